package com.jsemit.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

final class ProviderLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderLoader.class);

    private ProviderLoader() {
    }

    static IrJsonProvider first() {
        Iterator<IrJsonProvider> iterator = ServiceLoader.load(IrJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            IrJsonProvider provider = iterator.next();
            LOGGER.debug("Using IR JSON provider {} ({})", provider.getName(), provider.getClass().getName());
            return provider;
        }
        throw new IllegalStateException(
            "No IrJsonProvider found on the classpath. " +
            "Add jsemit-jackson (or another provider) to your dependencies."
        );
    }

    static IrJsonProvider named(String name) {
        for (IrJsonProvider provider : ServiceLoader.load(IrJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                LOGGER.debug("Using IR JSON provider {} ({})", provider.getName(), provider.getClass().getName());
                return provider;
            }
            LOGGER.trace("Skipping IR JSON provider {}", provider.getName());
        }
        throw new IllegalStateException(
            "No IrJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean available() {
        return ServiceLoader.load(IrJsonProvider.class).iterator().hasNext();
    }
}
