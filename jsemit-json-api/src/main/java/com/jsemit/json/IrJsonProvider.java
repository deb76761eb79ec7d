package com.jsemit.json;

/**
 * Provider interface for IR JSON serialization/deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., jsemit-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * IrJsonProvider provider = IrJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(tree);
 * Node copy = provider.getDeserializer().deserialize(json);
 * }</pre>
 */
public interface IrJsonProvider {

    IrJsonSerializer getSerializer();

    IrJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available IrJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static IrJsonProvider getProvider() {
        return ProviderLoader.first();
    }

    /**
     * Gets an IrJsonProvider by name via ServiceLoader. Names match case-insensitively.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static IrJsonProvider getProvider(String name) {
        return ProviderLoader.named(name);
    }

    /**
     * Checks if any provider is available on the classpath.
     */
    static boolean isProviderAvailable() {
        return ProviderLoader.available();
    }
}
