package com.jsemit.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsemit.ast.Node;
import com.jsemit.json.IrJsonDeserializer;
import com.jsemit.json.IrJsonException;
import com.jsemit.json.IrJsonProvider;
import com.jsemit.json.IrJsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson-based implementation of IrJsonProvider.
 */
public class JacksonIrJsonProvider implements IrJsonProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(JacksonIrJsonProvider.class);

    private final ObjectMapper mapper;
    private final IrJsonSerializer serializer;
    private final IrJsonDeserializer deserializer;

    public JacksonIrJsonProvider() {
        this(IrJackson.createObjectMapper());
    }

    public JacksonIrJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
        LOGGER.debug("Created Jackson IR JSON provider with modules {}", mapper.getRegisteredModuleIds());
    }

    @Override
    public IrJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public IrJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements IrJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws IrJsonException {
            try {
                // Write through Node so the root carries its "type" tag too
                return mapper.writerFor(Node.class).writeValueAsString(node);
            } catch (Exception e) {
                throw new IrJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws IrJsonException {
            try {
                return mapper.writerFor(Node.class).withDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new IrJsonException("Failed to serialize " + node.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements IrJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Node deserialize(String json) throws IrJsonException {
            return deserialize(json, Node.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws IrJsonException {
            Node node;
            try {
                node = mapper.readValue(json, Node.class);
            } catch (Exception e) {
                throw new IrJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
            if (!type.isInstance(node)) {
                throw new IrJsonException("Expected " + type.getSimpleName() + " but found " + node.type());
            }
            return type.cast(node);
        }
    }
}
