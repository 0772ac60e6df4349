package com.descant.jackson;

import com.descant.ErrorEntry;
import com.descant.FrontendResult;
import com.descant.json.TreeJsonDeserializer;
import com.descant.json.TreeJsonException;
import com.descant.json.TreeJsonProvider;
import com.descant.json.TreeJsonSerializer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Jackson-based implementation of TreeJsonProvider.
 */
public class JacksonTreeJsonProvider implements TreeJsonProvider {

    private final ObjectMapper mapper;
    private final TreeJsonSerializer serializer;
    private final TreeJsonDeserializer deserializer;

    public JacksonTreeJsonProvider() {
        this.mapper = DescantJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public TreeJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public TreeJsonDeserializer getDeserializer() {
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

    private static class JacksonSerializer implements TreeJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Object value) throws TreeJsonException {
            try {
                return mapper.writeValueAsString(value);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + describe(value), e);
            }
        }

        @Override
        public String serializePretty(Object value) throws TreeJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + describe(value), e);
            }
        }

        @Override
        public String serializeResult(FrontendResult result) throws TreeJsonException {
            try {
                ObjectNode root = mapper.createObjectNode();
                root.set("unit", mapper.valueToTree(result.unit()));
                root.set("errors", mapper.valueToTree(result.errors()));
                root.set("comments", mapper.valueToTree(result.tokens().getComments()));
                return mapper.writeValueAsString(root);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize front-end result", e);
            }
        }

        private static String describe(Object value) {
            return value == null ? "null" : value.getClass().getSimpleName();
        }
    }

    private static class JacksonDeserializer implements TreeJsonDeserializer {
        private static final TypeReference<List<ErrorEntry>> ERROR_LIST = new TypeReference<>() { };

        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<ErrorEntry> deserializeErrors(String json) throws TreeJsonException {
            try {
                return mapper.readValue(json, ERROR_LIST);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to deserialize diagnostics", e);
            }
        }

        @Override
        public <T> T deserialize(String json, Class<T> type) throws TreeJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
