package com.descant.jackson;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for program trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DescantJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(result.unit());
 * </pre>
 */
public final class DescantJackson {

    private DescantJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for tree serialization.
     *
     * The returned mapper:
     * - Reads node state from fields, so query methods such as isFunction() never become properties
     * - Tags every node with its class name in a "node" property
     * - Skips parent and owning-statement links, which would otherwise cycle
     * - Leaves out null values
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY);

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new TreeModule());

        return mapper;
    }
}
