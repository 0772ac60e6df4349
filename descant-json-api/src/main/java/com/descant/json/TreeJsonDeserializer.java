package com.descant.json;

import com.descant.ErrorEntry;

import java.util.List;

/**
 * Reads back the value records written by a {@link TreeJsonSerializer}:
 * diagnostics, tokens and source positions.
 */
public interface TreeJsonDeserializer {

    /**
     * Reads a JSON array of diagnostics.
     *
     * @throws TreeJsonException if the JSON is not a list of diagnostics
     */
    List<ErrorEntry> deserializeErrors(String json) throws TreeJsonException;

    /**
     * Reads a single value of the given type.
     *
     * @throws TreeJsonException if deserialization fails
     */
    <T> T deserialize(String json, Class<T> type) throws TreeJsonException;
}
