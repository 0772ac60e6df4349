package com.descant.json;

import com.descant.FrontendResult;

/**
 * Writes program trees, tokens and diagnostics as JSON.
 */
public interface TreeJsonSerializer {

    /**
     * Serializes a tree node, token, diagnostic or list of them.
     *
     * @param value the value to serialize
     * @return compact JSON
     * @throws TreeJsonException if serialization fails
     */
    String serialize(Object value) throws TreeJsonException;

    /**
     * Same as {@link #serialize(Object)}, indented for reading.
     */
    String serializePretty(Object value) throws TreeJsonException;

    /**
     * Writes a whole front-end run as one object with {@code unit},
     * {@code errors} and {@code comments} properties.
     *
     * @throws TreeJsonException if serialization fails
     */
    String serializeResult(FrontendResult result) throws TreeJsonException;
}
