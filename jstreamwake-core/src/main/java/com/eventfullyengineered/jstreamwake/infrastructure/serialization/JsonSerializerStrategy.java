package com.eventfullyengineered.jstreamwake.infrastructure.serialization;

import com.fasterxml.jackson.databind.JsonNode;

/**
 *
 *
 */
public interface JsonSerializerStrategy {

    /**
     *
     * @param o
     * @return
     */
    String toJson(Object o);

    /**
     *
     * @param s
     * @param type
     * @return
     */
    <T> T fromJson(String s, Class<T> type);

    /**
     * Parses a JSON document without binding it to a type.
     * @param s the raw document
     * @return the parsed tree or null when s is null or empty
     */
    JsonNode readTree(String s);

}
