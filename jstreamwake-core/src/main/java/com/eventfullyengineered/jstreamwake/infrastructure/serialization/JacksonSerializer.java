package com.eventfullyengineered.jstreamwake.infrastructure.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.io.IOException;

/**
 * Jackson backed {@link JsonSerializerStrategy}.
 * The default instance omits null properties and ignores unknown ones.
 */
public class JacksonSerializer implements JsonSerializerStrategy {

    public static final JacksonSerializer DEFAULT = new JacksonSerializer(new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));

    private final ObjectMapper objectMapper;

    /**
     * @param objectMapper mapper used for wake payloads, callback bodies and webhook responses
     */
    public JacksonSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Preconditions.checkNotNull(objectMapper, "objectMapper");
    }

    @Override
    public String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new SerializationException(e);
        }
    }

    @Override
    public <T> T fromJson(String s, Class<T> type) {
        try {
            return Strings.isNullOrEmpty(s) ? null : objectMapper.readValue(s, type);
        } catch (IOException e) {
            throw new SerializationException(e);
        }
    }

    @Override
    public JsonNode readTree(String s) {
        try {
            return Strings.isNullOrEmpty(s) ? null : objectMapper.readTree(s);
        } catch (IOException e) {
            throw new SerializationException(e);
        }
    }

}
