package com.eventfullyengineered.jstreamwake.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * {@code {"error":{"code":..,"message":..}}} body of rejected subscription requests.
 */
public final class ErrorResponse {

    private final String code;
    private final String message;

    private ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message);
    }

    @JsonProperty("error")
    public Map<String, String> getError() {
        return ImmutableMap.of("code", code, "message", message);
    }
}
