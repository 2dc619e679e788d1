package com.eventfullyengineered.jstreamwake.callbacks;

import com.eventfullyengineered.jstreamwake.consumers.StreamOffset;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Callback response body. Success is {@code {ok: true, token, streams}}, failure is
 * {@code {ok: false, error: {code, message}, token?}}.
 */
public final class CallbackResponse {

    private final boolean ok;
    private final String token;
    private final List<StreamOffset> streams;
    private final Error error;

    @JsonCreator
    public CallbackResponse(@JsonProperty("ok") boolean ok,
                            @JsonProperty("token") String token,
                            @JsonProperty("streams") List<StreamOffset> streams,
                            @JsonProperty("error") Error error) {
        this.ok = ok;
        this.token = token;
        this.streams = streams == null ? null : ImmutableList.copyOf(streams);
        this.error = error;
    }

    public static CallbackResponse success(String token, List<StreamOffset> streams) {
        return new CallbackResponse(true, token, streams, null);
    }

    public static CallbackResponse failure(CallbackException e) {
        return new CallbackResponse(false, e.getToken(), null, new Error(e.getCode().name(), e.getMessage()));
    }

    @JsonProperty("ok")
    public boolean isOk() {
        return ok;
    }

    @JsonProperty("token")
    public String getToken() {
        return token;
    }

    @JsonProperty("streams")
    public List<StreamOffset> getStreams() {
        return streams;
    }

    @JsonProperty("error")
    public Error getError() {
        return error;
    }

    public static final class Error {
        private final String code;
        private final String message;

        @JsonCreator
        public Error(@JsonProperty("code") String code, @JsonProperty("message") String message) {
            this.code = code;
            this.message = message;
        }

        @JsonProperty("code")
        public String getCode() {
            return code;
        }

        @JsonProperty("message")
        public String getMessage() {
            return message;
        }
    }
}
