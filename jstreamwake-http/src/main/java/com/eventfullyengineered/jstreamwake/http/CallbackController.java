package com.eventfullyengineered.jstreamwake.http;

import com.eventfullyengineered.jstreamwake.StreamWake;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackErrorCode;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackException;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackRequest;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackResponse;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.JsonSerializerStrategy;
import com.google.common.base.Preconditions;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code POST /callback/{consumer_id}} with a bearer token. Rejections are rendered by
 * {@link StreamWakeExceptionHandler}.
 */
@RestController
public class CallbackController {

    static final String PREFIX = "/callback/";
    private static final String BEARER = "Bearer ";

    private final StreamWake streamWake;
    private final JsonSerializerStrategy serializer;

    public CallbackController(StreamWake streamWake) {
        this.streamWake = Preconditions.checkNotNull(streamWake, "streamWake");
        this.serializer = streamWake.getSettings().getJsonSerializerStrategy();
    }

    @PostMapping(value = PREFIX + "{consumerId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public CallbackResponse callback(HttpServletRequest httpRequest,
                                     @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false)
                                     String authorization,
                                     @RequestBody(required = false) String body) {
        // the consumer id stays percent-encoded, decoding it would break the delimiter
        String consumerId = StringUtils.substringAfter(rawPathOf(httpRequest), PREFIX);
        String token = bearerToken(authorization);
        if (token == null) {
            throw new CallbackException(CallbackErrorCode.TOKEN_INVALID, "Missing bearer token");
        }
        CallbackRequest request = CallbackRequest.parse(serializer, body);
        return streamWake.handleCallback(consumerId, token, request);
    }

    private static String rawPathOf(HttpServletRequest request) {
        return request.getRequestURI().substring(request.getContextPath().length());
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !StringUtils.startsWithIgnoreCase(authorization, BEARER)) {
            return null;
        }
        return StringUtils.trimToNull(authorization.substring(BEARER.length()));
    }
}
