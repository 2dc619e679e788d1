package com.eventfullyengineered.jstreamwake.callbacks;

import com.google.common.base.Preconditions;

/**
 * A rejected callback. Nothing was changed on the consumer.
 */
public class CallbackException extends RuntimeException {

    private static final long serialVersionUID = -2379404416312245151L;

    private final CallbackErrorCode code;
    private final String token;

    public CallbackException(CallbackErrorCode code, String message) {
        this(code, message, null);
    }

    public CallbackException(CallbackErrorCode code, String message, String token) {
        super(message);
        this.code = Preconditions.checkNotNull(code, "code");
        this.token = token;
    }

    public CallbackErrorCode getCode() {
        return code;
    }

    /**
     * @return a fresh token, only set for {@link CallbackErrorCode#TOKEN_EXPIRED}
     */
    public String getToken() {
        return token;
    }

    public int getHttpStatus() {
        return code.getHttpStatus();
    }
}
