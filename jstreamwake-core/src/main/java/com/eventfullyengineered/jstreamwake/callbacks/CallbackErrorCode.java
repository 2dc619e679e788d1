package com.eventfullyengineered.jstreamwake.callbacks;

public enum CallbackErrorCode {

    /**
     * Malformed body, missing epoch, or an epoch ahead of the consumer.
     */
    INVALID_REQUEST(400),

    TOKEN_INVALID(401),

    /**
     * The error carries a fresh token to retry with.
     */
    TOKEN_EXPIRED(401),

    /**
     * The callback belongs to a superseded wake cycle. Stop processing.
     */
    STALE_EPOCH(409),

    /**
     * The wake id is not the outstanding one. Stop processing.
     */
    ALREADY_CLAIMED(409),

    /**
     * An ack moved backwards, past the tail, or named a stream the consumer is not subscribed to.
     */
    INVALID_OFFSET(409),

    CONSUMER_GONE(410);

    private final int httpStatus;

    CallbackErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
