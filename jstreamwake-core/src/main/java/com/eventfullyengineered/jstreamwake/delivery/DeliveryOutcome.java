package com.eventfullyengineered.jstreamwake.delivery;

public enum DeliveryOutcome {

    /**
     * 2xx response.
     */
    ACCEPTED,

    /**
     * 2xx response with a {@code {"done": true}} body.
     */
    DONE,

    /**
     * Non-2xx response, timeout or network error.
     */
    FAILED
}
