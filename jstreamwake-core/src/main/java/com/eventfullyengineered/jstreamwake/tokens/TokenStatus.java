package com.eventfullyengineered.jstreamwake.tokens;

public enum TokenStatus {

    VALID,

    /**
     * Signature checks out but the token is past its expiry. The claims are still readable.
     */
    EXPIRED,

    /**
     * Malformed or not signed by this server.
     */
    INVALID
}
