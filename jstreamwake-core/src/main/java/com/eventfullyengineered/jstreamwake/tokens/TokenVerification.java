package com.eventfullyengineered.jstreamwake.tokens;

import com.google.common.base.Preconditions;

public final class TokenVerification {

    private static final TokenVerification INVALID = new TokenVerification(TokenStatus.INVALID, null);

    private final TokenStatus status;
    private final CallbackToken claims;

    private TokenVerification(TokenStatus status, CallbackToken claims) {
        this.status = status;
        this.claims = claims;
    }

    static TokenVerification valid(CallbackToken claims) {
        return new TokenVerification(TokenStatus.VALID, Preconditions.checkNotNull(claims));
    }

    static TokenVerification expired(CallbackToken claims) {
        return new TokenVerification(TokenStatus.EXPIRED, Preconditions.checkNotNull(claims));
    }

    static TokenVerification invalid() {
        return INVALID;
    }

    public TokenStatus getStatus() {
        return status;
    }

    public boolean isValid() {
        return status == TokenStatus.VALID;
    }

    /**
     * @return the claims, null when {@link TokenStatus#INVALID}
     */
    public CallbackToken getClaims() {
        return claims;
    }
}
