package com.eventfullyengineered.jstreamwake.tokens;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The claims a callback token is bound to.
 */
public final class CallbackToken {

    private final String consumerId;
    private final long epoch;
    private final long expiresAt;

    public CallbackToken(String consumerId, long epoch, long expiresAt) {
        this.consumerId = Preconditions.checkNotNull(consumerId, "consumerId");
        this.epoch = epoch;
        this.expiresAt = expiresAt;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public long getEpoch() {
        return epoch;
    }

    /**
     * @return expiry in epoch millis
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("consumerId", consumerId)
            .add("epoch", epoch)
            .add("expiresAt", expiresAt)
            .toString();
    }
}
