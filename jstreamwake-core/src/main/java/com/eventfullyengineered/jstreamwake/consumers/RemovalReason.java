package com.eventfullyengineered.jstreamwake.consumers;

public enum RemovalReason {

    /**
     * The owning subscription was deleted.
     */
    SUBSCRIPTION_DELETED,

    /**
     * The primary stream was deleted, or the last subscribed stream was.
     */
    STREAM_DELETED,

    /**
     * The consumer unsubscribed from all of its streams.
     */
    UNSUBSCRIBED,

    /**
     * Webhook delivery kept failing past the garbage collection threshold.
     */
    DELIVERY_FAILING,

    /**
     * The owning subscription no longer exists although the consumer survived its deletion.
     */
    ORPHANED;

    /**
     * @return true if the stream offsets are still meaningful for a consumer re-created under the same id
     */
    public boolean keepsOffsets() {
        return this == UNSUBSCRIBED || this == DELIVERY_FAILING;
    }
}
