package com.eventfullyengineered.jstreamwake.consumers;

public enum ConsumerState {

    /**
     * No outstanding wake. The epoch is the last one used and there is no wake id.
     */
    IDLE,

    /**
     * A wake was sent and is not yet confirmed.
     */
    WAKING,

    /**
     * The wake was confirmed and the consumer is working. Kept alive by callbacks.
     */
    LIVE
}
