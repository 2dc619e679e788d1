package com.eventfullyengineered.jstreamwake.delivery;

/**
 * Receives the outcome of every webhook delivery attempt.
 */
public interface DeliveryListener {

    void onDeliveryOutcome(String consumerId, String wakeId, DeliveryOutcome outcome);
}
