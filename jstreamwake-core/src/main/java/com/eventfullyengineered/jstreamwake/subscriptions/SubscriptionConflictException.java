package com.eventfullyengineered.jstreamwake.subscriptions;

/**
 * Thrown when a subscription is created with an id that already exists with a different configuration.
 */
public class SubscriptionConflictException extends RuntimeException {

    private static final long serialVersionUID = -6189251790153316205L;

    private final String subscriptionId;

    public SubscriptionConflictException(String subscriptionId) {
        super("Subscription " + subscriptionId + " already exists with different configuration");
        this.subscriptionId = subscriptionId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }
}
