package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.base.MoreObjects;

/**
 * Represents the result of creating a subscription
 */
public class CreateSubscriptionResult {

    private final Subscription subscription;

    /**
     * False when an identical subscription already existed. The secret must not be shown again in that case.
     */
    private final boolean created;

    public CreateSubscriptionResult(Subscription subscription, boolean created) {
        this.subscription = subscription;
        this.created = created;
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public boolean isCreated() {
        return created;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("subscription", subscription)
            .add("created", created)
            .toString();
    }
}
