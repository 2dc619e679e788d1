package com.eventfullyengineered.jstreamwake.subscriptions;

/**
 * Receives subscription lifecycle changes. Called synchronously by the registry, so a delete does not return before
 * every listener has finished.
 */
public interface SubscriptionListener {

    void onSubscriptionCreated(Subscription subscription);

    void onSubscriptionDeleted(Subscription subscription);
}
