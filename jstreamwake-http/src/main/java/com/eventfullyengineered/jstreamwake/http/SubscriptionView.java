package com.eventfullyengineered.jstreamwake.http;

import com.eventfullyengineered.jstreamwake.subscriptions.Subscription;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON representation of a subscription. The webhook secret is only included right after creation.
 */
public final class SubscriptionView {

    private final String subscriptionId;
    private final String pattern;
    private final String webhook;
    private final String description;
    private final String webhookSecret;

    private SubscriptionView(Subscription subscription, boolean withSecret) {
        this.subscriptionId = subscription.getSubscriptionId();
        this.pattern = subscription.getPattern();
        this.webhook = subscription.getWebhook();
        this.description = subscription.getDescription();
        this.webhookSecret = withSecret ? subscription.getWebhookSecret() : null;
    }

    public static SubscriptionView of(Subscription subscription) {
        return new SubscriptionView(subscription, false);
    }

    public static SubscriptionView withSecret(Subscription subscription) {
        return new SubscriptionView(subscription, true);
    }

    @JsonProperty("subscription_id")
    public String getSubscriptionId() {
        return subscriptionId;
    }

    @JsonProperty("pattern")
    public String getPattern() {
        return pattern;
    }

    @JsonProperty("webhook")
    public String getWebhook() {
        return webhook;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("webhook_secret")
    public String getWebhookSecret() {
        return webhookSecret;
    }
}
