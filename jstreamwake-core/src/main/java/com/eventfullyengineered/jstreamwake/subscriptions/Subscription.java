package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A registered interest in streams matching a glob pattern. Immutable; changed only by delete and recreate.
 */
public final class Subscription {

    private final String subscriptionId;
    private final String pattern;
    private final String webhook;
    /**
     * Signs wake payloads. Only exposed to the owner when the subscription is first created.
     */
    private final String webhookSecret;
    private final String description;

    public Subscription(String subscriptionId, String pattern, String webhook, String webhookSecret, String description) {
        this.subscriptionId = Preconditions.checkNotNull(subscriptionId, "subscriptionId");
        this.pattern = Preconditions.checkNotNull(pattern, "pattern");
        this.webhook = Preconditions.checkNotNull(webhook, "webhook");
        this.webhookSecret = Preconditions.checkNotNull(webhookSecret, "webhookSecret");
        this.description = description;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getPattern() {
        return pattern;
    }

    public String getWebhook() {
        return webhook;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true if a repeated create with these values is the same request
     */
    public boolean hasConfiguration(String pattern, String webhook, String description) {
        return this.pattern.equals(pattern)
            && this.webhook.equals(webhook)
            && Objects.equals(this.description, description);
    }

    @Override
    public String toString() {
        // never the secret
        return MoreObjects.toStringHelper(this)
            .add("subscriptionId", subscriptionId)
            .add("pattern", pattern)
            .add("webhook", webhook)
            .add("description", description)
            .toString();
    }
}
