package com.eventfullyengineered.jstreamwake.http;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PUT /{pattern}?subscription={id}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SubscriptionRequest {

    private final String webhook;
    private final String description;

    @JsonCreator
    public SubscriptionRequest(@JsonProperty("webhook") String webhook,
                               @JsonProperty("description") String description) {
        this.webhook = webhook;
        this.description = description;
    }

    @JsonProperty("webhook")
    public String getWebhook() {
        return webhook;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }
}
