package com.eventfullyengineered.jstreamwake.delivery;

import com.google.common.base.MoreObjects;

public final class WebhookResponse {

    private final int statusCode;
    private final String body;

    public WebhookResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("statusCode", statusCode)
            .add("body", body)
            .toString();
    }
}
