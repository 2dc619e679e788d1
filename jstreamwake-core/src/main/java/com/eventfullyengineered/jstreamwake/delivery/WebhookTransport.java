package com.eventfullyengineered.jstreamwake.delivery;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Sends a webhook request. Implementations complete exceptionally on timeout or network errors and never throw
 * from {@link #post} itself.
 */
public interface WebhookTransport {

    CompletionStage<WebhookResponse> post(String url, Map<String, String> headers, String body, Duration timeout);
}
