package com.eventfullyengineered.jstreamwake.delivery;

import com.google.common.base.Preconditions;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link WebhookTransport} on top of {@link HttpClient}.
 */
public class HttpClientWebhookTransport implements WebhookTransport {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;

    public HttpClientWebhookTransport() {
        this(HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
    }

    public HttpClientWebhookTransport(HttpClient httpClient) {
        this.httpClient = Preconditions.checkNotNull(httpClient, "httpClient");
    }

    @Override
    public CompletionStage<WebhookResponse> post(String url, Map<String, String> headers, String body, Duration timeout) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body));
            for (Map.Entry<String, String> header : headers.entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            CompletableFuture<WebhookResponse> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> new WebhookResponse(response.statusCode(), response.body()));
    }
}
