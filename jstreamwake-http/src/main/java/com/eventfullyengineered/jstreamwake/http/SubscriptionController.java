package com.eventfullyengineered.jstreamwake.http;

import com.eventfullyengineered.jstreamwake.StreamWake;
import com.eventfullyengineered.jstreamwake.subscriptions.CreateSubscriptionResult;
import com.eventfullyengineered.jstreamwake.subscriptions.Subscription;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Subscription CRUD. The request path is the stream path pattern, the query names the subscription:
 * {@code PUT|GET|DELETE /{pattern}?subscription={id}} and {@code GET /{pattern}?subscriptions}.
 */
@RestController
public class SubscriptionController {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionController.class);

    static final String SUBSCRIPTION = "subscription";
    static final String SUBSCRIPTIONS = "subscriptions";

    private final StreamWake streamWake;

    public SubscriptionController(StreamWake streamWake) {
        this.streamWake = Preconditions.checkNotNull(streamWake, "streamWake");
    }

    @PutMapping(value = "/{*pattern}", params = SUBSCRIPTION, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@PathVariable("pattern") String pattern,
                                    @RequestParam(SUBSCRIPTION) String subscriptionId,
                                    @RequestBody SubscriptionRequest request) {
        LOG.debug("[REST] PUT {}?subscription={}", pattern, subscriptionId);
        if (StringUtils.isBlank(subscriptionId)) {
            return invalid("Missing subscription id");
        }
        String webhook = StringUtils.trimToNull(request.getWebhook());
        if (!isWebhookUrl(webhook)) {
            return invalid("A valid http(s) webhook URL is required");
        }

        CreateSubscriptionResult result =
            streamWake.createSubscription(subscriptionId, pattern, webhook, request.getDescription());
        if (result.isCreated()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                .body(SubscriptionView.withSecret(result.getSubscription()));
        }
        return ResponseEntity.ok(SubscriptionView.of(result.getSubscription()));
    }

    @GetMapping(value = "/{*pattern}", params = SUBSCRIPTION, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> get(@RequestParam(SUBSCRIPTION) String subscriptionId) {
        Optional<Subscription> subscription = streamWake.getSubscription(subscriptionId);
        if (!subscription.isPresent()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("NOT_FOUND", "Subscription " + subscriptionId + " not found"));
        }
        return ResponseEntity.ok(SubscriptionView.of(subscription.get()));
    }

    @GetMapping(value = "/{*pattern}", params = {SUBSCRIPTIONS, "!" + SUBSCRIPTION},
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, List<SubscriptionView>> list(@PathVariable("pattern") String pattern) {
        List<SubscriptionView> views = streamWake.listSubscriptions(pattern).stream()
            .map(SubscriptionView::of)
            .collect(Collectors.toList());
        return ImmutableMap.of(SUBSCRIPTIONS, views);
    }

    @DeleteMapping(value = "/{*pattern}", params = SUBSCRIPTION)
    public ResponseEntity<Void> delete(@RequestParam(SUBSCRIPTION) String subscriptionId) {
        LOG.debug("[REST] DELETE subscription={}", subscriptionId);
        streamWake.deleteSubscription(subscriptionId);
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<ErrorResponse> invalid(String message) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_REQUEST", message));
    }

    static boolean isWebhookUrl(String webhook) {
        if (webhook == null) {
            return false;
        }
        try {
            URI uri = new URI(webhook);
            return ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                && !StringUtils.isEmpty(uri.getHost());
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
