package com.eventfullyengineered.jstreamwake.delivery;

import com.eventfullyengineered.jstreamwake.StreamWakeSettings;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.consumers.StreamOffset;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.JsonSerializerStrategy;
import com.eventfullyengineered.jstreamwake.streams.StreamStorage;
import com.eventfullyengineered.jstreamwake.subscriptions.Subscription;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionRegistry;
import com.eventfullyengineered.jstreamwake.tokens.CallbackTokenManager;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.reactivex.Scheduler;
import io.reactivex.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Delivers wakes to subscription webhooks. There is at most one delivery task per consumer, identified by the wake id
 * it delivers; a new wake replaces the task of the previous one. Every attempt re-reads the consumer and gives up as
 * soon as the wake it delivers is no longer outstanding.
 */
public class WebhookDeliveryService implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookDeliveryService.class);

    public static final String CALLBACK_PATH = "/callback/";

    private final ConsumerInstanceStore consumers;
    private final SubscriptionRegistry subscriptions;
    private final StreamStorage storage;
    private final CallbackTokenManager tokens;
    private final WebhookTransport transport;
    private final RetryPolicy retryPolicy;
    private final Scheduler scheduler;
    private final JsonSerializerStrategy serializer;
    private final String callbackBaseUrl;
    private final Duration requestTimeout;
    private final long confirmationTimeoutMillis;
    private final ConcurrentMap<String, DeliveryTask> tasks = new ConcurrentHashMap<>();
    private volatile DeliveryListener listener;
    private volatile boolean closed;

    public WebhookDeliveryService(ConsumerInstanceStore consumers,
                                  SubscriptionRegistry subscriptions,
                                  StreamStorage storage,
                                  CallbackTokenManager tokens,
                                  WebhookTransport transport,
                                  RetryPolicy retryPolicy,
                                  StreamWakeSettings settings,
                                  Scheduler scheduler) {
        this.consumers = Ensure.notNull(consumers, "consumers");
        this.subscriptions = Ensure.notNull(subscriptions, "subscriptions");
        this.storage = Ensure.notNull(storage, "storage");
        this.tokens = Ensure.notNull(tokens, "tokens");
        this.transport = Ensure.notNull(transport, "transport");
        this.retryPolicy = Ensure.notNull(retryPolicy, "retryPolicy");
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
        this.serializer = settings.getJsonSerializerStrategy();
        this.callbackBaseUrl = settings.getCallbackBaseUrl();
        this.requestTimeout = settings.getWebhookRequestTimeout();
        this.confirmationTimeoutMillis = settings.getWakeConfirmationTimeout().toMillis();
    }

    public void setListener(DeliveryListener listener) {
        this.listener = Ensure.notNull(listener, "listener");
    }

    /**
     * Starts delivering a new wake. The first attempt is dispatched on the scheduler.
     */
    public void deliver(String consumerId, String wakeId) {
        if (closed) {
            return;
        }
        DeliveryTask task = new DeliveryTask(consumerId, wakeId);
        DeliveryTask previous = tasks.put(consumerId, task);
        if (previous != null) {
            previous.dispose();
        }
        task.setConfirmationTimer(scheduler.scheduleDirect(
            () -> onConfirmationTimeout(task), confirmationTimeoutMillis, TimeUnit.MILLISECONDS));
        scheduler.scheduleDirect(() -> attempt(task));
    }

    /**
     * Schedules the next attempt with backoff, unless the wake was cancelled or another attempt is in flight.
     */
    public void retry(String consumerId, String wakeId) {
        DeliveryTask task = currentTask(consumerId, wakeId);
        if (task == null || closed) {
            return;
        }
        if (task.isInFlight()) {
            LOG.debug("Retry of wake {} for {} skipped, an attempt is in flight.", wakeId, consumerId);
            return;
        }
        int retry = task.nextRetry();
        long delay = retryPolicy.delayMillis(retry);
        LOG.debug("Retry {} of wake {} for {} in {} ms.", retry, wakeId, consumerId, delay);
        task.setRetryTimer(scheduler.scheduleDirect(() -> attempt(task), delay, TimeUnit.MILLISECONDS));
    }

    public void cancel(String consumerId, String wakeId) {
        DeliveryTask task = currentTask(consumerId, wakeId);
        if (task != null && tasks.remove(consumerId, task)) {
            task.dispose();
            LOG.debug("Delivery of wake {} for {} cancelled.", wakeId, consumerId);
        }
    }

    public void cancelAll(String consumerId) {
        DeliveryTask task = tasks.remove(consumerId);
        if (task != null) {
            task.dispose();
        }
    }

    /**
     * @return true if the wake still has a delivery task
     */
    public boolean isDelivering(String consumerId, String wakeId) {
        return currentTask(consumerId, wakeId) != null;
    }

    @Override
    public void close() {
        closed = true;
        for (String consumerId : tasks.keySet()) {
            cancelAll(consumerId);
        }
    }

    private DeliveryTask currentTask(String consumerId, String wakeId) {
        DeliveryTask task = tasks.get(consumerId);
        return task != null && task.wakeId.equals(wakeId) ? task : null;
    }

    private void onConfirmationTimeout(DeliveryTask task) {
        if (task.isDisposed() || closed) {
            return;
        }
        Optional<ConsumerInstance> consumer = consumers.get(task.consumerId);
        if (consumer.isPresent() && consumer.get().isWaking(task.wakeId)) {
            LOG.debug("Wake {} for {} unconfirmed after {} ms, sending a fresh attempt.",
                task.wakeId, task.consumerId, confirmationTimeoutMillis);
            attempt(task);
        }
    }

    private void attempt(DeliveryTask task) {
        if (task.isDisposed() || closed) {
            return;
        }
        try {
            send(task);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error delivering wake {} for {}.", task.wakeId, task.consumerId, e);
            notifyListener(task, DeliveryOutcome.FAILED);
        }
    }

    private void send(DeliveryTask task) {
        Optional<ConsumerInstance> found = consumers.get(task.consumerId);
        if (!found.isPresent() || !found.get().isWaking(task.wakeId)) {
            cancel(task.consumerId, task.wakeId);
            return;
        }
        ConsumerInstance consumer = found.get();
        Optional<Subscription> subscription = subscriptions.get(consumer.getSubscriptionId());
        if (!subscription.isPresent()) {
            LOG.debug("Subscription {} is gone, wake {} for {} dropped.",
                consumer.getSubscriptionId(), task.wakeId, task.consumerId);
            cancel(task.consumerId, task.wakeId);
            return;
        }

        String body = serializer.toJson(payloadFor(consumer));
        long timestamp = scheduler.now(TimeUnit.SECONDS);
        Map<String, String> headers = ImmutableMap.of(
            "Content-Type", "application/json",
            WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(subscription.get().getWebhookSecret(), body, timestamp));

        int attempt = task.attemptStarted();
        LOG.debug("Delivering wake {} for {} at epoch {}, attempt {}.",
            task.wakeId, task.consumerId, consumer.getEpoch(), attempt);
        CompletionStage<WebhookResponse> response;
        try {
            response = transport.post(subscription.get().getWebhook(), headers, body, requestTimeout);
        } catch (RuntimeException e) {
            CompletableFuture<WebhookResponse> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            response = failed;
        }
        response.whenComplete((result, error) -> {
            task.attemptFinished();
            notifyListener(task, outcomeOf(task, result, error));
        });
    }

    WakePayload payloadFor(ConsumerInstance consumer) {
        ImmutableList.Builder<StreamOffset> streams = ImmutableList.builder();
        ImmutableList.Builder<String> pending = ImmutableList.builder();
        for (Map.Entry<String, String> stream : consumer.getStreams().entrySet()) {
            streams.add(new StreamOffset(stream.getKey(), stream.getValue()));
            String tail = storage.currentTail(stream.getKey());
            if (storage.compareOffsets(tail, stream.getValue()) > 0) {
                pending.add(stream.getKey());
            }
        }
        return new WakePayload(
            consumer.getConsumerId(),
            consumer.getEpoch(),
            consumer.getWakeId(),
            consumer.getPrimaryStream(),
            streams.build(),
            pending.build(),
            callbackBaseUrl + CALLBACK_PATH + consumer.getConsumerId(),
            tokens.issue(consumer.getConsumerId(), consumer.getEpoch()));
    }

    private DeliveryOutcome outcomeOf(DeliveryTask task, WebhookResponse response, Throwable error) {
        if (error != null) {
            LOG.warn("Webhook delivery of wake {} for {} failed: {}", task.wakeId, task.consumerId, error.toString());
            return DeliveryOutcome.FAILED;
        }
        if (!response.isSuccessful()) {
            LOG.warn("Webhook delivery of wake {} for {} failed with status {}.",
                task.wakeId, task.consumerId, response.getStatusCode());
            return DeliveryOutcome.FAILED;
        }
        return isDone(response.getBody()) ? DeliveryOutcome.DONE : DeliveryOutcome.ACCEPTED;
    }

    private boolean isDone(String body) {
        if (Ensure.isNullOrEmpty(body.trim())) {
            return false;
        }
        try {
            JsonNode node = serializer.readTree(body);
            return node != null && node.path("done").asBoolean(false);
        } catch (RuntimeException e) {
            // a body that is not JSON is a plain acceptance
            return false;
        }
    }

    private void notifyListener(DeliveryTask task, DeliveryOutcome outcome) {
        DeliveryListener current = listener;
        if (current == null || closed) {
            return;
        }
        try {
            current.onDeliveryOutcome(task.consumerId, task.wakeId, outcome);
        } catch (RuntimeException e) {
            LOG.error("Error handling {} outcome of wake {} for {}.", outcome, task.wakeId, task.consumerId, e);
        }
    }

    private static final class DeliveryTask {
        private final String consumerId;
        private final String wakeId;
        private int attempts;
        private int retries;
        private int inFlight;
        private boolean disposed;
        private Disposable retryTimer;
        private Disposable confirmationTimer;

        DeliveryTask(String consumerId, String wakeId) {
            this.consumerId = consumerId;
            this.wakeId = wakeId;
        }

        synchronized int attemptStarted() {
            inFlight++;
            return ++attempts;
        }

        synchronized void attemptFinished() {
            if (inFlight > 0) {
                inFlight--;
            }
        }

        synchronized boolean isInFlight() {
            return inFlight > 0;
        }

        synchronized int nextRetry() {
            return ++retries;
        }

        synchronized boolean isDisposed() {
            return disposed;
        }

        synchronized void setRetryTimer(Disposable timer) {
            if (disposed) {
                timer.dispose();
                return;
            }
            if (retryTimer != null) {
                retryTimer.dispose();
            }
            retryTimer = timer;
        }

        synchronized void setConfirmationTimer(Disposable timer) {
            if (disposed) {
                timer.dispose();
                return;
            }
            confirmationTimer = timer;
        }

        synchronized void dispose() {
            disposed = true;
            if (retryTimer != null) {
                retryTimer.dispose();
            }
            if (confirmationTimer != null) {
                confirmationTimer.dispose();
            }
        }
    }
}
