package com.eventfullyengineered.jstreamwake;

import com.eventfullyengineered.jstreamwake.callbacks.CallbackHandler;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackRequest;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackResponse;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.consumers.InMemoryConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.delivery.HttpClientWebhookTransport;
import com.eventfullyengineered.jstreamwake.delivery.RetryPolicy;
import com.eventfullyengineered.jstreamwake.delivery.WebhookDeliveryService;
import com.eventfullyengineered.jstreamwake.delivery.WebhookTransport;
import com.eventfullyengineered.jstreamwake.evaluator.PendingWorkEvaluator;
import com.eventfullyengineered.jstreamwake.gc.ConsumerGarbageCollector;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.lifecycle.ConsumerStateMachine;
import com.eventfullyengineered.jstreamwake.lifecycle.WakeCycleCoordinator;
import com.eventfullyengineered.jstreamwake.streams.StreamEvent;
import com.eventfullyengineered.jstreamwake.streams.StreamStorage;
import com.eventfullyengineered.jstreamwake.subscriptions.CreateSubscriptionResult;
import com.eventfullyengineered.jstreamwake.subscriptions.Subscription;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionRegistry;
import com.eventfullyengineered.jstreamwake.tokens.CallbackTokenManager;
import com.google.common.base.Ticker;
import io.reactivex.Observable;
import io.reactivex.Scheduler;
import io.reactivex.disposables.Disposable;
import io.reactivex.schedulers.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Push notifications for a {@link StreamStorage}: webhooks registered for stream path patterns are woken when data
 * lands on a matching stream, and drive their consumers through callbacks.
 */
public class StreamWake implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamWake.class);

    private static final int LOCK_STRIPES = 64;

    private final StreamWakeSettings settings;
    private final SubscriptionRegistry subscriptions;
    private final ConsumerInstanceStore consumers;
    private final WebhookDeliveryService delivery;
    private final WakeCycleCoordinator coordinator;
    private final PendingWorkEvaluator evaluator;
    private final ConsumerGarbageCollector garbageCollector;
    private final CallbackHandler callbacks;
    private final Disposable streamEvents;

    public StreamWake(StreamStorage storage, StreamWakeSettings settings) {
        this(storage, settings, new HttpClientWebhookTransport(), Schedulers.computation());
    }

    public StreamWake(StreamStorage storage,
                      StreamWakeSettings settings,
                      WebhookTransport transport,
                      Scheduler scheduler) {
        this(storage, settings, transport, scheduler, ConsumerStateMachine.RANDOM_WAKE_IDS);
    }

    StreamWake(StreamStorage storage,
               StreamWakeSettings settings,
               WebhookTransport transport,
               Scheduler scheduler,
               Supplier<String> wakeIds) {
        Ensure.notNull(storage, "storage");
        this.settings = Ensure.notNull(settings, "settings");
        Ensure.notNull(transport, "transport");
        Ensure.notNull(scheduler, "scheduler");

        this.subscriptions = new SubscriptionRegistry();
        this.consumers = new InMemoryConsumerInstanceStore(settings.getTokenTtl(), tickerOf(scheduler), LOCK_STRIPES);
        CallbackTokenManager tokens = new CallbackTokenManager(
            settings.getTokenSecret(), settings.getTokenTtl(), settings.getTokenRefreshThreshold(), scheduler);
        ConsumerStateMachine stateMachine = new ConsumerStateMachine(
            settings.getLivenessTimeout(), settings.getDeliveryFailureThreshold(), storage::compareOffsets, wakeIds);
        this.delivery = new WebhookDeliveryService(
            consumers, subscriptions, storage, tokens, transport, new RetryPolicy(), settings, scheduler);
        this.coordinator = new WakeCycleCoordinator(consumers, storage, stateMachine, delivery, scheduler);
        this.evaluator = new PendingWorkEvaluator(subscriptions, consumers, storage, coordinator);
        this.garbageCollector = new ConsumerGarbageCollector(subscriptions, consumers, coordinator, scheduler,
            settings.getDeliveryFailureThreshold(), settings.getGcSweepInterval());
        this.callbacks = new CallbackHandler(consumers, storage, tokens, coordinator, scheduler);

        subscriptions.addListener(evaluator);
        subscriptions.addListener(garbageCollector);
        this.streamEvents = Observable.wrap(storage.notifier())
            .subscribe(this::onStreamEvent, e -> LOG.error("Stream notifications failed.", e));
        garbageCollector.start();
        LOG.info("Stream wake started. {}", settings);
    }

    public CreateSubscriptionResult createSubscription(String subscriptionId,
                                                       String pattern,
                                                       String webhook,
                                                       String description) {
        return subscriptions.create(subscriptionId, pattern, webhook, description);
    }

    public Optional<Subscription> getSubscription(String subscriptionId) {
        return subscriptions.get(subscriptionId);
    }

    public List<Subscription> listSubscriptions(String pattern) {
        return subscriptions.listByPattern(pattern);
    }

    /**
     * Deletes a subscription together with all of its consumers.
     * @return true if it existed
     */
    public boolean deleteSubscription(String subscriptionId) {
        return subscriptions.delete(subscriptionId);
    }

    /**
     * @see CallbackHandler#handle(String, String, CallbackRequest)
     */
    public CallbackResponse handleCallback(String consumerId, String token, CallbackRequest request) {
        return callbacks.handle(consumerId, token, request);
    }

    public Optional<ConsumerInstance> getConsumer(String consumerId) {
        return consumers.get(consumerId);
    }

    public StreamWakeSettings getSettings() {
        return settings;
    }

    /**
     * Runs a garbage collection sweep now.
     * @return the number of consumers removed
     */
    public int collectGarbage() {
        return garbageCollector.sweep();
    }

    @Override
    public void close() {
        streamEvents.dispose();
        garbageCollector.close();
        delivery.close();
        coordinator.close();
        LOG.info("Stream wake stopped.");
    }

    private void onStreamEvent(StreamEvent event) {
        try {
            garbageCollector.onStreamEvent(event);
        } catch (RuntimeException e) {
            LOG.error("Error collecting consumers for {}.", event, e);
        }
        evaluator.onStreamEvent(event);
    }

    private static Ticker tickerOf(Scheduler scheduler) {
        return new Ticker() {
            @Override
            public long read() {
                return TimeUnit.MILLISECONDS.toNanos(scheduler.now(TimeUnit.MILLISECONDS));
            }
        };
    }
}
