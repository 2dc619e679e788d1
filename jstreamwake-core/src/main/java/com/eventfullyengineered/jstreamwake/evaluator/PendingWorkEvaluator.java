package com.eventfullyengineered.jstreamwake.evaluator;

import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.lifecycle.WakeCycleCoordinator;
import com.eventfullyengineered.jstreamwake.streams.Offsets;
import com.eventfullyengineered.jstreamwake.streams.StreamEvent;
import com.eventfullyengineered.jstreamwake.streams.StreamStorage;
import com.eventfullyengineered.jstreamwake.subscriptions.GlobPattern;
import com.eventfullyengineered.jstreamwake.subscriptions.Subscription;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionListener;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns stream changes into wakes. Tails are read without holding any consumer lock; the lock of a single consumer
 * is only taken to apply a transition, and only when the unlocked snapshot suggests an IDLE consumer has work.
 * <p>
 * Stream deletion is left to the garbage collector.
 */
public class PendingWorkEvaluator implements SubscriptionListener {

    private static final Logger LOG = LoggerFactory.getLogger(PendingWorkEvaluator.class);

    private final SubscriptionRegistry subscriptions;
    private final ConsumerInstanceStore consumers;
    private final StreamStorage storage;
    private final WakeCycleCoordinator coordinator;

    public PendingWorkEvaluator(SubscriptionRegistry subscriptions,
                                ConsumerInstanceStore consumers,
                                StreamStorage storage,
                                WakeCycleCoordinator coordinator) {
        this.subscriptions = Ensure.notNull(subscriptions, "subscriptions");
        this.consumers = Ensure.notNull(consumers, "consumers");
        this.storage = Ensure.notNull(storage, "storage");
        this.coordinator = Ensure.notNull(coordinator, "coordinator");
    }

    public void onStreamEvent(StreamEvent event) {
        try {
            switch (event.getType()) {
                case CREATED:
                    streamCreated(event.getPath());
                    break;
                case APPENDED:
                    streamAppended(event.getPath());
                    break;
                case DELETED:
                    break;
                default:
                    throw new IllegalArgumentException("Unknown stream event type " + event.getType());
            }
        } catch (RuntimeException e) {
            LOG.error("Error evaluating {}.", event, e);
        }
    }

    /**
     * Seeds consumers for the streams that already exist when a subscription is created, at their current tail so
     * that only later appends wake them.
     */
    @Override
    public void onSubscriptionCreated(Subscription subscription) {
        GlobPattern pattern = GlobPattern.compile(subscription.getPattern());
        int seeded = 0;
        for (String path : storage.streamPaths()) {
            if (pattern.matches(path)
                && createConsumer(subscription.getSubscriptionId(), path, storage.currentTail(path))) {
                seeded++;
            }
        }
        if (seeded > 0) {
            LOG.debug("Seeded {} consumers for subscription {}.", seeded, subscription.getSubscriptionId());
        }
    }

    @Override
    public void onSubscriptionDeleted(Subscription subscription) {
        // removal is the garbage collector's job
    }

    /**
     * Evaluates every consumer subscribed to the path after its tail advanced.
     */
    public void streamAppended(String path) {
        for (String subscriptionId : subscriptions.affected(path)) {
            createConsumer(subscriptionId, path, Offsets.BEFORE_BEGINNING);
        }
        for (String consumerId : consumers.consumersForStream(path)) {
            coordinator.wakeIfPending(consumerId);
        }
    }

    private void streamCreated(String path) {
        for (String subscriptionId : subscriptions.affected(path)) {
            createConsumer(subscriptionId, path, Offsets.BEFORE_BEGINNING);
        }
    }

    /**
     * Creates the consumer unless its subscription was deleted in the meantime. Creation and subscription deletion
     * are serialized, so a consumer created here is always seen by the deletion cascade.
     */
    private boolean createConsumer(String subscriptionId, String path, String initialOffset) {
        boolean created = subscriptions.whileExists(subscriptionId,
            subscription -> consumers.getOrCreate(subscriptionId, path, initialOffset)).isPresent();
        if (!created) {
            LOG.debug("Subscription {} was deleted, no consumer created for {}.", subscriptionId, path);
        }
        return created;
    }
}
