package com.eventfullyengineered.jstreamwake.gc;

import com.eventfullyengineered.jstreamwake.consumers.ConsumerGoneException;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.consumers.Mutation;
import com.eventfullyengineered.jstreamwake.consumers.RemovalReason;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.lifecycle.WakeCycleCoordinator;
import com.eventfullyengineered.jstreamwake.streams.StreamEvent;
import com.eventfullyengineered.jstreamwake.streams.StreamEventType;
import com.eventfullyengineered.jstreamwake.subscriptions.Subscription;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionListener;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionRegistry;
import io.reactivex.Observable;
import io.reactivex.Scheduler;
import io.reactivex.disposables.Disposable;
import io.reactivex.observers.DisposableObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Removes consumers that can no longer do useful work. Removals caused by deleting a subscription or a stream happen
 * synchronously, before the delete returns. Consumers whose webhook kept failing, whose subscription vanished or that
 * have no stream left are removed by a periodic sweep.
 */
public class ConsumerGarbageCollector implements SubscriptionListener, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ConsumerGarbageCollector.class);

    private final SubscriptionRegistry subscriptions;
    private final ConsumerInstanceStore consumers;
    private final WakeCycleCoordinator coordinator;
    private final Scheduler scheduler;
    private final long deliveryFailureThresholdMillis;
    private final Duration sweepInterval;
    private Disposable sweeps;

    public ConsumerGarbageCollector(SubscriptionRegistry subscriptions,
                                    ConsumerInstanceStore consumers,
                                    WakeCycleCoordinator coordinator,
                                    Scheduler scheduler,
                                    Duration deliveryFailureThreshold,
                                    Duration sweepInterval) {
        this.subscriptions = Ensure.notNull(subscriptions, "subscriptions");
        this.consumers = Ensure.notNull(consumers, "consumers");
        this.coordinator = Ensure.notNull(coordinator, "coordinator");
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
        this.deliveryFailureThresholdMillis =
            Ensure.positive(deliveryFailureThreshold, "deliveryFailureThreshold").toMillis();
        this.sweepInterval = Ensure.positive(sweepInterval, "sweepInterval");
    }

    public synchronized void start() {
        if (sweeps != null) {
            return;
        }
        long intervalMillis = sweepInterval.toMillis();
        sweeps = Observable.interval(intervalMillis, intervalMillis, TimeUnit.MILLISECONDS, scheduler)
            .subscribeWith(new DisposableObserver<Long>() {
                @Override
                public void onNext(Long tick) {
                    sweep();
                }

                @Override
                public void onError(Throwable e) {
                    LOG.error("Garbage collection sweeps stopped.", e);
                }

                @Override
                public void onComplete() {
                }
            });
    }

    @Override
    public synchronized void close() {
        if (sweeps != null) {
            sweeps.dispose();
            sweeps = null;
        }
    }

    /**
     * Handles stream deletions, other stream events are ignored.
     */
    public void onStreamEvent(StreamEvent event) {
        if (event.getType() == StreamEventType.DELETED) {
            onStreamDeleted(event.getPath());
        }
    }

    @Override
    public void onSubscriptionCreated(Subscription subscription) {
    }

    @Override
    public void onSubscriptionDeleted(Subscription subscription) {
        int removed = 0;
        for (String consumerId : consumers.consumersForSubscription(subscription.getSubscriptionId())) {
            if (coordinator.removeConsumer(consumerId, RemovalReason.SUBSCRIPTION_DELETED)) {
                removed++;
            }
        }
        LOG.debug("Removed {} consumers of deleted subscription {}.", removed, subscription.getSubscriptionId());
    }

    /**
     * Removes consumers whose primary stream was deleted and drops the path from every other consumer.
     */
    public void onStreamDeleted(String path) {
        for (String consumerId : consumers.consumersForStream(path)) {
            try {
                boolean removed = consumers.mutate(consumerId, consumer -> dropStream(consumer, path));
                if (removed) {
                    coordinator.consumerRemoved(consumerId);
                }
            } catch (ConsumerGoneException e) {
                LOG.debug("Consumer {} already gone while deleting stream {}.", consumerId, path);
            }
        }
    }

    /**
     * Runs one sweep.
     * @return the number of consumers removed
     */
    public int sweep() {
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        int removed = 0;
        for (ConsumerInstance consumer : consumers.all()) {
            try {
                RemovalReason reason = removalReasonOf(consumer, now);
                if (reason != null && coordinator.removeConsumer(consumer.getConsumerId(), reason)) {
                    removed++;
                }
            } catch (RuntimeException e) {
                LOG.error("Error sweeping consumer {}.", consumer.getConsumerId(), e);
            }
        }
        if (removed > 0) {
            LOG.info("Garbage collection removed {} consumers.", removed);
        }
        return removed;
    }

    private RemovalReason removalReasonOf(ConsumerInstance consumer, long now) {
        if (!subscriptions.get(consumer.getSubscriptionId()).isPresent()) {
            return RemovalReason.ORPHANED;
        }
        if (consumer.getStreams().isEmpty()) {
            return RemovalReason.UNSUBSCRIBED;
        }
        Long failingSince = consumer.getDeliveryFailingSince();
        if (failingSince != null && now - failingSince >= deliveryFailureThresholdMillis) {
            return RemovalReason.DELIVERY_FAILING;
        }
        return null;
    }

    private static Mutation<Boolean> dropStream(ConsumerInstance consumer, String path) {
        if (consumer.getPrimaryStream().equals(path)) {
            return Mutation.remove(RemovalReason.STREAM_DELETED, true);
        }
        if (!consumer.isSubscribedTo(path)) {
            return Mutation.update(consumer, false);
        }
        ConsumerInstance next = consumer.toBuilder().removeStream(path).build();
        if (next.getStreams().isEmpty()) {
            return Mutation.remove(RemovalReason.STREAM_DELETED, true);
        }
        return Mutation.update(next, false);
    }
}
