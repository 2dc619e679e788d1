package com.eventfullyengineered.jstreamwake.lifecycle;

import com.eventfullyengineered.jstreamwake.consumers.ConsumerGoneException;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerIds;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerState;
import com.eventfullyengineered.jstreamwake.consumers.Mutation;
import com.eventfullyengineered.jstreamwake.consumers.RemovalReason;
import com.eventfullyengineered.jstreamwake.delivery.DeliveryListener;
import com.eventfullyengineered.jstreamwake.delivery.DeliveryOutcome;
import com.eventfullyengineered.jstreamwake.delivery.WebhookDeliveryService;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.streams.StreamStorage;
import com.google.common.collect.ImmutableMap;
import io.reactivex.Scheduler;
import io.reactivex.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Applies lifecycle events to consumers and runs the resulting effects: wake delivery, retries and liveness timers.
 * Effects only run after the transition producing them was committed and never under a consumer lock; every handler
 * re-checks the committed state before acting on it.
 * <p>
 * An append racing a transition to IDLE finds the consumer busy and does not wake it, so every transition that
 * commits IDLE is followed by a fresh read of the tails.
 */
public class WakeCycleCoordinator implements DeliveryListener, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(WakeCycleCoordinator.class);

    private final ConsumerInstanceStore consumers;
    private final StreamStorage storage;
    private final ConsumerStateMachine stateMachine;
    private final WebhookDeliveryService delivery;
    private final Scheduler scheduler;
    private final ConcurrentMap<String, LivenessTimer> livenessTimers = new ConcurrentHashMap<>();

    public WakeCycleCoordinator(ConsumerInstanceStore consumers,
                                StreamStorage storage,
                                ConsumerStateMachine stateMachine,
                                WebhookDeliveryService delivery,
                                Scheduler scheduler) {
        this.consumers = Ensure.notNull(consumers, "consumers");
        this.storage = Ensure.notNull(storage, "storage");
        this.stateMachine = Ensure.notNull(stateMachine, "stateMachine");
        this.delivery = Ensure.notNull(delivery, "delivery");
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
        delivery.setListener(this);
    }

    public ConsumerStateMachine getStateMachine() {
        return stateMachine;
    }

    /**
     * Applies an event to a consumer, then wakes it if it ended up IDLE with work pending.
     * @return the latest committed snapshot, empty if the consumer does not exist or was removed by the event
     */
    public Optional<ConsumerInstance> apply(String consumerId, LifecycleEvent event) {
        Optional<ConsumerInstance> next = commit(consumerId, event);
        if (next.isPresent() && next.get().getState() == ConsumerState.IDLE) {
            return wakeIfPending(consumerId);
        }
        return next;
    }

    /**
     * Wakes an IDLE consumer if the current tail of one of its streams is beyond the acked offset. Tails are read
     * without holding the consumer lock; the state machine re-checks the state when the wake is committed.
     * @return the latest committed snapshot, empty if the consumer does not exist
     */
    public Optional<ConsumerInstance> wakeIfPending(String consumerId) {
        Optional<ConsumerInstance> snapshot = consumers.get(consumerId);
        if (!snapshot.isPresent() || snapshot.get().getState() != ConsumerState.IDLE) {
            return snapshot;
        }
        Map<String, String> tails = tailsOf(snapshot.get());
        if (!stateMachine.hasPendingWork(snapshot.get(), tails)) {
            return snapshot;
        }
        LOG.debug("Pending work for consumer {} of subscription {}.",
            consumerId, ConsumerIds.subscriptionIdOf(consumerId));
        return commit(consumerId, LifecycleEvent.pendingWorkObserved(tails));
    }

    private Optional<ConsumerInstance> commit(String consumerId, LifecycleEvent event) {
        long now = now();
        Transition transition;
        try {
            transition = consumers.mutate(consumerId, current -> toMutation(stateMachine.apply(current, event, now)));
        } catch (ConsumerGoneException e) {
            LOG.debug("{} ignored, consumer {} is gone.", event, consumerId);
            return Optional.empty();
        }
        if (transition.isRemoval()) {
            consumerRemoved(consumerId);
            return Optional.empty();
        }
        run(transition.getEffects());
        return Optional.of(transition.getNext());
    }

    /**
     * Wraps a transition for {@link ConsumerInstanceStore#mutate}.
     */
    public static Mutation<Transition> toMutation(Transition transition) {
        return transition.isRemoval()
            ? Mutation.remove(transition.getRemoval(), transition)
            : Mutation.update(transition.getNext(), transition);
    }

    /**
     * Reads the current tail of every stream the consumer is subscribed to.
     */
    public Map<String, String> tailsOf(ConsumerInstance consumer) {
        ImmutableMap.Builder<String, String> tails = ImmutableMap.builder();
        for (String path : consumer.getStreams().keySet()) {
            tails.put(path, storage.currentTail(path));
        }
        return tails.build();
    }

    public void run(List<Effect> effects) {
        for (Effect effect : effects) {
            try {
                run(effect);
            } catch (RuntimeException e) {
                LOG.error("Error running {}.", effect, e);
            }
        }
    }

    /**
     * Removes a consumer and stops its deliveries and timers.
     * @return true if the consumer existed
     */
    public boolean removeConsumer(String consumerId, RemovalReason reason) {
        boolean removed = consumers.remove(consumerId, reason).isPresent();
        consumerRemoved(consumerId);
        return removed;
    }

    /**
     * Stops deliveries and timers of a consumer that was removed from the store.
     */
    public void consumerRemoved(String consumerId) {
        delivery.cancelAll(consumerId);
        LivenessTimer timer = livenessTimers.remove(consumerId);
        if (timer != null) {
            timer.dispose();
        }
    }

    @Override
    public void onDeliveryOutcome(String consumerId, String wakeId, DeliveryOutcome outcome) {
        switch (outcome) {
            case ACCEPTED:
                apply(consumerId, LifecycleEvent.webhookAccepted(wakeId));
                break;
            case DONE:
                Optional<ConsumerInstance> consumer = consumers.get(consumerId);
                if (consumer.isPresent()) {
                    apply(consumerId, LifecycleEvent.webhookDone(wakeId, tailsOf(consumer.get())));
                }
                break;
            case FAILED:
                apply(consumerId, LifecycleEvent.webhookFailed(wakeId));
                break;
            default:
                throw new IllegalArgumentException("Unknown delivery outcome " + outcome);
        }
    }

    @Override
    public void close() {
        for (String consumerId : livenessTimers.keySet()) {
            LivenessTimer timer = livenessTimers.remove(consumerId);
            if (timer != null) {
                timer.dispose();
            }
        }
    }

    private void run(Effect effect) {
        LOG.debug("Running {}.", effect);
        if (effect instanceof Effect.DeliverWake) {
            Effect.DeliverWake wake = (Effect.DeliverWake) effect;
            LOG.debug("Consumer {} woken at epoch {} with wake {}.",
                wake.getConsumerId(), wake.getEpoch(), wake.getWakeId());
            delivery.deliver(wake.getConsumerId(), wake.getWakeId());
        } else if (effect instanceof Effect.CancelDelivery) {
            delivery.cancel(effect.getConsumerId(), ((Effect.CancelDelivery) effect).getWakeId());
        } else if (effect instanceof Effect.RetryDelivery) {
            delivery.retry(effect.getConsumerId(), ((Effect.RetryDelivery) effect).getWakeId());
        } else if (effect instanceof Effect.ScheduleLivenessCheck) {
            Effect.ScheduleLivenessCheck schedule = (Effect.ScheduleLivenessCheck) effect;
            scheduleLivenessCheck(schedule.getConsumerId(), schedule.getWakeId(), schedule.getDeadline());
        } else if (effect instanceof Effect.CancelLivenessCheck) {
            cancelLivenessCheck(effect.getConsumerId(), ((Effect.CancelLivenessCheck) effect).getWakeId());
        } else {
            throw new IllegalArgumentException("Unknown effect " + effect);
        }
    }

    private void scheduleLivenessCheck(String consumerId, String wakeId, long deadline) {
        long delay = Math.max(0L, deadline - now());
        Disposable task = scheduler.scheduleDirect(() -> onLivenessTimer(consumerId), delay, TimeUnit.MILLISECONDS);
        LivenessTimer previous = livenessTimers.put(consumerId, new LivenessTimer(wakeId, task));
        if (previous != null) {
            previous.dispose();
        }
    }

    /**
     * Cancels the timer only while it still belongs to the wake, a late cancel of an earlier cycle must not disarm
     * the timer of the current one.
     */
    private void cancelLivenessCheck(String consumerId, String wakeId) {
        livenessTimers.computeIfPresent(consumerId, (id, timer) -> {
            if (!timer.wakeId.equals(wakeId)) {
                return timer;
            }
            timer.dispose();
            return null;
        });
    }

    private void onLivenessTimer(String consumerId) {
        try {
            Optional<ConsumerInstance> consumer = consumers.get(consumerId);
            if (consumer.isPresent()) {
                apply(consumerId, LifecycleEvent.livenessCheck(tailsOf(consumer.get())));
            }
        } catch (RuntimeException e) {
            LOG.error("Liveness check of consumer {} failed.", consumerId, e);
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private static final class LivenessTimer {
        private final String wakeId;
        private final Disposable task;

        LivenessTimer(String wakeId, Disposable task) {
            this.wakeId = wakeId;
            this.task = task;
        }

        void dispose() {
            task.dispose();
        }
    }
}
