package com.eventfullyengineered.jstreamwake.lifecycle;

import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerState;
import com.eventfullyengineered.jstreamwake.consumers.RemovalReason;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.lifecycle.Effect.CancelDelivery;
import com.eventfullyengineered.jstreamwake.lifecycle.Effect.CancelLivenessCheck;
import com.eventfullyengineered.jstreamwake.lifecycle.Effect.DeliverWake;
import com.eventfullyengineered.jstreamwake.lifecycle.Effect.RetryDelivery;
import com.eventfullyengineered.jstreamwake.lifecycle.Effect.ScheduleLivenessCheck;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.Claim;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.Done;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.Heartbeat;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.LivenessCheck;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.PendingWorkObserved;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.WebhookAccepted;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.WebhookDone;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent.WebhookFailed;
import com.fasterxml.uuid.Generators;
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The consumer lifecycle as a pure function {@code (snapshot, event, now) -> transition}.
 * <pre>
 * IDLE   --pending work-----------------> WAKING  (epoch + 1, new wake id, deliver)
 * WAKING --webhook 2xx / claim----------> LIVE    (arm liveness)
 * WAKING --webhook done-----------------> IDLE    (auto-ack to tail)
 * LIVE   --done, nothing pending--------> IDLE
 * LIVE   --done, pending----------------> WAKING  (epoch + 1, new wake id, deliver)
 * LIVE   --liveness deadline passed-----> IDLE, or WAKING when work is pending
 * </pre>
 * Events that do not apply to the current state leave it unchanged.
 */
public class ConsumerStateMachine {

    public static final Supplier<String> RANDOM_WAKE_IDS = () -> Generators.randomBasedGenerator().generate().toString();

    private final long livenessTimeoutMillis;
    private final long deliveryFailureThresholdMillis;
    private final Comparator<String> offsetComparator;
    private final Supplier<String> wakeIds;

    public ConsumerStateMachine(Duration livenessTimeout,
                                Duration deliveryFailureThreshold,
                                Comparator<String> offsetComparator) {
        this(livenessTimeout, deliveryFailureThreshold, offsetComparator, RANDOM_WAKE_IDS);
    }

    public ConsumerStateMachine(Duration livenessTimeout,
                                Duration deliveryFailureThreshold,
                                Comparator<String> offsetComparator,
                                Supplier<String> wakeIds) {
        this.livenessTimeoutMillis = Ensure.positive(livenessTimeout, "livenessTimeout").toMillis();
        this.deliveryFailureThresholdMillis =
            Ensure.positive(deliveryFailureThreshold, "deliveryFailureThreshold").toMillis();
        this.offsetComparator = Ensure.notNull(offsetComparator, "offsetComparator");
        this.wakeIds = Ensure.notNull(wakeIds, "wakeIds");
    }

    public Transition apply(ConsumerInstance current, LifecycleEvent event, long now) {
        Ensure.notNull(current, "current");
        Ensure.notNull(event, "event");

        if (event instanceof PendingWorkObserved) {
            return onPendingWork(current, ((PendingWorkObserved) event).getTails());
        }
        if (event instanceof WebhookAccepted) {
            return onAccepted(current, ((WebhookAccepted) event).getWakeId(), now);
        }
        if (event instanceof WebhookDone) {
            WebhookDone done = (WebhookDone) event;
            return onWebhookDone(current, done.getWakeId(), done.getTails());
        }
        if (event instanceof WebhookFailed) {
            return onFailed(current, ((WebhookFailed) event).getWakeId(), now);
        }
        if (event instanceof LivenessCheck) {
            return onLivenessCheck(current, ((LivenessCheck) event).getTails(), now);
        }
        if (event instanceof Claim) {
            return onClaim(current, ((Claim) event).getWakeId(), now);
        }
        if (event instanceof Heartbeat) {
            return onHeartbeat(current, now);
        }
        if (event instanceof Done) {
            return onDone(current, ((Done) event).getTails());
        }
        throw new IllegalArgumentException("Unknown lifecycle event " + event);
    }

    /**
     * @return true if some subscribed path's tail in the snapshot is beyond its acked offset
     */
    public boolean hasPendingWork(ConsumerInstance consumer, Map<String, String> tails) {
        return !pendingPaths(consumer, tails).isEmpty();
    }

    public List<String> pendingPaths(ConsumerInstance consumer, Map<String, String> tails) {
        ImmutableList.Builder<String> pending = ImmutableList.builder();
        for (Map.Entry<String, String> stream : consumer.getStreams().entrySet()) {
            String tail = tails.get(stream.getKey());
            if (tail != null && offsetComparator.compare(tail, stream.getValue()) > 0) {
                pending.add(stream.getKey());
            }
        }
        return pending.build();
    }

    /**
     * @return true if a callback presenting the wake id claims the outstanding wake, or repeats a claim of it
     */
    public static boolean isOutstandingWake(ConsumerInstance consumer, String wakeId) {
        return consumer.getState() != ConsumerState.IDLE && consumer.getWakeId().equals(wakeId);
    }

    private Transition onPendingWork(ConsumerInstance current, Map<String, String> tails) {
        if (current.getState() != ConsumerState.IDLE || !hasPendingWork(current, tails)) {
            return Transition.unchanged(current);
        }
        return wake(current, new ArrayList<>());
    }

    private Transition onAccepted(ConsumerInstance current, String wakeId, long now) {
        if (current.isWaking(wakeId)) {
            return goLive(current, now);
        }
        if (isOutstandingWake(current, wakeId) && current.getDeliveryFailingSince() != null) {
            return Transition.to(current.toBuilder().deliveryFailingSince(null).build());
        }
        return Transition.unchanged(current);
    }

    private Transition onWebhookDone(ConsumerInstance current, String wakeId, Map<String, String> tails) {
        if (!isOutstandingWake(current, wakeId)) {
            return Transition.unchanged(current);
        }
        ConsumerInstance.Builder next = current.toBuilder();
        for (Map.Entry<String, String> stream : current.getStreams().entrySet()) {
            String tail = tails.get(stream.getKey());
            if (tail != null && offsetComparator.compare(tail, stream.getValue()) > 0) {
                next.stream(stream.getKey(), tail);
            }
        }
        List<Effect> effects = new ArrayList<>();
        effects.add(new CancelDelivery(current.getConsumerId(), wakeId));
        if (current.getState() == ConsumerState.LIVE) {
            effects.add(new CancelLivenessCheck(current.getConsumerId(), current.getWakeId()));
        }
        return Transition.to(next.state(ConsumerState.IDLE).deliveryFailingSince(null).build(), effects);
    }

    private Transition onFailed(ConsumerInstance current, String wakeId, long now) {
        if (!current.isWaking(wakeId)) {
            return Transition.unchanged(current);
        }
        Long failingSince = current.getDeliveryFailingSince();
        if (failingSince == null) {
            failingSince = now;
        } else if (now - failingSince >= deliveryFailureThresholdMillis) {
            return Transition.remove(RemovalReason.DELIVERY_FAILING);
        }
        return Transition.to(current.toBuilder().deliveryFailingSince(failingSince).build(),
            new RetryDelivery(current.getConsumerId(), wakeId));
    }

    private Transition onLivenessCheck(ConsumerInstance current, Map<String, String> tails, long now) {
        if (current.getState() != ConsumerState.LIVE) {
            return Transition.unchanged(current);
        }
        if (now < current.getLivenessDeadline()) {
            return Transition.to(current, new ScheduleLivenessCheck(
                current.getConsumerId(), current.getWakeId(), current.getLivenessDeadline()));
        }
        List<Effect> effects = new ArrayList<>();
        effects.add(new CancelDelivery(current.getConsumerId(), current.getWakeId()));
        if (hasPendingWork(current, tails)) {
            return wake(current, effects);
        }
        return Transition.to(current.toBuilder().state(ConsumerState.IDLE).build(), effects);
    }

    private Transition onClaim(ConsumerInstance current, String wakeId, long now) {
        if (current.isWaking(wakeId)) {
            return goLive(current, now);
        }
        return Transition.unchanged(current);
    }

    private Transition onHeartbeat(ConsumerInstance current, long now) {
        if (current.getState() != ConsumerState.LIVE) {
            return Transition.unchanged(current);
        }
        long deadline = now + livenessTimeoutMillis;
        return Transition.to(current.toBuilder().livenessDeadline(deadline).build(),
            new ScheduleLivenessCheck(current.getConsumerId(), current.getWakeId(), deadline));
    }

    private Transition onDone(ConsumerInstance current, Map<String, String> tails) {
        if (current.getState() == ConsumerState.IDLE) {
            return Transition.unchanged(current);
        }
        List<Effect> effects = new ArrayList<>();
        effects.add(new CancelDelivery(current.getConsumerId(), current.getWakeId()));
        if (current.getState() == ConsumerState.LIVE) {
            effects.add(new CancelLivenessCheck(current.getConsumerId(), current.getWakeId()));
        }
        ConsumerInstance resolved = current.toBuilder().deliveryFailingSince(null).build();
        if (hasPendingWork(resolved, tails)) {
            return wake(resolved, effects);
        }
        return Transition.to(resolved.toBuilder().state(ConsumerState.IDLE).build(), effects);
    }

    private Transition goLive(ConsumerInstance current, long now) {
        long deadline = now + livenessTimeoutMillis;
        ConsumerInstance next = current.toBuilder()
            .state(ConsumerState.LIVE)
            .livenessDeadline(deadline)
            .deliveryFailingSince(null)
            .build();
        return Transition.to(next,
            new CancelDelivery(current.getConsumerId(), current.getWakeId()),
            new ScheduleLivenessCheck(current.getConsumerId(), current.getWakeId(), deadline));
    }

    private Transition wake(ConsumerInstance current, List<Effect> effects) {
        long epoch = current.getEpoch() + 1;
        String wakeId = wakeIds.get();
        ConsumerInstance next = current.toBuilder()
            .state(ConsumerState.WAKING)
            .epoch(epoch)
            .wakeId(wakeId)
            .build();
        effects.add(new DeliverWake(current.getConsumerId(), epoch, wakeId));
        return Transition.to(next, effects);
    }
}
