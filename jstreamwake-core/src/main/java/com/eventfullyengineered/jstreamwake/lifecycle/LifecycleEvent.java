package com.eventfullyengineered.jstreamwake.lifecycle;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Inputs of the {@link ConsumerStateMachine}. Events carrying tails hold a snapshot read before the consumer lock
 * was taken; a path missing from the snapshot is treated as having nothing pending.
 */
public abstract class LifecycleEvent {

    private LifecycleEvent() {
    }

    public static PendingWorkObserved pendingWorkObserved(Map<String, String> tails) {
        return new PendingWorkObserved(tails);
    }

    public static WebhookAccepted webhookAccepted(String wakeId) {
        return new WebhookAccepted(wakeId);
    }

    public static WebhookDone webhookDone(String wakeId, Map<String, String> tails) {
        return new WebhookDone(wakeId, tails);
    }

    public static WebhookFailed webhookFailed(String wakeId) {
        return new WebhookFailed(wakeId);
    }

    public static LivenessCheck livenessCheck(Map<String, String> tails) {
        return new LivenessCheck(tails);
    }

    public static Claim claim(String wakeId) {
        return new Claim(wakeId);
    }

    public static Heartbeat heartbeat() {
        return Heartbeat.INSTANCE;
    }

    public static Done done(Map<String, String> tails) {
        return new Done(tails);
    }

    abstract static class WithTails extends LifecycleEvent {
        private final ImmutableMap<String, String> tails;

        WithTails(Map<String, String> tails) {
            this.tails = ImmutableMap.copyOf(Preconditions.checkNotNull(tails, "tails"));
        }

        public Map<String, String> getTails() {
            return tails;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("tails", tails).toString();
        }
    }

    abstract static class ForWake extends LifecycleEvent {
        private final String wakeId;

        ForWake(String wakeId) {
            this.wakeId = Preconditions.checkNotNull(wakeId, "wakeId");
        }

        public String getWakeId() {
            return wakeId;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("wakeId", wakeId).toString();
        }
    }

    /**
     * A subscribed stream advanced.
     */
    public static final class PendingWorkObserved extends WithTails {
        PendingWorkObserved(Map<String, String> tails) {
            super(tails);
        }
    }

    /**
     * The webhook answered 2xx without {@code done}.
     */
    public static final class WebhookAccepted extends ForWake {
        WebhookAccepted(String wakeId) {
            super(wakeId);
        }
    }

    /**
     * The webhook answered 2xx with {@code {"done": true}}.
     */
    public static final class WebhookDone extends ForWake {
        private final ImmutableMap<String, String> tails;

        WebhookDone(String wakeId, Map<String, String> tails) {
            super(wakeId);
            this.tails = ImmutableMap.copyOf(Preconditions.checkNotNull(tails, "tails"));
        }

        public Map<String, String> getTails() {
            return tails;
        }
    }

    /**
     * Non-2xx, timeout or network error.
     */
    public static final class WebhookFailed extends ForWake {
        WebhookFailed(String wakeId) {
            super(wakeId);
        }
    }

    /**
     * The liveness timer fired.
     */
    public static final class LivenessCheck extends WithTails {
        LivenessCheck(Map<String, String> tails) {
            super(tails);
        }
    }

    /**
     * A callback presented a wake id.
     */
    public static final class Claim extends ForWake {
        Claim(String wakeId) {
            super(wakeId);
        }
    }

    /**
     * Any accepted callback.
     */
    public static final class Heartbeat extends LifecycleEvent {
        private static final Heartbeat INSTANCE = new Heartbeat();

        private Heartbeat() {
        }

        @Override
        public String toString() {
            return "Heartbeat";
        }
    }

    /**
     * A callback with {@code done: true}.
     */
    public static final class Done extends WithTails {
        Done(Map<String, String> tails) {
            super(tails);
        }
    }
}
