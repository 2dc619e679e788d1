package com.eventfullyengineered.jstreamwake.lifecycle;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Side effects requested by a {@link Transition}. They are executed by the {@link WakeCycleCoordinator} after the
 * transition has been committed, outside the consumer lock.
 */
public abstract class Effect {

    private final String consumerId;

    private Effect(String consumerId) {
        this.consumerId = Preconditions.checkNotNull(consumerId, "consumerId");
    }

    public String getConsumerId() {
        return consumerId;
    }

    MoreObjects.ToStringHelper toStringHelper() {
        return MoreObjects.toStringHelper(this).add("consumerId", consumerId);
    }

    @Override
    public String toString() {
        return toStringHelper().toString();
    }

    /**
     * Start delivering the wake of a new cycle.
     */
    public static final class DeliverWake extends Effect {
        private final long epoch;
        private final String wakeId;

        public DeliverWake(String consumerId, long epoch, String wakeId) {
            super(consumerId);
            this.epoch = epoch;
            this.wakeId = Preconditions.checkNotNull(wakeId, "wakeId");
        }

        public long getEpoch() {
            return epoch;
        }

        public String getWakeId() {
            return wakeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DeliverWake)) {
                return false;
            }
            DeliverWake that = (DeliverWake) o;
            return epoch == that.epoch && getConsumerId().equals(that.getConsumerId()) && wakeId.equals(that.wakeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getConsumerId(), epoch, wakeId);
        }

        @Override
        public String toString() {
            return toStringHelper().add("epoch", epoch).add("wakeId", wakeId).toString();
        }
    }

    /**
     * The wake was resolved, stop any pending retry of its delivery.
     */
    public static final class CancelDelivery extends Effect {
        private final String wakeId;

        public CancelDelivery(String consumerId, String wakeId) {
            super(consumerId);
            this.wakeId = Preconditions.checkNotNull(wakeId, "wakeId");
        }

        public String getWakeId() {
            return wakeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CancelDelivery)) {
                return false;
            }
            CancelDelivery that = (CancelDelivery) o;
            return getConsumerId().equals(that.getConsumerId()) && wakeId.equals(that.wakeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getConsumerId(), wakeId);
        }

        @Override
        public String toString() {
            return toStringHelper().add("wakeId", wakeId).toString();
        }
    }

    /**
     * Schedule another delivery attempt of the current wake with backoff.
     */
    public static final class RetryDelivery extends Effect {
        private final String wakeId;

        public RetryDelivery(String consumerId, String wakeId) {
            super(consumerId);
            this.wakeId = Preconditions.checkNotNull(wakeId, "wakeId");
        }

        public String getWakeId() {
            return wakeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RetryDelivery)) {
                return false;
            }
            RetryDelivery that = (RetryDelivery) o;
            return getConsumerId().equals(that.getConsumerId()) && wakeId.equals(that.wakeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getConsumerId(), wakeId);
        }

        @Override
        public String toString() {
            return toStringHelper().add("wakeId", wakeId).toString();
        }
    }

    /**
     * (Re)arm the liveness timer of a wake.
     */
    public static final class ScheduleLivenessCheck extends Effect {
        private final String wakeId;
        private final long deadline;

        public ScheduleLivenessCheck(String consumerId, String wakeId, long deadline) {
            super(consumerId);
            this.wakeId = Preconditions.checkNotNull(wakeId, "wakeId");
            this.deadline = deadline;
        }

        public String getWakeId() {
            return wakeId;
        }

        /**
         * @return epoch millis
         */
        public long getDeadline() {
            return deadline;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ScheduleLivenessCheck)) {
                return false;
            }
            ScheduleLivenessCheck that = (ScheduleLivenessCheck) o;
            return deadline == that.deadline && getConsumerId().equals(that.getConsumerId())
                && wakeId.equals(that.wakeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getConsumerId(), wakeId, deadline);
        }

        @Override
        public String toString() {
            return toStringHelper().add("wakeId", wakeId).add("deadline", deadline).toString();
        }
    }

    /**
     * Disarm the liveness timer, only if it still belongs to the wake.
     */
    public static final class CancelLivenessCheck extends Effect {
        private final String wakeId;

        public CancelLivenessCheck(String consumerId, String wakeId) {
            super(consumerId);
            this.wakeId = Preconditions.checkNotNull(wakeId, "wakeId");
        }

        public String getWakeId() {
            return wakeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CancelLivenessCheck)) {
                return false;
            }
            CancelLivenessCheck that = (CancelLivenessCheck) o;
            return getConsumerId().equals(that.getConsumerId()) && wakeId.equals(that.wakeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(CancelLivenessCheck.class, getConsumerId(), wakeId);
        }

        @Override
        public String toString() {
            return toStringHelper().add("wakeId", wakeId).toString();
        }
    }
}
