package com.eventfullyengineered.jstreamwake.consumers;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one consumer: a subscription applied to one primary stream. Instances are immutable, a mutation
 * produces a new snapshot which the {@link ConsumerInstanceStore} commits atomically.
 */
public final class ConsumerInstance {

    private final String consumerId;
    private final String subscriptionId;
    private final String primaryStream;
    /**
     * Acked offset per subscribed path, in subscription order.
     */
    private final ImmutableMap<String, String> streams;
    private final ConsumerState state;
    private final long epoch;
    /**
     * Only set while not {@link ConsumerState#IDLE}.
     */
    private final String wakeId;
    /**
     * Epoch millis, only meaningful while {@link ConsumerState#LIVE}.
     */
    private final long livenessDeadline;
    /**
     * Epoch millis of the first webhook failure since the last successful delivery, or null.
     */
    private final Long deliveryFailingSince;

    private ConsumerInstance(Builder builder) {
        this.consumerId = Preconditions.checkNotNull(builder.consumerId, "consumerId");
        this.subscriptionId = Preconditions.checkNotNull(builder.subscriptionId, "subscriptionId");
        this.primaryStream = Preconditions.checkNotNull(builder.primaryStream, "primaryStream");
        this.streams = ImmutableMap.copyOf(builder.streams);
        this.state = Preconditions.checkNotNull(builder.state, "state");
        this.epoch = builder.epoch;
        this.wakeId = builder.state == ConsumerState.IDLE ? null : builder.wakeId;
        this.livenessDeadline = builder.state == ConsumerState.LIVE ? builder.livenessDeadline : 0L;
        this.deliveryFailingSince = builder.deliveryFailingSince;
        Preconditions.checkState(state == ConsumerState.IDLE || wakeId != null, "wakeId required while %s", state);
    }

    /**
     * Creates an IDLE consumer subscribed to its primary stream only.
     */
    public static ConsumerInstance create(String subscriptionId, String primaryStream, String ackedOffset, long epoch) {
        return new Builder()
            .consumerId(ConsumerIds.of(subscriptionId, primaryStream))
            .subscriptionId(subscriptionId)
            .primaryStream(primaryStream)
            .stream(primaryStream, ackedOffset)
            .state(ConsumerState.IDLE)
            .epoch(epoch)
            .build();
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getPrimaryStream() {
        return primaryStream;
    }

    public Map<String, String> getStreams() {
        return streams;
    }

    public List<StreamOffset> getStreamOffsets() {
        ImmutableList.Builder<StreamOffset> offsets = ImmutableList.builder();
        for (Map.Entry<String, String> entry : streams.entrySet()) {
            offsets.add(new StreamOffset(entry.getKey(), entry.getValue()));
        }
        return offsets.build();
    }

    public boolean isSubscribedTo(String path) {
        return streams.containsKey(path);
    }

    public String getAckedOffset(String path) {
        return streams.get(path);
    }

    public ConsumerState getState() {
        return state;
    }

    public long getEpoch() {
        return epoch;
    }

    public String getWakeId() {
        return wakeId;
    }

    public long getLivenessDeadline() {
        return livenessDeadline;
    }

    public Long getDeliveryFailingSince() {
        return deliveryFailingSince;
    }

    public boolean isWaking(String wakeId) {
        return state == ConsumerState.WAKING && this.wakeId.equals(wakeId);
    }

    public Builder toBuilder() {
        return new Builder()
            .consumerId(consumerId)
            .subscriptionId(subscriptionId)
            .primaryStream(primaryStream)
            .streams(streams)
            .state(state)
            .epoch(epoch)
            .wakeId(wakeId)
            .livenessDeadline(livenessDeadline)
            .deliveryFailingSince(deliveryFailingSince);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("consumerId", consumerId)
            .add("state", state)
            .add("epoch", epoch)
            .add("wakeId", wakeId)
            .add("streams", streams)
            .add("livenessDeadline", livenessDeadline)
            .add("deliveryFailingSince", deliveryFailingSince)
            .toString();
    }

    public static class Builder {

        private String consumerId;
        private String subscriptionId;
        private String primaryStream;
        private final Map<String, String> streams = new LinkedHashMap<>();
        private ConsumerState state = ConsumerState.IDLE;
        private long epoch;
        private String wakeId;
        private long livenessDeadline;
        private Long deliveryFailingSince;

        public Builder consumerId(String consumerId) {
            this.consumerId = consumerId;
            return this;
        }

        public Builder subscriptionId(String subscriptionId) {
            this.subscriptionId = subscriptionId;
            return this;
        }

        public Builder primaryStream(String primaryStream) {
            this.primaryStream = primaryStream;
            return this;
        }

        public Builder streams(Map<String, String> streams) {
            this.streams.clear();
            this.streams.putAll(streams);
            return this;
        }

        public Builder stream(String path, String ackedOffset) {
            this.streams.put(Preconditions.checkNotNull(path), Preconditions.checkNotNull(ackedOffset));
            return this;
        }

        public Builder removeStream(String path) {
            this.streams.remove(path);
            return this;
        }

        public Map<String, String> streams() {
            return streams;
        }

        public Builder state(ConsumerState state) {
            this.state = state;
            return this;
        }

        public Builder epoch(long epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder wakeId(String wakeId) {
            this.wakeId = wakeId;
            return this;
        }

        public Builder livenessDeadline(long livenessDeadline) {
            this.livenessDeadline = livenessDeadline;
            return this;
        }

        public Builder deliveryFailingSince(Long deliveryFailingSince) {
            this.deliveryFailingSince = deliveryFailingSince;
            return this;
        }

        public ConsumerInstance build() {
            return new ConsumerInstance(this);
        }
    }
}
