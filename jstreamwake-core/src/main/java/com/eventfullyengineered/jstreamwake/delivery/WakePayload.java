package com.eventfullyengineered.jstreamwake.delivery;

import com.eventfullyengineered.jstreamwake.consumers.StreamOffset;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Body POSTed to the subscription webhook.
 */
public final class WakePayload {

    private final String consumerId;
    private final long epoch;
    private final String wakeId;
    private final String primaryStream;
    private final List<StreamOffset> streams;
    private final List<String> triggeredBy;
    private final String callback;
    private final String token;

    @JsonCreator
    public WakePayload(@JsonProperty("consumer_id") String consumerId,
                       @JsonProperty("epoch") long epoch,
                       @JsonProperty("wake_id") String wakeId,
                       @JsonProperty("primary_stream") String primaryStream,
                       @JsonProperty("streams") List<StreamOffset> streams,
                       @JsonProperty("triggered_by") List<String> triggeredBy,
                       @JsonProperty("callback") String callback,
                       @JsonProperty("token") String token) {
        this.consumerId = consumerId;
        this.epoch = epoch;
        this.wakeId = wakeId;
        this.primaryStream = primaryStream;
        this.streams = streams == null ? ImmutableList.of() : ImmutableList.copyOf(streams);
        this.triggeredBy = triggeredBy == null ? ImmutableList.of() : ImmutableList.copyOf(triggeredBy);
        this.callback = callback;
        this.token = token;
    }

    @JsonProperty("consumer_id")
    public String getConsumerId() {
        return consumerId;
    }

    @JsonProperty("epoch")
    public long getEpoch() {
        return epoch;
    }

    @JsonProperty("wake_id")
    public String getWakeId() {
        return wakeId;
    }

    @JsonProperty("primary_stream")
    public String getPrimaryStream() {
        return primaryStream;
    }

    @JsonProperty("streams")
    public List<StreamOffset> getStreams() {
        return streams;
    }

    /**
     * Paths whose tail is beyond the acked offset when the payload was built.
     */
    @JsonProperty("triggered_by")
    public List<String> getTriggeredBy() {
        return triggeredBy;
    }

    @JsonProperty("callback")
    public String getCallback() {
        return callback;
    }

    @JsonProperty("token")
    public String getToken() {
        return token;
    }
}
