package com.eventfullyengineered.jstreamwake.callbacks;

import com.eventfullyengineered.jstreamwake.consumers.StreamOffset;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.JsonSerializerStrategy;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.SerializationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Body of a callback: {@code {epoch, wake_id?, acks?, subscribe?, unsubscribe?, done?}}.
 */
public final class CallbackRequest {

    private final Long epoch;
    private final String wakeId;
    private final List<StreamOffset> acks;
    private final List<String> subscribe;
    private final List<String> unsubscribe;
    private final boolean done;

    @JsonCreator
    public CallbackRequest(@JsonProperty("epoch") Long epoch,
                           @JsonProperty("wake_id") String wakeId,
                           @JsonProperty("acks") List<StreamOffset> acks,
                           @JsonProperty("subscribe") List<String> subscribe,
                           @JsonProperty("unsubscribe") List<String> unsubscribe,
                           @JsonProperty("done") Boolean done) {
        this.epoch = epoch;
        this.wakeId = wakeId;
        this.acks = copyOf(acks);
        this.subscribe = copyOf(subscribe);
        this.unsubscribe = copyOf(unsubscribe);
        this.done = done != null && done;
    }

    /**
     * Parses a callback body.
     * @throws CallbackException with {@link CallbackErrorCode#INVALID_REQUEST} if the body is not a JSON object
     */
    public static CallbackRequest parse(JsonSerializerStrategy serializer, String body) {
        CallbackRequest request;
        try {
            request = serializer.fromJson(body, CallbackRequest.class);
        } catch (SerializationException e) {
            throw new CallbackException(CallbackErrorCode.INVALID_REQUEST, "Malformed callback body");
        }
        if (request == null) {
            throw new CallbackException(CallbackErrorCode.INVALID_REQUEST, "Missing callback body");
        }
        return request;
    }

    private static <T> List<T> copyOf(List<T> list) {
        // element nulls are rejected by validation rather than here
        return list == null ? ImmutableList.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    @JsonProperty("epoch")
    public Long getEpoch() {
        return epoch;
    }

    @JsonProperty("wake_id")
    public String getWakeId() {
        return wakeId;
    }

    @JsonProperty("acks")
    public List<StreamOffset> getAcks() {
        return acks;
    }

    @JsonProperty("subscribe")
    public List<String> getSubscribe() {
        return subscribe;
    }

    @JsonProperty("unsubscribe")
    public List<String> getUnsubscribe() {
        return unsubscribe;
    }

    @JsonProperty("done")
    public boolean isDone() {
        return done;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("epoch", epoch)
            .add("wakeId", wakeId)
            .add("acks", acks)
            .add("subscribe", subscribe)
            .add("unsubscribe", unsubscribe)
            .add("done", done)
            .toString();
    }
}
