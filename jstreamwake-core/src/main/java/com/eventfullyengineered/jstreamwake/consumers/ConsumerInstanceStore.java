package com.eventfullyengineered.jstreamwake.consumers;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Durable map of consumer id to {@link ConsumerInstance} with per-consumer exclusive mutation. No operation locks
 * more than one consumer.
 */
public interface ConsumerInstanceStore {

    /**
     * Gets the consumer for a subscription and primary stream, creating it IDLE when missing.
     * @param initialOffset acked offset of the primary stream for a new consumer unless a recently removed
     *                      consumer with the same id left one behind
     */
    ConsumerInstance getOrCreate(String subscriptionId, String primaryStream, String initialOffset);

    Optional<ConsumerInstance> get(String consumerId);

    /**
     * Atomically reads, transforms and commits a consumer. Exceptions thrown by the mutator abort without any change.
     * @throws ConsumerGoneException if the consumer does not exist
     */
    <R> R mutate(String consumerId, Function<ConsumerInstance, Mutation<R>> mutator);

    /**
     * Removes a consumer. Once this returns every later {@link #mutate} for the id fails until it is re-created.
     * @return the removed consumer
     */
    Optional<ConsumerInstance> remove(String consumerId, RemovalReason reason);

    /**
     * @return ids of consumers subscribed to the path, primary or not
     */
    Set<String> consumersForStream(String path);

    Set<String> consumersForSubscription(String subscriptionId);

    Collection<ConsumerInstance> all();
}
