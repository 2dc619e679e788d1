package com.eventfullyengineered.jstreamwake.consumers;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Striped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * {@link ConsumerInstanceStore} keeping consumers in memory. Mutations of one consumer are serialized with a striped
 * lock; lookups and the stream and subscription indexes are lock free.
 * <p>
 * A removed consumer leaves a tombstone for a while. A consumer re-created under the same id continues from the
 * tombstone's epoch so that tokens minted for the removed one stay stale.
 */
public class InMemoryConsumerInstanceStore implements ConsumerInstanceStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryConsumerInstanceStore.class);

    private static final int DEFAULT_STRIPES = 64;

    private final ConcurrentMap<String, ConsumerInstance> consumers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> byStream = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> bySubscription = new ConcurrentHashMap<>();
    private final Striped<Lock> locks;
    private final Cache<String, Tombstone> tombstones;

    public InMemoryConsumerInstanceStore(Duration tombstoneTtl) {
        this(tombstoneTtl, Ticker.systemTicker(), DEFAULT_STRIPES);
    }

    public InMemoryConsumerInstanceStore(Duration tombstoneTtl, Ticker ticker, int stripes) {
        Preconditions.checkArgument(stripes > 0, "stripes must be positive");
        this.locks = Striped.lock(stripes);
        this.tombstones = CacheBuilder.newBuilder()
            .ticker(ticker)
            .expireAfterWrite(tombstoneTtl.toMillis(), TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public ConsumerInstance getOrCreate(String subscriptionId, String primaryStream, String initialOffset) {
        String consumerId = ConsumerIds.of(subscriptionId, primaryStream);
        ConsumerInstance existing = consumers.get(consumerId);
        if (existing != null) {
            return existing;
        }

        Lock lock = locks.get(consumerId);
        lock.lock();
        try {
            existing = consumers.get(consumerId);
            if (existing != null) {
                return existing;
            }
            Tombstone tombstone = tombstones.getIfPresent(consumerId);
            long epoch = tombstone == null ? 0L : tombstone.epoch;
            String offset = tombstone == null || tombstone.primaryOffset == null ? initialOffset : tombstone.primaryOffset;

            ConsumerInstance created = ConsumerInstance.create(subscriptionId, primaryStream, offset, epoch);
            consumers.put(consumerId, created);
            index(bySubscription, subscriptionId, consumerId);
            index(byStream, primaryStream, consumerId);
            LOG.debug("Consumer {} created at offset {} and epoch {}.", consumerId, offset, epoch);
            return created;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ConsumerInstance> get(String consumerId) {
        return Optional.ofNullable(consumers.get(consumerId));
    }

    @Override
    public <R> R mutate(String consumerId, Function<ConsumerInstance, Mutation<R>> mutator) {
        Lock lock = locks.get(consumerId);
        lock.lock();
        try {
            ConsumerInstance current = consumers.get(consumerId);
            if (current == null) {
                throw new ConsumerGoneException(consumerId);
            }
            Mutation<R> mutation = mutator.apply(current);
            if (mutation.isRemoval()) {
                removeLocked(current, mutation.getRemoval());
            } else {
                commit(current, mutation.getNext());
            }
            return mutation.getResult();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ConsumerInstance> remove(String consumerId, RemovalReason reason) {
        Lock lock = locks.get(consumerId);
        lock.lock();
        try {
            ConsumerInstance current = consumers.get(consumerId);
            if (current == null) {
                return Optional.empty();
            }
            removeLocked(current, reason);
            return Optional.of(current);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> consumersForStream(String path) {
        return snapshot(byStream, path);
    }

    @Override
    public Set<String> consumersForSubscription(String subscriptionId) {
        return snapshot(bySubscription, subscriptionId);
    }

    @Override
    public Collection<ConsumerInstance> all() {
        return ImmutableList.copyOf(consumers.values());
    }

    private void commit(ConsumerInstance current, ConsumerInstance next) {
        Preconditions.checkState(current.getConsumerId().equals(next.getConsumerId()),
            "mutation changed the consumer id from %s to %s", current.getConsumerId(), next.getConsumerId());
        consumers.put(next.getConsumerId(), next);
        for (String path : current.getStreams().keySet()) {
            if (!next.isSubscribedTo(path)) {
                unindex(byStream, path, next.getConsumerId());
            }
        }
        for (String path : next.getStreams().keySet()) {
            if (!current.isSubscribedTo(path)) {
                index(byStream, path, next.getConsumerId());
            }
        }
    }

    private void removeLocked(ConsumerInstance current, RemovalReason reason) {
        String consumerId = current.getConsumerId();
        consumers.remove(consumerId);
        for (String path : current.getStreams().keySet()) {
            unindex(byStream, path, consumerId);
        }
        unindex(bySubscription, current.getSubscriptionId(), consumerId);

        String primaryOffset = reason.keepsOffsets() ? current.getAckedOffset(current.getPrimaryStream()) : null;
        tombstones.put(consumerId, new Tombstone(current.getEpoch(), primaryOffset));
        LOG.info("Consumer {} removed at epoch {}. Reason: {}", consumerId, current.getEpoch(), reason);
    }

    private static void index(ConcurrentMap<String, Set<String>> index, String key, String consumerId) {
        index.compute(key, (k, ids) -> {
            Set<String> updated = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            updated.add(consumerId);
            return updated;
        });
    }

    private static void unindex(ConcurrentMap<String, Set<String>> index, String key, String consumerId) {
        index.computeIfPresent(key, (k, ids) -> {
            ids.remove(consumerId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private static Set<String> snapshot(ConcurrentMap<String, Set<String>> index, String key) {
        Set<String> ids = index.get(key);
        return ids == null ? ImmutableSet.of() : ImmutableSet.copyOf(ids);
    }

    private static final class Tombstone {
        private final long epoch;
        private final String primaryOffset;

        Tombstone(long epoch, String primaryOffset) {
            this.epoch = epoch;
            this.primaryOffset = primaryOffset;
        }
    }
}
