package com.eventfullyengineered.jstreamwake.subscriptions;

import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Holds subscription records. Reads are lock free; writes are serialized and republish the {@link PatternIndex}.
 * Work that must not outlive a subscription runs through {@link #whileExists}, which excludes writes.
 */
public class SubscriptionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionRegistry.class);

    public static final String ALL_PATTERN = "/**";

    private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final List<SubscriptionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile PatternIndex index = PatternIndex.EMPTY;

    public void addListener(SubscriptionListener listener) {
        listeners.add(Preconditions.checkNotNull(listener));
    }

    /**
     * Creates a subscription. Repeating an identical create returns the existing record.
     * @throws SubscriptionConflictException when the id exists with a different configuration
     */
    public CreateSubscriptionResult create(String subscriptionId, String pattern, String webhook, String description) {
        Ensure.notNullOrEmpty(subscriptionId, "subscriptionId");
        Ensure.notNullOrEmpty(pattern, "pattern");
        Ensure.notNullOrEmpty(webhook, "webhook");
        String normalized = GlobPattern.normalize(pattern);

        Subscription subscription;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Subscription existing = subscriptions.get(subscriptionId);
            if (existing != null) {
                if (existing.hasConfiguration(normalized, webhook, description)) {
                    return new CreateSubscriptionResult(existing, false);
                }
                throw new SubscriptionConflictException(subscriptionId);
            }
            subscription = new Subscription(subscriptionId, normalized, webhook, WebhookSecrets.generate(), description);
            subscriptions.put(subscriptionId, subscription);
            index = PatternIndex.build(subscriptions.values());
        } finally {
            writeLock.unlock();
        }

        LOG.info("Subscription {} created for pattern {} with webhook {}.", subscriptionId, normalized, webhook);
        for (SubscriptionListener listener : listeners) {
            listener.onSubscriptionCreated(subscription);
        }
        return new CreateSubscriptionResult(subscription, true);
    }

    public Optional<Subscription> get(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    /**
     * @return the subscriptions registered with exactly this pattern, or all of them for {@link #ALL_PATTERN}
     */
    public List<Subscription> listByPattern(String pattern) {
        String normalized = GlobPattern.normalize(pattern);
        if (ALL_PATTERN.equals(normalized)) {
            return listAll();
        }
        return subscriptions.values().stream()
            .filter(s -> s.getPattern().equals(normalized))
            .collect(Collectors.toList());
    }

    public List<Subscription> listAll() {
        return ImmutableList.copyOf(subscriptions.values());
    }

    /**
     * Runs an action while the subscription exists. A concurrent {@link #delete} waits for the action to finish, so
     * anything the action registers for the subscription is visible to the delete listeners.
     * @return the action's result, empty if the subscription does not exist
     */
    public <T> Optional<T> whileExists(String subscriptionId, Function<Subscription, T> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            Subscription subscription = subscriptions.get(subscriptionId);
            if (subscription == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(subscription));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Resolves the subscriptions whose pattern matches a stream path.
     */
    public Set<String> affected(String path) {
        return index.affected(path);
    }

    /**
     * Deletes a subscription. Listeners remove the owned consumer instances before this returns.
     * @return true if the subscription existed
     */
    public boolean delete(String subscriptionId) {
        Subscription removed;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            removed = subscriptions.remove(subscriptionId);
            if (removed == null) {
                return false;
            }
            index = PatternIndex.build(subscriptions.values());
        } finally {
            writeLock.unlock();
        }

        LOG.info("Subscription {} deleted.", subscriptionId);
        for (SubscriptionListener listener : listeners) {
            listener.onSubscriptionDeleted(removed);
        }
        return true;
    }
}
