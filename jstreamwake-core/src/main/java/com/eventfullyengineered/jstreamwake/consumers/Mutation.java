package com.eventfullyengineered.jstreamwake.consumers;

import com.google.common.base.Preconditions;

/**
 * The outcome of a read-modify-write on one consumer: the snapshot to commit (or removal) and a value handed back
 * to the caller once committed.
 * @param <R> the type of the value
 */
public final class Mutation<R> {

    private final ConsumerInstance next;
    private final RemovalReason removal;
    private final R result;

    private Mutation(ConsumerInstance next, RemovalReason removal, R result) {
        this.next = next;
        this.removal = removal;
        this.result = result;
    }

    public static <R> Mutation<R> update(ConsumerInstance next, R result) {
        return new Mutation<>(Preconditions.checkNotNull(next, "next"), null, result);
    }

    public static <R> Mutation<R> remove(RemovalReason reason, R result) {
        return new Mutation<>(null, Preconditions.checkNotNull(reason, "reason"), result);
    }

    public ConsumerInstance getNext() {
        return next;
    }

    public RemovalReason getRemoval() {
        return removal;
    }

    public boolean isRemoval() {
        return removal != null;
    }

    public R getResult() {
        return result;
    }
}
