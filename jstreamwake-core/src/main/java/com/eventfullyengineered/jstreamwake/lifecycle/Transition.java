package com.eventfullyengineered.jstreamwake.lifecycle;

import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.RemovalReason;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of applying a {@link LifecycleEvent}: either the next snapshot or a removal, plus the effects to run once
 * it has been committed.
 */
public final class Transition {

    private final ConsumerInstance next;
    private final RemovalReason removal;
    private final ImmutableList<Effect> effects;

    private Transition(ConsumerInstance next, RemovalReason removal, List<Effect> effects) {
        this.next = next;
        this.removal = removal;
        this.effects = ImmutableList.copyOf(effects);
    }

    public static Transition unchanged(ConsumerInstance current) {
        return new Transition(Preconditions.checkNotNull(current), null, ImmutableList.of());
    }

    public static Transition to(ConsumerInstance next, Effect... effects) {
        return new Transition(Preconditions.checkNotNull(next), null, ImmutableList.copyOf(effects));
    }

    public static Transition to(ConsumerInstance next, List<Effect> effects) {
        return new Transition(Preconditions.checkNotNull(next), null, effects);
    }

    public static Transition remove(RemovalReason reason) {
        return new Transition(null, Preconditions.checkNotNull(reason), ImmutableList.of());
    }

    /**
     * @return the next snapshot, null for a removal
     */
    public ConsumerInstance getNext() {
        return next;
    }

    public RemovalReason getRemoval() {
        return removal;
    }

    public boolean isRemoval() {
        return removal != null;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Appends the effects of a transition applied on top of this one.
     */
    public Transition then(Transition following) {
        if (isRemoval()) {
            return this;
        }
        return new Transition(following.next, following.removal,
            ImmutableList.<Effect>builder().addAll(effects).addAll(following.effects).build());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("next", next)
            .add("removal", removal)
            .add("effects", effects)
            .toString();
    }
}
