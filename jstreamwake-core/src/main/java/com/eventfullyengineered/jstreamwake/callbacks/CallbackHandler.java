package com.eventfullyengineered.jstreamwake.callbacks;

import com.eventfullyengineered.jstreamwake.consumers.ConsumerGoneException;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstanceStore;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerState;
import com.eventfullyengineered.jstreamwake.consumers.Mutation;
import com.eventfullyengineered.jstreamwake.consumers.RemovalReason;
import com.eventfullyengineered.jstreamwake.consumers.StreamOffset;
import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.lifecycle.ConsumerStateMachine;
import com.eventfullyengineered.jstreamwake.lifecycle.LifecycleEvent;
import com.eventfullyengineered.jstreamwake.lifecycle.Transition;
import com.eventfullyengineered.jstreamwake.lifecycle.WakeCycleCoordinator;
import com.eventfullyengineered.jstreamwake.streams.StreamStorage;
import com.eventfullyengineered.jstreamwake.tokens.CallbackToken;
import com.eventfullyengineered.jstreamwake.tokens.CallbackTokenManager;
import com.eventfullyengineered.jstreamwake.tokens.TokenStatus;
import com.eventfullyengineered.jstreamwake.tokens.TokenVerification;
import io.reactivex.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Applies callbacks of woken consumers. A callback is applied as a whole under the consumer's lock or rejected with
 * a {@link CallbackException} leaving the consumer untouched. Checks run in this order: consumer exists, token,
 * epoch, wake id, acks, subscribe, unsubscribe; then the liveness deadline is pushed back and {@code done} resolved.
 */
public class CallbackHandler {

    private static final Logger LOG = LoggerFactory.getLogger(CallbackHandler.class);

    private final ConsumerInstanceStore consumers;
    private final StreamStorage storage;
    private final CallbackTokenManager tokens;
    private final WakeCycleCoordinator coordinator;
    private final ConsumerStateMachine stateMachine;
    private final Scheduler scheduler;

    public CallbackHandler(ConsumerInstanceStore consumers,
                           StreamStorage storage,
                           CallbackTokenManager tokens,
                           WakeCycleCoordinator coordinator,
                           Scheduler scheduler) {
        this.consumers = Ensure.notNull(consumers, "consumers");
        this.storage = Ensure.notNull(storage, "storage");
        this.tokens = Ensure.notNull(tokens, "tokens");
        this.coordinator = Ensure.notNull(coordinator, "coordinator");
        this.stateMachine = coordinator.getStateMachine();
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
    }

    /**
     * @param consumerId the consumer id as it appears in the callback URL, still percent-encoded
     * @param token the bearer token
     * @throws CallbackException if the callback is rejected
     */
    public CallbackResponse handle(String consumerId, String token, CallbackRequest request) {
        Ensure.notNull(request, "request");
        validate(request);
        TokenVerification verification = tokens.verify(token);
        long now = scheduler.now(TimeUnit.MILLISECONDS);

        Applied applied;
        try {
            applied = consumers.mutate(consumerId, current -> apply(current, token, verification, request, now));
        } catch (ConsumerGoneException e) {
            throw new CallbackException(CallbackErrorCode.CONSUMER_GONE, "Consumer instance not found");
        }

        if (applied.removed) {
            coordinator.consumerRemoved(consumerId);
            throw new CallbackException(CallbackErrorCode.CONSUMER_GONE,
                "Consumer removed after unsubscribing from all streams");
        }
        coordinator.run(applied.transition.getEffects());
        ConsumerInstance next = applied.transition.getNext();
        LOG.debug("Callback for {} applied at epoch {}, now {}.", consumerId, next.getEpoch(), next.getState());
        if (next.getState() == ConsumerState.IDLE) {
            // tails were read before the commit
            coordinator.wakeIfPending(consumerId);
        }
        return CallbackResponse.success(applied.token, next.getStreamOffsets());
    }

    private static void validate(CallbackRequest request) {
        if (request.getEpoch() == null) {
            throw new CallbackException(CallbackErrorCode.INVALID_REQUEST, "Missing epoch");
        }
        for (StreamOffset ack : request.getAcks()) {
            if (ack == null || Ensure.isNullOrEmpty(ack.getPath()) || Ensure.isNullOrEmpty(ack.getOffset())) {
                throw new CallbackException(CallbackErrorCode.INVALID_REQUEST, "Each ack needs a path and an offset");
            }
        }
        validatePaths(request.getSubscribe(), "subscribe");
        validatePaths(request.getUnsubscribe(), "unsubscribe");
    }

    private static void validatePaths(Iterable<String> paths, String field) {
        for (String path : paths) {
            if (Ensure.isNullOrEmpty(path) || path.charAt(0) != '/') {
                throw new CallbackException(CallbackErrorCode.INVALID_REQUEST,
                    "Invalid stream path in " + field + ": " + path);
            }
        }
    }

    private Mutation<Applied> apply(ConsumerInstance current,
                                    String token,
                                    TokenVerification verification,
                                    CallbackRequest request,
                                    long now) {
        String consumerId = current.getConsumerId();
        CallbackToken claims = checkToken(current, verification);

        long epoch = request.getEpoch();
        if (epoch < current.getEpoch()) {
            throw new CallbackException(CallbackErrorCode.STALE_EPOCH,
                "Consumer epoch " + epoch + " is stale; current epoch is " + current.getEpoch());
        }
        if (epoch > current.getEpoch()) {
            throw new CallbackException(CallbackErrorCode.INVALID_REQUEST,
                "Consumer epoch " + epoch + " is ahead of current epoch " + current.getEpoch());
        }

        Transition transition = Transition.unchanged(current);
        if (request.getWakeId() != null) {
            if (!ConsumerStateMachine.isOutstandingWake(current, request.getWakeId())) {
                throw new CallbackException(CallbackErrorCode.ALREADY_CLAIMED,
                    "Wake ID " + request.getWakeId() + " is invalid or already claimed");
            }
            transition = stateMachine.apply(current, LifecycleEvent.claim(request.getWakeId()), now);
        }

        ConsumerInstance.Builder next = transition.getNext().toBuilder();
        for (StreamOffset ack : request.getAcks()) {
            String acked = next.streams().get(ack.getPath());
            if (acked == null) {
                throw new CallbackException(CallbackErrorCode.INVALID_OFFSET,
                    "Not subscribed to " + ack.getPath());
            }
            if (storage.compareOffsets(ack.getOffset(), acked) < 0) {
                throw new CallbackException(CallbackErrorCode.INVALID_OFFSET,
                    "Offset " + ack.getOffset() + " for " + ack.getPath() + " is behind acked offset " + acked);
            }
            String tail = storage.currentTail(ack.getPath());
            if (storage.compareOffsets(ack.getOffset(), tail) > 0) {
                throw new CallbackException(CallbackErrorCode.INVALID_OFFSET,
                    "Offset " + ack.getOffset() + " for " + ack.getPath() + " is beyond tail " + tail);
            }
            next.stream(ack.getPath(), ack.getOffset());
        }
        for (String path : request.getSubscribe()) {
            if (!next.streams().containsKey(path)) {
                next.stream(path, storage.currentTail(path));
            }
        }
        for (String path : request.getUnsubscribe()) {
            next.removeStream(path);
        }
        if (next.streams().isEmpty()) {
            return Mutation.remove(RemovalReason.UNSUBSCRIBED, Applied.REMOVED);
        }

        ConsumerInstance updated = next.build();
        transition = transition.then(stateMachine.apply(updated, LifecycleEvent.heartbeat(), now));
        if (request.isDone()) {
            ConsumerInstance live = transition.getNext();
            transition = transition.then(
                stateMachine.apply(live, LifecycleEvent.done(coordinator.tailsOf(live)), now));
        }

        ConsumerInstance result = transition.getNext();
        String responseToken = tokens.refresh(token, claims, consumerId, result.getEpoch());
        return Mutation.update(result, new Applied(transition, responseToken));
    }

    private CallbackToken checkToken(ConsumerInstance current, TokenVerification verification) {
        String consumerId = current.getConsumerId();
        CallbackToken claims = verification.getClaims();
        if (verification.getStatus() == TokenStatus.INVALID
            || !claims.getConsumerId().equals(consumerId)
            || claims.getEpoch() > current.getEpoch()) {
            throw new CallbackException(CallbackErrorCode.TOKEN_INVALID, "Callback token is invalid");
        }
        if (verification.getStatus() == TokenStatus.EXPIRED) {
            throw new CallbackException(CallbackErrorCode.TOKEN_EXPIRED, "Callback token has expired",
                tokens.issue(consumerId, current.getEpoch()));
        }
        if (claims.getEpoch() < current.getEpoch()) {
            throw new CallbackException(CallbackErrorCode.STALE_EPOCH,
                "Token epoch " + claims.getEpoch() + " is stale; current epoch is " + current.getEpoch());
        }
        return claims;
    }

    private static final class Applied {
        private static final Applied REMOVED = new Applied(null, null);

        private final Transition transition;
        private final String token;
        private final boolean removed;

        Applied(Transition transition, String token) {
            this.transition = transition;
            this.token = token;
            this.removed = transition == null;
        }
    }
}
