package com.eventfullyengineered.jstreamwake.callbacks;

import com.eventfullyengineered.jstreamwake.StreamWake;
import com.eventfullyengineered.jstreamwake.StreamWakeSettings;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerInstance;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerState;
import com.eventfullyengineered.jstreamwake.consumers.StreamOffset;
import com.eventfullyengineered.jstreamwake.delivery.FakeWebhookTransport;
import com.eventfullyengineered.jstreamwake.delivery.WakePayload;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.JacksonSerializer;
import com.eventfullyengineered.jstreamwake.streams.InMemoryStreamStorage;
import com.eventfullyengineered.jstreamwake.streams.InterleavingStreamStorage;
import com.google.common.collect.ImmutableList;
import io.reactivex.schedulers.TestScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallbackHandlerTest {

    private static final String PATH = "/agents/t1";
    private static final String CONSUMER_ID = "sub1:%2Fagents%2Ft1";

    private final TestScheduler scheduler = new TestScheduler();
    private final FakeWebhookTransport transport = new FakeWebhookTransport().hold();
    private final InMemoryStreamStorage storage = new InMemoryStreamStorage();
    private final InterleavingStreamStorage interleaving = new InterleavingStreamStorage(storage);
    private StreamWake streamWake;
    private WakePayload wake;

    @BeforeEach
    void setUp() {
        StreamWakeSettings settings = new StreamWakeSettings.Builder("http://wake.local")
            .withTokenSecret("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8))
            .build();
        streamWake = new StreamWake(interleaving, settings, transport, scheduler);
        streamWake.createSubscription("sub1", "/agents/*", "http://hooks.local/wake", null);
        storage.append(PATH, "first");
        scheduler.triggerActions();
        wake = transport.last().payload();
    }

    @AfterEach
    void tearDown() {
        streamWake.close();
    }

    private static CallbackRequest request(Long epoch,
                                           String wakeId,
                                           List<StreamOffset> acks,
                                           List<String> subscribe,
                                           List<String> unsubscribe,
                                           boolean done) {
        return new CallbackRequest(epoch, wakeId, acks, subscribe, unsubscribe, done);
    }

    private static CallbackRequest claim(long epoch, String wakeId) {
        return request(epoch, wakeId, null, null, null, false);
    }

    private static CallbackRequest ack(long epoch, String offset, boolean done) {
        return request(epoch, null, ImmutableList.of(new StreamOffset(PATH, offset)), null, null, done);
    }

    private CallbackResponse handle(String token, CallbackRequest request) {
        return streamWake.handleCallback(CONSUMER_ID, token, request);
    }

    private CallbackException rejected(String token, CallbackRequest request) {
        return assertThrows(CallbackException.class, () -> handle(token, request));
    }

    private ConsumerInstance consumer() {
        return streamWake.getConsumer(CONSUMER_ID).get();
    }

    @Test
    void claimShouldMoveConsumerLive() {
        CallbackResponse response = handle(wake.getToken(), claim(1, wake.getWakeId()));

        assertTrue(response.isOk());
        assertEquals(wake.getToken(), response.getToken());
        assertEquals(ImmutableList.of(new StreamOffset(PATH, "-1")), response.getStreams());
        assertEquals(ConsumerState.LIVE, consumer().getState());
    }

    @Test
    void repeatedClaimOfSameWakeShouldSucceed() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));

        CallbackResponse response = handle(wake.getToken(), claim(1, wake.getWakeId()));

        assertTrue(response.isOk());
        assertEquals(ConsumerState.LIVE, consumer().getState());
    }

    @Test
    void claimOfOtherWakeShouldBeRejected() {
        CallbackException e = rejected(wake.getToken(), claim(1, "not-the-wake"));

        assertEquals(CallbackErrorCode.ALREADY_CLAIMED, e.getCode());
        assertEquals(409, e.getHttpStatus());
        assertEquals(ConsumerState.WAKING, consumer().getState());
    }

    @Test
    void ackShouldAdvanceOffset() {
        CallbackResponse response = handle(wake.getToken(), ack(1, "0", false));

        assertEquals(ImmutableList.of(new StreamOffset(PATH, "0")), response.getStreams());
        assertEquals("0", consumer().getAckedOffset(PATH));
    }

    @Test
    void rejectedCallbackShouldLeaveConsumerUntouched() {
        CallbackRequest request = request(1L, wake.getWakeId(),
            ImmutableList.of(new StreamOffset(PATH, "5")), null, null, false);

        CallbackException e = rejected(wake.getToken(), request);

        assertEquals(CallbackErrorCode.INVALID_OFFSET, e.getCode());
        assertEquals(ConsumerState.WAKING, consumer().getState());
        assertEquals("-1", consumer().getAckedOffset(PATH));
    }

    @Test
    void ackBehindAckedOffsetShouldBeRejected() {
        storage.append(PATH, "second");
        handle(wake.getToken(), ack(1, "1", false));

        CallbackException e = rejected(wake.getToken(), ack(1, "0", false));

        assertEquals(CallbackErrorCode.INVALID_OFFSET, e.getCode());
        assertEquals("1", consumer().getAckedOffset(PATH));
    }

    @Test
    void ackOfUnsubscribedStreamShouldBeRejected() {
        CallbackRequest request = request(1L, null,
            ImmutableList.of(new StreamOffset("/agents/t2", "0")), null, null, false);

        assertEquals(CallbackErrorCode.INVALID_OFFSET, rejected(wake.getToken(), request).getCode());
    }

    @Test
    void doneWithNothingPendingShouldGoIdle() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));

        handle(wake.getToken(), ack(1, "0", true));

        assertEquals(ConsumerState.IDLE, consumer().getState());
        assertEquals(1L, consumer().getEpoch());
    }

    @Test
    void doneWithPendingWorkShouldStartNewEpoch() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));
        storage.append(PATH, "second");

        CallbackResponse response = handle(wake.getToken(), ack(1, "0", true));
        scheduler.triggerActions();

        assertEquals(ConsumerState.WAKING, consumer().getState());
        assertEquals(2L, consumer().getEpoch());
        assertEquals(2, transport.count());
        assertEquals(2L, transport.last().payload().getEpoch());
        assertFalse(wake.getToken().equals(response.getToken()));
    }

    @Test
    void staleEpochShouldBeFenced() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));
        storage.append(PATH, "second");
        handle(wake.getToken(), ack(1, "0", true));
        scheduler.triggerActions();
        WakePayload second = transport.last().payload();

        CallbackException staleToken = rejected(wake.getToken(), ack(1, "1", false));
        CallbackException staleRequest = rejected(second.getToken(), ack(1, "1", false));

        assertEquals(CallbackErrorCode.STALE_EPOCH, staleToken.getCode());
        assertEquals(CallbackErrorCode.STALE_EPOCH, staleRequest.getCode());
        assertEquals(409, staleRequest.getHttpStatus());
        assertEquals("0", consumer().getAckedOffset(PATH));
        assertTrue(handle(second.getToken(), ack(2, "1", false)).isOk());
    }

    @Test
    void epochAheadOfConsumerShouldBeInvalid() {
        CallbackException e = rejected(wake.getToken(), claim(2, wake.getWakeId()));

        assertEquals(CallbackErrorCode.INVALID_REQUEST, e.getCode());
        assertEquals(400, e.getHttpStatus());
    }

    @Test
    void missingEpochShouldBeInvalid() {
        CallbackException e = rejected(wake.getToken(), request(null, null, null, null, null, false));

        assertEquals(CallbackErrorCode.INVALID_REQUEST, e.getCode());
    }

    @Test
    void malformedBodyShouldBeInvalid() {
        CallbackException e = assertThrows(CallbackException.class,
            () -> CallbackRequest.parse(JacksonSerializer.DEFAULT, "{\"epoch\":"));

        assertEquals(CallbackErrorCode.INVALID_REQUEST, e.getCode());
    }

    @Test
    void unknownTokenShouldBeRejected() {
        CallbackException garbage = rejected("not-a-token", claim(1, wake.getWakeId()));
        CallbackException missing = rejected(null, claim(1, wake.getWakeId()));

        assertEquals(CallbackErrorCode.TOKEN_INVALID, garbage.getCode());
        assertEquals(401, garbage.getHttpStatus());
        assertEquals(CallbackErrorCode.TOKEN_INVALID, missing.getCode());
    }

    @Test
    void tokenOfOtherConsumerShouldBeRejected() {
        storage.append("/agents/t2", "other");
        scheduler.triggerActions();
        WakePayload other = transport.last().payload();
        assertEquals("sub1:%2Fagents%2Ft2", other.getConsumerId());

        CallbackException e = rejected(other.getToken(), claim(1, wake.getWakeId()));

        assertEquals(CallbackErrorCode.TOKEN_INVALID, e.getCode());
    }

    @Test
    void expiredTokenShouldBeRejectedWithFreshToken() {
        scheduler.advanceTimeBy(1, TimeUnit.HOURS);

        CallbackException e = rejected(wake.getToken(), claim(1, wake.getWakeId()));

        assertEquals(CallbackErrorCode.TOKEN_EXPIRED, e.getCode());
        assertEquals(401, e.getHttpStatus());
        assertNotNull(e.getToken());
        assertTrue(handle(e.getToken(), claim(1, wake.getWakeId())).isOk());
    }

    @Test
    void tokenCloseToExpiryShouldBeRefreshed() {
        scheduler.advanceTimeBy(55, TimeUnit.MINUTES);

        CallbackResponse response = handle(wake.getToken(), claim(1, wake.getWakeId()));

        assertFalse(wake.getToken().equals(response.getToken()));
        assertTrue(handle(response.getToken(), ack(1, "0", false)).isOk());
    }

    @Test
    void unknownConsumerShouldBeGone() {
        CallbackException e = assertThrows(CallbackException.class,
            () -> streamWake.handleCallback("sub1:%2Fnowhere", wake.getToken(), claim(1, "w")));

        assertEquals(CallbackErrorCode.CONSUMER_GONE, e.getCode());
        assertEquals(410, e.getHttpStatus());
    }

    @Test
    void subscribeShouldStartAtCurrentTail() {
        storage.append("/shared/log", "a", "b");
        handle(wake.getToken(), claim(1, wake.getWakeId()));

        CallbackResponse response = handle(wake.getToken(),
            request(1L, null, null, ImmutableList.of("/shared/log"), null, false));

        assertEquals(ImmutableList.of(new StreamOffset(PATH, "-1"), new StreamOffset("/shared/log", "1")),
            response.getStreams());
        assertTrue(consumer().isSubscribedTo("/shared/log"));
    }

    @Test
    void appendToSecondaryStreamShouldWakeIdleConsumer() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));
        handle(wake.getToken(), request(1L, null, ImmutableList.of(new StreamOffset(PATH, "0")),
            ImmutableList.of("/shared/log"), null, true));
        assertEquals(ConsumerState.IDLE, consumer().getState());

        storage.append("/shared/log", "news");
        scheduler.triggerActions();

        assertEquals(ConsumerState.WAKING, consumer().getState());
        assertEquals(ImmutableList.of("/shared/log"), transport.last().payload().getTriggeredBy());
    }

    @Test
    void unsubscribeShouldDropStream() {
        handle(wake.getToken(), request(1L, null, null, ImmutableList.of("/shared/log"), null, false));

        CallbackResponse response = handle(wake.getToken(),
            request(1L, null, null, null, ImmutableList.of("/shared/log"), false));

        assertEquals(ImmutableList.of(new StreamOffset(PATH, "-1")), response.getStreams());
    }

    @Test
    void unsubscribingFromEverythingShouldRemoveConsumer() {
        CallbackException e = rejected(wake.getToken(),
            request(1L, null, null, null, ImmutableList.of(PATH), false));

        assertEquals(CallbackErrorCode.CONSUMER_GONE, e.getCode());
        assertFalse(streamWake.getConsumer(CONSUMER_ID).isPresent());
    }

    @Test
    void invalidStreamPathShouldBeRejected() {
        CallbackException e = rejected(wake.getToken(),
            request(1L, null, null, ImmutableList.of("relative/path"), null, false));

        assertEquals(CallbackErrorCode.INVALID_REQUEST, e.getCode());
    }

    @Test
    void heartbeatShouldExtendLiveness() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));
        handle(wake.getToken(), ack(1, "0", false));

        scheduler.advanceTimeBy(40, TimeUnit.SECONDS);
        handle(wake.getToken(), claim(1, null));
        scheduler.advanceTimeBy(40, TimeUnit.SECONDS);
        assertEquals(ConsumerState.LIVE, consumer().getState());

        scheduler.advanceTimeBy(5, TimeUnit.SECONDS);
        assertEquals(ConsumerState.IDLE, consumer().getState());
        assertEquals(1L, consumer().getEpoch());
    }

    @Test
    void livenessExpiryWithPendingWorkShouldWakeAgain() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));

        scheduler.advanceTimeBy(45, TimeUnit.SECONDS);

        assertEquals(ConsumerState.WAKING, consumer().getState());
        assertEquals(2L, consumer().getEpoch());
        assertEquals(2L, transport.last().payload().getEpoch());
    }

    @Test
    void appendRacingDoneShouldStartNextCycle() {
        handle(wake.getToken(), claim(1, wake.getWakeId()));
        handle(wake.getToken(), ack(1, "0", false));
        interleaving.afterNextTailRead(() -> storage.append(PATH, "second"));

        handle(wake.getToken(), request(1L, null, null, null, null, true));
        scheduler.triggerActions();

        ConsumerInstance consumer = consumer();
        assertEquals(ConsumerState.WAKING, consumer.getState());
        assertEquals(2L, consumer.getEpoch());
        assertEquals("0", consumer.getAckedOffset(PATH));
        assertEquals(2, transport.count());
        assertEquals(2L, transport.last().payload().getEpoch());
    }
}
