package com.eventfullyengineered.jstreamwake.tokens;

import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import io.reactivex.Scheduler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Issues and verifies callback bearer tokens. A token is
 * {@code base64url(consumerId).epoch.expiresAt.hex(hmacSha256(secret, <first three parts>))}; verification
 * recomputes the signature, no token is ever stored.
 */
public class CallbackTokenManager {

    private static final char SEPARATOR = '.';
    private static final Splitter SPLITTER = Splitter.on(SEPARATOR);
    private static final BaseEncoding ID_ENCODING = BaseEncoding.base64Url().omitPadding();

    private final HashFunction hmac;
    private final long ttlMillis;
    private final long refreshThresholdMillis;
    private final Scheduler scheduler;

    public CallbackTokenManager(byte[] secret, Duration ttl, Duration refreshThreshold, Scheduler scheduler) {
        Preconditions.checkArgument(secret != null && secret.length > 0, "secret must not be empty");
        this.hmac = Hashing.hmacSha256(secret);
        this.ttlMillis = Ensure.positive(ttl, "ttl").toMillis();
        this.refreshThresholdMillis = Ensure.positive(refreshThreshold, "refreshThreshold").toMillis();
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
    }

    public String issue(String consumerId, long epoch) {
        Ensure.notNullOrEmpty(consumerId, "consumerId");
        long expiresAt = now() + ttlMillis;
        String unsigned = ID_ENCODING.encode(consumerId.getBytes(StandardCharsets.UTF_8))
            + SEPARATOR + epoch + SEPARATOR + expiresAt;
        return unsigned + SEPARATOR + sign(unsigned);
    }

    public TokenVerification verify(String token) {
        if (Ensure.isNullOrEmpty(token)) {
            return TokenVerification.invalid();
        }
        List<String> parts = SPLITTER.splitToList(token);
        if (parts.size() != 4) {
            return TokenVerification.invalid();
        }

        String unsigned = token.substring(0, token.lastIndexOf(SEPARATOR));
        byte[] expected = sign(unsigned).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = parts.get(3).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            return TokenVerification.invalid();
        }

        CallbackToken claims;
        try {
            String consumerId = new String(ID_ENCODING.decode(parts.get(0)), StandardCharsets.UTF_8);
            claims = new CallbackToken(consumerId, Long.parseLong(parts.get(1)), Long.parseLong(parts.get(2)));
        } catch (IllegalArgumentException e) {
            // a correctly signed token is always well formed, this only happens after a secret collision
            return TokenVerification.invalid();
        }

        if (now() >= claims.getExpiresAt()) {
            return TokenVerification.expired(claims);
        }
        return TokenVerification.valid(claims);
    }

    /**
     * Returns the token to hand back after a successful callback: the presented one while it is bound to the
     * current epoch and has more than the refresh threshold left, a fresh one otherwise.
     */
    public String refresh(String presented, CallbackToken claims, String consumerId, long currentEpoch) {
        if (presented != null && claims != null
            && claims.getConsumerId().equals(consumerId)
            && claims.getEpoch() == currentEpoch
            && claims.getExpiresAt() - now() > refreshThresholdMillis) {
            return presented;
        }
        return issue(consumerId, currentEpoch);
    }

    private String sign(String unsigned) {
        return hmac.hashString(unsigned, StandardCharsets.UTF_8).toString();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
