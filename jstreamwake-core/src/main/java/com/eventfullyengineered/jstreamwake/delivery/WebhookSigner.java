package com.eventfullyengineered.jstreamwake.delivery;

import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Signs webhook bodies: {@code t=<unix seconds>,sha256=<hex hmac-sha256(secret, "<t>.<body>")>}.
 */
public final class WebhookSigner {

    public static final String SIGNATURE_HEADER = "Webhook-Signature";

    private static final Splitter.MapSplitter HEADER_SPLITTER =
        Splitter.on(',').trimResults().withKeyValueSeparator('=');

    private WebhookSigner() {
    }

    public static String sign(String secret, String body, long timestampSeconds) {
        Ensure.notNullOrEmpty(secret, "secret");
        Ensure.notNull(body, "body");
        return "t=" + timestampSeconds + ",sha256=" + hmac(secret, timestampSeconds, body);
    }

    /**
     * Checks a signature header the way a webhook receiver would.
     */
    public static boolean verify(String secret, String body, String signatureHeader) {
        if (Ensure.isNullOrEmpty(signatureHeader)) {
            return false;
        }
        Map<String, String> parts;
        try {
            parts = HEADER_SPLITTER.split(signatureHeader);
        } catch (IllegalArgumentException e) {
            return false;
        }
        String timestamp = parts.get("t");
        String signature = parts.get("sha256");
        if (timestamp == null || signature == null) {
            return false;
        }
        long seconds;
        try {
            seconds = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            return false;
        }
        return MessageDigest.isEqual(
            hmac(secret, seconds, body).getBytes(StandardCharsets.US_ASCII),
            signature.getBytes(StandardCharsets.US_ASCII));
    }

    private static String hmac(String secret, long timestampSeconds, String body) {
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
            .hashString(timestampSeconds + "." + body, StandardCharsets.UTF_8)
            .toString();
    }
}
