package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.io.BaseEncoding;

import java.security.SecureRandom;

public final class WebhookSecrets {

    public static final String PREFIX = "whsec_";

    private static final SecureRandom RANDOM = new SecureRandom();

    private WebhookSecrets() {
        // statics only
    }

    public static String generate() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return PREFIX + BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
