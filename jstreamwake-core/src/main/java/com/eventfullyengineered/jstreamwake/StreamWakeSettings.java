package com.eventfullyengineered.jstreamwake;

import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.JacksonSerializer;
import com.eventfullyengineered.jstreamwake.infrastructure.serialization.JsonSerializerStrategy;
import com.google.common.base.Strings;
import com.google.common.base.MoreObjects;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Properties;

public class StreamWakeSettings {

    public static final String PROPERTY_PREFIX = "jstreamwake.";

    public static final Duration DEFAULT_LIVENESS_TIMEOUT = Duration.ofSeconds(45);
    public static final Duration DEFAULT_WEBHOOK_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_WAKE_CONFIRMATION_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_DELIVERY_FAILURE_THRESHOLD = Duration.ofDays(3);
    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_TOKEN_REFRESH_THRESHOLD = Duration.ofMinutes(10);
    public static final Duration DEFAULT_GC_SWEEP_INTERVAL = Duration.ofMinutes(5);

    private static final JsonSerializerStrategy DEFAULT_JSON_SERIALIZER_STRATEGY = JacksonSerializer.DEFAULT;

    private String callbackBaseUrl;
    private byte[] tokenSecret;
    private Duration livenessTimeout = DEFAULT_LIVENESS_TIMEOUT;
    private Duration webhookRequestTimeout = DEFAULT_WEBHOOK_REQUEST_TIMEOUT;
    private Duration wakeConfirmationTimeout = DEFAULT_WAKE_CONFIRMATION_TIMEOUT;
    private Duration deliveryFailureThreshold = DEFAULT_DELIVERY_FAILURE_THRESHOLD;
    private Duration tokenTtl = DEFAULT_TOKEN_TTL;
    private Duration tokenRefreshThreshold = DEFAULT_TOKEN_REFRESH_THRESHOLD;
    private Duration gcSweepInterval = DEFAULT_GC_SWEEP_INTERVAL;
    private JsonSerializerStrategy jsonSerializerStrategy = DEFAULT_JSON_SERIALIZER_STRATEGY;

    /**
     * Base URL that callback URLs are built on, without a trailing slash.
     */
    public String getCallbackBaseUrl() {
        return callbackBaseUrl;
    }

    public void setCallbackBaseUrl(String callbackBaseUrl) {
        Ensure.notNullOrEmpty(callbackBaseUrl, "callbackBaseUrl");
        this.callbackBaseUrl = callbackBaseUrl.endsWith("/")
            ? callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1)
            : callbackBaseUrl;
    }

    public byte[] getTokenSecret() {
        return tokenSecret.clone();
    }

    public void setTokenSecret(byte[] tokenSecret) {
        Ensure.notNull(tokenSecret, "tokenSecret");
        if (tokenSecret.length < 16) {
            throw new IllegalArgumentException("tokenSecret should be at least 16 bytes.");
        }
        this.tokenSecret = tokenSecret.clone();
    }

    public Duration getLivenessTimeout() {
        return livenessTimeout;
    }

    public void setLivenessTimeout(Duration livenessTimeout) {
        this.livenessTimeout = Ensure.positive(livenessTimeout, "livenessTimeout");
    }

    public Duration getWebhookRequestTimeout() {
        return webhookRequestTimeout;
    }

    public void setWebhookRequestTimeout(Duration webhookRequestTimeout) {
        this.webhookRequestTimeout = Ensure.positive(webhookRequestTimeout, "webhookRequestTimeout");
    }

    /**
     * How long a wake may stay unconfirmed before a fresh delivery attempt is made.
     */
    public Duration getWakeConfirmationTimeout() {
        return wakeConfirmationTimeout;
    }

    public void setWakeConfirmationTimeout(Duration wakeConfirmationTimeout) {
        this.wakeConfirmationTimeout = Ensure.positive(wakeConfirmationTimeout, "wakeConfirmationTimeout");
    }

    /**
     * How long webhook delivery may fail continuously before the consumer is garbage collected.
     */
    public Duration getDeliveryFailureThreshold() {
        return deliveryFailureThreshold;
    }

    public void setDeliveryFailureThreshold(Duration deliveryFailureThreshold) {
        this.deliveryFailureThreshold = Ensure.positive(deliveryFailureThreshold, "deliveryFailureThreshold");
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public void setTokenTtl(Duration tokenTtl) {
        this.tokenTtl = Ensure.positive(tokenTtl, "tokenTtl");
    }

    /**
     * A callback token is reused in the response while more than this remains before it expires.
     */
    public Duration getTokenRefreshThreshold() {
        return tokenRefreshThreshold;
    }

    public void setTokenRefreshThreshold(Duration tokenRefreshThreshold) {
        this.tokenRefreshThreshold = Ensure.positive(tokenRefreshThreshold, "tokenRefreshThreshold");
    }

    public Duration getGcSweepInterval() {
        return gcSweepInterval;
    }

    public void setGcSweepInterval(Duration gcSweepInterval) {
        this.gcSweepInterval = Ensure.positive(gcSweepInterval, "gcSweepInterval");
    }

    public JsonSerializerStrategy getJsonSerializerStrategy() {
        return jsonSerializerStrategy;
    }

    public void setJsonSerializerStrategy(JsonSerializerStrategy strategy) {
        this.jsonSerializerStrategy = Ensure.notNull(strategy, "strategy");
    }

    public static class Builder {

        private String callbackBaseUrl;
        private byte[] tokenSecret;
        private Duration livenessTimeout = DEFAULT_LIVENESS_TIMEOUT;
        private Duration webhookRequestTimeout = DEFAULT_WEBHOOK_REQUEST_TIMEOUT;
        private Duration wakeConfirmationTimeout = DEFAULT_WAKE_CONFIRMATION_TIMEOUT;
        private Duration deliveryFailureThreshold = DEFAULT_DELIVERY_FAILURE_THRESHOLD;
        private Duration tokenTtl = DEFAULT_TOKEN_TTL;
        private Duration tokenRefreshThreshold = DEFAULT_TOKEN_REFRESH_THRESHOLD;
        private Duration gcSweepInterval = DEFAULT_GC_SWEEP_INTERVAL;
        private JsonSerializerStrategy jsonSerializerStrategy = DEFAULT_JSON_SERIALIZER_STRATEGY;

        public Builder(String callbackBaseUrl) {
            this.callbackBaseUrl = Ensure.notNullOrEmpty(callbackBaseUrl, "callbackBaseUrl");
        }

        /**
         * Reads {@code jstreamwake.*} properties. Durations are ISO-8601, e.g. {@code PT45S}.
         */
        public static Builder fromProperties(Properties properties) {
            String callbackBaseUrl = properties.getProperty(PROPERTY_PREFIX + "callback-base-url");
            if (Strings.isNullOrEmpty(callbackBaseUrl)) {
                throw new IllegalArgumentException(PROPERTY_PREFIX + "callback-base-url is required");
            }
            Builder builder = new Builder(callbackBaseUrl);
            String secret = properties.getProperty(PROPERTY_PREFIX + "token-secret");
            if (!Strings.isNullOrEmpty(secret)) {
                builder.withTokenSecret(secret.getBytes(StandardCharsets.UTF_8));
            }
            builder.livenessTimeout = duration(properties, "liveness-timeout", builder.livenessTimeout);
            builder.webhookRequestTimeout = duration(properties, "webhook-request-timeout", builder.webhookRequestTimeout);
            builder.wakeConfirmationTimeout = duration(properties, "wake-confirmation-timeout", builder.wakeConfirmationTimeout);
            builder.deliveryFailureThreshold = duration(properties, "delivery-failure-threshold", builder.deliveryFailureThreshold);
            builder.tokenTtl = duration(properties, "token-ttl", builder.tokenTtl);
            builder.tokenRefreshThreshold = duration(properties, "token-refresh-threshold", builder.tokenRefreshThreshold);
            builder.gcSweepInterval = duration(properties, "gc-sweep-interval", builder.gcSweepInterval);
            return builder;
        }

        private static Duration duration(Properties properties, String key, Duration defaultValue) {
            String value = properties.getProperty(PROPERTY_PREFIX + key);
            if (Strings.isNullOrEmpty(value)) {
                return defaultValue;
            }
            try {
                return Duration.parse(value.trim());
            } catch (RuntimeException e) {
                throw new IllegalArgumentException(PROPERTY_PREFIX + key + " is not an ISO-8601 duration: " + value, e);
            }
        }

        public Builder withTokenSecret(byte[] tokenSecret) {
            this.tokenSecret = Ensure.notNull(tokenSecret, "tokenSecret");
            return this;
        }

        public Builder withLivenessTimeout(Duration livenessTimeout) {
            this.livenessTimeout = livenessTimeout;
            return this;
        }

        public Builder withWebhookRequestTimeout(Duration webhookRequestTimeout) {
            this.webhookRequestTimeout = webhookRequestTimeout;
            return this;
        }

        public Builder withWakeConfirmationTimeout(Duration wakeConfirmationTimeout) {
            this.wakeConfirmationTimeout = wakeConfirmationTimeout;
            return this;
        }

        public Builder withDeliveryFailureThreshold(Duration deliveryFailureThreshold) {
            this.deliveryFailureThreshold = deliveryFailureThreshold;
            return this;
        }

        public Builder withTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
            return this;
        }

        public Builder withTokenRefreshThreshold(Duration tokenRefreshThreshold) {
            this.tokenRefreshThreshold = tokenRefreshThreshold;
            return this;
        }

        public Builder withGcSweepInterval(Duration gcSweepInterval) {
            this.gcSweepInterval = gcSweepInterval;
            return this;
        }

        public Builder withJsonSerializerStrategy(JsonSerializerStrategy jsonSerializerStrategy) {
            Ensure.notNull(jsonSerializerStrategy, "jsonSerializerStrategy");
            this.jsonSerializerStrategy = jsonSerializerStrategy;
            return this;
        }

        public StreamWakeSettings build() {
            StreamWakeSettings settings = new StreamWakeSettings();
            settings.setCallbackBaseUrl(callbackBaseUrl);
            settings.setTokenSecret(tokenSecret == null ? randomSecret() : tokenSecret);
            settings.setLivenessTimeout(livenessTimeout);
            settings.setWebhookRequestTimeout(webhookRequestTimeout);
            settings.setWakeConfirmationTimeout(wakeConfirmationTimeout);
            settings.setDeliveryFailureThreshold(deliveryFailureThreshold);
            settings.setTokenTtl(tokenTtl);
            settings.setTokenRefreshThreshold(tokenRefreshThreshold);
            settings.setGcSweepInterval(gcSweepInterval);
            settings.setJsonSerializerStrategy(jsonSerializerStrategy);
            return settings;
        }

        private static byte[] randomSecret() {
            byte[] secret = new byte[32];
            new SecureRandom().nextBytes(secret);
            return secret;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("callbackBaseUrl", callbackBaseUrl)
            .add("livenessTimeout", livenessTimeout)
            .add("webhookRequestTimeout", webhookRequestTimeout)
            .add("wakeConfirmationTimeout", wakeConfirmationTimeout)
            .add("deliveryFailureThreshold", deliveryFailureThreshold)
            .add("tokenTtl", tokenTtl)
            .add("tokenRefreshThreshold", tokenRefreshThreshold)
            .add("gcSweepInterval", gcSweepInterval)
            .toString();
    }
}
