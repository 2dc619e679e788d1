package com.eventfullyengineered.jstreamwake.consumers;

import com.google.common.base.Preconditions;
import com.google.common.net.UrlEscapers;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Consumer ids are {@code {subscription_id}:{percent-encoded primary stream}}. The encoded path never contains a
 * ':' so the last ':' is always the delimiter. Ids must be looked up in their encoded form.
 */
public final class ConsumerIds {

    public static final char DELIMITER = ':';

    private ConsumerIds() {
        // statics only
    }

    public static String of(String subscriptionId, String primaryStream) {
        Preconditions.checkNotNull(subscriptionId, "subscriptionId");
        Preconditions.checkNotNull(primaryStream, "primaryStream");
        return subscriptionId + DELIMITER + encodePath(primaryStream);
    }

    public static String encodePath(String path) {
        // form escaping encodes '/' and ':' but writes spaces as '+'
        return UrlEscapers.urlFormParameterEscaper().escape(path).replace("+", "%20");
    }

    public static String subscriptionIdOf(String consumerId) {
        int delimiter = delimiterOf(consumerId);
        return consumerId.substring(0, delimiter);
    }

    public static String primaryStreamOf(String consumerId) {
        int delimiter = delimiterOf(consumerId);
        return URLDecoder.decode(consumerId.substring(delimiter + 1).replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static int delimiterOf(String consumerId) {
        Preconditions.checkNotNull(consumerId, "consumerId");
        int delimiter = consumerId.lastIndexOf(DELIMITER);
        Preconditions.checkArgument(delimiter > 0, "Not a consumer id: %s", consumerId);
        return delimiter;
    }
}
