package com.eventfullyengineered.jstreamwake.streams;

import com.google.common.base.Preconditions;

import java.util.Comparator;

/**
 * Helpers for stream offsets. Offsets are opaque strings; {@link #BEFORE_BEGINNING} sorts before every other offset.
 */
public final class Offsets {

    /**
     * Offset meaning nothing has been processed yet.
     */
    public static final String BEFORE_BEGINNING = "-1";

    /**
     * Orders {@link #BEFORE_BEGINNING} first, then shorter offsets before longer ones, then lexicographically.
     * Fixed-width offsets compare lexicographically and decimal sequence numbers compare numerically.
     */
    public static final Comparator<String> DEFAULT_COMPARATOR = Offsets::compare;

    private Offsets() {
        // statics only
    }

    public static int compare(String a, String b) {
        Preconditions.checkNotNull(a, "a");
        Preconditions.checkNotNull(b, "b");
        boolean aBefore = BEFORE_BEGINNING.equals(a);
        boolean bBefore = BEFORE_BEGINNING.equals(b);
        if (aBefore || bBefore) {
            return Boolean.compare(bBefore, aBefore);
        }
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    public static boolean isAfter(Comparator<String> comparator, String offset, String other) {
        return comparator.compare(offset, other) > 0;
    }
}
