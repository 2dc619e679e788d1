package com.eventfullyengineered.jstreamwake.infrastructure;

import java.time.Duration;

public final class Ensure {

    private Ensure() {
        // static utility
    }

    public static boolean isNullOrEmpty(String string) {
        return string == null || string.isEmpty();
    }

    public static <T> T notNull(T t, String argumentName) {
        if (t == null) {
            throw new NullPointerException(argumentName + " must not be null.");
        }
        return t;
    }

    public static String notNullOrEmpty(String argument, String argumentName) {
        if (isNullOrEmpty(argument)) {
            throw new IllegalArgumentException(argumentName + " must not be null or empty.");
        }
        return argument;
    }

    public static Duration positive(Duration duration, String argumentName) {
        notNull(duration, argumentName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(argumentName + " should be positive.");
        }
        return duration;
    }

    public static void nonnegative(long number, String argumentName) {
        if (number < 0) {
            throw new IllegalArgumentException(argumentName + " should be non negative.");
        }
    }

    /**
     * Ensures a stream path is absolute, i.e. starts with a '/'.
     */
    public static String streamPath(String path, String argumentName) {
        notNullOrEmpty(path, argumentName);
        if (path.charAt(0) != '/') {
            throw new IllegalArgumentException(argumentName + " must start with '/': " + path);
        }
        return path;
    }
}
