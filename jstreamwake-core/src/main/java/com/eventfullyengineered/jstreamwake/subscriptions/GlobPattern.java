package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A compiled path glob. {@code *} matches exactly one segment, {@code **} matches zero or more segments and any
 * other segment matches literally. {@code %2A} is treated as {@code *}.
 */
public final class GlobPattern {

    public static final String SINGLE_SEGMENT = "*";
    public static final String ANY_SEGMENTS = "**";

    private static final Splitter SEGMENT_SPLITTER = Splitter.on('/').omitEmptyStrings();
    private static final Pattern ENCODED_STAR = Pattern.compile("%2[aA]");

    private final String pattern;
    private final ImmutableList<String> segments;
    private final boolean anySegments;

    private GlobPattern(String pattern, ImmutableList<String> segments) {
        this.pattern = pattern;
        this.segments = segments;
        this.anySegments = segments.contains(ANY_SEGMENTS);
    }

    /**
     * Compiles a pattern, normalizing {@code %2A} to {@code *} and decoding any other percent-escapes in literals.
     */
    public static GlobPattern compile(String pattern) {
        String normalized = normalize(pattern);
        return new GlobPattern(normalized, ImmutableList.copyOf(SEGMENT_SPLITTER.split(normalized)));
    }

    public static String normalize(String pattern) {
        Preconditions.checkNotNull(pattern, "pattern");
        String starred = ENCODED_STAR.matcher(pattern).replaceAll("*");
        // '+' is literal in a path, unlike in a form
        String decoded = URLDecoder.decode(starred.replace("+", "%2B"), StandardCharsets.UTF_8);
        return decoded.startsWith("/") ? decoded : "/" + decoded;
    }

    public static List<String> segmentsOf(String path) {
        return SEGMENT_SPLITTER.splitToList(path);
    }

    public static boolean matches(String pattern, String path) {
        return compile(pattern).matches(path);
    }

    public boolean matches(String path) {
        return matches(segmentsOf(path));
    }

    public boolean matches(List<String> pathSegments) {
        return matchFrom(0, pathSegments, 0);
    }

    private boolean matchFrom(int patternIndex, List<String> path, int pathIndex) {
        while (patternIndex < segments.size()) {
            String segment = segments.get(patternIndex);
            if (ANY_SEGMENTS.equals(segment)) {
                // collapse consecutive '**'
                while (patternIndex + 1 < segments.size() && ANY_SEGMENTS.equals(segments.get(patternIndex + 1))) {
                    patternIndex++;
                }
                if (patternIndex == segments.size() - 1) {
                    return true;
                }
                for (int skip = pathIndex; skip <= path.size(); skip++) {
                    if (matchFrom(patternIndex + 1, path, skip)) {
                        return true;
                    }
                }
                return false;
            }
            if (pathIndex >= path.size()) {
                return false;
            }
            if (!SINGLE_SEGMENT.equals(segment) && !segment.equals(path.get(pathIndex))) {
                return false;
            }
            patternIndex++;
            pathIndex++;
        }
        return pathIndex == path.size();
    }

    public String getPattern() {
        return pattern;
    }

    public List<String> getSegments() {
        return segments;
    }

    /**
     * @return true when the pattern contains {@code **} and cannot be resolved segment by segment
     */
    public boolean hasAnySegments() {
        return anySegments;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
