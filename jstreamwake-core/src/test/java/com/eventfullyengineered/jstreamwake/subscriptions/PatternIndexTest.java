package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternIndexTest {

    private static Subscription subscription(String id, String pattern) {
        return new Subscription(id, pattern, "http://localhost/hook", "whsec_x", null);
    }

    private final PatternIndex index = PatternIndex.build(ImmutableList.of(
        subscription("exact", "/agents/t1"),
        subscription("star", "/agents/*"),
        subscription("deep", "/agents/**"),
        subscription("inbox", "/*/t1/inbox"),
        subscription("all", "/**")));

    @Test
    void shouldResolveLiteralStarAndDoubleStarPatterns() {
        assertEquals(ImmutableSet.of("exact", "star", "deep", "all"), index.affected("/agents/t1"));
    }

    @Test
    void shouldFollowBothLiteralAndWildcardBranches() {
        assertEquals(ImmutableSet.of("inbox", "deep", "all"), index.affected("/agents/t1/inbox"));
    }

    @Test
    void unmatchedPathShouldOnlyHitCatchAll() {
        assertEquals(ImmutableSet.of("all"), index.affected("/other/stream"));
    }

    @Test
    void emptyIndexShouldMatchNothing() {
        assertTrue(PatternIndex.EMPTY.affected("/agents/t1").isEmpty());
    }
}
