package com.eventfullyengineered.jstreamwake.subscriptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobPatternTest {

    @Test
    void singleStarShouldMatchExactlyOneSegment() {
        assertTrue(GlobPattern.matches("/agents/*", "/agents/t1"));
        assertFalse(GlobPattern.matches("/agents/*", "/agents"));
        assertFalse(GlobPattern.matches("/agents/*", "/agents/t1/inbox"));
    }

    @Test
    void doubleStarShouldMatchZeroOrMoreSegments() {
        assertTrue(GlobPattern.matches("/agents/**", "/agents"));
        assertTrue(GlobPattern.matches("/agents/**", "/agents/t1"));
        assertTrue(GlobPattern.matches("/agents/**", "/agents/t1/inbox"));
        assertTrue(GlobPattern.matches("/**", "/anything/at/all"));
    }

    @Test
    void interiorDoubleStarShouldMatchAnyDepth() {
        assertTrue(GlobPattern.matches("/agents/**/inbox", "/agents/inbox"));
        assertTrue(GlobPattern.matches("/agents/**/inbox", "/agents/t1/inbox"));
        assertTrue(GlobPattern.matches("/agents/**/inbox", "/agents/a/b/c/inbox"));
        assertFalse(GlobPattern.matches("/agents/**/inbox", "/agents/t1/outbox"));
    }

    @Test
    void literalsShouldMatchExactly() {
        assertTrue(GlobPattern.matches("/agents/t1", "/agents/t1"));
        assertFalse(GlobPattern.matches("/agents/t1", "/agents/t2"));
        assertFalse(GlobPattern.matches("/agents/t1", "/Agents/t1"));
    }

    @Test
    void encodedStarShouldBeAWildcard() {
        assertEquals("/agents/*", GlobPattern.normalize("/agents/%2A"));
        assertEquals("/agents/*", GlobPattern.normalize("/agents/%2a"));
        assertTrue(GlobPattern.matches("/agents/%2A", "/agents/t1"));
    }

    @Test
    void normalizeShouldDecodeLiteralsAndKeepPlus() {
        assertEquals("/a b/c+d", GlobPattern.normalize("a%20b/c+d"));
    }

    @Test
    void shouldKnowWhetherItNeedsScanning() {
        assertTrue(GlobPattern.compile("/a/**").hasAnySegments());
        assertFalse(GlobPattern.compile("/a/*/b").hasAnySegments());
    }
}
