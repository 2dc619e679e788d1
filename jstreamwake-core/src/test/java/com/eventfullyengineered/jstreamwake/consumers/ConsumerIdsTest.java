package com.eventfullyengineered.jstreamwake.consumers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConsumerIdsTest {

    @Test
    void shouldPercentEncodePrimaryStream() {
        assertEquals("sub1:%2Fagents%2Ft1", ConsumerIds.of("sub1", "/agents/t1"));
    }

    @Test
    void shouldEncodeColonsAndSpacesInPath() {
        String id = ConsumerIds.of("sub1", "/a:b/c d");

        assertEquals("sub1:%2Fa%3Ab%2Fc%20d", id);
        assertEquals("/a:b/c d", ConsumerIds.primaryStreamOf(id));
    }

    @Test
    void lastColonShouldBeTheDelimiter() {
        String id = ConsumerIds.of("team:sub", "/x+y");

        assertEquals("team:sub", ConsumerIds.subscriptionIdOf(id));
        assertEquals("/x+y", ConsumerIds.primaryStreamOf(id));
    }

    @Test
    void shouldRejectIdsWithoutDelimiter() {
        assertThrows(IllegalArgumentException.class, () -> ConsumerIds.subscriptionIdOf("nope"));
    }
}
