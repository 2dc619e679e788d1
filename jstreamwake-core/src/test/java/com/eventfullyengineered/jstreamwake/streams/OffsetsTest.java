package com.eventfullyengineered.jstreamwake.streams;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OffsetsTest {

    @Test
    void beforeBeginningShouldSortFirst() {
        assertTrue(Offsets.compare("-1", "0") < 0);
        assertTrue(Offsets.compare("0000", "-1") > 0);
        assertEquals(0, Offsets.compare("-1", "-1"));
    }

    @Test
    void decimalSequenceNumbersShouldCompareNumerically() {
        assertTrue(Offsets.compare("9", "10") < 0);
        assertTrue(Offsets.compare("100", "99") > 0);
    }

    @Test
    void fixedWidthOffsetsShouldCompareLexicographically() {
        assertTrue(Offsets.compare("0000000000000001_0000000000000005", "0000000000000002_0000000000000000") < 0);
        assertEquals(0, Offsets.compare("000a", "000a"));
    }

    @Test
    void isAfterShouldBeStrict() {
        assertTrue(Offsets.isAfter(Offsets.DEFAULT_COMPARATOR, "1", "0"));
        assertFalse(Offsets.isAfter(Offsets.DEFAULT_COMPARATOR, "1", "1"));
        assertFalse(Offsets.isAfter(Offsets.DEFAULT_COMPARATOR, "-1", "0"));
    }
}
