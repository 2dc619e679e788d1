package com.eventfullyengineered.jstreamwake.streams;

import io.reactivex.observers.TestObserver;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryStreamStorageTest {

    private final InMemoryStreamStorage storage = new InMemoryStreamStorage();

    @Test
    void tailOfUnknownStreamShouldBeBeforeBeginning() {
        assertEquals(Offsets.BEFORE_BEGINNING, storage.currentTail("/nope"));
    }

    @Test
    void appendShouldAdvanceTailToLastItem() {
        assertEquals("0", storage.append("/agents/t1", "a"));
        assertEquals("2", storage.append("/agents/t1", "b", "c"));
        assertEquals("2", storage.currentTail("/agents/t1"));
        assertEquals(3, storage.read("/agents/t1").size());
    }

    @Test
    void shouldRaiseEventsInOrder() {
        TestObserver<StreamEvent> observer = new TestObserver<>();
        storage.notifier().subscribe(observer);

        storage.append("/s", "a");
        storage.deleteStream("/s");

        observer.assertValues(
            StreamEvent.created("/s", "-1"),
            StreamEvent.appended("/s", "0"),
            StreamEvent.deleted("/s"));
    }

    @Test
    void creatingExistingStreamShouldBeNoop() {
        assertTrue(storage.createStream("/s"));
        assertFalse(storage.createStream("/s"));
        assertEquals(Offsets.BEFORE_BEGINNING, storage.currentTail("/s"));
    }

    @Test
    void pathsMustBeAbsolute() {
        assertThrows(IllegalArgumentException.class, () -> storage.append("relative", "a"));
    }

    @Test
    void streamPathsShouldListExistingStreams() {
        storage.createStream("/a");
        storage.createStream("/b");
        storage.deleteStream("/a");

        assertEquals("[/b]", storage.streamPaths().toString());
    }
}
