package com.eventfullyengineered.jstreamwake.streams;

/**
 * The parts of the append-only storage engine that wake notifications depend on.
 */
public interface StreamStorage {

    /**
     * Gets the tail of a stream.
     * @param path The stream path
     * @return the offset of the last appended item or {@link Offsets#BEFORE_BEGINNING} when the stream is empty or
     * does not exist
     */
    String currentTail(String path);

    /**
     * Compares two offsets of this storage.
     */
    default int compareOffsets(String a, String b) {
        return Offsets.compare(a, b);
    }

    /**
     * @return the paths of all existing streams
     */
    Iterable<String> streamPaths();

    /**
     * @return the notifier raising {@link StreamEvent}s for this storage
     */
    StreamStoreNotifier notifier();
}
