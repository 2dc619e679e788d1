package com.eventfullyengineered.jstreamwake.streams;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A change on a single stream as reported by the storage engine.
 */
public final class StreamEvent {

    private final StreamEventType type;
    private final String path;
    private final String tail;

    public StreamEvent(StreamEventType type, String path, String tail) {
        this.type = Preconditions.checkNotNull(type, "type");
        this.path = Preconditions.checkNotNull(path, "path");
        this.tail = Preconditions.checkNotNull(tail, "tail");
    }

    public static StreamEvent created(String path, String tail) {
        return new StreamEvent(StreamEventType.CREATED, path, tail);
    }

    public static StreamEvent appended(String path, String tail) {
        return new StreamEvent(StreamEventType.APPENDED, path, tail);
    }

    public static StreamEvent deleted(String path) {
        return new StreamEvent(StreamEventType.DELETED, path, Offsets.BEFORE_BEGINNING);
    }

    public StreamEventType getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    public String getTail() {
        return tail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamEvent)) {
            return false;
        }
        StreamEvent that = (StreamEvent) o;
        return type == that.type && path.equals(that.path) && tail.equals(that.tail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, path, tail);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("type", type)
            .add("path", path)
            .add("tail", tail)
            .toString();
    }
}
