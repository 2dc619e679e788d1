package com.eventfullyengineered.jstreamwake.consumers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * A stream path and an offset within it.
 */
public final class StreamOffset {

    private final String path;
    private final String offset;

    @JsonCreator
    public StreamOffset(@JsonProperty("path") String path, @JsonProperty("offset") String offset) {
        this.path = path;
        this.offset = offset;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("offset")
    public String getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamOffset)) {
            return false;
        }
        StreamOffset that = (StreamOffset) o;
        return Objects.equals(path, that.path) && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, offset);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("path", path)
            .add("offset", offset)
            .toString();
    }
}
