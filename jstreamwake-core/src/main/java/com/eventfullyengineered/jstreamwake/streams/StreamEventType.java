package com.eventfullyengineered.jstreamwake.streams;

public enum StreamEventType {

    /**
     * A stream was created. The tail is {@link Offsets#BEFORE_BEGINNING} unless the stream was created with data.
     */
    CREATED,

    /**
     * Data was appended and the tail advanced.
     */
    APPENDED,

    /**
     * The stream was deleted. The tail is {@link Offsets#BEFORE_BEGINNING}.
     */
    DELETED
}
