package com.eventfullyengineered.jstreamwake.infrastructure.serialization;

public class SerializationException extends RuntimeException {

    private static final long serialVersionUID = -3290716478165232581L;

    public SerializationException(Throwable cause) {
        super(cause);
    }
}
