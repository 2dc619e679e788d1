package com.eventfullyengineered.jstreamwake.consumers;

public class ConsumerGoneException extends RuntimeException {

    private static final long serialVersionUID = 8841029563340180337L;

    private final String consumerId;

    public ConsumerGoneException(String consumerId) {
        super("Consumer instance " + consumerId + " not found");
        this.consumerId = consumerId;
    }

    public String getConsumerId() {
        return consumerId;
    }
}
