package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

public class QueueFullException extends GatewayException {

    public QueueFullException(int maxSize) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "queue-full", "Queue Full", "Queue is full");
        property("max_size", maxSize);
    }
}
