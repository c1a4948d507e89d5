package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends GatewayException {

    public NotFoundException(String resource, Object id) {
        super(HttpStatus.NOT_FOUND, "not-found", "Not Found", "%s not found: %s".formatted(resource, id));
    }
}
