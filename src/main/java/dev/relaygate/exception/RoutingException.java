package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

public class RoutingException extends GatewayException {

    public RoutingException(String message) {
        super(HttpStatus.BAD_REQUEST, "routing", "No Eligible Provider", message);
    }
}
