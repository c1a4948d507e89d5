package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends GatewayException {

    public PermissionDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, "permission-denied", "Permission Denied", message);
    }
}
