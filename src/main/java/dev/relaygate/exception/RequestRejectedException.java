package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

/** A steering rule rejected the request; message and status are surfaced verbatim. */
public class RequestRejectedException extends GatewayException {

    public RequestRejectedException(String message, int status) {
        super(resolve(status), "rejected", "Request Rejected", message);
    }

    private static HttpStatus resolve(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved : HttpStatus.BAD_REQUEST;
    }
}
