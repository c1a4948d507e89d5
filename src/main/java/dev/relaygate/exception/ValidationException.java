package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "validation", "Invalid Request", message);
    }

    public static ValidationException missingFields(List<String> required) {
        ValidationException e = new ValidationException("Missing required fields");
        e.property("required", required);
        return e;
    }

    /** Adds a caller hint such as {@code validTypes} or {@code validPeriods}. */
    public ValidationException hint(String key, Object value) {
        property(key, value);
        return this;
    }
}
