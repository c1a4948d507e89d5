package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the error taxonomy. Each subclass fixes an HTTP status and a stable
 * type slug; {@link GlobalExceptionHandler} renders them uniformly. Extra
 * caller-safe properties (hints, amounts) travel in {@link #properties()}.
 */
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String type;
    private final String title;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    protected GatewayException(HttpStatus status, String type, String title, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.type = type;
        this.title = title;
    }

    protected GatewayException(HttpStatus status, String type, String title, String message) {
        this(status, type, title, message, null);
    }

    protected void property(String key, Object value) {
        properties.put(key, value);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }
}
