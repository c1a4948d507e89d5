package dev.relaygate.queue;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.relaygate.domain.valueobject.ProviderResponse;

import java.util.Locale;

/** Outcome of one request inside a queued job. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubRequestResult(int index, Status status, ProviderResponse payload, String error, Boolean retryable) {

    public enum Status {
        PENDING, SUCCESS, ERROR, CANCELLED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static SubRequestResult pending(int index) {
        return new SubRequestResult(index, Status.PENDING, null, null, null);
    }

    public static SubRequestResult success(int index, ProviderResponse payload) {
        return new SubRequestResult(index, Status.SUCCESS, payload, null, null);
    }

    public static SubRequestResult error(int index, String message, boolean retryable) {
        return new SubRequestResult(index, Status.ERROR, null, message, retryable);
    }

    public static SubRequestResult cancelled(int index) {
        return new SubRequestResult(index, Status.CANCELLED, null, "Cancelled", null);
    }

    /** Still to be attempted: never run, or failed transiently. */
    public boolean isOutstanding() {
        return status == Status.PENDING || status == Status.ERROR && Boolean.TRUE.equals(retryable);
    }
}
