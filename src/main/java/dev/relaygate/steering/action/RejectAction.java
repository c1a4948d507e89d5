package dev.relaygate.steering.action;

import dev.relaygate.steering.EvaluationContext;

import java.util.LinkedHashMap;
import java.util.Map;

public record RejectAction(String message, int status) implements Action {

    public static final String DEFAULT_MESSAGE = "Request rejected by steering rule";

    public RejectAction {
        if (message == null || message.isBlank()) message = DEFAULT_MESSAGE;
        if (status == 0) status = 400;
        if (status < 400 || status > 599)
            throw new IllegalArgumentException("reject status must be a 4xx or 5xx code but was " + status);
    }

    @Override
    public String typeName() {
        return ActionType.REJECT.wireName();
    }

    @Override
    public boolean applyTo(EvaluationContext context) {
        return context.reject(message, status);
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("message", message);
        params.put("status", status);
        return params;
    }
}
