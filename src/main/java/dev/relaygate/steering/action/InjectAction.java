package dev.relaygate.steering.action;

import com.fasterxml.jackson.databind.JsonNode;
import dev.relaygate.steering.EvaluationContext;

import java.util.LinkedHashMap;
import java.util.Map;

/** Sets a field, creating the path if it does not exist yet. */
public record InjectAction(String field, JsonNode value) implements Action {

    public InjectAction {
        if (field == null || field.isBlank()) throw new IllegalArgumentException("inject action needs a field");
    }

    @Override
    public String typeName() {
        return ActionType.INJECT.wireName();
    }

    @Override
    public boolean applyTo(EvaluationContext context) {
        context.set(field, value);
        return true;
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("field", field);
        params.put("value", value);
        return params;
    }
}
