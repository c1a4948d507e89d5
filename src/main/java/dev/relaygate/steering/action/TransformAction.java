package dev.relaygate.steering.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.relaygate.steering.EvaluationContext;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites an existing field. Append/prepend work on strings (concatenation)
 * and arrays (element insert); on anything else they leave the field alone.
 */
public record TransformAction(String field, Operation operation, JsonNode value) implements Action {

    public enum Operation {
        REPLACE, APPEND, PREPEND, DELETE;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Operation fromWire(String value) {
            for (Operation op : values()) {
                if (op.wireName().equalsIgnoreCase(value)) return op;
            }
            throw new IllegalArgumentException("Unknown transform operation: " + value);
        }
    }

    public TransformAction {
        if (field == null || field.isBlank()) throw new IllegalArgumentException("transform action needs a field");
        if (operation == null) throw new IllegalArgumentException("transform action needs an operation");
    }

    @Override
    public String typeName() {
        return ActionType.TRANSFORM.wireName();
    }

    @Override
    public boolean applyTo(EvaluationContext context) {
        Optional<JsonNode> current = context.get(field);
        switch (operation) {
            case REPLACE -> {
                context.set(field, value);
                return true;
            }
            case DELETE -> {
                return context.remove(field);
            }
            case APPEND, PREPEND -> {
                if (current.isEmpty()) return false;
                JsonNode existing = current.get();
                boolean append = operation == Operation.APPEND;
                if (existing.isTextual() && value != null && value.isTextual()) {
                    String updated = append ? existing.textValue() + value.textValue()
                            : value.textValue() + existing.textValue();
                    context.set(field, TextNode.valueOf(updated));
                    return true;
                }
                if (existing.isArray()) {
                    context.set(field, combine((ArrayNode) existing, value, append));
                    return true;
                }
                return false;
            }
        }
        return false;
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("field", field);
        params.put("operation", operation.wireName());
        if (value != null) params.put("value", value);
        return params;
    }

    private static ArrayNode combine(ArrayNode existing, JsonNode value, boolean append) {
        ArrayNode added = JsonNodeFactory.instance.arrayNode();
        if (value != null && value.isArray()) added.addAll((ArrayNode) value);
        else if (value != null) added.add(value);
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        if (append) {
            result.addAll(existing);
            result.addAll(added);
        } else {
            result.addAll(added);
            result.addAll(existing);
        }
        return result;
    }
}
