package dev.relaygate.steering.action;

import dev.relaygate.steering.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** An action kind this build does not understand. Kept so rule files round-trip unchanged. */
public record UnsupportedAction(String type, Map<String, Object> params) implements Action {

    private static final Logger log = LoggerFactory.getLogger(UnsupportedAction.class);

    public UnsupportedAction {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    @Override
    public String typeName() {
        return type;
    }

    @Override
    public boolean applyTo(EvaluationContext context) {
        log.warn("Ignoring unsupported steering action type '{}'", type);
        return false;
    }
}
