package dev.relaygate.steering.action;

import dev.relaygate.steering.EvaluationContext;

import java.util.LinkedHashMap;
import java.util.Map;

/** Sets the routing target. A later route in the same pass overwrites an earlier one. */
public record RouteAction(String provider, String model) implements Action {

    public RouteAction {
        if ((provider == null || provider.isBlank()) && (model == null || model.isBlank()))
            throw new IllegalArgumentException("route action needs a provider or a model");
    }

    @Override
    public String typeName() {
        return ActionType.ROUTE.wireName();
    }

    @Override
    public boolean applyTo(EvaluationContext context) {
        return context.route(provider, model);
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (provider != null) params.put("provider", provider);
        if (model != null) params.put("model", model);
        return params;
    }
}
