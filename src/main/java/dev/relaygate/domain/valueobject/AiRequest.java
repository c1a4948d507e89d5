package dev.relaygate.domain.valueobject;

import com.fasterxml.jackson.databind.JsonNode;
import dev.relaygate.domain.enums.JobPriority;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One inbound AI call. Immutable; lives for a single request/response cycle or one queued job.
 */
public record AiRequest(
        String id,
        String prompt,
        JsonNode context,
        RoutingPreferences routingPreferences,
        CostConstraints costConstraints,
        String userId,
        String systemSource
) {
    public AiRequest {
        if (prompt == null || prompt.isBlank()) throw new IllegalArgumentException("prompt is required");
        if (id == null) id = UUID.randomUUID().toString();
        if (context != null) context = context.deepCopy();
        if (routingPreferences == null) routingPreferences = RoutingPreferences.none();
        if (costConstraints == null) costConstraints = CostConstraints.none();
    }

    public static AiRequest of(String prompt) {
        return new AiRequest(null, prompt, null, null, null, null, null);
    }

    /** Same request with a different prompt, e.g. after a steering transform. */
    public AiRequest withPrompt(String newPrompt) {
        return new AiRequest(id, newPrompt, context, routingPreferences, costConstraints, userId, systemSource);
    }

    public boolean wantsQueue() {
        return Boolean.TRUE.equals(routingPreferences.queued()) || routingPreferences.priority() != null;
    }

    public record RoutingPreferences(String provider, String model, JobPriority priority, Boolean queued,
                                     String capability) {
        public static RoutingPreferences none() {
            return new RoutingPreferences(null, null, null, null, null);
        }
    }

    public record CostConstraints(BigDecimal maxCost, UUID budgetId) {
        public static CostConstraints none() {
            return new CostConstraints(null, null);
        }
    }
}
