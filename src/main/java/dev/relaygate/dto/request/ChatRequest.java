package dev.relaygate.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.relaygate.domain.enums.JobPriority;
import dev.relaygate.domain.valueobject.AiRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.UUID;

public record ChatRequest(
        @NotBlank String prompt,
        JsonNode context,
        @JsonProperty("routing_preferences") RoutingPreferences routingPreferences,
        @JsonProperty("cost_constraints") @Valid CostConstraints costConstraints,
        @JsonProperty("user_id") String userId,
        @JsonProperty("system_source") String systemSource
) {
    public record RoutingPreferences(String provider, String model, JobPriority priority, Boolean queued,
                                     String capability) {}

    public record CostConstraints(@JsonProperty("max_cost") @PositiveOrZero BigDecimal maxCost,
                                  @JsonProperty("budget_id") UUID budgetId) {}

    public AiRequest toAiRequest() {
        AiRequest.RoutingPreferences prefs = routingPreferences == null ? null
                : new AiRequest.RoutingPreferences(routingPreferences.provider(), routingPreferences.model(),
                routingPreferences.priority(), routingPreferences.queued(), routingPreferences.capability());
        AiRequest.CostConstraints constraints = costConstraints == null ? null
                : new AiRequest.CostConstraints(costConstraints.maxCost(), costConstraints.budgetId());
        return new AiRequest(null, prompt, context, prefs, constraints, userId, systemSource);
    }
}
