package dev.relaygate.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.relaygate.domain.valueobject.ProviderResponse;
import dev.relaygate.domain.valueobject.RoutingDecision;
import dev.relaygate.service.GatewayService.ChatResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record ChatResponse(boolean success, ChatData data,
                           @JsonProperty("routing_info") RoutingInfo routingInfo) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChatData(String content, String provider, String model, boolean cached, Double similarity,
                           Usage usage, @JsonProperty("latency_ms") long latencyMs,
                           BigDecimal cost, @JsonProperty("job_id") UUID jobId) {

        public static ChatData from(ChatResult result) {
            ProviderResponse r = result.response();
            return new ChatData(r.content(), r.provider(), r.model(), result.cached(), result.similarity(),
                    new Usage(r.promptTokens(), r.completionTokens()),
                    r.latency() != null ? r.latency().toMillis() : 0, result.cost(), result.jobId());
        }
    }

    public record Usage(@JsonProperty("prompt_tokens") long promptTokens,
                        @JsonProperty("completion_tokens") long completionTokens) {}

    public record RoutingInfo(@JsonProperty("selected_provider") String selectedProvider,
                              @JsonProperty("selected_model") String selectedModel,
                              @JsonProperty("cost_estimate") BigDecimal costEstimate,
                              String reasoning,
                              @JsonProperty("matched_rules") List<String> matchedRules) {

        public static RoutingInfo from(RoutingDecision decision) {
            return new RoutingInfo(decision.provider(), decision.model(), decision.estimatedCost(),
                    decision.reasoningText(), decision.matchedRules());
        }
    }

    public static ChatResponse from(ChatResult result) {
        return new ChatResponse(true, ChatData.from(result), RoutingInfo.from(result.routing()));
    }
}
