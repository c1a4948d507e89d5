package dev.relaygate.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.relaygate.config.RoutingProperties;
import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.enums.ScopeType;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.domain.valueobject.ConstraintCheck;
import dev.relaygate.domain.valueobject.RoutingDecision;
import dev.relaygate.exception.BudgetExceededException;
import dev.relaygate.exception.RequestRejectedException;
import dev.relaygate.exception.RoutingException;
import dev.relaygate.service.BudgetRegistry;
import dev.relaygate.service.BudgetTracker;
import dev.relaygate.steering.EvaluationContext;
import dev.relaygate.steering.EvaluationResult;
import dev.relaygate.steering.RuleResult;
import dev.relaygate.steering.SteeringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Picks the provider and model for one request.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Steering. A reject is surfaced verbatim; transforms may rewrite the prompt.</li>
 *   <li>Budget. The request's {@code maxCost} (or the estimated cost) is checked against the
 *       budget and all its ancestors. Failure is an error, never a silent downgrade.</li>
 *   <li>Health and cost. The steering choice stands unless its provider is unavailable or
 *       unhealthy, or it costs more than {@code maxCost}; only then does the optimizer pick.</li>
 *   <li>Reasoning. Each stage appends one line to the decision's trace.</li>
 * </ol>
 *
 * A caller's provider preference beats the rule set's default actions but never a matched rule.
 */
@Component
public class ProviderRouter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private final SteeringService steering;
    private final BudgetRegistry budgetRegistry;
    private final BudgetTracker budgetTracker;
    private final CostOptimizer optimizer;
    private final ProviderCatalog catalog;
    private final ProviderClientRegistry clients;
    private final RoutingProperties properties;
    private final ObjectMapper objectMapper;

    public ProviderRouter(SteeringService steering, BudgetRegistry budgetRegistry, BudgetTracker budgetTracker,
                          CostOptimizer optimizer, ProviderCatalog catalog, ProviderClientRegistry clients,
                          RoutingProperties properties, ObjectMapper objectMapper) {
        this.steering = steering;
        this.budgetRegistry = budgetRegistry;
        this.budgetTracker = budgetTracker;
        this.optimizer = optimizer;
        this.catalog = catalog;
        this.clients = clients;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public RoutingDecision route(AiRequest request) {
        List<String> reasoning = new ArrayList<>();

        // 1. Steering
        EvaluationResult evaluation = steering.evaluate(contextFor(request));
        EvaluationContext outcome = evaluation.context();
        Optional<EvaluationContext.Rejection> rejection = outcome.rejection();
        if (rejection.isPresent()) {
            log.info("Request {} rejected by steering: {}", request.id(), rejection.get().message());
            throw new RequestRejectedException(rejection.get().message(), rejection.get().status());
        }
        List<String> matched = evaluation.matchedRules().stream().map(RuleResult::ruleId).toList();
        String prompt = outcome.get("request.body.prompt")
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .orElse(request.prompt());

        AiRequest.RoutingPreferences prefs = request.routingPreferences();
        String provider = null;
        String model = null;
        Optional<EvaluationContext.Routing> routing = outcome.routing();
        if (routing.isPresent() && !(evaluation.defaultsApplied() && prefs.provider() != null)) {
            provider = routing.get().provider();
            model = routing.get().model();
            reasoning.add(evaluation.defaultsApplied()
                    ? "steering defaults routed to %s".formatted(label(provider, model))
                    : "steering rules %s routed to %s".formatted(matched, label(provider, model)));
        } else if (prefs.provider() != null) {
            provider = prefs.provider();
            model = prefs.model();
            reasoning.add("caller preferred %s".formatted(label(provider, model)));
        }
        if (provider != null && model == null) {
            model = catalog.defaultModel(provider).map(ModelSpec::name).orElse(null);
            if (model != null) reasoning.add("using default model %s of %s".formatted(model, provider));
        }

        BigDecimal maxCost = request.costConstraints().maxCost();
        BigDecimal estimate = optimizer.estimateCost(provider, model, prompt);

        // 2. Budget
        UUID budgetId = resolveBudget(request);
        if (budgetId != null) {
            BigDecimal requested = maxCost != null ? maxCost : estimate;
            ConstraintCheck check = budgetTracker.checkBudgetConstraints(budgetId, requested);
            if (!check.allowed()) {
                List<UUID> exceeded = check.hierarchyViolations().isEmpty()
                        ? List.of(budgetId) : check.violatingBudgetIds();
                log.info("Request {} blocked by budget {}: {}", request.id(), budgetId, check.reason());
                throw new BudgetExceededException(budgetId, check.remaining(), requested, exceeded);
            }
            reasoning.add("budget %s allows %s (remaining %s)".formatted(budgetId, requested, check.remaining()));
        }

        // 3. Health and cost
        String problem = hardConstraintFailure(provider, model, estimate, maxCost);
        if (problem != null) {
            String capability = prefs.capability() != null ? prefs.capability() : properties.defaultCapability();
            List<CostOptimizer.ScoredModel> ranked = optimizer.rank(capability, prompt, maxCost);
            if (ranked.isEmpty())
                throw new RoutingException("No eligible provider for capability '%s': %s".formatted(capability, problem));
            Optional<String> fallback = provider != null ? catalog.fallback(provider) : Optional.empty();
            Optional<CostOptimizer.ScoredModel> viaFallback = fallback.flatMap(f -> ranked.stream()
                    .filter(m -> m.model().provider().equals(f))
                    .findFirst());
            CostOptimizer.ScoredModel best = viaFallback.orElse(ranked.get(0));
            provider = best.model().provider();
            model = best.model().name();
            estimate = best.estimatedCost();
            reasoning.add(viaFallback.isPresent()
                    ? "fell back to %s because %s".formatted(label(provider, model), problem)
                    : "optimizer (%s) chose %s with score %.1f because %s".formatted(
                            properties.strategy().name().toLowerCase(Locale.ROOT), label(provider, model),
                            best.score(), problem));
        } else {
            reasoning.add("%s is healthy and within cost constraints".formatted(label(provider, model)));
        }

        RoutingDecision decision = new RoutingDecision(provider, model, estimate, reasoning, budgetId, prompt, matched);
        log.debug("Routed request {} to {}: {}", request.id(), label(provider, model), decision.reasoningText());
        return decision;
    }

    // ── Internal ───────────────────────────────────────────────────

    private String hardConstraintFailure(String provider, String model, BigDecimal estimate, BigDecimal maxCost) {
        if (provider == null) return "no provider was selected";
        if (!catalog.hasProvider(provider) || !clients.isAvailable(provider))
            return "provider %s is not available".formatted(provider);
        if (model == null) return "provider %s has no model configured".formatted(provider);
        if (!optimizer.isHealthy(provider)) return "provider %s is unhealthy".formatted(provider);
        if (maxCost != null && estimate.compareTo(maxCost) > 0)
            return "estimated cost %s exceeds max cost %s".formatted(estimate, maxCost);
        return null;
    }

    private UUID resolveBudget(AiRequest request) {
        if (request.costConstraints().budgetId() != null) return request.costConstraints().budgetId();
        if (request.userId() == null) return null;
        return budgetRegistry.findActiveForScope(ScopeType.USER, request.userId()).map(Budget::getId).orElse(null);
    }

    private EvaluationContext contextFor(AiRequest request) {
        ObjectNode body = objectMapper.createObjectNode().put("prompt", request.prompt());
        if (request.context() != null) body.set("context", request.context());
        ObjectNode req = objectMapper.createObjectNode()
                .put("id", request.id())
                .put("prompt", request.prompt())
                .put("method", "POST")
                .put("path", "/v1/ai/chat");
        req.set("body", body);
        req.set("routing_preferences", objectMapper.valueToTree(request.routingPreferences()));

        ObjectNode user = objectMapper.createObjectNode();
        if (request.userId() != null) user.put("id", request.userId());

        ObjectNode ctx = request.context() != null && request.context().isObject()
                ? ((ObjectNode) request.context()).deepCopy() : objectMapper.createObjectNode();
        if (!ctx.has("tokenCount")) ctx.put("tokenCount", optimizer.estimateTokens(request.prompt()));
        if (request.systemSource() != null) ctx.put("systemSource", request.systemSource());
        if (request.costConstraints().maxCost() != null) ctx.put("maxCost", request.costConstraints().maxCost());

        JsonNode organization = ctx.path("organization").isObject() ? ctx.get("organization") : null;
        return EvaluationContext.create(req, user, organization, ctx);
    }

    private static String label(String provider, String model) {
        return model != null ? provider + "/" + model : provider;
    }
}
