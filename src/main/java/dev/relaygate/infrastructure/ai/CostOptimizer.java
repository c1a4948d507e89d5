package dev.relaygate.infrastructure.ai;

import dev.relaygate.config.RoutingProperties;
import dev.relaygate.domain.enums.OptimizationStrategy;
import dev.relaygate.domain.enums.ProviderStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Cost estimation and model scoring.
 *
 * <p>Tokens are estimated at four characters each. A candidate's score is the
 * strategy-weighted sum of accuracy (x100), speed (fast 100, medium 75, slow 50),
 * reliability ({@code (1 - errorRate) x 100}) and cost headroom: +50 when within
 * {@code maxCost}, otherwise relative cheapness among the candidates.
 */
@Component
public class CostOptimizer {

    private static final int CHARS_PER_TOKEN = 4;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int SCALE = 6;

    private final ProviderCatalog catalog;
    private final ProviderHealthTracker health;
    private final ProviderClientRegistry clients;
    private final RoutingProperties properties;

    public CostOptimizer(ProviderCatalog catalog, ProviderHealthTracker health, ProviderClientRegistry clients,
                         RoutingProperties properties) {
        this.catalog = catalog;
        this.health = health;
        this.clients = clients;
        this.properties = properties;
    }

    public record ScoredModel(ModelSpec model, double score, BigDecimal estimatedCost) {}

    public long estimateTokens(String prompt) {
        if (prompt == null || prompt.isEmpty()) return 1;
        return Math.max(1, (prompt.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    public BigDecimal estimateCost(String provider, String model, String prompt) {
        return costOf(provider, model, estimateTokens(prompt));
    }

    public BigDecimal costOf(String provider, String model, long tokens) {
        return catalog.pricePer1k(provider, model)
                .multiply(BigDecimal.valueOf(tokens))
                .divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
    }

    public boolean isHealthy(String provider) {
        ProviderHealth h = health.health(provider);
        return h.status() != ProviderStatus.UNHEALTHY && h.healthScore() >= properties.healthThreshold();
    }

    /**
     * Best available, healthy model offering {@code capability} whose estimated cost fits
     * {@code maxCost}. Ties keep catalog order.
     */
    public Optional<ScoredModel> best(String capability, String prompt, BigDecimal maxCost) {
        return rank(capability, prompt, maxCost).stream().findFirst();
    }

    public List<ScoredModel> rank(String capability, String prompt, BigDecimal maxCost) {
        List<ModelSpec> candidates = catalog.modelsWithCapability(capability).stream()
                .filter(m -> clients.isAvailable(m.provider()))
                .filter(m -> isHealthy(m.provider()))
                .toList();
        BigDecimal mostExpensive = candidates.stream()
                .map(m -> estimateCost(m.provider(), m.name(), prompt))
                .max(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);
        OptimizationStrategy strategy = properties.strategy();
        return candidates.stream()
                .map(m -> {
                    BigDecimal cost = estimateCost(m.provider(), m.name(), prompt);
                    return new ScoredModel(m, score(m, cost, maxCost, mostExpensive, strategy), cost);
                })
                .filter(s -> maxCost == null || s.estimatedCost().compareTo(maxCost) <= 0)
                .sorted(Comparator.comparingDouble(ScoredModel::score).reversed())
                .toList();
    }

    double score(ModelSpec model, BigDecimal cost, BigDecimal maxCost, BigDecimal mostExpensive,
                 OptimizationStrategy strategy) {
        double accuracy = model.accuracy() * 100;
        double speed = model.speed().score();
        double reliability = (1 - health.health(model.provider()).errorRate()) * 100;
        double costScore;
        if (maxCost != null) {
            costScore = cost.compareTo(maxCost) <= 0 ? 50 : -cost.subtract(maxCost).doubleValue() * 10;
        } else if (mostExpensive.signum() == 0) {
            costScore = 100;
        } else {
            costScore = 100 * (1 - cost.divide(mostExpensive, 6, RoundingMode.HALF_UP).doubleValue());
        }
        return strategy.accuracyWeight() * accuracy
                + strategy.speedWeight() * speed
                + strategy.reliabilityWeight() * reliability
                + strategy.costWeight() * costScore;
    }
}
