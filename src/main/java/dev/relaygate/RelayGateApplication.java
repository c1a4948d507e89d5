package dev.relaygate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * RelayGate: AI request gateway between client applications and LLM providers.
 *
 * <p>Architecture overview:
 * <pre>
 * Client → AiController → GatewayService
 *   → SemanticCache (hit → respond)
 *   → ProviderRouter: SteeringService → BudgetTracker check → CostOptimizer
 *   → direct ProviderClient call | RequestDispatcher lane
 *   → BudgetTracker.recordUsage → SemanticCache.store → respond
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Steering rules live in a YAML file and hot-reload without a restart</li>
 *   <li>Budget usage is written under row locks over the whole budget lineage</li>
 *   <li>Per-provider worker lanes are the only concurrency limit toward upstreams</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class RelayGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayGateApplication.class, args);
    }
}
