package dev.relaygate.steering;

import java.util.List;

/**
 * Outcome of one evaluation pass.
 *
 * @param defaultsApplied true when no rule produced a routing or reject decision
 * @param halted          true when a matched rule with {@code continue=false} stopped the pass
 */
public record EvaluationResult(List<RuleResult> results, EvaluationContext context,
                               boolean defaultsApplied, boolean halted) {

    public List<RuleResult> matchedRules() {
        return results.stream().filter(RuleResult::matched).toList();
    }
}
