package dev.relaygate.steering;

import java.util.List;

public record RuleResult(String ruleId, String ruleName, boolean matched, List<String> actionsApplied,
                         boolean continueEvaluation) {
}
