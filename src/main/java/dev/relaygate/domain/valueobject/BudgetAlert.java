package dev.relaygate.domain.valueobject;

import dev.relaygate.domain.enums.AlertAction;

import java.util.List;

/**
 * Threshold (percent of the limit) and what should happen once it is crossed.
 */
public record BudgetAlert(double threshold, List<AlertAction> actions) {
    public BudgetAlert {
        if (threshold <= 0 || threshold > 100)
            throw new IllegalArgumentException("Alert threshold must be within (0,100] but was " + threshold);
        actions = actions == null || actions.isEmpty() ? List.of(AlertAction.NOTIFY) : List.copyOf(actions);
    }
}
