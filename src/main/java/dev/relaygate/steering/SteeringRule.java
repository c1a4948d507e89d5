package dev.relaygate.steering;

import dev.relaygate.steering.action.Action;

import java.util.List;

/**
 * Condition → action mapping. {@code priority} is display metadata only:
 * rules always run in the order they appear in their set.
 */
public record SteeringRule(String id, String name, String description, int priority, boolean enabled,
                           List<Condition> conditions, Combinator operator, List<Action> actions,
                           boolean continueEvaluation) {

    public SteeringRule {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Rule id is required");
        if (name == null || name.isBlank()) name = id;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions = actions == null ? List.of() : List.copyOf(actions);
        if (operator == null) operator = Combinator.AND;
    }

    public SteeringRule withPriority(int newPriority) {
        return new SteeringRule(id, name, description, newPriority, enabled, conditions, operator,
                actions, continueEvaluation);
    }
}
