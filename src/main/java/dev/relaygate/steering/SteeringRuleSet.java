package dev.relaygate.steering;

import dev.relaygate.steering.action.Action;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable, ordered rule set. Every mutator returns a new instance so a
 * published set can be read by many threads while admins edit a copy.
 */
public record SteeringRuleSet(String version, String name, List<SteeringRule> rules, List<Action> defaultActions) {

    public SteeringRuleSet {
        if (version == null || version.isBlank()) version = "1.0";
        if (name == null || name.isBlank()) name = "default";
        rules = rules == null ? List.of() : List.copyOf(rules);
        defaultActions = defaultActions == null ? List.of() : List.copyOf(defaultActions);
    }

    public Optional<SteeringRule> find(String ruleId) {
        return rules.stream().filter(r -> r.id().equals(ruleId)).findFirst();
    }

    public int nextPriority() {
        return rules.stream().mapToInt(SteeringRule::priority).max().orElse(0) + 10;
    }

    public SteeringRuleSet withRuleAdded(SteeringRule rule) {
        if (find(rule.id()).isPresent())
            throw new IllegalStateException("Rule with ID %s already exists".formatted(rule.id()));
        List<SteeringRule> copy = new ArrayList<>(rules);
        copy.add(rule);
        return new SteeringRuleSet(version, name, copy, defaultActions);
    }

    public SteeringRuleSet withRuleReplaced(SteeringRule rule) {
        return mapRule(rule.id(), existing -> rule);
    }

    public SteeringRuleSet withRuleRemoved(String ruleId) {
        find(ruleId).orElseThrow(() -> new IllegalArgumentException("Rule with ID %s not found".formatted(ruleId)));
        return new SteeringRuleSet(version, name,
                rules.stream().filter(r -> !r.id().equals(ruleId)).toList(), defaultActions);
    }

    public SteeringRuleSet mapRule(String ruleId, UnaryOperator<SteeringRule> change) {
        find(ruleId).orElseThrow(() -> new IllegalArgumentException("Rule with ID %s not found".formatted(ruleId)));
        return new SteeringRuleSet(version, name,
                rules.stream().map(r -> r.id().equals(ruleId) ? change.apply(r) : r).toList(), defaultActions);
    }

    public SteeringRuleSet withDefaultActions(List<Action> actions) {
        return new SteeringRuleSet(version, name, rules, actions);
    }
}
