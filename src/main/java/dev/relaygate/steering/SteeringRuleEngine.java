package dev.relaygate.steering;

import dev.relaygate.steering.action.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a rule set against a request context.
 *
 * <p>Evaluation contract:
 * <ul>
 *   <li><b>Array order</b>: rules run exactly in the order of the set. Priority is
 *       never used to re-sort.</li>
 *   <li><b>Short-circuit</b>: a matched rule with {@code continue=false} ends the pass;
 *       rules after it are not evaluated or recorded.</li>
 *   <li><b>Disabled rules</b> are recorded as unmatched without touching their conditions.</li>
 *   <li><b>Defaults</b>: if the pass ends with neither a routing nor a rejection, the
 *       set's default actions are applied once.</li>
 *   <li><b>Fault isolation</b>: a condition or action that throws is logged and treated
 *       as a non-match / skipped action. Evaluation itself never throws.</li>
 * </ul>
 *
 * <p>The caller's context is never mutated; the result carries a copy.
 */
@Component
public class SteeringRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(SteeringRuleEngine.class);

    public EvaluationResult evaluate(SteeringRuleSet ruleSet, EvaluationContext input) {
        EvaluationContext context = input.copy();
        List<RuleResult> results = new ArrayList<>();
        boolean halted = false;

        for (SteeringRule rule : ruleSet.rules()) {
            if (!rule.enabled()) {
                results.add(new RuleResult(rule.id(), rule.name(), false, List.of(), rule.continueEvaluation()));
                continue;
            }

            boolean matched = matches(rule, context);
            List<String> applied = matched ? applyAll(rule.id(), rule.actions(), context) : List.of();
            results.add(new RuleResult(rule.id(), rule.name(), matched, applied, rule.continueEvaluation()));

            if (matched) {
                log.debug("Rule {} matched, applied {}", rule.id(), applied);
                if (!rule.continueEvaluation()) {
                    halted = true;
                    break;
                }
            }
        }

        boolean defaultsApplied = false;
        if (!context.hasDecision()) {
            applyAll("defaults", ruleSet.defaultActions(), context);
            defaultsApplied = true;
        }
        return new EvaluationResult(List.copyOf(results), context, defaultsApplied, halted);
    }

    // ── Internal ───────────────────────────────────────────────────

    private boolean matches(SteeringRule rule, EvaluationContext context) {
        List<Condition> conditions = rule.conditions();
        return switch (rule.operator()) {
            case AND -> conditions.stream().allMatch(c -> safeEvaluate(rule, c, context));
            case OR -> conditions.stream().anyMatch(c -> safeEvaluate(rule, c, context));
        };
    }

    private boolean safeEvaluate(SteeringRule rule, Condition condition, EvaluationContext context) {
        try {
            return ConditionEvaluator.evaluate(context, condition);
        } catch (RuntimeException e) {
            log.warn("Condition {} {} in rule {} failed, treating as non-match: {}",
                    condition.field(), condition.operator(), rule.id(), e.getMessage());
            return false;
        }
    }

    private List<String> applyAll(String owner, List<Action> actions, EvaluationContext context) {
        List<String> applied = new ArrayList<>();
        for (Action action : actions) {
            try {
                if (action.applyTo(context)) applied.add(action.typeName());
            } catch (RuntimeException e) {
                log.warn("Action {} of {} failed, skipping: {}", action.typeName(), owner, e.getMessage());
            }
        }
        return List.copyOf(applied);
    }
}
