package dev.relaygate.steering;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.steering.RuleSetDocument.ActionDocument;
import dev.relaygate.steering.RuleSetDocument.ConditionDocument;
import dev.relaygate.steering.RuleSetDocument.RuleDocument;
import dev.relaygate.steering.action.Action;
import dev.relaygate.steering.action.ActionType;
import dev.relaygate.steering.action.InjectAction;
import dev.relaygate.steering.action.LogAction;
import dev.relaygate.steering.action.RejectAction;
import dev.relaygate.steering.action.RouteAction;
import dev.relaygate.steering.action.TransformAction;
import dev.relaygate.steering.action.UnsupportedAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Turns the wire form of a rule set into the validated domain model.
 *
 * <p>Structural problems (missing ids, duplicate ids, unknown condition
 * operators, malformed parameters of a known action kind) are rejected here, at
 * load/registration time, so evaluation never has to. Unknown action kinds are
 * tolerated and kept as {@link UnsupportedAction}.
 */
@Component
public class RuleSetParser {

    private final ObjectMapper objectMapper;

    public RuleSetParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SteeringRuleSet parse(RuleSetDocument document) {
        if (document == null) throw new ValidationException("Rule set is empty");
        List<SteeringRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        List<RuleDocument> ruleDocs = document.rules() != null ? document.rules() : List.of();
        for (int i = 0; i < ruleDocs.size(); i++) {
            SteeringRule rule = parseRule(ruleDocs.get(i), "rules[" + i + "]");
            if (!ids.add(rule.id()))
                throw new ValidationException("Duplicate rule ID: " + rule.id());
            rules.add(rule);
        }
        List<Action> defaults = parseActions(document.defaultActions(), "defaultActions");
        return new SteeringRuleSet(document.version(), document.name(), rules, defaults);
    }

    /**
     * Parses one rule. Missing optional fields take creation defaults:
     * enabled, continue and the supplied priority.
     */
    public SteeringRule parseRule(RuleDocument doc, String where, int defaultPriority) {
        if (doc == null) throw new ValidationException(where + ": rule is empty");
        if (doc.id() == null || doc.id().isBlank())
            throw new ValidationException(where + ": must have a valid 'id'");
        String at = "Rule " + doc.id();
        if (doc.actions() == null || doc.actions().isEmpty())
            throw new ValidationException(at + ": must have at least one action");
        Combinator combinator;
        try {
            combinator = Combinator.fromWire(doc.operator());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(at + ": " + e.getMessage()).hint("validOperators", List.of("and", "or"));
        }
        List<Condition> conditions = new ArrayList<>();
        List<ConditionDocument> conditionDocs = doc.conditions() != null ? doc.conditions() : List.of();
        for (int i = 0; i < conditionDocs.size(); i++) {
            conditions.add(parseCondition(conditionDocs.get(i), at + " conditions[" + i + "]"));
        }
        return new SteeringRule(doc.id(), doc.name(), doc.description(),
                doc.priority() != null ? doc.priority() : defaultPriority,
                doc.enabled() == null || doc.enabled(),
                conditions, combinator,
                parseActions(doc.actions(), at),
                doc.continueEvaluation() == null || doc.continueEvaluation());
    }

    public List<Action> parseActions(List<ActionDocument> docs, String where) {
        if (docs == null) return List.of();
        List<Action> actions = new ArrayList<>();
        for (int i = 0; i < docs.size(); i++) {
            actions.add(parseAction(docs.get(i), where + " actions[" + i + "]"));
        }
        return actions;
    }

    // ── Internal ───────────────────────────────────────────────────

    private SteeringRule parseRule(RuleDocument doc, String where) {
        return parseRule(doc, where, 0);
    }

    private Condition parseCondition(ConditionDocument doc, String where) {
        if (doc == null || doc.field() == null || doc.field().isBlank())
            throw new ValidationException(where + ": must have a valid 'field'");
        ConditionOperator operator;
        try {
            operator = ConditionOperator.fromWire(doc.operator());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(where + ": " + e.getMessage());
        }
        if (operator == null) throw new ValidationException(where + ": must have a valid 'operator'");
        JsonNode value = doc.value();
        if (operator.requiresValue() && (value == null || value.isNull()) && operator != ConditionOperator.EQUALS
                && operator != ConditionOperator.NOT_EQUALS)
            throw new ValidationException(where + ": operator '%s' requires a value".formatted(operator.wireName()));
        if (operator == ConditionOperator.REGEX) {
            try {
                ConditionEvaluator.checkPattern(value.asText());
            } catch (PatternSyntaxException e) {
                throw new ValidationException(where + ": invalid regex: " + e.getDescription());
            }
        }
        if ((operator == ConditionOperator.IN || operator == ConditionOperator.NOT_IN) && !value.isArray())
            throw new ValidationException(where + ": operator '%s' requires a list value".formatted(operator.wireName()));
        return new Condition(doc.field(), operator, value);
    }

    private Action parseAction(ActionDocument doc, String where) {
        if (doc == null || doc.type() == null || doc.type().isBlank())
            throw new ValidationException(where + ": must have a valid 'type'");
        Map<String, Object> params = doc.params() != null ? doc.params() : Map.of();
        Optional<ActionType> type = ActionType.fromWire(doc.type());
        if (type.isEmpty()) return new UnsupportedAction(doc.type(), params);
        try {
            return switch (type.get()) {
                case ROUTE -> new RouteAction(text(params, "provider"), text(params, "model"));
                case REJECT -> new RejectAction(text(params, "message"), integer(params, "status"));
                case TRANSFORM -> {
                    Map<String, Object> p = nested(params, "transformation");
                    String operation = text(p, "operation");
                    if (operation == null) throw new IllegalArgumentException("transform action needs an operation");
                    yield new TransformAction(text(p, "field"), TransformAction.Operation.fromWire(operation),
                            node(p, "value"));
                }
                case INJECT -> {
                    Map<String, Object> p = nested(params, "context");
                    yield new InjectAction(text(p, "field"), node(p, "value"));
                }
                case LOG -> new LogAction(LogAction.parseLevel(text(params, "level")), text(params, "message"));
            };
        } catch (IllegalArgumentException e) {
            throw new ValidationException(where + ": " + e.getMessage());
        }
    }

    /** Accepts both flat params and the older nested {@code {transformation: {...}}} form. */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> nested(Map<String, Object> params, String key) {
        Object inner = params.get(key);
        return inner instanceof Map<?, ?> m ? (Map<String, Object>) m : params;
    }

    private static String text(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value == null ? null : value.toString();
    }

    private static int integer(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) return 0;
        if (value instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'%s' must be a number".formatted(key));
        }
    }

    private JsonNode node(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) return null;
        return value instanceof JsonNode n ? n : objectMapper.valueToTree(value);
    }
}
