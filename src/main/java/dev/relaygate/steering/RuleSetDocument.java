package dev.relaygate.steering;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.relaygate.steering.action.Action;

import java.util.List;
import java.util.Map;

/**
 * Wire form of a rule set: what the YAML file and the admin API read and write.
 * Converted to the validated domain model by {@link RuleSetParser}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleSetDocument(String version, String name, List<RuleDocument> rules,
                              List<ActionDocument> defaultActions) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RuleDocument(String id, String name, String description, Integer priority, Boolean enabled,
                               List<ConditionDocument> conditions, String operator,
                               List<ActionDocument> actions,
                               @JsonProperty("continue") Boolean continueEvaluation) {

        public static RuleDocument from(SteeringRule rule) {
            return new RuleDocument(rule.id(), rule.name(), rule.description(), rule.priority(), rule.enabled(),
                    rule.conditions().stream().map(ConditionDocument::from).toList(),
                    rule.operator().wireName(),
                    rule.actions().stream().map(ActionDocument::from).toList(),
                    rule.continueEvaluation());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConditionDocument(String field, String operator, JsonNode value) {

        public static ConditionDocument from(Condition condition) {
            return new ConditionDocument(condition.field(), condition.operator().wireName(), condition.value());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ActionDocument(String type, Map<String, Object> params) {

        public static ActionDocument from(Action action) {
            return new ActionDocument(action.typeName(), action.params());
        }
    }

    public static RuleSetDocument from(SteeringRuleSet ruleSet) {
        return new RuleSetDocument(ruleSet.version(), ruleSet.name(),
                ruleSet.rules().stream().map(RuleDocument::from).toList(),
                ruleSet.defaultActions().stream().map(ActionDocument::from).toList());
    }
}
