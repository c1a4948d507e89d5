package dev.relaygate.steering;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.relaygate.steering.action.Action;
import dev.relaygate.steering.action.InjectAction;
import dev.relaygate.steering.action.LogAction;
import dev.relaygate.steering.action.RejectAction;
import dev.relaygate.steering.action.RouteAction;
import dev.relaygate.steering.action.TransformAction;
import dev.relaygate.steering.action.UnsupportedAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Evaluation order, short-circuiting, defaults and fault isolation of the rule engine.
 */
class SteeringRuleEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SteeringRuleEngine engine = new SteeringRuleEngine();

    @Nested
    @DisplayName("rule order")
    class RuleOrder {

        @Test
        @DisplayName("later matching route overwrites an earlier one")
        void laterRouteWins() {
            SteeringRule codeToGpt4 = rule("code-to-gpt4", 10, true,
                    List.of(condition("request.body.prompt", ConditionOperator.CONTAINS, TextNode.valueOf("code"))),
                    new RouteAction("openai", "gpt-4"));
            SteeringRule longToOpus = rule("long-to-opus", 20, true,
                    List.of(condition("context.tokenCount", ConditionOperator.GT, IntNode.valueOf(4000))),
                    new RouteAction("anthropic", "claude-3-opus"));

            EvaluationResult result = engine.evaluate(set(List.of(codeToGpt4, longToOpus)),
                    context("fix this code", 5000));

            assertThat(result.context().routing())
                    .contains(new EvaluationContext.Routing("anthropic", "claude-3-opus"));
            assertThat(result.matchedRules()).extracting(RuleResult::ruleId)
                    .containsExactly("code-to-gpt4", "long-to-opus");
            assertThat(result.defaultsApplied()).isFalse();
        }

        @Test
        @DisplayName("priority does not reorder evaluation")
        void priorityIsAdvisory() {
            SteeringRule first = rule("first", 100, true, List.of(), new RouteAction("openai", "gpt-4"));
            SteeringRule second = rule("second", 1, true, List.of(), new RouteAction("ollama", "llama3"));

            EvaluationResult result = engine.evaluate(set(List.of(first, second)), context("hello", 10));

            assertThat(result.results()).extracting(RuleResult::ruleId).containsExactly("first", "second");
            assertThat(result.context().routing().map(EvaluationContext.Routing::provider)).contains("ollama");
        }

        @Test
        @DisplayName("matched rule with continue=false stops the pass")
        void shortCircuit() {
            SteeringRule stop = rule("stop", 10, false, List.of(), new RouteAction("openai", "gpt-4"));
            SteeringRule never = rule("never", 20, true, List.of(), new RouteAction("anthropic", null));

            EvaluationResult result = engine.evaluate(set(List.of(stop, never)), context("hello", 10));

            assertThat(result.halted()).isTrue();
            assertThat(result.results()).extracting(RuleResult::ruleId).containsExactly("stop");
            assertThat(result.context().routing().map(EvaluationContext.Routing::provider)).contains("openai");
        }

        @Test
        @DisplayName("disabled rules are recorded as unmatched")
        void disabledRule() {
            SteeringRule disabled = new SteeringRule("off", "off", null, 10, false, List.of(), Combinator.AND,
                    List.of(new RouteAction("openai", "gpt-4")), true);

            EvaluationResult result = engine.evaluate(set(List.of(disabled)), context("hello", 10));

            assertThat(result.results()).singleElement().satisfies(r -> assertThat(r.matched()).isFalse());
            assertThat(result.defaultsApplied()).isTrue();
        }
    }

    @Nested
    @DisplayName("combinators")
    class Combinators {

        @Test
        @DisplayName("empty AND matches, empty OR does not")
        void emptyConditionLists() {
            SteeringRule and = rule("and", 10, true, List.of(), new LogAction(Level.DEBUG, "and"));
            SteeringRule or = new SteeringRule("or", "or", null, 20, true, List.of(), Combinator.OR,
                    List.of(new LogAction(Level.DEBUG, "or")), true);

            EvaluationResult result = engine.evaluate(set(List.of(and, or)), context("hello", 10));

            assertThat(result.results()).extracting(RuleResult::matched).containsExactly(true, false);
        }

        @Test
        @DisplayName("OR matches when any condition holds")
        void orMatchesAny() {
            SteeringRule rule = new SteeringRule("any", "any", null, 10, true,
                    List.of(condition("user.tier", ConditionOperator.EQUALS, TextNode.valueOf("premium")),
                            condition("context.tokenCount", ConditionOperator.LT, IntNode.valueOf(100))),
                    Combinator.OR, List.of(new RouteAction("ollama", "llama3")), true);

            EvaluationResult result = engine.evaluate(set(List.of(rule)), context("hello", 10));

            assertThat(result.matchedRules()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("decisions and defaults")
    class Decisions {

        @Test
        @DisplayName("reject freezes routing for the rest of the pass")
        void rejectWinsOverRoute() {
            SteeringRule reject = rule("block", 10, true,
                    List.of(condition("request.body.prompt", ConditionOperator.CONTAINS, TextNode.valueOf("secret"))),
                    new RejectAction("Sensitive content", 403));
            SteeringRule route = rule("route", 20, true, List.of(), new RouteAction("openai", "gpt-4"));

            EvaluationResult result = engine.evaluate(set(List.of(reject, route)), context("tell me the secret", 10));

            assertThat(result.context().rejection())
                    .contains(new EvaluationContext.Rejection("Sensitive content", 403));
            assertThat(result.context().routing()).isEmpty();
            assertThat(result.results().get(1).actionsApplied()).isEmpty();
        }

        @Test
        @DisplayName("defaults apply only when no rule decided")
        void defaultsWhenUndecided() {
            SteeringRuleSet set = new SteeringRuleSet("1.0", "test",
                    List.of(rule("log-only", 10, true, List.of(), new LogAction(Level.INFO, "seen"))),
                    List.of(new RouteAction("openai", "gpt-3.5-turbo")));

            EvaluationResult result = engine.evaluate(set, context("hello", 10));

            assertThat(result.defaultsApplied()).isTrue();
            assertThat(result.context().routing())
                    .contains(new EvaluationContext.Routing("openai", "gpt-3.5-turbo"));
            assertThat(result.context().logs()).containsExactly("INFO seen");
        }

        @Test
        @DisplayName("transform and inject rewrite the evaluated copy only")
        void transformAndInject() {
            EvaluationContext input = context("Summarize", 10);
            SteeringRule rule = rule("rewrite", 10, true, List.of(),
                    new TransformAction("request.body.prompt", TransformAction.Operation.APPEND,
                            TextNode.valueOf(" briefly")),
                    new InjectAction("context.flags.rewritten", MAPPER.getNodeFactory().booleanNode(true)));

            EvaluationResult result = engine.evaluate(set(List.of(rule)), input);

            assertThat(result.context().get("request.body.prompt")).map(n -> n.asText())
                    .contains("Summarize briefly");
            assertThat(result.context().get("context.flags.rewritten")).isPresent();
            assertThat(input.get("request.body.prompt")).map(n -> n.asText()).contains("Summarize");
        }
    }

    @Nested
    @DisplayName("fault isolation")
    class FaultIsolation {

        @Test
        @DisplayName("a failing condition is a non-match and later rules still run")
        void failingConditionIsNonMatch() {
            SteeringRule broken = rule("broken", 10, true,
                    List.of(condition("request.body.prompt", ConditionOperator.REGEX, TextNode.valueOf("(["))),
                    new RouteAction("openai", "gpt-4"));
            SteeringRule next = rule("next", 20, true, List.of(), new RouteAction("ollama", "llama3"));

            EvaluationResult result = engine.evaluate(set(List.of(broken, next)), context("hello", 10));

            assertThat(result.results()).extracting(RuleResult::matched).containsExactly(false, true);
            assertThat(result.context().routing().map(EvaluationContext.Routing::provider)).contains("ollama");
        }

        @Test
        @DisplayName("unknown action kinds are skipped")
        void unsupportedActionIsNoOp() {
            SteeringRule rule = rule("future", 10, true, List.of(),
                    new UnsupportedAction("webhook", Map.of("url", "http://example.test")),
                    new RouteAction("openai", "gpt-4"));

            EvaluationResult result = engine.evaluate(set(List.of(rule)), context("hello", 10));

            assertThat(result.results().get(0).actionsApplied()).containsExactly("route");
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static SteeringRuleSet set(List<SteeringRule> rules) {
        return new SteeringRuleSet("1.0", "test", rules, List.of());
    }

    private static SteeringRule rule(String id, int priority, boolean continueEvaluation, List<Condition> conditions,
                                     Action... actions) {
        return new SteeringRule(id, id, null, priority, true, conditions, Combinator.AND, List.of(actions),
                continueEvaluation);
    }

    private static Condition condition(String field, ConditionOperator operator,
                                       com.fasterxml.jackson.databind.JsonNode value) {
        return new Condition(field, operator, value);
    }

    private static EvaluationContext context(String prompt, int tokenCount) {
        ObjectNode request = MAPPER.createObjectNode();
        request.putObject("body").put("prompt", prompt);
        ObjectNode ctx = MAPPER.createObjectNode().put("tokenCount", tokenCount);
        return EvaluationContext.create(request, MAPPER.createObjectNode().put("tier", "free"), null, ctx);
    }
}
