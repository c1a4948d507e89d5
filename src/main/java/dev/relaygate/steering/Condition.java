package dev.relaygate.steering;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single test against the evaluation context.
 *
 * @param field dot-path such as {@code request.body.prompt} or {@code context.tokenCount}
 * @param value comparison operand; null for {@code exists}/{@code not_exists}
 */
public record Condition(String field, ConditionOperator operator, JsonNode value) {
}
