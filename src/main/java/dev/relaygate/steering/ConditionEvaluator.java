package dev.relaygate.steering;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pure (context, condition) → boolean. Type mismatches and missing fields are
 * plain non-matches; the only thing that can escape is a bad regex, which the
 * engine absorbs.
 */
public final class ConditionEvaluator {

    private static final int MAX_CACHED_PATTERNS = 512;
    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    /** Numbers compare by value (5 equals 5.0); everything else by JSON equality. */
    private static final Comparator<JsonNode> SCALAR_EQUALITY = (a, b) -> {
        if (a.isNumber() && b.isNumber()) return a.decimalValue().compareTo(b.decimalValue());
        return a.equals(b) ? 0 : 1;
    };

    private ConditionEvaluator() {
    }

    public static boolean evaluate(EvaluationContext context, Condition condition) {
        Optional<JsonNode> field = context.get(condition.field());
        JsonNode expected = condition.value();
        return switch (condition.operator()) {
            case EXISTS -> field.isPresent();
            case NOT_EXISTS -> field.isEmpty();
            case EQUALS -> isEqual(field, expected);
            case NOT_EQUALS -> !isEqual(field, expected);
            case CONTAINS -> field.map(f -> contains(f, expected)).orElse(false);
            case NOT_CONTAINS -> field.map(f -> !contains(f, expected)).orElse(true);
            case REGEX -> field.filter(f -> !f.isContainerNode()).map(f -> regex(f.asText(), expected)).orElse(false);
            case GT -> compare(field, expected) > 0;
            case LT -> compareOrMax(field, expected) < 0;
            case GTE -> compare(field, expected) >= 0;
            case LTE -> compareOrMax(field, expected) <= 0;
            case IN -> expected != null && expected.isArray() && field.map(f -> member(expected, f)).orElse(false);
            case NOT_IN -> expected != null && expected.isArray() && field.map(f -> !member(expected, f)).orElse(true);
        };
    }

    static boolean nodesEqual(JsonNode a, JsonNode b) {
        return a.equals(SCALAR_EQUALITY, b);
    }

    // ── Internal ───────────────────────────────────────────────────

    private static boolean isEqual(Optional<JsonNode> field, JsonNode expected) {
        boolean expectedAbsent = expected == null || expected.isNull() || expected.isMissingNode();
        if (field.isEmpty()) return expectedAbsent;
        return !expectedAbsent && nodesEqual(field.get(), expected);
    }

    private static boolean contains(JsonNode field, JsonNode expected) {
        if (expected == null || expected.isNull()) return false;
        if (field.isArray()) return member(field, expected);
        if (field.isObject()) return false;
        return stringify(field).contains(stringify(expected));
    }

    private static boolean member(JsonNode array, JsonNode candidate) {
        for (JsonNode item : array) {
            if (nodesEqual(item, candidate)) return true;
        }
        return false;
    }

    private static String stringify(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static boolean regex(String text, JsonNode expected) {
        if (expected == null || !expected.isTextual()) return false;
        return pattern(expected.textValue()).matcher(text).find();
    }

    private static Pattern pattern(String regex) {
        Pattern cached = PATTERNS.get(regex);
        if (cached != null) return cached;
        Pattern compiled = Pattern.compile(regex);
        if (PATTERNS.size() < MAX_CACHED_PATTERNS) PATTERNS.put(regex, compiled);
        return compiled;
    }

    /** Sign of field − expected; Integer.MIN_VALUE when either side is not a number. */
    private static int compare(Optional<JsonNode> field, JsonNode expected) {
        if (field.isEmpty() || !field.get().isNumber() || expected == null || !expected.isNumber())
            return Integer.MIN_VALUE;
        return field.get().decimalValue().compareTo(expected.decimalValue());
    }

    /** Like {@link #compare} but non-numbers sort high, so lt/lte are false for them too. */
    private static int compareOrMax(Optional<JsonNode> field, JsonNode expected) {
        int c = compare(field, expected);
        return c == Integer.MIN_VALUE ? Integer.MAX_VALUE : c;
    }

    /** Exposed for rule-set validation so bad patterns are caught at load time. */
    static void checkPattern(String regex) throws PatternSyntaxException {
        Pattern.compile(regex);
    }
}
