package dev.relaygate.steering;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Mutable accumulator threaded through one evaluation pass.
 *
 * <p>Inputs live in a JSON tree with four top-level sections ({@code request},
 * {@code user}, {@code organization}, {@code context}); fields are addressed by
 * dot-paths and every lookup returns an {@link Optional}, so a missing
 * intermediate segment is simply "absent" and never an exception.
 *
 * <p>Outputs ({@link #routing()}, {@link #rejection()}) are typed. Once a
 * rejection is recorded the routing is frozen for the rest of the pass.
 *
 * <p>Not thread-safe: a context belongs to one request.
 */
public final class EvaluationContext {

    public static final String REQUEST = "request";
    public static final String USER = "user";
    public static final String ORGANIZATION = "organization";
    public static final String CONTEXT = "context";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    // indexes beyond int range resolve as absent
    private static final Pattern INDEX = Pattern.compile("\\d{1,9}");

    private final ObjectNode root;
    private Routing routing;
    private Rejection rejection;
    private final List<String> logs = new ArrayList<>();

    private EvaluationContext(ObjectNode root) {
        this.root = root;
        for (String section : List.of(REQUEST, USER, ORGANIZATION, CONTEXT)) {
            if (!root.path(section).isObject()) root.set(section, NODES.objectNode());
        }
    }

    public static EvaluationContext create(JsonNode request, JsonNode user, JsonNode organization, JsonNode context) {
        ObjectNode root = NODES.objectNode();
        root.set(REQUEST, objectOrEmpty(request));
        root.set(USER, objectOrEmpty(user));
        root.set(ORGANIZATION, objectOrEmpty(organization));
        root.set(CONTEXT, objectOrEmpty(context));
        return new EvaluationContext(root);
    }

    /** Builds a context from a tree shaped like {@link #toTree()}; unknown sections are kept. */
    public static EvaluationContext fromTree(JsonNode tree) {
        ObjectNode root = tree != null && tree.isObject() ? ((ObjectNode) tree).deepCopy() : NODES.objectNode();
        JsonNode routingNode = root.remove("routing");
        JsonNode rejectNode = root.remove("reject");
        EvaluationContext ctx = new EvaluationContext(root);
        if (routingNode != null && routingNode.hasNonNull("provider")) {
            ctx.routing = new Routing(routingNode.get("provider").asText(),
                    routingNode.hasNonNull("model") ? routingNode.get("model").asText() : null);
        }
        if (rejectNode != null && rejectNode.isObject()) {
            ctx.rejection = new Rejection(rejectNode.path("message").asText("Request rejected by steering rule"),
                    rejectNode.path("status").asInt(400));
        }
        return ctx;
    }

    public EvaluationContext copy() {
        EvaluationContext copy = new EvaluationContext(root.deepCopy());
        copy.routing = routing;
        copy.rejection = rejection;
        copy.logs.addAll(logs);
        return copy;
    }

    // ── Path access ────────────────────────────────────────────────

    /**
     * Resolves a dot-path. JSON null counts as absent. {@code routing.*} and
     * {@code reject.*} read the typed outputs.
     */
    public Optional<JsonNode> get(String path) {
        if (path == null || path.isBlank()) return Optional.empty();
        String[] parts = path.split("\\.");
        JsonNode current = switch (parts[0]) {
            case "routing" -> routing == null ? null : routing.toNode();
            case "reject" -> rejection == null ? null : rejection.toNode();
            default -> root.get(parts[0]);
        };
        for (int i = 1; i < parts.length && current != null; i++) {
            current = child(current, parts[i]);
        }
        if (current == null || current.isNull() || current.isMissingNode()) return Optional.empty();
        return Optional.of(current);
    }

    /** Sets a value, creating intermediate objects as needed. */
    public void set(String path, JsonNode value) {
        String[] parts = splitWritable(path);
        ObjectNode parent = root;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode next = parent.get(parts[i]);
            if (next == null || !next.isObject()) {
                next = NODES.objectNode();
                parent.set(parts[i], next);
            }
            parent = (ObjectNode) next;
        }
        parent.set(parts[parts.length - 1], value == null ? NODES.nullNode() : value);
    }

    /** Removes a value; returns false when the path did not resolve. */
    public boolean remove(String path) {
        String[] parts = splitWritable(path);
        JsonNode parent = root;
        for (int i = 0; i < parts.length - 1 && parent != null; i++) {
            parent = parent.get(parts[i]);
        }
        if (parent == null || !parent.isObject()) return false;
        return ((ObjectNode) parent).remove(parts[parts.length - 1]) != null;
    }

    // ── Outputs ────────────────────────────────────────────────────

    public Optional<Routing> routing() {
        return Optional.ofNullable(routing);
    }

    public Optional<Rejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public boolean hasDecision() {
        return routing != null || rejection != null;
    }

    /** Returns false without touching routing when the context is already rejected. */
    public boolean route(String provider, String model) {
        if (rejection != null) return false;
        String effectiveProvider = provider != null ? provider : routing != null ? routing.provider() : null;
        if (effectiveProvider == null) return false;
        String effectiveModel = model != null ? model
                : routing != null && effectiveProvider.equals(routing.provider()) ? routing.model() : null;
        routing = new Routing(effectiveProvider, effectiveModel);
        return true;
    }

    /** The first rejection wins. */
    public boolean reject(String message, int status) {
        if (rejection != null) return false;
        rejection = new Rejection(message, status);
        return true;
    }

    public void log(String entry) {
        logs.add(entry);
    }

    public List<String> logs() {
        return List.copyOf(logs);
    }

    public JsonNode request() {
        return root.get(REQUEST);
    }

    /** Snapshot of the whole context including outputs, for responses and audit logs. */
    public ObjectNode toTree() {
        ObjectNode tree = root.deepCopy();
        if (routing != null) tree.set("routing", routing.toNode());
        if (rejection != null) tree.set("reject", rejection.toNode());
        return tree;
    }

    public record Routing(String provider, String model) {
        ObjectNode toNode() {
            ObjectNode node = NODES.objectNode().put("provider", provider);
            if (model != null) node.put("model", model);
            return node;
        }
    }

    public record Rejection(String message, int status) {
        ObjectNode toNode() {
            return NODES.objectNode().put("message", message).put("status", status);
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    private static JsonNode child(JsonNode node, String segment) {
        if (node.isObject()) return node.get(segment);
        if (node.isArray() && INDEX.matcher(segment).matches()) return node.get(Integer.parseInt(segment));
        return null;
    }

    private static String[] splitWritable(String path) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("Field path is required");
        String[] parts = path.split("\\.");
        if (parts[0].equals("routing") || parts[0].equals("reject"))
            throw new IllegalArgumentException("Field %s is an evaluation output and cannot be written".formatted(path));
        return parts;
    }

    private static ObjectNode objectOrEmpty(JsonNode node) {
        return node != null && node.isObject() ? ((ObjectNode) node).deepCopy() : NODES.objectNode();
    }
}
