package dev.relaygate.steering;

import dev.relaygate.config.SteeringProperties;
import dev.relaygate.exception.NotFoundException;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.steering.RuleSetDocument.ActionDocument;
import dev.relaygate.steering.RuleSetDocument.RuleDocument;
import dev.relaygate.steering.action.Action;
import dev.relaygate.steering.action.RouteAction;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single named steering rule set.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Copy-on-write</b>: the published set is immutable and swapped atomically,
 *       so evaluations never lock and never see a half-applied edit.</li>
 *   <li><b>Persist before publish</b>: an admin edit is written to the YAML file first;
 *       if the write fails the in-memory set is unchanged.</li>
 *   <li><b>Hot reload</b>: the file's modification time is polled. A file that fails
 *       validation is logged and ignored; the last good set stays live.</li>
 * </ul>
 */
@Service
public class SteeringService {

    private static final Logger log = LoggerFactory.getLogger(SteeringService.class);

    private final RuleSetFileStore store;
    private final RuleSetParser parser;
    private final SteeringRuleEngine engine;
    private final SteeringProperties properties;
    private final AtomicReference<SteeringRuleSet> current = new AtomicReference<>();
    private final Object writeLock = new Object();
    private volatile FileTime loadedModified;

    public SteeringService(RuleSetFileStore store, RuleSetParser parser, SteeringRuleEngine engine,
                           SteeringProperties properties) {
        this.store = store;
        this.parser = parser;
        this.engine = engine;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (store.exists()) {
            try {
                reload();
                return;
            } catch (RuntimeException e) {
                log.error("Steering rules at {} are invalid, starting with defaults: {}", store.path(), e.getMessage());
                current.set(defaultRuleSet());
                return;
            }
        }
        SteeringRuleSet defaults = defaultRuleSet();
        current.set(defaults);
        try {
            store.write(RuleSetDocument.from(defaults));
            loadedModified = store.lastModified().orElse(null);
            log.info("Created default steering rules at {}", store.path());
        } catch (RuntimeException e) {
            log.warn("Could not create default steering rules file {}: {}", store.path(), e.getMessage());
        }
    }

    public SteeringRuleSet current() {
        return current.get();
    }

    public EvaluationResult evaluate(EvaluationContext context) {
        return engine.evaluate(current.get(), context);
    }

    // ── Rule CRUD ──────────────────────────────────────────────────

    public List<SteeringRule> listRules() {
        return current.get().rules();
    }

    public SteeringRule getRule(String id) {
        return current.get().find(id).orElseThrow(() -> new NotFoundException("Rule", id));
    }

    public SteeringRule addRule(RuleDocument doc) {
        synchronized (writeLock) {
            SteeringRuleSet set = current.get();
            if (doc != null && doc.id() != null && set.find(doc.id()).isPresent())
                throw new ValidationException("Rule with ID %s already exists".formatted(doc.id()));
            SteeringRule rule = parser.parseRule(doc, "rule", set.nextPriority());
            publish(set.withRuleAdded(rule));
            log.info("Added steering rule {}", rule.id());
            return rule;
        }
    }

    /** Fields missing from {@code doc} keep their current values. */
    public SteeringRule updateRule(String id, RuleDocument doc) {
        if (doc == null) throw new ValidationException("Rule body is required");
        if (doc.id() != null && !doc.id().equals(id))
            throw new ValidationException("Rule ID in body does not match URL parameter");
        synchronized (writeLock) {
            SteeringRuleSet set = current.get();
            RuleDocument existing = RuleDocument.from(set.find(id).orElseThrow(() -> new NotFoundException("Rule", id)));
            RuleDocument merged = new RuleDocument(id,
                    firstNonNull(doc.name(), existing.name()),
                    firstNonNull(doc.description(), existing.description()),
                    firstNonNull(doc.priority(), existing.priority()),
                    firstNonNull(doc.enabled(), existing.enabled()),
                    firstNonNull(doc.conditions(), existing.conditions()),
                    firstNonNull(doc.operator(), existing.operator()),
                    firstNonNull(doc.actions(), existing.actions()),
                    firstNonNull(doc.continueEvaluation(), existing.continueEvaluation()));
            SteeringRule rule = parser.parseRule(merged, "rule", existing.priority());
            publish(set.withRuleReplaced(rule));
            log.info("Updated steering rule {}", id);
            return rule;
        }
    }

    public void deleteRule(String id) {
        synchronized (writeLock) {
            SteeringRuleSet set = current.get();
            if (set.find(id).isEmpty()) throw new NotFoundException("Rule", id);
            publish(set.withRuleRemoved(id));
            log.info("Deleted steering rule {}", id);
        }
    }

    /** Rewrites priority metadata only; evaluation order is untouched. */
    public List<SteeringRule> updatePriorities(Map<String, Integer> priorities) {
        if (priorities == null || priorities.isEmpty()) throw new ValidationException("Priorities must be provided");
        synchronized (writeLock) {
            SteeringRuleSet set = current.get();
            for (Map.Entry<String, Integer> entry : priorities.entrySet()) {
                if (set.find(entry.getKey()).isEmpty()) throw new NotFoundException("Rule", entry.getKey());
                if (entry.getValue() == null)
                    throw new ValidationException("Priority for rule %s must be a number".formatted(entry.getKey()));
                int priority = entry.getValue();
                set = set.mapRule(entry.getKey(), r -> r.withPriority(priority));
            }
            publish(set);
            return set.rules();
        }
    }

    public List<Action> updateDefaultActions(List<ActionDocument> docs) {
        if (docs == null) throw new ValidationException("Default actions must be an array");
        List<Action> actions = parser.parseActions(docs, "defaultActions");
        synchronized (writeLock) {
            publish(current.get().withDefaultActions(actions));
        }
        return actions;
    }

    /** Runs one (possibly unsaved) rule against a context without touching the live set. */
    public RuleTestResult testRule(RuleDocument doc, EvaluationContext context) {
        SteeringRule rule = parser.parseRule(doc, "rule", 0);
        SteeringRuleSet single = new SteeringRuleSet("test", "rule-test", List.of(rule), List.of());
        EvaluationResult evaluation = engine.evaluate(single, context);
        return new RuleTestResult(evaluation.results().get(0), evaluation.context());
    }

    public record RuleTestResult(RuleResult result, EvaluationContext context) {}

    // ── Reload ─────────────────────────────────────────────────────

    public SteeringRuleSet reload() {
        synchronized (writeLock) {
            Optional<FileTime> modified = store.lastModified();
            SteeringRuleSet loaded = parser.parse(store.read());
            current.set(loaded);
            loadedModified = modified.orElse(null);
            log.info("Loaded {} steering rules from {}", loaded.rules().size(), store.path());
            return loaded;
        }
    }

    @Scheduled(fixedDelayString = "${relaygate.steering.poll-interval:PT5S}",
            initialDelayString = "${relaygate.steering.poll-interval:PT5S}")
    public void pollForChanges() {
        Optional<FileTime> modified = store.lastModified();
        if (modified.isEmpty() || modified.get().equals(loadedModified)) return;
        try {
            reload();
        } catch (RuntimeException e) {
            loadedModified = modified.get();
            log.error("Ignoring invalid steering rules change in {}: {}", store.path(), e.getMessage());
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    private void publish(SteeringRuleSet updated) {
        store.write(RuleSetDocument.from(updated));
        current.set(updated);
        loadedModified = store.lastModified().orElse(null);
    }

    private SteeringRuleSet defaultRuleSet() {
        return new SteeringRuleSet("1.0", "Default Rules", List.of(),
                List.of(new RouteAction(properties.defaultProvider(), properties.defaultModel())));
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
