package dev.relaygate.controller;

import com.fasterxml.jackson.databind.JsonNode;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.steering.EvaluationContext;
import dev.relaygate.steering.EvaluationResult;
import dev.relaygate.steering.RuleSetDocument;
import dev.relaygate.steering.RuleSetDocument.ActionDocument;
import dev.relaygate.steering.RuleSetDocument.RuleDocument;
import dev.relaygate.steering.SteeringRuleSet;
import dev.relaygate.steering.SteeringService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin surface for the steering rule set. Every write is persisted to the YAML
 * file before it becomes live.
 */
@RestController
@RequestMapping("/v1/admin/steering")
public class SteeringAdminController {

    private final SteeringService steering;

    public SteeringAdminController(SteeringService steering) {
        this.steering = steering;
    }

    public record RuleTestRequest(RuleDocument rule, JsonNode context) {}

    @GetMapping
    public RuleSetDocument ruleSet() {
        return RuleSetDocument.from(steering.current());
    }

    @GetMapping("/rules")
    public List<RuleDocument> rules() {
        return steering.listRules().stream().map(RuleDocument::from).toList();
    }

    @GetMapping("/rules/{id}")
    public RuleDocument rule(@PathVariable String id) {
        return RuleDocument.from(steering.getRule(id));
    }

    @PostMapping("/rules")
    public ResponseEntity<RuleDocument> addRule(@RequestBody(required = false) RuleDocument body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(RuleDocument.from(steering.addRule(body)));
    }

    @PutMapping("/rules/{id}")
    public RuleDocument updateRule(@PathVariable String id, @RequestBody(required = false) RuleDocument body) {
        return RuleDocument.from(steering.updateRule(id, body));
    }

    @DeleteMapping("/rules/{id}")
    public ResponseEntity<Void> deleteRule(@PathVariable String id) {
        steering.deleteRule(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/priorities")
    public List<RuleDocument> priorities(@RequestBody(required = false) Map<String, Integer> priorities) {
        return steering.updatePriorities(priorities).stream().map(RuleDocument::from).toList();
    }

    @PutMapping("/default-actions")
    public List<ActionDocument> defaultActions(@RequestBody(required = false) List<ActionDocument> actions) {
        return steering.updateDefaultActions(actions).stream().map(ActionDocument::from).toList();
    }

    @PostMapping("/test")
    public Map<String, Object> testRule(@RequestBody(required = false) RuleTestRequest body) {
        if (body == null || body.rule() == null) throw new ValidationException("Rule is required");
        SteeringService.RuleTestResult outcome = steering.testRule(body.rule(), EvaluationContext.fromTree(body.context()));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("result", outcome.result());
        response.put("context", outcome.context().toTree());
        response.put("logs", outcome.context().logs());
        return response;
    }

    @PostMapping("/evaluate")
    public Map<String, Object> evaluate(@RequestBody(required = false) JsonNode context) {
        EvaluationResult result = steering.evaluate(EvaluationContext.fromTree(context));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("results", result.results());
        response.put("matched_rules", result.matchedRules().size());
        response.put("defaults_applied", result.defaultsApplied());
        response.put("halted", result.halted());
        response.put("context", result.context().toTree());
        response.put("logs", result.context().logs());
        return response;
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        SteeringRuleSet loaded = steering.reload();
        return Map.of("success", true, "rules", loaded.rules().size(), "version", loaded.version());
    }
}
