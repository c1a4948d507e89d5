package dev.relaygate.controller;

import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.entity.UsageRecord;
import dev.relaygate.domain.enums.ScopeType;
import dev.relaygate.domain.enums.UsageSource;
import dev.relaygate.domain.valueobject.BudgetStatus;
import dev.relaygate.domain.valueobject.ConstraintCheck;
import dev.relaygate.domain.valueobject.UsageSummary;
import dev.relaygate.dto.request.BudgetRequest;
import dev.relaygate.dto.request.ConstraintCheckRequest;
import dev.relaygate.dto.request.UsageRequest;
import dev.relaygate.dto.response.BudgetResponse;
import dev.relaygate.dto.response.UsageRecordResponse;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.service.BudgetRegistry;
import dev.relaygate.service.BudgetTracker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Budget definitions and the usage ledger. Bodies are camelCase; every 400 carries
 * the hint ({@code required}, {@code validTypes}, {@code validPeriods}, {@code validSources})
 * that tells the caller how to fix the request.
 */
@RestController
@RequestMapping("/v1/budgets")
public class BudgetController {

    private static final List<String> USAGE_REQUIRED = List.of("amount", "currency", "source");

    private final BudgetRegistry registry;
    private final BudgetTracker tracker;

    public BudgetController(BudgetRegistry registry, BudgetTracker tracker) {
        this.registry = registry;
        this.tracker = tracker;
    }

    @PostMapping
    public ResponseEntity<BudgetResponse> create(@RequestBody(required = false) BudgetRequest request,
                                                 Principal principal) {
        String createdBy = principal != null ? principal.getName() : "anonymous";
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BudgetResponse.from(registry.createBudget(request, createdBy)));
    }

    @GetMapping("/{id}")
    public BudgetResponse get(@PathVariable UUID id) {
        return BudgetResponse.from(registry.getBudget(id));
    }

    @PutMapping("/{id}")
    public BudgetResponse update(@PathVariable UUID id, @RequestBody(required = false) BudgetRequest request) {
        return BudgetResponse.from(registry.updateBudget(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        registry.deleteBudget(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/scope/{type}/{scopeId}")
    public Map<String, Object> listForScope(@PathVariable String type, @PathVariable String scopeId,
                                            @RequestParam(defaultValue = "false") boolean includeInactive,
                                            @RequestParam(required = false) UUID parentBudgetId) {
        ScopeType scopeType = BudgetRegistry.parseScopeType(type);
        List<BudgetResponse> budgets = toResponses(
                registry.listBudgets(scopeType, scopeId, includeInactive, parentBudgetId));
        return Map.of("budgets", budgets, "count", budgets.size());
    }

    @GetMapping("/hierarchy/{type}/{scopeId}")
    public Map<String, Object> hierarchy(@PathVariable String type, @PathVariable String scopeId) {
        ScopeType scopeType = BudgetRegistry.parseScopeType(type);
        List<BudgetResponse> hierarchy = toResponses(registry.getBudgetHierarchy(scopeType, scopeId));
        return Map.of("hierarchy", hierarchy, "count", hierarchy.size());
    }

    @GetMapping("/{id}/status")
    public BudgetStatus status(@PathVariable UUID id) {
        return tracker.getBudgetStatus(id);
    }

    @PostMapping("/{id}/usage")
    public ResponseEntity<UsageRecordResponse> recordUsage(@PathVariable UUID id,
                                                           @RequestBody(required = false) UsageRequest request) {
        if (request == null || request.amount() == null || isBlank(request.currency()) || isBlank(request.source()))
            throw ValidationException.missingFields(USAGE_REQUIRED);

        UsageSource source;
        try {
            source = UsageSource.fromWire(request.source());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid source").hint("validSources", UsageSource.wireNames());
        }
        Instant timestamp = isBlank(request.timestamp()) ? null
                : BudgetRegistry.parseDate("timestamp", request.timestamp());
        UsageRecord record = tracker.recordUsage(id, request.amount(), request.currency(), source, timestamp,
                new BudgetTracker.UsageDetails(request.description(), request.requestId(),
                        request.provider(), request.model()));
        return ResponseEntity.status(HttpStatus.CREATED).body(UsageRecordResponse.from(record));
    }

    @PostMapping("/{id}/check-constraints")
    public ConstraintCheck checkConstraints(@PathVariable UUID id,
                                            @RequestBody(required = false) ConstraintCheckRequest request) {
        if (request == null || request.estimatedCost() == null || request.estimatedCost().signum() < 0)
            throw new ValidationException("Valid estimated cost is required");
        return tracker.checkBudgetConstraints(id, request.estimatedCost());
    }

    @GetMapping("/{id}/usage")
    public Map<String, Object> usageHistory(@PathVariable UUID id,
                                            @RequestParam(defaultValue = "100") int limit,
                                            @RequestParam(defaultValue = "0") int offset) {
        List<UsageRecordResponse> usage = tracker.getUsageHistory(id, limit, offset).stream()
                .map(UsageRecordResponse::from)
                .toList();
        return Map.of("usage", usage, "count", usage.size(), "limit", limit, "offset", offset);
    }

    @GetMapping("/{id}/usage/summary")
    public UsageSummary usageSummary(@PathVariable UUID id,
                                     @RequestParam(required = false) String startDate,
                                     @RequestParam(required = false) String endDate) {
        Instant start = isBlank(startDate) ? null : BudgetRegistry.parseDate("startDate", startDate);
        Instant end = isBlank(endDate) ? null : BudgetRegistry.parseDate("endDate", endDate);
        return tracker.getUsageSummary(id, start, end);
    }

    @PostMapping("/{id}/refresh-cache")
    public Map<String, Object> refreshCache(@PathVariable UUID id) {
        BudgetStatus status = tracker.refreshStatusCache(id);
        return Map.of("message", "Budget status cache refreshed successfully", "budgetId", id, "status", status);
    }

    // ── Internal ───────────────────────────────────────────────────

    private static List<BudgetResponse> toResponses(List<Budget> budgets) {
        return budgets.stream().map(BudgetResponse::from).toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
