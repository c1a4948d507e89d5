package dev.relaygate.service;

import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.enums.AlertAction;
import dev.relaygate.domain.enums.BudgetPeriod;
import dev.relaygate.domain.enums.ScopeType;
import dev.relaygate.domain.valueobject.BudgetAlert;
import dev.relaygate.dto.request.BudgetRequest;
import dev.relaygate.exception.BudgetInactiveException;
import dev.relaygate.exception.NotFoundException;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.repository.BudgetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Budget definitions and their tree.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Validation here, invariants in the entity</b>: the registry produces caller-facing
 *       errors with hints; {@link Budget} re-checks its own invariants as a backstop.</li>
 *   <li><b>Parent rules</b>: a parent must exist, be active, use the same currency and sit at a
 *       strictly higher scope rank. Re-parenting walks the new parent's ancestors to refuse cycles.</li>
 *   <li><b>Soft delete</b>: usage history keeps referencing the row, so it is only deactivated,
 *       and never while an active child still rolls up into it.</li>
 *   <li><b>Scope is fixed</b>: scope type and id identify what a budget governs; changing them
 *       means creating a new budget.</li>
 * </ul>
 */
@Service
public class BudgetRegistry {

    private static final Logger log = LoggerFactory.getLogger(BudgetRegistry.class);

    static final List<String> REQUIRED_FIELDS =
            List.of("name", "scopeType", "scopeId", "amount", "currency", "period", "startDate");
    private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");

    private final BudgetRepository repository;
    private final BudgetStatusCache statusCache;

    public BudgetRegistry(BudgetRepository repository, BudgetStatusCache statusCache) {
        this.repository = repository;
        this.statusCache = statusCache;
    }

    @Transactional
    public Budget createBudget(BudgetRequest request, String createdBy) {
        if (request == null) throw ValidationException.missingFields(REQUIRED_FIELDS);
        List<String> missing = new ArrayList<>();
        if (isBlank(request.name())) missing.add("name");
        if (isBlank(request.scopeType())) missing.add("scopeType");
        if (isBlank(request.scopeId())) missing.add("scopeId");
        if (request.amount() == null) missing.add("amount");
        if (isBlank(request.currency())) missing.add("currency");
        if (isBlank(request.period())) missing.add("period");
        if (isBlank(request.startDate())) missing.add("startDate");
        if (!missing.isEmpty()) throw ValidationException.missingFields(missing);

        ScopeType scopeType = parseScopeType(request.scopeType());
        BudgetPeriod period = parsePeriod(request.period());
        String currency = parseCurrency(request.currency());
        requirePositive(request.amount());
        Instant start = parseDate("startDate", request.startDate());
        Instant end = request.endDate() != null ? parseDate("endDate", request.endDate()) : null;
        checkDates(period, start, end);

        if (request.parentBudgetId() != null) {
            validateParent(request.parentBudgetId(), scopeType, currency, null);
        }

        Budget budget;
        try {
            budget = Budget.create(request.name().trim(), request.description(), scopeType, request.scopeId().trim(),
                    request.amount(), currency, period, start, end,
                    request.recurring() == null || request.recurring(),
                    parseAlerts(request.alerts()), request.tags(), createdBy, request.parentBudgetId());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        repository.save(budget);
        log.info("Created budget {} ({} {} {}) for {}:{}", budget.getId(), budget.getAmount(), budget.getCurrency(),
                budget.getPeriod().wireName(), scopeType.wireName(), budget.getScopeId());
        return budget;
    }

    /** Partial update: absent fields keep their values. */
    @Transactional
    public Budget updateBudget(UUID id, BudgetRequest request) {
        if (request == null) throw new ValidationException("Update body is required");
        Budget budget = getBudget(id);
        if (!budget.isActive()) throw new BudgetInactiveException(id);

        if (request.scopeType() != null && parseScopeType(request.scopeType()) != budget.getScopeType()
                || request.scopeId() != null && !request.scopeId().trim().equals(budget.getScopeId()))
            throw new ValidationException("Budget scope cannot be changed");

        String currency = request.currency() != null ? parseCurrency(request.currency()) : null;
        if (request.amount() != null) requirePositive(request.amount());
        BudgetPeriod period = request.period() != null ? parsePeriod(request.period()) : null;
        Instant start = request.startDate() != null ? parseDate("startDate", request.startDate()) : null;
        Instant end = request.endDate() != null ? parseDate("endDate", request.endDate()) : null;
        checkDates(period != null ? period : budget.getPeriod(),
                start != null ? start : budget.getStartDate(),
                end != null ? end : period == null && start == null ? budget.getEndDate() : null);

        boolean reparented = request.parentBudgetId() != null
                && !request.parentBudgetId().equals(budget.getParentBudgetId());
        if (currency != null && !currency.equals(budget.getCurrency())) {
            if (!reparented && budget.getParentBudgetId() != null) {
                repository.findById(budget.getParentBudgetId())
                        .filter(parent -> !parent.getCurrency().equals(currency))
                        .ifPresent(parent -> {
                            throw new ValidationException("Currency must match the parent budget's currency (%s)"
                                    .formatted(parent.getCurrency()));
                        });
            }
            boolean childrenDiffer = repository.findByParentBudgetId(id).stream()
                    .anyMatch(child -> child.isActive() && !child.getCurrency().equals(currency));
            if (childrenDiffer) throw new ValidationException("Currency must match the currency of child budgets");
        }
        if (reparented) {
            validateParent(request.parentBudgetId(), budget.getScopeType(),
                    currency != null ? currency : budget.getCurrency(), id);
        }

        try {
            budget.rename(request.name() != null ? request.name().trim() : null, request.description());
            budget.changeLimit(request.amount(), currency);
            budget.reschedule(period, start, end, request.recurring());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        if (request.alerts() != null) budget.replaceAlerts(parseAlerts(request.alerts()));
        if (request.tags() != null) budget.replaceTags(request.tags());
        if (reparented) budget.reparent(request.parentBudgetId());

        repository.save(budget);
        // A new parent changes which ancestors roll this budget up; limits only affect this one.
        if (reparented) statusCache.clear();
        else statusCache.invalidate(List.of(id));
        log.info("Updated budget {}", id);
        return budget;
    }

    @Transactional
    public Budget deleteBudget(UUID id) {
        Budget budget = getBudget(id);
        if (repository.existsByParentBudgetIdAndActiveTrue(id))
            throw new IllegalStateException("Budget %s still has active child budgets".formatted(id));
        budget.deactivate();
        repository.save(budget);
        statusCache.invalidate(List.of(id));
        log.info("Deactivated budget {}", id);
        return budget;
    }

    @Transactional(readOnly = true)
    public Budget getBudget(UUID id) {
        return repository.findById(id).orElseThrow(() -> new NotFoundException("Budget", id));
    }

    @Transactional(readOnly = true)
    public List<Budget> listBudgets(ScopeType scopeType, String scopeId, boolean includeInactive, UUID parentBudgetId) {
        return repository.findByScopeTypeAndScopeIdOrderByCreatedAtAsc(scopeType, scopeId).stream()
                .filter(b -> includeInactive || b.isActive())
                .filter(b -> parentBudgetId == null || parentBudgetId.equals(b.getParentBudgetId()))
                .toList();
    }

    /** The scope's active budget and all its ancestors, root first. */
    @Transactional(readOnly = true)
    public List<Budget> getBudgetHierarchy(ScopeType scopeType, String scopeId) {
        Budget leaf = findActiveForScope(scopeType, scopeId)
                .orElseThrow(() -> new NotFoundException("Budget for scope " + scopeType.wireName(), scopeId));
        return lineage(leaf);
    }

    @Transactional(readOnly = true)
    public Optional<Budget> findActiveForScope(ScopeType scopeType, String scopeId) {
        return repository.findByScopeTypeAndScopeIdOrderByCreatedAtAsc(scopeType, scopeId).stream()
                .filter(Budget::isActive)
                .findFirst();
    }

    /** {@code budget} and its ancestors, root first. */
    public List<Budget> lineage(Budget budget) {
        List<Budget> chain = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        Budget current = budget;
        while (current != null) {
            if (!seen.add(current.getId()))
                throw new IllegalStateException("Budget hierarchy contains a cycle at " + current.getId());
            chain.add(current);
            UUID parentId = current.getParentBudgetId();
            current = parentId == null ? null : repository.findById(parentId).orElse(null);
        }
        Collections.reverse(chain);
        return chain;
    }

    // ── Internal ───────────────────────────────────────────────────

    private void validateParent(UUID parentId, ScopeType childScope, String childCurrency, UUID childId) {
        Budget parent = repository.findById(parentId)
                .orElseThrow(() -> new ValidationException("Parent budget not found: " + parentId));
        if (!parent.isActive()) throw new ValidationException("Parent budget is inactive: " + parentId);
        if (!parent.getScopeType().canParent(childScope))
            throw new ValidationException("A %s budget cannot be the parent of a %s budget"
                    .formatted(parent.getScopeType().wireName(), childScope.wireName()));
        if (!Objects.equals(parent.getCurrency(), childCurrency))
            throw new ValidationException("Currency must match the parent budget's currency (%s)"
                    .formatted(parent.getCurrency()));
        if (childId != null) {
            for (Budget ancestor : lineage(parent)) {
                if (ancestor.getId().equals(childId))
                    throw new ValidationException("Re-parenting would create a cycle");
            }
        }
    }

    public static ScopeType parseScopeType(String value) {
        try {
            return ScopeType.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage()).hint("validTypes", ScopeType.wireNames());
        }
    }

    private static BudgetPeriod parsePeriod(String value) {
        try {
            return BudgetPeriod.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage()).hint("validPeriods", BudgetPeriod.wireNames());
        }
    }

    private static String parseCurrency(String value) {
        String currency = value.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY.matcher(currency).matches())
            throw new ValidationException("Currency must be a 3-letter ISO code but was " + value);
        return currency;
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount.signum() <= 0) throw new ValidationException("Budget amount must be positive");
    }

    private static void checkDates(BudgetPeriod period, Instant start, Instant end) {
        if (end != null && !end.isAfter(start))
            throw new ValidationException("End date must be after start date");
        if (period == BudgetPeriod.CUSTOM && end == null)
            throw new ValidationException("Custom period budgets need an end date");
    }

    public static Instant parseDate(String field, String value) {
        String text = value.trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException inner) {
                throw new ValidationException("%s must be an ISO-8601 date or instant".formatted(field));
            }
        }
    }

    private static List<BudgetAlert> parseAlerts(List<BudgetRequest.AlertRequest> alerts) {
        if (alerts == null) return List.of();
        List<BudgetAlert> parsed = new ArrayList<>();
        for (BudgetRequest.AlertRequest alert : alerts) {
            if (alert == null || alert.threshold() == null)
                throw new ValidationException("Every alert needs a threshold");
            try {
                List<AlertAction> actions = alert.actions() == null ? List.of()
                        : alert.actions().stream().map(AlertAction::fromWire).toList();
                parsed.add(new BudgetAlert(alert.threshold(), actions));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
        }
        return parsed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
