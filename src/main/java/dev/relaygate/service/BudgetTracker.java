package dev.relaygate.service;

import dev.relaygate.config.BudgetProperties;
import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.entity.UsageRecord;
import dev.relaygate.domain.enums.AlertAction;
import dev.relaygate.domain.enums.StatusLevel;
import dev.relaygate.domain.enums.UsageSource;
import dev.relaygate.domain.event.UsageRecordedEvent;
import dev.relaygate.domain.valueobject.BudgetAlert;
import dev.relaygate.domain.valueobject.BudgetStatus;
import dev.relaygate.domain.valueobject.ConstraintCheck;
import dev.relaygate.domain.valueobject.ConstraintCheck.HierarchyViolation;
import dev.relaygate.domain.valueobject.PeriodWindow;
import dev.relaygate.domain.valueobject.UsageSummary;
import dev.relaygate.exception.BudgetExceededException;
import dev.relaygate.exception.BudgetInactiveException;
import dev.relaygate.exception.NotFoundException;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.repository.BudgetRepository;
import dev.relaygate.repository.UsageRecordRepository;
import dev.relaygate.repository.UsageRecordRepository.SourceTotal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Usage accounting against the budget tree.
 *
 * <p>Consumption of a budget is its own usage plus the usage of every descendant, summed
 * over the budget's current period window. Nothing stores a running total: each status
 * or check is a fresh aggregate over the append-only usage rows.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Row locks, root first</b>: a usage write locks the whole lineage with
 *       {@code SELECT ... FOR UPDATE} in root-to-leaf order. Writers on overlapping subtrees
 *       serialize on their shared ancestor and cannot deadlock against each other.</li>
 *   <li><b>Hard cap at write time</b>: under the locks, a write is refused when any level is
 *       already at or over its limit. Concurrent writers that each passed a stale check can
 *       overshoot by at most one in-flight amount.</li>
 *   <li><b>Refused record travels with the error</b>: {@link BudgetExceededException}
 *       carries the unsaved record so the caller can compensate or reconcile.</li>
 * </ul>
 */
@Service
public class BudgetTracker {

    private static final Logger log = LoggerFactory.getLogger(BudgetTracker.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 6;

    private final BudgetRepository budgets;
    private final UsageRecordRepository usage;
    private final BudgetRegistry registry;
    private final BudgetStatusCache statusCache;
    private final ApplicationEventPublisher eventPublisher;
    private final BudgetProperties properties;
    private final GatewayProperties.Alerts alertLevels;
    private final Clock clock;
    private final Counter refusedCounter;

    public BudgetTracker(BudgetRepository budgets, UsageRecordRepository usage, BudgetRegistry registry,
                         BudgetStatusCache statusCache, ApplicationEventPublisher eventPublisher,
                         BudgetProperties properties, GatewayProperties gatewayProperties, Clock clock,
                         MeterRegistry meterRegistry) {
        this.budgets = budgets;
        this.usage = usage;
        this.registry = registry;
        this.statusCache = statusCache;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.alertLevels = gatewayProperties.alerts();
        this.clock = clock;
        this.refusedCounter = Counter.builder("relaygate.budget.usage.refused")
                .description("Usage writes refused by the hard cap")
                .register(meterRegistry);
    }

    /** Optional attribution carried on a usage record. */
    public record UsageDetails(String description, String requestId, String provider, String model) {
        public static UsageDetails none() {
            return new UsageDetails(null, null, null, null);
        }
    }

    // ── Writes ─────────────────────────────────────────────────────

    @Transactional
    public UsageRecord recordUsage(UUID budgetId, BigDecimal amount, String currency, UsageSource source,
                                   Instant timestamp, UsageDetails details) {
        if (amount == null || amount.signum() <= 0)
            throw new ValidationException("Usage amount must be positive");
        Budget target = budgets.findById(budgetId).orElseThrow(() -> new NotFoundException("Budget", budgetId));
        List<Budget> lineage = lockLineage(target);
        target = lineage.get(lineage.size() - 1);
        if (!target.isActive()) throw new BudgetInactiveException(budgetId);

        String effectiveCurrency = currency == null || currency.isBlank()
                ? target.getCurrency() : currency.trim().toUpperCase(Locale.ROOT);
        if (!effectiveCurrency.equals(target.getCurrency()))
            throw new ValidationException("Currency %s does not match budget currency %s"
                    .formatted(effectiveCurrency, target.getCurrency()));

        UsageDetails d = details != null ? details : UsageDetails.none();
        UsageRecord record = UsageRecord.create(budgetId, amount, effectiveCurrency,
                source != null ? source : UsageSource.GATEWAY_INTERNAL, timestamp,
                d.description(), d.requestId(), d.provider(), d.model());

        Instant now = clock.instant();
        if (properties.enforceHardCap()) {
            List<UUID> exhausted = new ArrayList<>();
            BigDecimal targetRemaining = null;
            for (Budget level : lineage) {
                BigDecimal consumed = consumption(level, now);
                if (consumed.compareTo(level.getAmount()) >= 0) exhausted.add(level.getId());
                if (level.getId().equals(budgetId)) targetRemaining = level.getAmount().subtract(consumed);
            }
            if (!exhausted.isEmpty()) {
                refusedCounter.increment();
                log.warn("Refused usage of {} on budget {}: limit already reached on {}", amount, budgetId, exhausted);
                throw new BudgetExceededException(budgetId, targetRemaining, amount, exhausted, record);
            }
        }

        usage.save(record);
        List<UUID> lineageIds = lineage.stream().map(Budget::getId).toList();
        statusCache.invalidate(lineageIds);
        eventPublisher.publishEvent(new UsageRecordedEvent(record.getId(), budgetId, lineageIds, amount, now));
        log.info("Recorded usage {} {} on budget {} ({})", amount, effectiveCurrency, budgetId,
                record.getSource().wireName());
        return record;
    }

    // ── Reads ──────────────────────────────────────────────────────

    /**
     * Checks {@code estimatedCost} against the budget and every ancestor using fresh
     * aggregates (never the status cache).
     */
    @Transactional(readOnly = true)
    public ConstraintCheck checkBudgetConstraints(UUID budgetId, BigDecimal estimatedCost) {
        if (estimatedCost == null || estimatedCost.signum() < 0)
            throw new ValidationException("Estimated cost must be zero or positive");
        Budget target = registry.getBudget(budgetId);
        if (!target.isActive()) throw new BudgetInactiveException(budgetId);

        Instant now = clock.instant();
        List<HierarchyViolation> violations = new ArrayList<>();
        BigDecimal tightest = null;
        BigDecimal targetConsumed = BigDecimal.ZERO;
        for (Budget level : registry.lineage(target)) {
            BigDecimal consumed = consumption(level, now);
            BigDecimal remaining = level.getAmount().subtract(consumed);
            if (tightest == null || remaining.compareTo(tightest) < 0) tightest = remaining;
            if (consumed.add(estimatedCost).compareTo(level.getAmount()) > 0) {
                violations.add(new HierarchyViolation(level.getId(), level.getName(), level.getAmount(),
                        consumed, estimatedCost));
            }
            if (level.getId().equals(budgetId)) targetConsumed = consumed;
        }

        boolean wouldExceed = !violations.isEmpty();
        String reason = wouldExceed
                ? "Would exceed the limit of %d budget(s) in the hierarchy".formatted(violations.size())
                : null;
        boolean allowed = !wouldExceed;

        double projectedPercent = percent(targetConsumed.add(estimatedCost), target.getAmount());
        List<AlertAction> suggested = target.getAlerts().stream()
                .filter(a -> projectedPercent >= a.threshold())
                .max(Comparator.comparingDouble(BudgetAlert::threshold))
                .map(BudgetAlert::actions)
                .orElse(List.of());
        if (allowed && suggested.contains(AlertAction.BLOCK_ALL)) {
            allowed = false;
            reason = "Would cross a blocking alert threshold (%.1f%%)".formatted(projectedPercent);
        } else if (allowed && suggested.contains(AlertAction.REQUIRE_APPROVAL)) {
            allowed = false;
            reason = "Requires approval: would cross an alert threshold (%.1f%%)".formatted(projectedPercent);
        }

        return new ConstraintCheck(budgetId, allowed, tightest, wouldExceed, estimatedCost,
                target.getCurrency(), reason, suggested, violations);
    }

    /** Cache-first; a miss computes and stores under the generation guard. */
    @Transactional(readOnly = true)
    public BudgetStatus getBudgetStatus(UUID budgetId) {
        return statusCache.get(budgetId).orElseGet(() -> computeAndCache(budgetId));
    }

    @Transactional(readOnly = true)
    public BudgetStatus refreshStatusCache(UUID budgetId) {
        statusCache.invalidate(List.of(budgetId));
        return computeAndCache(budgetId);
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<UsageRecord> getUsageHistory(UUID budgetId, int limit, int offset) {
        if (limit < 1 || limit > 1000) throw new ValidationException("limit must be between 1 and 1000");
        if (offset < 0) throw new ValidationException("offset must not be negative");
        registry.getBudget(budgetId);
        return usage.findHistory(budgetId, limit, offset);
    }

    /**
     * Direct usage of this budget between {@code start} and {@code end}; defaults to
     * the current period window.
     */
    @Transactional(readOnly = true)
    public UsageSummary getUsageSummary(UUID budgetId, Instant start, Instant end) {
        Budget budget = registry.getBudget(budgetId);
        PeriodWindow window = budget.windowAt(clock.instant());
        Instant from = start != null ? start : window.start();
        Instant to = end != null ? end : window.end();
        if (!to.isAfter(from)) throw new ValidationException("End date must be after start date");

        Map<String, BigDecimal> bySource = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        long count = 0;
        for (SourceTotal row : usage.totalsBySource(budgetId, from, to)) {
            bySource.put(row.source().wireName(), row.total());
            total = total.add(row.total());
            count += row.count();
        }
        Instant effectiveEnd = to.isAfter(clock.instant()) ? clock.instant() : to;
        long days = Math.max(1, ceilDays(Duration.between(from, effectiveEnd)));
        BigDecimal perDay = total.divide(BigDecimal.valueOf(days), SCALE, RoundingMode.HALF_UP);
        return new UsageSummary(budgetId, total, budget.getCurrency(), count, perDay, bySource, from, to);
    }

    // ── Internal ───────────────────────────────────────────────────

    private List<Budget> lockLineage(Budget target) {
        List<Budget> locked = new ArrayList<>();
        for (Budget level : registry.lineage(target)) {
            locked.add(budgets.findByIdForUpdate(level.getId())
                    .orElseThrow(() -> new NotFoundException("Budget", level.getId())));
        }
        return locked;
    }

    private BigDecimal consumption(Budget budget, Instant now) {
        PeriodWindow window = budget.windowAt(now);
        List<UUID> subtree = budgets.findSubtreeIds(budget.getId());
        return usage.sumAmount(subtree, window.start(), window.end());
    }

    private BudgetStatus computeAndCache(UUID budgetId) {
        long generation = statusCache.generation(budgetId);
        BudgetStatus status = computeStatus(registry.getBudget(budgetId));
        statusCache.putIfCurrent(budgetId, status, generation);
        return status;
    }

    private BudgetStatus computeStatus(Budget budget) {
        Instant now = clock.instant();
        PeriodWindow window = budget.windowAt(now);
        BigDecimal consumed = consumption(budget, now);
        BigDecimal limit = budget.getAmount();
        double percentUsed = percent(consumed, limit);
        StatusLevel level = StatusLevel.of(percentUsed, alertLevels.budgetWarningPercent(),
                alertLevels.budgetCriticalPercent());

        boolean openEnded = window.end().equals(Budget.OPEN_END);
        long daysRemaining = openEnded || !now.isBefore(window.end())
                ? 0 : ceilDays(Duration.between(now, window.end()));
        long daysSoFar = Math.max(1, ceilDays(Duration.between(window.start(), now)));
        BigDecimal burnRate = consumed.divide(BigDecimal.valueOf(daysSoFar), SCALE, RoundingMode.HALF_UP);
        BigDecimal projected = consumed.add(burnRate.multiply(BigDecimal.valueOf(daysRemaining)));

        List<BudgetAlert> triggered = budget.getAlerts().stream()
                .filter(a -> percentUsed >= a.threshold())
                .toList();
        return new BudgetStatus(budget.getId(), budget.getCurrency(), consumed, limit, limit.subtract(consumed),
                percentUsed, level, window.start(), window.end(), daysRemaining, burnRate, projected,
                triggered, now);
    }

    private static double percent(BigDecimal consumed, BigDecimal limit) {
        return consumed.multiply(HUNDRED).divide(limit, 4, RoundingMode.HALF_UP).doubleValue();
    }

    private static long ceilDays(Duration duration) {
        if (duration.isNegative() || duration.isZero()) return 0;
        long days = duration.toDays();
        return duration.minusDays(days).isZero() ? days : days + 1;
    }
}
