package dev.relaygate.domain.entity;

import dev.relaygate.domain.enums.BudgetPeriod;
import dev.relaygate.domain.enums.ScopeType;
import dev.relaygate.domain.valueobject.BudgetAlert;
import dev.relaygate.domain.valueobject.PeriodWindow;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A spending ceiling for one scope over one period.
 *
 * Design: budgets form a tree through {@code parentBudgetId} (plain column, not a
 * JPA association, so lineage walks and row locks stay explicit), optimistic
 * locking (@Version) for concurrent admin edits, soft delete via {@code active}.
 */
@Entity
@Table(name = "budgets", indexes = {
        @Index(name = "idx_budget_scope", columnList = "scope_type, scope_id"),
        @Index(name = "idx_budget_parent", columnList = "parent_budget_id"),
        @Index(name = "idx_budget_active", columnList = "active")
})
public class Budget {

    /** Stand-in end for windows that never close; stays within SQL timestamp range. */
    public static final Instant OPEN_END = Instant.parse("9999-12-31T00:00:00Z");

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, length = 20)
    private ScopeType scopeType;

    @Column(name = "scope_id", nullable = false)
    private String scopeId;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BudgetPeriod period;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(nullable = false)
    private boolean recurring;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "alerts", columnDefinition = "jsonb", nullable = false)
    private List<BudgetAlert> alerts = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb", nullable = false)
    private List<String> tags = new ArrayList<>();

    @Column(name = "created_by", nullable = false, length = 128)
    private String createdBy;

    @Column(name = "parent_budget_id", columnDefinition = "uuid")
    private UUID parentBudgetId;

    @Column(nullable = false)
    private boolean active;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Budget() {
    }

    public static Budget create(String name, String description, ScopeType scopeType, String scopeId,
                                BigDecimal amount, String currency, BudgetPeriod period,
                                Instant startDate, Instant endDate, boolean recurring,
                                List<BudgetAlert> alerts, List<String> tags, String createdBy,
                                UUID parentBudgetId) {
        Budget b = new Budget();
        b.id = UUID.randomUUID();
        b.name = name;
        b.description = description;
        b.scopeType = scopeType;
        b.scopeId = scopeId;
        b.amount = amount;
        b.currency = currency;
        b.period = period;
        b.startDate = startDate;
        b.endDate = endDate != null || period == BudgetPeriod.CUSTOM ? endDate : period.endAfter(startDate);
        b.recurring = recurring && period != BudgetPeriod.CUSTOM;
        b.alerts = alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
        b.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        b.createdBy = createdBy != null ? createdBy : "system";
        b.parentBudgetId = parentBudgetId;
        b.active = true;
        b.createdAt = Instant.now();
        b.updatedAt = b.createdAt;
        b.checkInvariants();
        return b;
    }

    /**
     * The period window that is current at {@code now}. Recurring budgets roll
     * forward by whole periods from {@code startDate}; others use their fixed range.
     */
    public PeriodWindow windowAt(Instant now) {
        if (!recurring || period == BudgetPeriod.CUSTOM) {
            return new PeriodWindow(startDate, endDate != null ? endDate : OPEN_END);
        }
        Instant windowStart = startDate;
        Instant windowEnd = period.endAfter(windowStart);
        while (!now.isBefore(windowEnd)) {
            windowStart = windowEnd;
            windowEnd = period.endAfter(windowStart);
        }
        return new PeriodWindow(windowStart, windowEnd);
    }

    // ── Mutations ──────────────────────────────────────────────────

    public void rename(String name, String description) {
        if (name != null) this.name = name;
        if (description != null) this.description = description;
        touch();
    }

    public void changeLimit(BigDecimal amount, String currency) {
        if (amount != null) this.amount = amount;
        if (currency != null) this.currency = currency;
        checkInvariants();
        touch();
    }

    public void reschedule(BudgetPeriod period, Instant startDate, Instant endDate, Boolean recurring) {
        if (period != null) this.period = period;
        if (startDate != null) this.startDate = startDate;
        if (endDate != null) this.endDate = endDate;
        else if (period != null || startDate != null)
            this.endDate = this.period == BudgetPeriod.CUSTOM ? this.endDate : this.period.endAfter(this.startDate);
        if (recurring != null) this.recurring = recurring;
        if (this.period == BudgetPeriod.CUSTOM) this.recurring = false;
        checkInvariants();
        touch();
    }

    public void replaceAlerts(List<BudgetAlert> alerts) {
        this.alerts = new ArrayList<>(alerts);
        touch();
    }

    public void replaceTags(List<String> tags) {
        this.tags = new ArrayList<>(tags);
        touch();
    }

    public void reparent(UUID parentBudgetId) {
        this.parentBudgetId = parentBudgetId;
        touch();
    }

    public void deactivate() {
        if (!active) throw new IllegalStateException("Budget %s is already inactive".formatted(id));
        this.active = false;
        touch();
    }

    private void checkInvariants() {
        if (amount == null || amount.signum() <= 0)
            throw new IllegalArgumentException("Budget amount must be positive");
        if (endDate != null && !endDate.isAfter(startDate))
            throw new IllegalArgumentException("End date must be after start date");
        if (period == BudgetPeriod.CUSTOM && endDate == null)
            throw new IllegalArgumentException("Custom period budgets need an end date");
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ScopeType getScopeType() {
        return scopeType;
    }

    public String getScopeId() {
        return scopeId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public BudgetPeriod getPeriod() {
        return period;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public List<BudgetAlert> getAlerts() {
        return List.copyOf(alerts);
    }

    public List<String> getTags() {
        return List.copyOf(tags);
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public UUID getParentBudgetId() {
        return parentBudgetId;
    }

    public boolean isActive() {
        return active;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
