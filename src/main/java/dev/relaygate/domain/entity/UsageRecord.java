package dev.relaygate.domain.entity;

import dev.relaygate.domain.enums.UsageSource;
import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One debit against a budget. Append-only: no setters, no update path.
 * Ids are assigned on creation, so {@link #isNew()} tells Spring Data to insert
 * instead of merging.
 */
@Entity
@Table(name = "usage_records", indexes = {
        @Index(name = "idx_usage_budget_time", columnList = "budget_id, occurred_at"),
        @Index(name = "idx_usage_request", columnList = "request_id")
})
public class UsageRecord implements Persistable<UUID> {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID budgetId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private UsageSource source;

    @Column(length = 1000, updatable = false)
    private String description;

    @Column(name = "request_id", length = 64, updatable = false)
    private String requestId;

    @Column(length = 50, updatable = false)
    private String provider;

    @Column(length = 100, updatable = false)
    private String model;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    private boolean fresh = true;

    protected UsageRecord() {
    }

    public static UsageRecord create(UUID budgetId, BigDecimal amount, String currency, UsageSource source,
                                     Instant timestamp, String description, String requestId,
                                     String provider, String model) {
        UsageRecord r = new UsageRecord();
        r.id = UUID.randomUUID();
        r.budgetId = budgetId;
        r.amount = amount;
        r.currency = currency;
        r.source = source;
        r.description = description;
        r.requestId = requestId;
        r.provider = provider;
        r.model = model;
        r.createdAt = Instant.now();
        r.timestamp = timestamp != null ? timestamp : r.createdAt;
        return r;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    // Getters
    @Override
    public UUID getId() {
        return id;
    }

    public UUID getBudgetId() {
        return budgetId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public UsageSource getSource() {
        return source;
    }

    public String getDescription() {
        return description;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
