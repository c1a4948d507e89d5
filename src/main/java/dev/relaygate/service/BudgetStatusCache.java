package dev.relaygate.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.relaygate.config.BudgetProperties;
import dev.relaygate.domain.event.UsageRecordedEvent;
import dev.relaygate.domain.valueobject.BudgetStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through cache of computed budget statuses.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Caffeine</b> with expire-after-write at the configured TTL, timed by the
 *       injected {@link Clock} so expiry follows the same clock as the ledger.</li>
 *   <li><b>Generation guard</b>: every invalidation bumps the budget's generation. A status
 *       computed under an older generation is dropped instead of stored, so a slow reader
 *       racing a usage write can never re-populate the cache with the pre-write total.</li>
 *   <li><b>Invalidated twice</b>: once by the writer before it returns, and again after the
 *       transaction commits, which closes the window where a reader sees the old rows
 *       between those two points.</li>
 * </ul>
 */
@Component
public class BudgetStatusCache {

    private static final Logger log = LoggerFactory.getLogger(BudgetStatusCache.class);

    private final ConcurrentHashMap<UUID, AtomicLong> generations = new ConcurrentHashMap<>();
    private final Cache<UUID, BudgetStatus> entries;
    private final Duration ttl;

    public BudgetStatusCache(BudgetProperties properties, Clock clock) {
        this.ttl = properties.statusCacheTtl();
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Optional<BudgetStatus> get(UUID budgetId) {
        return Optional.ofNullable(entries.getIfPresent(budgetId));
    }

    /** Snapshot to pass back into {@link #putIfCurrent}. */
    public long generation(UUID budgetId) {
        return generations.computeIfAbsent(budgetId, id -> new AtomicLong()).get();
    }

    /** Stores the status unless the budget was invalidated after {@code generation} was read. */
    public void putIfCurrent(UUID budgetId, BudgetStatus status, long generation) {
        if (ttl.isZero()) return;
        entries.asMap().compute(budgetId, (id, previous) -> generation(id) == generation ? status : previous);
    }

    public void invalidate(Collection<UUID> budgetIds) {
        for (UUID id : budgetIds) {
            generations.computeIfAbsent(id, k -> new AtomicLong()).incrementAndGet();
            entries.invalidate(id);
        }
    }

    public void clear() {
        invalidate(List.copyOf(entries.asMap().keySet()));
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onUsageRecorded(UsageRecordedEvent event) {
        invalidate(event.lineage());
        log.debug("Evicted status of {} budgets after usage on {}", event.lineage().size(), event.budgetId());
    }
}
