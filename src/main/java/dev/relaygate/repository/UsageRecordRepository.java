package dev.relaygate.repository;

import dev.relaygate.domain.entity.UsageRecord;
import dev.relaygate.domain.enums.UsageSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, UUID> {

    @Query("""
            select coalesce(sum(u.amount), 0) from UsageRecord u
            where u.budgetId in :budgetIds and u.timestamp >= :from and u.timestamp < :to
            """)
    BigDecimal sumAmount(@Param("budgetIds") Collection<UUID> budgetIds,
                         @Param("from") Instant from, @Param("to") Instant to);

    @Query(value = """
            SELECT * FROM usage_records WHERE budget_id = :budgetId
            ORDER BY occurred_at DESC, created_at DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<UsageRecord> findHistory(@Param("budgetId") UUID budgetId,
                                  @Param("limit") int limit, @Param("offset") int offset);

    long countByBudgetId(UUID budgetId);

    @Query("""
            select new dev.relaygate.repository.UsageRecordRepository$SourceTotal(u.source, sum(u.amount), count(u))
            from UsageRecord u
            where u.budgetId = :budgetId and u.timestamp >= :from and u.timestamp < :to
            group by u.source
            """)
    List<SourceTotal> totalsBySource(@Param("budgetId") UUID budgetId,
                                     @Param("from") Instant from, @Param("to") Instant to);

    record SourceTotal(UsageSource source, BigDecimal total, Long count) {}
}
