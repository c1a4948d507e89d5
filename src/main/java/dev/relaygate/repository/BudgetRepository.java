package dev.relaygate.repository;

import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.enums.ScopeType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    List<Budget> findByScopeTypeAndScopeIdOrderByCreatedAtAsc(ScopeType scopeType, String scopeId);

    List<Budget> findByParentBudgetId(UUID parentBudgetId);

    boolean existsByParentBudgetIdAndActiveTrue(UUID parentBudgetId);

    /** Row lock held until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Budget b where b.id = :id")
    Optional<Budget> findByIdForUpdate(@Param("id") UUID id);

    /** The budget itself plus every descendant, at any depth. */
    @Query(value = """
            WITH RECURSIVE subtree(id) AS (
                SELECT b.id FROM budgets b WHERE b.id = :id
                UNION ALL
                SELECT c.id FROM budgets c JOIN subtree s ON c.parent_budget_id = s.id
            )
            SELECT id FROM subtree
            """, nativeQuery = true)
    List<UUID> findSubtreeIds(@Param("id") UUID id);
}
