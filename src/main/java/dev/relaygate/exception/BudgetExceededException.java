package dev.relaygate.exception;

import dev.relaygate.domain.entity.UsageRecord;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A spend would cross a budget ceiling. When raised by a usage write, the
 * refused (unsaved) record is attached so the caller can compensate.
 */
public class BudgetExceededException extends GatewayException {

    private final transient UsageRecord refusedRecord;

    public BudgetExceededException(UUID budgetId, BigDecimal remaining, BigDecimal requested,
                                   List<UUID> exceededBudgets) {
        this(budgetId, remaining, requested, exceededBudgets, null);
    }

    public BudgetExceededException(UUID budgetId, BigDecimal remaining, BigDecimal requested,
                                   List<UUID> exceededBudgets, UsageRecord refusedRecord) {
        super(HttpStatus.PAYMENT_REQUIRED, "budget-exceeded", "Budget Exceeded",
                "Budget %s cannot cover %s (remaining %s)".formatted(budgetId, requested, remaining));
        this.refusedRecord = refusedRecord;
        property("budget_id", budgetId);
        property("remaining", remaining);
        property("requested", requested);
        property("exceeded_budgets", exceededBudgets);
    }

    public Optional<UsageRecord> getRefusedRecord() {
        return Optional.ofNullable(refusedRecord);
    }
}
