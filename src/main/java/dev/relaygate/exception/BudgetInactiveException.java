package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class BudgetInactiveException extends GatewayException {

    public BudgetInactiveException(UUID budgetId) {
        super(HttpStatus.CONFLICT, "budget-inactive", "Budget Inactive", "Budget is inactive: " + budgetId);
    }
}
