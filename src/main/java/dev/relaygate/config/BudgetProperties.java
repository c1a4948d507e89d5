package dev.relaygate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Budget ledger settings.
 *
 * @param statusCacheTtl how long a computed {@code BudgetStatus} may be served from memory
 * @param enforceHardCap refuse usage writes against a budget (or ancestor) that is already at its limit
 * @param defaultCurrency currency assumed when a caller omits it
 */
@ConfigurationProperties(prefix = "relaygate.budget")
public record BudgetProperties(Duration statusCacheTtl, Boolean enforceHardCap, String defaultCurrency) {

    public BudgetProperties {
        if (statusCacheTtl == null) statusCacheTtl = Duration.ofMinutes(5);
        if (enforceHardCap == null) enforceHardCap = Boolean.TRUE;
        if (defaultCurrency == null) defaultCurrency = "USD";
        if (statusCacheTtl.isNegative())
            throw new IllegalArgumentException("relaygate.budget.status-cache-ttl must not be negative");
    }
}
