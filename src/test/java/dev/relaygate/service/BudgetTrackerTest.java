package dev.relaygate.service;

import dev.relaygate.config.BudgetProperties;
import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.entity.UsageRecord;
import dev.relaygate.domain.enums.AlertAction;
import dev.relaygate.domain.enums.BudgetPeriod;
import dev.relaygate.domain.enums.ScopeType;
import dev.relaygate.domain.enums.StatusLevel;
import dev.relaygate.domain.enums.UsageSource;
import dev.relaygate.domain.event.UsageRecordedEvent;
import dev.relaygate.domain.valueobject.BudgetAlert;
import dev.relaygate.domain.valueobject.BudgetStatus;
import dev.relaygate.domain.valueobject.ConstraintCheck;
import dev.relaygate.exception.BudgetExceededException;
import dev.relaygate.exception.ValidationException;
import dev.relaygate.repository.BudgetRepository;
import dev.relaygate.repository.UsageRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Ledger arithmetic over mocked repositories. Row locking and the recursive subtree
 * query are covered against PostgreSQL in the integration suite.
 */
@ExtendWith(MockitoExtension.class)
class BudgetTrackerTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");

    @Mock
    private BudgetRepository budgets;

    @Mock
    private UsageRecordRepository usage;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private BudgetStatusCache statusCache;
    private BudgetTracker tracker;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BudgetProperties properties = new BudgetProperties(Duration.ofMinutes(5), true, "USD");
        statusCache = new BudgetStatusCache(properties, clock);
        BudgetRegistry registry = new BudgetRegistry(budgets, statusCache);
        tracker = new BudgetTracker(budgets, usage, registry, statusCache, eventPublisher, properties,
                new GatewayProperties(null, null, null, null, null, null, 0), clock, new SimpleMeterRegistry());
    }

    @Nested
    @DisplayName("recordUsage")
    class RecordUsage {

        @Test
        @DisplayName("saves the record and announces the whole lineage, root first")
        void savesAndPublishes() {
            Budget org = budget(ScopeType.ORGANIZATION, "1000", null);
            Budget team = budget(ScopeType.TEAM, "100", org.getId());
            stubLineage(org, team);
            when(budgets.findSubtreeIds(org.getId())).thenReturn(List.of(org.getId(), team.getId()));
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(any(), any(), any())).thenReturn(new BigDecimal("10"));

            UsageRecord record = tracker.recordUsage(team.getId(), new BigDecimal("2.50"), null,
                    UsageSource.EXTERNAL_CALLER, null, new BudgetTracker.UsageDetails("call", "req-1", "openai", "gpt-4"));

            assertThat(record.getCurrency()).isEqualTo("USD");
            assertThat(record.getTimestamp()).isNotNull();
            verify(usage).save(record);
            ArgumentCaptor<UsageRecordedEvent> event = ArgumentCaptor.forClass(UsageRecordedEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().lineage()).containsExactly(org.getId(), team.getId());
        }

        @Test
        @DisplayName("refuses when an ancestor is already at its limit and attaches the unsaved record")
        void hardCapOnAncestor() {
            Budget org = budget(ScopeType.ORGANIZATION, "100", null);
            Budget team = budget(ScopeType.TEAM, "100", org.getId());
            stubLineage(org, team);
            when(budgets.findSubtreeIds(org.getId())).thenReturn(List.of(org.getId(), team.getId()));
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(eq(List.of(org.getId(), team.getId())), any(), any()))
                    .thenReturn(new BigDecimal("100"));
            when(usage.sumAmount(eq(List.of(team.getId())), any(), any())).thenReturn(new BigDecimal("40"));

            assertThatThrownBy(() -> tracker.recordUsage(team.getId(), BigDecimal.TEN, "USD",
                    UsageSource.MANUAL, null, null))
                    .isInstanceOfSatisfying(BudgetExceededException.class, e -> {
                        assertThat(e.getRefusedRecord()).hasValueSatisfying(r ->
                                assertThat(r.getAmount()).isEqualByComparingTo("10"));
                        assertThat(e.properties().get("exceeded_budgets")).isEqualTo(List.of(org.getId()));
                        assertThat(e.properties().get("remaining")).isEqualTo(new BigDecimal("60"));
                    });
            verify(usage, never()).save(any());
        }

        @Test
        @DisplayName("a budget below its limit accepts usage that overshoots it")
        void overshootAllowedWhileBelowLimit() {
            Budget team = budget(ScopeType.TEAM, "100", null);
            stubLineage(team);
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(any(), any(), any())).thenReturn(new BigDecimal("60"));

            tracker.recordUsage(team.getId(), new BigDecimal("60"), "usd", UsageSource.MANUAL, null, null);

            verify(usage).save(any(UsageRecord.class));
        }

        @Test
        @DisplayName("rejects a currency other than the budget's")
        void currencyMismatch() {
            Budget team = budget(ScopeType.TEAM, "100", null);
            stubLineage(team);

            assertThatThrownBy(() -> tracker.recordUsage(team.getId(), BigDecimal.ONE, "EUR",
                    UsageSource.MANUAL, null, null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("does not match");
        }

        @Test
        @DisplayName("rejects non-positive amounts before touching storage")
        void nonPositiveAmount() {
            assertThatThrownBy(() -> tracker.recordUsage(UUID.randomUUID(), BigDecimal.ZERO, null,
                    UsageSource.MANUAL, null, null))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("checkBudgetConstraints")
    class CheckConstraints {

        @Test
        @DisplayName("an ancestor violation disallows and reports the tightest headroom")
        void ancestorViolation() {
            Budget org = budget(ScopeType.ORGANIZATION, "100", null);
            Budget team = budget(ScopeType.TEAM, "50", org.getId());
            when(budgets.findById(team.getId())).thenReturn(Optional.of(team));
            when(budgets.findById(org.getId())).thenReturn(Optional.of(org));
            when(budgets.findSubtreeIds(org.getId())).thenReturn(List.of(org.getId(), team.getId()));
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(eq(List.of(org.getId(), team.getId())), any(), any()))
                    .thenReturn(new BigDecimal("90"));
            when(usage.sumAmount(eq(List.of(team.getId())), any(), any())).thenReturn(new BigDecimal("20"));

            ConstraintCheck check = tracker.checkBudgetConstraints(team.getId(), new BigDecimal("15"));

            assertThat(check.allowed()).isFalse();
            assertThat(check.wouldExceed()).isTrue();
            assertThat(check.remaining()).isEqualByComparingTo("10");
            assertThat(check.violatingBudgetIds()).containsExactly(org.getId());
        }

        @Test
        @DisplayName("a crossed block-all alert disallows without exceeding")
        void blockingAlert() {
            Budget team = Budget.create("Team", null, ScopeType.TEAM, "t-1", new BigDecimal("100"), "USD",
                    BudgetPeriod.MONTHLY, Instant.parse("2025-01-01T00:00:00Z"), null, true,
                    List.of(new BudgetAlert(50, List.of(AlertAction.NOTIFY)),
                            new BudgetAlert(80, List.of(AlertAction.BLOCK_ALL))),
                    List.of(), "test", null);
            when(budgets.findById(team.getId())).thenReturn(Optional.of(team));
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(any(), any(), any())).thenReturn(new BigDecimal("70"));

            ConstraintCheck check = tracker.checkBudgetConstraints(team.getId(), new BigDecimal("15"));

            assertThat(check.allowed()).isFalse();
            assertThat(check.wouldExceed()).isFalse();
            assertThat(check.suggestedActions()).containsExactly(AlertAction.BLOCK_ALL);
            assertThat(check.remaining()).isEqualByComparingTo("30");
        }
    }

    @Nested
    @DisplayName("getBudgetStatus")
    class Status {

        @Test
        @DisplayName("reports overshoot as negative remaining and serves repeats from cache")
        void overshootAndCache() {
            Budget team = budget(ScopeType.TEAM, "100", null);
            when(budgets.findById(team.getId())).thenReturn(Optional.of(team));
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(any(), any(), any())).thenReturn(new BigDecimal("120"));

            BudgetStatus status = tracker.getBudgetStatus(team.getId());
            BudgetStatus again = tracker.getBudgetStatus(team.getId());

            assertThat(status.consumed()).isEqualByComparingTo("120");
            assertThat(status.remaining()).isEqualByComparingTo("-20");
            assertThat(status.level()).isEqualTo(StatusLevel.EXCEEDED);
            assertThat(status.periodStart()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
            assertThat(status.periodEnd()).isEqualTo(Instant.parse("2025-02-01T00:00:00Z"));
            assertThat(again).isSameAs(status);
            verify(usage, times(1)).sumAmount(any(), any(), any());
        }

        @Test
        @DisplayName("a usage write invalidates the cached status")
        void invalidatedByUsage() {
            Budget team = budget(ScopeType.TEAM, "100", null);
            when(budgets.findById(team.getId())).thenReturn(Optional.of(team));
            when(budgets.findByIdForUpdate(team.getId())).thenReturn(Optional.of(team));
            when(budgets.findSubtreeIds(team.getId())).thenReturn(List.of(team.getId()));
            when(usage.sumAmount(any(), any(), any()))
                    .thenReturn(new BigDecimal("10"), new BigDecimal("10"), new BigDecimal("15"));

            tracker.getBudgetStatus(team.getId());
            tracker.recordUsage(team.getId(), new BigDecimal("5"), null, UsageSource.MANUAL, null, null);

            assertThat(tracker.getBudgetStatus(team.getId()).consumed()).isEqualByComparingTo("15");
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private void stubLineage(Budget... rootFirst) {
        for (Budget b : rootFirst) {
            when(budgets.findById(b.getId())).thenReturn(Optional.of(b));
            when(budgets.findByIdForUpdate(b.getId())).thenReturn(Optional.of(b));
        }
    }

    private static Budget budget(ScopeType scope, String amount, UUID parent) {
        return Budget.create(scope.wireName(), null, scope, scope.wireName() + "-1", new BigDecimal(amount), "USD",
                BudgetPeriod.MONTHLY, Instant.parse("2025-01-01T00:00:00Z"), null, true, List.of(), List.of(),
                "test", parent);
    }
}
