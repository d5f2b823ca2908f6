package io.github.samzhu.governor.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.governor.config.GovernorProperties;
import io.github.samzhu.governor.config.GovernorProperties.BudgetLimits;
import io.github.samzhu.governor.exception.AdmissionDeniedException;
import io.github.samzhu.governor.exception.BudgetExceededException;
import io.github.samzhu.governor.exception.InvalidBudgetException;
import io.github.samzhu.governor.exception.LedgerQueryException;
import io.github.samzhu.governor.ledger.UsageLedger;
import io.github.samzhu.governor.ledger.UsageTotals;
import io.github.samzhu.governor.support.InMemoryUsageLedger;
import io.github.samzhu.governor.support.MutableClock;

class BudgetTrackerTest {

    private static final Instant NOW = Instant.parse("2025-12-09T10:00:00Z");

    private MutableClock clock;
    private InMemoryUsageLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        ledger = new InMemoryUsageLedger();
    }

    private BudgetTracker tracker(String daily, String weekly, String monthly, String costPerOperation) {
        return tracker(ledger, new BudgetLimits(
            new BigDecimal(daily), new BigDecimal(weekly), new BigDecimal(monthly), new BigDecimal(costPerOperation),
            null, null, null));
    }

    private BudgetTracker tracker(UsageLedger usageLedger, BudgetLimits limits) {
        return new BudgetTracker(usageLedger, new GovernorProperties(null, limits, null, null), clock);
    }

    @Test
    void shouldComputeStatusFromSuccessfulUsage() {
        // Given
        BudgetTracker tracker = tracker("10.00", "0", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(1)), "2.50", true);
        ledger.record(NOW.minus(Duration.ofMinutes(30)), "1.25", true);
        ledger.record(NOW.minus(Duration.ofMinutes(10)), "0.75", true);

        // When
        BudgetStatus status = tracker.getStatus();

        // Then
        assertThat(status.dailySpend()).isEqualByComparingTo("4.50");
        assertThat(status.dailyRemaining()).isEqualByComparingTo("5.50");
        assertThat(status.dailyOps()).isEqualTo(3);
        assertThat(status.monthlySpend()).isEqualByComparingTo("4.50");
        assertThat(status.monthlyRemaining()).isEqualByComparingTo("95.50");
        assertThat(status.monthlyOps()).isEqualTo(3);
    }

    @Test
    void shouldReturnFullBudgetWhenNoUsage() {
        BudgetTracker tracker = tracker("5.00", "0", "50.00", "0.001");

        BudgetStatus status = tracker.getStatus();

        assertThat(status.dailySpend()).isEqualByComparingTo("0");
        assertThat(status.dailyRemaining()).isEqualByComparingTo("5.00");
        assertThat(status.dailyOps()).isZero();
        assertThat(status.monthlyRemaining()).isEqualByComparingTo("50.00");
    }

    @Test
    void shouldUseRollingWindowsInsteadOfCalendarBoundaries() {
        // Given: 一筆 23 小時前（前一個日曆日）、一筆 25 小時前、一筆 8 天前、一筆 31 天前
        BudgetTracker tracker = tracker("10.00", "50.00", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(23)), "1.00", true);
        ledger.record(NOW.minus(Duration.ofHours(25)), "2.00", true);
        ledger.record(NOW.minus(Duration.ofDays(8)), "4.00", true);
        ledger.record(NOW.minus(Duration.ofDays(31)), "8.00", true);

        // When
        BudgetStatus status = tracker.getStatus();

        // Then
        assertThat(status.dailySpend()).isEqualByComparingTo("1.00");
        assertThat(status.weeklySpend()).isEqualByComparingTo("3.00");
        assertThat(status.monthlySpend()).isEqualByComparingTo("7.00");
    }

    @Test
    void shouldIgnoreFailedOperations() {
        // Given: $3.00 成功 + $8.00 失敗
        BudgetTracker tracker = tracker("10.00", "0", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(2)), "1.50", true);
        ledger.record(NOW.minus(Duration.ofHours(1)), "1.50", true);
        ledger.record(NOW.minus(Duration.ofMinutes(90)), "5.00", false);
        ledger.record(NOW.minus(Duration.ofMinutes(45)), "3.00", false);

        // When
        BudgetStatus status = tracker.getStatus();

        // Then
        assertThat(status.dailySpend()).isEqualByComparingTo("3.00");
        assertThat(status.dailyOps()).isEqualTo(2);
        assertThat(status.dailyRemaining()).isEqualByComparingTo("7.00");
    }

    @Test
    void shouldAllowOperationWithinBudget() {
        BudgetTracker tracker = tracker("10.00", "0", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(1)), "2.00", true);
        ledger.record(NOW.minus(Duration.ofMinutes(30)), "1.00", true);

        assertThatCode(() -> tracker.checkBudget(new BigDecimal("5.00"))).doesNotThrowAnyException();
    }

    @Test
    void shouldAcceptExactLimitAndRejectAnythingAbove() {
        // Given: daily $10, spend $7
        BudgetTracker tracker = tracker("10.00", "0", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(1)), "7.00", true);

        // Then
        assertThatCode(() -> tracker.checkBudget(new BigDecimal("3.00"))).doesNotThrowAnyException();
        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("3.01")))
            .isInstanceOf(BudgetExceededException.class)
            .hasMessageContaining("daily");
    }

    @Test
    void shouldRejectWhenDailyBudgetWouldBeExceeded() {
        // Given: $4.50 spent, daily $5.00
        BudgetTracker tracker = tracker("5.00", "0", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(1)), "3.00", true);
        ledger.record(NOW.minus(Duration.ofMinutes(30)), "1.50", true);

        // When/Then
        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("1.00")))
            .isInstanceOf(AdmissionDeniedException.class)
            .hasMessageContaining("daily budget would be exceeded")
            .hasMessageContaining("4.500")
            .hasMessageContaining("1.000")
            .hasMessageContaining("5.00")
            .satisfies(e -> {
                BudgetExceededException denied = (BudgetExceededException) e;
                assertThat(denied.getWindow()).isEqualTo(BudgetWindow.DAILY);
                assertThat(denied.getScope()).isEqualTo(BudgetExceededException.Scope.LOCAL);
                assertThat(denied.getSpend()).isEqualByComparingTo("4.50");
                assertThat(denied.getEstimatedCost()).isEqualByComparingTo("1.00");
                assertThat(denied.getLimit()).isEqualByComparingTo("5.00");
                assertThat(denied.getHint()).contains("24-hour rolling window");
                assertThat(denied.getDetails()).contains("Daily remaining: $0.5000");
            });
    }

    @Test
    void shouldFormatAmountsIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            // Given: $4.50 spent, daily $5.00, on a host whose locale uses a decimal comma
            BudgetTracker tracker = tracker("5.00", "0", "100.00", "0.002");
            ledger.record(NOW.minus(Duration.ofHours(1)), "4.50", true);

            // When/Then
            assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("1.00")))
                .isInstanceOf(BudgetExceededException.class)
                .hasMessage("daily budget would be exceeded: current $4.500 + estimated $1.000 > limit $5.00")
                .satisfies(e -> assertThat(((BudgetExceededException) e).getDetails()).contains(
                    "Daily spend: $4.5000 (local $4.5000 + peers $0.0000)",
                    "Daily remaining: $0.5000"));
            assertThatThrownBy(() -> tracker.updateDailyBudget(new BigDecimal("-1.50")))
                .hasMessage("daily budget cannot be negative: -1.50");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void shouldRejectWhenMonthlyBudgetWouldBeExceeded() {
        // Given: daily 高、monthly 低，月內已花 $48
        BudgetTracker tracker = tracker("20.00", "0", "50.00", "0.002");
        ledger.record(NOW.minus(Duration.ofDays(5)), "15.00", true);
        ledger.record(NOW.minus(Duration.ofDays(3)), "18.00", true);
        ledger.record(NOW.minus(Duration.ofHours(1)), "15.00", true);

        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("5.00")))
            .isInstanceOf(BudgetExceededException.class)
            .hasMessageContaining("monthly budget would be exceeded")
            .hasMessageContaining("48.000")
            .hasMessageContaining("5.000")
            .hasMessageContaining("50.00")
            .satisfies(e -> assertThat(((BudgetExceededException) e).getHint()).contains("30-day"));
    }

    @Test
    void shouldSkipWeeklyCheckWhenWeeklyBudgetIsUnset() {
        // Given: weekly = 0 (未設定)，週內花費遠超 0
        BudgetTracker tracker = tracker("20.00", "0", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofDays(2)), "30.00", true);

        assertThatCode(() -> tracker.checkBudget(new BigDecimal("1.00"))).doesNotThrowAnyException();
    }

    @Test
    void shouldEnforceWeeklyBudgetWhenSet() {
        BudgetTracker tracker = tracker("20.00", "35.00", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofDays(2)), "30.00", true);

        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("6.00")))
            .isInstanceOf(BudgetExceededException.class)
            .hasMessageContaining("weekly budget would be exceeded")
            .satisfies(e -> assertThat(((BudgetExceededException) e).getWindow()).isEqualTo(BudgetWindow.WEEKLY));
    }

    @Test
    void shouldReportFirstExceededWindowInOrder() {
        // Given: daily 與 monthly 都會超出，應回報 daily
        BudgetTracker tracker = tracker("1.00", "0", "1.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(1)), "0.90", true);

        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("0.50")))
            .isInstanceOf(BudgetExceededException.class)
            .satisfies(e -> assertThat(((BudgetExceededException) e).getWindow()).isEqualTo(BudgetWindow.DAILY));
    }

    @Test
    void shouldRejectAnySpendWithZeroDailyBudget() {
        BudgetTracker tracker = tracker("0", "0", "0", "0.002");

        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("0.01")))
            .isInstanceOf(BudgetExceededException.class)
            .hasMessageContaining("daily budget would be exceeded");
        assertThatCode(() -> tracker.checkBudget(BigDecimal.ZERO)).doesNotThrowAnyException();
    }

    @Test
    void shouldWrapLedgerFailureWithWindow() {
        // Given: 週查詢失敗
        UsageLedger failing = mock(UsageLedger.class);
        when(failing.sumSuccessful(NOW.minus(Duration.ofHours(24)))).thenReturn(UsageTotals.empty());
        when(failing.sumSuccessful(NOW.minus(Duration.ofDays(7))))
            .thenThrow(new IllegalStateException("connection refused"));
        BudgetTracker tracker = tracker(failing, BudgetLimits.defaults());

        // When/Then
        assertThatThrownBy(tracker::getStatus)
            .isInstanceOf(LedgerQueryException.class)
            .isNotInstanceOf(AdmissionDeniedException.class)
            .hasMessageContaining("weekly")
            .hasRootCauseMessage("connection refused")
            .satisfies(e -> assertThat(((LedgerQueryException) e).getWindow()).isEqualTo(BudgetWindow.WEEKLY));
    }

    @Test
    void checkBudgetShouldPropagateLedgerFailureInsteadOfDenying() {
        UsageLedger failing = mock(UsageLedger.class);
        when(failing.sumSuccessful(any())).thenThrow(new IllegalStateException("timeout"));
        BudgetTracker tracker = tracker(failing, BudgetLimits.defaults());

        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("0.01")))
            .isInstanceOf(LedgerQueryException.class)
            .satisfies(e -> assertThat(((LedgerQueryException) e).getWindow()).isEqualTo(BudgetWindow.DAILY));
    }

    @Test
    void shouldDescribeLedgerFailureWithoutMessage() {
        UsageLedger failing = mock(UsageLedger.class);
        when(failing.sumSuccessful(any())).thenThrow(new IllegalStateException());
        BudgetTracker tracker = tracker(failing, BudgetLimits.defaults());

        assertThatThrownBy(tracker::getStatus)
            .isInstanceOf(LedgerQueryException.class)
            .hasMessage("failed to get daily spend from usage ledger: java.lang.IllegalStateException")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldEstimateOperationCost() {
        BudgetTracker tracker = tracker("10.00", "0", "100.00", "0.0025");

        assertThat(tracker.estimateOperationCost(1)).isEqualByComparingTo("0.0025");
        assertThat(tracker.estimateOperationCost(10)).isEqualByComparingTo("0.025");
        assertThat(tracker.estimateOperationCost(100)).isEqualByComparingTo("0.25");
        assertThat(tracker.estimateOperationCost(1000)).isEqualByComparingTo("2.50");
        assertThat(tracker.estimateOperationCost(0)).isEqualByComparingTo("0");
    }

    @Test
    void shouldApplyBudgetUpdatesImmediately() {
        // Given
        BudgetTracker tracker = tracker("5.00", "0", "50.00", "0.001");
        ledger.record(NOW.minus(Duration.ofHours(1)), "5.00", true);
        assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("1.00")))
            .isInstanceOf(BudgetExceededException.class);

        // When
        tracker.updateDailyBudget(new BigDecimal("15.00"));
        tracker.updateWeeklyBudget(new BigDecimal("70.00"));
        tracker.updateMonthlyBudget(new BigDecimal("200.00"));

        // Then
        BudgetLimits limits = tracker.getBudgetLimits();
        assertThat(limits.dailyUsd()).isEqualByComparingTo("15.00");
        assertThat(limits.weeklyUsd()).isEqualByComparingTo("70.00");
        assertThat(limits.monthlyUsd()).isEqualByComparingTo("200.00");
        assertThat(limits.costPerOperationUsd()).isEqualByComparingTo("0.001");
        assertThatCode(() -> tracker.checkBudget(new BigDecimal("1.00"))).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectNegativeBudgetsAndKeepOriginal() {
        BudgetTracker tracker = tracker("5.00", "35.00", "50.00", "0.001");

        assertThatThrownBy(() -> tracker.updateDailyBudget(new BigDecimal("-10.00")))
            .isInstanceOf(InvalidBudgetException.class)
            .hasMessageContaining("daily budget cannot be negative")
            .satisfies(e -> assertThat(((InvalidBudgetException) e).getRejectedValue()).isEqualByComparingTo("-10.00"));
        assertThatThrownBy(() -> tracker.updateWeeklyBudget(new BigDecimal("-1")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("weekly budget cannot be negative");
        assertThatThrownBy(() -> tracker.updateMonthlyBudget(new BigDecimal("-100.00")))
            .isInstanceOf(InvalidBudgetException.class)
            .hasMessageContaining("monthly budget cannot be negative")
            .satisfies(e -> assertThat(((InvalidBudgetException) e).getHint()).contains("non-negative"));

        BudgetLimits limits = tracker.getBudgetLimits();
        assertThat(limits.dailyUsd()).isEqualByComparingTo("5.00");
        assertThat(limits.weeklyUsd()).isEqualByComparingTo("35.00");
        assertThat(limits.monthlyUsd()).isEqualByComparingTo("50.00");
    }

    @Test
    void shouldReturnIdenticalLimitsWithoutUpdates() {
        BudgetTracker tracker = tracker("12.50", "0", "250.75", "0.0035");

        BudgetLimits first = tracker.getBudgetLimits();
        BudgetLimits second = tracker.getBudgetLimits();

        assertThat(second).isEqualTo(first);
        assertThat(first.dailyUsd()).isEqualByComparingTo("12.50");
        assertThat(first.monthlyUsd()).isEqualByComparingTo("250.75");
        assertThat(first.costPerOperationUsd()).isEqualByComparingTo("0.0035");
    }

    @Test
    void shouldServeConcurrentReadsAndUpdates() throws Exception {
        BudgetTracker tracker = tracker("100.00", "0", "1000.00", "0.002");
        ExecutorService executor = Executors.newFixedThreadPool(8);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            int worker = i;
            futures.add(executor.submit(() -> {
                for (int n = 0; n < 200; n++) {
                    if (worker == 0) {
                        tracker.updateDailyBudget(BigDecimal.valueOf(100 + n % 2));
                    }
                    assertThat(tracker.getBudgetLimits().monthlyUsd()).isEqualByComparingTo("1000.00");
                    assertThat(tracker.estimateOperationCost(10)).isEqualByComparingTo("0.02");
                    tracker.checkBudget(new BigDecimal("0.01"));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(tracker.getBudgetLimits().dailyUsd()).isEqualByComparingTo("101");
    }

    @Test
    void shouldReportLocalSpendSummaryForSync() {
        BudgetTracker tracker = tracker("10.00", "35.00", "100.00", "0.002");
        ledger.record(NOW.minus(Duration.ofHours(1)), "1.00", true);
        ledger.record(NOW.minus(Duration.ofDays(3)), "2.00", true);
        tracker.setPeerSpend("node-b", WindowAmounts.of("9", "9", "9"), WindowAmounts.ZERO);

        WindowAmounts summary = tracker.getSpendSummary();

        // 不含其他節點
        assertThat(summary.daily()).isEqualByComparingTo("1.00");
        assertThat(summary.weekly()).isEqualByComparingTo("3.00");
        assertThat(summary.monthly()).isEqualByComparingTo("3.00");
    }

    @Test
    void shouldDescribeWindowDurations() {
        assertThat(BudgetTracker.describe(Duration.ofHours(24))).isEqualTo("24-hour");
        assertThat(BudgetTracker.describe(Duration.ofDays(7))).isEqualTo("7-day");
        assertThat(BudgetTracker.describe(Duration.ofDays(30))).isEqualTo("30-day");
        assertThat(BudgetTracker.describe(Duration.ofMinutes(90))).isEqualTo("90-minute");
    }
}
