package io.github.samzhu.governor.config;

import java.math.BigDecimal;
import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import io.github.samzhu.governor.budget.BudgetWindow;
import io.github.samzhu.governor.budget.WindowAmounts;

/**
 * Governor 的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link LimiterConfig} - 呼叫頻率限制（滑動視窗內的最大呼叫數）</li>
 *   <li>{@link BudgetLimits} - 日/週/月預算上限與叢集預算上限 (USD)</li>
 *   <li>{@link WindowConfig} - 三個滾動視窗的長度</li>
 *   <li>{@link PeerConfig} - 節點間花費快取的過期時間與容量</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * governor:
 *   limiter:
 *     max-calls: 60
 *     window: 1m
 *     poll-interval: 100ms
 *   budget:
 *     daily-usd: 5.00
 *     weekly-usd: 35.00
 *     monthly-usd: 100.00
 *     cost-per-operation-usd: 0.002
 *     cluster-daily-usd: 0
 *   windows:
 *     daily: 24h
 *     weekly: 7d
 *     monthly: 30d
 *   peers:
 *     staleness-limit: 10m
 *     max-peers: 0
 * </pre>
 *
 * <p>所有視窗皆為滾動視窗 {@code [now - duration, now]}，不使用日曆邊界，
 * 避免在邊界重置時被重複利用額度。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@Validated
@ConfigurationProperties(prefix = "governor")
public record GovernorProperties(
    LimiterConfig limiter,
    @Valid BudgetLimits budget,
    WindowConfig windows,
    PeerConfig peers
) {
    public GovernorProperties {
        if (limiter == null) {
            limiter = LimiterConfig.defaults();
        }
        if (budget == null) {
            budget = BudgetLimits.defaults();
        }
        if (windows == null) {
            windows = WindowConfig.defaults();
        }
        if (peers == null) {
            peers = PeerConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的配置。
     */
    public static GovernorProperties defaults() {
        return new GovernorProperties(null, null, null, null);
    }

    /**
     * 呼叫頻率限制設定。
     *
     * @param maxCalls 視窗內允許的最大呼叫數，預設 60
     * @param window 滑動視窗長度，預設 1 分鐘
     * @param pollInterval {@code await} 重試間隔，預設 100ms
     */
    public record LimiterConfig(
        int maxCalls,
        Duration window,
        Duration pollInterval
    ) {
        public LimiterConfig {
            if (maxCalls <= 0) {
                maxCalls = 60;
            }
            if (window == null || window.isZero() || window.isNegative()) {
                window = Duration.ofMinutes(1);
            }
            if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
                pollInterval = Duration.ofMillis(100);
            }
        }

        public static LimiterConfig defaults() {
            return new LimiterConfig(60, Duration.ofMinutes(1), Duration.ofMillis(100));
        }
    }

    /**
     * 預算上限設定 (USD)。
     *
     * <p>週預算為 0 表示「未設定」，不檢查週視窗；日/月預算為 0 表示不允許任何花費。
     * 叢集預算三者皆為 0 表示此節點不參與叢集預算。
     *
     * @param dailyUsd 24 小時滾動視窗上限
     * @param weeklyUsd 7 天滾動視窗上限，0 = 不檢查
     * @param monthlyUsd 30 天滾動視窗上限
     * @param costPerOperationUsd 單次操作的預估成本
     * @param clusterDailyUsd 叢集日上限，0 = 停用
     * @param clusterWeeklyUsd 叢集週上限，0 = 停用
     * @param clusterMonthlyUsd 叢集月上限，0 = 停用
     */
    public record BudgetLimits(
        @PositiveOrZero BigDecimal dailyUsd,
        @PositiveOrZero BigDecimal weeklyUsd,
        @PositiveOrZero BigDecimal monthlyUsd,
        @PositiveOrZero BigDecimal costPerOperationUsd,
        @PositiveOrZero BigDecimal clusterDailyUsd,
        @PositiveOrZero BigDecimal clusterWeeklyUsd,
        @PositiveOrZero BigDecimal clusterMonthlyUsd
    ) {
        public BudgetLimits {
            dailyUsd = orZero(dailyUsd);
            weeklyUsd = orZero(weeklyUsd);
            monthlyUsd = orZero(monthlyUsd);
            costPerOperationUsd = orZero(costPerOperationUsd);
            clusterDailyUsd = orZero(clusterDailyUsd);
            clusterWeeklyUsd = orZero(clusterWeeklyUsd);
            clusterMonthlyUsd = orZero(clusterMonthlyUsd);
        }

        /**
         * 建立預設預算設定 ($5/日、$35/週、$100/月，無叢集預算)。
         */
        public static BudgetLimits defaults() {
            return new BudgetLimits(
                new BigDecimal("5.00"),
                new BigDecimal("35.00"),
                new BigDecimal("100.00"),
                new BigDecimal("0.002"),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                BigDecimal.ZERO);
        }

        /**
         * 取得指定視窗的本機上限。
         */
        public BigDecimal limit(BudgetWindow window) {
            return localLimits().get(window);
        }

        public WindowAmounts localLimits() {
            return new WindowAmounts(dailyUsd, weeklyUsd, monthlyUsd);
        }

        public WindowAmounts clusterLimits() {
            return new WindowAmounts(clusterDailyUsd, clusterWeeklyUsd, clusterMonthlyUsd);
        }

        /**
         * 回傳只替換指定視窗上限的新設定。
         */
        public BudgetLimits withLimit(BudgetWindow window, BigDecimal value) {
            return switch (window) {
                case DAILY -> new BudgetLimits(value, weeklyUsd, monthlyUsd, costPerOperationUsd,
                    clusterDailyUsd, clusterWeeklyUsd, clusterMonthlyUsd);
                case WEEKLY -> new BudgetLimits(dailyUsd, value, monthlyUsd, costPerOperationUsd,
                    clusterDailyUsd, clusterWeeklyUsd, clusterMonthlyUsd);
                case MONTHLY -> new BudgetLimits(dailyUsd, weeklyUsd, value, costPerOperationUsd,
                    clusterDailyUsd, clusterWeeklyUsd, clusterMonthlyUsd);
            };
        }

        private static BigDecimal orZero(BigDecimal value) {
            return value == null ? BigDecimal.ZERO : value;
        }
    }

    /**
     * 滾動視窗長度設定。
     *
     * @param daily 日視窗，預設 24h
     * @param weekly 週視窗，預設 7d
     * @param monthly 月視窗，預設 30d
     */
    public record WindowConfig(
        Duration daily,
        Duration weekly,
        Duration monthly
    ) {
        public WindowConfig {
            if (daily == null) {
                daily = Duration.ofHours(24);
            }
            if (weekly == null) {
                weekly = Duration.ofDays(7);
            }
            if (monthly == null) {
                monthly = Duration.ofDays(30);
            }
        }

        public static WindowConfig defaults() {
            return new WindowConfig(Duration.ofHours(24), Duration.ofDays(7), Duration.ofDays(30));
        }

        public Duration get(BudgetWindow window) {
            return switch (window) {
                case DAILY -> daily;
                case WEEKLY -> weekly;
                case MONTHLY -> monthly;
            };
        }
    }

    /**
     * 節點花費快取設定。
     *
     * @param stalenessLimit 超過此時間未更新的節點資料不納入彙總，預設 10 分鐘
     * @param maxPeers 快取的最大節點數，0 表示不限制
     */
    public record PeerConfig(
        Duration stalenessLimit,
        int maxPeers
    ) {
        public PeerConfig {
            if (stalenessLimit == null) {
                stalenessLimit = Duration.ofMinutes(10);
            }
            if (maxPeers < 0) {
                maxPeers = 0;
            }
        }

        public static PeerConfig defaults() {
            return new PeerConfig(Duration.ofMinutes(10), 0);
        }
    }
}
