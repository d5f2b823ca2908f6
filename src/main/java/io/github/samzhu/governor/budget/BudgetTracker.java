package io.github.samzhu.governor.budget;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.governor.config.GovernorProperties;
import io.github.samzhu.governor.config.GovernorProperties.BudgetLimits;
import io.github.samzhu.governor.config.GovernorProperties.WindowConfig;
import io.github.samzhu.governor.exception.BudgetExceededException;
import io.github.samzhu.governor.exception.BudgetExceededException.Scope;
import io.github.samzhu.governor.exception.InvalidBudgetException;
import io.github.samzhu.governor.exception.LedgerQueryException;
import io.github.samzhu.governor.ledger.UsageLedger;
import io.github.samzhu.governor.ledger.UsageTotals;
import io.github.samzhu.governor.sync.BudgetProvider;

/**
 * AI 操作的美元預算追蹤與准入檢查。
 *
 * <p>花費來源為用量帳本的實際記錄，使用三個滾動視窗（預設 24h / 7d / 30d），
 * 不使用日曆邊界，避免在日期切換時重置用量。
 *
 * <p>檢查流程 ({@link #checkBudget})：
 * <ol>
 *   <li>查詢帳本取得本機日/週/月花費</li>
 *   <li>加上未過期節點回報的花費（{@link #aggregateSpend}）</li>
 *   <li>依序檢查日 → 週（上限 {@code > 0} 才檢查）→ 月，第一個超出的視窗即拒絕</li>
 *   <li>若本機有設定叢集上限，再以各節點平均後的上限檢查（{@link #clusterLimits}）</li>
 * </ol>
 *
 * <p>叢集彙總是最終一致的估計值：同步延遲可能造成小幅超支，
 * 沒有節點在 staleness limit 內回報時退化為只看本機。
 *
 * <p>並行控制：
 * <ul>
 *   <li>預算設定使用讀寫鎖，查詢/檢查/估算取讀鎖，更新取寫鎖</li>
 *   <li>節點快取有獨立的讀寫鎖（{@link PeerSpendCache}）</li>
 *   <li>帳本查詢不持有任何鎖，兩把鎖不會在同一路徑上同時持有</li>
 * </ul>
 */
@Service
public class BudgetTracker implements BudgetProvider {

    private static final Logger log = LoggerFactory.getLogger(BudgetTracker.class);

    private final UsageLedger ledger;
    private final Clock clock;
    private final WindowConfig windows;
    private final PeerSpendCache peers;

    private final ReentrantReadWriteLock configLock = new ReentrantReadWriteLock();
    private BudgetLimits config;

    public BudgetTracker(UsageLedger ledger, GovernorProperties properties, Clock clock) {
        this.ledger = ledger;
        this.clock = clock;
        this.windows = properties.windows();
        this.config = properties.budget();
        this.peers = new PeerSpendCache(properties.peers().stalenessLimit(), properties.peers().maxPeers());

        log.info("BudgetTracker initialized: daily=${}, weekly=${}, monthly=${}, costPerOperation=${}, "
                + "cluster=[{}, {}, {}], stalenessLimit={}",
            config.dailyUsd(), config.weeklyUsd(), config.monthlyUsd(), config.costPerOperationUsd(),
            config.clusterDailyUsd(), config.clusterWeeklyUsd(), config.clusterMonthlyUsd(),
            peers.stalenessLimit());
        if (config.weeklyUsd().signum() == 0) {
            log.warn("Weekly budget is 0, weekly window is not enforced (set {} to enable)",
                BudgetWindow.WEEKLY.localProperty());
        }
    }

    // ===== Status =====

    /**
     * 取得目前本機預算狀態，只計入成功的操作。
     *
     * @return 三個視窗的花費、剩餘額度與操作次數
     * @throws LedgerQueryException 任一視窗查詢失敗時，標示失敗的視窗
     */
    public BudgetStatus getStatus() {
        UsageTotals daily = queryWindow(BudgetWindow.DAILY);
        UsageTotals weekly = queryWindow(BudgetWindow.WEEKLY);
        UsageTotals monthly = queryWindow(BudgetWindow.MONTHLY);

        WindowAmounts spend = new WindowAmounts(daily.totalCost(), weekly.totalCost(), monthly.totalCost());
        WindowAmounts remaining = getBudgetLimits().localLimits().minus(spend);

        return new BudgetStatus(
            spend.daily(),
            spend.weekly(),
            spend.monthly(),
            remaining.daily(),
            remaining.weekly(),
            remaining.monthly(),
            daily.operationCount(),
            weekly.operationCount(),
            monthly.operationCount());
    }

    // ===== Admission =====

    /**
     * 檢查預估成本是否在預算內。剛好等於上限視為通過。
     *
     * @param estimatedCostUsd 預估成本 (USD)
     * @throws BudgetExceededException 若任一視窗（本機或叢集）將超出上限
     * @throws LedgerQueryException 若帳本查詢失敗
     */
    public void checkBudget(BigDecimal estimatedCostUsd) {
        Objects.requireNonNull(estimatedCostUsd, "estimatedCostUsd");

        WindowAmounts local = getStatus().spend();
        AggregatedSpend aggregated = aggregateSpend(local);
        WindowAmounts spend = aggregated.total();
        BudgetLimits limits = getBudgetLimits();

        for (BudgetWindow window : BudgetWindow.values()) {
            BigDecimal limit = limits.limit(window);
            // 週上限 0 = 未設定；日/月上限 0 = 不允許任何花費
            if (window == BudgetWindow.WEEKLY && limit.signum() == 0) {
                continue;
            }
            if (exceeds(spend.get(window), estimatedCostUsd, limit)) {
                throw localExceeded(window, spend.get(window), local.get(window), estimatedCostUsd, limit);
            }
        }

        ClusterLimits cluster = clusterLimits();
        if (!cluster.isEnforced()) {
            return;
        }
        for (BudgetWindow window : BudgetWindow.values()) {
            BigDecimal ceiling = cluster.ceilings().get(window);
            if (ceiling.signum() > 0 && exceeds(spend.get(window), estimatedCostUsd, ceiling)) {
                throw clusterExceeded(window, spend.get(window), estimatedCostUsd, ceiling, cluster.participants());
            }
        }
    }

    /**
     * 估算 N 次操作的成本：{@code n × costPerOperationUsd}。
     */
    public BigDecimal estimateOperationCost(int numOperations) {
        BigDecimal costPerOperation;
        configLock.readLock().lock();
        try {
            costPerOperation = config.costPerOperationUsd();
        } finally {
            configLock.readLock().unlock();
        }
        return costPerOperation.multiply(BigDecimal.valueOf(numOperations));
    }

    // ===== Configuration =====

    /**
     * 更新日預算上限，立即生效。持久化由外部負責。
     *
     * @throws InvalidBudgetException 若為負數，原設定不變
     */
    public void updateDailyBudget(BigDecimal newBudgetUsd) {
        updateBudget(BudgetWindow.DAILY, newBudgetUsd, "5.00 for $5/day");
    }

    /**
     * 更新週預算上限，立即生效。設為 0 表示停用週視窗檢查。
     *
     * @throws InvalidBudgetException 若為負數，原設定不變
     */
    public void updateWeeklyBudget(BigDecimal newBudgetUsd) {
        updateBudget(BudgetWindow.WEEKLY, newBudgetUsd, "35.00 for $35/week");
    }

    /**
     * 更新月預算上限，立即生效。
     *
     * @throws InvalidBudgetException 若為負數，原設定不變
     */
    public void updateMonthlyBudget(BigDecimal newBudgetUsd) {
        updateBudget(BudgetWindow.MONTHLY, newBudgetUsd, "100.00 for $100/month");
    }

    /**
     * 目前的預算設定快照。
     */
    public BudgetLimits getBudgetLimits() {
        configLock.readLock().lock();
        try {
            return config;
        } finally {
            configLock.readLock().unlock();
        }
    }

    // ===== Peer sync =====

    @Override
    public WindowAmounts getSpendSummary() {
        return getStatus().spend();
    }

    @Override
    public WindowAmounts getClusterLimits() {
        return getBudgetLimits().clusterLimits();
    }

    @Override
    public void setPeerSpend(String peerName, WindowAmounts spend, WindowAmounts clusterLimits) {
        Objects.requireNonNull(peerName, "peerName");
        Objects.requireNonNull(spend, "spend");
        Objects.requireNonNull(clusterLimits, "clusterLimits");
        peers.put(peerName, new PeerSpend(spend, clusterLimits, clock.instant()));
        log.debug("Peer spend updated: peer={}, spend={}, clusterLimits={}", peerName, spend, clusterLimits);
    }

    /**
     * 最後一次收到的某節點資料，不論是否過期。
     */
    public Optional<PeerSpend> getPeerSpend(String peerName) {
        return peers.get(peerName);
    }

    /**
     * 將本機花費加上所有未過期節點的花費。過期的節點直接略過，不視為錯誤。
     *
     * @param local 本機日/週/月花費
     * @return 彙總後的花費與實際納入的節點數
     */
    public AggregatedSpend aggregateSpend(WindowAmounts local) {
        WindowAmounts total = local;
        List<PeerSpend> fresh = peers.fresh(clock.instant());
        for (PeerSpend peer : fresh) {
            total = total.plus(peer.spend());
        }
        if (!fresh.isEmpty()) {
            log.debug("Aggregated spend: local={}, total={}, peers={}", local, total, fresh.size());
        }
        return new AggregatedSpend(total, fresh.size());
    }

    /**
     * 計算本節點的叢集上限份額：本機與所有未過期且有設定叢集上限的節點取平均。
     *
     * <p>本機三個叢集上限皆為 0 時回傳 {@link ClusterLimits#disabled()}，不論節點資料為何。
     */
    public ClusterLimits clusterLimits() {
        WindowAmounts local = getBudgetLimits().clusterLimits();
        if (local.isAllZero()) {
            return ClusterLimits.disabled();
        }

        WindowAmounts total = local;
        int participants = 1;
        for (PeerSpend peer : peers.fresh(clock.instant())) {
            if (!peer.hasClusterLimits()) {
                continue;
            }
            total = total.plus(peer.clusterLimits());
            participants++;
        }
        return new ClusterLimits(total.dividedBy(participants), participants);
    }

    // ===== Internal =====

    private UsageTotals queryWindow(BudgetWindow window) {
        Instant since = clock.instant().minus(windows.get(window));
        try {
            return ledger.sumSuccessful(since);
        } catch (RuntimeException e) {
            throw new LedgerQueryException(window, e);
        }
    }

    private void updateBudget(BudgetWindow window, BigDecimal newBudgetUsd, String example) {
        Objects.requireNonNull(newBudgetUsd, "newBudgetUsd");
        if (newBudgetUsd.signum() < 0) {
            throw new InvalidBudgetException(window, newBudgetUsd,
                "specify a non-negative budget value (e.g., " + example + ")");
        }

        BigDecimal previous;
        configLock.writeLock().lock();
        try {
            previous = config.limit(window);
            config = config.withLimit(window, newBudgetUsd);
        } finally {
            configLock.writeLock().unlock();
        }
        log.info("Budget updated: window={}, previous=${}, current=${}", window.label(), previous, newBudgetUsd);
    }

    private static boolean exceeds(BigDecimal spend, BigDecimal estimate, BigDecimal limit) {
        return spend.add(estimate).compareTo(limit) > 0;
    }

    private BudgetExceededException localExceeded(
            BudgetWindow window, BigDecimal spend, BigDecimal localSpend, BigDecimal estimate, BigDecimal limit) {
        String message = String.format(Locale.ROOT, "%s budget would be exceeded: current $%.3f + estimated $%.3f > limit $%.2f",
            window.label(), spend, estimate, limit);
        List<String> details = List.of(
            String.format(Locale.ROOT, "%s spend: $%.4f (local $%.4f + peers $%.4f)",
                window.title(), spend, localSpend, spend.subtract(localSpend)),
            String.format(Locale.ROOT, "%s limit: $%.2f", window.title(), limit),
            String.format(Locale.ROOT, "%s remaining: $%.4f", window.title(), limit.subtract(spend)),
            String.format(Locale.ROOT, "Estimated cost: $%.4f", estimate));
        String hint = String.format(Locale.ROOT, "increase %s budget in config or wait for the %s rolling window to reset",
            window.label(), describe(windows.get(window)));
        return new BudgetExceededException(message, hint, window, Scope.LOCAL,
            spend, estimate, limit, 0, details);
    }

    private static BudgetExceededException clusterExceeded(
            BudgetWindow window, BigDecimal spend, BigDecimal estimate, BigDecimal ceiling, int participants) {
        String message = String.format(Locale.ROOT,
            "cluster %s budget would be exceeded: aggregate $%.3f + estimated $%.3f > cluster limit $%.2f (%d nodes averaged)",
            window.label(), spend, estimate, ceiling, participants);
        String hint = "reduce spend across cluster nodes or increase " + window.clusterProperty();
        return new BudgetExceededException(message, hint, window, Scope.CLUSTER,
            spend, estimate, ceiling, participants,
            List.of(String.format(Locale.ROOT, "Cluster %s limit: $%.2f across %d nodes", window.label(), ceiling, participants)));
    }

    /**
     * 以「24-hour」、「7-day」形式描述視窗長度。
     */
    static String describe(Duration window) {
        if (window.toDays() >= 2 && window.toHours() % 24 == 0) {
            return window.toDays() + "-day";
        }
        if (window.toHours() >= 1 && window.toMinutes() % 60 == 0) {
            return window.toHours() + "-hour";
        }
        return window.toMinutes() + "-minute";
    }
}
