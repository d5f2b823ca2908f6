package io.github.samzhu.governor.limiter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.governor.config.GovernorProperties;
import io.github.samzhu.governor.config.GovernorProperties.LimiterConfig;
import io.github.samzhu.governor.exception.RateLimitExceededException;

/**
 * 單一程序內的 AI 呼叫頻率限制（滑動視窗 log）。
 *
 * <p>依時間順序保存每次被允許呼叫的時間戳記。每次檢查時：
 * <ol>
 *   <li>計算 {@code cutoff = now - window}</li>
 *   <li>從佇列前端移除所有 {@code <= cutoff} 的時間戳記（佇列遞增排序，過期的必定在前端）</li>
 *   <li>剩餘數量 {@code >= maxCalls} 則拒絕，不記錄</li>
 *   <li>否則記錄 {@code now} 並允許</li>
 * </ol>
 *
 * <p>整個「移除 → 檢查 → 新增」在同一把鎖內完成，並行呼叫不會重複允許或遺失記錄。
 * 每次呼叫的攤銷成本為 O(1)，記憶體為 O(maxCalls)。
 *
 * <p>與 {@link io.github.samzhu.governor.budget.BudgetTracker} 互相獨立，沒有共用狀態。
 */
@Service
public class CallLimiter {

    private static final Logger log = LoggerFactory.getLogger(CallLimiter.class);

    private final Clock clock;
    private final int maxCalls;
    private final Duration window;
    private final Duration pollInterval;

    private final ArrayDeque<Instant> calls = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public CallLimiter(GovernorProperties properties, Clock clock) {
        LimiterConfig config = properties.limiter();
        this.clock = clock;
        this.maxCalls = config.maxCalls();
        this.window = config.window();
        this.pollInterval = config.pollInterval();
        log.info("CallLimiter initialized: maxCalls={}, window={}, pollInterval={}",
            maxCalls, window, pollInterval);
    }

    /**
     * 嘗試取得一次呼叫許可。
     *
     * @throws RateLimitExceededException 若視窗內呼叫數已達上限
     */
    public void allow() {
        lock.lock();
        try {
            Instant now = clock.instant();
            evictExpired(now);
            if (calls.size() >= maxCalls) {
                throw new RateLimitExceededException(maxCalls, window, calls.size());
            }
            calls.addLast(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 阻塞直到取得許可，每隔 poll interval 重試一次 {@link #allow()}。
     *
     * <p>取消方式為中斷執行緒：重試之間若被中斷即拋出 {@link InterruptedException}，
     * 不再重試，也不會留下任何記錄。
     *
     * @throws InterruptedException 若等待期間執行緒被中斷
     */
    public void await() throws InterruptedException {
        while (true) {
            if (tryAllow()) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(pollInterval.toNanos());
        }
    }

    /**
     * 與 {@link #await()} 相同，但最多等待 {@code timeout}。
     *
     * @param timeout 最長等待時間
     * @return {@code true} 表示已取得許可，{@code false} 表示逾時
     * @throws InterruptedException 若等待期間執行緒被中斷
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (tryAllow()) {
                return true;
            }
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(left, pollInterval.toNanos()));
        }
    }

    /**
     * 清除所有呼叫記錄。
     */
    public void reset() {
        lock.lock();
        try {
            calls.clear();
        } finally {
            lock.unlock();
        }
        log.debug("CallLimiter reset");
    }

    /**
     * 移除過期記錄後，回傳視窗內的呼叫數與剩餘次數。
     */
    public LimiterStats stats() {
        lock.lock();
        try {
            evictExpired(clock.instant());
            int inWindow = calls.size();
            return new LimiterStats(inWindow, Math.max(0, maxCalls - inWindow));
        } finally {
            lock.unlock();
        }
    }

    private boolean tryAllow() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("interrupted while waiting for call limiter");
        }
        try {
            allow();
            return true;
        } catch (RateLimitExceededException e) {
            return false;
        }
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!calls.isEmpty() && !calls.peekFirst().isAfter(cutoff)) {
            calls.removeFirst();
        }
    }
}
