package io.github.samzhu.governor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Governor - AI 模型呼叫的頻率與預算管控服務。
 *
 * <p>每次 AI 模型操作執行前需通過兩道獨立的准入檢查：
 * <ul>
 *   <li>{@link io.github.samzhu.governor.limiter.CallLimiter} - 記憶體內滑動視窗的呼叫頻率限制</li>
 *   <li>{@link io.github.samzhu.governor.budget.BudgetTracker} - 依用量帳本計算日/週/月滾動視窗花費，
 *       並結合其他節點回報的花費做叢集預算檢查</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Dispatcher → CallLimiter.allow() → BudgetTracker.checkBudget(cost) → AI 模型
 *                                          ↓                ↑
 *                                   ai_model_usage     Peer Sync (setPeerSpend)
 * </pre>
 */
@SpringBootApplication
public class GovernorApplication {

    private static final Logger log = LoggerFactory.getLogger(GovernorApplication.class);

    public static void main(String[] args) {
        log.info("Starting Governor - AI call rate and budget gates");
        SpringApplication.run(GovernorApplication.class, args);
    }
}
