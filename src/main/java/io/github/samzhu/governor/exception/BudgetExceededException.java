package io.github.samzhu.governor.exception;

import java.math.BigDecimal;
import java.util.List;

import io.github.samzhu.governor.budget.BudgetWindow;

/**
 * 預估成本加上目前花費將超出預算上限。
 *
 * <p>攜帶結構化資訊供呼叫端決定延後或重試：
 * <ul>
 *   <li>{@link #getWindow()} - 超出的視窗</li>
 *   <li>{@link #getScope()} - 本機預算或叢集預算</li>
 *   <li>{@link #getSpend()} - 彙總後的花費（本機 + 未過期節點）</li>
 *   <li>{@link #getEstimatedCost()} - 本次操作的預估成本</li>
 *   <li>{@link #getLimit()} - 上限；叢集範圍時為各節點平均後的上限</li>
 * </ul>
 */
public class BudgetExceededException extends AdmissionDeniedException {

    /**
     * 預算範圍。
     */
    public enum Scope {
        LOCAL,
        CLUSTER
    }

    private final BudgetWindow window;
    private final Scope scope;
    private final BigDecimal spend;
    private final BigDecimal estimatedCost;
    private final BigDecimal limit;
    private final int participants;
    private final List<String> details;

    public BudgetExceededException(
            String message,
            String hint,
            BudgetWindow window,
            Scope scope,
            BigDecimal spend,
            BigDecimal estimatedCost,
            BigDecimal limit,
            int participants,
            List<String> details) {
        super(message, hint);
        this.window = window;
        this.scope = scope;
        this.spend = spend;
        this.estimatedCost = estimatedCost;
        this.limit = limit;
        this.participants = participants;
        this.details = List.copyOf(details);
    }

    public BudgetWindow getWindow() {
        return window;
    }

    public Scope getScope() {
        return scope;
    }

    public BigDecimal getSpend() {
        return spend;
    }

    public BigDecimal getEstimatedCost() {
        return estimatedCost;
    }

    public BigDecimal getLimit() {
        return limit;
    }

    /**
     * 參與叢集平均的節點數；本機範圍時為 0。
     */
    public int getParticipants() {
        return participants;
    }

    /**
     * 花費明細，例如本機與其他節點的拆分、剩餘額度。
     */
    public List<String> getDetails() {
        return details;
    }
}
