package io.github.samzhu.governor.budget;

import java.math.BigDecimal;

/**
 * 目前的本機預算狀態，每次呼叫重新計算，不儲存。
 *
 * <p>剩餘額度 = 上限 - 花費，超支時為負數。週上限為 0（未設定）時，
 * {@code weeklyRemaining} 即為負的週花費，僅供參考。
 */
public record BudgetStatus(
    BigDecimal dailySpend,
    BigDecimal weeklySpend,
    BigDecimal monthlySpend,
    BigDecimal dailyRemaining,
    BigDecimal weeklyRemaining,
    BigDecimal monthlyRemaining,
    long dailyOps,
    long weeklyOps,
    long monthlyOps
) {
    /**
     * 三個視窗的本機花費。
     */
    public WindowAmounts spend() {
        return new WindowAmounts(dailySpend, weeklySpend, monthlySpend);
    }
}
