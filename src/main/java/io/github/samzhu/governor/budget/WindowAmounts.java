package io.github.samzhu.governor.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 日/週/月三個視窗的金額 (USD)。
 *
 * <p>用於表示花費、預算上限與叢集上限。{@code null} 一律視為 0。
 *
 * @param daily 日視窗金額
 * @param weekly 週視窗金額
 * @param monthly 月視窗金額
 */
public record WindowAmounts(
    BigDecimal daily,
    BigDecimal weekly,
    BigDecimal monthly
) {
    /** 平均上限的小數位數，與成本計算一致 */
    static final int SCALE = 6;

    public static final WindowAmounts ZERO = new WindowAmounts(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public WindowAmounts {
        if (daily == null) {
            daily = BigDecimal.ZERO;
        }
        if (weekly == null) {
            weekly = BigDecimal.ZERO;
        }
        if (monthly == null) {
            monthly = BigDecimal.ZERO;
        }
    }

    public static WindowAmounts of(String daily, String weekly, String monthly) {
        return new WindowAmounts(new BigDecimal(daily), new BigDecimal(weekly), new BigDecimal(monthly));
    }

    public BigDecimal get(BudgetWindow window) {
        return switch (window) {
            case DAILY -> daily;
            case WEEKLY -> weekly;
            case MONTHLY -> monthly;
        };
    }

    public WindowAmounts plus(WindowAmounts other) {
        return new WindowAmounts(
            daily.add(other.daily),
            weekly.add(other.weekly),
            monthly.add(other.monthly));
    }

    public WindowAmounts minus(WindowAmounts other) {
        return new WindowAmounts(
            daily.subtract(other.daily),
            weekly.subtract(other.weekly),
            monthly.subtract(other.monthly));
    }

    /**
     * 三個金額各自除以 {@code divisor}，保留 6 位小數 (HALF_UP)。
     */
    public WindowAmounts dividedBy(int divisor) {
        BigDecimal d = BigDecimal.valueOf(divisor);
        return new WindowAmounts(
            daily.divide(d, SCALE, RoundingMode.HALF_UP),
            weekly.divide(d, SCALE, RoundingMode.HALF_UP),
            monthly.divide(d, SCALE, RoundingMode.HALF_UP));
    }

    public boolean isAllZero() {
        return daily.signum() == 0 && weekly.signum() == 0 && monthly.signum() == 0;
    }
}
