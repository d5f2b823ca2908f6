package io.github.samzhu.governor.ledger;

import java.math.BigDecimal;

/**
 * 某段時間內成功操作的總成本與次數。
 *
 * @param totalCost 總成本 (USD)
 * @param operationCount 成功操作次數
 */
public record UsageTotals(
    BigDecimal totalCost,
    long operationCount
) {
    public UsageTotals {
        if (totalCost == null) {
            totalCost = BigDecimal.ZERO;
        }
    }

    public static UsageTotals empty() {
        return new UsageTotals(BigDecimal.ZERO, 0);
    }
}
