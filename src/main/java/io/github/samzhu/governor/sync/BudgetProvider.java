package io.github.samzhu.governor.sync;

import io.github.samzhu.governor.budget.WindowAmounts;

/**
 * 提供給節點同步協定的預算介面。
 *
 * <p>同步協定（傳輸、節點探索、排程）不在本服務範圍內。協定每次與某節點同步成功後：
 * <ol>
 *   <li>以 {@link #getSpendSummary()} 與 {@link #getClusterLimits()} 取得本機狀態送出</li>
 *   <li>以 {@link #setPeerSpend} 寫入對方回傳的花費與叢集上限</li>
 * </ol>
 */
public interface BudgetProvider {

    /**
     * 本機（不含其他節點）的日/週/月花費。
     *
     * @throws io.github.samzhu.governor.exception.LedgerQueryException 若帳本查詢失敗
     */
    WindowAmounts getSpendSummary();

    /**
     * 本機設定的叢集上限，全為 0 表示未參與叢集預算。
     */
    WindowAmounts getClusterLimits();

    /**
     * 記錄某節點最後一次回報的花費與叢集上限，覆寫舊資料。
     *
     * @param peerName 節點名稱
     * @param spend 該節點的日/週/月花費
     * @param clusterLimits 該節點設定的叢集上限
     */
    void setPeerSpend(String peerName, WindowAmounts spend, WindowAmounts clusterLimits);
}
