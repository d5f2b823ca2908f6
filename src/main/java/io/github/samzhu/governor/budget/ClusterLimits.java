package io.github.samzhu.governor.budget;

/**
 * 本節點分到的叢集預算上限（各參與節點設定值的平均）。
 *
 * <p>這是每個節點的「公平份額」，不是全域總上限。
 * {@code participants == 0} 表示本節點未啟用叢集預算，此時上限為 0 但不代表拒絕所有操作，
 * 呼叫端必須先檢查 {@link #isEnforced()}。
 *
 * @param ceilings 平均後的日/週/月上限
 * @param participants 參與平均的節點數（含本機）
 */
public record ClusterLimits(
    WindowAmounts ceilings,
    int participants
) {
    public static ClusterLimits disabled() {
        return new ClusterLimits(WindowAmounts.ZERO, 0);
    }

    public boolean isEnforced() {
        return participants > 0;
    }
}
