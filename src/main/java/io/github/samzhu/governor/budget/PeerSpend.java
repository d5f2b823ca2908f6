package io.github.samzhu.governor.budget;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 某個節點最後一次回報的花費與叢集上限。
 *
 * @param spend 該節點的日/週/月花費
 * @param clusterLimits 該節點設定的叢集上限，全為 0 表示不參與叢集預算
 * @param receivedAt 收到回報的時間
 */
public record PeerSpend(
    WindowAmounts spend,
    WindowAmounts clusterLimits,
    Instant receivedAt
) {
    public PeerSpend {
        Objects.requireNonNull(spend, "spend");
        Objects.requireNonNull(clusterLimits, "clusterLimits");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    /**
     * 資料年齡超過 {@code stalenessLimit} 即視為過期；limit {@code <= 0} 表示永不過期。
     */
    public boolean isStale(Instant now, Duration stalenessLimit) {
        if (stalenessLimit.isZero() || stalenessLimit.isNegative()) {
            return false;
        }
        return Duration.between(receivedAt, now).compareTo(stalenessLimit) > 0;
    }

    /**
     * 是否有設定叢集上限。
     */
    public boolean hasClusterLimits() {
        return !clusterLimits.isAllZero();
    }
}
