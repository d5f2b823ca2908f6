package io.github.samzhu.governor.limiter;

/**
 * 呼叫頻率限制的即時狀態。
 *
 * @param callsInWindow 目前滑動視窗內已允許的呼叫數
 * @param remaining 視窗內剩餘可用次數，永遠 {@code >= 0}
 */
public record LimiterStats(
    int callsInWindow,
    int remaining
) {}
