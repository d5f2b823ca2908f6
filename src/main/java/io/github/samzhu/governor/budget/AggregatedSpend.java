package io.github.samzhu.governor.budget;

/**
 * 本機花費加上所有未過期節點花費的彙總。
 *
 * @param total 彙總後的日/週/月花費
 * @param peers 實際納入的節點數（不含本機）
 */
public record AggregatedSpend(
    WindowAmounts total,
    int peers
) {}
