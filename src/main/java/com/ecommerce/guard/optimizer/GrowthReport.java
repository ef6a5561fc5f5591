package com.ecommerce.guard.optimizer;

/**
 * 内存增长趋势报告
 * <p>
 * abnormalGrowth 只有在每小时增长率超过泄漏阈值且最近三次采样严格递增时才为 true。
 */
public record GrowthReport(
    long baselineBytes,
    long currentBytes,
    long peakBytes,
    double growthPercent,
    double growthRatePerHour,
    boolean consistentGrowth,
    boolean abnormalGrowth,
    double elapsedHours,
    int records
) {
}
