package com.ecommerce.guard.optimizer;

import java.util.Map;

/**
 * 一次优化的结果，details 的键即执行过的步骤
 */
public record OptimizationResult(
    OptimizationLevel level,
    long memoryBeforeBytes,
    long memoryAfterBytes,
    long savedBytes,
    double savedMb,
    long durationMs,
    Map<String, Object> details
) {
}
