package com.ecommerce.guard.service;

import com.ecommerce.guard.stress.StressState;

/**
 * 当前状态概览
 */
public record GuardStatus(
    StressState state,
    double stressScore,
    boolean circuitBreakerActive,
    boolean throttling,
    boolean backgroundTasksPaused,
    double cpuPercent,
    double memoryPercent,
    double processMemoryMb,
    double processMemoryPercent,
    boolean monitoring,
    boolean stressMonitoring,
    long timestamp
) {
}
