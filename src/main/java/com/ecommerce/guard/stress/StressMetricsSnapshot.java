package com.ecommerce.guard.stress;

import java.util.List;
import java.util.Map;

/**
 * 压力指标快照：累计计数 + 实时状态 + 窗口内各分量均值
 */
public record StressMetricsSnapshot(
    StressState currentState,
    double currentScore,
    double maxScore,
    long stressEvents,
    long circuitBreakerTrips,
    long emergencyEvents,
    double totalStressSeconds,
    double durationInStateSeconds,
    double stressDurationSeconds,
    boolean sustainedStress,
    long lastStressTime,
    boolean circuitBreakerActive,
    boolean throttling,
    long throttledRequests,
    boolean backgroundTasksPaused,
    List<String> pausedTasks,
    Map<String, Long> actionsTaken,
    Components average,
    Components current
) {

    /**
     * CPU / 内存 / 网络压力分量
     */
    public record Components(double cpu, double memory, double network) {

        public static final Components ZERO = new Components(0, 0, 0);
    }
}
