package com.ecommerce.guard.stress;

/**
 * 压力分数及各分量（观测值 / 阈值）
 */
public record StressScore(double score, double cpu, double memory, double network) {

    public static final StressScore ZERO = new StressScore(0, 0, 0, 0);

    public static StressScore of(double cpu, double memory, double network) {
        return new StressScore(Math.max(cpu, Math.max(memory, network)), cpu, memory, network);
    }

    /**
     * 阈值非正时该分量为 0
     */
    public static double component(double observed, double threshold) {
        return threshold > 0 ? observed / threshold : 0.0;
    }
}
