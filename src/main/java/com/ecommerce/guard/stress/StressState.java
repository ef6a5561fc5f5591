package com.ecommerce.guard.stress;

/**
 * 压力状态，按严重程度排序
 */
public enum StressState {

    NORMAL,
    ELEVATED,
    HIGH,
    CRITICAL;

    /**
     * 分数到状态的映射，各下限均为闭区间
     */
    public static StressState fromScore(double score) {
        if (score >= 1.5) {
            return CRITICAL;
        }
        if (score >= 1.2) {
            return HIGH;
        }
        if (score >= 1.0) {
            return ELEVATED;
        }
        return NORMAL;
    }

    public boolean isStressed() {
        return this != NORMAL;
    }

    public boolean isMoreSevereThan(StressState other) {
        return compareTo(other) > 0;
    }
}
