package com.ecommerce.guard.optimizer;

import java.util.Locale;

/**
 * 优化级别
 */
public enum OptimizationLevel {

    /** 强制回收 + 清理缓存 */
    NORMAL,

    /** 在 NORMAL 基础上增加引用分析与本地堆归还 */
    AGGRESSIVE;

    public static OptimizationLevel from(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown optimization level: " + value
                + ", expected normal or aggressive");
        }
    }
}
