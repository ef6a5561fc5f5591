package com.ecommerce.guard.monitor;

/**
 * 压力检测结果
 *
 * @param underPressure 是否超过阈值
 * @param value         最近一次采样的指标值（%）
 */
public record PressureReading(boolean underPressure, double value) {
}
