package com.ecommerce.guard.optimizer;

/**
 * 内存增长采样点
 *
 * @param timestamp          采样时间（毫秒）
 * @param processMemoryBytes 进程常驻内存
 * @param growthPercent      相对启动基线的增长（%）
 */
public record GrowthRecord(long timestamp, long processMemoryBytes, double growthPercent) {
}
