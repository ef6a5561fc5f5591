package com.ecommerce.guard.optimizer;

/**
 * 内存突增记录
 *
 * @param timestamp           检测时间（毫秒）
 * @param previousMb          上一次采样的进程内存（MB）
 * @param currentMb           本次采样的进程内存（MB）
 * @param diffMb              两次采样之差（MB）
 * @param systemMemoryPercent 检测时系统内存使用率（%）
 */
public record MemorySpike(long timestamp, double previousMb, double currentMb, double diffMb,
                          double systemMemoryPercent) {
}
