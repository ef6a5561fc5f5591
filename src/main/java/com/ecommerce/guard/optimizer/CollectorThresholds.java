package com.ecommerce.guard.optimizer;

/**
 * 调优后的回收阈值（堆内存池容量百分比）
 *
 * @param young        新生代（Eden）
 * @param survivor     幸存区
 * @param tenured      老年代
 * @param memoryFactor 计算时使用的内存系数
 */
public record CollectorThresholds(int young, int survivor, int tenured, double memoryFactor) {
}
