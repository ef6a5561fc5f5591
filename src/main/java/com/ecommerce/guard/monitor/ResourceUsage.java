package com.ecommerce.guard.monitor;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 单次采样的资源使用快照（不可变）
 * <p>
 * 速率字段为两次采样的差值除以间隔秒数，首个采样为 0。
 */
@Value
@Builder(toBuilder = true)
public class ResourceUsage {

    private static final double MB = 1024.0 * 1024.0;

    long timestamp;

    // CPU（%）
    double cpuPercent;
    @Builder.Default
    List<Double> cpuPercentPerCore = Collections.emptyList();
    @Builder.Default
    List<Double> loadAverages = Collections.emptyList();

    // 内存
    long memoryUsedBytes;
    long memoryAvailableBytes;
    double memoryPercent;

    // 交换分区
    long swapUsedBytes;
    double swapPercent;

    // 磁盘 I/O 速率
    double diskReadBytesPerSec;
    double diskWriteBytesPerSec;
    double diskReadCountPerSec;
    double diskWriteCountPerSec;

    // 网络 I/O 速率
    double netSentBytesPerSec;
    double netRecvBytesPerSec;
    double netPacketsSentPerSec;
    double netPacketsRecvPerSec;

    // 进程
    long processMemoryBytes;
    double processMemoryPercent;
    double processCpuPercent;
    int processThreads;
    long processOpenFiles;
    long heapUsedBytes;
    long heapMaxBytes;

    // 运行时长（秒）
    double systemUptimeSeconds;
    double processUptimeSeconds;

    public static ResourceUsage empty() {
        return ResourceUsage.builder().build();
    }

    public double getNetworkMegabytesPerSec() {
        return (netSentBytesPerSec + netRecvBytesPerSec) / MB;
    }

    public double getHeapPercent() {
        return heapMaxBytes > 0 ? heapUsedBytes * 100.0 / heapMaxBytes : 0.0;
    }

    public boolean hasZeroRates() {
        return diskReadBytesPerSec == 0 && diskWriteBytesPerSec == 0
            && diskReadCountPerSec == 0 && diskWriteCountPerSec == 0
            && netSentBytesPerSec == 0 && netRecvBytesPerSec == 0
            && netPacketsSentPerSec == 0 && netPacketsRecvPerSec == 0;
    }
}
