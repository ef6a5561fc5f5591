package com.ecommerce.guard.monitor;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 计数器原始读数，I/O 类字段为累计值，由探测器做差分
 */
@Value
@Builder
public class RawCounters {

    double cpuPercent;
    @Builder.Default
    List<Double> cpuPercentPerCore = Collections.emptyList();
    @Builder.Default
    List<Double> loadAverages = Collections.emptyList();

    long memoryTotalBytes;
    long memoryUsedBytes;
    long memoryAvailableBytes;

    long swapTotalBytes;
    long swapUsedBytes;

    // 累计值
    long diskReadBytes;
    long diskWriteBytes;
    long diskReadCount;
    long diskWriteCount;
    long netBytesSent;
    long netBytesRecv;
    long netPacketsSent;
    long netPacketsRecv;

    long processMemoryBytes;
    double processCpuPercent;
    int processThreads;
    long processOpenFiles;
    long heapUsedBytes;
    long heapMaxBytes;

    double systemUptimeSeconds;
    double processUptimeSeconds;
}
