package com.ecommerce.guard.monitor;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 硬件与进程的近似静态信息，由 {@link ResourceDetector} 周期性整体替换
 */
@Value
@Builder(toBuilder = true)
public class SystemInfo {

    private static final double GB = 1024.0 * 1024.0 * 1024.0;

    // 标识
    String hostname;
    String osName;
    String osRelease;
    String architecture;
    String jvmVersion;
    long processId;

    // CPU
    int cpuCountPhysical;
    int cpuCountLogical;
    double cpuFrequencyMhz;
    double cpuFrequencyMaxMhz;

    // 内存（字节）
    long totalMemoryBytes;
    long availableMemoryBytes;

    // 交换分区（字节）
    long swapTotalBytes;
    long swapAvailableBytes;

    // 磁盘（字节）
    long diskTotalBytes;
    long diskAvailableBytes;
    String diskPath;

    @Builder.Default
    List<String> networkInterfaces = Collections.emptyList();

    long updatedAt;

    public static SystemInfo empty() {
        return SystemInfo.builder().hostname("").osName("").osRelease("").architecture("")
            .jvmVersion("").diskPath("").build();
    }

    public double getTotalMemoryGb() {
        return totalMemoryBytes / GB;
    }

    public double getAvailableMemoryGb() {
        return availableMemoryBytes / GB;
    }

    public double getSwapTotalGb() {
        return swapTotalBytes / GB;
    }

    public double getDiskTotalGb() {
        return diskTotalBytes / GB;
    }

    public double getDiskAvailableGb() {
        return diskAvailableBytes / GB;
    }

    public String describe() {
        return String.format("System: %s %s (%s), CPU: %d logical cores %.0fMHz, Memory: %.1fGB total, "
                + "Swap: %.1fGB total, Disk: %.1fGB total %.1fGB available on %s",
            osName, osRelease, architecture, cpuCountLogical, cpuFrequencyMhz,
            getTotalMemoryGb(), getSwapTotalGb(), getDiskTotalGb(), getDiskAvailableGb(), diskPath);
    }
}
