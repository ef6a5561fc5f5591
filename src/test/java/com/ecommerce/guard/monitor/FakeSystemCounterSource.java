package com.ecommerce.guard.monitor;

import java.io.IOException;

/**
 * 可编排的计数器来源，总内存固定为 8GB
 */
public class FakeSystemCounterSource implements SystemCounterSource {

    public static final long TOTAL_MEMORY = 8L * 1024 * 1024 * 1024;

    private volatile double cpuPercent;
    private volatile double memoryPercent;
    private volatile long processMemoryBytes = 512L * 1024 * 1024;
    private volatile long netBytesSent;
    private volatile long netBytesRecv;
    private volatile long diskReadBytes;
    private volatile boolean failCounters;
    private volatile boolean failSystemInfo;
    private volatile String hostname = "guard-test";

    @Override
    public SystemInfo readSystemInfo(String diskPath) throws IOException {
        if (failSystemInfo) {
            throw new IOException("system info unavailable");
        }
        return SystemInfo.builder()
            .hostname(hostname)
            .osName("Linux")
            .osRelease("6.1")
            .architecture("amd64")
            .jvmVersion("17")
            .cpuCountLogical(8)
            .cpuCountPhysical(4)
            .totalMemoryBytes(TOTAL_MEMORY)
            .availableMemoryBytes(TOTAL_MEMORY / 2)
            .diskPath(diskPath == null ? "/" : diskPath)
            .build();
    }

    @Override
    public RawCounters readCounters() throws IOException {
        if (failCounters) {
            throw new IOException("counters unavailable");
        }
        long used = (long) (TOTAL_MEMORY * memoryPercent / 100.0);
        return RawCounters.builder()
            .cpuPercent(cpuPercent)
            .memoryTotalBytes(TOTAL_MEMORY)
            .memoryUsedBytes(used)
            .memoryAvailableBytes(TOTAL_MEMORY - used)
            .netBytesSent(netBytesSent)
            .netBytesRecv(netBytesRecv)
            .diskReadBytes(diskReadBytes)
            .processMemoryBytes(processMemoryBytes)
            .processThreads(42)
            .build();
    }

    @Override
    public long readProcessMemoryBytes() throws IOException {
        if (failCounters) {
            throw new IOException("counters unavailable");
        }
        return processMemoryBytes;
    }

    public void setCpuPercent(double cpuPercent) {
        this.cpuPercent = cpuPercent;
    }

    public void setMemoryPercent(double memoryPercent) {
        this.memoryPercent = memoryPercent;
    }

    public void setProcessMemoryBytes(long processMemoryBytes) {
        this.processMemoryBytes = processMemoryBytes;
    }

    public void setProcessMemoryPercent(double percent) {
        this.processMemoryBytes = (long) (TOTAL_MEMORY * percent / 100.0);
    }

    public void addNetwork(long sent, long recv) {
        this.netBytesSent += sent;
        this.netBytesRecv += recv;
    }

    public void addDiskRead(long bytes) {
        this.diskReadBytes += bytes;
    }

    public void setFailCounters(boolean failCounters) {
        this.failCounters = failCounters;
    }

    public void setFailSystemInfo(boolean failSystemInfo) {
        this.failSystemInfo = failSystemInfo;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }
}
