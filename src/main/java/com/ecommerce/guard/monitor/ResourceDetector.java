package com.ecommerce.guard.monitor;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.support.PeriodicTicker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 资源探测器
 * <p>
 * 核心功能：
 * 1. 周期采样 CPU / 内存 / 交换分区 / 磁盘 / 网络 / 进程计数器
 * 2. 对累计计数器做差分得到每秒速率
 * 3. 维护有界历史（满时淘汰最旧）
 * 4. 低频刷新硬件信息
 * <p>
 * 所有公开方法都不抛异常，读取失败时返回最近一次有效数据。
 */
public class ResourceDetector {

    private static final Logger log = LoggerFactory.getLogger(ResourceDetector.class);

    private static final double MB = 1024.0 * 1024.0;

    private final GuardProperties properties;
    private final SystemCounterSource source;
    private final Clock clock;

    private final Object historyLock = new Object();
    private final Deque<ResourceUsage> history = new ArrayDeque<>();
    private final int historyCapacity;

    // 差分基线，只由采样线程写入
    private RawCounters previousCounters;
    private long previousTimestamp;

    private volatile ResourceUsage latest = ResourceUsage.empty();
    private volatile SystemInfo systemInfo = SystemInfo.empty();
    private volatile double activeIntervalSeconds;

    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong samplingFailures = new AtomicLong();
    private volatile PeriodicTicker ticker;

    public ResourceDetector(GuardProperties properties, SystemCounterSource source, Clock clock) {
        this.properties = properties != null ? properties : new GuardProperties();
        this.source = source;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.historyCapacity = Math.max(1, this.properties.getMonitoring().getHistorySize());
        this.activeIntervalSeconds = this.properties.getMonitoring().getIntervalSeconds();
        refreshHardwareFacts();
    }

    // ========== 硬件信息 ==========

    /**
     * 重新计算硬件信息，失败时保留原值
     */
    public SystemInfo refreshHardwareFacts() {
        try {
            SystemInfo fresh = source.readSystemInfo(properties.getMonitoring().getDiskPath());
            systemInfo = fresh.toBuilder().updatedAt(clock.millis()).build();
            log.debug("Hardware facts refreshed: {}", systemInfo.describe());
        } catch (Exception e) {
            log.warn("Failed to refresh hardware facts, keeping previous values: {}", e.getMessage());
        }
        return systemInfo;
    }

    public SystemInfo systemInfo() {
        return systemInfo;
    }

    // ========== 采样 ==========

    /**
     * 采样一次并追加到历史
     *
     * @return 新快照；读取失败时返回最近一次有效快照
     */
    public ResourceUsage sampleUsage() {
        RawCounters current;
        try {
            current = source.readCounters();
        } catch (Exception e) {
            samplingFailures.incrementAndGet();
            log.warn("Resource sampling failed, returning last known snapshot: {}", e.getMessage());
            return latest;
        }

        long now = clock.millis();
        ResourceUsage usage = toUsage(current, now);

        synchronized (historyLock) {
            previousCounters = current;
            previousTimestamp = now;
            if (history.size() >= historyCapacity) {
                history.pollFirst();
            }
            history.addLast(usage);
        }
        latest = usage;
        return usage;
    }

    private ResourceUsage toUsage(RawCounters c, long now) {
        RawCounters prev;
        long prevTs;
        synchronized (historyLock) {
            prev = previousCounters;
            prevTs = previousTimestamp;
        }
        double elapsed = prev == null ? 0.0 : (now - prevTs) / 1000.0;

        long total = c.getMemoryTotalBytes() > 0 ? c.getMemoryTotalBytes() : systemInfo.getTotalMemoryBytes();

        return ResourceUsage.builder()
            .timestamp(now)
            .cpuPercent(c.getCpuPercent())
            .cpuPercentPerCore(c.getCpuPercentPerCore())
            .loadAverages(c.getLoadAverages())
            .memoryUsedBytes(c.getMemoryUsedBytes())
            .memoryAvailableBytes(c.getMemoryAvailableBytes())
            .memoryPercent(percent(c.getMemoryUsedBytes(), total))
            .swapUsedBytes(c.getSwapUsedBytes())
            .swapPercent(percent(c.getSwapUsedBytes(), c.getSwapTotalBytes()))
            .diskReadBytesPerSec(rate(prev == null ? 0 : c.getDiskReadBytes() - prev.getDiskReadBytes(), elapsed))
            .diskWriteBytesPerSec(rate(prev == null ? 0 : c.getDiskWriteBytes() - prev.getDiskWriteBytes(), elapsed))
            .diskReadCountPerSec(rate(prev == null ? 0 : c.getDiskReadCount() - prev.getDiskReadCount(), elapsed))
            .diskWriteCountPerSec(rate(prev == null ? 0 : c.getDiskWriteCount() - prev.getDiskWriteCount(), elapsed))
            .netSentBytesPerSec(rate(prev == null ? 0 : c.getNetBytesSent() - prev.getNetBytesSent(), elapsed))
            .netRecvBytesPerSec(rate(prev == null ? 0 : c.getNetBytesRecv() - prev.getNetBytesRecv(), elapsed))
            .netPacketsSentPerSec(rate(prev == null ? 0 : c.getNetPacketsSent() - prev.getNetPacketsSent(), elapsed))
            .netPacketsRecvPerSec(rate(prev == null ? 0 : c.getNetPacketsRecv() - prev.getNetPacketsRecv(), elapsed))
            .processMemoryBytes(c.getProcessMemoryBytes())
            .processMemoryPercent(percent(c.getProcessMemoryBytes(), total))
            .processCpuPercent(c.getProcessCpuPercent())
            .processThreads(c.getProcessThreads())
            .processOpenFiles(c.getProcessOpenFiles())
            .heapUsedBytes(c.getHeapUsedBytes())
            .heapMaxBytes(c.getHeapMaxBytes())
            .systemUptimeSeconds(c.getSystemUptimeSeconds())
            .processUptimeSeconds(c.getProcessUptimeSeconds())
            .build();
    }

    /**
     * 差分速率，计数器回绕或间隔非正时为 0
     */
    static double rate(long delta, double elapsedSeconds) {
        if (elapsedSeconds <= 0 || delta <= 0) {
            return 0.0;
        }
        return delta / elapsedSeconds;
    }

    private static double percent(long part, long total) {
        return total > 0 ? part * 100.0 / total : 0.0;
    }

    public ResourceUsage latestUsage() {
        return latest;
    }

    /**
     * 实时读取进程内存，不写入历史
     */
    public long processMemoryBytes() {
        try {
            return source.readProcessMemoryBytes();
        } catch (Exception e) {
            log.warn("Failed to read process memory, using last sample: {}", e.getMessage());
            return latest.getProcessMemoryBytes();
        }
    }

    // ========== 周期监控 ==========

    /**
     * 启动周期采样
     *
     * @param intervalSeconds 采样间隔（秒）
     * @return 已在运行时返回 false
     */
    public synchronized boolean startMonitoring(double intervalSeconds) {
        if (ticker != null && ticker.isRunning()) {
            log.warn("Resource monitoring already running, ignoring start request");
            return false;
        }
        synchronized (historyLock) {
            previousCounters = null;
            previousTimestamp = 0L;
        }
        activeIntervalSeconds = intervalSeconds > 0 ? intervalSeconds : properties.getMonitoring().getIntervalSeconds();
        tickCount.set(0);
        long delay = PeriodicTicker.secondsToMillis(activeIntervalSeconds);
        ticker = new PeriodicTicker("resource-monitor", this::monitorTick, () -> delay);
        ticker.start();
        log.info("Resource monitoring started, interval={}s, historySize={}", activeIntervalSeconds, historyCapacity);
        return true;
    }

    public synchronized boolean stopMonitoring() {
        PeriodicTicker current = ticker;
        if (current == null || !current.stop()) {
            return false;
        }
        log.info("Resource monitoring stopped");
        return true;
    }

    public boolean isMonitoring() {
        PeriodicTicker current = ticker;
        return current != null && current.isRunning();
    }

    void monitorTick() {
        sampleUsage();
        int refreshEvery = properties.getMonitoring().getRefreshEveryTicks();
        if (refreshEvery > 0 && tickCount.incrementAndGet() % refreshEvery == 0) {
            refreshHardwareFacts();
        }
    }

    // ========== 压力检测 ==========

    public PressureReading detectMemoryPressure() {
        double value = latest.getMemoryPercent();
        return new PressureReading(value > properties.getThresholds().getWarningPercent(), value);
    }

    public PressureReading detectCpuPressure() {
        double value = latest.getCpuPercent();
        return new PressureReading(value > properties.getStress().getCpuThresholdPercent(), value);
    }

    // ========== 历史 ==========

    /**
     * 返回覆盖指定时长的历史后缀，条数 = 时长 / 采样间隔
     */
    public List<ResourceUsage> historicalUsage(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return Collections.emptyList();
        }
        double interval = activeIntervalSeconds > 0 ? activeIntervalSeconds : 1.0;
        long wanted = (long) (duration.toMillis() / 1000.0 / interval);
        synchronized (historyLock) {
            int count = (int) Math.min(wanted, history.size());
            if (count <= 0) {
                return Collections.emptyList();
            }
            List<ResourceUsage> all = new ArrayList<>(history);
            return new ArrayList<>(all.subList(all.size() - count, all.size()));
        }
    }

    public int historySize() {
        synchronized (historyLock) {
            return history.size();
        }
    }

    public int historyCapacity() {
        return historyCapacity;
    }

    public long samplingFailures() {
        return samplingFailures.get();
    }

    /**
     * 分组汇总视图，供状态接口使用
     */
    public Map<String, Object> summary() {
        SystemInfo info = systemInfo;
        ResourceUsage usage = latest;

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("hostname", info.getHostname());
        system.put("os", info.getOsName() + " " + info.getOsRelease());
        system.put("architecture", info.getArchitecture());
        system.put("jvmVersion", info.getJvmVersion());
        system.put("pid", info.getProcessId());
        system.put("uptimeSeconds", usage.getSystemUptimeSeconds());

        Map<String, Object> cpu = new LinkedHashMap<>();
        cpu.put("logicalCores", info.getCpuCountLogical());
        cpu.put("physicalCores", info.getCpuCountPhysical());
        cpu.put("frequencyMhz", info.getCpuFrequencyMhz());
        cpu.put("percent", usage.getCpuPercent());
        cpu.put("perCore", usage.getCpuPercentPerCore());
        cpu.put("loadAverages", usage.getLoadAverages());

        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("totalGb", info.getTotalMemoryGb());
        memory.put("usedMb", usage.getMemoryUsedBytes() / MB);
        memory.put("availableMb", usage.getMemoryAvailableBytes() / MB);
        memory.put("percent", usage.getMemoryPercent());
        memory.put("swapTotalGb", info.getSwapTotalGb());
        memory.put("swapPercent", usage.getSwapPercent());

        Map<String, Object> disk = new LinkedHashMap<>();
        disk.put("path", info.getDiskPath());
        disk.put("totalGb", info.getDiskTotalGb());
        disk.put("availableGb", info.getDiskAvailableGb());
        disk.put("readMbPerSec", usage.getDiskReadBytesPerSec() / MB);
        disk.put("writeMbPerSec", usage.getDiskWriteBytesPerSec() / MB);

        Map<String, Object> network = new LinkedHashMap<>();
        network.put("interfaces", info.getNetworkInterfaces());
        network.put("sentMbPerSec", usage.getNetSentBytesPerSec() / MB);
        network.put("recvMbPerSec", usage.getNetRecvBytesPerSec() / MB);

        Map<String, Object> process = new LinkedHashMap<>();
        process.put("memoryMb", usage.getProcessMemoryBytes() / MB);
        process.put("memoryPercent", usage.getProcessMemoryPercent());
        process.put("cpuPercent", usage.getProcessCpuPercent());
        process.put("threads", usage.getProcessThreads());
        process.put("openFiles", usage.getProcessOpenFiles());
        process.put("heapPercent", usage.getHeapPercent());
        process.put("uptimeSeconds", usage.getProcessUptimeSeconds());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("system", system);
        result.put("cpu", cpu);
        result.put("memory", memory);
        result.put("disk", disk);
        result.put("network", network);
        result.put("process", process);
        result.put("historySize", historySize());
        result.put("monitoring", isMonitoring());
        return result;
    }
}
