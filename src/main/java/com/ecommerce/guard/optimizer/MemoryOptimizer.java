package com.ecommerce.guard.optimizer;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.support.PeriodicTicker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * 内存优化器
 * <p>
 * 核心功能：
 * 1. 启动时按物理内存调优回收阈值
 * 2. 按需或越过阈值时执行回收
 * 3. 清理已知缓存
 * 4. 以启动基线跟踪内存增长，识别持续增长（疑似泄漏）
 * 5. 记录相邻采样之间的内存突增
 * <p>
 * 统计计数器为近似值，后台线程与前台调用之间的竞争不做额外同步。
 * runCollection / optimize 允许并发调用，回收原语本身串行。
 */
public class MemoryOptimizer {

    private static final Logger log = LoggerFactory.getLogger(MemoryOptimizer.class);

    private static final double MB = 1024.0 * 1024.0;
    private static final int DURATION_WINDOW = 10;
    private static final int GROWTH_WINDOW = 60;
    private static final int CONSISTENT_POINTS = 3;
    private static final int SPIKE_WINDOW = 50;

    static final String TRIM_NATIVE_HEAP = "systemTrimNativeHeap";
    static final String CLASS_HISTOGRAM = "gcClassHistogram";

    private final GuardProperties properties;
    private final ResourceDetector detector;
    private final CollectorBridge collector;
    private final CacheSweeper cacheSweeper;
    private final HeapPoolThresholdTuner tuner;
    private final DiagnosticCommands diagnosticCommands;
    private final MemoryLimiter memoryLimiter;
    private final Clock clock;

    // 调优结果，未调优时为 null
    private volatile CollectorThresholds thresholds;

    // 回收统计
    private final LongAdder collectionsRun = new LongAdder();
    private final LongAdder itemsReclaimed = new LongAdder();
    private final LongAdder bytesReclaimed = new LongAdder();
    private final LongAdder emergencyPasses = new LongAdder();
    private final LongAdder collectionFailures = new LongAdder();
    private final LongAdder cachesCleared = new LongAdder();
    private final LongAdder optimizations = new LongAdder();
    private final LongAdder bytesSaved = new LongAdder();
    private final Deque<Long> recentDurations = new ArrayDeque<>();
    private volatile long lastCollectionAt;

    // 增长跟踪
    private final long baselineBytes;
    private final long baselineAt;
    private final Deque<GrowthRecord> growth = new ArrayDeque<>();
    private final AtomicLong peakBytes = new AtomicLong();

    // 突增检测
    private final Deque<MemorySpike> spikes = new ArrayDeque<>();
    private final LongAdder spikesDetected = new LongAdder();
    private long lastObservedBytes;

    private final AtomicBoolean thresholdCollectionRunning = new AtomicBoolean();
    private volatile PeriodicTicker ticker;

    // 指标
    private final Counter collectionCounter;
    private final Counter emergencyCounter;
    private final Counter reclaimedBytesCounter;

    public MemoryOptimizer(GuardProperties properties,
                           ResourceDetector detector,
                           CollectorBridge collector,
                           CacheSweeper cacheSweeper,
                           HeapPoolThresholdTuner tuner,
                           DiagnosticCommands diagnosticCommands,
                           MemoryLimiter memoryLimiter,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.properties = properties != null ? properties : new GuardProperties();
        this.detector = detector;
        this.collector = collector;
        this.cacheSweeper = cacheSweeper;
        this.tuner = tuner;
        this.diagnosticCommands = diagnosticCommands;
        this.memoryLimiter = memoryLimiter;
        this.clock = clock != null ? clock : Clock.systemUTC();

        this.collectionCounter = Counter.builder("guard.gc.passes")
            .description("Reclamation passes run")
            .register(meterRegistry);
        this.emergencyCounter = Counter.builder("guard.gc.emergency.passes")
            .description("Forced reclamation passes")
            .register(meterRegistry);
        this.reclaimedBytesCounter = Counter.builder("guard.gc.reclaimed.bytes")
            .description("Estimated bytes reclaimed")
            .baseUnit("bytes")
            .register(meterRegistry);
        Gauge.builder("guard.memory.peak.bytes", peakBytes, AtomicLong::get)
            .baseUnit("bytes")
            .register(meterRegistry);

        GuardProperties.GcConfig gc = this.properties.getGc();
        if (gc.getDebugFlags() != 0) {
            collector.setVerbose(true);
            log.info("Verbose collector output enabled, debugFlags={}", gc.getDebugFlags());
        }
        if (gc.isEnabled() && gc.isTuneThresholds()) {
            tuneCollectorThresholds();
        }

        this.baselineBytes = detector.processMemoryBytes();
        this.baselineAt = this.clock.millis();
        this.peakBytes.set(baselineBytes);
        this.lastObservedBytes = baselineBytes;
        log.info("MemoryOptimizer initialized: baseline={}MB, collectionThreshold={}%",
            String.format("%.1f", baselineBytes / MB), gc.getThresholdPercent());
    }

    // ========== 阈值调优 ==========

    private void tuneCollectorThresholds() {
        double totalGb = detector.systemInfo().getTotalMemoryGb();
        CollectorThresholds computed = HeapPoolThresholdTuner.compute(totalGb, properties.getGc());
        thresholds = computed;
        if (tuner != null) {
            try {
                tuner.install(computed, this::onThresholdExceeded);
            } catch (RuntimeException e) {
                log.warn("Failed to install collector thresholds: {}", e.getMessage());
            }
        }
    }

    private void onThresholdExceeded() {
        // 通知可能密集到达，同一时间只跑一次
        if (!thresholdCollectionRunning.compareAndSet(false, true)) {
            return;
        }
        try {
            runCollection(false);
        } finally {
            thresholdCollectionRunning.set(false);
        }
    }

    public CollectorThresholds thresholds() {
        return thresholds;
    }

    // ========== 回收 ==========

    /**
     * 执行回收
     *
     * @param force true 时无条件执行，并计为紧急回收
     */
    public CollectionResult runCollection(boolean force) {
        double memoryPercent = force
            ? detector.latestUsage().getProcessMemoryPercent()
            : detector.sampleUsage().getProcessMemoryPercent();
        if (!force && memoryPercent <= properties.getGc().getThresholdPercent()) {
            return CollectionResult.skipped("not needed", memoryPercent);
        }

        try {
            long before = collector.heapUsedBytes();
            long start = System.nanoTime();
            collector.collect();
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            long after = collector.heapUsedBytes();

            long reclaimed = Math.max(0, before - after);
            long items = reclaimed / Math.max(1, properties.getGc().getAverageObjectSizeBytes());

            collectionsRun.increment();
            itemsReclaimed.add(items);
            bytesReclaimed.add(reclaimed);
            collectionCounter.increment();
            reclaimedBytesCounter.increment(reclaimed);
            if (force) {
                emergencyPasses.increment();
                emergencyCounter.increment();
            }
            recordDuration(durationMs);
            lastCollectionAt = clock.millis();

            log.debug("Collection pass finished: forced={}, duration={}ms, reclaimed={}KB",
                force, durationMs, reclaimed / 1024);
            return CollectionResult.completed(durationMs, items, reclaimed, force);
        } catch (Exception e) {
            collectionFailures.increment();
            log.error("Collection pass failed", e);
            return CollectionResult.failed(String.valueOf(e.getMessage()), force);
        }
    }

    private void recordDuration(long durationMs) {
        synchronized (recentDurations) {
            if (recentDurations.size() >= DURATION_WINDOW) {
                recentDurations.pollFirst();
            }
            recentDurations.addLast(durationMs);
        }
    }

    public double averageCollectionMillis() {
        synchronized (recentDurations) {
            return recentDurations.stream().mapToLong(Long::longValue).average().orElse(0.0);
        }
    }

    // ========== 缓存与引用 ==========

    public CacheSweepResult clearKnownCaches() {
        try {
            CacheSweepResult result = cacheSweeper.sweep();
            cachesCleared.add(result.cachesCleared());
            return result;
        } catch (Exception e) {
            log.error("Cache sweep failed", e);
            return new CacheSweepResult(0, 0, List.of(), 1);
        }
    }

    /**
     * 探测对象引用图分析工具是否可用，不做实际分析
     */
    public ReferenceReductionResult reduceReferences() {
        if (diagnosticCommands != null && diagnosticCommands.isSupported(CLASS_HISTOGRAM)) {
            return new ReferenceReductionResult(true, "GC.class_histogram",
                "Object graph introspection available through the diagnostic command MBean");
        }
        return ReferenceReductionResult.unavailable("Object graph introspection tooling is not available");
    }

    /**
     * 归还空闲本地堆给操作系统（HotSpot System.trim_native_heap）
     */
    public NativeTrimResult trimNativeMemory() {
        if (diagnosticCommands == null || !diagnosticCommands.isSupported(TRIM_NATIVE_HEAP)) {
            return NativeTrimResult.unsupported("System.trim_native_heap is not supported by this runtime");
        }
        try {
            String output = diagnosticCommands.invoke(TRIM_NATIVE_HEAP);
            log.info("Native heap trimmed: {}", output);
            return new NativeTrimResult(true, true, output);
        } catch (JMException e) {
            log.warn("Native heap trim failed: {}", e.getMessage());
            return new NativeTrimResult(true, false, e.getMessage());
        }
    }

    // ========== 增长趋势 ==========

    public GrowthReport checkGrowthTrend() {
        long now = clock.millis();
        long current = detector.processMemoryBytes();
        peakBytes.accumulateAndGet(current, Math::max);
        detectSpike(now, current);

        double growthPercent = baselineBytes > 0 ? (current - baselineBytes) * 100.0 / baselineBytes : 0.0;
        double elapsedSeconds = (now - baselineAt) / 1000.0;
        double ratePerHour = elapsedSeconds > 0 ? growthPercent / elapsedSeconds * 3600.0 : 0.0;

        boolean consistent;
        int records;
        synchronized (growth) {
            if (growth.size() >= GROWTH_WINDOW) {
                growth.pollFirst();
            }
            growth.addLast(new GrowthRecord(now, current, growthPercent));
            consistent = isConsistentGrowth();
            records = growth.size();
        }

        boolean abnormal = ratePerHour > properties.getThresholds().getLeakPercent() && consistent;
        if (abnormal) {
            log.warn("Abnormal memory growth detected: {}%/h, current={}MB, baseline={}MB",
                String.format("%.2f", ratePerHour), String.format("%.1f", current / MB),
                String.format("%.1f", baselineBytes / MB));
        }
        return new GrowthReport(baselineBytes, current, peakBytes.get(), growthPercent, ratePerHour,
            consistent, abnormal, elapsedSeconds / 3600.0, records);
    }

    /**
     * 最近三个点内存严格递增
     */
    private boolean isConsistentGrowth() {
        if (growth.size() < CONSISTENT_POINTS) {
            return false;
        }
        List<GrowthRecord> all = new ArrayList<>(growth);
        List<GrowthRecord> tail = all.subList(all.size() - CONSISTENT_POINTS, all.size());
        for (int i = 1; i < tail.size(); i++) {
            if (tail.get(i).processMemoryBytes() <= tail.get(i - 1).processMemoryBytes()) {
                return false;
            }
        }
        return true;
    }

    public List<GrowthRecord> growthRecords() {
        synchronized (growth) {
            return new ArrayList<>(growth);
        }
    }

    // ========== 突增 ==========

    /**
     * 与上一次观测比较，增量超过阈值时记录一次突增
     */
    private void detectSpike(long now, long currentBytes) {
        MemorySpike spike = null;
        synchronized (spikes) {
            long previous = lastObservedBytes;
            lastObservedBytes = currentBytes;
            if (previous <= 0) {
                return;
            }
            double diffMb = (currentBytes - previous) / MB;
            if (diffMb > properties.getThresholds().getSpikeThresholdMb()) {
                spike = new MemorySpike(now, previous / MB, currentBytes / MB, diffMb,
                    detector.latestUsage().getMemoryPercent());
                if (spikes.size() >= SPIKE_WINDOW) {
                    spikes.pollFirst();
                }
                spikes.addLast(spike);
                spikesDetected.increment();
            }
        }
        if (spike != null) {
            log.warn("Memory spike detected: +{}MB, now at {}MB",
                String.format("%.1f", spike.diffMb()), String.format("%.1f", spike.currentMb()));
        }
    }

    /**
     * 最近的突增记录，最多保留 50 条
     */
    public List<MemorySpike> memorySpikes() {
        synchronized (spikes) {
            return new ArrayList<>(spikes);
        }
    }

    // ========== 优化 ==========

    public OptimizationResult optimize(OptimizationLevel level) {
        OptimizationLevel effective = level != null ? level : OptimizationLevel.NORMAL;
        long start = clock.millis();
        long before = detector.processMemoryBytes();
        peakBytes.accumulateAndGet(before, Math::max);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("collection", runCollection(true));
        details.put("caches", clearKnownCaches());
        if (effective == OptimizationLevel.AGGRESSIVE) {
            details.put("references", reduceReferences());
            details.put("nativeTrim", trimNativeMemory());
        }

        long after = detector.processMemoryBytes();
        long saved = Math.max(0, before - after);
        optimizations.increment();
        bytesSaved.add(saved);

        log.info("Memory optimization finished: level={}, before={}MB, after={}MB, saved={}MB",
            effective, String.format("%.1f", before / MB), String.format("%.1f", after / MB),
            String.format("%.1f", saved / MB));
        return new OptimizationResult(effective, before, after, saved, saved / MB, clock.millis() - start, details);
    }

    public MemoryLimitResult setMemoryLimit(long limitMb) {
        return memoryLimiter.apply(limitMb);
    }

    // ========== 周期回收 ==========

    /**
     * 启动周期回收，每次同时记录一个增长点
     */
    public synchronized boolean startPeriodicCollection() {
        GuardProperties.GcConfig gc = properties.getGc();
        if (!gc.isEnabled() || gc.getIntervalSeconds() <= 0) {
            log.info("Periodic collection disabled");
            return false;
        }
        if (ticker != null && ticker.isRunning()) {
            log.warn("Periodic collection already running");
            return false;
        }
        long delay = PeriodicTicker.secondsToMillis(gc.getIntervalSeconds());
        ticker = new PeriodicTicker("memory-optimizer", this::periodicTick, () -> delay);
        ticker.start();
        log.info("Periodic collection started, interval={}s", gc.getIntervalSeconds());
        return true;
    }

    public synchronized boolean stopPeriodicCollection() {
        PeriodicTicker current = ticker;
        return current != null && current.stop();
    }

    /**
     * 停止周期回收并移除阈值监听
     */
    public void shutdown() {
        stopPeriodicCollection();
        if (tuner != null) {
            tuner.uninstall();
        }
    }

    void periodicTick() {
        runCollection(false);
        checkGrowthTrend();
    }

    // ========== 统计 ==========

    /**
     * 累计统计 + 运行时回收器实时计数
     */
    public Map<String, Object> metrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("collectionsRun", collectionsRun.sum());
        metrics.put("itemsReclaimed", itemsReclaimed.sum());
        metrics.put("bytesReclaimed", bytesReclaimed.sum());
        metrics.put("emergencyPasses", emergencyPasses.sum());
        metrics.put("collectionFailures", collectionFailures.sum());
        metrics.put("averageCollectionMs", averageCollectionMillis());
        metrics.put("lastCollectionAt", lastCollectionAt);
        metrics.put("cachesCleared", cachesCleared.sum());
        metrics.put("optimizations", optimizations.sum());
        metrics.put("bytesSaved", bytesSaved.sum());
        metrics.put("baselineMemoryMb", baselineBytes / MB);
        metrics.put("peakMemoryMb", peakBytes.get() / MB);

        try {
            metrics.put("runtimeCollections", collector.collectionCount());
            metrics.put("runtimeCollectionTimeMs", collector.collectionTimeMillis());
            metrics.put("collectors", collector.collectorDetails());
        } catch (RuntimeException e) {
            log.warn("Failed to read collector counters: {}", e.getMessage());
        }

        Map<String, Object> spikeStats = new LinkedHashMap<>();
        spikeStats.put("detected", spikesDetected.sum());
        spikeStats.put("thresholdMb", properties.getThresholds().getSpikeThresholdMb());
        spikeStats.put("recent", memorySpikes());
        metrics.put("spikes", spikeStats);

        CollectorThresholds tuned = thresholds;
        if (tuned != null) {
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("young", tuned.young());
            t.put("survivor", tuned.survivor());
            t.put("tenured", tuned.tenured());
            t.put("memoryFactor", tuned.memoryFactor());
            metrics.put("thresholds", t);
        }
        return metrics;
    }

    public long emergencyPasses() {
        return emergencyPasses.sum();
    }

    public long collectionsRun() {
        return collectionsRun.sum();
    }
}
