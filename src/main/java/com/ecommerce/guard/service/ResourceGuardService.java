package com.ecommerce.guard.service;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.monitor.ResourceUsage;
import com.ecommerce.guard.monitor.SystemInfo;
import com.ecommerce.guard.optimizer.GrowthReport;
import com.ecommerce.guard.optimizer.MemoryLimitResult;
import com.ecommerce.guard.optimizer.MemoryOptimizer;
import com.ecommerce.guard.optimizer.MemorySpike;
import com.ecommerce.guard.optimizer.OptimizationLevel;
import com.ecommerce.guard.optimizer.OptimizationResult;
import com.ecommerce.guard.stress.BackgroundTaskDescriptor;
import com.ecommerce.guard.stress.StressHandler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 资源守护服务门面
 * <p>
 * 负责按配置启动/停止三个后台循环，并向外暴露查询与管理操作。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceGuardService {

    private static final double MB = 1024.0 * 1024.0;

    private final GuardProperties properties;
    private final ResourceDetector resourceDetector;
    private final MemoryOptimizer memoryOptimizer;
    private final StressHandler stressHandler;
    private final Clock clock;

    @PostConstruct
    public void start() {
        if (properties.getMonitoring().isEnabled()) {
            resourceDetector.startMonitoring(properties.getMonitoring().getIntervalSeconds());
        }
        if (properties.getGc().isEnabled()) {
            memoryOptimizer.startPeriodicCollection();
        }
        if (properties.getStress().isEnabled()) {
            stressHandler.startMonitoring();
        }
        log.info("Resource guard started: monitoring={}, periodicCollection={}, stressHandling={}",
            resourceDetector.isMonitoring(), properties.getGc().isEnabled(), stressHandler.isMonitoring());
    }

    @PreDestroy
    public void stop() {
        stressHandler.stopMonitoring();
        memoryOptimizer.stopPeriodicCollection();
        resourceDetector.stopMonitoring();
        log.info("Resource guard stopped");
    }

    // ========== 查询 ==========

    public GuardStatus currentStatus() {
        ResourceUsage usage = resourceDetector.latestUsage();
        return new GuardStatus(
            stressHandler.currentState(),
            stressHandler.currentScore().score(),
            stressHandler.circuitBreaker().isActive(),
            stressHandler.throttler().isEnabled(),
            stressHandler.taskRegistry().anyPaused(),
            usage.getCpuPercent(),
            usage.getMemoryPercent(),
            usage.getProcessMemoryBytes() / MB,
            usage.getProcessMemoryPercent(),
            resourceDetector.isMonitoring(),
            stressHandler.isMonitoring(),
            clock.millis());
    }

    public SystemInfo systemFacts() {
        return resourceDetector.systemInfo();
    }

    public Map<String, Object> systemSummary() {
        return resourceDetector.summary();
    }

    public List<ResourceUsage> usageHistory(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        return resourceDetector.historicalUsage(Duration.ofMinutes(minutes));
    }

    public GrowthReport growthReport() {
        return memoryOptimizer.checkGrowthTrend();
    }

    public List<MemorySpike> memorySpikes() {
        return memoryOptimizer.memorySpikes();
    }

    public Map<String, Object> metrics() {
        Map<String, Object> detector = new LinkedHashMap<>();
        detector.put("historySize", resourceDetector.historySize());
        detector.put("historyCapacity", resourceDetector.historyCapacity());
        detector.put("samplingFailures", resourceDetector.samplingFailures());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("detector", detector);
        metrics.put("memory", memoryOptimizer.metrics());
        metrics.put("stress", stressHandler.stressMetrics());
        return metrics;
    }

    // ========== 管理 ==========

    public OptimizationResult optimize(String level) {
        return memoryOptimizer.optimize(OptimizationLevel.from(level));
    }

    public MemoryLimitResult setMemoryLimit(long limitMb) {
        return memoryOptimizer.setMemoryLimit(limitMb);
    }

    public BackgroundTaskDescriptor registerBackgroundTask(String name, Runnable pause, Runnable resume, boolean critical) {
        return stressHandler.registerBackgroundTask(name, pause, resume, critical);
    }
}
