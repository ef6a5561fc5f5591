package com.ecommerce.guard.config;

import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.stress.StressHandler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * 资源守护监控指标
 * 提供：
 * 1. 采样指标（历史长度、采样失败、最近一次 CPU / 内存）
 * 2. 降载指标（限流拒绝、后台任务暂停）
 * <p>
 * JVM 与系统指标由 actuator 自动绑定。
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    private final MeterRegistry meterRegistry;
    private final ResourceDetector resourceDetector;
    private final StressHandler stressHandler;

    public MetricsConfig(MeterRegistry meterRegistry, ResourceDetector resourceDetector, StressHandler stressHandler) {
        this.meterRegistry = meterRegistry;
        this.resourceDetector = resourceDetector;
        this.stressHandler = stressHandler;
    }

    @PostConstruct
    public void initMetrics() {
        registerSamplingMetrics();
        registerSheddingMetrics();
        log.info("Resource guard metrics initialized");
    }

    private void registerSamplingMetrics() {
        Gauge.builder("guard.monitor.history.size", resourceDetector, ResourceDetector::historySize)
            .description("Retained usage snapshots")
            .register(meterRegistry);

        Gauge.builder("guard.monitor.sampling.failures", resourceDetector, ResourceDetector::samplingFailures)
            .description("Failed counter reads")
            .register(meterRegistry);

        Gauge.builder("guard.monitor.cpu.percent", resourceDetector, d -> d.latestUsage().getCpuPercent())
            .register(meterRegistry);

        Gauge.builder("guard.monitor.memory.percent", resourceDetector, d -> d.latestUsage().getMemoryPercent())
            .register(meterRegistry);

        Gauge.builder("guard.monitor.process.memory.percent", resourceDetector,
                d -> d.latestUsage().getProcessMemoryPercent())
            .register(meterRegistry);
    }

    private void registerSheddingMetrics() {
        Gauge.builder("guard.stress.rejected.requests", stressHandler, StressHandler::rejectedRequests)
            .description("Requests rejected by the stress gate")
            .register(meterRegistry);

        Gauge.builder("guard.stress.throttled.requests", stressHandler, h -> h.throttler().rejected())
            .register(meterRegistry);

        Gauge.builder("guard.stress.tasks.paused", stressHandler, h -> h.taskRegistry().pausedTaskNames().size())
            .description("Background tasks currently paused")
            .register(meterRegistry);
    }
}
