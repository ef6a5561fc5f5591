package com.ecommerce.guard.config;

import com.ecommerce.guard.monitor.JvmProcSystemCounterSource;
import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.monitor.SystemCounterSource;
import com.ecommerce.guard.optimizer.CacheSweeper;
import com.ecommerce.guard.optimizer.CollectorBridge;
import com.ecommerce.guard.optimizer.DiagnosticCommands;
import com.ecommerce.guard.optimizer.HeapPoolThresholdTuner;
import com.ecommerce.guard.optimizer.JvmCollectorBridge;
import com.ecommerce.guard.optimizer.MemoryLimiter;
import com.ecommerce.guard.optimizer.MemoryOptimizer;
import com.ecommerce.guard.stress.BackgroundTaskRegistry;
import com.ecommerce.guard.stress.LogVerbosityController;
import com.ecommerce.guard.stress.RequestThrottler;
import com.ecommerce.guard.stress.StressCircuitBreaker;
import com.ecommerce.guard.stress.StressHandler;
import com.ecommerce.guard.stress.StressRequestGate;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 资源守护组件装配
 * <p>
 * 依赖顺序：探测器 → 内存优化器 → 压力处理器。
 * 后台循环由 {@link com.ecommerce.guard.service.ResourceGuardService} 按配置启动。
 */
@Configuration
@EnableConfigurationProperties(GuardProperties.class)
public class GuardAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GuardAutoConfiguration.class);

    private final GuardProperties properties;

    public GuardAutoConfiguration(GuardProperties properties) {
        this.properties = properties;
        log.info("Resource guard configuration initializing");
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock guardClock() {
        return Clock.systemUTC();
    }

    // ========== 探测器 ==========

    @Bean
    @ConditionalOnMissingBean
    public SystemCounterSource systemCounterSource() {
        return new JvmProcSystemCounterSource();
    }

    @Bean
    public ResourceDetector resourceDetector(SystemCounterSource systemCounterSource, Clock clock) {
        log.info("Creating ResourceDetector bean");
        return new ResourceDetector(properties, systemCounterSource, clock);
    }

    // ========== 内存优化器 ==========

    @Bean
    @ConditionalOnMissingBean
    public CollectorBridge collectorBridge() {
        return new JvmCollectorBridge();
    }

    @Bean
    public CacheSweeper cacheSweeper(ApplicationContext applicationContext) {
        return new CacheSweeper(applicationContext, properties.getGc().getAverageObjectSizeBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryLimiter memoryLimiter() {
        return new MemoryLimiter();
    }

    @Bean(destroyMethod = "shutdown")
    public MemoryOptimizer memoryOptimizer(ResourceDetector resourceDetector,
                                           CollectorBridge collectorBridge,
                                           CacheSweeper cacheSweeper,
                                           MemoryLimiter memoryLimiter,
                                           MeterRegistry meterRegistry,
                                           Clock clock) {
        log.info("Creating MemoryOptimizer bean");
        return new MemoryOptimizer(properties, resourceDetector, collectorBridge, cacheSweeper,
            new HeapPoolThresholdTuner(), new DiagnosticCommands(), memoryLimiter, meterRegistry, clock);
    }

    // ========== 压力处理 ==========

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiterRegistry rateLimiterRegistry() {
        return RateLimiterRegistry.ofDefaults();
    }

    @Bean
    public StressCircuitBreaker stressCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        return new StressCircuitBreaker(circuitBreakerRegistry, clock);
    }

    @Bean
    public RequestThrottler requestThrottler(RateLimiterRegistry rateLimiterRegistry) {
        return new RequestThrottler(rateLimiterRegistry, properties.getStress().getThrottlePermitsPerSecond());
    }

    @Bean
    public LogVerbosityController logVerbosityController(ObjectProvider<LoggingSystem> loggingSystem) {
        return new LogVerbosityController(loggingSystem.getIfAvailable());
    }

    @Bean
    public BackgroundTaskRegistry backgroundTaskRegistry() {
        return new BackgroundTaskRegistry();
    }

    @Bean
    public StressHandler stressHandler(ResourceDetector resourceDetector,
                                       MemoryOptimizer memoryOptimizer,
                                       BackgroundTaskRegistry backgroundTaskRegistry,
                                       StressCircuitBreaker stressCircuitBreaker,
                                       RequestThrottler requestThrottler,
                                       LogVerbosityController logVerbosityController,
                                       MeterRegistry meterRegistry,
                                       Clock clock) {
        log.info("Creating StressHandler bean");
        return new StressHandler(properties, resourceDetector, memoryOptimizer, backgroundTaskRegistry,
            stressCircuitBreaker, requestThrottler, logVerbosityController, meterRegistry, clock);
    }

    @Bean
    public StressRequestGate stressRequestGate(StressHandler stressHandler) {
        return new StressRequestGate(stressHandler, properties.getStress().getCriticalEndpoints());
    }
}
