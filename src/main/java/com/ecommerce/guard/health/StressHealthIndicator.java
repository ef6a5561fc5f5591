package com.ecommerce.guard.health;

import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.stress.StressHandler;
import com.ecommerce.guard.stress.StressState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 压力状态健康检查，熔断打开时为 OUT_OF_SERVICE
 */
@Slf4j
@Component("stressHealthIndicator")
@RequiredArgsConstructor
public class StressHealthIndicator implements HealthIndicator {

    private final StressHandler stressHandler;
    private final ResourceDetector resourceDetector;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            StressState state = stressHandler.currentState();
            details.put("state", state.name());
            details.put("score", stressHandler.currentScore().score());
            details.put("circuitBreaker", stressHandler.circuitBreaker().state());
            details.put("throttling", stressHandler.throttler().isEnabled());
            details.put("monitoring", resourceDetector.isMonitoring());
            details.put("memoryPercent", resourceDetector.latestUsage().getMemoryPercent());

            if (stressHandler.circuitBreaker().isActive()) {
                return Health.outOfService().withDetails(details).build();
            }
            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            log.error("Stress health check failed", e);
            details.put("error", e.getMessage());
            return Health.unknown().withDetails(details).build();
        }
    }
}
