package com.ecommerce.guard.health;

import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.monitor.ResourceUsage;
import com.ecommerce.guard.stress.RequestThrottler;
import com.ecommerce.guard.stress.StressCircuitBreaker;
import com.ecommerce.guard.stress.StressHandler;
import com.ecommerce.guard.stress.StressScore;
import com.ecommerce.guard.stress.StressState;
import com.ecommerce.guard.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 压力健康检查测试
 */
class StressHealthIndicatorTest {

    private StressHandler stressHandler;
    private ResourceDetector detector;
    private StressCircuitBreaker circuitBreaker;
    private StressHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        stressHandler = mock(StressHandler.class);
        detector = mock(ResourceDetector.class);
        circuitBreaker = new StressCircuitBreaker(CircuitBreakerRegistry.ofDefaults(), new MutableClock(0));
        when(stressHandler.currentState()).thenReturn(StressState.ELEVATED);
        when(stressHandler.currentScore()).thenReturn(StressScore.of(1.1, 0.2, 0.0));
        when(stressHandler.circuitBreaker()).thenReturn(circuitBreaker);
        when(stressHandler.throttler()).thenReturn(new RequestThrottler(RateLimiterRegistry.ofDefaults(), 10));
        when(detector.latestUsage()).thenReturn(ResourceUsage.empty());
        indicator = new StressHealthIndicator(stressHandler, detector);
    }

    @Test
    @DisplayName("熔断关闭时 UP")
    void testUp() {
        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("ELEVATED", health.getDetails().get("state"));
        assertEquals("CLOSED", health.getDetails().get("circuitBreaker"));
    }

    @Test
    @DisplayName("熔断打开时 OUT_OF_SERVICE")
    void testOutOfService() {
        circuitBreaker.activate();

        assertEquals(Status.OUT_OF_SERVICE, indicator.health().getStatus());
    }

    @Test
    @DisplayName("检查异常时 UNKNOWN")
    void testUnknownOnError() {
        when(detector.latestUsage()).thenThrow(new IllegalStateException("detector down"));

        Health health = indicator.health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals("detector down", health.getDetails().get("error"));
    }
}
