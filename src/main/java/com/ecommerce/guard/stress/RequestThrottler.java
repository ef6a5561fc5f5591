package com.ecommerce.guard.stress;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * 请求限流，仅在压力处理器启用后生效
 */
@Slf4j
public class RequestThrottler {

    public static final String NAME = "stressThrottle";

    private final RateLimiter rateLimiter;
    private final LongAdder rejected = new LongAdder();
    private volatile boolean enabled;

    public RequestThrottler(RateLimiterRegistry registry, int permitsPerSecond) {
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(Math.max(1, permitsPerSecond))
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ZERO)
            .build();
        this.rateLimiter = registry.rateLimiter(NAME, config);
    }

    public boolean enable() {
        if (enabled) {
            return false;
        }
        enabled = true;
        log.warn("Request throttling enabled: {} requests/s", rateLimiter.getRateLimiterConfig().getLimitForPeriod());
        return true;
    }

    public boolean disable() {
        if (!enabled) {
            return false;
        }
        enabled = false;
        log.info("Request throttling disabled");
        return true;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 获取许可，未启用时总是放行
     */
    public boolean tryAcquire() {
        if (!enabled) {
            return true;
        }
        if (rateLimiter.acquirePermission()) {
            return true;
        }
        rejected.increment();
        return false;
    }

    public long rejected() {
        return rejected.sum();
    }

    public int availablePermissions() {
        return rateLimiter.getMetrics().getAvailablePermissions();
    }
}
