package com.ecommerce.guard.stress;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.LongAdder;

/**
 * 压力熔断器
 * <p>
 * 由压力处理器显式开关，底层使用 Resilience4j 熔断器的 FORCED_OPEN / CLOSED 状态，
 * 不依据调用失败率自动转换。
 */
public class StressCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(StressCircuitBreaker.class);

    public static final String NAME = "stress";

    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final LongAdder trips = new LongAdder();
    private volatile long activatedAt;

    public StressCircuitBreaker(CircuitBreakerRegistry registry, Clock clock) {
        this.circuitBreaker = registry.circuitBreaker(NAME);
        this.clock = clock != null ? clock : Clock.systemUTC();
        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Stress circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));
    }

    /**
     * 打开熔断
     *
     * @return 已打开时返回 false
     */
    public synchronized boolean activate() {
        if (isActive()) {
            return false;
        }
        circuitBreaker.transitionToForcedOpenState();
        activatedAt = clock.millis();
        trips.increment();
        log.warn("Circuit breaker activated - non-critical requests will be rejected");
        return true;
    }

    /**
     * 关闭熔断
     *
     * @return 未打开时返回 false
     */
    public synchronized boolean deactivate() {
        if (!isActive()) {
            return false;
        }
        circuitBreaker.transitionToClosedState();
        log.info("Circuit breaker deactivated after {}s", String.format("%.1f", activeSeconds()));
        activatedAt = 0L;
        return true;
    }

    public boolean isActive() {
        return circuitBreaker.getState() == CircuitBreaker.State.FORCED_OPEN;
    }

    public double activeSeconds() {
        long since = activatedAt;
        return isActive() && since > 0 ? (clock.millis() - since) / 1000.0 : 0.0;
    }

    public long activatedAt() {
        return activatedAt;
    }

    public long trips() {
        return trips.sum();
    }

    public String state() {
        return circuitBreaker.getState().name();
    }
}
