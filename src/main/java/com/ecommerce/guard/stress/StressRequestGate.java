package com.ecommerce.guard.stress;

import org.springframework.util.AntPathMatcher;

import java.util.List;

/**
 * 请求闸门
 * <p>
 * NORMAL 状态下不做任何检查；压力状态下关键接口直接放行，
 * 熔断打开时拒绝（503），限流开启且无许可时拒绝（429）。
 */
public class StressRequestGate {

    private final StressHandler stressHandler;
    private final List<String> criticalEndpoints;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public StressRequestGate(StressHandler stressHandler, List<String> criticalEndpoints) {
        this.stressHandler = stressHandler;
        this.criticalEndpoints = criticalEndpoints != null ? List.copyOf(criticalEndpoints) : List.of();
    }

    /**
     * @param path        应用内请求路径
     * @param handlerName 处理方法名，可为 null
     */
    public GateDecision evaluate(String path, String handlerName) {
        if (!stressHandler.currentState().isStressed()) {
            return GateDecision.allow();
        }
        if (isCritical(path, handlerName)) {
            return GateDecision.allow();
        }
        if (stressHandler.circuitBreaker().isActive()) {
            stressHandler.recordRejection();
            return GateDecision.circuitOpen();
        }
        if (!stressHandler.throttler().tryAcquire()) {
            stressHandler.recordRejection();
            return GateDecision.throttled();
        }
        return GateDecision.allow();
    }

    public boolean isCritical(String path, String handlerName) {
        for (String pattern : criticalEndpoints) {
            if (handlerName != null && pattern.equals(handlerName)) {
                return true;
            }
            if (path != null && (pattern.equals(path) || (matcher.isPattern(pattern) && matcher.match(pattern, path)))) {
                return true;
            }
        }
        return false;
    }
}
