package com.ecommerce.guard.stress;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.monitor.ResourceDetector;
import com.ecommerce.guard.monitor.ResourceUsage;
import com.ecommerce.guard.optimizer.MemoryOptimizer;
import com.ecommerce.guard.optimizer.OptimizationLevel;
import com.ecommerce.guard.support.PeriodicTicker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * 压力处理器 - 分级状态机
 * <p>
 * 分数 = max(CPU / CPU 阈值, 内存 / 内存告警阈值, 网络 MB/s / 网络阈值)。
 * 进入或升级到某状态时只执行该状态对应的动作；回到 NORMAL 时撤销所有缓解措施。
 * 持续处于压力状态超过最长时间时执行紧急处理，并重置计时，
 * 同一段压力期内不会每次检查都重复触发。
 * <p>
 * 计数器为近似统计，后台检查线程与查询线程之间不做额外同步。
 */
public class StressHandler {

    private static final Logger log = LoggerFactory.getLogger(StressHandler.class);

    private static final int WINDOW_SIZE = 60;

    private final GuardProperties properties;
    private final ResourceDetector detector;
    private final MemoryOptimizer optimizer;
    private final BackgroundTaskRegistry taskRegistry;
    private final StressCircuitBreaker circuitBreaker;
    private final RequestThrottler throttler;
    private final LogVerbosityController logVerbosity;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Set<StressAction> enabledActions;

    // 状态，只由检查线程写入
    private volatile StressState currentState = StressState.NORMAL;
    private volatile StressScore currentScore = StressScore.ZERO;
    private volatile double maxScore;
    private volatile long stateEnteredAt;
    private volatile long episodeStartedAt;
    private volatile long emergencyWindowStartedAt;
    private volatile long lastStressTime;
    private volatile List<StressAction> lastActions = Collections.emptyList();

    // 累计统计
    private final LongAdder stressEvents = new LongAdder();
    private final LongAdder emergencyEvents = new LongAdder();
    private final LongAdder rejectedRequests = new LongAdder();
    private final LongAdder totalStressMillis = new LongAdder();
    private final Map<StressAction, LongAdder> actionCounts = new EnumMap<>(StressAction.class);

    // 最近的分量窗口
    private final Deque<StressScore> window = new ArrayDeque<>();

    private volatile PeriodicTicker ticker;

    private final Counter stressEventCounter;

    public StressHandler(GuardProperties properties,
                         ResourceDetector detector,
                         MemoryOptimizer optimizer,
                         BackgroundTaskRegistry taskRegistry,
                         StressCircuitBreaker circuitBreaker,
                         RequestThrottler throttler,
                         LogVerbosityController logVerbosity,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.properties = properties != null ? properties : new GuardProperties();
        this.detector = detector;
        this.optimizer = optimizer;
        this.taskRegistry = taskRegistry;
        this.circuitBreaker = circuitBreaker;
        this.throttler = throttler;
        this.logVerbosity = logVerbosity;
        this.meterRegistry = meterRegistry;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.enabledActions = parseActions(this.properties.getStress().getStressActions());
        for (StressAction action : StressAction.values()) {
            actionCounts.put(action, new LongAdder());
        }
        this.stateEnteredAt = this.clock.millis();

        this.stressEventCounter = Counter.builder("guard.stress.events")
            .description("Transitions from NORMAL into a stress state")
            .register(meterRegistry);
        Gauge.builder("guard.stress.score", this, h -> h.currentScore.score())
            .register(meterRegistry);
        Gauge.builder("guard.stress.state", this, h -> h.currentState.ordinal())
            .description("0=NORMAL 1=ELEVATED 2=HIGH 3=CRITICAL")
            .register(meterRegistry);
        Gauge.builder("guard.stress.circuit.active", circuitBreaker, cb -> cb.isActive() ? 1 : 0)
            .register(meterRegistry);

        log.info("StressHandler initialized: cpuThreshold={}%, memoryThreshold={}%, networkThreshold={}MB/s, actions={}",
            this.properties.getStress().getCpuThresholdPercent(),
            this.properties.getThresholds().getWarningPercent(),
            this.properties.getStress().getNetworkThresholdMbs(), enabledActions);
    }

    private static Set<StressAction> parseActions(List<String> names) {
        Set<StressAction> actions = EnumSet.noneOf(StressAction.class);
        if (names == null) {
            return actions;
        }
        for (String name : names) {
            StressAction.fromConfigName(name).ifPresentOrElse(actions::add,
                () -> log.warn("Unknown stress action ignored: {}", name));
        }
        return actions;
    }

    // ========== 分数 ==========

    public StressScore computeScore(ResourceUsage usage) {
        GuardProperties.StressConfig stress = properties.getStress();
        double cpu = StressScore.component(usage.getCpuPercent(), stress.getCpuThresholdPercent());
        double memory = StressScore.component(usage.getMemoryPercent(), properties.getThresholds().getWarningPercent());
        double network = StressScore.component(usage.getNetworkMegabytesPerSec(), stress.getNetworkThresholdMbs());
        return StressScore.of(cpu, memory, network);
    }

    /**
     * 执行一次检查：现场采样计算分数并驱动状态机
     */
    public StressState checkStress() {
        return recordScore(computeScore(detector.sampleUsage()));
    }

    /**
     * 循环内的检查，所属节拍器已停止时丢弃本次分数
     */
    private void monitorTick() {
        PeriodicTicker owner = ticker;
        StressScore score = computeScore(detector.sampleUsage());
        synchronized (this) {
            if (owner == null || !owner.isRunning()) {
                log.debug("Discarding stress score {} from stopped monitor", score.score());
                return;
            }
            recordScore(score);
        }
    }

    private synchronized StressState recordScore(StressScore score) {
        synchronized (window) {
            if (window.size() >= WINDOW_SIZE) {
                window.pollFirst();
            }
            window.addLast(score);
        }
        currentScore = score;
        maxScore = Math.max(maxScore, score.score());
        return handleScore(score.score());
    }

    // ========== 状态机 ==========

    synchronized StressState handleScore(double score) {
        StressState previous = currentState;
        StressState next = StressState.fromScore(score);
        long now = clock.millis();
        currentState = next;

        if (next != previous) {
            stateEnteredAt = now;
            if (next.isStressed()) {
                if (!previous.isStressed()) {
                    episodeStartedAt = now;
                    emergencyWindowStartedAt = now;
                    lastStressTime = now;
                    stressEvents.increment();
                    stressEventCounter.increment();
                    log.warn("Entering stress state: {} (score: {})", next, String.format("%.2f", score));
                    takeStressActions(next);
                } else if (next.isMoreSevereThan(previous)) {
                    log.warn("Stress escalating: {} -> {} (score: {})", previous, next, String.format("%.2f", score));
                    takeStressActions(next);
                } else {
                    lastActions = Collections.emptyList();
                    log.info("Stress de-escalating: {} -> {} (score: {})", previous, next, String.format("%.2f", score));
                }
            } else {
                long duration = now - episodeStartedAt;
                totalStressMillis.add(duration);
                lastActions = Collections.emptyList();
                log.info("Returning to normal state after {}s in stress", String.format("%.1f", duration / 1000.0));
                restoreNormalOperation();
            }
        } else if (next.isStressed()) {
            lastActions = Collections.emptyList();
        }

        if (previous.isStressed() && next.isStressed()) {
            checkMaxStressTime(now);
        }
        return next;
    }

    private void checkMaxStressTime(long now) {
        double maxStress = properties.getStress().getMaxStressTime();
        double elapsed = (now - emergencyWindowStartedAt) / 1000.0;
        if (maxStress > 0 && elapsed > maxStress) {
            log.warn("Maximum stress time exceeded: {}s", String.format("%.1f", elapsed));
            takeEmergencyActions(now);
        }
    }

    /**
     * 计算进入某状态时要执行的动作
     */
    List<StressAction> actionsFor(StressState state) {
        List<StressAction> actions = new ArrayList<>();
        switch (state) {
            case ELEVATED -> {
                addIfEnabled(actions, StressAction.REDUCE_LOGGING);
                // 机会性回收不受配置开关控制
                actions.add(StressAction.COLLECT_GARBAGE);
            }
            case HIGH -> {
                addIfEnabled(actions, StressAction.PAUSE_BACKGROUND);
                addIfEnabled(actions, StressAction.OPTIMIZE_MEMORY);
            }
            case CRITICAL -> {
                addIfEnabled(actions, StressAction.CIRCUIT_BREAK);
                addIfEnabled(actions, StressAction.THROTTLE_REQUESTS);
                for (StressAction action : enabledActions) {
                    if (!actions.contains(action)) {
                        actions.add(action);
                    }
                }
            }
            default -> {
            }
        }
        return actions;
    }

    private void addIfEnabled(List<StressAction> actions, StressAction action) {
        if (enabledActions.contains(action)) {
            actions.add(action);
        }
    }

    private void takeStressActions(StressState state) {
        List<StressAction> actions = actionsFor(state);
        for (StressAction action : actions) {
            try {
                Object result = execute(action);
                actionCounts.get(action).increment();
                Counter.builder("guard.stress.actions")
                    .tag("action", action.configName())
                    .register(meterRegistry)
                    .increment();
                log.info("Stress action taken: {} - result: {}", action.configName(), result);
            } catch (Exception e) {
                log.error("Error executing stress action {}", action.configName(), e);
            }
        }
        lastActions = List.copyOf(actions);
    }

    private Object execute(StressAction action) {
        return switch (action) {
            case REDUCE_LOGGING -> logVerbosity.reduce();
            case COLLECT_GARBAGE -> optimizer.runCollection(false).ran();
            case PAUSE_BACKGROUND -> taskRegistry.pauseAll();
            case OPTIMIZE_MEMORY -> optimizer.optimize(OptimizationLevel.NORMAL).savedMb() > 0;
            case CIRCUIT_BREAK -> circuitBreaker.activate();
            case THROTTLE_REQUESTS -> throttler.enable();
        };
    }

    private void takeEmergencyActions(long now) {
        log.warn("Taking emergency actions due to prolonged stress");
        emergencyEvents.increment();
        try {
            optimizer.optimize(OptimizationLevel.AGGRESSIVE);
        } catch (Exception e) {
            log.error("Emergency optimization failed", e);
        }
        circuitBreaker.activate();
        emergencyWindowStartedAt = now;
    }

    private void restoreNormalOperation() {
        circuitBreaker.deactivate();
        throttler.disable();
        if (taskRegistry.anyPaused()) {
            taskRegistry.resumeAll();
        }
        logVerbosity.restore();
    }

    // ========== 后台检查 ==========

    /**
     * 启动检查循环，间隔随状态自适应
     */
    public synchronized boolean startMonitoring() {
        if (ticker != null && ticker.isRunning()) {
            log.warn("Stress monitoring already running");
            return false;
        }
        ticker = new PeriodicTicker("stress-handler", this::monitorTick, this::nextCheckDelayMillis);
        ticker.start();
        log.info("Stress monitoring started");
        return true;
    }

    /**
     * 停止检查循环，仍处于压力状态时撤销缓解措施
     * <p>
     * 等待节拍线程结束期间不持有处理器锁。
     */
    public boolean stopMonitoring() {
        PeriodicTicker current = ticker;
        if (current == null || !current.stop()) {
            return false;
        }
        synchronized (this) {
            if (currentState.isStressed()) {
                handleScore(0.0);
            }
        }
        log.info("Stress monitoring stopped");
        return true;
    }

    public boolean isMonitoring() {
        PeriodicTicker current = ticker;
        return current != null && current.isRunning();
    }

    long nextCheckDelayMillis() {
        GuardProperties.StressConfig stress = properties.getStress();
        return PeriodicTicker.secondsToMillis(currentState.isStressed()
            ? stress.getStressCheckInterval() : stress.getNormalCheckInterval());
    }

    // ========== 查询 ==========

    public BackgroundTaskDescriptor registerBackgroundTask(String name, Runnable pause, Runnable resume, boolean critical) {
        return taskRegistry.register(name, pause, resume, critical);
    }

    public StressState currentState() {
        return currentState;
    }

    public StressScore currentScore() {
        return currentScore;
    }

    public List<StressAction> lastActions() {
        return lastActions;
    }

    public StressCircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public RequestThrottler throttler() {
        return throttler;
    }

    public BackgroundTaskRegistry taskRegistry() {
        return taskRegistry;
    }

    void recordRejection() {
        rejectedRequests.increment();
    }

    public long rejectedRequests() {
        return rejectedRequests.sum();
    }

    public Set<StressAction> enabledActions() {
        return Collections.unmodifiableSet(enabledActions);
    }

    public StressMetricsSnapshot stressMetrics() {
        long now = clock.millis();
        StressState state = currentState;
        double inState = (now - stateEnteredAt) / 1000.0;
        double stressDuration = state.isStressed() ? (now - episodeStartedAt) / 1000.0 : 0.0;

        Map<String, Long> actions = new LinkedHashMap<>();
        actionCounts.forEach((action, count) -> actions.put(action.configName(), count.sum()));

        StressMetricsSnapshot.Components average;
        synchronized (window) {
            average = window.isEmpty() ? StressMetricsSnapshot.Components.ZERO
                : new StressMetricsSnapshot.Components(
                    window.stream().mapToDouble(StressScore::cpu).average().orElse(0),
                    window.stream().mapToDouble(StressScore::memory).average().orElse(0),
                    window.stream().mapToDouble(StressScore::network).average().orElse(0));
        }
        StressScore score = currentScore;

        return new StressMetricsSnapshot(
            state,
            score.score(),
            maxScore,
            stressEvents.sum(),
            circuitBreaker.trips(),
            emergencyEvents.sum(),
            totalStressMillis.sum() / 1000.0,
            inState,
            stressDuration,
            state.isStressed() && stressDuration >= properties.getStress().getStressDurationSeconds(),
            lastStressTime,
            circuitBreaker.isActive(),
            throttler.isEnabled(),
            throttler.rejected(),
            taskRegistry.anyPaused(),
            taskRegistry.pausedTaskNames(),
            actions,
            average,
            new StressMetricsSnapshot.Components(score.cpu(), score.memory(), score.network()));
    }

    public long emergencyEvents() {
        return emergencyEvents.sum();
    }
}
