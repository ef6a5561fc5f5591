package com.ecommerce.guard.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 周期任务 - 单守护线程驱动的后台节拍器
 * <p>
 * 每次执行后按 {@code nextDelayMillis} 重新计算下一次延迟，支持自适应间隔。
 * 单次执行的异常只记录日志，不会终止节拍。停止为协作式：
 * 置位取消标志后最多等待 {@link #JOIN_TIMEOUT_MILLIS} 毫秒，不保证同步完成。
 */
public class PeriodicTicker {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTicker.class);

    static final long JOIN_TIMEOUT_MILLIS = 2000;

    private final String name;
    private final Runnable body;
    private final LongSupplier nextDelayMillis;

    private volatile boolean running;
    private volatile ScheduledExecutorService executor;

    public PeriodicTicker(String name, Runnable body, LongSupplier nextDelayMillis) {
        this.name = name;
        this.body = body;
        this.nextDelayMillis = nextDelayMillis;
    }

    /**
     * 启动节拍，首次执行立即进行
     *
     * @return 已经在运行时返回 false
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        executor.execute(this::tick);
        return true;
    }

    /**
     * 停止节拍
     *
     * @return 本来就未运行时返回 false
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        ScheduledExecutorService current = executor;
        executor = null;
        current.shutdownNow();
        try {
            if (!current.awaitTermination(JOIN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Ticker {} did not terminate within {}ms", name, JOIN_TIMEOUT_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public String getName() {
        return name;
    }

    private void tick() {
        if (!running) {
            return;
        }
        try {
            body.run();
        } catch (Exception e) {
            log.error("Ticker {} iteration failed", name, e);
        }
        scheduleNext();
    }

    private void scheduleNext() {
        ScheduledExecutorService current = executor;
        if (!running || current == null || current.isShutdown()) {
            return;
        }
        long delay;
        try {
            delay = Math.max(1L, nextDelayMillis.getAsLong());
        } catch (Exception e) {
            log.error("Ticker {} failed to compute next delay", name, e);
            delay = 1000L;
        }
        try {
            current.schedule(this::tick, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Ticker {} stopped while scheduling next run", name);
        }
    }

    /**
     * 秒转毫秒，非正数按 1 秒处理
     */
    public static long secondsToMillis(double seconds) {
        if (seconds <= 0) {
            return 1000L;
        }
        return Math.max(1L, (long) (seconds * 1000));
    }
}
