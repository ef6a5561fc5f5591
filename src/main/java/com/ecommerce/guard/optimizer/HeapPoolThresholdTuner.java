package com.ecommerce.guard.optimizer;

import com.ecommerce.guard.config.GuardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.ListenerNotFoundException;
import javax.management.Notification;
import javax.management.NotificationEmitter;
import javax.management.NotificationListener;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryNotificationInfo;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.util.List;
import java.util.Locale;

/**
 * 回收阈值调优
 * <p>
 * 物理内存越大，阈值越高，回收越不频繁。计算结果安装为堆内存池的使用阈值，
 * 不支持使用阈值的池（如 G1 Eden）退而使用回收后使用阈值。
 */
public class HeapPoolThresholdTuner {

    private static final Logger log = LoggerFactory.getLogger(HeapPoolThresholdTuner.class);

    private final List<MemoryPoolMXBean> pools;
    private volatile NotificationListener listener;

    public HeapPoolThresholdTuner() {
        this(ManagementFactory.getMemoryPoolMXBeans());
    }

    HeapPoolThresholdTuner(List<MemoryPoolMXBean> pools) {
        this.pools = pools;
    }

    /**
     * memoryFactor = clamp(totalGb / divisor, min, max)，
     * 各阈值 = (int)(base * memoryFactor * tuneFactor)，再夹在下限与上限之间
     */
    public static CollectorThresholds compute(double totalMemoryGb, GuardProperties.GcConfig gc) {
        double divisor = gc.getMemoryFactorDivisorGb() > 0 ? gc.getMemoryFactorDivisorGb() : 4.0;
        double factor = Math.max(gc.getMemoryFactorMin(), Math.min(gc.getMemoryFactorMax(), totalMemoryGb / divisor));
        GuardProperties.PoolThresholds base = gc.getBaseThresholds();
        GuardProperties.PoolThresholds floors = gc.getThresholdFloors();
        int ceiling = gc.getThresholdCeiling();
        return new CollectorThresholds(
            scale(base.getYoung(), factor, gc.getTuneFactor(), floors.getYoung(), ceiling),
            scale(base.getSurvivor(), factor, gc.getTuneFactor(), floors.getSurvivor(), ceiling),
            scale(base.getTenured(), factor, gc.getTuneFactor(), floors.getTenured(), ceiling),
            factor);
    }

    private static int scale(int base, double factor, double tuneFactor, int floor, int ceiling) {
        int value = (int) (base * factor * tuneFactor);
        int lower = Math.max(1, floor);
        int upper = Math.max(lower, Math.min(99, ceiling));
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * 安装阈值并注册越界回调
     *
     * @return 成功设置阈值的内存池数量
     */
    public synchronized int install(CollectorThresholds thresholds, Runnable onExceeded) {
        int installed = 0;
        for (MemoryPoolMXBean pool : pools) {
            if (pool.getType() != MemoryType.HEAP) {
                continue;
            }
            int percent = percentFor(pool.getName(), thresholds);
            long max = pool.getUsage() != null ? pool.getUsage().getMax() : -1;
            if (percent <= 0 || max <= 0) {
                continue;
            }
            long bytes = max * percent / 100;
            try {
                if (pool.isUsageThresholdSupported()) {
                    pool.setUsageThreshold(bytes);
                    installed++;
                } else if (pool.isCollectionUsageThresholdSupported()) {
                    pool.setCollectionUsageThreshold(bytes);
                    installed++;
                }
                log.debug("Collector threshold installed: pool={}, percent={}%, bytes={}", pool.getName(), percent, bytes);
            } catch (RuntimeException e) {
                log.warn("Failed to install threshold on pool {}: {}", pool.getName(), e.getMessage());
            }
        }
        registerListener(onExceeded);
        log.info("Collector thresholds tuned: young={}%, survivor={}%, tenured={}%, memoryFactor={}, pools={}",
            thresholds.young(), thresholds.survivor(), thresholds.tenured(),
            String.format("%.2f", thresholds.memoryFactor()), installed);
        return installed;
    }

    private void registerListener(Runnable onExceeded) {
        if (onExceeded == null || listener != null) {
            return;
        }
        if (!(ManagementFactory.getMemoryMXBean() instanceof NotificationEmitter emitter)) {
            return;
        }
        NotificationListener l = (Notification notification, Object handback) -> {
            String type = notification.getType();
            if (MemoryNotificationInfo.MEMORY_THRESHOLD_EXCEEDED.equals(type)
                || MemoryNotificationInfo.MEMORY_COLLECTION_THRESHOLD_EXCEEDED.equals(type)) {
                onExceeded.run();
            }
        };
        emitter.addNotificationListener(l, null, null);
        listener = l;
    }

    /**
     * 移除回调并清除阈值
     */
    public synchronized void uninstall() {
        NotificationListener l = listener;
        listener = null;
        if (l != null && ManagementFactory.getMemoryMXBean() instanceof NotificationEmitter emitter) {
            try {
                emitter.removeNotificationListener(l);
            } catch (ListenerNotFoundException e) {
                log.debug("Threshold listener already removed");
            }
        }
        for (MemoryPoolMXBean pool : pools) {
            if (pool.getType() != MemoryType.HEAP) {
                continue;
            }
            if (pool.isUsageThresholdSupported()) {
                pool.setUsageThreshold(0);
            }
            if (pool.isCollectionUsageThresholdSupported()) {
                pool.setCollectionUsageThreshold(0);
            }
        }
    }

    static int percentFor(String poolName, CollectorThresholds thresholds) {
        String name = poolName.toLowerCase(Locale.ROOT);
        if (name.contains("eden") || name.contains("young")) {
            return thresholds.young();
        }
        if (name.contains("survivor")) {
            return thresholds.survivor();
        }
        if (name.contains("old") || name.contains("tenured")) {
            return thresholds.tenured();
        }
        return 0;
    }
}
