package com.ecommerce.guard.optimizer;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 MemoryMXBean / GarbageCollectorMXBean 的实现
 */
public class JvmCollectorBridge implements CollectorBridge {

    private final MemoryMXBean memoryMXBean = ManagementFactory.getMemoryMXBean();
    private final List<GarbageCollectorMXBean> gcBeans = ManagementFactory.getGarbageCollectorMXBeans();

    @Override
    public long heapUsedBytes() {
        return memoryMXBean.getHeapMemoryUsage().getUsed();
    }

    @Override
    public void collect() {
        System.gc();
    }

    @Override
    public long collectionCount() {
        return gcBeans.stream().mapToLong(gc -> Math.max(0, gc.getCollectionCount())).sum();
    }

    @Override
    public long collectionTimeMillis() {
        return gcBeans.stream().mapToLong(gc -> Math.max(0, gc.getCollectionTime())).sum();
    }

    @Override
    public List<Map<String, Object>> collectorDetails() {
        List<Map<String, Object>> details = new ArrayList<>();
        for (GarbageCollectorMXBean gc : gcBeans) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", gc.getName());
            item.put("collections", gc.getCollectionCount());
            item.put("timeMs", gc.getCollectionTime());
            item.put("pools", Arrays.asList(gc.getMemoryPoolNames()));
            details.add(item);
        }
        return details;
    }

    @Override
    public void setVerbose(boolean verbose) {
        memoryMXBean.setVerbose(verbose);
    }
}
