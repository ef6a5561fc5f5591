package com.ecommerce.guard.optimizer;

import com.ecommerce.guard.config.GuardProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 回收阈值调优测试
 */
class HeapPoolThresholdTunerTest {

    private final GuardProperties.GcConfig gc = new GuardProperties().getGc();

    @Test
    @DisplayName("大内存主机阈值按上限系数放大")
    void testCompute_largeHost() {
        CollectorThresholds t = HeapPoolThresholdTuner.compute(16.0, gc);

        assertEquals(2.0, t.memoryFactor(), 0.001);
        assertEquals(64, t.young());
        assertEquals(72, t.survivor());
        assertEquals(88, t.tenured());
    }

    @Test
    @DisplayName("小内存主机阈值不低于下限")
    void testCompute_smallHostClampedToFloors() {
        CollectorThresholds t = HeapPoolThresholdTuner.compute(1.0, gc);

        assertEquals(0.5, t.memoryFactor(), 0.001);
        assertEquals(20, t.young());
        assertEquals(20, t.survivor());
        assertEquals(30, t.tenured());
    }

    @Test
    @DisplayName("4GB 主机系数为 1")
    void testCompute_referenceHost() {
        CollectorThresholds t = HeapPoolThresholdTuner.compute(4.0, gc);

        assertEquals(1.0, t.memoryFactor(), 0.001);
        assertEquals(32, t.young());
        assertEquals(36, t.survivor());
        assertEquals(44, t.tenured());
    }

    @Test
    @DisplayName("阈值不超过上限")
    void testCompute_ceiling() {
        gc.setTuneFactor(10.0);

        CollectorThresholds t = HeapPoolThresholdTuner.compute(16.0, gc);

        assertEquals(95, t.young());
        assertEquals(95, t.tenured());
    }

    @Test
    @DisplayName("按内存池名称匹配代")
    void testPercentFor() {
        CollectorThresholds t = new CollectorThresholds(30, 40, 50, 1.0);

        assertEquals(30, HeapPoolThresholdTuner.percentFor("G1 Eden Space", t));
        assertEquals(40, HeapPoolThresholdTuner.percentFor("G1 Survivor Space", t));
        assertEquals(50, HeapPoolThresholdTuner.percentFor("G1 Old Gen", t));
        assertEquals(50, HeapPoolThresholdTuner.percentFor("Tenured Gen", t));
        assertEquals(0, HeapPoolThresholdTuner.percentFor("Metaspace", t));
    }

    @Test
    @DisplayName("安装阈值到堆内存池")
    void testInstall() {
        MemoryPoolMXBean oldGen = pool("G1 Old Gen", MemoryType.HEAP, true);
        MemoryPoolMXBean eden = pool("G1 Eden Space", MemoryType.HEAP, false);
        when(eden.isCollectionUsageThresholdSupported()).thenReturn(true);
        MemoryPoolMXBean metaspace = mock(MemoryPoolMXBean.class);
        when(metaspace.getType()).thenReturn(MemoryType.NON_HEAP);
        HeapPoolThresholdTuner tuner = new HeapPoolThresholdTuner(List.of(oldGen, eden, metaspace));

        int installed = tuner.install(new CollectorThresholds(64, 72, 88, 2.0), null);

        assertEquals(2, installed);
        verify(oldGen).setUsageThreshold(880);
        verify(eden).setCollectionUsageThreshold(640);
        verify(metaspace, never()).setUsageThreshold(anyLong());
    }

    @Test
    @DisplayName("卸载时清除阈值")
    void testUninstall() {
        MemoryPoolMXBean oldGen = pool("G1 Old Gen", MemoryType.HEAP, true);
        HeapPoolThresholdTuner tuner = new HeapPoolThresholdTuner(List.of(oldGen));
        tuner.install(new CollectorThresholds(64, 72, 88, 2.0), null);

        tuner.uninstall();

        verify(oldGen).setUsageThreshold(0);
    }

    private static MemoryPoolMXBean pool(String name, MemoryType type, boolean usageThresholdSupported) {
        MemoryPoolMXBean pool = mock(MemoryPoolMXBean.class);
        when(pool.getName()).thenReturn(name);
        when(pool.getType()).thenReturn(type);
        when(pool.getUsage()).thenReturn(new MemoryUsage(0, 10, 100, 1000));
        when(pool.isUsageThresholdSupported()).thenReturn(usageThresholdSupported);
        return pool;
    }
}
