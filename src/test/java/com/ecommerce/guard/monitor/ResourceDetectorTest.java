package com.ecommerce.guard.monitor;

import com.ecommerce.guard.config.GuardProperties;
import com.ecommerce.guard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 资源探测器测试
 */
class ResourceDetectorTest {

    private static final long MB = 1024L * 1024L;

    private GuardProperties properties;
    private FakeSystemCounterSource source;
    private MutableClock clock;
    private ResourceDetector detector;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        properties.getMonitoring().setHistorySize(3);
        properties.getMonitoring().setIntervalSeconds(5.0);
        source = new FakeSystemCounterSource();
        clock = new MutableClock(1_700_000_000_000L);
        detector = new ResourceDetector(properties, source, clock);
    }

    @AfterEach
    void tearDown() {
        detector.stopMonitoring();
    }

    @Test
    @DisplayName("构造时加载硬件信息")
    void testHardwareFactsLoaded() {
        SystemInfo info = detector.systemInfo();

        assertEquals("guard-test", info.getHostname());
        assertEquals(FakeSystemCounterSource.TOTAL_MEMORY, info.getTotalMemoryBytes());
        assertEquals(clock.millis(), info.getUpdatedAt());
    }

    @Test
    @DisplayName("硬件信息刷新失败保留原值")
    void testRefreshFailureKeepsPreviousFacts() {
        source.setHostname("changed");
        source.setFailSystemInfo(true);

        SystemInfo info = detector.refreshHardwareFacts();

        assertEquals("guard-test", info.getHostname());
    }

    @Test
    @DisplayName("历史有界，满时淘汰最旧快照")
    void testHistoryBounded() {
        for (int i = 0; i < 5; i++) {
            clock.advanceSeconds(5);
            detector.sampleUsage();
        }

        assertEquals(3, detector.historySize());
        List<ResourceUsage> all = detector.historicalUsage(Duration.ofHours(1));
        assertEquals(3, all.size());
        assertEquals(clock.millis() - 10_000, all.get(0).getTimestamp());
        assertEquals(clock.millis(), all.get(2).getTimestamp());
    }

    @Test
    @DisplayName("首次采样速率为 0，之后按时间差计算")
    void testRateComputation() {
        source.addNetwork(1000 * MB, 1000 * MB);
        ResourceUsage first = detector.sampleUsage();
        assertTrue(first.hasZeroRates());

        source.addNetwork(10 * MB, 4 * MB);
        source.addDiskRead(2 * MB);
        clock.advanceSeconds(2);
        ResourceUsage second = detector.sampleUsage();

        assertEquals(5.0 * MB, second.getNetSentBytesPerSec(), 0.001);
        assertEquals(2.0 * MB, second.getNetRecvBytesPerSec(), 0.001);
        assertEquals(1.0 * MB, second.getDiskReadBytesPerSec(), 0.001);
        assertEquals(7.0, second.getNetworkMegabytesPerSec(), 0.001);
    }

    @Test
    @DisplayName("计数器回绕或时间差为 0 时速率为 0")
    void testRateGuards() {
        assertEquals(0.0, ResourceDetector.rate(-100, 1.0));
        assertEquals(0.0, ResourceDetector.rate(100, 0.0));
        assertEquals(50.0, ResourceDetector.rate(100, 2.0));
    }

    @Test
    @DisplayName("启动监控后首个快照速率为 0")
    void testRatesResetOnStart() throws InterruptedException {
        detector.sampleUsage();
        clock.advanceSeconds(5);
        source.addNetwork(50 * MB, 50 * MB);

        assertTrue(detector.startMonitoring(3600));
        long deadline = System.currentTimeMillis() + 2000;
        while (detector.historySize() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        detector.stopMonitoring();

        assertEquals(2, detector.historySize());
        assertTrue(detector.latestUsage().hasZeroRates());
    }

    @Test
    @DisplayName("重复启动监控返回 false")
    void testStartMonitoringTwice() {
        assertTrue(detector.startMonitoring(3600));
        assertFalse(detector.startMonitoring(3600));
        assertTrue(detector.isMonitoring());

        assertTrue(detector.stopMonitoring());
        assertFalse(detector.isMonitoring());
        assertFalse(detector.stopMonitoring());
    }

    @Test
    @DisplayName("采样失败返回最近一次有效快照")
    void testSamplingFailureReturnsLastSnapshot() {
        source.setCpuPercent(42.0);
        ResourceUsage good = detector.sampleUsage();

        source.setFailCounters(true);
        clock.advanceSeconds(5);
        ResourceUsage failed = detector.sampleUsage();

        assertSame(good, failed);
        assertEquals(1, detector.historySize());
        assertEquals(1, detector.samplingFailures());
    }

    @Test
    @DisplayName("进程内存读取失败时使用最近采样值")
    void testProcessMemoryFallback() {
        source.setProcessMemoryBytes(300 * MB);
        detector.sampleUsage();
        source.setFailCounters(true);

        assertEquals(300 * MB, detector.processMemoryBytes());
    }

    @Test
    @DisplayName("内存压力按告警阈值判断")
    void testDetectMemoryPressure() {
        source.setMemoryPercent(75.0);
        detector.sampleUsage();

        PressureReading reading = detector.detectMemoryPressure();

        assertTrue(reading.underPressure());
        assertEquals(75.0, reading.value(), 0.01);

        source.setMemoryPercent(60.0);
        detector.sampleUsage();
        assertFalse(detector.detectMemoryPressure().underPressure());
    }

    @Test
    @DisplayName("CPU 压力按压力阈值判断")
    void testDetectCpuPressure() {
        source.setCpuPercent(81.0);
        detector.sampleUsage();
        assertTrue(detector.detectCpuPressure().underPressure());

        source.setCpuPercent(80.0);
        detector.sampleUsage();
        assertFalse(detector.detectCpuPressure().underPressure());
    }

    @Test
    @DisplayName("按时长返回历史后缀")
    void testHistoricalUsageSuffix() {
        properties.getMonitoring().setHistorySize(10);
        detector = new ResourceDetector(properties, source, clock);
        for (int i = 0; i < 10; i++) {
            clock.advanceSeconds(5);
            detector.sampleUsage();
        }

        List<ResourceUsage> recent = detector.historicalUsage(Duration.ofSeconds(20));

        assertEquals(4, recent.size());
        assertEquals(clock.millis(), recent.get(3).getTimestamp());
        assertEquals(10, detector.historicalUsage(Duration.ofHours(1)).size());
        assertTrue(detector.historicalUsage(Duration.ZERO).isEmpty());
    }

    @Test
    @DisplayName("汇总视图包含各分组")
    @SuppressWarnings("unchecked")
    void testSummary() {
        source.setCpuPercent(12.5);
        detector.sampleUsage();

        Map<String, Object> summary = detector.summary();

        assertTrue(summary.keySet().containsAll(List.of("system", "cpu", "memory", "disk", "network", "process")));
        Map<String, Object> cpu = (Map<String, Object>) summary.get("cpu");
        assertEquals(12.5, (Double) cpu.get("percent"), 0.001);
        assertEquals(1, summary.get("historySize"));
    }
}
