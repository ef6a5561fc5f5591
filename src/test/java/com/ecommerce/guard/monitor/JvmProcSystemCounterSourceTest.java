package com.ecommerce.guard.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * /proc 解析测试，使用临时目录模拟文件
 */
class JvmProcSystemCounterSourceTest {

    @TempDir
    Path root;

    private Path proc;
    private Path sys;
    private JvmProcSystemCounterSource source;

    @BeforeEach
    void setUp() throws IOException {
        proc = Files.createDirectories(root.resolve("proc"));
        sys = Files.createDirectories(root.resolve("sys"));
        source = new JvmProcSystemCounterSource(proc, sys);
    }

    @Test
    @DisplayName("读取 MemAvailable")
    void testReadMemAvailable() throws IOException {
        Files.writeString(proc.resolve("meminfo"),
            "MemTotal:       16000000 kB\nMemFree:         2000000 kB\nMemAvailable:    8000000 kB\n");

        assertEquals(8_000_000L * 1024, source.readMemAvailable().getAsLong());
    }

    @Test
    @DisplayName("meminfo 缺失时返回空")
    void testReadMemAvailableMissing() throws IOException {
        assertTrue(source.readMemAvailable().isEmpty());
    }

    @Test
    @DisplayName("磁盘计数只统计整盘")
    void testReadDiskCountersWholeDisksOnly() throws IOException {
        Files.createDirectories(sys.resolve("block").resolve("sda"));
        Files.writeString(proc.resolve("diskstats"), String.join("\n",
            "   8       0 sda 100 0 2000 0 50 0 4000 0 0 0 0",
            "   8       1 sda1 90 0 1800 0 40 0 3000 0 0 0 0",
            "   7       0 loop0 5 0 10 0 0 0 0 0 0 0 0"));

        long[] counters = source.readDiskCounters();

        assertEquals(100, counters[0]);
        assertEquals(2000L * 512, counters[1]);
        assertEquals(50, counters[2]);
        assertEquals(4000L * 512, counters[3]);
    }

    @Test
    @DisplayName("网卡计数累加所有接口")
    void testReadNetCounters() throws IOException {
        Files.createDirectories(proc.resolve("net"));
        Files.writeString(proc.resolve("net").resolve("dev"), String.join("\n",
            "Inter-|   Receive                                                |  Transmit",
            " face |bytes    packets errs drop fifo frame compressed multicast|bytes    packets errs drop fifo colls carrier compressed",
            "    lo:    1000      10    0    0    0     0          0         0     1000      10    0    0    0     0       0          0",
            "  eth0:    5000      20    0    0    0     0          0         0     3000      15    0    0    0     0       0          0"));

        long[] counters = source.readNetCounters();

        assertArrayEquals(new long[]{6000, 30, 4000, 25}, counters);
    }

    @Test
    @DisplayName("每核 CPU 首次为 0，之后按 jiffies 差分")
    void testReadPerCorePercent() throws IOException {
        Path stat = proc.resolve("stat");
        Files.writeString(stat, "cpu  200 0 0 800 0 0 0\ncpu0 100 0 0 400 0 0 0\ncpu1 100 0 0 400 0 0 0\n");
        assertEquals(List.of(0.0, 0.0), source.readPerCorePercent());

        Files.writeString(stat, "cpu  300 0 0 900 0 0 0\ncpu0 175 0 0 425 0 0 0\ncpu1 100 0 0 500 0 0 0\n");
        List<Double> percents = source.readPerCorePercent();

        assertEquals(75.0, percents.get(0), 0.001);
        assertEquals(0.0, percents.get(1), 0.001);
    }

    @Test
    @DisplayName("读取负载与运行时长")
    void testLoadAndUptime() throws IOException {
        Files.writeString(proc.resolve("loadavg"), "0.50 1.25 2.00 1/123 4567\n");
        Files.writeString(proc.resolve("uptime"), "12345.67 54321.00\n");

        assertEquals(List.of(0.5, 1.25, 2.0), source.readLoadAverages());
        assertEquals(12345.67, source.readSystemUptime(), 0.001);
    }

    @Test
    @DisplayName("物理核数按 physical id + core id 去重")
    void testPhysicalCores() throws IOException {
        Files.writeString(proc.resolve("cpuinfo"), String.join("\n",
            "processor : 0", "physical id : 0", "core id : 0", "cpu MHz : 2400.000", "",
            "processor : 1", "physical id : 0", "core id : 0", "cpu MHz : 2400.000", "",
            "processor : 2", "physical id : 0", "core id : 1", "cpu MHz : 2400.000", ""));

        assertEquals(2, source.physicalCores());
    }

    @Test
    @DisplayName("进程内存读取 VmRSS")
    void testReadProcessMemory() throws IOException {
        Files.createDirectories(proc.resolve("self"));
        Files.writeString(proc.resolve("self").resolve("status"), "Name:\tjava\nVmRSS:\t  204800 kB\nThreads:\t40\n");

        assertEquals(204800L * 1024, source.readProcessMemoryBytes());
    }

    @Test
    @DisplayName("文件缺失时退化为零值")
    void testMissingFilesDegrade() throws IOException {
        assertArrayEquals(new long[4], source.readDiskCounters());
        assertArrayEquals(new long[4], source.readNetCounters());
        assertTrue(source.readPerCorePercent().isEmpty());
        assertTrue(source.readProcessMemoryBytes() > 0);
    }
}
