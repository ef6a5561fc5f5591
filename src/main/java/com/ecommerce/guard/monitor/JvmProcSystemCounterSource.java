package com.ecommerce.guard.monitor;

import com.sun.management.OperatingSystemMXBean;
import com.sun.management.UnixOperatingSystemMXBean;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.RuntimeMXBean;
import java.lang.management.ThreadMXBean;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * 基于 JVM 平台 MXBean 与 Linux /proc 的计数器来源
 * <p>
 * 非 Linux 平台或文件缺失时，相关字段退化为 0 或空列表。
 */
@Slf4j
public class JvmProcSystemCounterSource implements SystemCounterSource {

    private static final int SECTOR_BYTES = 512;

    private final Path procRoot;
    private final Path sysRoot;

    private final OperatingSystemMXBean osBean;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();
    private final RuntimeMXBean runtimeBean = ManagementFactory.getRuntimeMXBean();

    // 每核 CPU 的上一次 jiffies，用于差分
    private long[][] previousCoreTicks;

    public JvmProcSystemCounterSource() {
        this(Path.of("/proc"), Path.of("/sys"));
    }

    JvmProcSystemCounterSource(Path procRoot, Path sysRoot) {
        this.procRoot = procRoot;
        this.sysRoot = sysRoot;
        this.osBean = (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public SystemInfo readSystemInfo(String diskPath) throws IOException {
        Path disk = Path.of(diskPath == null || diskPath.isBlank() ? System.getProperty("user.dir") : diskPath);
        FileStore store = Files.getFileStore(disk);
        long memTotal = osBean.getTotalMemorySize();
        long memAvailable = readMemAvailable().orElse(osBean.getFreeMemorySize());

        return SystemInfo.builder()
            .hostname(hostname())
            .osName(System.getProperty("os.name", ""))
            .osRelease(System.getProperty("os.version", ""))
            .architecture(System.getProperty("os.arch", ""))
            .jvmVersion(System.getProperty("java.version", ""))
            .processId(ProcessHandle.current().pid())
            .cpuCountLogical(Runtime.getRuntime().availableProcessors())
            .cpuCountPhysical(physicalCores())
            .cpuFrequencyMhz(currentFrequencyMhz())
            .cpuFrequencyMaxMhz(maxFrequencyMhz())
            .totalMemoryBytes(memTotal)
            .availableMemoryBytes(memAvailable)
            .swapTotalBytes(osBean.getTotalSwapSpaceSize())
            .swapAvailableBytes(osBean.getFreeSwapSpaceSize())
            .diskPath(disk.toString())
            .diskTotalBytes(store.getTotalSpace())
            .diskAvailableBytes(store.getUsableSpace())
            .networkInterfaces(interfaceNames())
            .updatedAt(System.currentTimeMillis())
            .build();
    }

    @Override
    public synchronized RawCounters readCounters() throws IOException {
        long memTotal = osBean.getTotalMemorySize();
        long memAvailable = readMemAvailable().orElse(osBean.getFreeMemorySize());
        long swapTotal = osBean.getTotalSwapSpaceSize();
        long[] disk = readDiskCounters();
        long[] net = readNetCounters();
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();

        return RawCounters.builder()
            .cpuPercent(toPercent(osBean.getCpuLoad()))
            .cpuPercentPerCore(readPerCorePercent())
            .loadAverages(readLoadAverages())
            .memoryTotalBytes(memTotal)
            .memoryAvailableBytes(memAvailable)
            .memoryUsedBytes(Math.max(0, memTotal - memAvailable))
            .swapTotalBytes(swapTotal)
            .swapUsedBytes(Math.max(0, swapTotal - osBean.getFreeSwapSpaceSize()))
            .diskReadCount(disk[0])
            .diskReadBytes(disk[1])
            .diskWriteCount(disk[2])
            .diskWriteBytes(disk[3])
            .netBytesRecv(net[0])
            .netPacketsRecv(net[1])
            .netBytesSent(net[2])
            .netPacketsSent(net[3])
            .processMemoryBytes(readProcessMemoryBytes())
            .processCpuPercent(toPercent(osBean.getProcessCpuLoad()))
            .processThreads(threadBean.getThreadCount())
            .processOpenFiles(openFiles())
            .heapUsedBytes(heap.getUsed())
            .heapMaxBytes(heap.getMax())
            .systemUptimeSeconds(readSystemUptime())
            .processUptimeSeconds(runtimeBean.getUptime() / 1000.0)
            .build();
    }

    @Override
    public long readProcessMemoryBytes() throws IOException {
        Path status = procRoot.resolve("self").resolve("status");
        if (Files.isReadable(status)) {
            for (String line : Files.readAllLines(status, StandardCharsets.UTF_8)) {
                if (line.startsWith("VmRSS:")) {
                    return parseKb(line);
                }
            }
        }
        // 无 /proc 时用堆 + 非堆近似
        return memoryBean.getHeapMemoryUsage().getUsed() + memoryBean.getNonHeapMemoryUsage().getUsed();
    }

    // ========== /proc 解析 ==========

    OptionalLong readMemAvailable() throws IOException {
        Path meminfo = procRoot.resolve("meminfo");
        if (!Files.isReadable(meminfo)) {
            return OptionalLong.empty();
        }
        for (String line : Files.readAllLines(meminfo, StandardCharsets.UTF_8)) {
            if (line.startsWith("MemAvailable:")) {
                return OptionalLong.of(parseKb(line));
            }
        }
        return OptionalLong.empty();
    }

    /**
     * 读取整盘（不含分区、loop、ram 设备）的累计计数
     *
     * @return [读次数, 读字节, 写次数, 写字节]
     */
    long[] readDiskCounters() throws IOException {
        long[] result = new long[4];
        Path diskstats = procRoot.resolve("diskstats");
        if (!Files.isReadable(diskstats)) {
            return result;
        }
        for (String line : Files.readAllLines(diskstats, StandardCharsets.UTF_8)) {
            String[] f = line.trim().split("\\s+");
            if (f.length < 10) {
                continue;
            }
            String device = f[2];
            if (device.startsWith("loop") || device.startsWith("ram") || !isWholeDisk(device)) {
                continue;
            }
            result[0] += Long.parseLong(f[3]);
            result[1] += Long.parseLong(f[5]) * SECTOR_BYTES;
            result[2] += Long.parseLong(f[7]);
            result[3] += Long.parseLong(f[9]) * SECTOR_BYTES;
        }
        return result;
    }

    private boolean isWholeDisk(String device) {
        Path block = sysRoot.resolve("block");
        // 没有 /sys/block 时无法区分分区，全部计入
        return !Files.isDirectory(block) || Files.exists(block.resolve(device));
    }

    /**
     * 读取所有网卡的累计计数
     *
     * @return [接收字节, 接收包数, 发送字节, 发送包数]
     */
    long[] readNetCounters() throws IOException {
        long[] result = new long[4];
        Path netDev = procRoot.resolve("net").resolve("dev");
        if (!Files.isReadable(netDev)) {
            return result;
        }
        for (String line : Files.readAllLines(netDev, StandardCharsets.UTF_8)) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String[] f = line.substring(colon + 1).trim().split("\\s+");
            if (f.length < 10) {
                continue;
            }
            result[0] += Long.parseLong(f[0]);
            result[1] += Long.parseLong(f[1]);
            result[2] += Long.parseLong(f[8]);
            result[3] += Long.parseLong(f[9]);
        }
        return result;
    }

    List<Double> readPerCorePercent() throws IOException {
        Path stat = procRoot.resolve("stat");
        if (!Files.isReadable(stat)) {
            return Collections.emptyList();
        }
        List<long[]> cores = new ArrayList<>();
        for (String line : Files.readAllLines(stat, StandardCharsets.UTF_8)) {
            if (line.startsWith("cpu") && line.length() > 3 && Character.isDigit(line.charAt(3))) {
                String[] f = line.trim().split("\\s+");
                long total = 0;
                for (int i = 1; i < f.length; i++) {
                    total += Long.parseLong(f[i]);
                }
                // idle + iowait
                long idle = Long.parseLong(f[4]) + (f.length > 5 ? Long.parseLong(f[5]) : 0);
                cores.add(new long[]{total, idle});
            }
        }
        List<Double> percents = new ArrayList<>(cores.size());
        for (int i = 0; i < cores.size(); i++) {
            long[] now = cores.get(i);
            long[] prev = previousCoreTicks != null && i < previousCoreTicks.length ? previousCoreTicks[i] : null;
            if (prev == null || now[0] <= prev[0]) {
                percents.add(0.0);
                continue;
            }
            double totalDelta = now[0] - prev[0];
            double idleDelta = Math.max(0, now[1] - prev[1]);
            percents.add(Math.max(0.0, Math.min(100.0, (totalDelta - idleDelta) * 100.0 / totalDelta)));
        }
        previousCoreTicks = cores.toArray(new long[0][]);
        return percents;
    }

    List<Double> readLoadAverages() throws IOException {
        Path loadavg = procRoot.resolve("loadavg");
        if (Files.isReadable(loadavg)) {
            String[] f = Files.readString(loadavg, StandardCharsets.UTF_8).trim().split("\\s+");
            if (f.length >= 3) {
                return List.of(Double.parseDouble(f[0]), Double.parseDouble(f[1]), Double.parseDouble(f[2]));
            }
        }
        double one = osBean.getSystemLoadAverage();
        return one < 0 ? Collections.emptyList() : List.of(one);
    }

    double readSystemUptime() throws IOException {
        Path uptime = procRoot.resolve("uptime");
        if (Files.isReadable(uptime)) {
            String[] f = Files.readString(uptime, StandardCharsets.UTF_8).trim().split("\\s+");
            return Double.parseDouble(f[0]);
        }
        return runtimeBean.getUptime() / 1000.0;
    }

    int physicalCores() throws IOException {
        Path cpuinfo = procRoot.resolve("cpuinfo");
        int logical = Runtime.getRuntime().availableProcessors();
        if (!Files.isReadable(cpuinfo)) {
            return logical;
        }
        Set<String> cores = new HashSet<>();
        String physicalId = "0";
        for (String line : Files.readAllLines(cpuinfo, StandardCharsets.UTF_8)) {
            if (line.startsWith("physical id")) {
                physicalId = valueOf(line);
            } else if (line.startsWith("core id")) {
                cores.add(physicalId + ":" + valueOf(line));
            }
        }
        return cores.isEmpty() ? logical : cores.size();
    }

    private double currentFrequencyMhz() throws IOException {
        Path cpuinfo = procRoot.resolve("cpuinfo");
        if (!Files.isReadable(cpuinfo)) {
            return 0.0;
        }
        double sum = 0;
        int count = 0;
        for (String line : Files.readAllLines(cpuinfo, StandardCharsets.UTF_8)) {
            if (line.startsWith("cpu MHz")) {
                sum += Double.parseDouble(valueOf(line));
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private double maxFrequencyMhz() throws IOException {
        Path maxFreq = sysRoot.resolve("devices/system/cpu/cpu0/cpufreq/cpuinfo_max_freq");
        if (!Files.isReadable(maxFreq)) {
            return 0.0;
        }
        return Long.parseLong(Files.readString(maxFreq, StandardCharsets.UTF_8).trim()) / 1000.0;
    }

    // ========== JVM / 网络 ==========

    private long openFiles() {
        if (osBean instanceof UnixOperatingSystemMXBean) {
            return ((UnixOperatingSystemMXBean) osBean).getOpenFileDescriptorCount();
        }
        return 0;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return System.getenv().getOrDefault("HOSTNAME", "unknown");
        }
    }

    private static List<String> interfaceNames() {
        List<String> names = new ArrayList<>();
        try {
            for (NetworkInterface ni : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                names.add(ni.getName());
            }
        } catch (SocketException e) {
            log.warn("Failed to list network interfaces: {}", e.getMessage());
        }
        Collections.sort(names);
        return names;
    }

    private static double toPercent(double load) {
        return load < 0 ? 0.0 : load * 100.0;
    }

    private static long parseKb(String line) {
        String[] f = line.trim().split("\\s+");
        return Long.parseLong(f[1]) * 1024L;
    }

    private static String valueOf(String line) {
        int colon = line.indexOf(':');
        return colon < 0 ? "" : line.substring(colon + 1).trim();
    }
}
