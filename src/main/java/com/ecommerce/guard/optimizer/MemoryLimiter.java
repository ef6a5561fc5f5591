package com.ecommerce.guard.optimizer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 进程地址空间上限（Linux prlimit --as）
 * <p>
 * 限制的是虚拟地址空间而非堆，设置过低会导致线程创建或内存映射失败。
 */
@Slf4j
public class MemoryLimiter {

    private static final long COMMAND_TIMEOUT_SECONDS = 5;
    // 换算成字节后不能溢出
    static final long MAX_LIMIT_MB = Long.MAX_VALUE >> 20;

    /**
     * 外部命令执行器
     */
    @FunctionalInterface
    public interface CommandRunner {
        CommandOutput run(List<String> command) throws IOException, InterruptedException;
    }

    public record CommandOutput(int exitCode, String output) {
    }

    private final String osName;
    private final long pid;
    private final CommandRunner runner;

    public MemoryLimiter() {
        this(System.getProperty("os.name", ""), ProcessHandle.current().pid(), MemoryLimiter::runProcess);
    }

    public MemoryLimiter(String osName, long pid, CommandRunner runner) {
        this.osName = osName;
        this.pid = pid;
        this.runner = runner;
    }

    public boolean isSupported() {
        return osName != null && osName.toLowerCase(Locale.ROOT).contains("linux");
    }

    public MemoryLimitResult apply(long limitMb) {
        if (limitMb <= 0) {
            return MemoryLimitResult.failure(limitMb, "Memory limit must be positive");
        }
        if (limitMb > MAX_LIMIT_MB) {
            return MemoryLimitResult.failure(limitMb, "Memory limit too large, at most " + MAX_LIMIT_MB + "MB");
        }
        if (!isSupported()) {
            return MemoryLimitResult.failure(limitMb, "Address-space limiting is not supported on " + osName);
        }
        long bytes = limitMb * 1024L * 1024L;
        List<String> command = List.of("prlimit", "--pid", String.valueOf(pid), "--as=" + bytes);
        try {
            CommandOutput out = runner.run(command);
            if (out.exitCode() != 0) {
                log.warn("prlimit exited with {}: {}", out.exitCode(), out.output());
                return MemoryLimitResult.failure(limitMb, "prlimit failed: " + out.output());
            }
            log.info("Address-space limit set to {}MB for pid {}", limitMb, pid);
            return MemoryLimitResult.ok(limitMb, "Memory limit set to " + limitMb + "MB");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return MemoryLimitResult.failure(limitMb, "Interrupted while setting memory limit");
        } catch (IOException e) {
            log.warn("Failed to run prlimit: {}", e.getMessage());
            return MemoryLimitResult.failure(limitMb, "prlimit not available: " + e.getMessage());
        }
    }

    private static CommandOutput runProcess(List<String> command) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            return new CommandOutput(-1, "timed out");
        }
        try (InputStream in = process.getInputStream()) {
            return new CommandOutput(process.exitValue(), new String(in.readAllBytes(), StandardCharsets.UTF_8).trim());
        }
    }
}
