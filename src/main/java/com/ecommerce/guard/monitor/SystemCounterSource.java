package com.ecommerce.guard.monitor;

import java.io.IOException;

/**
 * 操作系统/进程计数器来源
 */
public interface SystemCounterSource {

    /**
     * 读取硬件信息
     *
     * @param diskPath 统计磁盘容量的路径
     */
    SystemInfo readSystemInfo(String diskPath) throws IOException;

    /**
     * 读取当前计数器
     */
    RawCounters readCounters() throws IOException;

    /**
     * 读取进程常驻内存（字节）
     */
    long readProcessMemoryBytes() throws IOException;
}
