package com.ecommerce.guard.optimizer;

/**
 * 地址空间限制结果
 */
public record MemoryLimitResult(boolean success, long limitMb, String message) {

    public static MemoryLimitResult ok(long limitMb, String message) {
        return new MemoryLimitResult(true, limitMb, message);
    }

    public static MemoryLimitResult failure(long limitMb, String message) {
        return new MemoryLimitResult(false, limitMb, message);
    }
}
