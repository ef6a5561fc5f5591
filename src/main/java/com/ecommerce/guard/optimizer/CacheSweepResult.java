package com.ecommerce.guard.optimizer;

import java.util.List;

/**
 * 缓存清理结果（尽力而为，不保证覆盖所有缓存）
 *
 * @param cachesCleared      清理的缓存数
 * @param bytesFreedEstimate 按条目数估算的释放字节数
 * @param cleared            已清理的缓存名称
 * @param failures           清理失败的缓存数
 */
public record CacheSweepResult(int cachesCleared, long bytesFreedEstimate, List<String> cleared, int failures) {
}
