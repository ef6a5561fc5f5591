package com.ecommerce.guard.optimizer;

/**
 * 可被内存优化器清空的缓存
 * <p>
 * 实现为 Spring Bean 或通过 {@link CacheSweeper#register} 注册后，压力处理时会被清空。
 */
public interface Clearable {

    void clear();

    /**
     * 当前占用字节数估算，未知时返回 0
     */
    default long estimatedBytes() {
        return 0L;
    }
}
