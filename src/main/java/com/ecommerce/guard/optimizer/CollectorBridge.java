package com.ecommerce.guard.optimizer;

import java.util.List;
import java.util.Map;

/**
 * 运行时回收器访问接口
 */
public interface CollectorBridge {

    /** 当前堆已用字节数 */
    long heapUsedBytes();

    /** 请求一次完整回收 */
    void collect();

    /** 所有回收器的累计回收次数 */
    long collectionCount();

    /** 所有回收器的累计回收耗时（毫秒） */
    long collectionTimeMillis();

    /** 各回收器的明细（名称、次数、耗时、内存池） */
    List<Map<String, Object>> collectorDetails();

    /** 打开或关闭运行时的 verbose 回收输出 */
    void setVerbose(boolean verbose);
}
