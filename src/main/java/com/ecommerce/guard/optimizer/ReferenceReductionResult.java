package com.ecommerce.guard.optimizer;

/**
 * 引用图分析工具探测结果
 */
public record ReferenceReductionResult(boolean available, String tool, String message) {

    public static ReferenceReductionResult unavailable(String message) {
        return new ReferenceReductionResult(false, null, message);
    }
}
