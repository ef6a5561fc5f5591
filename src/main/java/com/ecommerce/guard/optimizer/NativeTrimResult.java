package com.ecommerce.guard.optimizer;

/**
 * 本地堆归还结果
 */
public record NativeTrimResult(boolean supported, boolean performed, String output) {

    public static NativeTrimResult unsupported(String reason) {
        return new NativeTrimResult(false, false, reason);
    }
}
