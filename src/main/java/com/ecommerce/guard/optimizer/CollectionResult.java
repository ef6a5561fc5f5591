package com.ecommerce.guard.optimizer;

/**
 * 单次回收结果
 * <p>
 * 跳过时只有 reason 与 currentMemoryPercent 有意义，失败时只有 error 有意义。
 */
public record CollectionResult(
    boolean ran,
    long durationMs,
    long itemsReclaimed,
    long bytesReclaimedEstimate,
    boolean wasForced,
    String reason,
    Double currentMemoryPercent,
    String error
) {

    public static CollectionResult completed(long durationMs, long itemsReclaimed, long bytesReclaimed, boolean forced) {
        return new CollectionResult(true, durationMs, itemsReclaimed, bytesReclaimed, forced, null, null, null);
    }

    public static CollectionResult skipped(String reason, double currentMemoryPercent) {
        return new CollectionResult(false, 0, 0, 0, false, reason, currentMemoryPercent, null);
    }

    public static CollectionResult failed(String error, boolean forced) {
        return new CollectionResult(false, 0, 0, 0, forced, null, null, error);
    }
}
