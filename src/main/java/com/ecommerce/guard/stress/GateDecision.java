package com.ecommerce.guard.stress;

/**
 * 请求闸门判定结果
 */
public record GateDecision(boolean allowed, int status, String message) {

    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int TOO_MANY_REQUESTS = 429;

    private static final GateDecision ALLOW = new GateDecision(true, 200, null);

    public static GateDecision allow() {
        return ALLOW;
    }

    public static GateDecision circuitOpen() {
        return new GateDecision(false, SERVICE_UNAVAILABLE, "Service temporarily unavailable due to high load");
    }

    public static GateDecision throttled() {
        return new GateDecision(false, TOO_MANY_REQUESTS, "Too many requests, please retry later");
    }
}
