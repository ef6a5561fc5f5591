package com.ecommerce.guard.stress;

import java.util.Locale;
import java.util.Optional;

/**
 * 压力动作，配置中使用小写下划线名称
 */
public enum StressAction {

    REDUCE_LOGGING,
    COLLECT_GARBAGE,
    PAUSE_BACKGROUND,
    OPTIMIZE_MEMORY,
    CIRCUIT_BREAK,
    THROTTLE_REQUESTS;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<StressAction> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (StressAction action : values()) {
            if (action.configName().equalsIgnoreCase(name.trim())) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
