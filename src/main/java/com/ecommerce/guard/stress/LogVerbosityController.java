package com.ecommerce.guard.stress;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggerConfiguration;
import org.springframework.boot.logging.LoggingSystem;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 压力期间把显式配置低于 WARN 的日志级别提升到 WARN，恢复时还原
 */
@Slf4j
public class LogVerbosityController {

    private final LoggingSystem loggingSystem;

    // 被调整的 logger 及其原配置级别
    private final Map<String, LogLevel> originalLevels = new LinkedHashMap<>();

    public LogVerbosityController(LoggingSystem loggingSystem) {
        this.loggingSystem = loggingSystem;
    }

    public synchronized boolean reduce() {
        if (loggingSystem == null) {
            return false;
        }
        try {
            for (LoggerConfiguration config : loggingSystem.getLoggerConfigurations()) {
                LogLevel configured = config.getConfiguredLevel();
                if (configured == null || configured.ordinal() >= LogLevel.WARN.ordinal()) {
                    continue;
                }
                originalLevels.putIfAbsent(config.getName(), configured);
                loggingSystem.setLogLevel(config.getName(), LogLevel.WARN);
            }
            log.warn("Logging verbosity reduced to WARN for {} loggers", originalLevels.size());
            return true;
        } catch (RuntimeException e) {
            log.error("Error reducing logging verbosity", e);
            return false;
        }
    }

    public synchronized boolean restore() {
        if (loggingSystem == null || originalLevels.isEmpty()) {
            return false;
        }
        try {
            originalLevels.forEach(loggingSystem::setLogLevel);
            log.info("Logging verbosity restored for {} loggers", originalLevels.size());
            originalLevels.clear();
            return true;
        } catch (RuntimeException e) {
            log.error("Error restoring logging verbosity", e);
            return false;
        }
    }

    public synchronized boolean isReduced() {
        return !originalLevels.isEmpty();
    }
}
