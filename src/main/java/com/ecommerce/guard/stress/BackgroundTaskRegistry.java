package com.ecommerce.guard.stress;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 后台任务注册表
 * <p>
 * 单个任务暂停/恢复失败只记录日志，不影响其余任务。
 */
@Slf4j
public class BackgroundTaskRegistry {

    private final Map<String, BackgroundTaskDescriptor> tasks = new ConcurrentHashMap<>();

    public BackgroundTaskDescriptor register(String name, Runnable pause, Runnable resume, boolean critical) {
        BackgroundTaskDescriptor descriptor = new BackgroundTaskDescriptor(name, pause, resume, critical);
        BackgroundTaskDescriptor previous = tasks.put(name, descriptor);
        if (previous != null && previous.isPaused()) {
            log.warn("Background task {} replaced while paused", name);
        }
        log.info("Background task registered: {} (critical={}, pausable={})", name, critical, descriptor.isPausable());
        return descriptor;
    }

    public boolean unregister(String name) {
        return tasks.remove(name) != null;
    }

    public BackgroundTaskDescriptor get(String name) {
        return tasks.get(name);
    }

    public Collection<BackgroundTaskDescriptor> tasks() {
        return List.copyOf(tasks.values());
    }

    /**
     * 暂停所有可暂停且未暂停的任务，关键标记只用于展示
     *
     * @return 本次暂停的任务数
     */
    public int pauseAll() {
        int paused = 0;
        for (BackgroundTaskDescriptor task : tasks.values()) {
            if (!task.isPausable() || task.isPaused()) {
                continue;
            }
            try {
                task.pause();
                paused++;
                log.info("Background task paused: {}", task.getName());
            } catch (RuntimeException e) {
                log.error("Failed to pause background task {}", task.getName(), e);
            }
        }
        return paused;
    }

    /**
     * 恢复所有已暂停任务，恢复失败的任务同样清除暂停标记
     *
     * @return 成功恢复的任务数
     */
    public int resumeAll() {
        int resumed = 0;
        for (BackgroundTaskDescriptor task : tasks.values()) {
            if (!task.isPaused()) {
                continue;
            }
            try {
                task.resume();
                resumed++;
                log.info("Background task resumed: {}", task.getName());
            } catch (RuntimeException e) {
                log.error("Failed to resume background task {}", task.getName(), e);
            }
        }
        return resumed;
    }

    public boolean anyPaused() {
        return tasks.values().stream().anyMatch(BackgroundTaskDescriptor::isPaused);
    }

    public List<String> pausedTaskNames() {
        List<String> names = new ArrayList<>();
        for (BackgroundTaskDescriptor task : tasks.values()) {
            if (task.isPaused()) {
                names.add(task.getName());
            }
        }
        return names;
    }
}
