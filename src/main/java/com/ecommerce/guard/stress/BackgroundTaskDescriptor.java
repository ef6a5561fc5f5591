package com.ecommerce.guard.stress;

/**
 * 可暂停的后台任务
 */
public class BackgroundTaskDescriptor {

    private final String name;
    private final Runnable pauseOperation;
    private final Runnable resumeOperation;
    private final boolean critical;
    private volatile boolean paused;

    public BackgroundTaskDescriptor(String name, Runnable pauseOperation, Runnable resumeOperation, boolean critical) {
        this.name = name;
        this.pauseOperation = pauseOperation;
        this.resumeOperation = resumeOperation;
        this.critical = critical;
    }

    public String getName() {
        return name;
    }

    public boolean isCritical() {
        return critical;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * 暂停与恢复操作都提供时才可暂停
     */
    public boolean isPausable() {
        return pauseOperation != null && resumeOperation != null;
    }

    void pause() {
        pauseOperation.run();
        paused = true;
    }

    void resume() {
        try {
            resumeOperation.run();
        } finally {
            paused = false;
        }
    }
}
