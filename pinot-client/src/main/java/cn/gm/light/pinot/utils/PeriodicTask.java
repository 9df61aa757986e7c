package cn.gm.light.pinot.utils;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 固定间隔执行的后台任务。两次执行之间保持固定延迟，避免任务堆积；
 * 单次执行抛出的异常只记录日志，不会终止后续调度。
 */
@Slf4j
public class PeriodicTask {
    private final String name;
    private final Runnable task;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> currentTask;

    public PeriodicTask(String name, Runnable task) {
        this.name = name;
        this.task = task;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ClientThreadFactory(name));
    }

    public synchronized void start(long initialDelayMs, long delayMs) {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        currentTask = scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Periodic task [{}] failed", name, e);
            }
        }, initialDelayMs, delayMs, TimeUnit.MILLISECONDS);
    }

    public void start(long delayMs) {
        this.start(delayMs, delayMs);
    }

    public synchronized void stop() {
        if (currentTask != null) {
            currentTask.cancel(true);
        }
        scheduler.shutdownNow();
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }
}
