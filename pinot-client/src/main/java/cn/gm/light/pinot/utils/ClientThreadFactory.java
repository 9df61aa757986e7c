package cn.gm.light.pinot.utils;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 后台刷新线程工厂，默认守护线程，进程退出不受影响。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/4 19:34:55
 */
@Slf4j
public class ClientThreadFactory implements ThreadFactory {
    private final String threadNamePrefix;
    private final boolean daemon;
    private final AtomicLong threadId = new AtomicLong(0); // 每个工厂独立计数

    public ClientThreadFactory(String poolName) {
        this(poolName, true);
    }

    public ClientThreadFactory(String poolName, boolean daemon) {
        this.threadNamePrefix = poolName + "-thread";
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, threadNamePrefix + "-" + threadId.incrementAndGet());
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler((t, e) ->
                log.error("Thread [{}] in pool [{}] crashed", t.getName(), threadNamePrefix, e));
        return thread;
    }
}
