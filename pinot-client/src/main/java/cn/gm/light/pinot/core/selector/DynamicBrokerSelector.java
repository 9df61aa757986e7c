package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.core.config.CoordinatorConfig;
import cn.gm.light.pinot.exception.PinotClientException;
import cn.gm.light.pinot.exception.SelectionException;
import cn.gm.light.pinot.utils.ClientThreadFactory;
import com.alibaba.fastjson2.JSONException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 订阅协调服务上的 external view，变化时刷新 表 -> broker 映射。
 *
 * <p>watch 回调只把事件放进队列，由单独的后台线程消费，刷新失败记录日志后继续等待下一个事件。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/5 14:40:09
 */
@Slf4j
public class DynamicBrokerSelector extends TableAwareBrokerSelector {
    public static final String BROKER_EXTERNAL_VIEW_PATH = "EXTERNALVIEW/brokerResource";

    private final CoordinatorConfig config;
    private final ExternalViewStore store;
    private final String externalViewPath;
    private final BlockingQueue<ExternalViewEvent> events = new LinkedBlockingQueue<>();
    private volatile boolean stopped;
    private Thread watcherThread;

    public DynamicBrokerSelector(CoordinatorConfig config) {
        this(config, new EtcdExternalViewStore(config));
    }

    public DynamicBrokerSelector(CoordinatorConfig config, ExternalViewStore store) {
        this.config = config;
        this.store = store;
        this.externalViewPath = config.getPathPrefix() + "/" + BROKER_EXTERNAL_VIEW_PATH;
    }

    @Override
    public void init() {
        try {
            store.connect();
        } catch (PinotClientException e) {
            log.error("Failed to connect to coordinator: {}", config.getEndpoints());
            throw e;
        }
        try {
            refreshExternalView();
            store.watch(externalViewPath, events::offer);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
        watcherThread = new ClientThreadFactory("external-view-watcher").newThread(this::watchLoop);
        watcherThread.start();
        log.info("Dynamic broker selector started, external view path: {}", externalViewPath);
    }

    @Override
    public void stop() {
        stopped = true;
        if (watcherThread != null) {
            watcherThread.interrupt();
        }
        store.close();
        log.info("Dynamic broker selector stopped");
    }

    void refreshExternalView() {
        byte[] node = store.read(externalViewPath);
        ExternalView ev;
        try {
            ev = ExternalView.parse(node);
        } catch (JSONException e) {
            throw new SelectionException("failed to decode external view: " + externalViewPath, e);
        }
        updateBrokerData(ev.tableBrokerMap(), ev.allBrokerList());
    }

    private void watchLoop() {
        while (!stopped) {
            ExternalViewEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            switch (event.getType()) {
                case DATA_CHANGED:
                    try {
                        refreshExternalView();
                    } catch (PinotClientException e) {
                        log.error("Failed to refresh external view: {}", externalViewPath, e);
                    }
                    break;
                case ERROR:
                    log.error("External view watcher error", event.getError());
                    break;
                default:
                    log.warn("External view {} received {}, keep the last known brokers", externalViewPath, event.getType());
            }
        }
    }

    String getExternalViewPath() {
        return externalViewPath;
    }

    boolean isWatcherAlive() {
        return watcherThread != null && watcherThread.isAlive();
    }
}
