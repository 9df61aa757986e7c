package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.core.config.CoordinatorConfig;
import cn.gm.light.pinot.exception.ConfigurationException;
import cn.gm.light.pinot.exception.SelectionException;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.watch.WatchEvent;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 基于 etcd 的 external view 存储，文档以 key 的形式保存
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/5 10:26:41
 */
@Slf4j
public class EtcdExternalViewStore implements ExternalViewStore {
    private final CoordinatorConfig config;
    private final List<Watch.Watcher> watchers = new CopyOnWriteArrayList<>();
    private volatile Client client;

    public EtcdExternalViewStore(CoordinatorConfig config) {
        this.config = config;
    }

    @Override
    public void connect() {
        if (config.getEndpoints() == null || config.getEndpoints().isEmpty()) {
            throw ConfigurationException.of("no coordinator endpoints configured");
        }
        String[] endpoints = config.getEndpoints().stream()
                .map(EtcdExternalViewStore::toEndpoint)
                .toArray(String[]::new);
        try {
            this.client = Client.builder()
                    .endpoints(endpoints)
                    .connectTimeout(Duration.ofSeconds(sessionTimeoutSec()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid coordinator endpoints: " + config.getEndpoints(), e);
        }
        log.info("Connected to coordinator: {}", config.getEndpoints());
    }

    @Override
    public byte[] read(String path) {
        Client c = requireClient();
        GetResponse resp;
        try {
            resp = c.getKVClient().get(key(path)).get(sessionTimeoutSec(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SelectionException("interrupted while reading external view: " + path, e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to read coordinator: {}, external view path: {}", config.getEndpoints(), path);
            throw new SelectionException("failed to read external view: " + path, e);
        }
        List<KeyValue> kvs = resp.getKvs();
        if (kvs.isEmpty()) {
            throw SelectionException.of("external view not found: " + path);
        }
        return kvs.get(0).getValue().getBytes();
    }

    @Override
    public void watch(String path, Consumer<ExternalViewEvent> listener) {
        Client c = requireClient();
        Watch.Watcher watcher = c.getWatchClient().watch(key(path), Watch.listener(resp -> {
            for (WatchEvent event : resp.getEvents()) {
                switch (event.getEventType()) {
                    case PUT:
                        listener.accept(ExternalViewEvent.dataChanged());
                        break;
                    case DELETE:
                        listener.accept(ExternalViewEvent.deleted());
                        break;
                    default:
                        log.debug("Ignore unrecognized watch event on {}", path);
                }
            }
        }, t -> listener.accept(ExternalViewEvent.error(t))));
        watchers.add(watcher);
    }

    @Override
    public void close() {
        for (Watch.Watcher watcher : watchers) {
            watcher.close();
        }
        watchers.clear();
        Client c = this.client;
        this.client = null;
        if (c != null) {
            c.close();
        }
    }

    private Client requireClient() {
        Client c = this.client;
        if (c == null) {
            throw SelectionException.of("coordinator connection hasn't been initialized");
        }
        return c;
    }

    private long sessionTimeoutSec() {
        return config.getSessionTimeoutSec() > 0
                ? config.getSessionTimeoutSec()
                : CoordinatorConfig.DEFAULT_SESSION_TIMEOUT_SEC;
    }

    private static ByteSequence key(String path) {
        return ByteSequence.from(path, StandardCharsets.UTF_8);
    }

    // jetcd 需要带 scheme 的地址
    static String toEndpoint(String endpoint) {
        if (endpoint.contains("://")) {
            return endpoint;
        }
        return "http://" + endpoint;
    }
}
