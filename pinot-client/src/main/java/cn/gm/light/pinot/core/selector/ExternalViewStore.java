package cn.gm.light.pinot.core.selector;

import java.util.function.Consumer;

/**
 * 协调服务上 external view 文档的读取与订阅。
 */
public interface ExternalViewStore extends AutoCloseable {

    void connect();

    /**
     * 读取节点内容
     *
     * @throws cn.gm.light.pinot.exception.SelectionException 连接失败或节点不存在
     */
    byte[] read(String path);

    /**
     * 订阅节点变化，回调在协调服务客户端的线程上执行，实现方不应阻塞。
     */
    void watch(String path, Consumer<ExternalViewEvent> listener);

    @Override
    void close();
}
