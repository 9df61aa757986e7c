package cn.gm.light.pinot;

import cn.gm.light.pinot.core.config.ClientConfig;
import cn.gm.light.pinot.core.config.ControllerConfig;
import cn.gm.light.pinot.core.config.CoordinatorConfig;
import cn.gm.light.pinot.core.selector.BrokerSelector;
import cn.gm.light.pinot.core.selector.ControllerBasedBrokerSelector;
import cn.gm.light.pinot.core.selector.DynamicBrokerSelector;
import cn.gm.light.pinot.core.selector.SimpleBrokerSelector;
import cn.gm.light.pinot.core.transport.ClientTransport;
import cn.gm.light.pinot.core.transport.GrpcBrokerClientTransport;
import cn.gm.light.pinot.core.transport.JsonHttpClientTransport;
import cn.gm.light.pinot.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 创建 {@link Connection}。
 *
 * <p>broker 来源的优先级：controller &gt; 静态列表 &gt; 协调服务。配置了 grpcConfig 时走 gRPC，否则走 HTTP。
 * 选择器初始化失败直接抛出。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/7 16:40:55
 */
@Slf4j
public final class ConnectionFactory {
    private static final OkHttpClient DEFAULT_CLIENT = new OkHttpClient();

    private ConnectionFactory() {
    }

    public static Connection fromBrokerList(List<String> brokerList) {
        return withConfig(ClientConfig.builder().brokerList(brokerList).build());
    }

    /**
     * @param endpoints    协调服务地址
     * @param pathPrefix   集群根路径前缀
     * @param pinotCluster 集群名，与前缀以 "/" 拼接
     */
    public static Connection fromCoordinator(List<String> endpoints, String pathPrefix, String pinotCluster) {
        CoordinatorConfig coordinatorConfig = CoordinatorConfig.builder()
                .endpoints(endpoints)
                .pathPrefix(pathPrefix + "/" + pinotCluster)
                .sessionTimeoutSec(CoordinatorConfig.DEFAULT_SESSION_TIMEOUT_SEC)
                .build();
        return withConfig(ClientConfig.builder().coordinatorConfig(coordinatorConfig).build());
    }

    public static Connection fromController(String controllerAddress) {
        ControllerConfig controllerConfig = ControllerConfig.builder()
                .controllerAddress(controllerAddress)
                .build();
        return withConfig(ClientConfig.builder().controllerConfig(controllerConfig).build());
    }

    public static Connection withConfig(ClientConfig config) {
        return withConfigAndClient(config, DEFAULT_CLIENT);
    }

    /**
     * 使用调用方提供的 OkHttpClient，查询和 controller 轮询共用。
     * {@link ClientConfig#getHttpTimeoutMs()} 为正时在其基础上派生出带调用超时的客户端。
     */
    public static Connection withConfigAndClient(ClientConfig config, OkHttpClient httpClient) {
        if (config == null) {
            throw ConfigurationException.of("client config is required");
        }
        OkHttpClient client = httpClient;
        if (config.getHttpTimeoutMs() > 0) {
            client = httpClient.newBuilder()
                    .callTimeout(config.getHttpTimeoutMs(), TimeUnit.MILLISECONDS)
                    .build();
        }
        BrokerSelector selector = createBrokerSelector(config, httpClient);
        ClientTransport transport = config.getGrpcConfig() != null
                ? new GrpcBrokerClientTransport(config.getGrpcConfig())
                : new JsonHttpClientTransport(client, config.getExtraHttpHeader());
        selector.init();
        log.info("Created connection with {} and {}", selector.getClass().getSimpleName(),
                transport.getClass().getSimpleName());
        return new Connection(transport, selector);
    }

    static BrokerSelector createBrokerSelector(ClientConfig config, OkHttpClient httpClient) {
        BrokerSelector selector = null;
        if (config.getCoordinatorConfig() != null) {
            selector = new DynamicBrokerSelector(config.getCoordinatorConfig());
        }
        if (config.getBrokerList() != null && !config.getBrokerList().isEmpty()) {
            selector = new SimpleBrokerSelector(config.getBrokerList());
        }
        if (config.getControllerConfig() != null) {
            selector = new ControllerBasedBrokerSelector(config.getControllerConfig(), httpClient);
        }
        if (selector == null) {
            throw ConfigurationException.of(
                    "please specify at least one of Pinot coordinator, Pinot broker or Pinot controller to connect");
        }
        return selector;
    }
}
