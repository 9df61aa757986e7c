package cn.gm.light.pinot.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 创建 {@link cn.gm.light.pinot.Connection} 的配置。
 * broker 来源三选一：静态列表、协调服务、controller；同时配置时 controller 优先，其次静态列表。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/3 09:07:47
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientConfig {
    // 查询请求附加的 HTTP 头
    private Map<String, String> extraHttpHeader;

    // HTTP 调用超时，0 表示不限制
    private long httpTimeoutMs;

    private CoordinatorConfig coordinatorConfig;

    private ControllerConfig controllerConfig;

    private List<String> brokerList;

    // 非空时走 gRPC 流式查询
    private GrpcConfig grpcConfig;
}
