package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.core.config.GrpcConfig;
import io.grpc.ManagedChannel;

/**
 * 每次查询创建一个新 channel，调用方负责关闭。
 */
@FunctionalInterface
public interface GrpcChannelFactory {

    ManagedChannel create(String target, GrpcConfig config);
}
