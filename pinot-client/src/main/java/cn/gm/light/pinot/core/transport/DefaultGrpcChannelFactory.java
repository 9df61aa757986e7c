package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.core.config.GrpcConfig;
import cn.gm.light.pinot.core.config.GrpcTlsConfig;
import cn.gm.light.pinot.exception.ConfigurationException;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.TlsChannelCredentials;
import io.grpc.netty.shaded.io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;

/**
 * 明文或 TLS channel。TLS 仅在 {@link GrpcTlsConfig#isEnabled()} 时启用。
 */
@Slf4j
public class DefaultGrpcChannelFactory implements GrpcChannelFactory {

    @Override
    public ManagedChannel create(String target, GrpcConfig config) {
        GrpcTlsConfig tls = config.getTlsConfig();
        ChannelCredentials credentials = buildCredentials(tls);
        ManagedChannelBuilder<?> builder;
        try {
            builder = Grpc.newChannelBuilder(target, credentials);
        } catch (RuntimeException e) {
            // CA 证书内容在这里才被解析
            throw new ConfigurationException("failed to create grpc channel to " + target + ": " + e.getMessage(), e);
        }
        if (tls != null && tls.isEnabled() && tls.getServerName() != null && !tls.getServerName().isEmpty()) {
            builder.overrideAuthority(tls.getServerName());
        }
        return builder.build();
    }

    static ChannelCredentials buildCredentials(GrpcTlsConfig tls) {
        if (tls == null || !tls.isEnabled()) {
            return InsecureChannelCredentials.create();
        }
        TlsChannelCredentials.Builder builder = TlsChannelCredentials.newBuilder();
        if (tls.isInsecureSkipVerify()) {
            log.warn("grpc TLS certificate verification is disabled");
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE.getTrustManagers());
        } else if (tls.getCaCertPath() != null && !tls.getCaCertPath().isEmpty()) {
            try {
                builder.trustManager(new File(tls.getCaCertPath()));
            } catch (IOException e) {
                throw new ConfigurationException("failed to read grpc CA cert: " + tls.getCaCertPath(), e);
            }
        }
        return builder.build();
    }
}
