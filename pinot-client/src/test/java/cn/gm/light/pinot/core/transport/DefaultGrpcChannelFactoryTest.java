package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.core.config.GrpcConfig;
import cn.gm.light.pinot.core.config.GrpcTlsConfig;
import cn.gm.light.pinot.exception.ConfigurationException;
import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class DefaultGrpcChannelFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    public void testPlaintextByDefault() {
        ChannelCredentials credentials = DefaultGrpcChannelFactory.buildCredentials(null);
        Assertions.assertTrue(credentials instanceof InsecureChannelCredentials);

        GrpcTlsConfig disabled = GrpcTlsConfig.builder().enabled(false).caCertPath("/not/exist.pem").build();
        Assertions.assertTrue(DefaultGrpcChannelFactory.buildCredentials(disabled) instanceof InsecureChannelCredentials);
    }

    @Test
    public void testTlsCredentials() {
        GrpcTlsConfig tls = GrpcTlsConfig.builder().enabled(true).insecureSkipVerify(true).build();
        Assertions.assertTrue(DefaultGrpcChannelFactory.buildCredentials(tls) instanceof TlsChannelCredentials);

        // 未指定 CA 时使用系统信任库
        GrpcTlsConfig system = GrpcTlsConfig.builder().enabled(true).build();
        Assertions.assertTrue(DefaultGrpcChannelFactory.buildCredentials(system) instanceof TlsChannelCredentials);
    }

    @Test
    public void testMissingCaCert() {
        GrpcTlsConfig tls = GrpcTlsConfig.builder()
                .enabled(true)
                .caCertPath(tempDir.resolve("missing.pem").toString())
                .build();
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> DefaultGrpcChannelFactory.buildCredentials(tls));
        Assertions.assertTrue(e.getMessage().startsWith("failed to read grpc CA cert"));
    }

    @Test
    public void testInvalidCaCert() throws IOException {
        Path pem = tempDir.resolve("ca.pem");
        Files.write(pem, "not a certificate".getBytes(StandardCharsets.UTF_8));
        GrpcTlsConfig tls = GrpcTlsConfig.builder().enabled(true).caCertPath(pem.toString()).build();
        GrpcConfig config = GrpcConfig.builder().tlsConfig(tls).build();

        // 证书内容在创建 channel 时解析
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> new DefaultGrpcChannelFactory().create("localhost:8010", config));
        Assertions.assertTrue(e.getMessage().startsWith("failed to create grpc channel to localhost:8010"));
    }

    @Test
    public void testCreatePlaintextChannel() {
        ManagedChannel channel = new DefaultGrpcChannelFactory().create("localhost:8010", new GrpcConfig());
        try {
            Assertions.assertEquals("localhost:8010", channel.authority());
        } finally {
            channel.shutdownNow();
        }
    }
}
