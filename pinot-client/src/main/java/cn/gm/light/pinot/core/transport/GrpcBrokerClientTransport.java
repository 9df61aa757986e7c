package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.core.codec.GrpcResponseDecoder;
import cn.gm.light.pinot.core.config.GrpcConfig;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.Request;
import cn.gm.light.pinot.exception.ConfigurationException;
import cn.gm.light.pinot.exception.TransportException;
import cn.gm.light.pinot.proto.BrokerRequest;
import cn.gm.light.pinot.proto.PinotQueryBrokerGrpc;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * gRPC 流式查询。每次调用新建 channel，结束后关闭；
 * 响应流交给 {@link GrpcResponseDecoder} 逐条解码。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/6 19:05:12
 */
@Slf4j
public class GrpcBrokerClientTransport implements ClientTransport {
    private final GrpcConfig config;
    private final GrpcChannelFactory channelFactory;

    public GrpcBrokerClientTransport(GrpcConfig config) {
        this(config, new DefaultGrpcChannelFactory());
    }

    public GrpcBrokerClientTransport(GrpcConfig config, GrpcChannelFactory channelFactory) {
        if (config == null) {
            throw ConfigurationException.of("grpc config is required");
        }
        this.config = config;
        this.channelFactory = channelFactory;
    }

    @Override
    public BrokerResponse execute(String brokerAddress, Request request) {
        String address = normalizeGrpcAddress(brokerAddress);
        ManagedChannel channel = channelFactory.create(address, config);
        try {
            PinotQueryBrokerGrpc.PinotQueryBrokerBlockingStub stub = PinotQueryBrokerGrpc.newBlockingStub(channel);
            if (config.getTimeoutMs() > 0) {
                stub = stub.withDeadlineAfter(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
            }
            BrokerRequest brokerRequest = BrokerRequest.newBuilder()
                    .setSql(request.getQuery())
                    .putAllMetadata(buildGrpcMetadata(config, request))
                    .build();
            log.debug("Submitting grpc query to {}: {}", address, request.getQuery());
            GrpcResponseDecoder decoder = new GrpcResponseDecoder(config);
            Iterator<cn.gm.light.pinot.proto.BrokerResponse> stream = stub.submit(brokerRequest);
            while (stream.hasNext()) {
                cn.gm.light.pinot.proto.BrokerResponse block = stream.next();
                decoder.onMessage(block.getMetadataMap(), block.getPayload().toByteArray());
            }
            return decoder.finish();
        } catch (StatusRuntimeException e) {
            throw new TransportException("grpc response error: " + e.getStatus(), e);
        } finally {
            channel.shutdownNow();
        }
    }

    static String normalizeGrpcAddress(String address) {
        String trimmed = address;
        if (trimmed.startsWith("grpc://")) {
            trimmed = trimmed.substring("grpc://".length());
        }
        if (trimmed.startsWith("grpcs://")) {
            trimmed = trimmed.substring("grpcs://".length());
        }
        return trimmed;
    }

    /**
     * 额外元数据先放入，内置字段覆盖同名项
     */
    static Map<String, String> buildGrpcMetadata(GrpcConfig config, Request request) {
        Map<String, String> metadata = new HashMap<>();
        if (config.getExtraMetadata() != null) {
            metadata.putAll(config.getExtraMetadata());
        }
        int blockRowSize = config.getBlockRowSize() > 0 ? config.getBlockRowSize() : GrpcConfig.DEFAULT_BLOCK_ROW_SIZE;
        metadata.put("blockRowSize", Integer.toString(blockRowSize));
        metadata.put(GrpcResponseDecoder.ENCODING, GrpcResponseDecoder
                .normalizeAlgorithm(config.getEncoding(), null, GrpcConfig.DEFAULT_ENCODING).toUpperCase(Locale.ROOT));
        metadata.put(GrpcResponseDecoder.COMPRESSION, GrpcResponseDecoder
                .normalizeAlgorithm(config.getCompression(), null, GrpcConfig.DEFAULT_COMPRESSION).toUpperCase(Locale.ROOT));
        String queryOptions = QueryOptions.build(request, config.getTimeoutMs());
        if (!queryOptions.isEmpty()) {
            metadata.put("queryOptions", queryOptions);
        }
        if (request.isTrace()) {
            metadata.put("trace", "true");
        }
        return metadata;
    }
}
