package cn.gm.light.pinot.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * gRPC 流式查询配置
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrpcConfig {
    public static final int DEFAULT_BLOCK_ROW_SIZE = 10000;
    public static final String DEFAULT_ENCODING = "JSON";
    public static final String DEFAULT_COMPRESSION = "ZSTD";

    // JSON 或 ARROW
    private String encoding;
    private String compression;
    private int blockRowSize;
    // 调用截止时间，0 表示不限制
    private long timeoutMs;
    private Map<String, String> extraMetadata;
    private GrpcTlsConfig tlsConfig;
}
