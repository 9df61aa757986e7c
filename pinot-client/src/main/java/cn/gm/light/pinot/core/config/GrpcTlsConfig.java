package cn.gm.light.pinot.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrpcTlsConfig {
    private boolean enabled;
    // PEM 格式 CA 证书路径，为空时使用系统信任库
    private String caCertPath;
    private String serverName;
    private boolean insecureSkipVerify;
}
