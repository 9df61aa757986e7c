package cn.gm.light.pinot.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 协调服务配置，external view 文档位于 {@code <pathPrefix>/EXTERNALVIEW/brokerResource}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorConfig {
    public static final int DEFAULT_SESSION_TIMEOUT_SEC = 60;

    private List<String> endpoints;
    private String pathPrefix;
    @Builder.Default
    private int sessionTimeoutSec = DEFAULT_SESSION_TIMEOUT_SEC;
}
