package cn.gm.light.pinot.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControllerConfig {
    public static final long DEFAULT_UPDATE_FREQ_MS = 1000;

    // host:port，或带 http:// / https:// 前缀
    private String controllerAddress;
    private Map<String, String> extraControllerApiHeaders;
    // 轮询间隔，<=0 时使用默认值
    private long updateFreqMs;
}
