package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.core.config.ControllerConfig;
import cn.gm.light.pinot.exception.ConfigurationException;
import cn.gm.light.pinot.exception.SelectionException;
import cn.gm.light.pinot.utils.PeriodicTask;
import com.alibaba.fastjson2.JSONException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Map;

/**
 * 定时轮询 controller 的 broker 接口刷新映射。
 * 首次拉取在 {@link #init()} 中同步完成，失败则不启动轮询。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/5 17:02:30
 */
@Slf4j
public class ControllerBasedBrokerSelector extends TableAwareBrokerSelector {
    public static final String CONTROLLER_API_ENDPOINT = "/v2/brokers/tables?state=ONLINE";

    private final ControllerConfig config;
    private final OkHttpClient client;
    private String controllerApiRequestUrl;
    private long updateFreqMs;
    private PeriodicTask poller;

    public ControllerBasedBrokerSelector(ControllerConfig config, OkHttpClient client) {
        this.config = config;
        this.client = client;
    }

    @Override
    public void init() {
        this.updateFreqMs = config.getUpdateFreqMs() > 0
                ? config.getUpdateFreqMs()
                : ControllerConfig.DEFAULT_UPDATE_FREQ_MS;
        this.controllerApiRequestUrl = getControllerRequestUrl(config.getControllerAddress());
        try {
            updateBrokerData();
        } catch (SelectionException e) {
            throw new SelectionException("an error occurred when fetching broker data from controller API: "
                    + e.getMessage(), e);
        }
        poller = new PeriodicTask("controller-broker-poller", this::updateBrokerData);
        poller.start(updateFreqMs);
        log.info("Controller based broker selector started, url: {}, interval: {}ms", controllerApiRequestUrl, updateFreqMs);
    }

    @Override
    public void stop() {
        if (poller != null) {
            poller.stop();
        }
    }

    /**
     * 补全 scheme 并拼接 broker 接口路径。只接受 http / https。
     */
    public static String getControllerRequestUrl(String controllerAddress) {
        if (controllerAddress == null || controllerAddress.isEmpty()) {
            throw ConfigurationException.of("controller address is empty");
        }
        String addressWithScheme = controllerAddress;
        String[] tokenized = controllerAddress.split("://", -1);
        if (tokenized.length > 1) {
            String scheme = tokenized[0];
            if (!"https".equals(scheme) && !"http".equals(scheme)) {
                throw ConfigurationException.of(String.format(
                        "Unsupported controller URL scheme: %s, only http (default) and https are allowed", scheme));
            }
        } else {
            addressWithScheme = "http://" + controllerAddress;
        }
        if (addressWithScheme.endsWith("/")) {
            addressWithScheme = addressWithScheme.substring(0, addressWithScheme.length() - 1);
        }
        return addressWithScheme + CONTROLLER_API_ENDPOINT;
    }

    void updateBrokerData() {
        Request.Builder builder = new Request.Builder()
                .url(controllerApiRequestUrl)
                .get()
                .header("Accept", "application/json");
        Map<String, String> extraHeaders = config.getExtraControllerApiHeaders();
        if (extraHeaders != null) {
            extraHeaders.forEach(builder::header);
        }
        try (Response resp = client.newCall(builder.build()).execute()) {
            if (resp.code() != 200) {
                throw SelectionException.of("Controller API returned HTTP status code " + resp.code());
            }
            ResponseBody body = resp.body();
            byte[] bytes = body == null ? new byte[0] : body.bytes();
            ControllerResponse c;
            try {
                c = ControllerResponse.parse(bytes);
            } catch (JSONException e) {
                throw new SelectionException("An error occurred when decoding controller API response: " + e.getMessage(), e);
            }
            updateBrokerData(c.extractTableToBrokerMap(), c.extractBrokerList());
            log.debug("Refreshed brokers from controller, tables: {}", c.extractTableToBrokerMap().keySet());
        } catch (IOException e) {
            throw new SelectionException("Got exceptions while sending controller API request: " + e.getMessage(), e);
        }
    }

    String getControllerApiRequestUrl() {
        return controllerApiRequestUrl;
    }

    long getUpdateFreqMs() {
        return updateFreqMs;
    }

    boolean isPolling() {
        return poller != null && poller.isRunning();
    }
}
