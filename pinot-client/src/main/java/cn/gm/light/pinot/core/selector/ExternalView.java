package cn.gm.light.pinot.core.selector;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * broker 资源的 external view 文档
 *
 * <pre>
 * {"id":"brokerResource","simpleFields":{...},
 *  "mapFields":{"baseballStats_OFFLINE":{"Broker_127.0.0.1_8000":"ONLINE"}},
 *  "listFields":{}}
 * </pre>
 */
@Slf4j
@Data
public class ExternalView {
    static final String ONLINE = "ONLINE";

    private String id;
    private Map<String, String> simpleFields;
    private Map<String, Map<String, String>> mapFields;
    private Map<String, List<String>> listFields;

    public static ExternalView parse(byte[] bytes) {
        ExternalView ev;
        try {
            ev = JSON.parseObject(new String(bytes, StandardCharsets.UTF_8), ExternalView.class);
        } catch (JSONException e) {
            log.error("Failed to parse external view: {}", new String(bytes, StandardCharsets.UTF_8), e);
            throw e;
        }
        if (ev == null) {
            throw new JSONException("empty external view document");
        }
        return ev;
    }

    /**
     * 表名（已去掉 _OFFLINE/_REALTIME）到 ONLINE broker 列表。混合表的两部分合并去重。
     */
    public Map<String, List<String>> tableBrokerMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (mapFields == null) {
            return result;
        }
        for (Map.Entry<String, Map<String, String>> e : mapFields.entrySet()) {
            List<String> brokers = result.computeIfAbsent(TableNames.extractTableName(e.getKey()), k -> new ArrayList<>());
            for (String broker : extractBrokers(e.getValue())) {
                if (!brokers.contains(broker)) {
                    brokers.add(broker);
                }
            }
        }
        return result;
    }

    /**
     * 所有表的 broker 拼接，可能有重复
     */
    public List<String> allBrokerList() {
        List<String> result = new ArrayList<>();
        if (mapFields == null) {
            return result;
        }
        for (Map<String, String> brokerMapping : mapFields.values()) {
            result.addAll(extractBrokers(brokerMapping));
        }
        return result;
    }

    static List<String> extractBrokers(Map<String, String> brokerMapping) {
        if (brokerMapping == null) {
            return Collections.emptyList();
        }
        List<String> brokers = new ArrayList<>();
        for (Map.Entry<String, String> e : brokerMapping.entrySet()) {
            if (!ONLINE.equals(e.getValue())) {
                continue;
            }
            String hostPort = extractBrokerHostPort(e.getKey());
            if (hostPort != null) {
                brokers.add(hostPort);
            }
        }
        return brokers;
    }

    /**
     * Broker_[hostname]_[port] -> hostname:port，格式不对返回 null
     */
    static String extractBrokerHostPort(String brokerKey) {
        String[] splits = brokerKey.split("_", -1);
        if (splits.length < 2) {
            log.warn("Invalid broker key: {}, should be in the format of Broker_[hostname]_[port]", brokerKey);
            return null;
        }
        String port = splits[splits.length - 1];
        try {
            Integer.parseInt(port);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse broker port: {} to integer", port);
            return null;
        }
        return splits[splits.length - 2] + ":" + port;
    }
}
