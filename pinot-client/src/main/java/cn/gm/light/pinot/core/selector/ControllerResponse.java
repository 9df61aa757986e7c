package cn.gm.light.pinot.core.selector;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.TypeReference;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * controller {@code /v2/brokers/tables} 接口的返回：表名 -> broker 列表
 */
public class ControllerResponse {
    private static final TypeReference<Map<String, List<BrokerDto>>> TYPE =
            new TypeReference<Map<String, List<BrokerDto>>>() {
            };

    private final Map<String, List<BrokerDto>> tables;

    public ControllerResponse(Map<String, List<BrokerDto>> tables) {
        this.tables = tables == null ? Collections.emptyMap() : tables;
    }

    public static ControllerResponse parse(byte[] body) throws JSONException {
        return new ControllerResponse(JSON.parseObject(new String(body, StandardCharsets.UTF_8), TYPE));
    }

    /**
     * 去重后的全部 broker
     */
    public List<String> extractBrokerList() {
        Set<String> brokerSet = new LinkedHashSet<>();
        for (List<BrokerDto> brokers : tables.values()) {
            if (brokers == null) {
                continue;
            }
            for (BrokerDto broker : brokers) {
                brokerSet.add(broker.extractBrokerName());
            }
        }
        return new ArrayList<>(brokerSet);
    }

    public Map<String, List<String>> extractTableToBrokerMap() {
        Map<String, List<String>> tableToBrokerMap = new LinkedHashMap<>();
        for (Map.Entry<String, List<BrokerDto>> e : tables.entrySet()) {
            List<String> brokersPerTable = new ArrayList<>();
            if (e.getValue() != null) {
                for (BrokerDto broker : e.getValue()) {
                    brokersPerTable.add(broker.extractBrokerName());
                }
            }
            tableToBrokerMap.put(e.getKey(), brokersPerTable);
        }
        return tableToBrokerMap;
    }
}
