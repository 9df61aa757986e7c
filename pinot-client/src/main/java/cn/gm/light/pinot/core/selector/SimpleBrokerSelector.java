package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 预配置的 broker 列表，忽略表名随机选择。
 */
public class SimpleBrokerSelector implements BrokerSelector {
    private static final String NO_BROKER = "no pre-configured broker lists set in SimpleBrokerSelector";

    private final List<String> brokerList;

    public SimpleBrokerSelector(List<String> brokerList) {
        this.brokerList = brokerList == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(brokerList));
    }

    @Override
    public void init() {
        if (brokerList.isEmpty()) {
            throw ConfigurationException.of(NO_BROKER);
        }
    }

    @Override
    public String selectBroker(String table) {
        if (brokerList.isEmpty()) {
            throw ConfigurationException.of(NO_BROKER);
        }
        return brokerList.get(ThreadLocalRandom.current().nextInt(brokerList.size()));
    }

    public List<String> getBrokerList() {
        return brokerList;
    }
}
