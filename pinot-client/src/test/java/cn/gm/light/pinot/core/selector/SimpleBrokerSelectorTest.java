package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.exception.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class SimpleBrokerSelectorTest {

    @Test
    public void testSelectBroker() {
        List<String> brokers = Arrays.asList("broker0:8099", "broker1:8099", "broker2:8099");
        SimpleBrokerSelector selector = new SimpleBrokerSelector(brokers);
        selector.init();

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            String broker = selector.selectBroker(i % 2 == 0 ? "" : "anyTable");
            Assertions.assertTrue(brokers.contains(broker));
            seen.add(broker);
        }
        Assertions.assertTrue(seen.size() > 1);
    }

    @Test
    public void testEmptyList() {
        SimpleBrokerSelector selector = new SimpleBrokerSelector(Collections.emptyList());
        ConfigurationException initError = Assertions.assertThrows(ConfigurationException.class, selector::init);
        for (int i = 0; i < 3; i++) {
            ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                    () -> selector.selectBroker("t"));
            Assertions.assertEquals(initError.getMessage(), e.getMessage());
        }
        Assertions.assertThrows(ConfigurationException.class, () -> new SimpleBrokerSelector(null).selectBroker(""));
    }
}
