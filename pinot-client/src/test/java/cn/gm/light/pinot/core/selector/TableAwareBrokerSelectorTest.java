package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.exception.SelectionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class TableAwareBrokerSelectorTest {
    private StubSelector selector;

    @BeforeEach
    public void setUp() {
        selector = new StubSelector();
        Map<String, List<String>> tables = new HashMap<>();
        tables.put("t1", Arrays.asList("h1:1", "h2:2"));
        tables.put("empty", Collections.emptyList());
        selector.updateBrokerData(tables, Arrays.asList("h1:1", "h2:2"));
    }

    @Test
    public void testSelectForTable() {
        Assertions.assertTrue(Arrays.asList("h1:1", "h2:2").contains(selector.selectBroker("t1")));
        Assertions.assertTrue(Arrays.asList("h1:1", "h2:2").contains(selector.selectBroker("t1_OFFLINE")));
        Assertions.assertTrue(Arrays.asList("h1:1", "h2:2").contains(selector.selectBroker("t1_REALTIME")));
    }

    @Test
    public void testSelectAnyBroker() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            seen.add(selector.selectBroker(""));
        }
        Assertions.assertEquals(new HashSet<>(Arrays.asList("h1:1", "h2:2")), seen);
    }

    @Test
    public void testErrors() {
        SelectionException unknown = Assertions.assertThrows(SelectionException.class,
                () -> selector.selectBroker("missing_OFFLINE"));
        Assertions.assertEquals("Unable to find the table: missing_OFFLINE", unknown.getMessage());

        SelectionException empty = Assertions.assertThrows(SelectionException.class,
                () -> selector.selectBroker("empty"));
        Assertions.assertEquals("No available broker found for table: empty", empty.getMessage());

        StubSelector blank = new StubSelector();
        SelectionException none = Assertions.assertThrows(SelectionException.class, () -> blank.selectBroker(""));
        Assertions.assertEquals("No available broker found", none.getMessage());
    }

    @Test
    public void testSnapshotIsImmutable() {
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> selector.getAllBrokerList().add("h3:3"));
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> selector.getTableBrokerMap().get("t1").clear());
    }

    @Test
    public void testConcurrentSwap() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> writer = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    String broker = "h" + i + ":" + i;
                    selector.updateBrokerData(Collections.singletonMap("t1", Collections.singletonList(broker)),
                            Collections.singletonList(broker));
                }
                return null;
            });
            Future<?> reader = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    // 写入过程中读取不应失败
                    String broker = selector.selectBroker("t1");
                    Assertions.assertNotNull(broker);
                }
                return null;
            });
            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            reader.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    static class StubSelector extends TableAwareBrokerSelector {
        @Override
        public void init() {
        }
    }
}
