package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.core.config.CoordinatorConfig;
import cn.gm.light.pinot.exception.SelectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

public class DynamicBrokerSelectorTest {
    private FakeStore store;
    private DynamicBrokerSelector selector;

    @BeforeEach
    public void setUp() {
        store = new FakeStore();
        store.content = ExternalViewTest.EXTERNAL_VIEW;
        CoordinatorConfig config = CoordinatorConfig.builder()
                .endpoints(Collections.singletonList("localhost:2379"))
                .pathPrefix("/pinot/QuickStartCluster")
                .build();
        selector = new DynamicBrokerSelector(config, store);
    }

    @AfterEach
    public void tearDown() {
        selector.stop();
    }

    @Test
    public void testInitReadsExternalView() {
        selector.init();
        Assertions.assertEquals("/pinot/QuickStartCluster/EXTERNALVIEW/brokerResource", selector.getExternalViewPath());
        Assertions.assertEquals(selector.getExternalViewPath(), store.watchedPath);
        Assertions.assertEquals(1, store.reads.get());
        Assertions.assertTrue(selector.selectBroker("baseballStats").startsWith("127.0.0.1:"));
        Assertions.assertTrue(selector.isWatcherAlive());
    }

    @Test
    public void testDataChangedSwapsBrokers() {
        selector.init();
        store.content = "{\"mapFields\":{\"airlineStats_REALTIME\":{\"Broker_10.0.0.1_8099\":\"ONLINE\"}}}";
        store.listener.accept(ExternalViewEvent.dataChanged());

        waitFor(() -> selector.getTableBrokerMap().containsKey("airlineStats"));
        Assertions.assertEquals("10.0.0.1:8099", selector.selectBroker("airlineStats"));
        Assertions.assertEquals(Collections.singletonList("10.0.0.1:8099"), selector.getAllBrokerList());
        Assertions.assertThrows(SelectionException.class, () -> selector.selectBroker("baseballStats"));
    }

    @Test
    public void testWatchErrorsDoNotStopTheLoop() {
        selector.init();
        store.listener.accept(ExternalViewEvent.error(new IllegalStateException("session expired")));
        store.content = "{\"mapFields\":";
        store.listener.accept(ExternalViewEvent.dataChanged());
        store.listener.accept(ExternalViewEvent.deleted());

        store.content = "{\"mapFields\":{\"t_OFFLINE\":{\"Broker_h_1\":\"ONLINE\"}}}";
        store.listener.accept(ExternalViewEvent.dataChanged());

        waitFor(() -> selector.getTableBrokerMap().containsKey("t"));
        Assertions.assertEquals("h:1", selector.selectBroker("t"));
        Assertions.assertTrue(selector.isWatcherAlive());
    }

    @Test
    public void testInitFailsWhenReadFails() {
        store.content = null;
        Assertions.assertThrows(SelectionException.class, selector::init);
        Assertions.assertNull(store.listener);
    }

    @Test
    public void testInitFailsOnMalformedDocument() {
        store.content = "{\"mapFields\":{";
        Assertions.assertThrows(SelectionException.class, selector::init);
    }

    @Test
    public void testStopTerminatesWatcher() {
        selector.init();
        selector.stop();
        waitFor(() -> !selector.isWatcherAlive());
        Assertions.assertTrue(store.closed);
    }

    private static void waitFor(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not met in time");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Assertions.fail("interrupted");
            }
        }
    }

    static class FakeStore implements ExternalViewStore {
        volatile String content;
        volatile Consumer<ExternalViewEvent> listener;
        volatile String watchedPath;
        volatile boolean closed;
        final AtomicInteger reads = new AtomicInteger();

        @Override
        public void connect() {
        }

        @Override
        public byte[] read(String path) {
            reads.incrementAndGet();
            String c = content;
            if (c == null) {
                throw SelectionException.of("external view not found: " + path);
            }
            return c.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void watch(String path, Consumer<ExternalViewEvent> listener) {
            this.watchedPath = path;
            this.listener = listener;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
