package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.Request;
import cn.gm.light.pinot.enums.QueryFormat;
import cn.gm.light.pinot.exception.ProtocolException;
import cn.gm.light.pinot.exception.TransportException;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

public class JsonHttpClientTransportTest {
    private static final String RESPONSE = "{\"resultTable\":{\"dataSchema\":{\"columnDataTypes\":[\"LONG\"],"
            + "\"columnNames\":[\"cnt\"]},\"rows\":[[97889]]},\"exceptions\":[],\"numServersQueried\":1,"
            + "\"timeUsedMs\":5}";

    private MockWebServer server;

    @BeforeEach
    public void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    public void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    public void testExecuteSql() throws InterruptedException {
        server.enqueue(new MockResponse().setBody(RESPONSE));
        JsonHttpClientTransport transport = new JsonHttpClientTransport(new OkHttpClient(),
                Collections.singletonMap("Authorization", "Bearer token"));
        Request request = Request.builder()
                .queryFormat(QueryFormat.SQL)
                .query("select count(*) from baseballStats")
                .build();

        BrokerResponse resp = transport.execute(address(), request);
        Assertions.assertEquals(97889L, resp.getResultTable().getLong(0, 0));
        Assertions.assertEquals(5, resp.getTimeUsedMs());

        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        Assertions.assertNotNull(recorded);
        Assertions.assertEquals("POST", recorded.getMethod());
        Assertions.assertEquals("/query/sql", recorded.getPath());
        Assertions.assertEquals("application/json; charset=utf-8", recorded.getHeader("Content-Type"));
        Assertions.assertEquals("Bearer token", recorded.getHeader("Authorization"));

        JSONObject body = JSON.parseObject(recorded.getBody().readUtf8());
        Assertions.assertEquals("select count(*) from baseballStats", body.getString("sql"));
        Assertions.assertEquals("groupByMode=sql;responseFormat=sql", body.getString("queryOptions"));
        // 未开启 trace 时不带该字段
        Assertions.assertFalse(body.containsKey("trace"));
    }

    @Test
    public void testQueryOptionsWithTimeoutAndMultistage() throws InterruptedException {
        server.enqueue(new MockResponse().setBody(RESPONSE));
        OkHttpClient client = new OkHttpClient.Builder().callTimeout(3000, TimeUnit.MILLISECONDS).build();
        JsonHttpClientTransport transport = new JsonHttpClientTransport(client, null);
        Request request = Request.builder()
                .queryFormat(QueryFormat.SQL)
                .query("select 1")
                .trace(true)
                .useMultistageEngine(true)
                .build();
        transport.execute("http://" + address(), request);

        JSONObject body = JSON.parseObject(server.takeRequest(5, TimeUnit.SECONDS).getBody().readUtf8());
        Assertions.assertEquals("groupByMode=sql;responseFormat=sql;useMultistageEngine=true;timeoutMs=3000",
                body.getString("queryOptions"));
        Assertions.assertEquals("true", body.getString("trace"));
    }

    @Test
    public void testExecutePql() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"exceptions\":[]}"));
        JsonHttpClientTransport transport = new JsonHttpClientTransport(new OkHttpClient(), null);
        Request request = Request.builder().queryFormat(QueryFormat.PQL).query("select * from t").build();
        transport.execute(address(), request);

        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        Assertions.assertEquals("/query", recorded.getPath());
        JSONObject body = JSON.parseObject(recorded.getBody().readUtf8());
        Assertions.assertEquals("select * from t", body.getString("pql"));
        Assertions.assertFalse(body.containsKey("queryOptions"));
    }

    @Test
    public void testNon200() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        JsonHttpClientTransport transport = new JsonHttpClientTransport(new OkHttpClient(), null);
        Request request = Request.builder().queryFormat(QueryFormat.SQL).query("select 1").build();

        TransportException e = Assertions.assertThrows(TransportException.class,
                () -> transport.execute(address(), request));
        Assertions.assertTrue(e.getMessage().startsWith("caught http exception when querying Pinot: 500"));
    }

    @Test
    public void testMalformedBody() {
        server.enqueue(new MockResponse().setBody("{\"resultTable\":"));
        JsonHttpClientTransport transport = new JsonHttpClientTransport(new OkHttpClient(), null);
        Request request = Request.builder().queryFormat(QueryFormat.SQL).query("select 1").build();

        Assertions.assertThrows(ProtocolException.class, () -> transport.execute(address(), request));
    }

    @Test
    public void testUnreachableBroker() throws IOException {
        String unreachable = address();
        server.shutdown();
        JsonHttpClientTransport transport = new JsonHttpClientTransport(new OkHttpClient(), null);
        Request request = Request.builder().queryFormat(QueryFormat.SQL).query("select 1").build();

        Assertions.assertThrows(TransportException.class, () -> transport.execute(unreachable, request));
    }

    @Test
    public void testGetQueryUrl() {
        Assertions.assertEquals("http://h:8000/query/sql", JsonHttpClientTransport.getQueryUrl(QueryFormat.SQL, "h:8000"));
        Assertions.assertEquals("https://h:8000/query", JsonHttpClientTransport.getQueryUrl(QueryFormat.PQL, "https://h:8000"));
    }

    private String address() {
        return server.getHostName() + ":" + server.getPort();
    }
}
