package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.core.config.GrpcConfig;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.RespSchema;
import cn.gm.light.pinot.entity.ResultTable;
import cn.gm.light.pinot.entity.Value;
import cn.gm.light.pinot.exception.ProtocolException;
import cn.gm.light.pinot.exception.TransportException;
import com.github.luben.zstd.Zstd;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class GrpcResponseDecoderTest {
    private static final byte[] METADATA = "{\"exceptions\":[],\"numServersQueried\":1,\"timeUsedMs\":3}"
            .getBytes(StandardCharsets.UTF_8);

    @Test
    public void testThreeMessageSequence() {
        GrpcResponseDecoder decoder = new GrpcResponseDecoder(new GrpcConfig());
        decoder.onMessage(Collections.emptyMap(), METADATA);
        decoder.onMessage(Collections.emptyMap(),
                GrpcPayloads.schemaFrame(Collections.singletonList("cnt"), Collections.singletonList("LONG")));
        decoder.onMessage(block("2", "JSON", "NONE"), GrpcPayloads.jsonRows("[1]", "[2]"));

        BrokerResponse resp = decoder.finish();
        ResultTable table = resp.getResultTable();
        Assertions.assertEquals(1, resp.getNumServersQueried());
        Assertions.assertEquals("cnt", table.getColumnName(0));
        Assertions.assertEquals(2, table.getRowCount());
        Assertions.assertEquals(1L, table.getLong(0, 0));
        Assertions.assertEquals(2L, table.getLong(1, 0));
    }

    @Test
    public void testBlocksAppendInArrivalOrder() {
        GrpcResponseDecoder decoder = new GrpcResponseDecoder(new GrpcConfig());
        decoder.onMessage(Collections.emptyMap(), METADATA);
        decoder.onMessage(Collections.emptyMap(),
                GrpcPayloads.schemaFrame(Collections.singletonList("name"), Collections.singletonList("STRING")));
        decoder.onMessage(block("1", "JSON", "ZSTD"), Zstd.compress(GrpcPayloads.jsonRows("[\"first\"]")));
        decoder.onMessage(block("2", null, null), Zstd.compress(GrpcPayloads.jsonRows("[\"second\"]", "[\"third\"]")));

        ResultTable table = decoder.finish().getResultTable();
        Assertions.assertEquals(3, table.getRowCount());
        Assertions.assertEquals("first", table.getString(0, 0));
        Assertions.assertEquals("third", table.getString(2, 0));
    }

    @Test
    public void testUnsupportedCompressionFailsBlock() {
        GrpcResponseDecoder decoder = new GrpcResponseDecoder(new GrpcConfig());
        decoder.onMessage(Collections.emptyMap(), METADATA);
        decoder.onMessage(Collections.emptyMap(),
                GrpcPayloads.schemaFrame(Collections.singletonList("cnt"), Collections.singletonList("LONG")));
        Assertions.assertThrows(ProtocolException.class,
                () -> decoder.onMessage(block("1", "JSON", "BROTLI"), GrpcPayloads.jsonRows("[1]")));
    }

    @Test
    public void testUnsupportedEncoding() {
        GrpcResponseDecoder decoder = new GrpcResponseDecoder(new GrpcConfig());
        decoder.onMessage(Collections.emptyMap(), METADATA);
        decoder.onMessage(Collections.emptyMap(),
                GrpcPayloads.schemaFrame(Collections.singletonList("cnt"), Collections.singletonList("LONG")));
        ProtocolException e = Assertions.assertThrows(ProtocolException.class,
                () -> decoder.onMessage(block("1", "CSV", "NONE"), GrpcPayloads.jsonRows("[1]")));
        Assertions.assertTrue(e.getMessage().startsWith("unsupported grpc encoding"));
    }

    @Test
    public void testNoMessages() {
        TransportException e = Assertions.assertThrows(TransportException.class,
                () -> new GrpcResponseDecoder(new GrpcConfig()).finish());
        Assertions.assertEquals("no grpc response payload received", e.getMessage());
    }

    @Test
    public void testMetadataOnly() {
        GrpcResponseDecoder decoder = new GrpcResponseDecoder(new GrpcConfig());
        decoder.onMessage(Collections.emptyMap(), METADATA);
        BrokerResponse resp = decoder.finish();
        Assertions.assertNull(resp.getResultTable());
        Assertions.assertEquals(3, resp.getTimeUsedMs());
    }

    @Test
    public void testServerExceptionsWithoutRows() {
        // 查询在服务端失败时只回元数据，异常信息要原样交给调用方
        byte[] failed = "{\"exceptions\":[{\"errorCode\":190,\"message\":\"TableDoesNotExistError\"}]}"
                .getBytes(StandardCharsets.UTF_8);
        GrpcResponseDecoder decoder = new GrpcResponseDecoder(new GrpcConfig());
        decoder.onMessage(Collections.emptyMap(), failed);
        BrokerResponse resp = decoder.finish();
        Assertions.assertTrue(resp.hasExceptions());
        Assertions.assertEquals(190, resp.getExceptions().get(0).getErrorCode());
    }

    @Test
    public void testDecodeDataSchema() {
        RespSchema schema = GrpcResponseDecoder.decodeDataSchema(
                GrpcPayloads.schemaFrame(Arrays.asList("a", "b"), Arrays.asList("INT", "STRING")));
        Assertions.assertEquals(Arrays.asList("a", "b"), schema.getColumnNames());
        Assertions.assertEquals(Arrays.asList("INT", "STRING"), schema.getColumnDataTypes());

        Assertions.assertTrue(GrpcResponseDecoder.decodeDataSchema(new byte[]{0, 0, 0, 0}).getColumnNames().isEmpty());
    }

    @Test
    public void testMalformedSchemaFrame() {
        // 负列数
        byte[] negative = ByteBuffer.allocate(4).putInt(-1).array();
        Assertions.assertThrows(ProtocolException.class, () -> GrpcResponseDecoder.decodeDataSchema(negative));

        // 列名被截断
        byte[] truncated = ByteBuffer.allocate(10).putInt(1).putInt(20).put((byte) 'a').put((byte) 'b').array();
        Assertions.assertThrows(ProtocolException.class, () -> GrpcResponseDecoder.decodeDataSchema(truncated));

        // 负长度
        byte[] negativeLength = ByteBuffer.allocate(8).putInt(1).putInt(-5).array();
        Assertions.assertThrows(ProtocolException.class, () -> GrpcResponseDecoder.decodeDataSchema(negativeLength));

        Assertions.assertThrows(ProtocolException.class, () -> GrpcResponseDecoder.decodeDataSchema(new byte[]{0, 1}));
    }

    @Test
    public void testParseRowSize() {
        Assertions.assertEquals(5, GrpcResponseDecoder.parseRowSize(Collections.singletonMap("rowSize", "5")));
        ProtocolException missing = Assertions.assertThrows(ProtocolException.class,
                () -> GrpcResponseDecoder.parseRowSize(Collections.emptyMap()));
        Assertions.assertEquals("grpc response metadata missing rowSize", missing.getMessage());
        Assertions.assertThrows(ProtocolException.class,
                () -> GrpcResponseDecoder.parseRowSize(Collections.singletonMap("rowSize", "many")));
    }

    @Test
    public void testDecodeJsonRows() {
        List<List<Value>> rows = GrpcResponseDecoder.decodeJsonRows(
                GrpcPayloads.jsonRows("[1,\"a\",null]", "[2.50,\"b\",true]"), 2);
        Assertions.assertEquals(2, rows.size());
        Assertions.assertEquals("2.50", rows.get(1).get(0).asString());
        Assertions.assertTrue(rows.get(0).get(2).isNull());
        Assertions.assertTrue(rows.get(1).get(2).asBoolean());

        Assertions.assertTrue(GrpcResponseDecoder.decodeJsonRows(new byte[0], 0).isEmpty());
        Assertions.assertThrows(ProtocolException.class,
                () -> GrpcResponseDecoder.decodeJsonRows(GrpcPayloads.jsonRows("[1]"), 2));
        Assertions.assertThrows(ProtocolException.class,
                () -> GrpcResponseDecoder.decodeJsonRows(GrpcPayloads.jsonRows("{\"a\":1}"), 1));
    }

    @Test
    public void testNormalizeAlgorithm() {
        Assertions.assertEquals("GZIP", GrpcResponseDecoder.normalizeAlgorithm("GZIP", "LZ4", "ZSTD"));
        Assertions.assertEquals("LZ4", GrpcResponseDecoder.normalizeAlgorithm("", "LZ4", "ZSTD"));
        Assertions.assertEquals("ZSTD", GrpcResponseDecoder.normalizeAlgorithm(null, null, "ZSTD"));
    }

    private static Map<String, String> block(String rowSize, String encoding, String compression) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("rowSize", rowSize);
        if (encoding != null) {
            metadata.put("encoding", encoding);
        }
        if (compression != null) {
            metadata.put("compression", compression);
        }
        return metadata;
    }
}
