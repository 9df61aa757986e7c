package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.core.config.GrpcConfig;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.RespSchema;
import cn.gm.light.pinot.entity.ResultTable;
import cn.gm.light.pinot.entity.Value;
import cn.gm.light.pinot.exception.ProtocolException;
import cn.gm.light.pinot.exception.TransportException;
import com.alibaba.fastjson2.JSONException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 按到达顺序消费 gRPC 响应流：
 * <ol>
 *     <li>第一条：JSON 元数据，即去掉结果行的 broker 响应</li>
 *     <li>第二条：schema 帧</li>
 *     <li>之后每条：一个数据块，元数据中带 rowSize、encoding、compression</li>
 * </ol>
 * 单次调用内使用，非线程安全。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/6 16:48:52
 */
@Slf4j
public class GrpcResponseDecoder {
    public static final String ROW_SIZE = "rowSize";
    public static final String ENCODING = "encoding";
    public static final String COMPRESSION = "compression";

    private final GrpcConfig config;
    private BrokerResponse response;
    private RespSchema schema;
    private int blocks;

    public GrpcResponseDecoder(GrpcConfig config) {
        this.config = config;
    }

    public void onMessage(Map<String, String> metadata, byte[] payload) {
        if (response == null) {
            try {
                response = BrokerResponseDecoder.decode(payload);
            } catch (JSONException e) {
                throw new ProtocolException("failed to decode grpc metadata block: " + e.getMessage(), e);
            }
            return;
        }
        if (schema == null) {
            schema = decodeDataSchema(payload);
            if (response.getResultTable() == null) {
                response.setResultTable(new ResultTable(schema, new ArrayList<>()));
            } else {
                response.getResultTable().setDataSchema(schema);
            }
            return;
        }
        int rowSize = parseRowSize(metadata);
        String encoding = normalizeAlgorithm(metadata.get(ENCODING), config.getEncoding(), GrpcConfig.DEFAULT_ENCODING);
        String compression = normalizeAlgorithm(metadata.get(COMPRESSION), config.getCompression(), GrpcConfig.DEFAULT_COMPRESSION);
        byte[] data = PayloadDecompressor.decompress(payload, compression);
        List<List<Value>> rows;
        switch (encoding.toUpperCase(Locale.ROOT)) {
            case "JSON":
                rows = decodeJsonRows(data, rowSize);
                break;
            case "ARROW":
                rows = ArrowRowDecoder.decode(data, schema);
                break;
            default:
                throw ProtocolException.of("unsupported grpc encoding: " + encoding);
        }
        response.getResultTable().getRows().addAll(rows);
        blocks++;
        log.debug("Decoded grpc block #{}: {} rows, encoding={}, compression={}", blocks, rows.size(), encoding, compression);
    }

    /**
     * @throws TransportException 一条消息都没有收到
     */
    public BrokerResponse finish() {
        if (response == null) {
            throw TransportException.of("no grpc response payload received");
        }
        return response;
    }

    /**
     * int32 列数，随后 n 个长度前缀的列名，再 n 个长度前缀的列类型
     */
    public static RespSchema decodeDataSchema(byte[] payload) {
        FrameReader reader = new FrameReader(payload);
        int columnCount = reader.readInt("schema column count");
        if (columnCount < 0) {
            throw ProtocolException.of("invalid schema column count: " + columnCount);
        }
        List<String> columnNames = new ArrayList<>();
        for (int i = 0; i < columnCount; i++) {
            columnNames.add(reader.readString("schema column name"));
        }
        List<String> columnTypes = new ArrayList<>();
        for (int i = 0; i < columnCount; i++) {
            columnTypes.add(reader.readString("schema column type"));
        }
        return new RespSchema(columnTypes, columnNames);
    }

    public static int parseRowSize(Map<String, String> metadata) {
        if (metadata == null) {
            throw ProtocolException.of("grpc response metadata missing");
        }
        String rowSize = metadata.get(ROW_SIZE);
        if (rowSize == null) {
            throw ProtocolException.of("grpc response metadata missing rowSize");
        }
        try {
            return Integer.parseInt(rowSize.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid grpc rowSize \"" + rowSize + "\"", e);
        }
    }

    /**
     * rowSize 个 长度前缀 + JSON 数组 的行
     */
    public static List<List<Value>> decodeJsonRows(byte[] payload, int rowSize) {
        List<List<Value>> rows = new ArrayList<>();
        if (rowSize <= 0) {
            return rows;
        }
        FrameReader reader = new FrameReader(payload);
        for (int i = 0; i < rowSize; i++) {
            int rowLength = reader.readLength("row length");
            byte[] rowBytes = reader.readBytes(rowLength, "row bytes");
            try {
                rows.add(JsonCodec.parseRow(rowBytes));
            } catch (JSONException e) {
                throw new ProtocolException("failed to decode row json: " + e.getMessage(), e);
            }
        }
        return rows;
    }

    /**
     * 依次取第一个非空值
     */
    public static String normalizeAlgorithm(String primary, String fallback, String defaultValue) {
        if (primary != null && !primary.isEmpty()) {
            return primary;
        }
        if (fallback != null && !fallback.isEmpty()) {
            return fallback;
        }
        return defaultValue;
    }
}
