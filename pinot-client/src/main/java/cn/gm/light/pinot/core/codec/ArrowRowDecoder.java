package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.entity.RespSchema;
import cn.gm.light.pinot.entity.Value;
import cn.gm.light.pinot.exception.ProtocolException;
import com.alibaba.fastjson2.JSONException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.ipc.ArrowStreamReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arrow IPC stream 解码为行。列的读取方式由 schema 中的列类型决定，
 * 数值以十进制文本保存，避免浮点转换损失。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/6 15:31:07
 */
public final class ArrowRowDecoder {

    private ArrowRowDecoder() {
    }

    public static List<List<Value>> decode(byte[] payload, RespSchema schema) {
        List<List<Value>> rows = new ArrayList<>();
        try (BufferAllocator allocator = new RootAllocator();
             ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(payload), allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            while (reader.loadNextBatch()) {
                List<FieldVector> vectors = root.getFieldVectors();
                int rowCount = root.getRowCount();
                for (int rowIdx = 0; rowIdx < rowCount; rowIdx++) {
                    List<Value> row = new ArrayList<>(vectors.size());
                    for (int colIdx = 0; colIdx < vectors.size(); colIdx++) {
                        row.add(readValue(vectors.get(colIdx), columnType(schema, colIdx), rowIdx));
                    }
                    rows.add(row);
                }
            }
        } catch (IOException e) {
            throw new ProtocolException("failed to read arrow payload: " + e.getMessage(), e);
        } catch (ProtocolException e) {
            throw e;
        } catch (RuntimeException e) {
            // arrow 对非法 IPC 数据抛出的运行时异常
            throw new ProtocolException("failed to read arrow payload: " + e.getMessage(), e);
        }
        return rows;
    }

    private static String columnType(RespSchema schema, int colIdx) {
        List<String> types = schema == null ? null : schema.getColumnDataTypes();
        if (types == null || colIdx >= types.size() || types.get(colIdx) == null) {
            return "";
        }
        return types.get(colIdx).toUpperCase(Locale.ROOT);
    }

    static Value readValue(ValueVector column, String columnType, int rowIdx) {
        if (column.isNull(rowIdx)) {
            return Value.NULL;
        }
        switch (columnType) {
            case "BOOLEAN":
                return Value.ofBool(expect(column, BitVector.class, columnType).get(rowIdx) != 0);
            case "INT":
                return Value.ofNumber(Integer.toString(expect(column, IntVector.class, columnType).get(rowIdx)));
            case "LONG":
                return Value.ofNumber(Long.toString(expect(column, BigIntVector.class, columnType).get(rowIdx)));
            case "FLOAT":
                return Value.ofNumber(expect(column, Float4Vector.class, columnType).get(rowIdx));
            case "DOUBLE":
                return Value.ofNumber(expect(column, Float8Vector.class, columnType).get(rowIdx));
            case "TIMESTAMP":
            case "STRING":
            case "BYTES":
            case "BIG_DECIMAL":
            case "JSON":
            case "OBJECT":
                return Value.ofString(utf8(expect(column, VarCharVector.class, "STRING").get(rowIdx)));
            case "MAP":
                return decodeMap(expect(column, VarBinaryVector.class, columnType).get(rowIdx));
            case "UNKNOWN":
                return Value.NULL;
            case "BOOLEAN_ARRAY":
            case "INT_ARRAY":
            case "LONG_ARRAY":
            case "FLOAT_ARRAY":
            case "DOUBLE_ARRAY":
            case "TIMESTAMP_ARRAY":
            case "STRING_ARRAY":
            case "BYTES_ARRAY":
                return readList(expect(column, ListVector.class, columnType), columnType, rowIdx);
            default:
                if (column instanceof VarCharVector) {
                    return Value.ofString(utf8(((VarCharVector) column).get(rowIdx)));
                }
                throw ProtocolException.of("unexpected column type " + column.getClass().getSimpleName()
                        + " for " + columnType);
        }
    }

    private static Value readList(ListVector list, String columnType, int rowIdx) {
        String elementType = columnType.substring(0, columnType.length() - "_ARRAY".length());
        if ("TIMESTAMP".equals(elementType) || "BYTES".equals(elementType)) {
            elementType = "STRING";
        }
        ValueVector values = list.getDataVector();
        int start = list.getElementStartIndex(rowIdx);
        int end = list.getElementEndIndex(rowIdx);
        List<Value> output = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            output.add(readValue(values, elementType, i));
        }
        return Value.ofList(output);
    }

    /**
     * int32 条目数，随后每个条目为 长度前缀的 key + 长度前缀的 JSON value
     */
    static Value decodeMap(byte[] payload) {
        FrameReader reader = new FrameReader(payload);
        int size = reader.readInt("map size");
        if (size < 0) {
            throw ProtocolException.of("invalid map size: " + size);
        }
        Map<String, Value> output = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            String key = reader.readString("map key");
            int valueLength = reader.readLength("map value length");
            byte[] valueBytes = reader.readBytes(valueLength, "map value");
            try {
                output.put(key, JsonCodec.parseValue(valueBytes));
            } catch (JSONException e) {
                throw new ProtocolException("failed to decode map value of key " + key, e);
            }
        }
        return Value.ofMap(output);
    }

    private static <T extends ValueVector> T expect(ValueVector column, Class<T> type, String columnType) {
        if (!type.isInstance(column)) {
            throw ProtocolException.of("expected " + columnType + " column but got " + column.getClass().getSimpleName());
        }
        return type.cast(column);
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
