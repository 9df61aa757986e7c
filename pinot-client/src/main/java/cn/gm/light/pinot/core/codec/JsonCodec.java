package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.entity.Value;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONReader;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JSON 编解码。数值一律解析为 BigDecimal/BigInteger/Long，再以原始文本存入 {@link Value}，
 * 解析阶段不做定长类型转换。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/2 14:25:33
 */
public final class JsonCodec {

    private static final JSONReader.Feature[] READ_FEATURES = {
            JSONReader.Feature.UseBigDecimalForDoubles,
            JSONReader.Feature.UseBigDecimalForFloats
    };

    private JsonCodec() {
    }

    public static Object parse(byte[] json) {
        return JSON.parse(new String(json, StandardCharsets.UTF_8), READ_FEATURES);
    }

    public static JSONObject parseObject(byte[] json) {
        JSONObject obj = JSON.parseObject(new String(json, StandardCharsets.UTF_8), READ_FEATURES);
        if (obj == null) {
            throw new JSONException("expected a JSON object but got null");
        }
        return obj;
    }

    public static Value parseValue(byte[] json) {
        return Value.from(parse(json));
    }

    /**
     * 解码一行 JSON 数组
     */
    public static List<Value> parseRow(byte[] json) {
        Object parsed = parse(json);
        if (!(parsed instanceof List)) {
            throw new JSONException("expected a JSON array row but got " + parsed);
        }
        return toRow((List<?>) parsed);
    }

    public static List<Value> toRow(List<?> raw) {
        List<Value> row = new ArrayList<>(raw.size());
        for (Object cell : raw) {
            row.add(Value.from(cell));
        }
        return row;
    }

    public static List<List<Value>> toRows(JSONArray raw) {
        if (raw == null) {
            return new ArrayList<>();
        }
        List<List<Value>> rows = new ArrayList<>(raw.size());
        for (Object r : raw) {
            if (r instanceof List) {
                rows.add(toRow((List<?>) r));
            } else {
                rows.add(new ArrayList<>(Collections.singletonList(Value.from(r))));
            }
        }
        return rows;
    }

    public static String toJson(Map<String, ?> map) {
        return JSON.toJSONString(map);
    }

    /**
     * 先按原名取字段，取不到时忽略大小写再找一次
     */
    static Object field(JSONObject obj, String name) {
        if (obj.containsKey(name)) {
            return obj.get(name);
        }
        for (Map.Entry<String, Object> e : obj.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }
}
