package cn.gm.light.pinot.entity;

import com.alibaba.fastjson2.JSON;
import com.google.common.io.BaseEncoding;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 结果表中的单元格值。
 *
 * <p>数值类型保留服务端返回的原始文本，只有在调用 {@link #asInt()}、{@link #asLong()}、
 * {@link #asFloat()}、{@link #asDouble()} 时才做转换。转换失败（非数值、溢出）时返回该类型的零值，
 * 不抛异常。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/2 11:03:15
 */
public final class Value {

    public enum Kind {
        NULL,
        NUMBER,
        STRING,
        BOOL,
        BYTES,
        LIST,
        MAP
    }

    public static final Value NULL = new Value(Kind.NULL, null);
    public static final Value TRUE = new Value(Kind.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(Kind.BOOL, Boolean.FALSE);

    private final Kind kind;
    // NUMBER/STRING 为 String，BOOL 为 Boolean，BYTES 为 byte[]，LIST 为 List<Value>，MAP 为 Map<String, Value>
    private final Object raw;

    private Value(Kind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static Value ofNumber(String text) {
        if (text == null) {
            return NULL;
        }
        return new Value(Kind.NUMBER, text);
    }

    public static Value ofNumber(Number number) {
        if (number == null) {
            return NULL;
        }
        return new Value(Kind.NUMBER, numberText(number));
    }

    public static Value ofString(String s) {
        return s == null ? NULL : new Value(Kind.STRING, s);
    }

    public static Value ofBool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Value ofBytes(byte[] bytes) {
        return bytes == null ? NULL : new Value(Kind.BYTES, bytes.clone());
    }

    public static Value ofList(List<Value> values) {
        if (values == null) {
            return NULL;
        }
        return new Value(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static Value ofMap(Map<String, Value> values) {
        if (values == null) {
            return NULL;
        }
        return new Value(Kind.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * 把 JSON 解码得到的 Java 对象转换成 Value，嵌套的 List/Map 递归转换。
     */
    public static Value from(Object o) {
        if (o == null) {
            return NULL;
        }
        if (o instanceof Value) {
            return (Value) o;
        }
        if (o instanceof String) {
            return ofString((String) o);
        }
        if (o instanceof Boolean) {
            return ofBool((Boolean) o);
        }
        if (o instanceof Number) {
            return ofNumber((Number) o);
        }
        if (o instanceof byte[]) {
            return ofBytes((byte[]) o);
        }
        if (o instanceof Map) {
            Map<String, Value> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                out.put(String.valueOf(e.getKey()), from(e.getValue()));
            }
            return ofMap(out);
        }
        if (o instanceof Collection) {
            List<Value> out = new ArrayList<>();
            for (Object item : (Collection<?>) o) {
                out.add(from(item));
            }
            return ofList(out);
        }
        if (o instanceof Object[]) {
            return from(Arrays.asList((Object[]) o));
        }
        return ofString(o.toString());
    }

    private static String numberText(Number number) {
        if (number instanceof BigDecimal) {
            return number.toString();
        }
        if (number instanceof Float) {
            float f = number.floatValue();
            if (Float.isNaN(f) || Float.isInfinite(f)) {
                return Float.toString(f);
            }
            return new BigDecimal(Float.toString(f)).toPlainString();
        }
        if (number instanceof Double) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Double.toString(d);
            }
            return new BigDecimal(Double.toString(d)).toPlainString();
        }
        return number.toString();
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    /**
     * 数值的原始文本；非数值返回 null。
     */
    public String numberText() {
        return kind == Kind.NUMBER ? (String) raw : null;
    }

    public String asString() {
        switch (kind) {
            case NULL:
                return null;
            case NUMBER:
            case STRING:
                return (String) raw;
            case BOOL:
                return raw.toString();
            case BYTES:
                return BaseEncoding.base16().lowerCase().encode((byte[]) raw);
            default:
                return JSON.toJSONString(toJava());
        }
    }

    public boolean asBoolean() {
        switch (kind) {
            case BOOL:
                return (Boolean) raw;
            case STRING:
                return Boolean.parseBoolean((String) raw);
            default:
                return false;
        }
    }

    public int asInt() {
        String text = coercibleText();
        if (text == null) {
            return 0;
        }
        long l;
        try {
            l = Long.parseLong(text);
        } catch (NumberFormatException e) {
            return 0;
        }
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            return 0;
        }
        return (int) l;
    }

    public long asLong() {
        String text = coercibleText();
        if (text == null) {
            return 0L;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public float asFloat() {
        String text = coercibleText();
        if (text == null) {
            return 0f;
        }
        double d = parseDouble(text);
        float f = (float) d;
        if (Float.isInfinite(f) && !Double.isInfinite(d)) {
            return 0f;
        }
        return f;
    }

    public double asDouble() {
        String text = coercibleText();
        if (text == null) {
            return 0d;
        }
        return parseDouble(text);
    }

    /**
     * 高精度读取；非数值返回 null。
     */
    public BigDecimal asBigDecimal() {
        String text = coercibleText();
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public byte[] asBytes() {
        if (kind == Kind.BYTES) {
            return ((byte[]) raw).clone();
        }
        if (kind == Kind.STRING) {
            try {
                return BaseEncoding.base16().lowerCase().decode(((String) raw).toLowerCase());
            } catch (IllegalArgumentException e) {
                return new byte[0];
            }
        }
        return new byte[0];
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        return kind == Kind.LIST ? (List<Value>) raw : Collections.emptyList();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        return kind == Kind.MAP ? (Map<String, Value>) raw : Collections.emptyMap();
    }

    /**
     * 转换回普通 Java 对象：数值为 BigDecimal（NaN/Infinity 为 Double），列表为 List，映射为 Map。
     */
    public Object toJava() {
        switch (kind) {
            case NULL:
                return null;
            case NUMBER:
                BigDecimal decimal = asBigDecimal();
                return decimal != null ? decimal : (Object) parseDouble((String) raw);
            case LIST:
                List<Object> list = new ArrayList<>();
                for (Value v : asList()) {
                    list.add(v.toJava());
                }
                return list;
            case MAP:
                Map<String, Object> map = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : asMap().entrySet()) {
                    map.put(e.getKey(), e.getValue().toJava());
                }
                return map;
            case BYTES:
                return ((byte[]) raw).clone();
            default:
                return raw;
        }
    }

    private String coercibleText() {
        if (kind == Kind.NUMBER) {
            return (String) raw;
        }
        if (kind == Kind.STRING) {
            return ((String) raw).trim();
        }
        return null;
    }

    private static double parseDouble(String text) {
        double d;
        try {
            d = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0d;
        }
        // 超出 double 范围的有限值按零处理
        if (Double.isInfinite(d) && !text.toLowerCase().contains("infinity")) {
            return 0d;
        }
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == Kind.BYTES) {
            return Arrays.equals((byte[]) raw, (byte[]) other.raw);
        }
        return Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.BYTES) {
            return 31 * kind.hashCode() + Arrays.hashCode((byte[]) raw);
        }
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        if (kind == Kind.NULL) {
            return "null";
        }
        return asString();
    }
}
