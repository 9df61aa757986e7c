package cn.gm.light.pinot.core.statement;

import cn.gm.light.pinot.exception.ParameterException;
import com.google.common.io.BaseEncoding;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 把参数转换成 SQL 字面量并替换模板中的 {@code ?}。
 *
 * <p>字符串类统一加单引号，内部单引号写成两个；时间类格式化为 {@code 'yyyy-MM-dd HH:mm:ss.SSS'}，
 * Instant 与 Date 按 UTC 输出。
 */
public final class QueryFormatter {
    static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);

    private QueryFormatter() {
    }

    /**
     * 按顺序替换占位符，占位符数量必须与参数数量一致。
     */
    public static String formatQuery(String queryPattern, Object[] params) {
        String[] parts = splitOnPlaceholder(queryPattern);
        int numPlaceholders = parts.length - 1;
        int numParams = params == null ? 0 : params.length;
        if (numPlaceholders != numParams) {
            throw ParameterException.of(String.format(
                    "number of placeholders in queryPattern (%d) does not match number of params (%d)",
                    numPlaceholders, numParams));
        }
        return join(parts, params);
    }

    /**
     * 按 {@code ?} 切分，保留首尾空段，n 个占位符得到 n+1 段。
     */
    static String[] splitOnPlaceholder(String template) {
        return template.split("\\?", -1);
    }

    static String join(String[] parts, Object[] params) {
        StringBuilder query = new StringBuilder();
        for (int i = 0; i < parts.length - 1; i++) {
            query.append(parts[i]);
            try {
                query.append(formatArg(params[i]));
            } catch (ParameterException e) {
                throw new ParameterException("failed to format parameter at index " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        query.append(parts[parts.length - 1]);
        return query.toString();
    }

    public static String formatArg(Object value) {
        if (value instanceof String || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof BigDecimal) {
            return "'" + ((BigDecimal) value).toPlainString() + "'";
        }
        if (value instanceof BigInteger) {
            return "'" + value + "'";
        }
        if (value instanceof byte[]) {
            return "'" + BaseEncoding.base16().lowerCase().encode((byte[]) value) + "'";
        }
        if (value instanceof LocalDateTime) {
            return "'" + TIMESTAMP_FORMATTER.format((LocalDateTime) value) + "'";
        }
        if (value instanceof ZonedDateTime) {
            return "'" + TIMESTAMP_FORMATTER.format(((ZonedDateTime) value).toLocalDateTime()) + "'";
        }
        if (value instanceof OffsetDateTime) {
            return "'" + TIMESTAMP_FORMATTER.format(((OffsetDateTime) value).toLocalDateTime()) + "'";
        }
        if (value instanceof Instant) {
            return "'" + TIMESTAMP_FORMATTER.format(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC)) + "'";
        }
        if (value instanceof Date) {
            // java.sql.Timestamp 也走这里，毫秒以下精度丢弃
            Instant instant = Instant.ofEpochMilli(((Date) value).getTime());
            return "'" + TIMESTAMP_FORMATTER.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC)) + "'";
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long
                || value instanceof Float || value instanceof Double || value instanceof Boolean
                || value instanceof AtomicInteger || value instanceof AtomicLong || value instanceof AtomicBoolean) {
            return value.toString();
        }
        throw ParameterException.of("unsupported type: " + (value == null ? "null" : value.getClass().getName()));
    }

    private static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
