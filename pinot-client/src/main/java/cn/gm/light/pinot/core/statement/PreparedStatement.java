package cn.gm.light.pinot.core.statement;

import cn.gm.light.pinot.entity.BrokerResponse;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 带 {@code ?} 占位符的查询，可多次绑定参数执行。参数下标从 1 开始。
 *
 * <p>所有方法在 {@link #close()} 之后抛出 {@link cn.gm.light.pinot.exception.ParameterException}，
 * {@link #getQuery()} 与 {@link #getParameterCount()} 除外。
 */
public interface PreparedStatement extends AutoCloseable {

    default void setString(int parameterIndex, String value) {
        set(parameterIndex, value);
    }

    default void setInt(int parameterIndex, int value) {
        set(parameterIndex, value);
    }

    default void setLong(int parameterIndex, long value) {
        set(parameterIndex, value);
    }

    default void setFloat(int parameterIndex, float value) {
        set(parameterIndex, value);
    }

    default void setDouble(int parameterIndex, double value) {
        set(parameterIndex, value);
    }

    default void setBoolean(int parameterIndex, boolean value) {
        set(parameterIndex, value);
    }

    default void setBigDecimal(int parameterIndex, BigDecimal value) {
        set(parameterIndex, value);
    }

    default void setBigInteger(int parameterIndex, BigInteger value) {
        set(parameterIndex, value);
    }

    default void setBytes(int parameterIndex, byte[] value) {
        set(parameterIndex, value);
    }

    /**
     * 接受 LocalDateTime、ZonedDateTime、OffsetDateTime、Instant、java.util.Date 及其子类
     */
    default void setTimestamp(int parameterIndex, Object value) {
        set(parameterIndex, value);
    }

    void set(int parameterIndex, Object value);

    BrokerResponse execute();

    /**
     * 直接使用给定参数执行，不读也不改已绑定的参数。
     */
    BrokerResponse executeWithParams(Object... params);

    String getQuery();

    int getParameterCount();

    void clearParameters();

    @Override
    void close();
}
