package cn.gm.light.pinot.core.statement;

import cn.gm.light.pinot.Connection;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.exception.ParameterException;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 参数槽由读写锁保护：set/clear/close 持写锁，execute 持读锁。
 * 与 execute 并发的 set 按后写为准，execute 看到的是它拿到读锁那一刻的参数。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/7 11:22:36
 */
public class DefaultPreparedStatement implements PreparedStatement {
    private static final String CLOSED = "prepared statement is closed";

    private final Connection connection;
    private final String table;
    private final String queryTemplate;
    private final String[] queryParts;
    private final int paramCount;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private Object[] parameters;
    private boolean closed;

    public DefaultPreparedStatement(Connection connection, String table, String queryTemplate) {
        if (table == null || table.isEmpty()) {
            throw ParameterException.of("table name cannot be empty");
        }
        if (queryTemplate == null || queryTemplate.isEmpty()) {
            throw ParameterException.of("query template cannot be empty");
        }
        this.queryParts = QueryFormatter.splitOnPlaceholder(queryTemplate);
        this.paramCount = queryParts.length - 1;
        if (paramCount == 0) {
            throw ParameterException.of("query template must contain at least one parameter placeholder (?)");
        }
        this.connection = connection;
        this.table = table;
        this.queryTemplate = queryTemplate;
        this.parameters = new Object[paramCount];
    }

    @Override
    public void set(int parameterIndex, Object value) {
        rwLock.writeLock().lock();
        try {
            ensureOpen();
            if (parameterIndex < 1 || parameterIndex > paramCount) {
                throw ParameterException.of(String.format("parameter index %d is out of range [1, %d]",
                        parameterIndex, paramCount));
            }
            parameters[parameterIndex - 1] = value;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public BrokerResponse execute() {
        String query;
        rwLock.readLock().lock();
        try {
            ensureOpen();
            for (int i = 0; i < parameters.length; i++) {
                if (parameters[i] == null) {
                    throw ParameterException.of("parameter at index " + (i + 1) + " is not set");
                }
            }
            query = buildQuery(parameters);
        } finally {
            rwLock.readLock().unlock();
        }
        return connection.executeSql(table, query);
    }

    @Override
    public BrokerResponse executeWithParams(Object... params) {
        String query;
        rwLock.readLock().lock();
        try {
            ensureOpen();
            int n = params == null ? 0 : params.length;
            if (n != paramCount) {
                throw ParameterException.of(String.format("expected %d parameters, got %d", paramCount, n));
            }
            query = buildQuery(params);
        } finally {
            rwLock.readLock().unlock();
        }
        return connection.executeSql(table, query);
    }

    @Override
    public String getQuery() {
        return queryTemplate;
    }

    @Override
    public int getParameterCount() {
        return paramCount;
    }

    @Override
    public void clearParameters() {
        rwLock.writeLock().lock();
        try {
            ensureOpen();
            parameters = new Object[paramCount];
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            closed = true;
            parameters = null;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private String buildQuery(Object[] params) {
        try {
            return QueryFormatter.join(queryParts, params);
        } catch (ParameterException e) {
            throw new ParameterException("failed to build query: " + e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw ParameterException.of(CLOSED);
        }
    }
}
