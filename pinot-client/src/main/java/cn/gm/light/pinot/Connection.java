package cn.gm.light.pinot;

import cn.gm.light.pinot.core.selector.BrokerSelector;
import cn.gm.light.pinot.core.statement.DefaultPreparedStatement;
import cn.gm.light.pinot.core.statement.PreparedStatement;
import cn.gm.light.pinot.core.statement.QueryFormatter;
import cn.gm.light.pinot.core.transport.ClientTransport;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.Request;
import cn.gm.light.pinot.enums.QueryFormat;
import cn.gm.light.pinot.exception.SelectionException;
import cn.gm.light.pinot.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

/**
 * 查询入口，通常由 {@link ConnectionFactory} 创建。
 *
 * <p>每次查询先由 {@link BrokerSelector} 选出 broker，再交给 {@link ClientTransport} 执行。
 * 可被多个线程共享；trace 与 useMultistageEngine 开关对之后发起的查询生效。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/7 15:03:18
 */
@Slf4j
public class Connection implements AutoCloseable {
    private final ClientTransport transport;
    private final BrokerSelector brokerSelector;
    private volatile boolean trace;
    private volatile boolean useMultistageEngine;

    public Connection(ClientTransport transport, BrokerSelector brokerSelector) {
        this.transport = transport;
        this.brokerSelector = brokerSelector;
    }

    public BrokerResponse executeSql(String table, String query) {
        return execute(table, query, QueryFormat.SQL);
    }

    public BrokerResponse executePql(String table, String query) {
        return execute(table, query, QueryFormat.PQL);
    }

    /**
     * 用参数替换模板中的 {@code ?} 后执行，参数个数不匹配时不会发起请求。
     */
    public BrokerResponse executeSqlWithParams(String table, String queryPattern, Object... params) {
        String query = QueryFormatter.formatQuery(queryPattern, params);
        return executeSql(table, query);
    }

    public PreparedStatement prepare(String table, String queryTemplate) {
        return new DefaultPreparedStatement(this, table, queryTemplate);
    }

    private BrokerResponse execute(String table, String query, QueryFormat format) {
        String brokerAddress;
        try {
            brokerAddress = brokerSelector.selectBroker(table);
        } catch (RuntimeException e) {
            throw new SelectionException("unable to find an available broker for table " + table
                    + ", Error: " + e.getMessage(), e);
        }
        Request request = Request.builder()
                .queryFormat(format)
                .query(query)
                .trace(trace)
                .useMultistageEngine(useMultistageEngine)
                .build();
        try {
            return transport.execute(brokerAddress, request);
        } catch (RuntimeException e) {
            log.debug("Query failed on broker {}: {}", brokerAddress, query, e);
            throw new TransportException("caught exception to execute " + format.name() + " query " + query
                    + ", Error: " + e.getMessage(), e);
        }
    }

    public void openTrace() {
        this.trace = true;
    }

    public void closeTrace() {
        this.trace = false;
    }

    public void useMultistageEngine(boolean useMultistageEngine) {
        this.useMultistageEngine = useMultistageEngine;
    }

    public boolean isTrace() {
        return trace;
    }

    public boolean isUseMultistageEngine() {
        return useMultistageEngine;
    }

    /**
     * 停止 broker 选择器的后台任务
     */
    @Override
    public void close() {
        brokerSelector.stop();
    }

    BrokerSelector getBrokerSelector() {
        return brokerSelector;
    }

    ClientTransport getTransport() {
        return transport;
    }
}
