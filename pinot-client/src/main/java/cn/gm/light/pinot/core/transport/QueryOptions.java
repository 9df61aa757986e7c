package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.entity.Request;
import cn.gm.light.pinot.enums.QueryFormat;

import java.util.StringJoiner;

/**
 * 拼接 queryOptions，形如 {@code groupByMode=sql;responseFormat=sql;useMultistageEngine=true;timeoutMs=1000}
 */
final class QueryOptions {

    private QueryOptions() {
    }

    static String build(Request request, long timeoutMs) {
        StringJoiner options = new StringJoiner(";");
        if (request.getQueryFormat() == QueryFormat.SQL) {
            options.add("groupByMode=sql;responseFormat=sql");
        }
        if (request.isUseMultistageEngine()) {
            options.add("useMultistageEngine=true");
        }
        if (timeoutMs > 0) {
            options.add("timeoutMs=" + timeoutMs);
        }
        return options.toString();
    }
}
