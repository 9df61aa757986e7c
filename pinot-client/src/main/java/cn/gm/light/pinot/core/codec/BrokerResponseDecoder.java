package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.entity.AggregationResult;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.RespSchema;
import cn.gm.light.pinot.entity.ResultTable;
import cn.gm.light.pinot.entity.SelectionResults;
import cn.gm.light.pinot.entity.ServerError;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 broker 返回的 JSON 文档映射为 {@link BrokerResponse}。
 */
public final class BrokerResponseDecoder {

    private BrokerResponseDecoder() {
    }

    public static BrokerResponse decode(byte[] body) {
        return decode(JsonCodec.parseObject(body));
    }

    public static BrokerResponse decode(JSONObject obj) {
        BrokerResponse response = new BrokerResponse();

        Object resultTable = JsonCodec.field(obj, "resultTable");
        if (resultTable instanceof JSONObject) {
            response.setResultTable(decodeResultTable((JSONObject) resultTable));
        }
        Object selection = JsonCodec.field(obj, "selectionResults");
        if (selection instanceof JSONObject) {
            response.setSelectionResults(decodeSelectionResults((JSONObject) selection));
        }
        Object aggregation = JsonCodec.field(obj, "aggregationResults");
        if (aggregation instanceof JSONArray) {
            response.setAggregationResults(decodeAggregationResults((JSONArray) aggregation));
        }
        Object exceptions = JsonCodec.field(obj, "exceptions");
        if (exceptions instanceof JSONArray) {
            List<ServerError> errors = new ArrayList<>();
            for (Object e : (JSONArray) exceptions) {
                if (e instanceof JSONObject) {
                    JSONObject eo = (JSONObject) e;
                    errors.add(new ServerError(intField(eo, "errorCode"), stringField(eo, "message")));
                }
            }
            response.setExceptions(errors);
        }
        Object traceInfo = JsonCodec.field(obj, "traceInfo");
        if (traceInfo instanceof JSONObject) {
            Map<String, String> trace = new HashMap<>();
            for (Map.Entry<String, Object> e : ((JSONObject) traceInfo).entrySet()) {
                trace.put(e.getKey(), e.getValue() == null ? null : e.getValue().toString());
            }
            response.setTraceInfo(trace);
        }

        response.setNumServersQueried(intField(obj, "numServersQueried"));
        response.setNumServersResponded(intField(obj, "numServersResponded"));
        response.setNumSegmentsQueried(intField(obj, "numSegmentsQueried"));
        response.setNumSegmentsProcessed(intField(obj, "numSegmentsProcessed"));
        response.setNumSegmentsMatched(intField(obj, "numSegmentsMatched"));
        response.setNumConsumingSegmentsQueried(intField(obj, "numConsumingSegmentsQueried"));
        response.setNumDocsScanned(longField(obj, "numDocsScanned"));
        response.setNumEntriesScannedInFilter(longField(obj, "numEntriesScannedInFilter"));
        response.setNumEntriesScannedPostFilter(longField(obj, "numEntriesScannedPostFilter"));
        response.setNumGroupsLimitReached(Boolean.TRUE.equals(JsonCodec.field(obj, "numGroupsLimitReached")));
        response.setTotalDocs(longField(obj, "totalDocs"));
        response.setTimeUsedMs(intField(obj, "timeUsedMs"));
        response.setMinConsumingFreshnessTimeMs(longField(obj, "minConsumingFreshnessTimeMs"));
        return response;
    }

    static ResultTable decodeResultTable(JSONObject obj) {
        RespSchema schema = new RespSchema();
        Object dataSchema = JsonCodec.field(obj, "dataSchema");
        if (dataSchema instanceof JSONObject) {
            schema.setColumnDataTypes(stringList(JsonCodec.field((JSONObject) dataSchema, "columnDataTypes")));
            schema.setColumnNames(stringList(JsonCodec.field((JSONObject) dataSchema, "columnNames")));
        }
        Object rows = JsonCodec.field(obj, "rows");
        return new ResultTable(schema, JsonCodec.toRows(rows instanceof JSONArray ? (JSONArray) rows : null));
    }

    private static SelectionResults decodeSelectionResults(JSONObject obj) {
        SelectionResults results = new SelectionResults();
        results.setColumns(stringList(JsonCodec.field(obj, "columns")));
        Object rows = JsonCodec.field(obj, "results");
        results.setResults(JsonCodec.toRows(rows instanceof JSONArray ? (JSONArray) rows : null));
        return results;
    }

    private static List<AggregationResult> decodeAggregationResults(JSONArray array) {
        List<AggregationResult> out = new ArrayList<>();
        for (Object item : array) {
            if (!(item instanceof JSONObject)) {
                continue;
            }
            JSONObject ao = (JSONObject) item;
            AggregationResult result = new AggregationResult();
            result.setFunction(stringField(ao, "function"));
            result.setValue(stringField(ao, "value"));
            result.setGroupByColumns(stringList(JsonCodec.field(ao, "groupByColumns")));
            Object groups = JsonCodec.field(ao, "groupByResult");
            if (groups instanceof JSONArray) {
                List<AggregationResult.GroupValue> groupValues = new ArrayList<>();
                for (Object g : (JSONArray) groups) {
                    if (g instanceof JSONObject) {
                        AggregationResult.GroupValue gv = new AggregationResult.GroupValue();
                        gv.setValue(stringField((JSONObject) g, "value"));
                        gv.setGroup(stringList(JsonCodec.field((JSONObject) g, "group")));
                        groupValues.add(gv);
                    }
                }
                result.setGroupByResult(groupValues);
            }
            out.add(result);
        }
        return out;
    }

    private static List<String> stringList(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof List) {
            for (Object o : (List<?>) raw) {
                out.add(o == null ? null : o.toString());
            }
        }
        return out;
    }

    private static String stringField(JSONObject obj, String name) {
        Object v = JsonCodec.field(obj, name);
        if (v == null) {
            return null;
        }
        if (v instanceof BigDecimal) {
            return ((BigDecimal) v).toPlainString();
        }
        return v.toString();
    }

    private static int intField(JSONObject obj, String name) {
        Object v = JsonCodec.field(obj, name);
        return v instanceof Number ? ((Number) v).intValue() : 0;
    }

    private static long longField(JSONObject obj, String name) {
        Object v = JsonCodec.field(obj, name);
        return v instanceof Number ? ((Number) v).longValue() : 0L;
    }
}
