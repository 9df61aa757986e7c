package cn.gm.light.pinot.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * broker 响应。一次成功调用最多填充 resultTable、selectionResults、aggregationResults 之一；
 * exceptions 非空表示服务端查询失败，此时结果可能是部分的。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/2 11:21:09
 */
@Data
public class BrokerResponse {
    private List<AggregationResult> aggregationResults;
    private SelectionResults selectionResults;
    private ResultTable resultTable;
    private List<ServerError> exceptions = new ArrayList<>();
    private Map<String, String> traceInfo = new HashMap<>();
    private int numServersQueried;
    private int numServersResponded;
    private int numSegmentsQueried;
    private int numSegmentsProcessed;
    private int numSegmentsMatched;
    private int numConsumingSegmentsQueried;
    private long numDocsScanned;
    private long numEntriesScannedInFilter;
    private long numEntriesScannedPostFilter;
    private boolean numGroupsLimitReached;
    private long totalDocs;
    private int timeUsedMs;
    private long minConsumingFreshnessTimeMs;

    public boolean hasExceptions() {
        return exceptions != null && !exceptions.isEmpty();
    }
}
