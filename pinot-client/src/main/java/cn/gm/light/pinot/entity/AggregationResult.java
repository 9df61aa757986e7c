package cn.gm.light.pinot.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * PQL 聚合结果
 */
@Data
public class AggregationResult {
    private String function;
    private String value;
    private List<String> groupByColumns = new ArrayList<>();
    private List<GroupValue> groupByResult = new ArrayList<>();

    @Data
    public static class GroupValue {
        private String value;
        private List<String> group = new ArrayList<>();
    }
}
