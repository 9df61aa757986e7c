package cn.gm.light.pinot.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * PQL selection 结果
 */
@Data
public class SelectionResults {
    private List<String> columns = new ArrayList<>();
    private List<List<Value>> results = new ArrayList<>();
}
