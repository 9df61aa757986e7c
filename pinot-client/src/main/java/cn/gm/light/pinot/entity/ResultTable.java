package cn.gm.light.pinot.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL 查询结果表。行可能比 schema 短，缺失的尾部列按 {@link Value#NULL} 读取。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/2 11:40:21
 */
@Data
@NoArgsConstructor
public class ResultTable {
    private RespSchema dataSchema = new RespSchema();
    private List<List<Value>> rows = new ArrayList<>();

    public ResultTable(RespSchema dataSchema, List<List<Value>> rows) {
        this.dataSchema = dataSchema;
        this.rows = rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return dataSchema.getColumnNames().size();
    }

    public String getColumnName(int columnIndex) {
        return dataSchema.getColumnNames().get(columnIndex);
    }

    public String getColumnDataType(int columnIndex) {
        return dataSchema.getColumnDataTypes().get(columnIndex);
    }

    public Value get(int rowIndex, int columnIndex) {
        List<Value> row = rows.get(rowIndex);
        if (columnIndex >= row.size()) {
            return Value.NULL;
        }
        Value v = row.get(columnIndex);
        return v == null ? Value.NULL : v;
    }

    public String getString(int rowIndex, int columnIndex) {
        return get(rowIndex, columnIndex).asString();
    }

    public int getInt(int rowIndex, int columnIndex) {
        return get(rowIndex, columnIndex).asInt();
    }

    public long getLong(int rowIndex, int columnIndex) {
        return get(rowIndex, columnIndex).asLong();
    }

    public float getFloat(int rowIndex, int columnIndex) {
        return get(rowIndex, columnIndex).asFloat();
    }

    public double getDouble(int rowIndex, int columnIndex) {
        return get(rowIndex, columnIndex).asDouble();
    }
}
