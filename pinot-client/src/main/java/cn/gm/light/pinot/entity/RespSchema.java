package cn.gm.light.pinot.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RespSchema {
    private List<String> columnDataTypes = new ArrayList<>();
    private List<String> columnNames = new ArrayList<>();
}
