package cn.gm.light.pinot.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * broker 返回的 exceptions 列表元素
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServerError {
    private int errorCode;
    private String message;
}
