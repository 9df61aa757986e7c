package cn.gm.light.pinot.entity;

import cn.gm.light.pinot.enums.QueryFormat;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次查询请求，构建后不可变。
 */
@Getter
@Builder
@ToString
public class Request {
    private final QueryFormat queryFormat;
    private final String query;
    private final boolean trace;
    private final boolean useMultistageEngine;
}
