package cn.gm.light.pinot.enums;

public enum QueryFormat {
    SQL("sql"),
    PQL("pql")
    ;

    private final String key;

    QueryFormat(String key) {
        this.key = key;
    }

    /**
     * 请求体中携带查询文本的字段名
     */
    public String getKey() {
        return key;
    }
}
