package cn.gm.light.pinot.core.selector;

/**
 * 表名归一化
 */
public final class TableNames {
    public static final String OFFLINE_SUFFIX = "_OFFLINE";
    public static final String REALTIME_SUFFIX = "_REALTIME";

    private TableNames() {
    }

    /**
     * 依次去掉第一处 _OFFLINE 和第一处 _REALTIME
     */
    public static String extractTableName(String table) {
        if (table == null) {
            return "";
        }
        return removeFirst(removeFirst(table, OFFLINE_SUFFIX), REALTIME_SUFFIX);
    }

    private static String removeFirst(String s, String token) {
        int idx = s.indexOf(token);
        if (idx < 0) {
            return s;
        }
        return s.substring(0, idx) + s.substring(idx + token.length());
    }
}
