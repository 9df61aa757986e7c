package cn.gm.light.pinot.exception;

/**
 * broker 选择失败：协调服务连接/读取失败、表不存在、候选 broker 为空。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 */
public class SelectionException extends PinotClientException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 503;

    public SelectionException(String message) {
        super(CODE, message);
    }

    public SelectionException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static SelectionException of(String message) {
        return new SelectionException(message);
    }
}
