package cn.gm.light.pinot.exception;

/**
 * 传输失败：建连失败、HTTP 非 200、RPC 提交/接收失败、超时或取消。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 */
public class TransportException extends PinotClientException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 502;

    public TransportException(String message) {
        super(CODE, message);
    }

    public TransportException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static TransportException of(String message) {
        return new TransportException(message);
    }
}
