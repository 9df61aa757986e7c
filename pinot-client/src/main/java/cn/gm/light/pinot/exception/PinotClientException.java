package cn.gm.light.pinot.exception;

/**
 * 客户端异常基类，所有同步调用路径上的失败都以它的子类抛出。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/2 10:12:40
 */
public class PinotClientException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final int code;

    public PinotClientException(int code, String message) {
        super(message);
        this.code = code;
    }

    public PinotClientException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    // 快速构建方法（带默认错误码）
    public static PinotClientException of(String message) {
        return new PinotClientException(500, message);
    }

    public int getCode() {
        return code;
    }
}
