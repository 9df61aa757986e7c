package cn.gm.light.pinot.exception;

/**
 * 预编译语句参数错误
 */
public class ParameterException extends PinotClientException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 400;

    public ParameterException(String message) {
        super(CODE, message);
    }

    public ParameterException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static ParameterException of(String message) {
        return new ParameterException(message);
    }
}
