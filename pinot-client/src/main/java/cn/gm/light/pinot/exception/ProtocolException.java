package cn.gm.light.pinot.exception;

public class ProtocolException extends PinotClientException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 500;

    public ProtocolException(String message) {
        super(CODE, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static ProtocolException of(String message) {
        return new ProtocolException(message);
    }
}
