package cn.gm.light.pinot.exception;

/**
 * 配置错误：未指定 broker 来源、静态列表为空、controller 地址协议不支持、TLS 证书不可用等。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 */
public class ConfigurationException extends PinotClientException {
    private static final long serialVersionUID = 1L;
    public static final int CODE = 400;

    public ConfigurationException(String message) {
        super(CODE, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static ConfigurationException of(String message) {
        return new ConfigurationException(message);
    }
}
