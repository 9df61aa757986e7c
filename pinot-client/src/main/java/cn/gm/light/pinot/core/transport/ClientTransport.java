package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.Request;

/**
 * 向指定 broker 发送一次查询。
 */
public interface ClientTransport {

    /**
     * @param brokerAddress host:port，可带 scheme
     * @throws cn.gm.light.pinot.exception.TransportException 网络失败或非成功状态
     * @throws cn.gm.light.pinot.exception.ProtocolException  响应无法解码
     */
    BrokerResponse execute(String brokerAddress, Request request);
}
