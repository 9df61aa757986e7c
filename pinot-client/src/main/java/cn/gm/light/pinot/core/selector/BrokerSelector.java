package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.core.LifeCycle;

/**
 * 根据表名选出一个可用 broker。
 *
 * <p>实现只有三种：{@link SimpleBrokerSelector} 静态列表、{@link DynamicBrokerSelector} 协调服务推送、
 * {@link ControllerBasedBrokerSelector} controller 轮询。
 */
public interface BrokerSelector extends LifeCycle {

    /**
     * @param table 表名，可带 _OFFLINE / _REALTIME 后缀；为空表示任意 broker
     * @return host:port 形式的 broker 地址
     * @throws cn.gm.light.pinot.exception.PinotClientException 无可用 broker 时
     */
    String selectBroker(String table);
}
