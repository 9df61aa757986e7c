package cn.gm.light.pinot.core;

/**
 * 带后台任务组件的生命周期
 */
public interface LifeCycle {

    void init();

    // 停止后台任务并释放资源，可重复调用
    default void stop() {
    }
}
