package com.wangbin.hvac.core.processor;

/**
 * 控制周期监听器，在结果发布后收到通知。实现抛出的异常只记录，不影响控制周期。
 */
public interface ControlCycleListener {

    void onControlCycle(ControlCycleEvent event);
}
