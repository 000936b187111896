package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.model.ControlMode;

/**
 * 按当前值与设定值、死区选择运行模式
 */
public final class ModeSelector {

    private ModeSelector() {
    }

    public static ControlMode select(double current, double setpoint, double deadband) {
        if (current < setpoint - deadband) {
            return ControlMode.HEATING;
        }
        if (current > setpoint + deadband) {
            return ControlMode.COOLING;
        }
        return ControlMode.DEADBAND;
    }
}
