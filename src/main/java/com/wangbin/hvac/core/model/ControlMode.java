package com.wangbin.hvac.core.model;

/**
 * 控制模式。安全类模式与正常自动控制输出区分上报。
 */
public enum ControlMode {
    OFF(false),
    HEATING(false),
    COOLING(false),
    DEADBAND(false),
    /** 非温控类设备的正常运行 */
    RUNNING(false),
    /** 非温控类设备已满足需求、待机 */
    STANDBY(false),
    LOCKOUT(false),
    FREEZE_PROTECTION(true),
    HIGH_LIMIT(true),
    EMERGENCY_SHUTDOWN(true),
    /** 策略异常后的安全关闭 */
    SAFE_OFF(true);

    private final boolean safety;

    ControlMode(boolean safety) {
        this.safety = safety;
    }

    public boolean isSafety() {
        return safety;
    }
}
