package com.wangbin.hvac.core.pid;

/**
 * 控制器角色，决定误差符号
 */
public enum ControllerRole {

    HEATING("heating"),
    COOLING("cooling"),
    /** 水温、回路温度等按加热方向计算误差的通用回路 */
    DEFAULT("default");

    private final String code;

    ControllerRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 冷却角色：误差 = 输入 - 设定值；其余角色：误差 = 设定值 - 输入
     */
    public double error(double input, double setpoint) {
        return this == COOLING ? input - setpoint : setpoint - input;
    }
}
