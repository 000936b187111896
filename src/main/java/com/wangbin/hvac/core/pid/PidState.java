package com.wangbin.hvac.core.pid;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个控制器回路的持久化状态，按 (设备, 角色) 保存
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PidState {

    private double integral;
    private double previousError;
    private double lastOutput;
    private Double lastSetpoint;
    private long updatedAt;

    public static PidState initial() {
        return new PidState();
    }

    public PidState copy() {
        return toBuilder().build();
    }
}
