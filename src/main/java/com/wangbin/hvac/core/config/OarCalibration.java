package com.wangbin.hvac.core.config;

import com.wangbin.hvac.common.utils.ValueUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 室外温度补偿标定：(minOat → maxSetpoint) 与 (maxOat → minSetpoint) 两点线性插值，范围外限幅
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OarCalibration {

    private boolean enabled = true;
    private double minOat = 32;
    private double maxSetpoint = 76;
    private double maxOat = 74;
    private double minSetpoint = 71.5;

    public static OarCalibration of(double minOat, double maxSetpoint, double maxOat, double minSetpoint) {
        return new OarCalibration(true, minOat, maxSetpoint, maxOat, minSetpoint);
    }

    public double calculate(double outdoorTemp) {
        if (outdoorTemp <= minOat) {
            return maxSetpoint;
        }
        if (outdoorTemp >= maxOat) {
            return minSetpoint;
        }
        double ratio = (outdoorTemp - minOat) / (maxOat - minOat);
        double setpoint = maxSetpoint - ratio * (maxSetpoint - minSetpoint);
        return ValueUtils.clamp(setpoint, Math.min(minSetpoint, maxSetpoint), Math.max(minSetpoint, maxSetpoint));
    }
}
