package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.model.ControlMode;

import java.util.Optional;

/**
 * 防冻与高温限值联锁，在正常控制之前判定
 */
public final class SafetyInterlock {

    private SafetyInterlock() {
    }

    /**
     * 低于防冻阈值返回 FREEZE_PROTECTION，高于高限返回 HIGH_LIMIT
     */
    public static Optional<ControlMode> check(Double airTemp, double freezeThreshold, double highLimit) {
        if (airTemp == null || !Double.isFinite(airTemp)) {
            return Optional.empty();
        }
        if (airTemp < freezeThreshold) {
            return Optional.of(ControlMode.FREEZE_PROTECTION);
        }
        if (airTemp > highLimit) {
            return Optional.of(ControlMode.HIGH_LIMIT);
        }
        return Optional.empty();
    }

    /**
     * 新风阀二位控制：lowBound < 室外温度 <= highBound 时开启
     */
    public static boolean damperOpen(double outdoorTemp, double lowBound, double highBound) {
        return outdoorTemp > lowBound && outdoorTemp <= highBound;
    }
}
