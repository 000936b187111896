package com.wangbin.hvac.core.pid;

import com.wangbin.hvac.common.utils.ValueUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * PID控制器
 *
 * 纯函数实现：不修改传入状态，由调用方持久化返回的新状态。
 * 积分按 error * dt 累加后限幅到 [-maxIntegral, maxIntegral]。
 */
@Slf4j
public final class PidController {

    /** 设定值变化超过该值时清零积分项 */
    public static final double SETPOINT_RESET_THRESHOLD = 0.5;

    /** PID关闭时比例退化控制的增益 */
    public static final double FALLBACK_GAIN = 10.0;

    private PidController() {
    }

    public static PidResult compute(double input, double setpoint, PidParams params, double dt,
                                    ControllerRole role, PidState state) {
        PidState previous = state != null ? state : PidState.initial();
        double error = role.error(input, setpoint);

        double integral = previous.getIntegral();
        double derivative = 0;
        if (dt > 0) {
            integral = ValueUtils.clamp(integral + error * dt, -params.getMaxIntegral(), params.getMaxIntegral());
            derivative = (error - previous.getPreviousError()) / dt;
        }

        double proportionalTerm = params.getKp() * error;
        double integralTerm = params.getKi() * integral;
        double derivativeTerm = params.getKd() * derivative;

        double raw = ValueUtils.clamp(proportionalTerm + integralTerm + derivativeTerm,
                params.getOutputMin(), params.getOutputMax());
        double output = params.isReverseActing() ? params.getOutputMax() - raw : raw;

        PidState next = PidState.builder()
                .integral(integral)
                .previousError(error)
                .lastOutput(output)
                .lastSetpoint(setpoint)
                .updatedAt(System.currentTimeMillis())
                .build();

        return new PidResult(output, raw, error, proportionalTerm, integralTerm, derivativeTerm, next);
    }

    /**
     * 设定值跳变超过阈值时只清零积分项，其余字段保留
     */
    public static PidState prepareState(PidState state, double setpoint) {
        if (state == null) {
            return PidState.initial();
        }
        PidState copy = state.copy();
        Double last = state.getLastSetpoint();
        if (last != null && Math.abs(setpoint - last) > SETPOINT_RESET_THRESHOLD) {
            log.debug("设定值由 {} 变为 {}，清零积分项", last, setpoint);
            copy.setIntegral(0);
        }
        return copy;
    }

    /**
     * PID关闭时的退化比例控制：clamp(error * 10, 0, 100)
     */
    public static double fallbackOutput(double error) {
        return ValueUtils.clampPercent(error * FALLBACK_GAIN);
    }
}
