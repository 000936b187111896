package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidController;
import com.wangbin.hvac.core.pid.PidParams;
import com.wangbin.hvac.core.pid.PidResult;
import com.wangbin.hvac.core.pid.PidState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抽象设备控制策略
 *
 * 职责：
 * 1. 在策略边界捕获全部异常，转换为安全关闭命令
 * 2. 统一PID计算与设定值跳变时的积分清零
 * 3. 记录执行统计
 */
@Slf4j
@Getter
public abstract class AbstractEquipmentStrategy implements EquipmentStrategy {

    protected final EquipmentType type;
    protected final String description;

    protected final AtomicLong executionCount = new AtomicLong(0);
    protected final AtomicLong safeOffCount = new AtomicLong(0);
    protected final AtomicLong safetyTripCount = new AtomicLong(0);

    protected AbstractEquipmentStrategy(EquipmentType type, String description) {
        this.type = type;
        this.description = description;
    }

    @Override
    public final ControlResult execute(ControlContext context) {
        executionCount.incrementAndGet();
        try {
            ControlResult result = doExecute(context);
            if (result.isSafetyTrip()) {
                safetyTripCount.incrementAndGet();
                log.warn("{} {} 安全联锁动作: {}", description, context.getEquipmentId(), result.getMode());
            }
            return result;
        } catch (Exception e) {
            safeOffCount.incrementAndGet();
            EngineException wrapped = EngineException.strategyException(
                    description + "执行异常", context.getLocationId(), context.getEquipmentId(), e);
            log.error("{} {} 执行异常，输出安全关闭命令", description, context.getEquipmentId(), wrapped);
            return safeOff(context, e);
        }
    }

    /**
     * 具体控制逻辑
     */
    protected abstract ControlResult doExecute(ControlContext context) throws Exception;

    /**
     * 安全关闭命令集：停机、所有阀门关闭、风机停止
     */
    protected ActuatorCommands safeOffCommands() {
        return new ActuatorCommands()
                .flag("unitEnable", false)
                .flag("fanEnabled", false)
                .percent("heatingValvePosition", 0)
                .percent("coolingValvePosition", 0)
                .percent("outdoorDamperPosition", 0);
    }

    private ControlResult safeOff(ControlContext context, Exception cause) {
        return ControlResult.builder()
                .locationId(context.getLocation() != null ? context.getLocationId() : null)
                .equipmentId(context.getEquipment() != null ? context.getEquipmentId() : null)
                .equipmentType(type)
                .mode(ControlMode.SAFE_OFF)
                .commands(safeOffCommands())
                .diagnostics(new LinkedHashMap<>(Map.of("error", String.valueOf(cause.getMessage()))))
                .build();
    }

    /**
     * 运行PID回路；PID关闭时退化为 clamp(error * 10, 0, 100)
     */
    protected PidResult runPid(ControlContext context, ControllerRole role, double input, double setpoint,
                               double dt) {
        PidParams params = context.getLocation().pidFor(role);
        PidState prepared = PidController.prepareState(context.pidState(role), setpoint);
        if (!params.isEnabled()) {
            double error = role.error(input, setpoint);
            double output = PidController.fallbackOutput(error);
            PidState unchanged = prepared.toBuilder()
                    .previousError(error)
                    .lastOutput(output)
                    .lastSetpoint(setpoint)
                    .updatedAt(System.currentTimeMillis())
                    .build();
            return new PidResult(output, output, error, output, 0, 0, unchanged);
        }
        return PidController.compute(input, setpoint, params, dt, role, prepared);
    }

    protected ControlResult.ControlResultBuilder resultBuilder(ControlContext context) {
        return ControlResult.builder()
                .locationId(context.getLocationId())
                .equipmentId(context.getEquipmentId())
                .equipmentType(type);
    }
}
