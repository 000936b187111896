package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentMemory;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidResult;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.staging.StagingConfig;
import com.wangbin.hvac.core.staging.StagingCoordinator;
import com.wangbin.hvac.core.staging.StagingDecision;
import com.wangbin.hvac.core.staging.StagingState;
import com.wangbin.hvac.core.strategy.AbstractEquipmentStrategy;
import com.wangbin.hvac.core.strategy.ControlContext;
import com.wangbin.hvac.core.strategy.ResolvedSetpoint;
import com.wangbin.hvac.core.strategy.SensorResolver;
import com.wangbin.hvac.core.strategy.Sensors;
import com.wangbin.hvac.core.strategy.SetpointResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 冷水机组控制策略
 *
 * 室外温度低于闭锁值时禁止运行（可配置回差），运行时以冷冻水供水温度做冷却PID，
 * 输出容量换算为所需级数后交给分级协调器，加减级受延时与最小运行时间约束。
 */
@Slf4j
@Component
public class ChillerStrategy extends AbstractEquipmentStrategy {

    static final String MEMORY_OAT_ENABLED = "oatEnabled";
    private static final double MIN_WATER_SETPOINT = 38;
    private static final double MAX_WATER_SETPOINT = 60;

    private final StagingCoordinator coordinator;

    public ChillerStrategy(StagingCoordinator coordinator) {
        super(EquipmentType.CHILLER, "冷水机组");
        this.coordinator = coordinator;
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile.ChillerTuning tuning = context.getLocation().getChiller();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(context.getEquipmentId());
        SensorResolver resolver = new SensorResolver(context.getLocation(), context.getEquipment());
        EquipmentMemory memory = context.memoryOrEmpty();

        ResolvedSetpoint setpoint = SetpointResolver.resolve(settings, null, null, null,
                tuning.getDefaultSetpoint(), MIN_WATER_SETPOINT, MAX_WATER_SETPOINT);

        Optional<Double> outdoor = resolver.find(context.getTelemetry(), Sensors.OUTDOOR_TEMP);
        boolean oatEnabled = oatPermits(tuning, outdoor, memory.getFlag(MEMORY_OAT_ENABLED, false),
                context.getEquipmentId());
        EquipmentMemory nextMemory = memory.withFlag(MEMORY_OAT_ENABLED, oatEnabled);

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        outdoor.ifPresent(value -> diagnostics.put("outdoorTemp", value));
        diagnostics.put("oatEnabled", oatEnabled);

        StagingState current = context.getStagingState();
        if (current == null) {
            current = StagingState.initial(context.getEquipmentId(), tuning.getMaxStages());
        }

        ControlMode mode;
        int required;
        Map<ControllerRole, PidState> states = new EnumMap<>(ControllerRole.class);
        if (!settings.isEnabledOrDefault()) {
            mode = ControlMode.OFF;
            required = 0;
        } else if (!oatEnabled) {
            mode = ControlMode.LOCKOUT;
            required = 0;
        } else {
            double supply = resolver.find(context.getTelemetry(), Sensors.WATER_SUPPLY_TEMP)
                    .orElse(setpoint.getValue());
            PidResult pid = runPid(context, ControllerRole.COOLING, supply, setpoint.getValue(),
                    context.getLocation().getZone().getPidDt());
            double capacity = pid.getOutput();
            // 运行期间至少一级
            required = Math.max(1, StagingCoordinator.requiredStages(capacity / 100.0, tuning.getMaxStages()));
            mode = ControlMode.COOLING;
            states.put(ControllerRole.COOLING, pid.getNewState());
            diagnostics.put("supplyTemp", supply);
            diagnostics.put("capacity", capacity);
        }

        // 关机与闭锁同样按减级延时与最小运行时间逐级卸载
        StagingDecision decision = coordinator.evaluate(StagingConfig.from(tuning), current, required,
                context.getNow(), false);
        StagingState next = decision.getState();
        if (next.getGroupId() == null) {
            next.setGroupId(context.getEquipmentId());
        }
        int stage = next.activeCount();
        diagnostics.put("requiredStages", required);
        diagnostics.put("stagingAction", decision.getAction().name());
        diagnostics.put("stagingReason", decision.getReason());

        return build(context, mode, setpoint, mode == ControlMode.COOLING || stage > 0, stage, nextMemory, states,
                next, diagnostics);
    }

    /**
     * 室外温度闭锁：回差模式下 ≥enableOat 开启、≤disableOat 关闭，中间保持；否则 ≥lockoutOat 开启
     */
    static boolean oatPermits(LocationProfile.ChillerTuning tuning, Optional<Double> outdoor, boolean previous,
                              String equipmentId) {
        if (outdoor.isEmpty()) {
            log.warn("冷水机组 {} 未找到室外温度，保持上次闭锁状态: {}", equipmentId, previous);
            return previous;
        }
        double oat = outdoor.get();
        if (!tuning.isHysteresis()) {
            return oat >= tuning.getLockoutOat();
        }
        if (oat >= tuning.getEnableOat()) {
            return true;
        }
        if (oat <= tuning.getDisableOat()) {
            return false;
        }
        return previous;
    }

    private ControlResult build(ControlContext context, ControlMode mode, ResolvedSetpoint setpoint, boolean enable,
                                int stage, EquipmentMemory memory, Map<ControllerRole, PidState> states,
                                StagingState staging, Map<String, Object> diagnostics) {
        ActuatorCommands commands = new ActuatorCommands()
                .flag("chillerEnable", enable)
                .integer("chillerStage", stage)
                .number("chillerSetpoint", setpoint.getValue())
                .number("cwTempSetpoint", setpoint.getValue());
        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .nextPidStates(states)
                .nextStagingState(staging)
                .nextMemory(memory)
                .diagnostics(diagnostics)
                .build();
    }
}
