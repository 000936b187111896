package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.common.utils.ValueUtils;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidResult;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.strategy.AbstractEquipmentStrategy;
import com.wangbin.hvac.core.strategy.ControlContext;
import com.wangbin.hvac.core.strategy.ModeSelector;
import com.wangbin.hvac.core.strategy.ResolvedSetpoint;
import com.wangbin.hvac.core.strategy.SafetyInterlock;
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
 * 风机盘管控制策略
 *
 * 执行顺序：防冻/高限联锁 → 启停 → 设定值解析 → 模式选择 → PID → 手动阀门覆盖
 */
@Slf4j
@Component
public class FanCoilStrategy extends AbstractEquipmentStrategy {

    public static final String HEATING_VALVE = "heatingValvePosition";
    public static final String COOLING_VALVE = "coolingValvePosition";
    public static final String DAMPER = "outdoorDamperPosition";

    public FanCoilStrategy() {
        super(EquipmentType.FAN_COIL, "风机盘管");
    }

    protected FanCoilStrategy(EquipmentType type, String description) {
        super(type, description);
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile location = context.getLocation();
        LocationProfile.ZoneTuning zone = location.getZone();
        TelemetrySnapshot telemetry = context.getTelemetry();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(context.getEquipmentId());
        SensorResolver resolver = new SensorResolver(location, context.getEquipment());

        Optional<Double> outdoor = resolver.find(telemetry, Sensors.OUTDOOR_TEMP);
        ResolvedSetpoint setpoint = SetpointResolver.resolve(settings, zone.getFixedSetpoint(), location.getOar(),
                outdoor.orElse(null), zone.getDefaultSetpoint(), zone.getMinSetpoint(), zone.getMaxSetpoint());

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        Optional<Double> safetyTemp = safetyTemperature(resolver, telemetry);
        safetyTemp.ifPresent(value -> diagnostics.put("safetyTemp", value));
        Optional<ControlMode> safety = SafetyInterlock.check(safetyTemp.orElse(null),
                zone.getFreezeThreshold(), zone.getHighLimit());
        if (safety.isPresent()) {
            return safetyResult(context, safety.get(), setpoint, diagnostics);
        }

        if (!settings.isEnabledOrDefault()) {
            ActuatorCommands commands = new ActuatorCommands()
                    .flag("unitEnable", false)
                    .flag("fanEnabled", false)
                    .text("fanSpeed", "off")
                    .percent(HEATING_VALVE, 0)
                    .percent(COOLING_VALVE, 0)
                    .percent(DAMPER, 0)
                    .number("temperatureSetpoint", setpoint.getValue());
            return resultBuilder(context)
                    .mode(ControlMode.OFF)
                    .effectiveSetpoint(setpoint.getValue())
                    .setpointSource(setpoint.getSource())
                    .commands(commands)
                    .diagnostics(diagnostics)
                    .build();
        }

        double current = resolver.resolve(telemetry, Sensors.SPACE_TEMP);
        double damper = damperPosition(context, resolver, outdoor);
        ControlMode mode = ModeSelector.select(current, setpoint.getValue(), zone.getDeadband());
        diagnostics.put("currentTemp", current);
        diagnostics.put("error", ValueUtils.round1(current - setpoint.getValue()));

        Map<ControllerRole, PidState> nextStates = new EnumMap<>(ControllerRole.class);
        double heating = 0;
        double cooling = 0;
        String fanSpeed = zone.getIdleFanSpeed();
        if (mode == ControlMode.HEATING) {
            PidResult pid = runPid(context, ControllerRole.HEATING, current, setpoint.getValue(), zone.getPidDt());
            heating = pid.getOutput();
            nextStates.put(ControllerRole.HEATING, pid.getNewState());
            fanSpeed = zone.getActiveFanSpeed();
        } else if (mode == ControlMode.COOLING) {
            PidResult pid = runPid(context, ControllerRole.COOLING, current, setpoint.getValue(), zone.getPidDt());
            cooling = pid.getOutput();
            nextStates.put(ControllerRole.COOLING, pid.getNewState());
            fanSpeed = zone.getActiveFanSpeed();
        }

        heating = manualValve(settings, "heatingValve", heating, diagnostics);
        cooling = manualValve(settings, "coolingValve", cooling, diagnostics);

        ActuatorCommands commands = new ActuatorCommands()
                .flag("unitEnable", true)
                .flag("fanEnabled", true)
                .text("fanSpeed", fanSpeed)
                .percent(HEATING_VALVE, heating)
                .percent(COOLING_VALVE, cooling)
                .percent(DAMPER, damper)
                .number("temperatureSetpoint", setpoint.getValue());

        log.debug("{} {}: 当前 {}°F, 设定 {}°F({}), 模式 {}, 热阀 {}%, 冷阀 {}%",
                description, context.getEquipmentId(), current, setpoint.getValue(), setpoint.getSource(),
                mode, heating, cooling);

        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .nextPidStates(nextStates)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * 防冻/高限判定使用的温度，风机盘管取送风温度
     */
    protected Optional<Double> safetyTemperature(SensorResolver resolver, TelemetrySnapshot telemetry) {
        return resolver.find(telemetry, Sensors.SUPPLY_TEMP);
    }

    /**
     * 新风阀位置：室外温度缺失时关闭
     */
    protected double damperPosition(ControlContext context, SensorResolver resolver, Optional<Double> outdoor) {
        LocationProfile.ZoneTuning zone = context.getLocation().getZone();
        if (outdoor.isEmpty()) {
            return 0;
        }
        return SafetyInterlock.damperOpen(outdoor.get(), zone.getDamperLowBound(), zone.getDamperHighBound())
                ? zone.getDamperOpenPosition() : 0;
    }

    private ControlResult safetyResult(ControlContext context, ControlMode mode, ResolvedSetpoint setpoint,
                                       Map<String, Object> diagnostics) {
        boolean freeze = mode == ControlMode.FREEZE_PROTECTION;
        ActuatorCommands commands = new ActuatorCommands()
                .flag("unitEnable", true)
                .flag("fanEnabled", true)
                .text("fanSpeed", context.getLocation().getZone().getActiveFanSpeed())
                .percent(HEATING_VALVE, freeze ? 100 : 0)
                .percent(COOLING_VALVE, freeze ? 0 : 100)
                .percent(DAMPER, 0)
                .number("temperatureSetpoint", setpoint.getValue());
        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * 手动阀门：xxxMode=manual 时使用 xxxPosition，优先于PID
     */
    private double manualValve(UserSettings settings, String valve, double automatic,
                               Map<String, Object> diagnostics) {
        Object mode = settings.getOverrides().get(valve + "Mode");
        if (mode == null || !"manual".equalsIgnoreCase(mode.toString())) {
            return automatic;
        }
        Optional<Double> position = settings.overrideDouble(valve + "Position");
        if (position.isEmpty()) {
            log.warn("设备 {} {} 为手动模式但未提供开度，保持自动输出", settings.getEquipmentId(), valve);
            return automatic;
        }
        diagnostics.put(valve + "Manual", true);
        return position.get();
    }
}
