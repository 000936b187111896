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
 * 蒸汽换热器控制策略
 *
 * 依赖热水泵运行，供水设定值按室外温度补偿，补偿到停机温度以上关闭。
 * 供水超过安全切断温度时立即关阀。正常运行时加热PID输出按主/副阀容量比例分段：
 * 先开主阀，主阀全开后再调节副阀。
 */
@Slf4j
@Component
public class SteamBundleStrategy extends AbstractEquipmentStrategy {

    private static final double MIN_WATER_SETPOINT = 80;
    private static final double MAX_WATER_SETPOINT = 180;

    static final String[] PUMP_AMP_KEYS = {
            "HWPump1Amps", "hwPump1Amps", "HWPump-1 Amps", "hwPump-1 Amps", "hwPump1_Amps",
            "HWPump2Amps", "hwPump2Amps", "HWPump-2 Amps", "hwPump-2 Amps", "hwPump2_Amps",
            "PumpAmps", "pumpAmps", "Pump1Amps", "pump1Amps", "Pump2Amps", "pump2Amps"};
    static final String[] PUMP_STATUS_KEYS = {
            "PumpStatus", "pumpStatus", "PumpRunning", "pumpRunning", "HWPumpStatus", "hwPumpStatus",
            "Pump1Status", "pump1Status", "Pump2Status", "pump2Status"};

    public SteamBundleStrategy() {
        super(EquipmentType.STEAM_BUNDLE, "蒸汽换热器");
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile.SteamBundleTuning tuning = context.getLocation().getSteamBundle();
        TelemetrySnapshot telemetry = context.getTelemetry();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(context.getEquipmentId());
        SensorResolver resolver = new SensorResolver(context.getLocation(), context.getEquipment());

        double supply = resolver.resolve(telemetry, Sensors.BUNDLE_SUPPLY_TEMP);
        double outdoor = resolver.resolve(telemetry, Sensors.OUTDOOR_TEMP);
        boolean pumpRunning = pumpRunning(telemetry, tuning.getPumpRunningAmps());

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("supplyTemp", supply);
        diagnostics.put("outdoorTemp", outdoor);
        diagnostics.put("pumpStatus", pumpRunning ? "running" : "off");

        ResolvedSetpoint setpoint = SetpointResolver.resolve(settings, null, tuning.getOar(), outdoor,
                tuning.getDefaultSetpoint(), MIN_WATER_SETPOINT, MAX_WATER_SETPOINT);

        if (!settings.isEnabledOrDefault()) {
            diagnostics.put("safetyStatus", "user_off");
            return closed(context, ControlMode.OFF, setpoint, diagnostics);
        }
        if (tuning.isRequirePump() && !pumpRunning) {
            log.info("蒸汽换热器 {} 未检测到热水泵运行，关闭蒸汽阀", context.getEquipmentId());
            diagnostics.put("safetyStatus", "no_pump");
            return closed(context, ControlMode.STANDBY, setpoint, diagnostics);
        }
        if (supply >= tuning.getSafetyShutoff()) {
            log.error("蒸汽换热器 {} 供水温度 {}°F 达到安全切断值 {}°F", context.getEquipmentId(), supply,
                    tuning.getSafetyShutoff());
            diagnostics.put("safetyStatus", "high_temp");
            return closed(context, ControlMode.HIGH_LIMIT, setpoint, diagnostics);
        }
        if (tuning.getOar().isEnabled() && outdoor >= tuning.getOar().getMaxOat()) {
            diagnostics.put("safetyStatus", "oar_disabled");
            return closed(context, ControlMode.LOCKOUT, setpoint, diagnostics);
        }

        Map<ControllerRole, PidState> states = new EnumMap<>(ControllerRole.class);
        double output = 0;
        if (setpoint.getValue() - supply > 0) {
            PidResult pid = runPid(context, ControllerRole.HEATING, supply, setpoint.getValue(),
                    context.getLocation().getZone().getPidDt());
            output = pid.getOutput();
            states.put(ControllerRole.HEATING, pid.getNewState());
        }
        double[] valves = splitValves(output, tuning.getPrimaryValveRatio());
        diagnostics.put("pidOutput", output);
        diagnostics.put("safetyStatus", "normal");

        ActuatorCommands commands = new ActuatorCommands()
                .flag("unitEnable", true)
                .flag("steamEnable", true)
                .percent("steamValve", output)
                .percent("primaryValvePosition", valves[0])
                .percent("secondaryValvePosition", valves[1])
                .number("temperatureSetpoint", setpoint.getValue());
        return resultBuilder(context)
                .mode(ControlMode.HEATING)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .nextPidStates(states)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * 输出分段：[0, ratio] 映射到主阀 0~100%，(ratio, 100] 映射到副阀 0~100%
     *
     * @return {主阀开度, 副阀开度}
     */
    static double[] splitValves(double output, double primaryRatio) {
        double threshold = ValueUtils.clamp(primaryRatio, 0.01, 0.99) * 100;
        double demand = ValueUtils.clampPercent(output);
        if (demand <= threshold) {
            return new double[]{demand / threshold * 100, 0};
        }
        return new double[]{100, (demand - threshold) / (100 - threshold) * 100};
    }

    /**
     * 任一热水泵电流超过阈值，或任一状态点为运行
     */
    static boolean pumpRunning(TelemetrySnapshot telemetry, double runningAmps) {
        for (String key : PUMP_AMP_KEYS) {
            Optional<Double> amps = telemetry.getDouble(key);
            if (amps.isPresent() && amps.get() > runningAmps) {
                return true;
            }
        }
        for (String key : PUMP_STATUS_KEYS) {
            if (telemetry.getBoolean(key).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    private ControlResult closed(ControlContext context, ControlMode mode, ResolvedSetpoint setpoint,
                                 Map<String, Object> diagnostics) {
        ActuatorCommands commands = new ActuatorCommands()
                .flag("unitEnable", false)
                .flag("steamEnable", false)
                .percent("steamValve", 0)
                .percent("primaryValvePosition", 0)
                .percent("secondaryValvePosition", 0)
                .number("temperatureSetpoint", setpoint.getValue());
        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .diagnostics(diagnostics)
                .build();
    }
}
