package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.common.utils.ValueUtils;
import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.strategy.AbstractEquipmentStrategy;
import com.wangbin.hvac.core.strategy.ControlContext;
import com.wangbin.hvac.core.strategy.ResolvedSetpoint;
import com.wangbin.hvac.core.strategy.SensorResolver;
import com.wangbin.hvac.core.strategy.Sensors;
import com.wangbin.hvac.core.strategy.SetpointResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 新风机组（DOAS）控制策略
 *
 * 送风温度越过高/低限时紧急停机；室外温度高于加热闭锁值禁止加热，低于制冷闭锁值禁止制冷。
 * 比例型机组按室外温度选择加热（燃气阀按送风误差比例开启）或两级直膨制冷；
 * 启停型机组按送风温度回差启停加热或制冷。风机在非停机状态下常开。
 */
@Slf4j
@Component
public class DoasStrategy extends AbstractEquipmentStrategy {

    private static final double MIN_SUPPLY_SETPOINT = 50;
    private static final double MAX_SUPPLY_SETPOINT = 80;
    private static final String[] SETPOINT_KEYS = {"supplyAirSetpoint", "SupplyAirSetpoint"};

    public DoasStrategy() {
        super(EquipmentType.DOAS, "新风机组");
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile.DoasTuning tuning = context.getLocation().getDoas();
        EquipmentConfig equipment = context.getEquipment();
        TelemetrySnapshot telemetry = context.getTelemetry();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(equipment.getId());
        SensorResolver resolver = new SensorResolver(context.getLocation(), equipment);
        boolean modulating = equipment.getDoasControl() != EquipmentConfig.DoasControl.ON_OFF;

        double supply = resolver.resolve(telemetry, Sensors.SUPPLY_AIR_TEMP);
        double outdoor = resolver.find(telemetry, Sensors.OUTDOOR_TEMP).orElseGet(() -> {
            log.warn("新风机组 {} 未找到室外温度，使用默认值 {}°F", equipment.getId(), tuning.getDefaultOutdoor());
            return tuning.getDefaultOutdoor();
        });
        ResolvedSetpoint setpoint = SetpointResolver.resolve(settings, telemetrySetpoint(telemetry), null, null,
                modulating ? tuning.getModulatingSetpoint() : tuning.getOnOffSetpoint(),
                MIN_SUPPLY_SETPOINT, MAX_SUPPLY_SETPOINT);

        boolean heatingLockout = outdoor > tuning.getHeatingLockoutOat();
        boolean coolingLockout = outdoor < tuning.getCoolingLockoutOat();

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("supplyTemp", supply);
        diagnostics.put("outdoorTemp", outdoor);
        diagnostics.put("doasControl", equipment.getDoasControl().name());
        diagnostics.put("heatingLockout", heatingLockout);
        diagnostics.put("coolingLockout", coolingLockout);

        if (supply >= tuning.getHighLimit()) {
            log.error("新风机组 {} 送风温度 {}°F 达到高限 {}°F，紧急停机", equipment.getId(), supply,
                    tuning.getHighLimit());
            diagnostics.put("shutdownReason", "送风温度高限");
            return build(context, ControlMode.HIGH_LIMIT, setpoint, Output.stopped(), diagnostics);
        }
        if (supply <= tuning.getLowLimit()) {
            log.error("新风机组 {} 送风温度 {}°F 达到低限 {}°F，紧急停机", equipment.getId(), supply,
                    tuning.getLowLimit());
            diagnostics.put("shutdownReason", "送风温度低限");
            return build(context, ControlMode.FREEZE_PROTECTION, setpoint, Output.stopped(), diagnostics);
        }
        if (!settings.isEnabledOrDefault()) {
            return build(context, ControlMode.OFF, setpoint, Output.stopped(), diagnostics);
        }

        Output output = modulating
                ? modulating(tuning, supply, outdoor, setpoint.getValue(), heatingLockout, coolingLockout)
                : onOff(tuning, supply, setpoint.getValue(), heatingLockout, coolingLockout);
        diagnostics.put("temperatureError", ValueUtils.round1(supply - setpoint.getValue()));
        return build(context, output.mode, setpoint, output, diagnostics);
    }

    /**
     * 比例型：室外温度低于加热切换点加热，不低于制冷切换点制冷，其间为中性区只送风
     */
    static Output modulating(LocationProfile.DoasTuning tuning, double supply, double outdoor, double setpoint,
                             boolean heatingLockout, boolean coolingLockout) {
        Output output = Output.fanOnly();
        if (outdoor < tuning.getHeatingOat() && !heatingLockout) {
            output.mode = ControlMode.HEATING;
            output.heating = true;
            double error = setpoint - supply;
            output.gasValve = error > 0 ? ValueUtils.clampPercent(error * tuning.getGasValveGain()) : 0;
        } else if (outdoor >= tuning.getCoolingOat() && !coolingLockout) {
            output.mode = ControlMode.COOLING;
            output.cooling = true;
            double error = supply - setpoint;
            output.dxStage1 = error >= tuning.getDxStage1Error();
            output.dxStage2 = error >= tuning.getDxStage2Error();
        }
        return output;
    }

    /**
     * 启停型：送风低于设定值减回差加热，高于设定值加回差制冷，闭锁时保持中性
     */
    static Output onOff(LocationProfile.DoasTuning tuning, double supply, double setpoint,
                        boolean heatingLockout, boolean coolingLockout) {
        Output output = Output.fanOnly();
        double error = supply - setpoint;
        if (error < -tuning.getOnOffDeadband() && !heatingLockout) {
            output.mode = ControlMode.HEATING;
            output.heating = true;
        } else if (error > tuning.getOnOffDeadband() && !coolingLockout) {
            output.mode = ControlMode.COOLING;
            output.cooling = true;
        } else if (error < -tuning.getOnOffDeadband() || error > tuning.getOnOffDeadband()) {
            output.mode = ControlMode.LOCKOUT;
        }
        return output;
    }

    private static Double telemetrySetpoint(TelemetrySnapshot telemetry) {
        for (String key : SETPOINT_KEYS) {
            Optional<Double> value = telemetry.getDouble(key);
            if (value.isPresent()) {
                return value.get();
            }
        }
        return null;
    }

    private ControlResult build(ControlContext context, ControlMode mode, ResolvedSetpoint setpoint,
                                Output output, Map<String, Object> diagnostics) {
        ActuatorCommands commands = new ActuatorCommands()
                .flag("unitEnable", output.fan)
                .flag("fanEnabled", output.fan)
                .flag("heatingEnabled", output.heating)
                .flag("coolingEnabled", output.cooling)
                .percent("gasValvePosition", output.gasValve)
                .flag("dxStage1Enabled", output.dxStage1)
                .flag("dxStage2Enabled", output.dxStage2)
                .number("supplyAirSetpoint", setpoint.getValue());
        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .diagnostics(diagnostics)
                .build();
    }

    static final class Output {
        ControlMode mode = ControlMode.DEADBAND;
        boolean fan;
        boolean heating;
        boolean cooling;
        double gasValve;
        boolean dxStage1;
        boolean dxStage2;

        static Output fanOnly() {
            Output output = new Output();
            output.fan = true;
            return output;
        }

        static Output stopped() {
            Output output = new Output();
            output.mode = ControlMode.OFF;
            return output;
        }
    }
}
