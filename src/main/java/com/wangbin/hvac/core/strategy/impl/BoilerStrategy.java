package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentMemory;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.staging.LeadLagDecision;
import com.wangbin.hvac.core.staging.UnitHealth;
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
 * 锅炉控制策略
 *
 * 供水设定值按室外温度补偿（生活热水锅炉固定），超温紧急停炉，燃烧按设定值上下回差启停，
 * 只有主机或主机失效时的备机参与运行。
 */
@Slf4j
@Component
public class BoilerStrategy extends AbstractEquipmentStrategy {

    static final String MEMORY_FIRING = "firing";
    private static final double MIN_WATER_SETPOINT = 80;
    private static final double MAX_WATER_SETPOINT = 180;
    private static final String[] FREEZESTAT_KEYS = {"Freezestat", "FreezeStat", "freezestat"};
    private static final String[] STATUS_KEYS = {"Status", "status", "BoilerStatus", "boilerStatus"};

    public BoilerStrategy() {
        super(EquipmentType.BOILER, "锅炉");
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile.BoilerTuning tuning = context.getLocation().getBoiler();
        EquipmentConfig equipment = context.getEquipment();
        TelemetrySnapshot telemetry = context.getTelemetry();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(equipment.getId());
        SensorResolver resolver = new SensorResolver(context.getLocation(), equipment);

        double supply = supplyTemperature(resolver, telemetry, tuning, equipment.getId());
        Optional<Double> outdoor = resolver.find(telemetry, Sensors.OUTDOOR_TEMP);
        ResolvedSetpoint setpoint = SetpointResolver.resolve(settings,
                equipment.isDomestic() ? tuning.getDomesticSetpoint() : null,
                tuning.getOar(), outdoor.orElse(null), tuning.getDefaultSupply(),
                MIN_WATER_SETPOINT, MAX_WATER_SETPOINT);

        LeadLagDecision leadLag = context.getLeadLag();
        boolean isLead = leadLag == null || leadLag.isLead(equipment.getId());
        EquipmentMemory memory = context.memoryOrEmpty();

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("supplyTemp", supply);
        outdoor.ifPresent(value -> diagnostics.put("outdoorTemp", value));

        if (supply > tuning.getEmergencyShutoff()) {
            log.error("锅炉 {} 供水温度 {}°F 超过紧急停炉值 {}°F", equipment.getId(), supply,
                    tuning.getEmergencyShutoff());
            return build(context, ControlMode.EMERGENCY_SHUTDOWN, setpoint, false, false, isLead, leadLag,
                    memory.withFlag(MEMORY_FIRING, false), diagnostics);
        }

        if (!settings.isEnabledOrDefault()) {
            return build(context, ControlMode.OFF, setpoint, false, false, isLead, leadLag,
                    memory.withFlag(MEMORY_FIRING, false), diagnostics);
        }

        boolean participating = isLead || (leadLag != null && !leadLag.isLeadHealthy());
        if (!participating) {
            return build(context, ControlMode.STANDBY, setpoint, false, false, false, leadLag,
                    memory.withFlag(MEMORY_FIRING, false), diagnostics);
        }

        boolean firing = memory.getFlag(MEMORY_FIRING, false);
        if (supply < setpoint.getValue() - tuning.getFiringDeadband()) {
            firing = true;
        } else if (supply > setpoint.getValue() + tuning.getFiringDeadband()) {
            firing = false;
        }
        return build(context, firing ? ControlMode.HEATING : ControlMode.STANDBY, setpoint, true, firing, isLead,
                leadLag, memory.withFlag(MEMORY_FIRING, firing), diagnostics);
    }

    @Override
    public UnitHealth assessHealth(LocationProfile location, EquipmentConfig equipment,
                                   TelemetrySnapshot telemetry) {
        if (telemetry == null || telemetry.isEmpty()) {
            return UnitHealth.unhealthy("无遥测数据");
        }
        SensorResolver resolver = new SensorResolver(location, equipment);
        Optional<Double> supply = resolver.find(telemetry, Sensors.WATER_SUPPLY_TEMP);
        if (supply.isPresent() && supply.get() > location.getBoiler().getEmergencyShutoff()) {
            return UnitHealth.unhealthy("供水超温");
        }
        for (String key : FREEZESTAT_KEYS) {
            if (telemetry.getBoolean(key).orElse(false)) {
                return UnitHealth.unhealthy("防冻开关动作");
            }
        }
        for (String key : STATUS_KEYS) {
            Optional<String> status = telemetry.getString(key);
            if (status.isPresent()) {
                String normalized = status.get().toLowerCase();
                if (normalized.contains("fault") || normalized.contains("alarm")) {
                    return UnitHealth.unhealthy("设备故障状态: " + status.get());
                }
            }
        }
        return UnitHealth.healthy();
    }

    private double supplyTemperature(SensorResolver resolver, TelemetrySnapshot telemetry,
                                     LocationProfile.BoilerTuning tuning, String equipmentId) {
        Optional<Double> supply = resolver.find(telemetry, Sensors.WATER_SUPPLY_TEMP);
        if (supply.isEmpty()) {
            log.warn("锅炉 {} 未找到供水温度，使用默认值 {}°F", equipmentId, tuning.getDefaultSupply());
            return tuning.getDefaultSupply();
        }
        return supply.get();
    }

    private ControlResult build(ControlContext context, ControlMode mode, ResolvedSetpoint setpoint,
                                boolean enable, boolean firing, boolean isLead, LeadLagDecision leadLag,
                                EquipmentMemory memory, Map<String, Object> diagnostics) {
        ActuatorCommands commands = new ActuatorCommands()
                .flag("boilerEnable", enable)
                .flag("boilerFiring", firing)
                .number("waterTempSetpoint", setpoint.getValue())
                .flag("isLead", isLead);
        if (leadLag != null) {
            commands.text("leadLagGroupId", leadLag.getGroupId())
                    .text("leadEquipmentId", leadLag.getLeadId());
        }
        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .nextMemory(memory)
                .diagnostics(diagnostics)
                .build();
    }
}
