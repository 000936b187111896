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
import com.wangbin.hvac.core.strategy.SensorResolver;
import com.wangbin.hvac.core.strategy.Sensors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 水泵控制策略
 *
 * 冷冻水泵：室外温度 ≥37 开启、≤36 停止；热水泵：≤74 开启、≥75 停止。
 * 正常只运行主泵，极端室外温度或主泵失效时备用泵同时运行。
 */
@Slf4j
@Component
public class PumpStrategy extends AbstractEquipmentStrategy {

    static final String MEMORY_DEMAND = "oatDemand";
    private static final String[] STATUS_KEYS = {"Status", "status", "PumpStatus", "pumpStatus"};
    private static final String[] ENABLE_KEYS = {"PumpEnable", "pumpEnable", "Enable", "enabled"};

    public PumpStrategy() {
        super(EquipmentType.PUMP, "水泵");
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile.PumpTuning tuning = context.getLocation().getPump();
        EquipmentConfig equipment = context.getEquipment();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(equipment.getId());
        SensorResolver resolver = new SensorResolver(context.getLocation(), equipment);
        EquipmentMemory memory = context.memoryOrEmpty();
        boolean chilledWater = equipment.getService() == EquipmentConfig.PumpService.CHILLED_WATER;

        Optional<Double> outdoor = resolver.find(context.getTelemetry(), Sensors.OUTDOOR_TEMP);
        boolean demand = outdoorDemand(tuning, chilledWater, outdoor, memory.getFlag(MEMORY_DEMAND, false));
        EquipmentMemory nextMemory = memory.withFlag(MEMORY_DEMAND, demand);

        LeadLagDecision leadLag = context.getLeadLag();
        boolean isLead = leadLag == null || leadLag.isLead(equipment.getId());
        boolean extreme = outdoor.isPresent() && (chilledWater
                ? outdoor.get() >= tuning.getCwLagOat()
                : outdoor.get() <= tuning.getHwLagOat());
        boolean leadFailed = leadLag != null && !leadLag.isLeadHealthy();

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        outdoor.ifPresent(value -> diagnostics.put("outdoorTemp", value));
        diagnostics.put("service", equipment.getService().name());
        diagnostics.put("oatDemand", demand);
        diagnostics.put("extremeOat", extreme);

        ControlMode mode;
        boolean run;
        if (!settings.isEnabledOrDefault()) {
            mode = ControlMode.OFF;
            run = false;
        } else if (!demand) {
            mode = ControlMode.STANDBY;
            run = false;
        } else {
            run = isLead || extreme || leadFailed;
            mode = run ? ControlMode.RUNNING : ControlMode.STANDBY;
            if (run && !isLead) {
                log.info("备用泵 {} 投入运行: 极端温度={}, 主泵失效={}", equipment.getId(), extreme, leadFailed);
            }
        }

        double speed = run ? settings.overrideDouble("pumpSpeed").orElse(tuning.getDefaultSpeed()) : 0;
        ActuatorCommands commands = new ActuatorCommands()
                .flag("pumpEnable", run)
                .percent("pumpSpeed", speed)
                .flag("isLead", isLead);
        if (leadLag != null) {
            commands.text("leadLagGroupId", leadLag.getGroupId());
        }
        return resultBuilder(context)
                .mode(mode)
                .commands(commands)
                .nextMemory(nextMemory)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * 室外温度回差判定，缺失时保持上次状态
     */
    static boolean outdoorDemand(LocationProfile.PumpTuning tuning, boolean chilledWater,
                                 Optional<Double> outdoor, boolean previous) {
        if (outdoor.isEmpty()) {
            return previous;
        }
        double oat = outdoor.get();
        if (chilledWater) {
            if (oat >= tuning.getCwOnOat()) {
                return true;
            }
            return oat > tuning.getCwOffOat() && previous;
        }
        if (oat <= tuning.getHwOnOat()) {
            return true;
        }
        return oat < tuning.getHwOffOat() && previous;
    }

    /**
     * 故障状态，或命令运行中但电流低于阈值，判为不健康
     */
    @Override
    public UnitHealth assessHealth(LocationProfile location, EquipmentConfig equipment,
                                   TelemetrySnapshot telemetry) {
        if (telemetry == null || telemetry.isEmpty()) {
            return UnitHealth.unhealthy("无遥测数据");
        }
        for (String key : STATUS_KEYS) {
            Optional<String> status = telemetry.getString(key);
            if (status.isPresent() && status.get().toLowerCase().contains("fault")) {
                return UnitHealth.unhealthy("设备故障状态: " + status.get());
            }
        }
        boolean commandedOn = false;
        for (String key : ENABLE_KEYS) {
            if (telemetry.getBoolean(key).orElse(false)) {
                commandedOn = true;
                break;
            }
        }
        if (commandedOn) {
            SensorResolver resolver = new SensorResolver(location, equipment);
            Optional<Double> amps = resolver.find(telemetry, Sensors.MOTOR_AMPS);
            if (amps.isPresent() && amps.get() < location.getPump().getFailureAmps()) {
                return UnitHealth.unhealthy("运行电流过低: " + amps.get() + "A");
            }
        }
        return UnitHealth.healthy();
    }
}
