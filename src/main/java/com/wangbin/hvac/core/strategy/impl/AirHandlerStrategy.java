package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.strategy.ControlContext;
import com.wangbin.hvac.core.strategy.SensorResolver;
import com.wangbin.hvac.core.strategy.Sensors;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 空调箱控制策略：温控同风机盘管，防冻取混风温度，新风阀按占用状态控制
 */
@Component
public class AirHandlerStrategy extends FanCoilStrategy {

    private static final String[] OCCUPANCY_KEYS = {"Occupancy", "occupancy", "Occupied", "occupied"};

    public AirHandlerStrategy() {
        super(EquipmentType.AIR_HANDLER, "空调箱");
    }

    @Override
    protected Optional<Double> safetyTemperature(SensorResolver resolver, TelemetrySnapshot telemetry) {
        Optional<Double> mixed = resolver.find(telemetry, Sensors.MIXED_TEMP);
        return mixed.isPresent() ? mixed : resolver.find(telemetry, Sensors.SUPPLY_TEMP);
    }

    /**
     * 有占用信号时：有人开到最小新风开度，无人关闭；没有占用信号时按室外温度区间
     */
    @Override
    protected double damperPosition(ControlContext context, SensorResolver resolver, Optional<Double> outdoor) {
        Optional<Boolean> occupied = occupancy(context.getTelemetry());
        if (occupied.isPresent()) {
            LocationProfile.ZoneTuning zone = context.getLocation().getZone();
            return occupied.get() ? zone.getMinOutdoorAirPosition() : 0;
        }
        return super.damperPosition(context, resolver, outdoor);
    }

    private Optional<Boolean> occupancy(TelemetrySnapshot telemetry) {
        if (telemetry == null) {
            return Optional.empty();
        }
        for (String key : OCCUPANCY_KEYS) {
            Optional<Boolean> value = telemetry.getBoolean(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
