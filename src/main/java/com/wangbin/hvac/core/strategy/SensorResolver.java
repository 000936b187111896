package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 按候选顺序解析逻辑传感器，优先使用设备级覆盖，其次位置级覆盖
 */
@Slf4j
public class SensorResolver {

    private final LocationProfile location;
    private final EquipmentConfig equipment;

    public SensorResolver(LocationProfile location, EquipmentConfig equipment) {
        this.location = location;
        this.equipment = equipment;
    }

    public SensorChain chain(SensorChain defaults) {
        List<String> override = equipment != null ? equipment.getSensors().get(defaults.getName()) : null;
        if (override == null || override.isEmpty()) {
            override = location != null ? location.getSensors().get(defaults.getName()) : null;
        }
        return override == null || override.isEmpty() ? defaults : defaults.withCandidates(override);
    }

    /**
     * 解析失败时返回默认值并记录告警
     */
    public double resolve(TelemetrySnapshot telemetry, SensorChain defaults) {
        SensorChain chain = chain(defaults);
        Optional<Double> value = find(telemetry, chain);
        if (value.isPresent()) {
            return value.get();
        }
        log.warn("设备 {} 未找到传感器 {} (候选: {})，使用默认值 {}",
                equipmentId(), chain.getName(), chain.getCandidates(), chain.getDefaultValue());
        return chain.getDefaultValue();
    }

    /**
     * 可选传感器：解析失败返回空，不记录告警
     */
    public Optional<Double> find(TelemetrySnapshot telemetry, SensorChain defaults) {
        if (telemetry == null) {
            return Optional.empty();
        }
        SensorChain chain = chain(defaults);
        for (String key : chain.getCandidates()) {
            Optional<Double> value = telemetry.getDouble(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private String equipmentId() {
        return equipment != null ? equipment.getId() : "-";
    }
}
