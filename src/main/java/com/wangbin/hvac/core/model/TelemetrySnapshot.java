package com.wangbin.hvac.core.model;

import com.wangbin.hvac.common.utils.ValueUtils;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 单台设备的遥测快照，交付给控制周期后不可变。缺失的键返回空值，不抛异常。
 */
@Getter
@ToString
public class TelemetrySnapshot {

    private final String equipmentId;
    private final long timestamp;
    private final Map<String, Object> metrics;

    public TelemetrySnapshot(String equipmentId, long timestamp, Map<String, ?> metrics) {
        this.equipmentId = equipmentId;
        this.timestamp = timestamp;
        this.metrics = metrics == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static TelemetrySnapshot of(String equipmentId, Map<String, ?> metrics) {
        return new TelemetrySnapshot(equipmentId, System.currentTimeMillis(), metrics);
    }

    public static TelemetrySnapshot empty(String equipmentId) {
        return new TelemetrySnapshot(equipmentId, System.currentTimeMillis(), null);
    }

    public boolean has(String key) {
        return metrics.containsKey(key) && metrics.get(key) != null;
    }

    public Object get(String key) {
        return metrics.get(key);
    }

    public Optional<Double> getDouble(String key) {
        return Optional.ofNullable(ValueUtils.toDouble(metrics.get(key)));
    }

    public double getDouble(String key, double defaultValue) {
        return getDouble(key).orElse(defaultValue);
    }

    public Optional<Boolean> getBoolean(String key) {
        return Optional.ofNullable(ValueUtils.toBoolean(metrics.get(key)));
    }

    public Optional<String> getString(String key) {
        Object value = metrics.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }
}
