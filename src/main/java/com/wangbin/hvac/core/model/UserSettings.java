package com.wangbin.hvac.core.model;

import com.wangbin.hvac.common.utils.ValueUtils;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 按设备聚合后的用户期望状态，存在时优先于自动计算值
 */
@Data
@Builder
public class UserSettings {

    private final String equipmentId;
    private final Boolean enabled;
    private final Double setpoint;
    private final Boolean isLead;
    private final String modifiedBy;
    private final long modifiedAt;

    @Builder.Default
    private final Map<String, Object> overrides = new LinkedHashMap<>();

    public static UserSettings none(String equipmentId) {
        return UserSettings.builder().equipmentId(equipmentId).overrides(Collections.emptyMap()).build();
    }

    public Optional<Double> setpointValue() {
        return Optional.ofNullable(setpoint).filter(Double::isFinite);
    }

    /**
     * 未下发启停命令时默认启用
     */
    public boolean isEnabledOrDefault() {
        return enabled == null || enabled;
    }

    public Optional<Object> override(String key) {
        return Optional.ofNullable(overrides.get(key));
    }

    public Optional<Double> overrideDouble(String key) {
        return Optional.ofNullable(ValueUtils.toDouble(overrides.get(key)));
    }
}
