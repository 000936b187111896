package com.wangbin.hvac.core.model;

import java.time.Duration;

/**
 * 设备类型及其默认调度周期、处理超时
 */
public enum EquipmentType {

    FAN_COIL("fan-coil", Duration.ofSeconds(30), Duration.ofSeconds(60)),
    AIR_HANDLER("air-handler", Duration.ofSeconds(30), Duration.ofSeconds(60)),
    PUMP("pumps", Duration.ofSeconds(30), Duration.ofSeconds(90)),
    BOILER("boiler", Duration.ofMinutes(2), Duration.ofSeconds(120)),
    GEO_PLANT("geo", Duration.ofMinutes(1), Duration.ofSeconds(120)),
    CHILLER("chiller", Duration.ofMinutes(5), Duration.ofSeconds(180)),
    STEAM_BUNDLE("steam-bundle", Duration.ofMinutes(1), Duration.ofSeconds(120)),
    DOAS("doas", Duration.ofSeconds(30), Duration.ofSeconds(60));

    private final String code;
    private final Duration defaultInterval;
    private final Duration defaultTimeout;

    EquipmentType(String code, Duration defaultInterval, Duration defaultTimeout) {
        this.code = code;
        this.defaultInterval = defaultInterval;
        this.defaultTimeout = defaultTimeout;
    }

    public String getCode() {
        return code;
    }

    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * 按编码或枚举名解析，忽略大小写
     */
    public static EquipmentType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("设备类型为空");
        }
        String normalized = code.trim();
        for (EquipmentType type : values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)
                    || type.name().replace('_', '-').equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知设备类型: " + code);
    }

    /**
     * 是否为需要主备轮换的冗余设备组
     */
    public boolean isLeadLagGroup() {
        return this == BOILER || this == PUMP;
    }
}
