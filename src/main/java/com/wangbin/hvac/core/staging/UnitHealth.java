package com.wangbin.hvac.core.staging;

import lombok.Value;

/**
 * 冗余组内单台设备的健康判定
 */
@Value
public class UnitHealth {

    private static final UnitHealth HEALTHY = new UnitHealth(true, null);

    boolean healthy;
    String reason;

    public static UnitHealth healthy() {
        return HEALTHY;
    }

    public static UnitHealth unhealthy(String reason) {
        return new UnitHealth(false, reason);
    }
}
