package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentMemory;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.staging.LeadLagDecision;
import com.wangbin.hvac.core.staging.StagingState;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * 策略输入：遥测、用户设定、持久化状态。策略只读，不修改其中任何对象。
 */
@Getter
@Builder
public class ControlContext {

    private final LocationProfile location;
    private final EquipmentConfig equipment;
    private final TelemetrySnapshot telemetry;
    private final UserSettings settings;

    @Builder.Default
    private final Map<ControllerRole, PidState> pidStates = Collections.emptyMap();

    private final StagingState stagingState;

    private final EquipmentMemory memory;

    /** 主备组判定，仅冗余设备组有值 */
    private final LeadLagDecision leadLag;

    @Builder.Default
    private final Instant now = Instant.now();

    public String getLocationId() {
        return location.getId();
    }

    public String getEquipmentId() {
        return equipment.getId();
    }

    public PidState pidState(ControllerRole role) {
        return pidStates.get(role);
    }

    public EquipmentMemory memoryOrEmpty() {
        return memory != null ? memory : new EquipmentMemory();
    }
}
