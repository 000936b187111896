package com.wangbin.hvac.core.model;

import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.staging.StagingState;
import lombok.Builder;
import lombok.Data;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单台设备一个控制周期的输出：执行器命令与下一周期状态
 */
@Data
@Builder
public class ControlResult {

    private final String locationId;
    private final String equipmentId;
    private final EquipmentType equipmentType;
    private final ControlMode mode;
    private final Double effectiveSetpoint;
    private final SetpointSource setpointSource;
    private final ActuatorCommands commands;

    @Builder.Default
    private final Map<ControllerRole, PidState> nextPidStates = new EnumMap<>(ControllerRole.class);

    /** 分级状态，非分级设备为 null */
    private final StagingState nextStagingState;

    /** 设备记忆，null 表示不更新 */
    private final EquipmentMemory nextMemory;

    /** 诊断信息，不发布到执行器 */
    @Builder.Default
    private final Map<String, Object> diagnostics = new LinkedHashMap<>();

    @Builder.Default
    private final long timestamp = System.currentTimeMillis();

    public boolean isSafetyTrip() {
        return mode != null && mode.isSafety();
    }
}
