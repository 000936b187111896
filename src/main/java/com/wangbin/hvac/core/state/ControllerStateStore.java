package com.wangbin.hvac.core.state;

import com.wangbin.hvac.core.model.EquipmentMemory;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.staging.LeadLagState;
import com.wangbin.hvac.core.staging.StagingState;

import java.util.Map;

/**
 * 控制器状态存储
 *
 * 键按 (位置, 设备/组) 隔离，不同设备之间不共享状态。
 * 每台设备只由所属调度任务读写，实现无需跨设备加锁。
 */
public interface ControllerStateStore {

    String getName();

    Map<ControllerRole, PidState> loadPidStates(String locationId, String equipmentId);

    void savePidStates(String locationId, String equipmentId, Map<ControllerRole, PidState> states);

    StagingState loadStagingState(String locationId, String groupId);

    void saveStagingState(String locationId, String groupId, StagingState state);

    LeadLagState loadLeadLagState(String locationId, String groupId);

    void saveLeadLagState(String locationId, String groupId, LeadLagState state);

    EquipmentMemory loadMemory(String locationId, String equipmentId);

    void saveMemory(String locationId, String equipmentId, EquipmentMemory memory);

    /**
     * 清除设备的全部状态：PID与设备记忆按设备，分级与主备状态按所在组（无组时为设备本身）
     */
    void clear(String locationId, String equipmentId, String groupId);

    Map<String, Object> getStatistics();
}
