package com.wangbin.hvac.core.state;

import com.wangbin.hvac.core.pid.ControllerRole;

/**
 * 状态键
 */
final class StateKeys {

    static final String PID = "pid";
    static final String STAGING = "staging";
    static final String LEAD_LAG = "leadlag";
    static final String MEMORY = "memory";

    private StateKeys() {
    }

    static String equipment(String prefix, String kind, String locationId, String id) {
        return prefix + kind + ":" + locationId + ":" + id;
    }

    static String pid(String prefix, String locationId, String equipmentId, ControllerRole role) {
        return equipment(prefix, PID, locationId, equipmentId) + ":" + role.getCode();
    }
}
