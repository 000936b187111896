package com.wangbin.hvac.core.staging;

import lombok.Value;

import java.util.List;

/**
 * 主备判定结果
 */
@Value
public class LeadLagDecision {

    String groupId;
    String leadId;
    List<String> lagIds;
    LeadLagState state;
    ChangeReason reason;
    /** 主机故障或备用被调用时需要参与运行的备用设备 */
    boolean leadHealthy;

    public boolean isLead(String equipmentId) {
        return leadId != null && leadId.equals(equipmentId);
    }

    public boolean changed() {
        return reason != ChangeReason.NONE;
    }

    public enum ChangeReason {
        NONE,
        INITIAL,
        USER,
        FAILOVER,
        SCHEDULED
    }
}
