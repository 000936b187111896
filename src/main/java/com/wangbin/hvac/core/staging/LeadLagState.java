package com.wangbin.hvac.core.staging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 主备组状态
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeadLagState {
    private String groupId;
    private String leadId;
    private long lastChangeover;
    private boolean failoverActive;
    private String failoverReason;
    private String previousLeadId;
}
