package com.wangbin.hvac.monitor.alert;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertNotification {
    String locationId;
    String equipmentId;
    String equipmentType;
    String metric;
    String ruleId;
    String ruleName;
    AlertLevel level;
    String message;
    /** 规则告警为 threshold，设备诊断告警为 diagnostic */
    String eventType;
    Object value;
    long timestamp;
}
