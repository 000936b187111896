package com.wangbin.hvac.monitor.alert;

import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * 阈值告警规则，全部条件满足时触发
 */
@Data
@Builder
public class AlertRule {
    private final String id;
    private final String name;
    private final AlertLevel level;

    @Builder.Default
    private final List<AlertCondition> conditions = Collections.emptyList();

    private final String notificationChannel;
}
