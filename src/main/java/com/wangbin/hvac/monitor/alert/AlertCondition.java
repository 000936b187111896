package com.wangbin.hvac.monitor.alert;

import lombok.Builder;
import lombok.Data;

/**
 * 告警条件定义。
 */
@Data
@Builder
public class AlertCondition {
    private final String metric;
    private final double threshold;
    private final Comparator comparator;

    public boolean matches(double value) {
        return switch (comparator) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case EQUALS -> value == threshold;
        };
    }

    public enum Comparator {
        GREATER_THAN,
        LESS_THAN,
        EQUALS
    }
}
