package com.wangbin.hvac.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 引擎整体健康状态。
 */
@Data
@Builder
public class HealthStatus {

    private final Status status;

    private final long uptimeMs;

    @Builder.Default
    private final long timestamp = Instant.now().toEpochMilli();

    @Builder.Default
    private final Map<String, ComponentHealth> components = new LinkedHashMap<>();

    public enum Status {
        UP,
        DOWN,
        DEGRADED,
        UNKNOWN
    }

    /**
     * 优先级 DOWN > DEGRADED > UNKNOWN > UP。
     */
    public static Status aggregate(Collection<ComponentHealth> componentHealths) {
        Status overall = Status.UP;
        for (ComponentHealth component : componentHealths) {
            if (component == null) {
                continue;
            }
            if (component.getStatus() == Status.DOWN) {
                return Status.DOWN;
            }
            if (rank(component.getStatus()) > rank(overall)) {
                overall = component.getStatus();
            }
        }
        return overall;
    }

    private static int rank(Status status) {
        return switch (status) {
            case DOWN -> 3;
            case DEGRADED -> 2;
            case UNKNOWN -> 1;
            case UP -> 0;
        };
    }
}
