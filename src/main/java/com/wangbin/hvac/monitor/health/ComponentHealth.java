package com.wangbin.hvac.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个组件（处理器、写入端、状态存储）的健康状态。
 */
@Data
@Builder
public class ComponentHealth {

    private final String name;
    private final HealthStatus.Status status;
    private final String message;

    @Builder.Default
    private final Map<String, Object> details = new LinkedHashMap<>();

    @Builder.Default
    private final long checkedAt = Instant.now().toEpochMilli();

    public static ComponentHealth of(String name, HealthStatus.Status status, String message,
                                     Map<String, Object> details) {
        return ComponentHealth.builder()
                .name(name)
                .status(status)
                .message(message)
                .details(details != null ? details : new LinkedHashMap<>())
                .build();
    }

    public boolean isUp() {
        return status == HealthStatus.Status.UP;
    }
}
