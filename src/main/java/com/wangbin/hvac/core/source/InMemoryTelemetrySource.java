package com.wangbin.hvac.core.source;

import com.wangbin.hvac.core.model.TelemetrySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内遥测源，由接口推送或测试直接写入
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.source", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryTelemetrySource implements TelemetrySource {

    private final Map<String, TelemetrySnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public Optional<TelemetrySnapshot> latest(String locationId, String equipmentId) {
        return Optional.ofNullable(snapshots.get(key(locationId, equipmentId)));
    }

    /**
     * 合并写入：新指标覆盖同名旧指标
     */
    public TelemetrySnapshot update(String locationId, String equipmentId, Map<String, ?> metrics) {
        TelemetrySnapshot merged = snapshots.compute(key(locationId, equipmentId), (key, previous) -> {
            Map<String, Object> values = new LinkedHashMap<>();
            if (previous != null) {
                values.putAll(previous.getMetrics());
            }
            values.putAll(metrics);
            return new TelemetrySnapshot(equipmentId, System.currentTimeMillis(), values);
        });
        log.debug("更新遥测: {}/{} -> {} 个指标", locationId, equipmentId, merged.getMetrics().size());
        return merged;
    }

    public void remove(String locationId, String equipmentId) {
        snapshots.remove(key(locationId, equipmentId));
    }

    private String key(String locationId, String equipmentId) {
        return locationId + "/" + equipmentId;
    }
}
