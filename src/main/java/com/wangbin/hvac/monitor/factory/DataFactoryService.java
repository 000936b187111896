package com.wangbin.hvac.monitor.factory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.hvac.core.processor.ControlCycleEvent;
import com.wangbin.hvac.core.processor.ControlCycleListener;
import com.wangbin.hvac.monitor.alert.AlertManager;
import com.wangbin.hvac.monitor.alert.AlertNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 数据工厂：消费控制周期结果，计算设备性能指标并产生告警
 *
 * 同一设备同一告警持续存在时只在首次出现时记录。
 */
@Slf4j
@Service
public class DataFactoryService implements ControlCycleListener {

    private static final Duration SNAPSHOT_TTL = Duration.ofHours(1);
    private static final long MAX_SNAPSHOTS = 10_000;

    private final AlertManager alertManager;
    private final EquipmentMetricsCalculator calculator;
    private final Cache<String, PerformanceSnapshot> latest;
    private final AtomicLong cycleCount = new AtomicLong(0);

    public DataFactoryService(AlertManager alertManager) {
        this(alertManager, new EquipmentMetricsCalculator());
    }

    public DataFactoryService(AlertManager alertManager, EquipmentMetricsCalculator calculator) {
        this.alertManager = alertManager;
        this.calculator = calculator;
        this.latest = Caffeine.newBuilder()
                .maximumSize(MAX_SNAPSHOTS)
                .expireAfterWrite(SNAPSHOT_TTL)
                .build();
    }

    @Override
    public void onControlCycle(ControlCycleEvent event) {
        cycleCount.incrementAndGet();
        PerformanceSnapshot computed = calculator.calculate(event);

        List<AlertNotification> alerts = new ArrayList<>(computed.getAlerts());
        alerts.addAll(alertManager.evaluate(computed.getLocationId(), computed.getEquipmentId(),
                computed.getEquipmentType(), computed.getMetrics()));

        String key = key(computed.getLocationId(), computed.getEquipmentId());
        Set<String> previouslyActive = Optional.ofNullable(latest.getIfPresent(key))
                .map(previous -> previous.getAlerts().stream()
                        .map(AlertNotification::getRuleId)
                        .collect(Collectors.toSet()))
                .orElse(Set.of());
        for (AlertNotification alert : alerts) {
            if (!previouslyActive.contains(alert.getRuleId())) {
                alertManager.raise(alert);
            }
        }

        PerformanceSnapshot snapshot = computed.toBuilder().alerts(alerts).build();
        latest.put(key, snapshot);
        log.debug("性能指标更新：{}/{}，效率：{}，告警数：{}", snapshot.getLocationId(), snapshot.getEquipmentId(),
                snapshot.getEfficiency(), alerts.size());
    }

    public List<PerformanceSnapshot> getPerformance(String locationId) {
        return latest.asMap().values().stream()
                .filter(snapshot -> snapshot.getLocationId().equalsIgnoreCase(locationId))
                .sorted(Comparator.comparing(PerformanceSnapshot::getEquipmentType)
                        .thenComparing(PerformanceSnapshot::getEquipmentId))
                .collect(Collectors.toList());
    }

    public Optional<PerformanceSnapshot> getPerformance(String locationId, String equipmentId) {
        return Optional.ofNullable(latest.getIfPresent(key(locationId, equipmentId)));
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("cycleCount", cycleCount.get());
        stats.put("snapshotCount", latest.estimatedSize());
        stats.put("alertCount", alertManager.getRaisedCount());
        return stats;
    }

    private static String key(String locationId, String equipmentId) {
        return locationId + ":" + equipmentId;
    }
}
