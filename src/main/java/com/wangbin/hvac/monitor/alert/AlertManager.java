package com.wangbin.hvac.monitor.alert;

import com.wangbin.hvac.core.config.HvacProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 告警管理：阈值规则评估、告警记录与最近告警查询
 */
@Slf4j
@Component
public class AlertManager {

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final Deque<AlertNotification> history = new ArrayDeque<>();
    private final AtomicLong raisedCount = new AtomicLong(0);
    private final HvacProperties.AlertConfig config;

    @Autowired
    public AlertManager(HvacProperties properties) {
        this(properties.getAlert());
    }

    public AlertManager(HvacProperties.AlertConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        for (HvacProperties.RuleConfig ruleConfig : config.getRules()) {
            register(AlertRule.builder()
                    .id(ruleConfig.getId() != null ? ruleConfig.getId() : ruleConfig.getMetric())
                    .name(ruleConfig.getName() != null ? ruleConfig.getName() : ruleConfig.getMetric())
                    .level(ruleConfig.getLevel())
                    .conditions(List.of(AlertCondition.builder()
                            .metric(ruleConfig.getMetric())
                            .comparator(ruleConfig.getComparator())
                            .threshold(ruleConfig.getThreshold())
                            .build()))
                    .notificationChannel(ruleConfig.getNotificationChannel())
                    .build());
        }
        log.info("告警管理初始化完成，规则数：{}", rules.size());
    }

    public void register(AlertRule rule) {
        rules.put(rule.getId(), rule);
        log.info("注册告警规则：{}", rule.getName());
    }

    public Collection<AlertRule> getRules() {
        return rules.values();
    }

    public void remove(String ruleId) {
        rules.remove(ruleId);
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * 用一组数值指标评估全部规则，规则涉及的指标都存在且全部条件满足时触发。
     * 只返回触发结果，由调用方决定是否记录。
     */
    public List<AlertNotification> evaluate(String locationId, String equipmentId, String equipmentType,
                                            Map<String, Double> metrics) {
        List<AlertNotification> triggered = new ArrayList<>();
        if (!config.isEnabled() || rules.isEmpty()) {
            return triggered;
        }
        for (AlertRule rule : rules.values()) {
            if (rule.getConditions().isEmpty()) {
                continue;
            }
            boolean matched = rule.getConditions().stream().allMatch(condition -> {
                Double value = metrics.get(condition.getMetric());
                return value != null && condition.matches(value);
            });
            if (matched) {
                AlertCondition first = rule.getConditions().get(0);
                Double value = metrics.get(first.getMetric());
                triggered.add(AlertNotification.builder()
                        .locationId(locationId)
                        .equipmentId(equipmentId)
                        .equipmentType(equipmentType)
                        .metric(first.getMetric())
                        .ruleId(rule.getId())
                        .ruleName(rule.getName())
                        .level(rule.getLevel())
                        .message(rule.getName() + "：" + first.getMetric() + "=" + value)
                        .eventType("threshold")
                        .value(value)
                        .timestamp(System.currentTimeMillis())
                        .build());
            }
        }
        return triggered;
    }

    /**
     * 记录一条告警
     */
    public AlertNotification raise(AlertNotification notification) {
        if (!config.isEnabled()) {
            return notification;
        }
        raisedCount.incrementAndGet();
        synchronized (history) {
            history.addFirst(notification);
            while (history.size() > Math.max(1, config.getHistorySize())) {
                history.removeLast();
            }
        }
        if (notification.getLevel() == AlertLevel.CRITICAL) {
            log.error("告警[{}] {}/{}：{}", notification.getLevel(), notification.getLocationId(),
                    notification.getEquipmentId(), notification.getMessage());
        } else {
            log.warn("告警[{}] {}/{}：{}", notification.getLevel(), notification.getLocationId(),
                    notification.getEquipmentId(), notification.getMessage());
        }
        return notification;
    }

    /**
     * 最近告警，新的在前
     */
    public List<AlertNotification> recent(String locationId, int limit) {
        List<AlertNotification> result = new ArrayList<>();
        synchronized (history) {
            for (AlertNotification notification : history) {
                if (locationId != null && !locationId.equalsIgnoreCase(notification.getLocationId())) {
                    continue;
                }
                result.add(notification);
                if (result.size() >= limit) {
                    break;
                }
            }
        }
        return result;
    }

    public long getRaisedCount() {
        return raisedCount.get();
    }
}
