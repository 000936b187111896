package com.wangbin.hvac.core.staging;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 主备管理器：用户指定、故障切换、定期轮换
 *
 * 优先级：
 * 1. 用户下发 isLead=true 且该设备健康
 * 2. 当前主机不健康时切换到下一台健康设备
 * 3. 距上次切换超过轮换周期时轮换到组内下一台
 * 4. 保持当前主机
 */
@Slf4j
public class LeadLagManager {

    public LeadLagDecision resolve(String groupId, List<String> units, Map<String, UnitHealth> health,
                                   String userLeadId, LeadLagState current, Instant now,
                                   Duration changeoverInterval) {
        if (units == null || units.isEmpty()) {
            throw new IllegalArgumentException("主备组 " + groupId + " 没有设备");
        }
        long nowMs = now.toEpochMilli();
        LeadLagState state = current != null ? current.toBuilder().build() : null;

        if (state == null || state.getLeadId() == null || !units.contains(state.getLeadId())) {
            String initial = userLeadId != null && units.contains(userLeadId) && isHealthy(health, userLeadId)
                    ? userLeadId : firstHealthy(units, health, units.get(0));
            state = LeadLagState.builder()
                    .groupId(groupId)
                    .leadId(initial)
                    .lastChangeover(nowMs)
                    .build();
            log.info("主备组 {} 初始化主机: {}", groupId, initial);
            return decision(groupId, units, health, state, LeadLagDecision.ChangeReason.INITIAL);
        }

        if (userLeadId != null && units.contains(userLeadId) && !userLeadId.equals(state.getLeadId())
                && isHealthy(health, userLeadId)) {
            log.info("主备组 {} 按用户指令切换主机: {} -> {}", groupId, state.getLeadId(), userLeadId);
            state = switchLead(state, userLeadId, nowMs, false, null);
            return decision(groupId, units, health, state, LeadLagDecision.ChangeReason.USER);
        }

        String lead = state.getLeadId();
        if (!isHealthy(health, lead)) {
            String replacement = nextHealthy(units, health, lead);
            if (replacement != null) {
                String reason = health.get(lead).getReason();
                log.warn("主备组 {} 主机 {} 故障({})，切换到 {}", groupId, lead, reason, replacement);
                state = switchLead(state, replacement, nowMs, true, reason);
                return decision(groupId, units, health, state, LeadLagDecision.ChangeReason.FAILOVER);
            }
            log.error("主备组 {} 全部设备不健康，保持主机 {}", groupId, lead);
            return decision(groupId, units, health, state, LeadLagDecision.ChangeReason.NONE);
        }

        if (units.size() > 1 && changeoverInterval != null && !changeoverInterval.isZero()
                && nowMs - state.getLastChangeover() >= changeoverInterval.toMillis()) {
            String next = nextHealthy(units, health, lead);
            if (next != null) {
                log.info("主备组 {} 定期轮换: {} -> {}", groupId, lead, next);
                state = switchLead(state, next, nowMs, false, null);
                return decision(groupId, units, health, state, LeadLagDecision.ChangeReason.SCHEDULED);
            }
        }

        return decision(groupId, units, health, state, LeadLagDecision.ChangeReason.NONE);
    }

    private LeadLagState switchLead(LeadLagState state, String newLead, long nowMs,
                                    boolean failover, String reason) {
        return state.toBuilder()
                .previousLeadId(state.getLeadId())
                .leadId(newLead)
                .lastChangeover(nowMs)
                .failoverActive(failover)
                .failoverReason(reason)
                .build();
    }

    private LeadLagDecision decision(String groupId, List<String> units, Map<String, UnitHealth> health,
                                     LeadLagState state, LeadLagDecision.ChangeReason reason) {
        String lead = state.getLeadId();
        List<String> lags = units.stream().filter(id -> !id.equals(lead)).collect(Collectors.toList());
        return new LeadLagDecision(groupId, lead, lags, state, reason, isHealthy(health, lead));
    }

    private boolean isHealthy(Map<String, UnitHealth> health, String unit) {
        UnitHealth unitHealth = health == null ? null : health.get(unit);
        return unitHealth == null || unitHealth.isHealthy();
    }

    private String firstHealthy(List<String> units, Map<String, UnitHealth> health, String fallback) {
        return units.stream().filter(unit -> isHealthy(health, unit)).findFirst().orElse(fallback);
    }

    /**
     * 按组内顺序，从当前设备之后找第一台健康设备
     */
    private String nextHealthy(List<String> units, Map<String, UnitHealth> health, String current) {
        int index = units.indexOf(current);
        for (int offset = 1; offset < units.size(); offset++) {
            String candidate = units.get((index + offset) % units.size());
            if (isHealthy(health, candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
