package com.wangbin.hvac.core.staging;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 分级协调器
 *
 * 负责：
 * 1. 按负荷计算所需级数
 * 2. 加级/减级每次一级，并受加级延时、减级延时约束（防短周期）
 * 3. 减级按后开先关
 * 4. 最小运行时间保护，紧急停机除外
 * 5. 领先机组轮换与运行时间累计
 */
@Slf4j
public class StagingCoordinator {

    private final Random random;

    public StagingCoordinator() {
        this(new Random());
    }

    public StagingCoordinator(Random random) {
        this.random = random;
    }

    /**
     * requiredStages = ceil(loadFraction * totalStages)，负荷限幅到 [0,1]
     */
    public static int requiredStages(double loadFraction, int totalStages) {
        if (!Double.isFinite(loadFraction) || loadFraction <= 0) {
            return 0;
        }
        double load = Math.min(1.0, loadFraction);
        return (int) Math.ceil(load * totalStages - 1e-9);
    }

    public StagingDecision evaluate(StagingConfig config, StagingState current, int required,
                                    Instant now, boolean emergencyStop) {
        int total = config.getTotalStages();
        StagingState state = current != null ? current.copy() : StagingState.initial(null, total);
        state.setTotalStages(total);
        long nowMs = now.toEpochMilli();
        accumulateRuntime(state, nowMs);

        int target = Math.max(0, Math.min(total, required));

        if (emergencyStop) {
            if (state.activeCount() == 0) {
                return new StagingDecision(state, StagingDecision.Action.NONE, null, 0, "紧急停机，无运行机组");
            }
            log.warn("分级组 {} 紧急停机，关闭全部 {} 级", state.getGroupId(), state.activeCount());
            state.getActiveUnits().clear();
            state.getStartTimes().clear();
            state.setLeadUnit(null);
            state.setLastStageChange(nowMs);
            return new StagingDecision(state, StagingDecision.Action.EMERGENCY_STOP, null, 0, "紧急停机");
        }

        int active = state.activeCount();
        if (active < target) {
            if (!elapsed(state.getLastStageChange(), config.getStageUpDelay().toMillis(), nowMs)) {
                return new StagingDecision(state, StagingDecision.Action.HOLD, null, target, "加级延时未到");
            }
            int unit = selectUnitToStart(state, config.getRotation(), total);
            state.getActiveUnits().add(unit);
            state.getStartTimes().put(unit, nowMs);
            state.setLastStageChange(nowMs);
            log.debug("分级组 {} 加级: 启动 {} 号机组, 运行级数 {}/{}",
                    state.getGroupId(), unit, state.activeCount(), target);
            return new StagingDecision(state, StagingDecision.Action.STAGE_UP, unit, target, "负荷增加");
        }

        if (active > target) {
            if (!elapsed(state.getLastStageChange(), config.getStageDownDelay().toMillis(), nowMs)) {
                return new StagingDecision(state, StagingDecision.Action.HOLD, null, target, "减级延时未到");
            }
            List<Integer> units = state.getActiveUnits();
            int unit = units.get(units.size() - 1);
            long startedAt = state.getStartTimes().getOrDefault(unit, 0L);
            if (nowMs - startedAt < config.getMinimumRuntime().toMillis()) {
                return new StagingDecision(state, StagingDecision.Action.HOLD, null, target, "最小运行时间未满足");
            }
            units.remove(units.size() - 1);
            state.getStartTimes().remove(unit);
            state.setLastStageChange(nowMs);
            if (units.isEmpty()) {
                state.setLeadUnit(null);
            }
            log.debug("分级组 {} 减级: 停止 {} 号机组, 运行级数 {}/{}",
                    state.getGroupId(), unit, state.activeCount(), target);
            return new StagingDecision(state, StagingDecision.Action.STAGE_DOWN, unit, target, "负荷降低");
        }

        return new StagingDecision(state, StagingDecision.Action.NONE, null, target, "级数满足");
    }

    private void accumulateRuntime(StagingState state, long nowMs) {
        long last = state.getLastEvaluated();
        if (last > 0 && nowMs > last) {
            long delta = nowMs - last;
            for (Integer unit : state.getActiveUnits()) {
                state.getRuntimeMillis().merge(unit, delta, Long::sum);
            }
        }
        state.setLastEvaluated(nowMs);
    }

    private boolean elapsed(long lastChange, long delayMs, long nowMs) {
        return lastChange <= 0 || nowMs - lastChange >= delayMs;
    }

    private int selectUnitToStart(StagingState state, RotationPolicy policy, int total) {
        if (policy == RotationPolicy.RANDOM) {
            List<Integer> idle = new ArrayList<>();
            for (int unit = 1; unit <= total; unit++) {
                if (!state.isActive(unit)) {
                    idle.add(unit);
                }
            }
            int unit = idle.get(random.nextInt(idle.size()));
            if (state.activeCount() == 0) {
                state.setLeadUnit(unit);
            }
            return unit;
        }

        if (state.activeCount() == 0 || state.getLeadUnit() == null) {
            int lead = Math.floorMod(state.getRotationPointer(), total) + 1;
            state.setRotationPointer(Math.floorMod(state.getRotationPointer() + 1, total));
            state.setLeadUnit(lead);
            if (!state.isActive(lead)) {
                return lead;
            }
        }
        int start = state.getLeadUnit() - 1;
        for (int offset = 0; offset < total; offset++) {
            int unit = Math.floorMod(start + offset, total) + 1;
            if (!state.isActive(unit)) {
                return unit;
            }
        }
        throw new IllegalStateException("没有可启动的机组: " + state.getGroupId());
    }
}
