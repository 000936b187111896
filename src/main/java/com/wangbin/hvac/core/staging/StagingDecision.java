package com.wangbin.hvac.core.staging;

import lombok.Value;

/**
 * 一次分级评估的结果
 */
@Value
public class StagingDecision {

    StagingState state;
    Action action;
    /** 本次启动或停止的机组，无动作时为 null */
    Integer unit;
    int requiredStages;
    String reason;

    public int activeStages() {
        return state.activeCount();
    }

    public enum Action {
        NONE,
        STAGE_UP,
        STAGE_DOWN,
        /** 条件满足但被延时或最小运行时间挡住 */
        HOLD,
        EMERGENCY_STOP
    }
}
