package com.wangbin.hvac.core.staging;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分级设备组状态，只由 StagingCoordinator 修改。机组编号从 1 开始。
 */
@Data
@NoArgsConstructor
public class StagingState {

    private String groupId;
    private int totalStages;

    /** 运行中的机组，按启动顺序 */
    private List<Integer> activeUnits = new ArrayList<>();

    /** 运行中机组的启动时间（毫秒） */
    private Map<Integer, Long> startTimes = new LinkedHashMap<>();

    /** 各机组累计运行时间（毫秒） */
    private Map<Integer, Long> runtimeMillis = new LinkedHashMap<>();

    /** 最近一次加/减级时间，0 表示从未变化 */
    private long lastStageChange;

    /** 下一次从零启动时的领先机组下标（0 起） */
    private int rotationPointer;

    /** 本轮运行的领先机组 */
    private Integer leadUnit;

    private long lastEvaluated;

    public static StagingState initial(String groupId, int totalStages) {
        StagingState state = new StagingState();
        state.setGroupId(groupId);
        state.setTotalStages(totalStages);
        for (int unit = 1; unit <= totalStages; unit++) {
            state.getRuntimeMillis().put(unit, 0L);
        }
        return state;
    }

    public int activeCount() {
        return activeUnits.size();
    }

    public boolean isActive(int unit) {
        return activeUnits.contains(unit);
    }

    public long runtimeSeconds(int unit) {
        return runtimeMillis.getOrDefault(unit, 0L) / 1000;
    }

    public StagingState copy() {
        StagingState copy = new StagingState();
        copy.groupId = groupId;
        copy.totalStages = totalStages;
        copy.activeUnits = new ArrayList<>(activeUnits);
        copy.startTimes = new LinkedHashMap<>(startTimes);
        copy.runtimeMillis = new LinkedHashMap<>(runtimeMillis);
        copy.lastStageChange = lastStageChange;
        copy.rotationPointer = rotationPointer;
        copy.leadUnit = leadUnit;
        copy.lastEvaluated = lastEvaluated;
        return copy;
    }
}
