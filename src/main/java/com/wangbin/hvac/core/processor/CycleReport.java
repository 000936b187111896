package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.model.EquipmentType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次 (位置, 设备类型) 周期的处理汇总
 */
@Value
@Builder
public class CycleReport {
    String locationId;
    EquipmentType equipmentType;
    int equipmentCount;
    int processed;
    /** 无遥测而跳过的设备 */
    int skipped;
    int failed;
    int published;
    int commandCount;
    List<String> failedEquipment;
    long durationMs;
}
