package com.wangbin.hvac.monitor.factory;

import com.wangbin.hvac.monitor.alert.AlertNotification;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 单台设备最近一个控制周期的性能指标
 */
@Value
@Builder(toBuilder = true)
public class PerformanceSnapshot {
    String locationId;
    String equipmentId;
    String equipmentType;
    String controlMode;
    Double setpoint;
    /** 效率百分比，不适用时为 null */
    Double efficiency;
    /** excellent / good / fair / poor，非温控设备为 null */
    String temperatureStability;
    Double powerKw;
    /** 地源热泵运行时间均衡质量 */
    String runtimeBalance;
    /** 地源热泵分级有效性 */
    Double stagingEffectiveness;
    @Builder.Default
    Map<String, Double> metrics = Collections.emptyMap();
    @Builder.Default
    List<AlertNotification> alerts = Collections.emptyList();
    long timestamp;
}
