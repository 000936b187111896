package com.wangbin.hvac.core.source;

import com.wangbin.hvac.core.model.TelemetrySnapshot;

import java.util.Optional;

/**
 * 遥测数据源：提供 (位置, 设备) 的最新规范化指标
 */
public interface TelemetrySource {

    String getName();

    /**
     * 读取失败抛出 EngineException，没有数据返回空
     */
    Optional<TelemetrySnapshot> latest(String locationId, String equipmentId);
}
