package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.report.model.PublishResult;
import lombok.Value;

/**
 * 单台设备一次控制周期的完整输入输出
 */
@Value
public class ControlCycleEvent {
    LocationProfile location;
    EquipmentConfig equipment;
    TelemetrySnapshot telemetry;
    UserSettings settings;
    ControlResult result;
    PublishResult publishResult;
}
