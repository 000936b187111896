package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.staging.UnitHealth;

/**
 * 设备控制策略接口
 *
 * 每种设备类型一个实现，(遥测, 用户设定, 持久化状态) → (执行器命令, 下一周期状态)。
 * 位置差异通过 LocationProfile 注入。
 */
public interface EquipmentStrategy {

    EquipmentType getType();

    /**
     * 执行一个控制周期，实现保证不向外抛出异常
     */
    ControlResult execute(ControlContext context);

    /**
     * 冗余组内健康判定，用于主备切换
     */
    default UnitHealth assessHealth(LocationProfile location, EquipmentConfig equipment,
                                    TelemetrySnapshot telemetry) {
        return UnitHealth.healthy();
    }
}
