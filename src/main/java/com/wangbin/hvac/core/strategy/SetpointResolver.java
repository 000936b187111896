package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.common.utils.ValueUtils;
import com.wangbin.hvac.core.config.OarCalibration;
import com.wangbin.hvac.core.model.SetpointSource;
import com.wangbin.hvac.core.model.UserSettings;
import lombok.extern.slf4j.Slf4j;

/**
 * 有效设定值解析，严格按优先级：用户设定 → 设置固定值 → 室外温度补偿 → 默认值
 */
@Slf4j
public final class SetpointResolver {

    private SetpointResolver() {
    }

    public static ResolvedSetpoint resolve(UserSettings settings, Double fixedSetpoint, OarCalibration oar,
                                           Double outdoorTemp, double defaultSetpoint,
                                           double minSetpoint, double maxSetpoint) {
        if (settings != null && settings.getSetpoint() != null) {
            if (settings.setpointValue().isPresent()) {
                double value = ValueUtils.clamp(settings.getSetpoint(), minSetpoint, maxSetpoint);
                return new ResolvedSetpoint(value, SetpointSource.USER);
            }
            log.warn("设备 {} 用户设定值无效: {}，忽略", settings.getEquipmentId(), settings.getSetpoint());
        }
        if (fixedSetpoint != null && Double.isFinite(fixedSetpoint)) {
            return new ResolvedSetpoint(ValueUtils.clamp(fixedSetpoint, minSetpoint, maxSetpoint),
                    SetpointSource.SETTINGS);
        }
        if (oar != null && oar.isEnabled() && outdoorTemp != null && Double.isFinite(outdoorTemp)) {
            return new ResolvedSetpoint(oar.calculate(outdoorTemp), SetpointSource.OUTDOOR_AIR_RESET);
        }
        return new ResolvedSetpoint(defaultSetpoint, SetpointSource.DEFAULT);
    }
}
