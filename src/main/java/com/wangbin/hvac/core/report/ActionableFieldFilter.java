package com.wangbin.hvac.core.report;

import com.wangbin.hvac.core.model.EquipmentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 可执行字段白名单，只有白名单内的命令会写入执行器侧
 */
public final class ActionableFieldFilter {

    private static final Set<String> GLOBAL_FIELDS = Set.of("steamValve", "steamEnable", "unitEnable");

    private static final Pattern STAGE_ENABLE = Pattern.compile("stage\\d+Enable");

    private static final Map<EquipmentType, Set<String>> ALLOWED = new EnumMap<>(EquipmentType.class);

    static {
        Set<String> zone = Set.of("unitEnable", "fanEnabled", "fanEnable", "fanSpeed",
                "heatingValve", "heatingValvePosition", "coolingValve", "coolingValvePosition",
                "outdoorDamper", "outdoorDamperPosition", "temperatureSetpoint", "tempSetpoint");
        ALLOWED.put(EquipmentType.FAN_COIL, zone);
        ALLOWED.put(EquipmentType.AIR_HANDLER, zone);
        ALLOWED.put(EquipmentType.BOILER,
                Set.of("boilerEnable", "boilerFiring", "waterTempSetpoint", "tempSetpoint", "isLead"));
        ALLOWED.put(EquipmentType.CHILLER,
                Set.of("chillerEnable", "chillerStage", "chillerSetpoint", "cwTempSetpoint"));
        ALLOWED.put(EquipmentType.PUMP, Set.of("pumpEnable", "pumpSpeed", "isLead"));
        ALLOWED.put(EquipmentType.GEO_PLANT, Set.of("activeStages", "loopSetpoint"));
        ALLOWED.put(EquipmentType.STEAM_BUNDLE,
                Set.of("primaryValvePosition", "secondaryValvePosition", "temperatureSetpoint"));
        ALLOWED.put(EquipmentType.DOAS, Set.of("fanEnabled", "heatingEnabled", "coolingEnabled",
                "gasValvePosition", "dxStage1Enabled", "dxStage2Enabled", "supplyAirSetpoint"));
    }

    private ActionableFieldFilter() {
    }

    public static boolean isActionable(EquipmentType type, String field) {
        if (GLOBAL_FIELDS.contains(field)) {
            return true;
        }
        if (type == EquipmentType.GEO_PLANT && STAGE_ENABLE.matcher(field).matches()) {
            return true;
        }
        return ALLOWED.getOrDefault(type, Collections.emptySet()).contains(field);
    }

    /**
     * 过滤命令，保持原有顺序并丢弃空值
     */
    public static Map<String, Object> filter(EquipmentType type, Map<String, Object> commands) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (commands == null) {
            return filtered;
        }
        commands.forEach((field, value) -> {
            if (value != null && isActionable(type, field)) {
                filtered.put(field, value);
            }
        });
        return filtered;
    }
}
