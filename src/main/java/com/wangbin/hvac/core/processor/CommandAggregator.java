package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.common.utils.JsonUtil;
import com.wangbin.hvac.common.utils.ValueUtils;
import com.wangbin.hvac.core.model.UserCommand;
import com.wangbin.hvac.core.model.UserSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 将用户命令按设备聚合为期望状态，同一命令类型以最新一条为准
 */
@Slf4j
public final class CommandAggregator {

    private static final String UPDATE_PREFIX = "update_";

    private static final Set<String> ENABLE_TYPES = Set.of(
            "enabled", "enable", "unitEnable", "boilerEnable", "pumpEnable", "chillerEnable", "systemEnable");

    private static final Set<String> SETPOINT_TYPES = Set.of(
            "setpoint", "temperatureSetpoint", "tempSetpoint", "waterTempSetpoint", "supplyTempSetpoint",
            "loopSetpoint");

    private static final Set<String> LEAD_TYPES = Set.of(
            "isLead", "isLeadBoiler", "isLeadPump", "isLeadChiller");

    private CommandAggregator() {
    }

    public static Map<String, UserSettings> aggregate(List<UserCommand> commands) {
        Map<String, Builder> builders = new LinkedHashMap<>();
        if (commands == null || commands.isEmpty()) {
            return new LinkedHashMap<>();
        }

        List<UserCommand> ordered = new ArrayList<>(commands);
        ordered.sort(Comparator.comparingLong(UserCommand::getModifiedAt).reversed());

        for (UserCommand command : ordered) {
            if (command.getEquipmentId() == null || command.getCommandType() == null) {
                log.debug("忽略不完整的用户命令: {}", command);
                continue;
            }
            builders.computeIfAbsent(command.getEquipmentId(), Builder::new).accept(command);
        }

        Map<String, UserSettings> settings = new LinkedHashMap<>();
        builders.forEach((equipmentId, builder) -> settings.put(equipmentId, builder.build()));
        return settings;
    }

    static String normalizeType(String commandType) {
        String type = commandType.trim();
        return type.startsWith(UPDATE_PREFIX) ? type.substring(UPDATE_PREFIX.length()) : type;
    }

    private static Object normalizeValue(Object value) {
        return value instanceof String text ? JsonUtil.parseScalar(text) : value;
    }

    private static final class Builder {
        private final String equipmentId;
        private final Set<String> seenTypes = new HashSet<>();
        private Boolean enabled;
        private Double setpoint;
        private Boolean isLead;
        private String modifiedBy;
        private long modifiedAt;
        private final Map<String, Object> overrides = new LinkedHashMap<>();

        private Builder(String equipmentId) {
            this.equipmentId = equipmentId;
        }

        void accept(UserCommand command) {
            String type = normalizeType(command.getCommandType());
            if (!seenTypes.add(type)) {
                return;
            }
            if (modifiedBy == null) {
                modifiedBy = command.getModifiedBy();
                modifiedAt = command.getModifiedAt();
            }
            Object value = normalizeValue(command.getValue());

            if (ENABLE_TYPES.contains(type)) {
                if (enabled == null) {
                    enabled = ValueUtils.toBoolean(value);
                }
            } else if (SETPOINT_TYPES.contains(type)) {
                if (setpoint == null) {
                    setpoint = ValueUtils.toDouble(value);
                }
            } else if (LEAD_TYPES.contains(type)) {
                if (isLead == null) {
                    isLead = ValueUtils.toBoolean(value);
                }
            } else if (value != null) {
                overrides.put(type, value);
            }
        }

        UserSettings build() {
            return UserSettings.builder()
                    .equipmentId(equipmentId)
                    .enabled(enabled)
                    .setpoint(setpoint)
                    .isLead(isLead)
                    .modifiedBy(modifiedBy)
                    .modifiedAt(modifiedAt)
                    .overrides(overrides)
                    .build();
        }
    }
}
