package com.wangbin.hvac.core.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.common.utils.JsonUtil;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.UserCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 从 InfluxDB 的 UIControlCommands 读取用户命令
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.source", name = "mode", havingValue = "influx")
public class InfluxCommandSource implements CommandSource {

    private final InfluxSqlClient client;
    private final HvacProperties.SourceConfig config;

    public InfluxCommandSource(HvacProperties properties, ObjectMapper objectMapper) {
        this(new InfluxSqlClient(properties.getSource(), objectMapper), properties.getSource());
    }

    InfluxCommandSource(InfluxSqlClient client, HvacProperties.SourceConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    public String getName() {
        return "influx";
    }

    @Override
    public List<UserCommand> recentCommands(String locationId, EquipmentType type, Duration lookback, int limit) {
        String sql = String.format(
                "SELECT * FROM %s WHERE \"locationId\" = %s AND (\"equipmentType\" = %s OR command LIKE %s) "
                        + "AND time >= now() - INTERVAL '%d minutes' ORDER BY time DESC LIMIT %d",
                config.getCommandTable(), InfluxSqlClient.literal(locationId),
                InfluxSqlClient.literal(type.getCode()), InfluxSqlClient.literal("%" + type.getCode() + "%"),
                Math.max(1, lookback.toMinutes()), limit);
        try {
            List<Map<String, Object>> rows = client.query(config.getCommandDatabase(), sql);
            List<UserCommand> commands = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                commands.add(toCommand(row, locationId, type));
            }
            log.debug("位置 {} {} 读取到 {} 条用户命令", locationId, type.getCode(), commands.size());
            return commands;
        } catch (Exception e) {
            throw EngineException.sourceException("读取用户命令失败", locationId, type.getCode(), e);
        }
    }

    private UserCommand toCommand(Map<String, Object> row, String locationId, EquipmentType type) {
        Object commandType = row.getOrDefault("commandType", row.get("command"));
        Object value = row.get("value");
        return UserCommand.builder()
                .locationId(locationId)
                .equipmentId(stringOf(row.get("equipmentId")))
                .equipmentType(type.getCode())
                .commandType(stringOf(commandType))
                .value(value instanceof String text ? JsonUtil.parseScalar(text) : value)
                .modifiedBy(stringOf(row.getOrDefault("modifiedBy", row.get("userId"))))
                .modifiedAt(InfluxTelemetrySource.parseTime(row.get("time")))
                .build();
    }

    private static String stringOf(Object value) {
        return value == null ? null : value.toString();
    }
}
