package com.wangbin.hvac.core.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 从 InfluxDB 读取设备最新指标
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.source", name = "mode", havingValue = "influx")
public class InfluxTelemetrySource implements TelemetrySource {

    private final InfluxSqlClient client;
    private final HvacProperties.SourceConfig config;

    public InfluxTelemetrySource(HvacProperties properties, ObjectMapper objectMapper) {
        this(new InfluxSqlClient(properties.getSource(), objectMapper), properties.getSource());
    }

    InfluxTelemetrySource(InfluxSqlClient client, HvacProperties.SourceConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    public String getName() {
        return "influx";
    }

    @Override
    public Optional<TelemetrySnapshot> latest(String locationId, String equipmentId) {
        String sql = String.format(
                "SELECT * FROM %s WHERE \"equipmentId\" = %s AND time >= now() - INTERVAL '%d minutes' "
                        + "ORDER BY time DESC LIMIT 1",
                config.getTelemetryTable(), InfluxSqlClient.literal(equipmentId),
                Math.max(1, config.getTelemetryMaxAge().toMinutes()));
        try {
            List<Map<String, Object>> rows = client.query(config.getTelemetryDatabase(), sql);
            if (rows.isEmpty()) {
                log.debug("设备 {}/{} 没有最新遥测", locationId, equipmentId);
                return Optional.empty();
            }
            Map<String, Object> metrics = new LinkedHashMap<>(rows.get(0));
            long timestamp = parseTime(metrics.remove("time"));
            return Optional.of(new TelemetrySnapshot(equipmentId, timestamp, metrics));
        } catch (Exception e) {
            throw EngineException.sourceException("读取设备 " + equipmentId + " 遥测失败", locationId, null, e);
        }
    }

    static long parseTime(Object value) {
        if (value == null) {
            return System.currentTimeMillis();
        }
        if (value instanceof Number number) {
            long raw = number.longValue();
            // 纳秒时间戳
            return raw > 10_000_000_000_000L ? raw / 1_000_000 : raw;
        }
        String text = value.toString();
        try {
            return Instant.parse(text.endsWith("Z") || text.contains("+") ? text : text + "Z").toEpochMilli();
        } catch (DateTimeParseException e) {
            return System.currentTimeMillis();
        }
    }
}
