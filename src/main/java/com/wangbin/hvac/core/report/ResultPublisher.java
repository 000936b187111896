package com.wangbin.hvac.core.report;

import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import com.wangbin.hvac.core.report.sink.ResultSink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 控制结果发布服务
 *
 * 职责：
 * 1. 按设备类型白名单过滤执行器命令
 * 2. 组装带标签的记录并交给写入端
 * 3. 失败只记录与计数，不向控制周期抛出异常
 */
@Slf4j
@Service
public class ResultPublisher {

    private final ResultSink sink;
    private final String measurement;

    private final AtomicLong publishCount = new AtomicLong(0);
    private final AtomicLong successCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    private final AtomicLong skippedCount = new AtomicLong(0);

    public ResultPublisher(ResultSink sink, HvacProperties properties) {
        this(sink, properties.getSink().getMeasurement());
    }

    public ResultPublisher(ResultSink sink, String measurement) {
        this.sink = sink;
        this.measurement = measurement;
    }

    @PostConstruct
    public void init() {
        try {
            sink.init();
            log.info("结果发布服务初始化完成，写入端：{}，测量名：{}", sink.getName(), measurement);
        } catch (Exception e) {
            // 写入端在下一次写入时重新连接
            log.error("结果写入端初始化失败：{}，将在写入时重试", sink.getName(), e);
        }
    }

    /**
     * 发布单台设备的控制结果
     */
    public PublishResult publish(LocationProfile location, ControlResult result) {
        publishCount.incrementAndGet();
        try {
            SinkRecord record = buildRecord(location, result);
            if (record == null) {
                skippedCount.incrementAndGet();
                log.debug("设备 {} 无可执行字段，跳过写入", result.getEquipmentId());
                return PublishResult.skipped(sink.getName());
            }
            PublishResult publishResult = sink.write(List.of(record));
            if (publishResult.isSuccess()) {
                successCount.incrementAndGet();
            } else {
                failureCount.incrementAndGet();
                log.warn("设备 {}/{} 控制结果写入失败：{}", location.getId(), result.getEquipmentId(),
                        publishResult.getErrorMessage());
            }
            return publishResult;
        } catch (Exception e) {
            failureCount.incrementAndGet();
            log.error("发布控制结果异常：{}/{}", location.getId(), result.getEquipmentId(), e);
            return PublishResult.error(sink.getName(), e.getMessage());
        }
    }

    /**
     * 组装记录，无可执行字段时返回 null
     */
    public SinkRecord buildRecord(LocationProfile location, ControlResult result) {
        Map<String, Object> actionable = ActionableFieldFilter.filter(result.getEquipmentType(),
                result.getCommands() != null ? result.getCommands().asMap() : null);
        if (actionable.isEmpty()) {
            return null;
        }

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("locationName", location.getDisplayName());
        tags.put("equipmentType", result.getEquipmentType().getCode());
        tags.put("equipmentId", result.getEquipmentId());
        tags.put("source", location.getId() + "-processor");

        Map<String, Object> fields = new LinkedHashMap<>(actionable);
        fields.put("timestamp", result.getTimestamp());
        if (result.getMode() != null) {
            fields.put("controlMode", result.getMode().name().toLowerCase());
        }
        if (result.getSetpointSource() != null) {
            fields.put("setpointSource", result.getSetpointSource().name().toLowerCase());
        }

        return SinkRecord.builder()
                .measurement(measurement)
                .locationId(location.getId())
                .equipmentId(result.getEquipmentId())
                .equipmentType(result.getEquipmentType().getCode())
                .tags(tags)
                .fields(fields)
                .timestamp(result.getTimestamp())
                .build();
    }

    public String getSinkName() {
        return sink.getName();
    }

    public boolean isSinkHealthy() {
        return sink.isHealthy();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("publishCount", publishCount.get());
        stats.put("successCount", successCount.get());
        stats.put("failureCount", failureCount.get());
        stats.put("skippedCount", skippedCount.get());
        stats.put("sink", sink.getStatistics());
        return stats;
    }

    @PreDestroy
    public void destroy() {
        log.info("关闭结果发布服务，写入端：{}", sink.getName());
        sink.destroy();
    }
}
