package com.wangbin.hvac.monitor.health;

import com.wangbin.hvac.core.processor.LocationProcessorManager;
import com.wangbin.hvac.core.processor.ProcessorStatus;
import com.wangbin.hvac.core.processor.TaskStatus;
import com.wangbin.hvac.core.report.ResultPublisher;
import com.wangbin.hvac.core.source.CommandSource;
import com.wangbin.hvac.core.source.TelemetrySource;
import com.wangbin.hvac.core.state.ControllerStateStore;
import com.wangbin.hvac.monitor.health.HealthStatus.Status;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 聚合引擎各组件健康信息的服务。
 */
@Slf4j
@Service
public class SystemHealthService {

    private final LocationProcessorManager processorManager;
    private final ResultPublisher resultPublisher;
    private final ControllerStateStore stateStore;
    private final TelemetrySource telemetrySource;
    private final CommandSource commandSource;

    public SystemHealthService(LocationProcessorManager processorManager, ResultPublisher resultPublisher,
                               ControllerStateStore stateStore, TelemetrySource telemetrySource,
                               CommandSource commandSource) {
        this.processorManager = processorManager;
        this.resultPublisher = resultPublisher;
        this.stateStore = stateStore;
        this.telemetrySource = telemetrySource;
        this.commandSource = commandSource;
    }

    public HealthStatus getSystemHealth() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        components.put("processors", buildProcessorHealth());
        components.put("sink", buildSinkHealth());
        components.put("stateStore", buildStateStoreHealth());
        components.put("sources", ComponentHealth.of("sources", Status.UP, "数据源已配置",
                Map.of("telemetry", telemetrySource.getName(), "commands", commandSource.getName())));

        return HealthStatus.builder()
                .status(HealthStatus.aggregate(components.values()))
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .components(components)
                .build();
    }

    ComponentHealth buildProcessorHealth() {
        List<ProcessorStatus> statuses = processorManager.getStatus();
        int running = 0;
        List<String> failing = new ArrayList<>();
        for (ProcessorStatus status : statuses) {
            if (status.isRunning()) {
                running++;
            }
            for (TaskStatus task : status.getTasks()) {
                if (task.getLastError() != null) {
                    failing.add(task.getLocationId() + "/" + task.getEquipmentType());
                }
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("locations", statuses.size());
        details.put("running", running);
        details.put("failingTasks", failing);

        Status status;
        String message;
        if (statuses.isEmpty()) {
            status = Status.UNKNOWN;
            message = "未配置位置";
        } else if (running == 0) {
            status = Status.DOWN;
            message = "没有运行中的位置处理器";
        } else if (!failing.isEmpty() || running < statuses.size()) {
            status = Status.DEGRADED;
            message = "部分任务失败或部分位置已停止";
        } else {
            status = Status.UP;
            message = "全部位置处理器运行正常";
        }
        return ComponentHealth.of("processors", status, message, details);
    }

    private ComponentHealth buildSinkHealth() {
        try {
            boolean healthy = resultPublisher.isSinkHealthy();
            return ComponentHealth.of("sink:" + resultPublisher.getSinkName(),
                    healthy ? Status.UP : Status.DEGRADED,
                    healthy ? "写入端正常" : "写入端最近写入失败",
                    resultPublisher.getStatistics());
        } catch (Exception e) {
            log.warn("获取写入端健康状态失败", e);
            return ComponentHealth.of("sink", Status.UNKNOWN, "获取写入端状态失败: " + e.getMessage(), null);
        }
    }

    private ComponentHealth buildStateStoreHealth() {
        try {
            return ComponentHealth.of("stateStore:" + stateStore.getName(), Status.UP, "状态存储可用",
                    stateStore.getStatistics());
        } catch (Exception e) {
            log.warn("获取状态存储健康状态失败", e);
            return ComponentHealth.of("stateStore", Status.DOWN, "状态存储不可用: " + e.getMessage(), null);
        }
    }
}
