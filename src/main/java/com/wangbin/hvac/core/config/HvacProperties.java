package com.wangbin.hvac.core.config;

import com.wangbin.hvac.monitor.alert.AlertCondition;
import com.wangbin.hvac.monitor.alert.AlertLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 控制引擎配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "hvac")
public class HvacProperties {

    /**
     * 位置处理器配置
     */
    private ProcessorConfig processor = new ProcessorConfig();

    /**
     * 控制器状态存储配置
     */
    private StateConfig state = new StateConfig();

    /**
     * 遥测/命令数据源配置
     */
    private SourceConfig source = new SourceConfig();

    /**
     * 结果写入配置
     */
    private SinkConfig sink = new SinkConfig();

    /**
     * 告警规则
     */
    private AlertConfig alert = new AlertConfig();

    /**
     * 位置列表
     */
    private List<LocationProfile> locations = new ArrayList<>();

    public Optional<LocationProfile> findLocation(String locationId) {
        return locations.stream()
                .filter(location -> location.getId().equalsIgnoreCase(locationId))
                .findFirst();
    }

    // =============== 配置类定义 ===============

    @Data
    public static class ProcessorConfig {
        /** 启动后自动开始调度 */
        private boolean autoStart = true;
        /** 用户命令回看窗口 */
        private Duration commandLookback = Duration.ofMinutes(15);
        /** 单次读取命令上限 */
        private int commandLimit = 20;
        private int schedulerThreads = 2;
        private int workerThreads = 8;
        private int workerQueueCapacity = 200;
        /** 停机时等待任务结束的时间 */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /** 首次执行延迟 */
        private Duration initialDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class StateConfig {
        /** memory 或 redis */
        private String store = "memory";
        /** 状态过期时间，超过后视为全新控制器 */
        private Duration ttl = Duration.ofHours(24);
        private long maxSize = 10000;
        private String keyPrefix = "hvac:state:";
    }

    @Data
    public static class SourceConfig {
        /** memory 或 influx */
        private String mode = "memory";
        private String url = "http://localhost:8181";
        private String telemetryDatabase = "Locations";
        private String telemetryTable = "metrics";
        private String commandDatabase = "UIControlCommands";
        private String commandTable = "UIControlCommands";
        /** 遥测最大允许陈旧时间 */
        private Duration telemetryMaxAge = Duration.ofMinutes(5);
        private int connectTimeout = 5000;
        private int readTimeout = 10000;
        private String token;
    }

    @Data
    public static class SinkConfig {
        /** influx、mqtt 或 log */
        private String mode = "log";
        private String measurement = "NeuralControlCommands";
        private String url = "http://localhost:8181";
        private String database = "NeuralControlCommands";
        private String token;
        private int connectTimeout = 5000;
        private int readTimeout = 10000;
        private MqttConfig mqtt = new MqttConfig();
    }

    @Data
    public static class MqttConfig {
        private String brokerUrl = "tcp://localhost:1883";
        private String clientId = "hvac-control-engine";
        private String username;
        private String password;
        /** 支持 {locationId}、{equipmentType}、{equipmentId} 占位符 */
        private String topic = "hvac/commands/{locationId}/{equipmentId}";
        private int qos = 1;
        private boolean retained = true;
        private int connectionTimeout = 10;
        private int keepAliveInterval = 60;
    }

    @Data
    public static class AlertConfig {
        private boolean enabled = true;
        /** 每台设备保留的最近告警数量 */
        private int historySize = 200;
        private List<RuleConfig> rules = new ArrayList<>();
    }

    @Data
    public static class RuleConfig {
        private String id;
        private String name;
        private AlertLevel level = AlertLevel.WARNING;
        private String metric;
        private AlertCondition.Comparator comparator = AlertCondition.Comparator.GREATER_THAN;
        private double threshold;
        private String notificationChannel = "log";
    }
}
