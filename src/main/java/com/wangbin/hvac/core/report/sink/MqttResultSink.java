package com.wangbin.hvac.core.report.sink;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.common.utils.JsonUtil;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MQTT v5 写入端，每条记录发布为一条 JSON 消息
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.sink", name = "mode", havingValue = "mqtt")
public class MqttResultSink extends AbstractResultSink {

    private static final long PUBLISH_TIMEOUT_MS = 5000;

    private final HvacProperties.MqttConfig config;
    private MqttAsyncClient client;

    @Autowired
    public MqttResultSink(HvacProperties properties) {
        this(properties.getSink().getMqtt());
    }

    public MqttResultSink(HvacProperties.MqttConfig config) {
        super("mqtt", "MQTT v5 写入端");
        this.config = config;
    }

    @Override
    protected void doInit() throws Exception {
        client = new MqttAsyncClient(config.getBrokerUrl(), config.getClientId(), new MemoryPersistence());
        connect();
    }

    private synchronized void connect() throws MqttException {
        if (client.isConnected()) {
            return;
        }
        MqttConnectionOptions options = new MqttConnectionOptions();
        options.setCleanStart(true);
        options.setAutomaticReconnect(true);
        options.setConnectionTimeout(config.getConnectionTimeout());
        options.setKeepAliveInterval(config.getKeepAliveInterval());
        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            options.setUserName(config.getUsername());
        }
        if (config.getPassword() != null && !config.getPassword().isEmpty()) {
            options.setPassword(config.getPassword().getBytes(StandardCharsets.UTF_8));
        }
        IMqttToken token = client.connect(options);
        token.waitForCompletion(config.getConnectionTimeout() * 1000L);
        log.info("MQTT 写入端已连接：{}", config.getBrokerUrl());
    }

    @Override
    protected PublishResult doWrite(List<SinkRecord> records) throws Exception {
        if (client == null) {
            throw EngineException.publishException("MQTT 客户端未初始化", null);
        }
        if (!client.isConnected()) {
            connect();
        }

        int published = 0;
        for (SinkRecord record : records) {
            MqttMessage message = new MqttMessage(buildPayload(record));
            message.setQos(config.getQos());
            message.setRetained(config.isRetained());
            String topic = resolveTopic(record);
            IMqttToken token = client.publish(topic, message);
            token.waitForCompletion(PUBLISH_TIMEOUT_MS);
            published++;
            log.debug("MQTT 发布成功：{}，字段数：{}", topic, record.getFields().size());
        }
        return PublishResult.success(name, published);
    }

    String resolveTopic(SinkRecord record) {
        return config.getTopic()
                .replace("{locationId}", nullToEmpty(record.getLocationId()))
                .replace("{equipmentType}", nullToEmpty(record.getEquipmentType()))
                .replace("{equipmentId}", nullToEmpty(record.getEquipmentId()));
    }

    private byte[] buildPayload(SinkRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("measurement", record.getMeasurement());
        payload.put("tags", record.getTags());
        payload.put("fields", record.getFields());
        payload.put("timestamp", record.getTimestamp());
        return JsonUtil.toJsonString(payload).getBytes(StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public boolean isHealthy() {
        return client != null && client.isConnected() && super.isHealthy();
    }

    @Override
    protected void doDestroy() throws Exception {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect().waitForCompletion(PUBLISH_TIMEOUT_MS);
            }
        } finally {
            client.close();
        }
    }
}
