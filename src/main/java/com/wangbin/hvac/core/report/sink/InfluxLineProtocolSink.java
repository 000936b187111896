package com.wangbin.hvac.core.report.sink;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.common.utils.HttpClientFactory;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.report.LineProtocolFormatter;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 通过 InfluxDB 3 行协议接口写入控制命令
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.sink", name = "mode", havingValue = "influx")
public class InfluxLineProtocolSink extends AbstractResultSink {

    private final RestTemplate restTemplate;
    private final HvacProperties.SinkConfig config;

    @Autowired
    public InfluxLineProtocolSink(HvacProperties properties) {
        this(HttpClientFactory.createRestTemplate(properties.getSink().getConnectTimeout(),
                properties.getSink().getReadTimeout()), properties.getSink());
    }

    public InfluxLineProtocolSink(RestTemplate restTemplate, HvacProperties.SinkConfig config) {
        super("influx", "InfluxDB 行协议写入端");
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    protected PublishResult doWrite(List<SinkRecord> records) {
        String body = LineProtocolFormatter.format(records);
        if (body.isEmpty()) {
            return PublishResult.skipped(name);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
        if (config.getToken() != null && !config.getToken().isBlank()) {
            headers.setBearerAuth(config.getToken());
        }
        String url = config.getUrl() + "/api/v3/write_lp?db=" + config.getDatabase() + "&precision=nanosecond";

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers),
                    String.class);
            PublishResult result = PublishResult.success(name, records.size());
            result.setStatusCode(response.getStatusCode().value());
            log.debug("写入 InfluxDB 成功：{} 条记录，状态码：{}", records.size(), result.getStatusCode());
            return result;
        } catch (RestClientException e) {
            throw EngineException.publishException("InfluxDB 行协议写入失败: " + e.getMessage(), e);
        }
    }
}
