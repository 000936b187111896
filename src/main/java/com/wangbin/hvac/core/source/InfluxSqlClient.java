package com.wangbin.hvac.core.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.hvac.common.utils.HttpClientFactory;
import com.wangbin.hvac.core.config.HvacProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * InfluxDB 3 SQL 查询客户端（/api/v3/query_sql）
 */
@Slf4j
public class InfluxSqlClient {

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String token;

    public InfluxSqlClient(HvacProperties.SourceConfig config, ObjectMapper objectMapper) {
        this(HttpClientFactory.createRestTemplate(config.getConnectTimeout(), config.getReadTimeout()),
                objectMapper, config.getUrl(), config.getToken());
    }

    public InfluxSqlClient(RestTemplate restTemplate, ObjectMapper objectMapper, String url, String token) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.url = url;
        this.token = token;
    }

    /**
     * 执行查询，返回行列表；HTTP或解析错误向上抛出
     */
    public List<Map<String, Object>> query(String database, String sql) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("q", sql);
        body.put("db", database);

        log.debug("执行Influx查询: db={}, sql={}", database, sql);
        ResponseEntity<String> response = restTemplate.postForEntity(url + "/api/v3/query_sql",
                new HttpEntity<>(body, headers), String.class);
        String payload = response.getBody();
        if (payload == null || payload.isBlank()) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> rows = objectMapper.readValue(payload, ROWS);
        return rows != null ? rows : Collections.emptyList();
    }

    /**
     * SQL 字符串字面量转义
     */
    public static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
