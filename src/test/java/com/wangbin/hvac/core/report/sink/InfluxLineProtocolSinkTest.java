package com.wangbin.hvac.core.report.sink;

import com.wangbin.hvac.common.utils.HttpClientFactory;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

class InfluxLineProtocolSinkTest {

    private static final String WRITE_URL =
            "http://localhost:8181/api/v3/write_lp?db=NeuralControlCommands&precision=nanosecond";

    private MockRestServiceServer server;
    private InfluxLineProtocolSink sink;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = HttpClientFactory.createRestTemplate(1000, 1000);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        sink = new InfluxLineProtocolSink(restTemplate, new HvacProperties.SinkConfig());
    }

    private static SinkRecord record(String locationName) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("locationName", locationName);
        tags.put("equipmentId", "fcu-1");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("unitEnable", true);
        return SinkRecord.builder()
                .measurement("NeuralControlCommands")
                .tags(tags)
                .fields(fields)
                .timestamp(1_700_000_000_000L)
                .build();
    }

    @Test
    void nonAsciiTagsAreWrittenAsUtf8() {
        String expected = "NeuralControlCommands,locationName=亨廷顿,equipmentId=fcu-1 unitEnable=t 1700000000000000000";
        server.expect(requestTo(WRITE_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType("text/plain;charset=UTF-8"))
                .andExpect(content().bytes(expected.getBytes(StandardCharsets.UTF_8)))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        PublishResult result = sink.write(List.of(record("亨廷顿")));

        server.verify();
        assertTrue(result.isSuccess());
        assertEquals(204, result.getStatusCode().intValue());
    }

    @Test
    void serverErrorIsReportedAsFailedWrite() {
        server.expect(requestTo(WRITE_URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        PublishResult result = sink.write(List.of(record("Huntington")));

        assertFalse(result.isSuccess());
        assertEquals(1, sink.getFailureWriteCount().get());
    }

    @Test
    void stringConverterUsesUtf8() {
        RestTemplate restTemplate = HttpClientFactory.createRestTemplate(1000, 1000);

        assertEquals(StandardCharsets.UTF_8, restTemplate.getMessageConverters().stream()
                .filter(converter -> converter instanceof StringHttpMessageConverter)
                .map(converter -> ((StringHttpMessageConverter) converter)
                        .getDefaultCharset())
                .findFirst()
                .orElseThrow());
    }
}
