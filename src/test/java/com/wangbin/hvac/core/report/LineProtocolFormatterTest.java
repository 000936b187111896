package com.wangbin.hvac.core.report;

import com.wangbin.hvac.core.report.model.SinkRecord;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LineProtocolFormatterTest {

    private static SinkRecord record(Map<String, Object> fields) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("locationName", "NE Realty");
        tags.put("equipmentId", "geo-1");
        return SinkRecord.builder()
                .measurement("hvac_commands")
                .tags(tags)
                .fields(fields)
                .timestamp(1_700_000_000_000L)
                .build();
    }

    @Test
    void encodesTagsFieldsAndNanosecondTimestamp() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("stage1Enable", true);
        fields.put("activeStages", 2L);
        fields.put("loopSetpoint", 45.0);
        fields.put("controlMode", "cooling");

        String line = LineProtocolFormatter.format(record(fields));

        assertEquals("hvac_commands,locationName=NE\\ Realty,equipmentId=geo-1 "
                + "stage1Enable=t,activeStages=2i,loopSetpoint=45.0,controlMode=\"cooling\" "
                + "1700000000000000000", line);
    }

    @Test
    void skipsNonFiniteValuesAndEmptyRecords() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("pumpSpeed", Double.NaN);

        assertNull(LineProtocolFormatter.format(record(fields)));
        assertEquals("", LineProtocolFormatter.format(List.of(record(fields))));
    }

    @Test
    void escapesSpecialCharacters() {
        assertEquals("\"say \\\"hi\\\"\"", LineProtocolFormatter.formatValue("say \"hi\""));
        assertEquals("a\\,b\\=c\\ d", LineProtocolFormatter.escapeKey("a,b=c d"));
        assertEquals("m\\,x=y\\ z", LineProtocolFormatter.escapeMeasurement("m,x=y z"));
        assertEquals("f", LineProtocolFormatter.formatValue(false));
        assertEquals("7i", LineProtocolFormatter.formatValue(7));
    }

    @Test
    void joinsMultipleRecordsWithNewlines() {
        String body = LineProtocolFormatter.format(List.of(
                record(Map.of("pumpEnable", true)),
                record(Map.of("pumpEnable", false))));

        assertEquals(2, body.split("\n").length);
    }
}
