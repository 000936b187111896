package com.wangbin.hvac.core.report;

import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.SetpointSource;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import com.wangbin.hvac.core.report.sink.RecordingResultSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultPublisherTest {

    private RecordingResultSink sink;
    private ResultPublisher publisher;
    private LocationProfile location;

    @BeforeEach
    void setUp() {
        sink = new RecordingResultSink();
        publisher = new ResultPublisher(sink, "hvac_commands");
        publisher.init();
        location = new LocationProfile();
        location.setId("huntington");
        location.setName("Huntington");
    }

    private static ControlResult fanCoilResult(ActuatorCommands commands) {
        return ControlResult.builder()
                .locationId("huntington")
                .equipmentId("fc-101")
                .equipmentType(EquipmentType.FAN_COIL)
                .mode(ControlMode.COOLING)
                .effectiveSetpoint(72.0)
                .setpointSource(SetpointSource.OUTDOOR_AIR_RESET)
                .commands(commands)
                .timestamp(1_700_000_000_000L)
                .build();
    }

    @Test
    void recordCarriesTagsAndActionableFields() {
        ControlResult result = fanCoilResult(new ActuatorCommands()
                .flag("unitEnable", true)
                .percent("coolingValvePosition", 30)
                .text("debugNote", "ignored"));

        PublishResult publishResult = publisher.publish(location, result);

        assertTrue(publishResult.isSuccess());
        assertEquals(1, sink.getRecords().size());
        SinkRecord record = sink.getRecords().get(0);
        assertEquals("hvac_commands", record.getMeasurement());
        assertEquals("Huntington", record.getTags().get("locationName"));
        assertEquals("fan-coil", record.getTags().get("equipmentType"));
        assertEquals("fc-101", record.getTags().get("equipmentId"));
        assertEquals("huntington-processor", record.getTags().get("source"));
        assertEquals(true, record.getFields().get("unitEnable"));
        assertEquals("cooling", record.getFields().get("controlMode"));
        assertEquals("outdoor_air_reset", record.getFields().get("setpointSource"));
        assertEquals(1_700_000_000_000L, record.getFields().get("timestamp"));
        assertFalse(record.getFields().containsKey("debugNote"));
    }

    @Test
    void nothingActionableIsSkipped() {
        ControlResult result = fanCoilResult(new ActuatorCommands().text("debugNote", "only"));

        PublishResult publishResult = publisher.publish(location, result);

        assertTrue(publishResult.isSkipped());
        assertTrue(sink.getRecords().isEmpty());
        assertEquals(1L, publisher.getStatistics().get("skippedCount"));
    }

    @Test
    void sinkFailureIsReportedNotThrown() {
        sink.setFailing(true);

        PublishResult publishResult = publisher.publish(location,
                fanCoilResult(new ActuatorCommands().flag("unitEnable", true)));

        assertFalse(publishResult.isSuccess());
        assertNotNull(publishResult.getErrorMessage());
        assertEquals(1L, publisher.getStatistics().get("failureCount"));
        assertEquals(1L, sink.getFailureWriteCount().get());
    }
}
