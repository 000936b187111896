package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.model.UserCommand;
import com.wangbin.hvac.core.model.UserSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandAggregatorTest {

    private static UserCommand command(String equipmentId, String type, Object value, long modifiedAt) {
        return UserCommand.builder()
                .locationId("huntington")
                .equipmentId(equipmentId)
                .equipmentType("fan-coil")
                .commandType(type)
                .value(value)
                .modifiedBy("operator")
                .modifiedAt(modifiedAt)
                .build();
    }

    @Test
    void newestCommandPerTypeWins() {
        Map<String, UserSettings> settings = CommandAggregator.aggregate(List.of(
                command("fc-101", "temperatureSetpoint", 70.0, 1000),
                command("fc-101", "temperatureSetpoint", 68.0, 3000),
                command("fc-101", "temperatureSetpoint", 74.0, 2000)));

        assertEquals(68.0, settings.get("fc-101").getSetpoint(), 1e-9);
        assertEquals(3000, settings.get("fc-101").getModifiedAt());
    }

    @Test
    void commandTypesMapToSettingFields() {
        Map<String, UserSettings> settings = CommandAggregator.aggregate(List.of(
                command("boiler-2", "boilerEnable", "false", 1000),
                command("boiler-2", "waterTempSetpoint", "150", 1000),
                command("boiler-2", "isLeadBoiler", "true", 1000),
                command("boiler-2", "firingRate", 60, 1000)));

        UserSettings boiler = settings.get("boiler-2");
        assertEquals(Boolean.FALSE, boiler.getEnabled());
        assertEquals(150.0, boiler.getSetpoint(), 1e-9);
        assertEquals(Boolean.TRUE, boiler.getIsLead());
        assertEquals(60, boiler.getOverrides().get("firingRate"));
        assertFalse(boiler.isEnabledOrDefault());
    }

    @Test
    void updatePrefixIsStripped() {
        assertEquals("setpoint", CommandAggregator.normalizeType("update_setpoint"));
        assertEquals("fanSpeed", CommandAggregator.normalizeType(" fanSpeed "));

        Map<String, UserSettings> settings = CommandAggregator.aggregate(List.of(
                command("fc-101", "update_setpoint", 71.0, 2000),
                command("fc-101", "setpoint", 65.0, 1000)));

        assertEquals(71.0, settings.get("fc-101").getSetpoint(), 1e-9);
    }

    @Test
    void equipmentAreAggregatedSeparately() {
        Map<String, UserSettings> settings = CommandAggregator.aggregate(List.of(
                command("fc-101", "enabled", true, 1000),
                command("fc-102", "enabled", false, 1000)));

        assertTrue(settings.get("fc-101").isEnabledOrDefault());
        assertFalse(settings.get("fc-102").isEnabledOrDefault());
    }

    @Test
    void incompleteCommandsAreIgnored() {
        Map<String, UserSettings> settings = CommandAggregator.aggregate(List.of(
                command(null, "enabled", true, 1000),
                command("fc-101", null, true, 1000)));

        assertTrue(settings.isEmpty());
        assertTrue(CommandAggregator.aggregate(null).isEmpty());
    }

    @Test
    void manualValveOverridesAreKept() {
        Map<String, UserSettings> settings = CommandAggregator.aggregate(List.of(
                command("fc-101", "heatingValveMode", "manual", 1000),
                command("fc-101", "heatingValvePosition", "40", 1000)));

        UserSettings fanCoil = settings.get("fc-101");
        assertEquals("manual", fanCoil.getOverrides().get("heatingValveMode"));
        assertEquals(40.0, fanCoil.overrideDouble("heatingValvePosition").orElseThrow(), 1e-9);
    }
}
