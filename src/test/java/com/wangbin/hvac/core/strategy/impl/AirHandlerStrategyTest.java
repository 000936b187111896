package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.strategy.ControlContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AirHandlerStrategyTest {

    private final AirHandlerStrategy strategy = new AirHandlerStrategy();

    private ControlResult run(LocationProfile location, Map<String, ?> metrics) {
        EquipmentConfig ahu = EquipmentConfig.builder().id("ahu-1").type(EquipmentType.AIR_HANDLER).build();
        return strategy.execute(ControlContext.builder()
                .location(location)
                .equipment(ahu)
                .telemetry(TelemetrySnapshot.of("ahu-1", metrics))
                .build());
    }

    private static LocationProfile warren() {
        LocationProfile location = new LocationProfile();
        location.setId("warren");
        return location;
    }

    @Test
    void mixedAirTemperatureTriggersFreezeProtection() {
        ControlResult result = run(warren(), Map.of("Space", 70.0, "MixedAir", 36.0, "Supply", 60.0));

        assertEquals(ControlMode.FREEZE_PROTECTION, result.getMode());
        assertEquals(100.0, result.getCommands().getDouble(FanCoilStrategy.HEATING_VALVE), 1e-9);
    }

    @Test
    void locationSensorOverrideChangesMixedAirKey() {
        LocationProfile location = warren();
        location.getSensors().put("mixed", List.of("MA_Temp"));

        ControlResult result = run(location, Map.of("Space", 72.0, "MixedAir", 36.0, "MA_Temp", 55.0,
                "Supply", 60.0));

        assertEquals(ControlMode.DEADBAND, result.getMode());
    }

    @Test
    void occupancyDrivesMinimumOutdoorAir() {
        ControlResult occupied = run(warren(), Map.of("Space", 72.0, "Supply", 60.0, "Occupancy", true));
        ControlResult vacant = run(warren(), Map.of("Space", 72.0, "Supply", 60.0, "Occupancy", false,
                "OAT", 60.0));

        assertEquals(20.0, occupied.getCommands().getDouble(FanCoilStrategy.DAMPER), 1e-9);
        assertEquals(0.0, vacant.getCommands().getDouble(FanCoilStrategy.DAMPER), 1e-9);
        assertEquals(EquipmentType.AIR_HANDLER, occupied.getEquipmentType());
    }
}
