package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.SetpointSource;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.strategy.ControlContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DoasStrategyTest {

    private final DoasStrategy strategy = new DoasStrategy();
    private final LocationProfile location = new LocationProfile();
    private final EquipmentConfig modulating = EquipmentConfig.builder()
            .id("doas-1").type(EquipmentType.DOAS).build();
    private final EquipmentConfig onOff = EquipmentConfig.builder()
            .id("doas-2").type(EquipmentType.DOAS).doasControl(EquipmentConfig.DoasControl.ON_OFF).build();

    DoasStrategyTest() {
        location.setId("element");
    }

    private ControlResult run(EquipmentConfig unit, Map<String, ?> metrics, UserSettings settings) {
        return strategy.execute(ControlContext.builder()
                .location(location)
                .equipment(unit)
                .telemetry(TelemetrySnapshot.of(unit.getId(), metrics))
                .settings(settings)
                .build());
    }

    private ControlResult run(EquipmentConfig unit, double supply, double outdoor) {
        return run(unit, Map.of("SupplyTemp", supply, "Outdoor_Air", outdoor), null);
    }

    @Test
    void coldWeatherModulatesGasValve() {
        ControlResult result = run(modulating, 60, 40);

        assertEquals(ControlMode.HEATING, result.getMode());
        assertEquals(68.0, result.getEffectiveSetpoint(), 1e-9);
        assertTrue(result.getCommands().getBoolean("fanEnabled"));
        assertTrue(result.getCommands().getBoolean("heatingEnabled"));
        assertEquals(80.0, result.getCommands().getDouble("gasValvePosition"), 1e-9);
        assertFalse(result.getCommands().getBoolean("dxStage1Enabled"));
    }

    @Test
    void warmWeatherStagesDxCoolingBySupplyError() {
        ControlResult both = run(modulating, 73, 80);
        assertEquals(ControlMode.COOLING, both.getMode());
        assertTrue(both.getCommands().getBoolean("dxStage1Enabled"));
        assertTrue(both.getCommands().getBoolean("dxStage2Enabled"));

        ControlResult first = run(modulating, 70.5, 80);
        assertTrue(first.getCommands().getBoolean("dxStage1Enabled"));
        assertFalse(first.getCommands().getBoolean("dxStage2Enabled"));

        ControlResult none = run(modulating, 69, 80);
        assertTrue(none.getCommands().getBoolean("coolingEnabled"));
        assertFalse(none.getCommands().getBoolean("dxStage1Enabled"));
    }

    @Test
    void neutralBandRunsFanOnly() {
        ControlResult result = run(modulating, 60, 60.2);

        assertEquals(ControlMode.DEADBAND, result.getMode());
        assertTrue(result.getCommands().getBoolean("fanEnabled"));
        assertFalse(result.getCommands().getBoolean("heatingEnabled"));
        assertFalse(result.getCommands().getBoolean("coolingEnabled"));
    }

    @Test
    void supplyLimitsShutUnitDown() {
        ControlResult hot = run(modulating, 85, 40);
        assertEquals(ControlMode.HIGH_LIMIT, hot.getMode());
        assertTrue(hot.isSafetyTrip());
        assertFalse(hot.getCommands().getBoolean("fanEnabled"));
        assertEquals(0.0, hot.getCommands().getDouble("gasValvePosition"), 1e-9);

        ControlResult cold = run(onOff, 45, 40);
        assertEquals(ControlMode.FREEZE_PROTECTION, cold.getMode());
        assertFalse(cold.getCommands().getBoolean("unitEnable"));
    }

    @Test
    void onOffUnitHeatsAndCoolsOutsideDeadband() {
        ControlResult heating = run(onOff, 60, 55);
        assertEquals(65.0, heating.getEffectiveSetpoint(), 1e-9);
        assertEquals(ControlMode.HEATING, heating.getMode());
        assertTrue(heating.getCommands().getBoolean("heatingEnabled"));
        assertEquals(0.0, heating.getCommands().getDouble("gasValvePosition"), 1e-9);

        ControlResult cooling = run(onOff, 68, 55);
        assertEquals(ControlMode.COOLING, cooling.getMode());
        assertTrue(cooling.getCommands().getBoolean("coolingEnabled"));

        ControlResult idle = run(onOff, 66, 55);
        assertEquals(ControlMode.DEADBAND, idle.getMode());
    }

    @Test
    void outdoorLockoutsBlockDemand() {
        ControlResult heatLocked = run(onOff, 60, 70);
        assertEquals(ControlMode.LOCKOUT, heatLocked.getMode());
        assertFalse(heatLocked.getCommands().getBoolean("heatingEnabled"));
        assertTrue(heatLocked.getCommands().getBoolean("fanEnabled"));

        ControlResult coolLocked = run(onOff, 70, 45);
        assertEquals(ControlMode.LOCKOUT, coolLocked.getMode());
        assertFalse(coolLocked.getCommands().getBoolean("coolingEnabled"));
    }

    @Test
    void setpointPrefersUserThenTelemetry() {
        UserSettings user = UserSettings.builder().equipmentId("doas-1").setpoint(70.0).build();
        ControlResult fromUser = run(modulating, Map.of("SupplyTemp", 60.0, "OAT", 40.0,
                "supplyAirSetpoint", 66.0), user);
        assertEquals(70.0, fromUser.getEffectiveSetpoint(), 1e-9);
        assertEquals(SetpointSource.USER, fromUser.getSetpointSource());

        ControlResult fromTelemetry = run(modulating, Map.of("SupplyTemp", 60.0, "OAT", 40.0,
                "supplyAirSetpoint", 66.0), null);
        assertEquals(66.0, fromTelemetry.getEffectiveSetpoint(), 1e-9);
        assertEquals(60.0, fromTelemetry.getCommands().getDouble("gasValvePosition"), 1e-9);
    }

    @Test
    void userDisableStopsFan() {
        UserSettings off = UserSettings.builder().equipmentId("doas-1").enabled(false).build();

        ControlResult result = run(modulating, Map.of("SupplyTemp", 60.0, "OAT", 40.0), off);

        assertEquals(ControlMode.OFF, result.getMode());
        assertFalse(result.getCommands().getBoolean("fanEnabled"));
    }
}
