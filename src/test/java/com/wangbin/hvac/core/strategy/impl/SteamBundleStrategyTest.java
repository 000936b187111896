package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.SetpointSource;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidParams;
import com.wangbin.hvac.core.strategy.ControlContext;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SteamBundleStrategyTest {

    private final SteamBundleStrategy strategy = new SteamBundleStrategy();
    private final LocationProfile location = new LocationProfile();
    private final EquipmentConfig bundle = EquipmentConfig.builder()
            .id("steam-bundle-1").type(EquipmentType.STEAM_BUNDLE).build();

    SteamBundleStrategyTest() {
        location.setId("warren");
        location.getPid().put(ControllerRole.HEATING, PidParams.builder().enabled(false).build());
    }

    private ControlResult run(Map<String, ?> metrics, UserSettings settings) {
        return strategy.execute(ControlContext.builder()
                .location(location)
                .equipment(bundle)
                .telemetry(TelemetrySnapshot.of("steam-bundle-1", metrics))
                .settings(settings)
                .build());
    }

    private static Map<String, Object> metrics(double supply, double outdoor, double pumpAmps) {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("Supply", supply);
        metrics.put("Outdoor_Air", outdoor);
        metrics.put("HWPump1Amps", pumpAmps);
        return metrics;
    }

    @Test
    void primaryValveOpensFirstUnderOutdoorReset() {
        ControlResult result = run(metrics(120, 40, 12), null);

        // 155 * (1 - 8/38)
        assertEquals(122.4, result.getEffectiveSetpoint(), 0.05);
        assertEquals(SetpointSource.OUTDOOR_AIR_RESET, result.getSetpointSource());
        assertEquals(ControlMode.HEATING, result.getMode());
        assertTrue(result.getCommands().getBoolean("steamEnable"));
        assertEquals(71.8, result.getCommands().getDouble("primaryValvePosition"), 0.15);
        assertEquals(0.0, result.getCommands().getDouble("secondaryValvePosition"), 1e-9);
        assertTrue(result.getNextPidStates().containsKey(ControllerRole.HEATING));
    }

    @Test
    void noRunningPumpKeepsValvesClosed() {
        ControlResult result = run(metrics(120, 40, 8), null);

        assertEquals(ControlMode.STANDBY, result.getMode());
        assertFalse(result.getCommands().getBoolean("unitEnable"));
        assertEquals(0.0, result.getCommands().getDouble("steamValve"), 1e-9);
        assertEquals("no_pump", result.getDiagnostics().get("safetyStatus"));
    }

    @Test
    void pumpDependencyCanBeDisabled() {
        location.getSteamBundle().setRequirePump(false);

        ControlResult result = run(Map.of("Supply", 120.0, "Outdoor_Air", 40.0), null);

        assertEquals(ControlMode.HEATING, result.getMode());
        assertEquals("off", result.getDiagnostics().get("pumpStatus"));
    }

    @Test
    void highSupplyTemperatureTripsSafetyShutoff() {
        ControlResult result = run(metrics(165, 20, 12), null);

        assertEquals(ControlMode.HIGH_LIMIT, result.getMode());
        assertTrue(result.isSafetyTrip());
        assertFalse(result.getCommands().getBoolean("steamEnable"));
        assertEquals(0.0, result.getCommands().getDouble("primaryValvePosition"), 1e-9);
    }

    @Test
    void warmWeatherLocksOutBundle() {
        ControlResult result = run(metrics(120, 70, 12), null);

        assertEquals(ControlMode.LOCKOUT, result.getMode());
        assertFalse(result.getCommands().getBoolean("unitEnable"));
        assertEquals("oar_disabled", result.getDiagnostics().get("safetyStatus"));
    }

    @Test
    void supplyAboveSetpointClosesValvesButStaysEnabled() {
        ControlResult result = run(metrics(150, 40, 12), null);

        assertEquals(ControlMode.HEATING, result.getMode());
        assertTrue(result.getCommands().getBoolean("unitEnable"));
        assertEquals(0.0, result.getCommands().getDouble("steamValve"), 1e-9);
        assertTrue(result.getNextPidStates().isEmpty());
    }

    @Test
    void userDisableClosesValves() {
        UserSettings off = UserSettings.builder().equipmentId("steam-bundle-1").enabled(false).build();

        ControlResult result = run(metrics(120, 40, 12), off);

        assertEquals(ControlMode.OFF, result.getMode());
        assertFalse(result.getCommands().getBoolean("steamEnable"));
    }

    @Test
    void outputIsSplitAcrossPrimaryAndSecondaryValves() {
        assertArrayEquals(new double[]{0, 0}, SteamBundleStrategy.splitValves(0, 0.33), 1e-9);
        assertArrayEquals(new double[]{100, 0}, SteamBundleStrategy.splitValves(33, 0.33), 1e-9);
        assertArrayEquals(new double[]{100, 100}, SteamBundleStrategy.splitValves(100, 0.33), 1e-9);

        double[] partial = SteamBundleStrategy.splitValves(50, 0.33);
        assertEquals(100, partial[0], 1e-9);
        assertEquals(17.0 / 67 * 100, partial[1], 1e-9);
    }

    @Test
    void pumpStatusFlagCountsAsRunning() {
        assertTrue(SteamBundleStrategy.pumpRunning(
                TelemetrySnapshot.of("steam-bundle-1", Map.of("PumpStatus", "running")), 10));
        assertFalse(SteamBundleStrategy.pumpRunning(
                TelemetrySnapshot.of("steam-bundle-1", Map.of("PumpStatus", "off", "PumpAmps", 4.0)), 10));
    }
}
