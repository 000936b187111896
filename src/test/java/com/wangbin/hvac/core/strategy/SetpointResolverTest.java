package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.config.OarCalibration;
import com.wangbin.hvac.core.model.SetpointSource;
import com.wangbin.hvac.core.model.UserSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SetpointResolverTest {

    private final OarCalibration oar = OarCalibration.of(32, 75, 73, 72);

    private UserSettings userSetpoint(Double value) {
        return UserSettings.builder().equipmentId("fc-1").setpoint(value).build();
    }

    @Test
    void userSetpointWins() {
        ResolvedSetpoint resolved = SetpointResolver.resolve(userSetpoint(68.0), 70.0, oar, 52.5, 72, 55, 85);

        assertEquals(68.0, resolved.getValue(), 1e-9);
        assertEquals(SetpointSource.USER, resolved.getSource());
    }

    @Test
    void userSetpointIsClampedToLimits() {
        ResolvedSetpoint resolved = SetpointResolver.resolve(userSetpoint(95.0), null, oar, 52.5, 72, 55, 85);

        assertEquals(85.0, resolved.getValue(), 1e-9);
        assertEquals(SetpointSource.USER, resolved.getSource());
    }

    @Test
    void invalidUserSetpointFallsThrough() {
        ResolvedSetpoint resolved = SetpointResolver.resolve(userSetpoint(Double.NaN), null, oar, 52.5, 72, 55, 85);

        assertEquals(SetpointSource.OUTDOOR_AIR_RESET, resolved.getSource());
    }

    @Test
    void fixedSettingBeatsOutdoorReset() {
        ResolvedSetpoint resolved = SetpointResolver.resolve(UserSettings.none("fc-1"), 70.0, oar, 52.5, 72, 55, 85);

        assertEquals(70.0, resolved.getValue(), 1e-9);
        assertEquals(SetpointSource.SETTINGS, resolved.getSource());
    }

    @Test
    void outdoorResetUsedWhenNoUserOrFixedValue() {
        ResolvedSetpoint resolved = SetpointResolver.resolve(null, null, oar, 52.5, 72, 55, 85);

        assertEquals(73.5, resolved.getValue(), 1e-9);
        assertEquals(SetpointSource.OUTDOOR_AIR_RESET, resolved.getSource());
    }

    @Test
    void defaultUsedWithoutOutdoorTemperature() {
        ResolvedSetpoint resolved = SetpointResolver.resolve(null, null, oar, null, 72, 55, 85);

        assertEquals(72.0, resolved.getValue(), 1e-9);
        assertEquals(SetpointSource.DEFAULT, resolved.getSource());
    }
}
