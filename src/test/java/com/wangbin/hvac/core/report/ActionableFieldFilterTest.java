package com.wangbin.hvac.core.report;

import com.wangbin.hvac.core.model.EquipmentType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionableFieldFilterTest {

    @Test
    void fanCoilKeepsOnlyActuatorFields() {
        Map<String, Object> commands = new LinkedHashMap<>();
        commands.put("unitEnable", true);
        commands.put("coolingValvePosition", 30.0);
        commands.put("currentTemp", 75.0);
        commands.put("error", 3.0);

        Map<String, Object> filtered = ActionableFieldFilter.filter(EquipmentType.FAN_COIL, commands);

        assertEquals(List.of("unitEnable", "coolingValvePosition"), List.copyOf(filtered.keySet()));
    }

    @Test
    void boilerDropsGroupBookkeeping() {
        Map<String, Object> commands = Map.of("boilerEnable", true, "isLead", true,
                "leadLagGroupId", "comfort-boilers", "leadEquipmentId", "boiler-1");

        Map<String, Object> filtered = ActionableFieldFilter.filter(EquipmentType.BOILER, commands);

        assertEquals(2, filtered.size());
        assertFalse(filtered.containsKey("leadLagGroupId"));
    }

    @Test
    void geoStageFlagsMatchPattern() {
        assertTrue(ActionableFieldFilter.isActionable(EquipmentType.GEO_PLANT, "stage3Enable"));
        assertTrue(ActionableFieldFilter.isActionable(EquipmentType.GEO_PLANT, "stage12Enable"));
        assertFalse(ActionableFieldFilter.isActionable(EquipmentType.GEO_PLANT, "stageEnable"));
        assertFalse(ActionableFieldFilter.isActionable(EquipmentType.FAN_COIL, "stage1Enable"));
        assertFalse(ActionableFieldFilter.isActionable(EquipmentType.GEO_PLANT, "requiredStages"));
    }

    @Test
    void globalFieldsApplyToEveryType() {
        for (EquipmentType type : EquipmentType.values()) {
            assertTrue(ActionableFieldFilter.isActionable(type, "steamValve"));
            assertTrue(ActionableFieldFilter.isActionable(type, "unitEnable"));
        }
    }

    @Test
    void steamBundleAndDoasOutputsAreActionable() {
        assertTrue(ActionableFieldFilter.isActionable(EquipmentType.STEAM_BUNDLE, "primaryValvePosition"));
        assertTrue(ActionableFieldFilter.isActionable(EquipmentType.STEAM_BUNDLE, "steamEnable"));
        assertTrue(ActionableFieldFilter.isActionable(EquipmentType.DOAS, "gasValvePosition"));
        assertTrue(ActionableFieldFilter.isActionable(EquipmentType.DOAS, "dxStage2Enabled"));
        assertFalse(ActionableFieldFilter.isActionable(EquipmentType.DOAS, "primaryValvePosition"));
        assertFalse(ActionableFieldFilter.isActionable(EquipmentType.FAN_COIL, "gasValvePosition"));
    }

    @Test
    void nullValuesAreDropped() {
        Map<String, Object> commands = new HashMap<>();
        commands.put("pumpEnable", null);
        commands.put("pumpSpeed", 100.0);

        Map<String, Object> filtered = ActionableFieldFilter.filter(EquipmentType.PUMP, commands);

        assertEquals(Map.of("pumpSpeed", 100.0), filtered);
        assertTrue(ActionableFieldFilter.filter(EquipmentType.PUMP, null).isEmpty());
    }
}
