package com.wangbin.hvac.monitor.alert;

import com.wangbin.hvac.core.config.HvacProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertManagerTest {

    private static AlertRule spaceTooHot() {
        return AlertRule.builder()
                .id("space-high")
                .name("室温过高")
                .level(AlertLevel.WARNING)
                .conditions(List.of(AlertCondition.builder()
                        .metric("Space")
                        .threshold(80)
                        .comparator(AlertCondition.Comparator.GREATER_THAN)
                        .build()))
                .build();
    }

    private static AlertNotification notification(String locationId, String equipmentId) {
        return AlertNotification.builder()
                .locationId(locationId)
                .equipmentId(equipmentId)
                .ruleId("test")
                .level(AlertLevel.INFO)
                .message("测试")
                .timestamp(System.currentTimeMillis())
                .build();
    }

    @Test
    void evaluateReturnsThresholdAlertWithoutRecordingIt() {
        AlertManager manager = new AlertManager(new HvacProperties.AlertConfig());
        manager.register(spaceTooHot());

        List<AlertNotification> alerts = manager.evaluate("huntington", "fcu-1", "fan-coil", Map.of("Space", 82.0));

        assertEquals(1, alerts.size());
        AlertNotification alert = alerts.get(0);
        assertEquals("space-high", alert.getRuleId());
        assertEquals("threshold", alert.getEventType());
        assertEquals(82.0, alert.getValue());
        assertEquals(0, manager.getRaisedCount());
        assertTrue(manager.recent(null, 10).isEmpty());
    }

    @Test
    void ruleDoesNotFireWhenMetricMissingOrBelowThreshold() {
        AlertManager manager = new AlertManager(new HvacProperties.AlertConfig());
        manager.register(spaceTooHot());

        assertTrue(manager.evaluate("huntington", "fcu-1", "fan-coil", Map.of("Space", 75.0)).isEmpty());
        assertTrue(manager.evaluate("huntington", "fcu-1", "fan-coil", Map.of("Supply", 95.0)).isEmpty());
    }

    @Test
    void disabledManagerNeitherEvaluatesNorRecords() {
        HvacProperties.AlertConfig config = new HvacProperties.AlertConfig();
        config.setEnabled(false);
        AlertManager manager = new AlertManager(config);
        manager.register(spaceTooHot());

        assertTrue(manager.evaluate("huntington", "fcu-1", "fan-coil", Map.of("Space", 90.0)).isEmpty());
        manager.raise(notification("huntington", "fcu-1"));
        assertEquals(0, manager.getRaisedCount());
    }

    @Test
    void initRegistersConfiguredRules() {
        HvacProperties.RuleConfig rule = new HvacProperties.RuleConfig();
        rule.setId("amps-low");
        rule.setMetric("Amps");
        rule.setComparator(AlertCondition.Comparator.LESS_THAN);
        rule.setThreshold(1);
        HvacProperties.AlertConfig config = new HvacProperties.AlertConfig();
        config.setRules(List.of(rule));

        AlertManager manager = new AlertManager(config);
        manager.init();

        assertEquals(1, manager.getRules().size());
        List<AlertNotification> alerts = manager.evaluate("huntington", "pump-1", "pumps", Map.of("Amps", 0.2));
        assertEquals(1, alerts.size());
        assertEquals("Amps", alerts.get(0).getRuleName());
        assertEquals(AlertLevel.WARNING, alerts.get(0).getLevel());
    }

    @Test
    void historyIsBoundedAndNewestFirst() {
        HvacProperties.AlertConfig config = new HvacProperties.AlertConfig();
        config.setHistorySize(2);
        AlertManager manager = new AlertManager(config);

        manager.raise(notification("huntington", "fcu-1"));
        manager.raise(notification("huntington", "fcu-2"));
        manager.raise(notification("huntington", "fcu-3"));

        List<AlertNotification> recent = manager.recent(null, 10);
        assertEquals(2, recent.size());
        assertEquals("fcu-3", recent.get(0).getEquipmentId());
        assertEquals("fcu-2", recent.get(1).getEquipmentId());
        assertEquals(3, manager.getRaisedCount());
    }

    @Test
    void recentFiltersByLocationAndLimit() {
        AlertManager manager = new AlertManager(new HvacProperties.AlertConfig());
        manager.raise(notification("huntington", "fcu-1"));
        manager.raise(notification("warren", "boiler-1"));
        manager.raise(notification("huntington", "fcu-2"));
        manager.raise(notification("huntington", "fcu-3"));

        List<AlertNotification> huntington = manager.recent("HUNTINGTON", 2);
        assertEquals(2, huntington.size());
        assertEquals("fcu-3", huntington.get(0).getEquipmentId());
        assertEquals("fcu-2", huntington.get(1).getEquipmentId());

        List<AlertNotification> warren = manager.recent("warren", 10);
        assertEquals(1, warren.size());
        assertEquals("boiler-1", warren.get(0).getEquipmentId());
    }
}
