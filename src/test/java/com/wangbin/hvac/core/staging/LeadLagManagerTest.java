package com.wangbin.hvac.core.staging;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LeadLagManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T08:00:00Z");
    private static final Duration WEEK = Duration.ofDays(7);
    private static final List<String> BOILERS = List.of("boiler-1", "boiler-2");

    private final LeadLagManager manager = new LeadLagManager();

    private static LeadLagState leadState(String leadId, Instant lastChangeover) {
        return LeadLagState.builder()
                .groupId("comfort-boilers")
                .leadId(leadId)
                .lastChangeover(lastChangeover.toEpochMilli())
                .build();
    }

    @Test
    void firstHealthyUnitBecomesInitialLead() {
        LeadLagDecision decision = manager.resolve("comfort-boilers", BOILERS,
                Map.of("boiler-1", UnitHealth.unhealthy("防冻开关动作")), null, null, NOW, WEEK);

        assertEquals(LeadLagDecision.ChangeReason.INITIAL, decision.getReason());
        assertEquals("boiler-2", decision.getLeadId());
        assertEquals(List.of("boiler-1"), decision.getLagIds());
    }

    @Test
    void userDesignatedLeadWins() {
        LeadLagDecision decision = manager.resolve("comfort-boilers", BOILERS, Map.of(), "boiler-2",
                leadState("boiler-1", NOW.minusSeconds(60)), NOW, WEEK);

        assertEquals(LeadLagDecision.ChangeReason.USER, decision.getReason());
        assertTrue(decision.isLead("boiler-2"));
        assertEquals("boiler-1", decision.getState().getPreviousLeadId());
    }

    @Test
    void unhealthyUserLeadIsIgnored() {
        LeadLagDecision decision = manager.resolve("comfort-boilers", BOILERS,
                Map.of("boiler-2", UnitHealth.unhealthy("设备故障状态: fault")), "boiler-2",
                leadState("boiler-1", NOW.minusSeconds(60)), NOW, WEEK);

        assertEquals(LeadLagDecision.ChangeReason.NONE, decision.getReason());
        assertEquals("boiler-1", decision.getLeadId());
    }

    @Test
    void failedLeadFailsOverToNextHealthyUnit() {
        LeadLagDecision decision = manager.resolve("comfort-boilers", BOILERS,
                Map.of("boiler-1", UnitHealth.unhealthy("供水超温")), null,
                leadState("boiler-1", NOW.minusSeconds(60)), NOW, WEEK);

        assertEquals(LeadLagDecision.ChangeReason.FAILOVER, decision.getReason());
        assertEquals("boiler-2", decision.getLeadId());
        assertTrue(decision.getState().isFailoverActive());
        assertEquals("供水超温", decision.getState().getFailoverReason());
        assertTrue(decision.isLeadHealthy());
    }

    @Test
    void allUnitsUnhealthyKeepsLead() {
        LeadLagDecision decision = manager.resolve("comfort-boilers", BOILERS,
                Map.of("boiler-1", UnitHealth.unhealthy("a"), "boiler-2", UnitHealth.unhealthy("b")), null,
                leadState("boiler-1", NOW.minusSeconds(60)), NOW, WEEK);

        assertEquals(LeadLagDecision.ChangeReason.NONE, decision.getReason());
        assertEquals("boiler-1", decision.getLeadId());
        assertFalse(decision.isLeadHealthy());
    }

    @Test
    void leadRotatesAfterChangeoverInterval() {
        LeadLagDecision due = manager.resolve("comfort-boilers", BOILERS, Map.of(), null,
                leadState("boiler-1", NOW.minus(Duration.ofDays(8))), NOW, WEEK);
        LeadLagDecision notDue = manager.resolve("comfort-boilers", BOILERS, Map.of(), null,
                leadState("boiler-1", NOW.minus(Duration.ofDays(3))), NOW, WEEK);

        assertEquals(LeadLagDecision.ChangeReason.SCHEDULED, due.getReason());
        assertEquals("boiler-2", due.getLeadId());
        assertEquals(NOW.toEpochMilli(), due.getState().getLastChangeover());
        assertFalse(notDue.changed());
        assertEquals("boiler-1", notDue.getLeadId());
    }

    @Test
    void emptyGroupIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.resolve("empty", List.of(), Map.of(), null, null, NOW, WEEK));
    }
}
