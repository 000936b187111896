package com.wangbin.hvac.core.staging;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeBalanceTest {

    @Test
    void evenRuntimeIsExcellent() {
        RuntimeBalance balance = RuntimeBalance.analyze(Map.of(1, 3_600_000L, 2, 3_600_000L));

        assertEquals(BalanceQuality.EXCELLENT, balance.getQuality());
        assertEquals(50.0, balance.getIdealShare(), 1e-9);
        assertEquals(0.0, balance.getMaxDeviation(), 1e-9);
    }

    @Test
    void qualityDegradesWithDeviation() {
        assertEquals(BalanceQuality.GOOD, RuntimeBalance.analyze(Map.of(1, 60L, 2, 40L)).getQuality());
        assertEquals(BalanceQuality.FAIR, RuntimeBalance.analyze(Map.of(1, 62L, 2, 38L)).getQuality());
        assertEquals(BalanceQuality.POOR, RuntimeBalance.analyze(Map.of(1, 100L, 2, 0L)).getQuality());
    }

    @Test
    void noRuntimeIsUnknown() {
        assertEquals(BalanceQuality.UNKNOWN, RuntimeBalance.analyze(Map.of()).getQuality());
        assertEquals(BalanceQuality.UNKNOWN, RuntimeBalance.of(StagingState.initial("geo-1", 4)).getQuality());
    }

    @Test
    void sharesAreReportedPerUnit() {
        RuntimeBalance balance = RuntimeBalance.analyze(Map.of("a", 75L, "b", 25L));

        assertEquals(75.0, balance.getShares().get("a"), 1e-9);
        assertEquals(25.0, balance.getShares().get("b"), 1e-9);
        assertEquals(100L, balance.getTotalRuntime());
    }
}
