package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class EquipmentTaskTest {

    private ScheduledExecutorService scheduler;
    private ExecutorService worker;
    private LocationProfile location;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        worker = Executors.newFixedThreadPool(2);
        location = new LocationProfile();
        location.setId("huntington");
        location.getEquipment().add(EquipmentConfig.builder().id("fc-101").type(EquipmentType.FAN_COIL).build());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        worker.shutdownNow();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    @Test
    void overlappingTriggerIsSkipped() throws Exception {
        StubCycleRunner runner = new StubCycleRunner(true, null);
        EquipmentTask task = new EquipmentTask(location, EquipmentType.FAN_COIL, runner, scheduler, worker);

        assertTrue(task.trigger());
        assertTrue(runner.started.await(5, TimeUnit.SECONDS));
        assertFalse(task.trigger());

        TaskStatus busy = task.getStatus();
        assertTrue(busy.isRunning());
        assertEquals(1, busy.getSkips());

        runner.release.countDown();
        waitUntil(() -> !task.isRunning());
        assertEquals(1, runner.calls.get());
        assertEquals(1, task.getStatus().getRuns());
        assertNotNull(task.getStatus().getLastReport());
        assertNull(task.getStatus().getLastError());
    }

    @Test
    void timedOutCycleIsCancelledAndNextTriggerRuns() throws Exception {
        location.getTimeouts().put(EquipmentType.FAN_COIL, Duration.ofMillis(200));
        StubCycleRunner runner = new StubCycleRunner(true, null);
        EquipmentTask task = new EquipmentTask(location, EquipmentType.FAN_COIL, runner, scheduler, worker);

        assertTrue(task.trigger());
        waitUntil(() -> task.getStatus().getTimeouts() == 1 && !task.isRunning());

        assertNotNull(task.getStatus().getLastError());
        assertTrue(task.trigger());
    }

    @Test
    void runnerFailureIsRecorded() throws Exception {
        StubCycleRunner runner = new StubCycleRunner(false, EquipmentType.FAN_COIL);
        EquipmentTask task = new EquipmentTask(location, EquipmentType.FAN_COIL, runner, scheduler, worker);

        assertTrue(task.trigger());
        waitUntil(() -> task.getStatus().getLastError() != null && !task.isRunning());

        assertEquals("strategy registry unavailable", task.getStatus().getLastError());
        assertEquals(1, task.getStatus().getFailures());
    }

    @Test
    void startAndStopControlScheduling() {
        EquipmentTask task = new EquipmentTask(location, EquipmentType.FAN_COIL, new StubCycleRunner(false, null),
                scheduler, worker);

        task.start(Duration.ofHours(1));
        assertTrue(task.isScheduled());
        assertEquals(30_000, task.getStatus().getIntervalMs());

        task.stop();
        assertFalse(task.isScheduled());
        assertEquals(0, task.getStatus().getNextRun());
    }
}
