package com.wangbin.hvac;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.processor.CycleReport;
import com.wangbin.hvac.core.processor.EquipmentCycleRunner;
import com.wangbin.hvac.core.processor.LocationProcessorManager;
import com.wangbin.hvac.core.strategy.StrategyRegistry;
import com.wangbin.hvac.core.strategy.impl.FanCoilStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.support.GenericApplicationContext;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GracefulShutdownTest {

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);
    private final ExecutorService worker = Executors.newFixedThreadPool(2);
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch interrupted = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        worker.shutdownNow();
    }

    /**
     * 一直阻塞到被中断的周期执行器
     */
    private EquipmentCycleRunner hangingRunner() {
        return new EquipmentCycleRunner(null, null, null, null, null, null, List.of(), Duration.ZERO, 0) {
            @Override
            public CycleReport run(LocationProfile location, EquipmentType type) {
                started.countDown();
                try {
                    Thread.sleep(TimeUnit.MINUTES.toMillis(5));
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return CycleReport.builder()
                        .locationId(location.getId())
                        .equipmentType(type)
                        .failedEquipment(List.of())
                        .build();
            }
        };
    }

    private HvacProperties properties(Duration shutdownTimeout) {
        HvacProperties properties = new HvacProperties();
        properties.getProcessor().setAutoStart(false);
        properties.getProcessor().setShutdownTimeout(shutdownTimeout);
        LocationProfile location = new LocationProfile();
        location.setId("huntington");
        location.getEquipment().add(EquipmentConfig.builder().id("fc-101").type(EquipmentType.FAN_COIL).build());
        properties.getLocations().add(location);
        return properties;
    }

    @Test
    void hungCycleIsInterruptedAfterShutdownTimeout() throws Exception {
        HvacProperties properties = properties(Duration.ofMillis(300));
        LocationProcessorManager manager = new LocationProcessorManager(properties, hangingRunner(),
                new StrategyRegistry(List.of(new FanCoilStrategy())), scheduler, worker);
        manager.init();

        manager.trigger("huntington", "fan-coil");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        new GracefulShutdown(manager, properties, worker)
                .onApplicationEvent(new ContextClosedEvent(new GenericApplicationContext()));

        assertTrue(worker.isShutdown());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertTrue(manager.getProcessors().stream().noneMatch(processor -> processor.isRunning()));
    }

    @Test
    void idleProcessorsShutDownWithoutInterruptingWorker() {
        HvacProperties properties = properties(Duration.ofSeconds(5));
        LocationProcessorManager manager = new LocationProcessorManager(properties, hangingRunner(),
                new StrategyRegistry(List.of(new FanCoilStrategy())), scheduler, worker);
        manager.init();

        new GracefulShutdown(manager, properties, worker)
                .onApplicationEvent(new ContextClosedEvent(new GenericApplicationContext()));

        assertFalse(worker.isShutdown());
        assertEquals(1, interrupted.getCount());
    }
}
