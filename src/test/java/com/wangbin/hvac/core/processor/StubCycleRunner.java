package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可控的周期执行器：可阻塞直到放行，可对指定设备类型抛出异常
 */
class StubCycleRunner extends EquipmentCycleRunner {

    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger calls = new AtomicInteger();

    private final boolean blocking;
    private final EquipmentType failingType;

    StubCycleRunner(boolean blocking, EquipmentType failingType) {
        super(null, null, null, null, null, null, List.of(), Duration.ZERO, 0);
        this.blocking = blocking;
        this.failingType = failingType;
    }

    @Override
    public CycleReport run(LocationProfile location, EquipmentType type) {
        calls.incrementAndGet();
        started.countDown();
        if (type == failingType) {
            throw new IllegalStateException("strategy registry unavailable");
        }
        if (blocking) {
            try {
                if (!release.await(30, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("interrupted");
            }
        }
        return CycleReport.builder()
                .locationId(location.getId())
                .equipmentType(type)
                .equipmentCount(1)
                .processed(1)
                .failedEquipment(List.of())
                .build();
    }
}
