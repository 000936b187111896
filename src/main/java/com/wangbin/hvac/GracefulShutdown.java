package com.wangbin.hvac;

import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.processor.EquipmentTask;
import com.wangbin.hvac.core.processor.LocationProcessor;
import com.wangbin.hvac.core.processor.LocationProcessorManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 优雅停机：容器关闭时先停止调度，再等待进行中的控制周期结束。
 * 超过停机超时后立即关闭设备工作线程池并中断仍在执行的周期。
 */
@Slf4j
@Component
public class GracefulShutdown implements ApplicationListener<ContextClosedEvent> {

    private static final long POLL_INTERVAL_MS = 200;

    private final LocationProcessorManager processorManager;
    private final HvacProperties properties;
    private final ExecutorService worker;

    public GracefulShutdown(LocationProcessorManager processorManager, HvacProperties properties,
                            @Qualifier("equipmentWorkerExecutor") ExecutorService worker) {
        this.processorManager = processorManager;
        this.properties = properties;
        this.worker = worker;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("开始优雅停机，停止所有位置处理器...");
        processorManager.stopAll();

        long deadline = System.currentTimeMillis() + properties.getProcessor().getShutdownTimeout().toMillis();
        try {
            while (hasRunningCycles()) {
                if (System.currentTimeMillis() >= deadline) {
                    List<Runnable> dropped = worker.shutdownNow();
                    log.warn("等待控制周期结束超时，已中断工作线程，丢弃排队任务数：{}", dropped.size());
                    return;
                }
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            }
            log.info("进行中的控制周期已全部结束");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("优雅停机被中断", e);
        }
    }

    private boolean hasRunningCycles() {
        for (LocationProcessor processor : processorManager.getProcessors()) {
            if (processor.getTasks().values().stream().anyMatch(EquipmentTask::isRunning)) {
                return true;
            }
        }
        return false;
    }
}
