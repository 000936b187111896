package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * (位置, 设备类型) 的周期任务
 *
 * 调度线程只负责触发，周期在工作线程执行。上一周期未结束时跳过本次触发，
 * 超时的周期被中断并视为结束。
 */
@Slf4j
public class EquipmentTask {

    @Getter
    private final LocationProfile location;
    @Getter
    private final EquipmentType type;
    private final Duration interval;
    private final Duration timeout;
    private final EquipmentCycleRunner runner;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService worker;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong runs = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong timeouts = new AtomicLong(0);
    private final AtomicLong skips = new AtomicLong(0);
    private final AtomicLong generation = new AtomicLong(0);

    private volatile ScheduledFuture<?> scheduledFuture;
    private volatile long lastRun;
    private volatile long lastSuccess;
    private volatile long nextRun;
    private volatile long lastDurationMs;
    private volatile String lastError;
    private volatile CycleReport lastReport;

    public EquipmentTask(LocationProfile location, EquipmentType type, EquipmentCycleRunner runner,
                         ScheduledExecutorService scheduler, ExecutorService worker) {
        this.location = location;
        this.type = type;
        this.interval = location.intervalFor(type);
        this.timeout = location.timeoutFor(type);
        this.runner = runner;
        this.scheduler = scheduler;
        this.worker = worker;
    }

    public synchronized void start(Duration initialDelay) {
        if (scheduledFuture != null && !scheduledFuture.isDone()) {
            return;
        }
        long delayMs = initialDelay != null ? initialDelay.toMillis() : 0;
        nextRun = System.currentTimeMillis() + delayMs;
        scheduledFuture = scheduler.scheduleWithFixedDelay(this::trigger, delayMs, interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("启动周期任务：{} {}，周期：{}s，超时：{}s", location.getId(), type.getCode(),
                interval.toSeconds(), timeout.toSeconds());
    }

    public synchronized void stop() {
        if (scheduledFuture != null) {
            scheduledFuture.cancel(false);
            scheduledFuture = null;
            nextRun = 0;
            log.info("停止周期任务：{} {}", location.getId(), type.getCode());
        }
    }

    public boolean isScheduled() {
        ScheduledFuture<?> future = scheduledFuture;
        return future != null && !future.isDone();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 触发一次周期，上一周期仍在运行时跳过
     *
     * @return 是否已提交执行
     */
    public boolean trigger() {
        try {
            if (isScheduled()) {
                nextRun = System.currentTimeMillis() + interval.toMillis();
            }
            if (!running.compareAndSet(false, true)) {
                skips.incrementAndGet();
                log.warn("上一周期仍在运行，跳过本次：{} {}", location.getId(), type.getCode());
                return false;
            }

            long startTime = System.currentTimeMillis();
            long currentGeneration = generation.incrementAndGet();
            lastRun = startTime;
            Future<?> future;
            try {
                future = worker.submit(() -> execute(currentGeneration, startTime));
            } catch (RejectedExecutionException e) {
                running.set(false);
                failures.incrementAndGet();
                lastError = "工作线程池已满";
                log.error("提交控制周期失败：{} {}", location.getId(), type.getCode(), e);
                return false;
            }
            scheduler.schedule(() -> checkTimeout(future, currentGeneration), timeout.toMillis(),
                    TimeUnit.MILLISECONDS);
            return true;
        } catch (Exception e) {
            // 调度线程中的异常会终止后续周期
            log.error("触发控制周期异常：{} {}", location.getId(), type.getCode(), e);
            return false;
        }
    }

    private void execute(long currentGeneration, long startTime) {
        runs.incrementAndGet();
        try {
            CycleReport report = runner.run(location, type);
            lastReport = report;
            lastSuccess = System.currentTimeMillis();
            if (report.getFailed() > 0) {
                lastError = "设备失败: " + report.getFailedEquipment();
            } else {
                lastError = null;
            }
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("控制周期被中断：{} {}", location.getId(), type.getCode());
            } else {
                failures.incrementAndGet();
                lastError = e.getMessage();
                log.error("控制周期执行失败：{} {}", location.getId(), type.getCode(), e);
            }
        } finally {
            lastDurationMs = System.currentTimeMillis() - startTime;
            if (generation.get() == currentGeneration) {
                running.set(false);
            }
        }
    }

    private void checkTimeout(Future<?> future, long currentGeneration) {
        if (future.isDone() || generation.get() != currentGeneration) {
            return;
        }
        if (future.cancel(true)) {
            timeouts.incrementAndGet();
            EngineException timeoutError = EngineException.timeoutException(location.getId(), type.getCode());
            lastError = timeoutError.getMessage() + "（" + timeout.toSeconds() + "s）";
            log.warn("控制周期超时已取消：{} {}，超时：{}s", location.getId(), type.getCode(), timeout.toSeconds());
            running.set(false);
        }
    }

    public TaskStatus getStatus() {
        return TaskStatus.builder()
                .locationId(location.getId())
                .equipmentType(type.getCode())
                .intervalMs(interval.toMillis())
                .timeoutMs(timeout.toMillis())
                .scheduled(isScheduled())
                .running(running.get())
                .lastRun(lastRun)
                .lastSuccess(lastSuccess)
                .nextRun(nextRun)
                .runs(runs.get())
                .failures(failures.get())
                .timeouts(timeouts.get())
                .skips(skips.get())
                .lastDurationMs(lastDurationMs)
                .lastError(lastError)
                .lastReport(lastReport)
                .build();
    }
}
