package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.common.exception.BusinessException;
import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.common.web.result.ResultCode;
import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.strategy.StrategyRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 位置处理器管理服务
 *
 * 职责：
 * 1. 按配置为每个启用的位置创建处理器
 * 2. 启停位置处理器、手动触发单个任务
 * 3. 停机时停止调度并关闭线程池
 */
@Slf4j
@Service
public class LocationProcessorManager {

    private final HvacProperties properties;
    private final EquipmentCycleRunner runner;
    private final StrategyRegistry strategyRegistry;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService worker;

    private final Map<String, LocationProcessor> processors = new LinkedHashMap<>();
    private volatile boolean shutdown;

    public LocationProcessorManager(HvacProperties properties, EquipmentCycleRunner runner,
                                    StrategyRegistry strategyRegistry,
                                    @Qualifier("processorScheduler") ScheduledExecutorService scheduler,
                                    @Qualifier("equipmentWorkerExecutor") ExecutorService worker) {
        this.properties = properties;
        this.runner = runner;
        this.strategyRegistry = strategyRegistry;
        this.scheduler = scheduler;
        this.worker = worker;
    }

    @PostConstruct
    public void init() {
        for (LocationProfile location : properties.getLocations()) {
            if (!location.isEnabled()) {
                log.info("位置 {} 已禁用，跳过", location.getId());
                continue;
            }
            validate(location);
            processors.put(location.getId(), new LocationProcessor(location, runner, scheduler, worker));
        }
        log.info("位置处理器管理服务初始化完成，位置数：{}", processors.size());

        if (properties.getProcessor().isAutoStart()) {
            startAll();
        }
    }

    private void validate(LocationProfile location) {
        if (location.getId() == null || location.getId().isBlank()) {
            throw EngineException.configException("位置ID不能为空", null);
        }
        if (processors.containsKey(location.getId())) {
            throw EngineException.configException("位置ID重复: " + location.getId(), location.getId());
        }
        for (EquipmentType type : location.equipmentTypes()) {
            if (!strategyRegistry.supports(type)) {
                throw EngineException.configException("不支持的设备类型: " + type.getCode(), location.getId());
            }
        }
    }

    public void startAll() {
        Duration initialDelay = properties.getProcessor().getInitialDelay();
        processors.values().forEach(processor -> processor.start(initialDelay));
    }

    public void stopAll() {
        processors.values().forEach(LocationProcessor::stop);
    }

    public ProcessorStatus start(String locationId) {
        LocationProcessor processor = getProcessor(locationId);
        processor.start(Duration.ZERO);
        return processor.getStatus();
    }

    public ProcessorStatus stop(String locationId) {
        LocationProcessor processor = getProcessor(locationId);
        processor.stop();
        return processor.getStatus();
    }

    /**
     * 手动触发一个任务，与调度周期共享防重入标记
     */
    public TaskStatus trigger(String locationId, String equipmentType) {
        if (shutdown) {
            throw new BusinessException(ResultCode.SERVICE_UNAVAILABLE, "处理器正在停机");
        }
        EquipmentType type = parseType(equipmentType);
        EquipmentTask task = getProcessor(locationId).getTask(type)
                .orElseThrow(() -> new BusinessException(ResultCode.DATA_NOT_FOUND,
                        "位置 " + locationId + " 没有 " + type.getCode() + " 设备"));
        boolean accepted = task.trigger();
        log.info("手动触发控制周期：{} {}，{}", locationId, type.getCode(), accepted ? "已提交" : "已跳过");
        return task.getStatus();
    }

    /**
     * 清除一台设备的PID、记忆、分级与主备状态
     */
    public void resetState(String locationId, String equipmentId) {
        LocationProfile location = getProcessor(locationId).getLocation();
        EquipmentConfig equipment = location.findEquipment(equipmentId)
                .orElseThrow(() -> new BusinessException(ResultCode.DATA_NOT_FOUND,
                        "位置 " + locationId + " 没有设备 " + equipmentId));
        runner.clearState(location, equipment);
    }

    public List<ProcessorStatus> getStatus() {
        List<ProcessorStatus> statuses = new ArrayList<>(processors.size());
        processors.values().forEach(processor -> statuses.add(processor.getStatus()));
        return statuses;
    }

    public ProcessorStatus getStatus(String locationId) {
        return getProcessor(locationId).getStatus();
    }

    public Collection<LocationProcessor> getProcessors() {
        return Collections.unmodifiableCollection(processors.values());
    }

    public LocationProcessor getProcessor(String locationId) {
        LocationProcessor processor = processors.get(locationId);
        if (processor == null) {
            throw new BusinessException(ResultCode.DATA_NOT_FOUND, "位置不存在或未启用: " + locationId);
        }
        return processor;
    }

    private static EquipmentType parseType(String equipmentType) {
        try {
            return EquipmentType.fromCode(equipmentType);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ResultCode.PARAM_ERROR, e.getMessage());
        }
    }

    @PreDestroy
    public void destroy() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("开始关闭位置处理器...");
        stopAll();
        long timeoutMs = properties.getProcessor().getShutdownTimeout().toMillis();
        shutdownExecutor("处理器调度线程池", scheduler, timeoutMs);
        shutdownExecutor("设备工作线程池", worker, timeoutMs);
        log.info("位置处理器已全部关闭");
    }

    private void shutdownExecutor(String name, ExecutorService executor, long timeoutMs) {
        if (executor != null && !executor.isShutdown()) {
            try {
                executor.shutdown();
                if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("{} 未在 {}ms 内结束，强制关闭", name, timeoutMs);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("{} 已关闭", name);
        }
    }
}
