package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 单个位置的处理器，为位置内每种设备类型维护一个独立周期任务
 */
@Slf4j
public class LocationProcessor {

    @Getter
    private final LocationProfile location;
    private final Map<EquipmentType, EquipmentTask> tasks = new EnumMap<>(EquipmentType.class);
    private volatile boolean running;

    public LocationProcessor(LocationProfile location, EquipmentCycleRunner runner,
                             ScheduledExecutorService scheduler, ExecutorService worker) {
        this.location = location;
        for (EquipmentType type : location.equipmentTypes()) {
            tasks.put(type, new EquipmentTask(location, type, runner, scheduler, worker));
        }
    }

    public synchronized void start(Duration initialDelay) {
        if (running) {
            return;
        }
        if (tasks.isEmpty()) {
            log.warn("位置 {} 没有配置设备，不启动处理器", location.getId());
            return;
        }
        tasks.values().forEach(task -> task.start(initialDelay));
        running = true;
        log.info("位置处理器已启动：{}（{}），任务数：{}", location.getId(), location.getDisplayName(), tasks.size());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        tasks.values().forEach(EquipmentTask::stop);
        running = false;
        log.info("位置处理器已停止：{}", location.getId());
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<EquipmentTask> getTask(EquipmentType type) {
        return Optional.ofNullable(tasks.get(type));
    }

    public Map<EquipmentType, EquipmentTask> getTasks() {
        return Collections.unmodifiableMap(tasks);
    }

    public ProcessorStatus getStatus() {
        List<TaskStatus> taskStatuses = new ArrayList<>(tasks.size());
        tasks.values().forEach(task -> taskStatuses.add(task.getStatus()));
        return ProcessorStatus.builder()
                .locationId(location.getId())
                .locationName(location.getDisplayName())
                .running(running)
                .tasks(taskStatuses)
                .build();
    }
}
