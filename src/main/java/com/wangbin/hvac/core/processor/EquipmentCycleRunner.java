package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserCommand;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.report.ResultPublisher;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.source.CommandSource;
import com.wangbin.hvac.core.source.TelemetrySource;
import com.wangbin.hvac.core.staging.LeadLagDecision;
import com.wangbin.hvac.core.staging.LeadLagManager;
import com.wangbin.hvac.core.staging.UnitHealth;
import com.wangbin.hvac.core.state.ControllerStateStore;
import com.wangbin.hvac.core.strategy.ControlContext;
import com.wangbin.hvac.core.strategy.EquipmentStrategy;
import com.wangbin.hvac.core.strategy.StrategyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * 执行一个 (位置, 设备类型) 的控制周期
 *
 * 执行步骤：
 * 1. 读取用户命令并按设备聚合
 * 2. 读取每台设备的最新遥测
 * 3. 冗余设备组先做主备判定
 * 4. 带持久化状态执行策略并保存下一周期状态
 * 5. 发布可执行字段并通知监听器
 *
 * 单台设备失败只记录日志，不影响同周期其他设备。
 */
@Slf4j
@Component
public class EquipmentCycleRunner {

    private final StrategyRegistry strategyRegistry;
    private final TelemetrySource telemetrySource;
    private final CommandSource commandSource;
    private final ControllerStateStore stateStore;
    private final ResultPublisher resultPublisher;
    private final LeadLagManager leadLagManager;
    private final List<ControlCycleListener> listeners;
    private final Duration commandLookback;
    private final int commandLimit;

    @Autowired
    public EquipmentCycleRunner(StrategyRegistry strategyRegistry, TelemetrySource telemetrySource,
                                CommandSource commandSource, ControllerStateStore stateStore,
                                ResultPublisher resultPublisher, LeadLagManager leadLagManager,
                                ObjectProvider<ControlCycleListener> listeners, HvacProperties properties) {
        this(strategyRegistry, telemetrySource, commandSource, stateStore, resultPublisher, leadLagManager,
                listeners.orderedStream().toList(), properties.getProcessor().getCommandLookback(),
                properties.getProcessor().getCommandLimit());
    }

    public EquipmentCycleRunner(StrategyRegistry strategyRegistry, TelemetrySource telemetrySource,
                                CommandSource commandSource, ControllerStateStore stateStore,
                                ResultPublisher resultPublisher, LeadLagManager leadLagManager,
                                List<ControlCycleListener> listeners, Duration commandLookback, int commandLimit) {
        this.strategyRegistry = strategyRegistry;
        this.telemetrySource = telemetrySource;
        this.commandSource = commandSource;
        this.stateStore = stateStore;
        this.resultPublisher = resultPublisher;
        this.leadLagManager = leadLagManager;
        this.listeners = listeners != null ? listeners : Collections.emptyList();
        this.commandLookback = commandLookback;
        this.commandLimit = commandLimit;
    }

    public CycleReport run(LocationProfile location, EquipmentType type) {
        long startTime = System.currentTimeMillis();
        Instant now = Instant.ofEpochMilli(startTime);
        EquipmentStrategy strategy = strategyRegistry.get(type);
        List<EquipmentConfig> equipmentList = location.equipmentOf(type);

        List<UserCommand> commands = fetchCommands(location, type);
        Map<String, UserSettings> settings = CommandAggregator.aggregate(commands);

        Map<String, TelemetrySnapshot> telemetry = new LinkedHashMap<>();
        List<String> failedEquipment = new ArrayList<>();
        for (EquipmentConfig equipment : equipmentList) {
            checkInterrupted();
            try {
                Optional<TelemetrySnapshot> snapshot = telemetrySource.latest(location.getId(), equipment.getId());
                snapshot.ifPresent(value -> telemetry.put(equipment.getId(), value));
            } catch (Exception e) {
                failedEquipment.add(equipment.getId());
                log.error("读取设备遥测失败，本周期跳过：{}/{}", location.getId(), equipment.getId(), e);
            }
        }

        Map<String, LeadLagDecision> leadLag = type.isLeadLagGroup()
                ? resolveLeadLag(location, type, strategy, equipmentList, telemetry, settings, now)
                : Collections.emptyMap();

        int processed = 0;
        int skipped = 0;
        int published = 0;
        for (EquipmentConfig equipment : equipmentList) {
            checkInterrupted();
            if (failedEquipment.contains(equipment.getId())) {
                continue;
            }
            TelemetrySnapshot snapshot = telemetry.get(equipment.getId());
            if (snapshot == null) {
                skipped++;
                log.warn("设备 {}/{} 没有可用遥测，保持上次输出", location.getId(), equipment.getId());
                continue;
            }
            try {
                UserSettings userSettings = settings.getOrDefault(equipment.getId(),
                        UserSettings.none(equipment.getId()));
                PublishResult publishResult = processEquipment(location, equipment, strategy, snapshot,
                        userSettings, leadLag.get(equipment.getGroupIdOrSelf()), now);
                processed++;
                if (publishResult.isSuccess() && !publishResult.isSkipped()) {
                    published++;
                }
            } catch (Exception e) {
                failedEquipment.add(equipment.getId());
                log.error("设备控制周期失败：{}/{}", location.getId(), equipment.getId(), e);
            }
        }

        CycleReport report = CycleReport.builder()
                .locationId(location.getId())
                .equipmentType(type)
                .equipmentCount(equipmentList.size())
                .processed(processed)
                .skipped(skipped)
                .failed(failedEquipment.size())
                .published(published)
                .commandCount(commands.size())
                .failedEquipment(failedEquipment)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        log.debug("控制周期完成：{} {}，处理 {}，跳过 {}，失败 {}，耗时 {}ms", location.getId(), type.getCode(),
                processed, skipped, failedEquipment.size(), report.getDurationMs());
        return report;
    }

    private List<UserCommand> fetchCommands(LocationProfile location, EquipmentType type) {
        try {
            List<UserCommand> commands = commandSource.recentCommands(location.getId(), type, commandLookback,
                    commandLimit);
            return commands != null ? commands : Collections.emptyList();
        } catch (Exception e) {
            log.warn("读取用户命令失败，按无命令执行：{} {}，错误：{}", location.getId(), type.getCode(),
                    e.getMessage());
            return Collections.emptyList();
        }
    }

    private Map<String, LeadLagDecision> resolveLeadLag(LocationProfile location, EquipmentType type,
                                                        EquipmentStrategy strategy,
                                                        List<EquipmentConfig> equipmentList,
                                                        Map<String, TelemetrySnapshot> telemetry,
                                                        Map<String, UserSettings> settings, Instant now) {
        Map<String, List<EquipmentConfig>> groups = new LinkedHashMap<>();
        for (EquipmentConfig equipment : equipmentList) {
            groups.computeIfAbsent(equipment.getGroupIdOrSelf(), key -> new ArrayList<>()).add(equipment);
        }

        Duration changeover = type == EquipmentType.BOILER
                ? location.getBoiler().getChangeoverInterval()
                : location.getPump().getChangeoverInterval();

        Map<String, LeadLagDecision> decisions = new LinkedHashMap<>();
        groups.forEach((groupId, members) -> {
            try {
                List<String> units = members.stream().map(EquipmentConfig::getId).toList();
                Map<String, UnitHealth> health = new LinkedHashMap<>();
                for (EquipmentConfig member : members) {
                    health.put(member.getId(), strategy.assessHealth(location, member, telemetry.get(member.getId())));
                }
                String userLead = members.stream()
                        .map(member -> settings.get(member.getId()))
                        .filter(Objects::nonNull)
                        .filter(value -> Boolean.TRUE.equals(value.getIsLead()))
                        .max(Comparator.comparingLong(UserSettings::getModifiedAt))
                        .map(UserSettings::getEquipmentId)
                        .orElse(null);

                LeadLagDecision decision = leadLagManager.resolve(groupId, units, health, userLead,
                        stateStore.loadLeadLagState(location.getId(), groupId), now, changeover);
                stateStore.saveLeadLagState(location.getId(), groupId, decision.getState());
                decisions.put(groupId, decision);
            } catch (Exception e) {
                log.error("主备判定失败：{}/{}", location.getId(), groupId, e);
            }
        });
        return decisions;
    }

    private PublishResult processEquipment(LocationProfile location, EquipmentConfig equipment,
                                           EquipmentStrategy strategy, TelemetrySnapshot telemetry,
                                           UserSettings settings, LeadLagDecision leadLag, Instant now) {
        String locationId = location.getId();
        String stagingKey = stagingKey(equipment);

        ControlContext context = ControlContext.builder()
                .location(location)
                .equipment(equipment)
                .telemetry(telemetry)
                .settings(settings)
                .pidStates(stateStore.loadPidStates(locationId, equipment.getId()))
                .stagingState(stagingKey != null ? stateStore.loadStagingState(locationId, stagingKey) : null)
                .memory(stateStore.loadMemory(locationId, equipment.getId()))
                .leadLag(leadLag)
                .now(now)
                .build();

        ControlResult result = strategy.execute(context);

        if (result.getNextPidStates() != null && !result.getNextPidStates().isEmpty()) {
            stateStore.savePidStates(locationId, equipment.getId(), result.getNextPidStates());
        }
        if (result.getNextStagingState() != null && stagingKey != null) {
            stateStore.saveStagingState(locationId, stagingKey, result.getNextStagingState());
        }
        if (result.getNextMemory() != null) {
            stateStore.saveMemory(locationId, equipment.getId(), result.getNextMemory());
        }

        PublishResult publishResult = resultPublisher.publish(location, result);
        notifyListeners(new ControlCycleEvent(location, equipment, telemetry, settings, result, publishResult));
        return publishResult;
    }

    /**
     * 清除设备的控制器状态，下一周期按初始状态重新计算
     */
    public void clearState(LocationProfile location, EquipmentConfig equipment) {
        stateStore.clear(location.getId(), equipment.getId(), equipment.getGroupIdOrSelf());
    }

    /**
     * 分级状态键：地源热泵按组共享，冷水机组按台；其它设备无分级状态
     */
    static String stagingKey(EquipmentConfig equipment) {
        if (equipment.getType() == EquipmentType.GEO_PLANT) {
            return equipment.getGroupIdOrSelf();
        }
        if (equipment.getType() == EquipmentType.CHILLER) {
            return equipment.getId();
        }
        return null;
    }

    private void notifyListeners(ControlCycleEvent event) {
        for (ControlCycleListener listener : listeners) {
            try {
                listener.onControlCycle(event);
            } catch (Exception e) {
                log.error("控制周期监听器处理失败：{}，设备：{}", listener.getClass().getSimpleName(),
                        event.getEquipment().getId(), e);
            }
        }
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("控制周期已被取消");
        }
    }
}
