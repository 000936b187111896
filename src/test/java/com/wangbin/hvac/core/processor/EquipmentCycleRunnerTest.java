package com.wangbin.hvac.core.processor;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserCommand;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.report.ResultPublisher;
import com.wangbin.hvac.core.report.model.SinkRecord;
import com.wangbin.hvac.core.report.sink.RecordingResultSink;
import com.wangbin.hvac.core.source.CommandSource;
import com.wangbin.hvac.core.source.InMemoryCommandSource;
import com.wangbin.hvac.core.source.InMemoryTelemetrySource;
import com.wangbin.hvac.core.source.TelemetrySource;
import com.wangbin.hvac.core.staging.LeadLagManager;
import com.wangbin.hvac.core.staging.StagingCoordinator;
import com.wangbin.hvac.core.state.CaffeineControllerStateStore;
import com.wangbin.hvac.core.strategy.StrategyRegistry;
import com.wangbin.hvac.core.strategy.impl.BoilerStrategy;
import com.wangbin.hvac.core.strategy.impl.ChillerStrategy;
import com.wangbin.hvac.core.strategy.impl.FanCoilStrategy;
import com.wangbin.hvac.core.strategy.impl.GeoStagingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EquipmentCycleRunnerTest {

    private final StrategyRegistry registry = new StrategyRegistry(List.of(
            new FanCoilStrategy(), new BoilerStrategy(), new GeoStagingStrategy(new StagingCoordinator()),
            new ChillerStrategy(new StagingCoordinator())));

    private InMemoryTelemetrySource telemetry;
    private InMemoryCommandSource commands;
    private CaffeineControllerStateStore stateStore;
    private RecordingResultSink sink;
    private ResultPublisher publisher;
    private List<ControlCycleEvent> events;
    private LocationProfile huntington;

    @BeforeEach
    void setUp() {
        telemetry = new InMemoryTelemetrySource();
        commands = new InMemoryCommandSource();
        stateStore = new CaffeineControllerStateStore(new HvacProperties());
        sink = new RecordingResultSink();
        publisher = new ResultPublisher(sink, "hvac_commands");
        events = new CopyOnWriteArrayList<>();

        huntington = new LocationProfile();
        huntington.setId("huntington");
        huntington.getEquipment().add(EquipmentConfig.builder().id("fc-101").type(EquipmentType.FAN_COIL).build());
        huntington.getEquipment().add(EquipmentConfig.builder().id("fc-102").type(EquipmentType.FAN_COIL).build());
        huntington.getEquipment().add(EquipmentConfig.builder().id("boiler-1").type(EquipmentType.BOILER)
                .groupId("comfort-boilers").build());
        huntington.getEquipment().add(EquipmentConfig.builder().id("boiler-2").type(EquipmentType.BOILER)
                .groupId("comfort-boilers").build());
        huntington.getEquipment().add(EquipmentConfig.builder().id("geo-1").type(EquipmentType.GEO_PLANT).build());
        huntington.getEquipment().add(EquipmentConfig.builder().id("chiller-1").type(EquipmentType.CHILLER)
                .groupId("chillers").build());
    }

    private EquipmentCycleRunner runner(TelemetrySource telemetrySource, CommandSource commandSource,
                                        List<ControlCycleListener> listeners) {
        return new EquipmentCycleRunner(registry, telemetrySource, commandSource, stateStore, publisher,
                new LeadLagManager(), listeners, Duration.ofMinutes(15), 20);
    }

    private EquipmentCycleRunner runner() {
        return runner(telemetry, commands, List.of(events::add));
    }

    private SinkRecord recordFor(String equipmentId) {
        return sink.getRecords().stream()
                .filter(record -> equipmentId.equals(record.getEquipmentId()))
                .reduce((first, second) -> second)
                .orElseThrow();
    }

    @Test
    void everyEquipmentOfTypeIsProcessedAndPublished() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 72.0, "Supply", 60.0));
        telemetry.update("huntington", "fc-102", Map.of("Space", 75.0, "Supply", 60.0));

        CycleReport report = runner().run(huntington, EquipmentType.FAN_COIL);

        assertEquals(2, report.getEquipmentCount());
        assertEquals(2, report.getProcessed());
        assertEquals(2, report.getPublished());
        assertEquals(0, report.getFailed());
        assertEquals(2, sink.getRecords().size());
        assertEquals(2, events.size());
    }

    @Test
    void equipmentWithoutTelemetryIsSkipped() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 72.0, "Supply", 60.0));

        CycleReport report = runner().run(huntington, EquipmentType.FAN_COIL);

        assertEquals(1, report.getProcessed());
        assertEquals(1, report.getSkipped());
        assertEquals("fc-101", sink.getRecords().get(0).getEquipmentId());
    }

    @Test
    void telemetryFailureIsIsolatedToOneEquipment() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 72.0, "Supply", 60.0));
        TelemetrySource flaky = new TelemetrySource() {
            @Override
            public String getName() {
                return "flaky";
            }

            @Override
            public Optional<TelemetrySnapshot> latest(String locationId, String equipmentId) {
                if ("fc-102".equals(equipmentId)) {
                    throw EngineException.sourceException("连接超时", locationId, "fan-coil", null);
                }
                return telemetry.latest(locationId, equipmentId);
            }
        };

        CycleReport report = runner(flaky, commands, List.of()).run(huntington, EquipmentType.FAN_COIL);

        assertEquals(1, report.getProcessed());
        assertEquals(1, report.getFailed());
        assertEquals(List.of("fc-102"), report.getFailedEquipment());
    }

    @Test
    void commandSourceFailureRunsWithoutCommands() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 72.0, "Supply", 60.0));
        CommandSource broken = new CommandSource() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public List<UserCommand> recentCommands(String locationId, EquipmentType type, Duration lookback,
                                                    int limit) {
                throw new IllegalStateException("database unavailable");
            }
        };

        CycleReport report = runner(telemetry, broken, List.of()).run(huntington, EquipmentType.FAN_COIL);

        assertEquals(1, report.getProcessed());
        assertEquals(0, report.getCommandCount());
    }

    @Test
    void userSetpointReachesPublishedRecord() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 72.0, "Supply", 60.0));
        commands.submit(UserCommand.builder()
                .locationId("huntington")
                .equipmentId("fc-101")
                .equipmentType("fan-coil")
                .commandType("temperatureSetpoint")
                .value("68")
                .modifiedBy("operator")
                .build());

        CycleReport report = runner().run(huntington, EquipmentType.FAN_COIL);

        assertEquals(1, report.getCommandCount());
        SinkRecord record = recordFor("fc-101");
        assertEquals(68.0, (Double) record.getFields().get("temperatureSetpoint"), 1e-9);
        assertEquals("user", record.getFields().get("setpointSource"));
    }

    @Test
    void pidStateIsPersistedBetweenCycles() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 66.0, "Supply", 60.0));

        runner().run(huntington, EquipmentType.FAN_COIL);

        assertTrue(stateStore.loadPidStates("huntington", "fc-101").containsKey(ControllerRole.HEATING));
    }

    @Test
    void failingListenerDoesNotAbortCycle() {
        telemetry.update("huntington", "fc-101", Map.of("Space", 72.0, "Supply", 60.0));
        telemetry.update("huntington", "fc-102", Map.of("Space", 72.0, "Supply", 60.0));
        List<ControlCycleListener> listeners = new ArrayList<>();
        listeners.add(event -> {
            throw new IllegalStateException("listener broken");
        });
        listeners.add(events::add);

        CycleReport report = runner(telemetry, commands, listeners).run(huntington, EquipmentType.FAN_COIL);

        assertEquals(2, report.getProcessed());
        assertEquals(2, events.size());
    }

    @Test
    void boilerGroupRunsOnlyLeadAndHonoursUserLead() {
        telemetry.update("huntington", "boiler-1", Map.of("H20Supply", 120.0));
        telemetry.update("huntington", "boiler-2", Map.of("H20Supply", 120.0));

        runner().run(huntington, EquipmentType.BOILER);
        assertEquals("boiler-1", stateStore.loadLeadLagState("huntington", "comfort-boilers").getLeadId());
        assertEquals(true, recordFor("boiler-1").getFields().get("boilerEnable"));
        assertEquals(false, recordFor("boiler-2").getFields().get("boilerEnable"));

        commands.submit(UserCommand.builder()
                .locationId("huntington")
                .equipmentId("boiler-2")
                .equipmentType("boiler")
                .commandType("isLead")
                .value(true)
                .build());
        runner().run(huntington, EquipmentType.BOILER);

        assertEquals("boiler-2", stateStore.loadLeadLagState("huntington", "comfort-boilers").getLeadId());
        assertEquals(true, recordFor("boiler-2").getFields().get("boilerEnable"));
        assertEquals(false, recordFor("boiler-1").getFields().get("boilerEnable"));
    }

    @Test
    void failedLeadBoilerFailsOver() {
        telemetry.update("huntington", "boiler-1", Map.of("H20Supply", 120.0, "Status", "ALARM"));
        telemetry.update("huntington", "boiler-2", Map.of("H20Supply", 120.0));

        runner().run(huntington, EquipmentType.BOILER);

        assertEquals("boiler-2", stateStore.loadLeadLagState("huntington", "comfort-boilers").getLeadId());
    }

    @Test
    void stagingStateIsKeptAcrossCycles() {
        telemetry.update("huntington", "geo-1", Map.of("LoopTemp", 52.0));

        runner().run(huntington, EquipmentType.GEO_PLANT);

        assertNotNull(stateStore.loadStagingState("huntington", "geo-1"));
        assertEquals(1, stateStore.loadStagingState("huntington", "geo-1").activeCount());
        assertEquals(true, recordFor("geo-1").getFields().get("stage1Enable"));
    }

    @Test
    void chillerStagingStateIsKeptPerUnit() {
        telemetry.update("huntington", "chiller-1", Map.of("OAT", 75.0, "H20Supply", 50.0));

        runner().run(huntington, EquipmentType.CHILLER);

        assertNotNull(stateStore.loadStagingState("huntington", "chiller-1"));
        assertNull(stateStore.loadStagingState("huntington", "chillers"));
        assertEquals(1, stateStore.loadStagingState("huntington", "chiller-1").activeCount());
        assertEquals(1L, ((Number) recordFor("chiller-1").getFields().get("chillerStage")).longValue());
    }

    @Test
    void clearStateDropsChillerStaging() {
        telemetry.update("huntington", "chiller-1", Map.of("OAT", 75.0, "H20Supply", 50.0));
        EquipmentCycleRunner runner = runner();
        runner.run(huntington, EquipmentType.CHILLER);

        runner.clearState(huntington, huntington.findEquipment("chiller-1").orElseThrow());

        assertNull(stateStore.loadStagingState("huntington", "chiller-1"));
    }
}
