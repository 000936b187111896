package com.wangbin.hvac.core.strategy.impl;

import com.wangbin.hvac.common.utils.ValueUtils;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.UserSettings;
import com.wangbin.hvac.core.staging.RuntimeBalance;
import com.wangbin.hvac.core.staging.StagingConfig;
import com.wangbin.hvac.core.staging.StagingCoordinator;
import com.wangbin.hvac.core.staging.StagingDecision;
import com.wangbin.hvac.core.staging.StagingState;
import com.wangbin.hvac.core.strategy.AbstractEquipmentStrategy;
import com.wangbin.hvac.core.strategy.ControlContext;
import com.wangbin.hvac.core.strategy.ResolvedSetpoint;
import com.wangbin.hvac.core.strategy.SensorResolver;
import com.wangbin.hvac.core.strategy.Sensors;
import com.wangbin.hvac.core.strategy.SetpointResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 地源热泵多级机组控制策略
 *
 * 回路温度偏差按各级开/关阈值（带回差）得到所需级数，交给分级协调器执行加减级；
 * 回路超高/超低或压缩机过流时立即全部停机。
 */
@Slf4j
@Component
public class GeoStagingStrategy extends AbstractEquipmentStrategy {

    private static final double MIN_LOOP_SETPOINT = 35;
    private static final double MAX_LOOP_SETPOINT = 65;

    private final StagingCoordinator coordinator;

    public GeoStagingStrategy(StagingCoordinator coordinator) {
        super(EquipmentType.GEO_PLANT, "地源热泵");
        this.coordinator = coordinator;
    }

    @Override
    protected ControlResult doExecute(ControlContext context) {
        LocationProfile.GeoTuning tuning = context.getLocation().getGeo();
        UserSettings settings = context.getSettings() != null
                ? context.getSettings() : UserSettings.none(context.getEquipmentId());
        SensorResolver resolver = new SensorResolver(context.getLocation(), context.getEquipment());

        ResolvedSetpoint setpoint = SetpointResolver.resolve(settings, null, null, null,
                tuning.getSetpoint(), MIN_LOOP_SETPOINT, MAX_LOOP_SETPOINT);
        double loop = resolver.resolve(context.getTelemetry(), Sensors.LOOP_TEMP);
        Optional<Double> amps = resolver.find(context.getTelemetry(), Sensors.COMPRESSOR_CURRENT);
        double error = loop - setpoint.getValue();

        StagingState current = context.getStagingState();
        if (current == null) {
            current = StagingState.initial(context.getEquipmentId(), tuning.getStageCount());
        }

        String shutdownReason = null;
        if (loop >= tuning.getHighLimit()) {
            shutdownReason = "回路温度达到高限 " + loop;
        } else if (loop <= tuning.getLowLimit()) {
            shutdownReason = "回路温度达到低限 " + loop;
        } else if (amps.isPresent() && amps.get() > tuning.getMaxCompressorAmps()) {
            shutdownReason = "压缩机电流过高 " + amps.get();
        }
        boolean userOff = !settings.isEnabledOrDefault();

        int required = (shutdownReason != null || userOff)
                ? 0 : requiredStages(error, current.activeCount(), tuning);
        // 用户关机按减级延时与最小运行时间逐级卸载，只有安全条件才立即全停
        StagingDecision decision = coordinator.evaluate(StagingConfig.from(tuning), current, required,
                context.getNow(), shutdownReason != null);
        StagingState next = decision.getState();
        if (next.getGroupId() == null) {
            next.setGroupId(context.getEquipmentId());
        }

        ControlMode mode;
        if (shutdownReason != null) {
            log.error("地源热泵 {} 紧急停机: {}", context.getEquipmentId(), shutdownReason);
            mode = ControlMode.EMERGENCY_SHUTDOWN;
        } else if (userOff) {
            mode = ControlMode.OFF;
        } else {
            mode = next.activeCount() > 0 ? ControlMode.COOLING : ControlMode.STANDBY;
        }

        ActuatorCommands commands = new ActuatorCommands();
        for (int stage = 1; stage <= tuning.getStageCount(); stage++) {
            commands.flag("stage" + stage + "Enable", next.isActive(stage));
        }
        commands.integer("activeStages", next.activeCount())
                .integer("requiredStages", required)
                .number("loopSetpoint", setpoint.getValue());
        if (next.getLeadUnit() != null) {
            commands.integer("leadStage", next.getLeadUnit());
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("loopTemp", loop);
        diagnostics.put("error", ValueUtils.round1(error));
        diagnostics.put("stagingAction", decision.getAction().name());
        diagnostics.put("stagingReason", decision.getReason());
        for (int stage = 1; stage <= tuning.getStageCount(); stage++) {
            diagnostics.put("stage" + stage + "RuntimeSeconds", next.runtimeSeconds(stage));
        }
        diagnostics.put("runtimeBalance", RuntimeBalance.of(next).getQuality().getCode());
        if (shutdownReason != null) {
            diagnostics.put("shutdownReason", shutdownReason);
        }

        return resultBuilder(context)
                .mode(mode)
                .effectiveSetpoint(setpoint.getValue())
                .setpointSource(setpoint.getSource())
                .commands(commands)
                .nextStagingState(next)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * 逐级判定：偏差达到开启阈值，或该级已在运行且偏差仍高于关闭阈值，则该级需要
     */
    static int requiredStages(double error, int active, LocationProfile.GeoTuning tuning) {
        List<Double> on = tuning.getStageOnThresholds();
        List<Double> off = tuning.getStageOffThresholds();
        int required = 0;
        for (int stage = 1; stage <= tuning.getStageCount(); stage++) {
            double onThreshold = thresholdAt(on, stage);
            double offThreshold = thresholdAt(off, stage);
            boolean needed = error >= onThreshold || (stage <= active && error > offThreshold);
            if (!needed) {
                break;
            }
            required = stage;
        }
        return required;
    }

    /**
     * 不考虑回差的理想级数
     */
    public static int idealStages(double error, LocationProfile.GeoTuning tuning) {
        return requiredStages(error, 0, tuning);
    }

    private static double thresholdAt(List<Double> thresholds, int stage) {
        if (thresholds.isEmpty()) {
            return Double.MAX_VALUE;
        }
        return thresholds.get(Math.min(stage, thresholds.size()) - 1);
    }
}
