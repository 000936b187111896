package com.wangbin.hvac.monitor.factory;

import com.wangbin.hvac.common.utils.ValueUtils;
import com.wangbin.hvac.core.config.EquipmentConfig;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.model.ActuatorCommands;
import com.wangbin.hvac.core.model.ControlMode;
import com.wangbin.hvac.core.model.ControlResult;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.processor.ControlCycleEvent;
import com.wangbin.hvac.core.staging.BalanceQuality;
import com.wangbin.hvac.core.staging.RuntimeBalance;
import com.wangbin.hvac.core.strategy.SensorResolver;
import com.wangbin.hvac.core.strategy.Sensors;
import com.wangbin.hvac.core.strategy.impl.FanCoilStrategy;
import com.wangbin.hvac.core.strategy.impl.GeoStagingStrategy;
import com.wangbin.hvac.monitor.alert.AlertLevel;
import com.wangbin.hvac.monitor.alert.AlertNotification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 由 (遥测, 用户设定, 控制结果) 计算设备性能指标与诊断告警
 */
public class EquipmentMetricsCalculator {

    static final double VOLTAGE = 480;
    static final double SQRT_3 = 1.732;
    static final double POWER_FACTOR = 0.85;

    private static final String[] RUNNING_KEYS = {"chillerRunning", "Running", "running", "ChillerRunning"};

    public PerformanceSnapshot calculate(ControlCycleEvent event) {
        ControlResult result = event.getResult();
        Calculation calc = new Calculation(event);

        switch (result.getEquipmentType()) {
            case BOILER -> boiler(calc);
            case PUMP -> pump(calc);
            case FAN_COIL, AIR_HANDLER -> zone(calc);
            case GEO_PLANT -> geo(calc);
            case CHILLER -> chiller(calc);
            default -> {
            }
        }

        Map<String, Double> metrics = numericMetrics(event.getTelemetry());
        if (calc.efficiency != null) {
            metrics.put("efficiency", calc.efficiency);
        }
        if (calc.powerKw != null) {
            metrics.put("powerKw", calc.powerKw);
        }
        if (calc.stagingEffectiveness != null) {
            metrics.put("stagingEffectiveness", calc.stagingEffectiveness);
        }

        return PerformanceSnapshot.builder()
                .locationId(result.getLocationId())
                .equipmentId(result.getEquipmentId())
                .equipmentType(result.getEquipmentType().getCode())
                .controlMode(result.getMode() != null ? result.getMode().name() : null)
                .setpoint(result.getEffectiveSetpoint())
                .efficiency(calc.efficiency)
                .temperatureStability(calc.stability)
                .powerKw(calc.powerKw)
                .runtimeBalance(calc.balance)
                .stagingEffectiveness(calc.stagingEffectiveness)
                .metrics(metrics)
                .alerts(calc.alerts)
                .timestamp(result.getTimestamp())
                .build();
    }

    private void boiler(Calculation calc) {
        double supply = calc.resolver.resolve(calc.telemetry, Sensors.WATER_SUPPLY_TEMP);
        double ret = calc.resolver.resolve(calc.telemetry, Sensors.WATER_RETURN_TEMP);
        double deltaT = supply - ret;
        boolean firing = Boolean.TRUE.equals(calc.commands.getBoolean("boilerFiring"));

        calc.efficiency = boilerEfficiency(supply, ret, firing);
        if (supply > 200) {
            calc.alert(AlertLevel.CRITICAL, "supplyTemp", supply, "锅炉供水温度过高：" + supply + "°F");
        }
        if (firing && deltaT < 10) {
            calc.alert(AlertLevel.WARNING, "deltaT", deltaT, "锅炉燃烧时供回水温差过小：" + ValueUtils.round1(deltaT) + "°F");
        }
    }

    private void pump(Calculation calc) {
        Optional<Double> amps = calc.resolver.find(calc.telemetry, Sensors.MOTOR_AMPS);
        boolean enabled = Boolean.TRUE.equals(calc.commands.getBoolean("pumpEnable"));
        double hp = calc.equipment.getMotorHp();
        if (amps.isEmpty()) {
            return;
        }
        double current = amps.get();
        calc.efficiency = pumpEfficiency(current, hp);
        calc.powerKw = pumpPowerKw(current);
        if (current > hp * 6) {
            calc.alert(AlertLevel.CRITICAL, "amps", current, "水泵电机过载：" + current + "A");
        }
        if (enabled && current < 1) {
            calc.alert(AlertLevel.WARNING, "amps", current, "水泵已启用但电流过低：" + current + "A");
        }
    }

    private void zone(Calculation calc) {
        ControlMode mode = calc.result.getMode();
        Optional<Double> supply = calc.resolver.find(calc.telemetry, Sensors.SUPPLY_TEMP);
        calc.efficiency = zoneEfficiency(mode, supply.orElse(null));

        Double current = ValueUtils.toDouble(calc.result.getDiagnostics().get("currentTemp"));
        Double setpoint = calc.result.getEffectiveSetpoint();
        if (current != null && setpoint != null) {
            calc.stability = temperatureStability(Math.abs(current - setpoint));
        }

        Double heating = calc.commands.getDouble(FanCoilStrategy.HEATING_VALVE);
        Double cooling = calc.commands.getDouble(FanCoilStrategy.COOLING_VALVE);
        if (heating != null && cooling != null && heating > 0 && cooling > 0) {
            calc.alert(AlertLevel.WARNING, "valves", heating, "加热阀与冷却阀同时开启");
        }
    }

    private void geo(Calculation calc) {
        LocationProfile.GeoTuning tuning = calc.location.getGeo();
        Double active = calc.commands.getDouble("activeStages");
        Double required = calc.commands.getDouble("requiredStages");
        Double error = ValueUtils.toDouble(calc.result.getDiagnostics().get("error"));
        if (calc.result.getNextStagingState() != null) {
            BalanceQuality quality = RuntimeBalance.of(calc.result.getNextStagingState()).getQuality();
            calc.balance = quality.getCode();
            if (quality == BalanceQuality.POOR) {
                calc.alert(AlertLevel.INFO, "runtimeBalance", null, "地源热泵各级运行时间不均衡");
            }
        }
        if (active == null || error == null) {
            return;
        }
        int activeStages = active.intValue();
        calc.stagingEffectiveness = stagingEffectiveness(activeStages, error, tuning);

        if (Math.abs(error) > 3) {
            calc.alert(AlertLevel.WARNING, "error", error, "回路温度偏离设定值：" + error + "°F");
        }
        if (required != null && Math.abs(activeStages - required) > 1) {
            calc.alert(AlertLevel.WARNING, "stages", active,
                    "运行级数 " + activeStages + " 与需求级数 " + required.intValue() + " 相差过大");
        }
        if (activeStages >= tuning.getStageCount() && error > 2) {
            calc.alert(AlertLevel.CRITICAL, "capacity", error, "全部级数运行仍无法满足负荷");
        }
    }

    private void chiller(Calculation calc) {
        Optional<Double> supply = calc.resolver.find(calc.telemetry, Sensors.WATER_SUPPLY_TEMP);
        Double setpoint = calc.result.getEffectiveSetpoint();
        if (supply.isPresent() && setpoint != null) {
            calc.efficiency = ValueUtils.clampPercent(100 - Math.abs(supply.get() - setpoint) * 10);
        }
        if (calc.result.getMode() == ControlMode.LOCKOUT && isRunning(calc.telemetry)) {
            calc.alert(AlertLevel.WARNING, "lockout", null, "冷水机组在室外温度闭锁期间仍在运行");
        }
    }

    // =============== 公式 ===============

    static double boilerEfficiency(double supply, double ret, boolean firing) {
        if (!firing || supply <= ret) {
            return 0;
        }
        return ValueUtils.round1(Math.min(95, 70 + (supply - ret) / 20 * 25));
    }

    static double pumpEfficiency(double amps, double hp) {
        return ValueUtils.round1(ValueUtils.clampPercent(100 - Math.abs(amps - hp * 1.5) * 10));
    }

    static double pumpPowerKw(double amps) {
        return Math.round(amps * VOLTAGE * SQRT_3 * POWER_FACTOR / 1000 * 100) / 100.0;
    }

    static double zoneEfficiency(ControlMode mode, Double supply) {
        if (supply == null) {
            return 85;
        }
        if (mode == ControlMode.HEATING) {
            return ValueUtils.round1(ValueUtils.clampPercent(100 - Math.abs(supply - 105) * 2));
        }
        if (mode == ControlMode.COOLING) {
            return ValueUtils.round1(ValueUtils.clampPercent(100 - Math.abs(supply - 55) * 2));
        }
        return 85;
    }

    static String temperatureStability(double deviation) {
        if (deviation < 0.5) {
            return "excellent";
        }
        if (deviation < 1) {
            return "good";
        }
        if (deviation < 2) {
            return "fair";
        }
        return "poor";
    }

    static double stagingEffectiveness(int activeStages, double error, LocationProfile.GeoTuning tuning) {
        int ideal = GeoStagingStrategy.idealStages(error, tuning);
        double score = 100 - 20.0 * Math.abs(activeStages - ideal)
                - 10 * Math.max(0, Math.abs(error) - tuning.getDeadband());
        return ValueUtils.round1(ValueUtils.clampPercent(score));
    }

    private static boolean isRunning(TelemetrySnapshot telemetry) {
        for (String key : RUNNING_KEYS) {
            Optional<Boolean> running = telemetry.getBoolean(key);
            if (running.isPresent()) {
                return running.get();
            }
        }
        return false;
    }

    private static Map<String, Double> numericMetrics(TelemetrySnapshot telemetry) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (telemetry == null) {
            return metrics;
        }
        telemetry.getMetrics().forEach((key, value) -> {
            if (value instanceof Boolean) {
                return;
            }
            Double number = ValueUtils.toDouble(value);
            if (number != null) {
                metrics.put(key, number);
            }
        });
        return metrics;
    }

    private static final class Calculation {
        private final ControlResult result;
        private final LocationProfile location;
        private final EquipmentConfig equipment;
        private final TelemetrySnapshot telemetry;
        private final ActuatorCommands commands;
        private final SensorResolver resolver;
        private final List<AlertNotification> alerts = new ArrayList<>();
        private Double efficiency;
        private Double powerKw;
        private String stability;
        private String balance;
        private Double stagingEffectiveness;

        private Calculation(ControlCycleEvent event) {
            this.result = event.getResult();
            this.location = event.getLocation();
            this.equipment = event.getEquipment();
            this.telemetry = event.getTelemetry() != null
                    ? event.getTelemetry() : TelemetrySnapshot.empty(equipment.getId());
            this.commands = result.getCommands() != null ? result.getCommands() : new ActuatorCommands();
            this.resolver = new SensorResolver(location, equipment);
        }

        private void alert(AlertLevel level, String metric, Object value, String message) {
            alerts.add(AlertNotification.builder()
                    .locationId(result.getLocationId())
                    .equipmentId(result.getEquipmentId())
                    .equipmentType(result.getEquipmentType().getCode())
                    .metric(metric)
                    .ruleId(result.getEquipmentType().getCode() + "." + metric)
                    .ruleName(equipment.getDisplayName())
                    .level(level)
                    .message(message)
                    .eventType("diagnostic")
                    .value(value)
                    .timestamp(result.getTimestamp())
                    .build());
        }
    }
}
