package com.wangbin.hvac.core.config;

import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidParams;
import com.wangbin.hvac.core.staging.RotationPolicy;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 位置配置对象：各位置的差异（补偿标定、传感器候选顺序、风阀区间、PID整定）都在这里表达，
 * 控制策略本身按设备类型只有一份。
 */
@Data
public class LocationProfile {

    private String id;
    private String name;
    private boolean enabled = true;

    /** 调度周期覆盖 */
    private Map<EquipmentType, Duration> intervals = new EnumMap<>(EquipmentType.class);

    /** 处理超时覆盖 */
    private Map<EquipmentType, Duration> timeouts = new EnumMap<>(EquipmentType.class);

    private List<EquipmentConfig> equipment = new ArrayList<>();

    /** 逻辑传感器 → 候选键，覆盖默认顺序 */
    private Map<String, List<String>> sensors = new LinkedHashMap<>();

    /** PID整定，按角色 */
    private Map<ControllerRole, PidParams> pid = new EnumMap<>(ControllerRole.class);

    private ZoneTuning zone = new ZoneTuning();
    private OarCalibration oar = new OarCalibration();
    private BoilerTuning boiler = new BoilerTuning();
    private ChillerTuning chiller = new ChillerTuning();
    private PumpTuning pump = new PumpTuning();
    private GeoTuning geo = new GeoTuning();
    private SteamBundleTuning steamBundle = new SteamBundleTuning();
    private DoasTuning doas = new DoasTuning();

    public String getDisplayName() {
        return name == null || name.isBlank() ? id : name;
    }

    public Duration intervalFor(EquipmentType type) {
        return intervals.getOrDefault(type, type.getDefaultInterval());
    }

    public Duration timeoutFor(EquipmentType type) {
        return timeouts.getOrDefault(type, type.getDefaultTimeout());
    }

    public PidParams pidFor(ControllerRole role) {
        PidParams params = pid.get(role);
        return params != null ? params : PidParams.defaults();
    }

    public List<EquipmentConfig> equipmentOf(EquipmentType type) {
        return equipment.stream()
                .filter(item -> item.getType() == type)
                .collect(Collectors.toList());
    }

    public Optional<EquipmentConfig> findEquipment(String equipmentId) {
        return equipment.stream().filter(item -> item.getId().equals(equipmentId)).findFirst();
    }

    /**
     * 位置内出现的设备类型，按声明顺序
     */
    public List<EquipmentType> equipmentTypes() {
        return equipment.stream()
                .map(EquipmentConfig::getType)
                .distinct()
                .collect(Collectors.toList());
    }

    // =============== 分类整定参数 ===============

    /**
     * 末端（风机盘管/空调箱）温控参数
     */
    @Data
    public static class ZoneTuning {
        private double deadband = 1.0;
        private double defaultSetpoint = 72;
        /** 设置中提供的固定设定值，优先级低于用户设定、高于补偿计算 */
        private Double fixedSetpoint;
        private double minSetpoint = 55;
        private double maxSetpoint = 85;
        private double freezeThreshold = 40;
        private double highLimit = 115;
        private double damperLowBound = 40;
        private double damperHighBound = 80;
        private double damperOpenPosition = 100;
        /** 空调箱有人时最小新风开度 */
        private double minOutdoorAirPosition = 20;
        private String activeFanSpeed = "medium";
        private String idleFanSpeed = "low";
        /** PID周期步长 */
        private double pidDt = 1.0;
    }

    @Data
    public static class BoilerTuning {
        private OarCalibration oar = new OarCalibration(true, 30, 155, 75, 80);
        private double domesticSetpoint = 135;
        private double defaultSupply = 140;
        private double emergencyShutoff = 170;
        private double firingDeadband = 2;
        private Duration changeoverInterval = Duration.ofDays(7);
    }

    @Data
    public static class ChillerTuning {
        private double lockoutOat = 50;
        /** 启用回差时按 enableOat/disableOat 锁存 */
        private boolean hysteresis = false;
        private double enableOat = 40;
        private double disableOat = 38;
        private double defaultSetpoint = 44;
        private int maxStages = 2;
        private Duration minimumRuntime = Duration.ofMinutes(3);
        private Duration stageUpDelay = Duration.ofMinutes(3);
        private Duration stageDownDelay = Duration.ofMinutes(3);
        private RotationPolicy rotation = RotationPolicy.ROUND_ROBIN;
    }

    @Data
    public static class PumpTuning {
        private double cwOnOat = 37;
        private double cwOffOat = 36;
        private double hwOnOat = 74;
        private double hwOffOat = 75;
        /** 极端室外温度时同时启动备用泵 */
        private double cwLagOat = 90;
        private double hwLagOat = 20;
        /** 运行中电流低于该值视为故障 */
        private double failureAmps = 0.5;
        private double defaultSpeed = 100;
        private Duration changeoverInterval = Duration.ofDays(7);
    }

    @Data
    public static class GeoTuning {
        private int stageCount = 4;
        private double setpoint = 45;
        private double deadband = 1.75;
        private List<Double> stageOnThresholds = new ArrayList<>(List.of(1.75, 3.75, 5.75, 7.75));
        private List<Double> stageOffThresholds = new ArrayList<>(List.of(0.0, 1.75, 3.75, 5.75));
        private double highLimit = 65;
        private double lowLimit = 35;
        private double maxCompressorAmps = 50;
        private Duration minimumRuntime = Duration.ofMinutes(3);
        private Duration stageUpDelay = Duration.ofMinutes(3);
        private Duration stageDownDelay = Duration.ofMinutes(3);
        private RotationPolicy rotation = RotationPolicy.ROUND_ROBIN;
    }

    /**
     * 蒸汽换热器：室外温度补偿到 0 即停机，主阀承担前 primaryValveRatio 的输出，超出部分由副阀调节
     */
    @Data
    public static class SteamBundleTuning {
        private OarCalibration oar = new OarCalibration(true, 32, 155, 70, 0);
        /** 补偿关闭时的固定设定值 */
        private double defaultSetpoint = 150;
        private double safetyShutoff = 165;
        private boolean requirePump = true;
        /** 热水泵电流高于该值视为运行 */
        private double pumpRunningAmps = 10;
        private double primaryValveRatio = 0.33;
    }

    @Data
    public static class DoasTuning {
        private double modulatingSetpoint = 68;
        private double onOffSetpoint = 65;
        /** 比例型：室外温度低于该值加热 */
        private double heatingOat = 60;
        /** 比例型：室外温度不低于该值制冷 */
        private double coolingOat = 60.5;
        private double onOffDeadband = 2;
        private double highLimit = 85;
        private double lowLimit = 45;
        private double heatingLockoutOat = 65;
        private double coolingLockoutOat = 50;
        /** 燃气阀每°F误差的开度 */
        private double gasValveGain = 10;
        private double dxStage1Error = 2;
        private double dxStage2Error = 4;
        /** 缺少室外温度时的取值 */
        private double defaultOutdoor = 65;
    }
}
