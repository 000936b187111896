package com.wangbin.hvac.core.config;

import com.wangbin.hvac.core.model.EquipmentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单台设备配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentConfig {

    private String id;
    private String name;
    private EquipmentType type;

    /** 主备/分级组标识，同组设备共享轮换状态 */
    private String groupId;

    /** 水泵服务类型 */
    @Builder.Default
    private PumpService service = PumpService.HOT_WATER;

    /** 生活热水锅炉使用固定设定值 */
    private boolean domestic;

    /** 新风机组控制方式 */
    @Builder.Default
    private DoasControl doasControl = DoasControl.MODULATING;

    /** 电机功率（马力），用于效率与过载计算 */
    @Builder.Default
    private double motorHp = 5.0;

    /** 设备级传感器候选键覆盖 */
    @Builder.Default
    private Map<String, List<String>> sensors = new LinkedHashMap<>();

    public String getGroupIdOrSelf() {
        return groupId == null || groupId.isBlank() ? id : groupId;
    }

    public String getDisplayName() {
        return name == null || name.isBlank() ? id : name;
    }

    public enum PumpService {
        CHILLED_WATER,
        HOT_WATER
    }

    public enum DoasControl {
        /** 比例燃气阀加两级直膨制冷，按室外温度切换模式 */
        MODULATING,
        /** 按送风温度回差启停加热与制冷 */
        ON_OFF
    }
}
