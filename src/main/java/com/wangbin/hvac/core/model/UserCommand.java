package com.wangbin.hvac.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 从命令源读取的原始用户命令
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCommand {
    private String locationId;
    private String equipmentId;
    private String equipmentType;
    /** 命令类型，如 enabled / temperatureSetpoint / isLead */
    private String commandType;
    private Object value;
    private String modifiedBy;
    private long modifiedAt;
}
