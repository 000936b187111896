package com.wangbin.hvac.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 用户命令提交请求
 */
@Data
public class CommandRequest {

    @NotBlank(message = "设备ID不能为空")
    private String equipmentId;

    @NotBlank(message = "设备类型不能为空")
    private String equipmentType;

    @NotBlank(message = "命令类型不能为空")
    private String commandType;

    private Object value;

    private String modifiedBy;
}
