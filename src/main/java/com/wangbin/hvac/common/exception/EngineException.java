package com.wangbin.hvac.common.exception;

import com.wangbin.hvac.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 控制引擎异常，携带发生位置与设备信息
 */
@Getter
public class EngineException extends BusinessException {

    private final String locationId;
    private final String equipmentId;
    private final String equipmentType;

    public EngineException(ResultCode resultCode, String message,
                           String locationId, String equipmentId, String equipmentType) {
        super(resultCode.getCode(), message);
        this.locationId = locationId;
        this.equipmentId = equipmentId;
        this.equipmentType = equipmentType;
    }

    public EngineException(ResultCode resultCode, String message,
                           String locationId, String equipmentId, String equipmentType, Throwable cause) {
        this(resultCode, message, locationId, equipmentId, equipmentType);
        initCause(cause);
    }

    // 策略执行异常
    public static EngineException strategyException(String message, String locationId, String equipmentId,
                                                    Throwable cause) {
        return new EngineException(ResultCode.STRATEGY_ERROR, message, locationId, equipmentId, null, cause);
    }

    // 数据源读取异常
    public static EngineException sourceException(String message, String locationId, String equipmentType,
                                                  Throwable cause) {
        return new EngineException(ResultCode.SOURCE_ERROR, message, locationId, null, equipmentType, cause);
    }

    // 发布异常
    public static EngineException publishException(String message, Throwable cause) {
        return new EngineException(ResultCode.PUBLISH_ERROR, message, null, null, null, cause);
    }

    // 配置异常
    public static EngineException configException(String message, String locationId) {
        return new EngineException(ResultCode.CONFIG_INVALID, message, locationId, null, null);
    }

    // 处理超时
    public static EngineException timeoutException(String locationId, String equipmentType) {
        return new EngineException(ResultCode.PROCESS_TIMEOUT, "处理超时", locationId, null, equipmentType);
    }
}
