package com.wangbin.hvac.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),
    DATA_INVALID(1003, "数据无效"),
    OPERATION_FAILED(1004, "操作失败"),

    // 控制引擎相关错误
    ENGINE_ERROR(2000, "控制引擎错误"),
    STRATEGY_ERROR(2001, "控制策略执行错误"),
    SOURCE_ERROR(2002, "数据源读取错误"),
    PUBLISH_ERROR(2003, "控制结果发布错误"),
    STATE_ERROR(2004, "控制器状态错误"),
    PROCESSOR_ERROR(2005, "位置处理器错误"),
    PROCESS_TIMEOUT(2006, "处理超时"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误"),
    CONFIG_NOT_FOUND(3001, "配置不存在"),
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    SERVICE_UNAVAILABLE(5001, "服务不可用"),
    NETWORK_ERROR(5004, "网络错误"),

    // 其他错误
    UNKNOWN_ERROR(9999, "未知错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 根据code获取枚举
     */
    public static ResultCode fromCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    /**
     * 判断是否为引擎错误
     */
    public boolean isEngineError() {
        return code >= 2000 && code < 3000;
    }
}
