package com.wangbin.hvac.core.report.model;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * 发布结果模型
 */
@Data
public class PublishResult {
    private String sinkName;          // 写入端名称
    private boolean success;          // 是否成功
    private int recordCount;          // 记录数
    private String errorMessage;      // 错误信息
    private long costTime;            // 耗时（毫秒）
    private Integer statusCode;       // 状态码（HTTP等）
    private Map<String, Object> metadata = new HashMap<>(); // 附加信息

    // 成功结果
    public static PublishResult success(String sinkName, int recordCount) {
        PublishResult result = new PublishResult();
        result.setSinkName(sinkName);
        result.setSuccess(true);
        result.setRecordCount(recordCount);
        return result;
    }

    // 错误结果
    public static PublishResult error(String sinkName, String errorMessage) {
        PublishResult result = new PublishResult();
        result.setSinkName(sinkName);
        result.setSuccess(false);
        result.setErrorMessage(errorMessage);
        return result;
    }

    // 无可写字段，跳过
    public static PublishResult skipped(String sinkName) {
        PublishResult result = success(sinkName, 0);
        result.addMetadata("skipped", true);
        return result;
    }

    public boolean isSkipped() {
        return Boolean.TRUE.equals(metadata.get("skipped"));
    }

    // 添加元数据
    public void addMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        metadata.put(key, value);
    }
}
