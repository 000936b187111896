package com.wangbin.hvac.core.report.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 写入结果库的一条记录
 */
@Data
@Builder
public class SinkRecord {
    private String measurement;                 // 测量名
    private String locationId;                  // 位置ID
    private String equipmentId;                 // 设备ID
    private String equipmentType;               // 设备类型编码
    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();   // 标签
    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>(); // 字段
    private long timestamp;                     // 毫秒时间戳
}
