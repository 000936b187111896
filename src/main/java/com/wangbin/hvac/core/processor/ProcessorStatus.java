package com.wangbin.hvac.core.processor;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 位置处理器状态
 */
@Value
@Builder
public class ProcessorStatus {
    String locationId;
    String locationName;
    boolean running;
    List<TaskStatus> tasks;
}
