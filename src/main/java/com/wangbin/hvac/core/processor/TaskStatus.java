package com.wangbin.hvac.core.processor;

import lombok.Builder;
import lombok.Value;

/**
 * 周期任务状态快照
 */
@Value
@Builder
public class TaskStatus {
    String locationId;
    String equipmentType;
    long intervalMs;
    long timeoutMs;
    boolean scheduled;
    boolean running;
    long lastRun;
    long lastSuccess;
    long nextRun;
    long runs;
    long failures;
    long timeouts;
    long skips;
    long lastDurationMs;
    String lastError;
    CycleReport lastReport;
}
