package com.wangbin.hvac.core.pid;

import lombok.Value;

/**
 * PID计算结果
 */
@Value
public class PidResult {
    /** 发布用输出（已处理反作用与限幅） */
    double output;
    /** 限幅后、反作用映射前的输出 */
    double rawOutput;
    double error;
    double proportional;
    double integral;
    double derivative;
    PidState newState;
}
