package com.wangbin.hvac.core.staging;

/**
 * 领先机组选择策略
 */
public enum RotationPolicy {
    /** 每次从零启动时轮换到下一台 */
    ROUND_ROBIN,
    /** 随机选择一台未运行的机组 */
    RANDOM
}
