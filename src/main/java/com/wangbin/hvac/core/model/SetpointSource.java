package com.wangbin.hvac.core.model;

/**
 * 有效设定值来源，按优先级排列
 */
public enum SetpointSource {
    USER,
    SETTINGS,
    OUTDOOR_AIR_RESET,
    DEFAULT
}
