package com.wangbin.hvac.core.strategy;

import lombok.Value;

import java.util.List;

/**
 * 逻辑传感器的有序候选键与默认值
 */
@Value
public class SensorChain {

    String name;
    List<String> candidates;
    double defaultValue;

    public static SensorChain of(String name, double defaultValue, String... candidates) {
        return new SensorChain(name, List.of(candidates), defaultValue);
    }

    public SensorChain withCandidates(List<String> override) {
        return new SensorChain(name, List.copyOf(override), defaultValue);
    }
}
