package com.wangbin.hvac.core.model;

import com.wangbin.hvac.common.utils.ValueUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 执行器命令集合，百分比字段写入时即限幅到 [0,100]
 */
public class ActuatorCommands {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public ActuatorCommands percent(String field, double value) {
        values.put(field, ValueUtils.round1(ValueUtils.clampPercent(value)));
        return this;
    }

    public ActuatorCommands number(String field, double value) {
        values.put(field, ValueUtils.round1(value));
        return this;
    }

    public ActuatorCommands integer(String field, long value) {
        values.put(field, value);
        return this;
    }

    public ActuatorCommands flag(String field, boolean value) {
        values.put(field, value);
        return this;
    }

    public ActuatorCommands text(String field, String value) {
        if (value != null) {
            values.put(field, value);
        }
        return this;
    }

    public Object get(String field) {
        return values.get(field);
    }

    public Double getDouble(String field) {
        return ValueUtils.toDouble(values.get(field));
    }

    public Boolean getBoolean(String field) {
        return ValueUtils.toBoolean(values.get(field));
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
