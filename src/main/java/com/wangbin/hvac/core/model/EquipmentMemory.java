package com.wangbin.hvac.core.model;

import com.wangbin.hvac.common.utils.ValueUtils;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 设备级小型键值状态，用于回差锁存等跨周期记忆
 */
@Data
@NoArgsConstructor
public class EquipmentMemory {

    private Map<String, Object> values = new LinkedHashMap<>();
    private long updatedAt;

    public EquipmentMemory(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public boolean getFlag(String key, boolean defaultValue) {
        Boolean value = ValueUtils.toBoolean(values.get(key));
        return value != null ? value : defaultValue;
    }

    public EquipmentMemory withFlag(String key, boolean value) {
        EquipmentMemory copy = copy();
        copy.values.put(key, value);
        copy.updatedAt = System.currentTimeMillis();
        return copy;
    }

    public EquipmentMemory with(String key, Object value) {
        EquipmentMemory copy = copy();
        copy.values.put(key, value);
        copy.updatedAt = System.currentTimeMillis();
        return copy;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public EquipmentMemory copy() {
        EquipmentMemory copy = new EquipmentMemory(values);
        copy.updatedAt = updatedAt;
        return copy;
    }
}
