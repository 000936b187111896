package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.core.model.EquipmentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 设备类型 → 控制策略
 */
@Slf4j
@Component
public class StrategyRegistry {

    private final Map<EquipmentType, EquipmentStrategy> strategies = new EnumMap<>(EquipmentType.class);

    public StrategyRegistry(List<EquipmentStrategy> strategyList) {
        for (EquipmentStrategy strategy : strategyList) {
            EquipmentStrategy previous = strategies.put(strategy.getType(), strategy);
            if (previous != null) {
                throw EngineException.configException("设备类型 " + strategy.getType() + " 注册了多个控制策略", null);
            }
        }
        log.info("已注册控制策略: {}", strategies.keySet());
    }

    public EquipmentStrategy get(EquipmentType type) {
        EquipmentStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw EngineException.configException("设备类型 " + type + " 没有控制策略", null);
        }
        return strategy;
    }

    public boolean supports(EquipmentType type) {
        return strategies.containsKey(type);
    }

    public Map<EquipmentType, EquipmentStrategy> getStrategies() {
        return Collections.unmodifiableMap(strategies);
    }
}
