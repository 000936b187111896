package com.wangbin.hvac.core.state;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.model.EquipmentMemory;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.staging.LeadLagState;
import com.wangbin.hvac.core.staging.StagingState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 本地控制器状态存储（基于Caffeine），写入后超过TTL未更新的状态被淘汰
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.state", name = "store", havingValue = "memory", matchIfMissing = true)
public class CaffeineControllerStateStore implements ControllerStateStore {

    private final Cache<String, Object> cache;
    private final String prefix;

    public CaffeineControllerStateStore(HvacProperties properties) {
        HvacProperties.StateConfig config = properties.getState();
        this.prefix = config.getKeyPrefix();
        RemovalListener<String, Object> removalListener = (key, value, cause) -> {
            if (cause.wasEvicted()) {
                log.debug("控制器状态被淘汰: key={}, cause={}", key, cause);
            }
        };
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getMaxSize())
                .expireAfterWrite(config.getTtl())
                .recordStats()
                .removalListener(removalListener)
                .build();
        log.info("本地控制器状态存储初始化完成: maxSize={}, ttl={}", config.getMaxSize(), config.getTtl());
    }

    @Override
    public String getName() {
        return "LOCAL_CAFFEINE";
    }

    @Override
    public Map<ControllerRole, PidState> loadPidStates(String locationId, String equipmentId) {
        Map<ControllerRole, PidState> states = new EnumMap<>(ControllerRole.class);
        for (ControllerRole role : ControllerRole.values()) {
            Object value = cache.getIfPresent(StateKeys.pid(prefix, locationId, equipmentId, role));
            if (value instanceof PidState state) {
                states.put(role, state.copy());
            }
        }
        return states;
    }

    @Override
    public void savePidStates(String locationId, String equipmentId, Map<ControllerRole, PidState> states) {
        if (states == null) {
            return;
        }
        states.forEach((role, state) -> cache.put(StateKeys.pid(prefix, locationId, equipmentId, role), state.copy()));
    }

    @Override
    public StagingState loadStagingState(String locationId, String groupId) {
        Object value = cache.getIfPresent(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, groupId));
        return value instanceof StagingState state ? state.copy() : null;
    }

    @Override
    public void saveStagingState(String locationId, String groupId, StagingState state) {
        if (state != null) {
            cache.put(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, groupId), state.copy());
        }
    }

    @Override
    public LeadLagState loadLeadLagState(String locationId, String groupId) {
        Object value = cache.getIfPresent(StateKeys.equipment(prefix, StateKeys.LEAD_LAG, locationId, groupId));
        return value instanceof LeadLagState state ? state.toBuilder().build() : null;
    }

    @Override
    public void saveLeadLagState(String locationId, String groupId, LeadLagState state) {
        if (state != null) {
            cache.put(StateKeys.equipment(prefix, StateKeys.LEAD_LAG, locationId, groupId), state.toBuilder().build());
        }
    }

    @Override
    public EquipmentMemory loadMemory(String locationId, String equipmentId) {
        Object value = cache.getIfPresent(StateKeys.equipment(prefix, StateKeys.MEMORY, locationId, equipmentId));
        return value instanceof EquipmentMemory memory ? memory.copy() : null;
    }

    @Override
    public void saveMemory(String locationId, String equipmentId, EquipmentMemory memory) {
        if (memory != null) {
            cache.put(StateKeys.equipment(prefix, StateKeys.MEMORY, locationId, equipmentId), memory.copy());
        }
    }

    @Override
    public void clear(String locationId, String equipmentId, String groupId) {
        String group = groupId != null ? groupId : equipmentId;
        for (ControllerRole role : ControllerRole.values()) {
            cache.invalidate(StateKeys.pid(prefix, locationId, equipmentId, role));
        }
        cache.invalidate(StateKeys.equipment(prefix, StateKeys.MEMORY, locationId, equipmentId));
        cache.invalidate(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, equipmentId));
        cache.invalidate(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, group));
        cache.invalidate(StateKeys.equipment(prefix, StateKeys.LEAD_LAG, locationId, group));
        log.info("已清除设备 {}/{} 的控制器状态，所在组：{}", locationId, equipmentId, group);
    }

    @Override
    public Map<String, Object> getStatistics() {
        CacheStats stats = cache.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("store", getName());
        result.put("size", cache.estimatedSize());
        result.put("hitCount", stats.hitCount());
        result.put("missCount", stats.missCount());
        result.put("hitRate", stats.hitRate());
        result.put("evictionCount", stats.evictionCount());
        return result;
    }

    @PreDestroy
    public void destroy() {
        cache.invalidateAll();
        cache.cleanUp();
        log.info("本地控制器状态存储已销毁");
    }
}
