package com.wangbin.hvac.core.state;

import com.wangbin.hvac.common.exception.BusinessException;
import com.wangbin.hvac.common.web.result.ResultCode;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.model.EquipmentMemory;
import com.wangbin.hvac.core.pid.ControllerRole;
import com.wangbin.hvac.core.pid.PidState;
import com.wangbin.hvac.core.staging.LeadLagState;
import com.wangbin.hvac.core.staging.StagingState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis控制器状态存储，多实例部署或重启后保留积分与分级状态
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.state", name = "store", havingValue = "redis")
public class RedisControllerStateStore implements ControllerStateStore {

    private final RedisTemplate<String, Object> redisTemplate;
    private final String prefix;
    private final Duration ttl;

    private final AtomicLong readCount = new AtomicLong(0);
    private final AtomicLong writeCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);

    public RedisControllerStateStore(RedisTemplate<String, Object> redisTemplate, HvacProperties properties) {
        this.redisTemplate = redisTemplate;
        this.prefix = properties.getState().getKeyPrefix();
        this.ttl = properties.getState().getTtl();
        log.info("Redis控制器状态存储初始化完成: prefix={}, ttl={}", prefix, ttl);
    }

    @Override
    public String getName() {
        return "REDIS";
    }

    @Override
    public Map<ControllerRole, PidState> loadPidStates(String locationId, String equipmentId) {
        Map<ControllerRole, PidState> states = new EnumMap<>(ControllerRole.class);
        for (ControllerRole role : ControllerRole.values()) {
            PidState state = read(StateKeys.pid(prefix, locationId, equipmentId, role), PidState.class);
            if (state != null) {
                states.put(role, state);
            }
        }
        return states;
    }

    @Override
    public void savePidStates(String locationId, String equipmentId, Map<ControllerRole, PidState> states) {
        if (states != null) {
            states.forEach((role, state) -> write(StateKeys.pid(prefix, locationId, equipmentId, role), state));
        }
    }

    @Override
    public StagingState loadStagingState(String locationId, String groupId) {
        return read(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, groupId), StagingState.class);
    }

    @Override
    public void saveStagingState(String locationId, String groupId, StagingState state) {
        write(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, groupId), state);
    }

    @Override
    public LeadLagState loadLeadLagState(String locationId, String groupId) {
        return read(StateKeys.equipment(prefix, StateKeys.LEAD_LAG, locationId, groupId), LeadLagState.class);
    }

    @Override
    public void saveLeadLagState(String locationId, String groupId, LeadLagState state) {
        write(StateKeys.equipment(prefix, StateKeys.LEAD_LAG, locationId, groupId), state);
    }

    @Override
    public EquipmentMemory loadMemory(String locationId, String equipmentId) {
        return read(StateKeys.equipment(prefix, StateKeys.MEMORY, locationId, equipmentId), EquipmentMemory.class);
    }

    @Override
    public void saveMemory(String locationId, String equipmentId, EquipmentMemory memory) {
        write(StateKeys.equipment(prefix, StateKeys.MEMORY, locationId, equipmentId), memory);
    }

    @Override
    public void clear(String locationId, String equipmentId, String groupId) {
        String group = groupId != null ? groupId : equipmentId;
        List<String> keys = new ArrayList<>();
        for (ControllerRole role : ControllerRole.values()) {
            keys.add(StateKeys.pid(prefix, locationId, equipmentId, role));
        }
        keys.add(StateKeys.equipment(prefix, StateKeys.MEMORY, locationId, equipmentId));
        keys.add(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, equipmentId));
        keys.add(StateKeys.equipment(prefix, StateKeys.STAGING, locationId, group));
        keys.add(StateKeys.equipment(prefix, StateKeys.LEAD_LAG, locationId, group));
        redisTemplate.delete(keys);
        log.info("已清除设备 {}/{} 的Redis控制器状态，所在组：{}", locationId, equipmentId, group);
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("store", getName());
        result.put("readCount", readCount.get());
        result.put("writeCount", writeCount.get());
        result.put("errorCount", errorCount.get());
        return result;
    }

    private <T> T read(String key, Class<T> type) {
        readCount.incrementAndGet();
        try {
            Object value = redisTemplate.opsForValue().get(key);
            return type.isInstance(value) ? type.cast(value) : null;
        } catch (Exception e) {
            errorCount.incrementAndGet();
            throw new BusinessException(ResultCode.STATE_ERROR, "读取 " + key + " 失败: " + e.getMessage());
        }
    }

    private void write(String key, Object value) {
        if (value == null) {
            return;
        }
        writeCount.incrementAndGet();
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (Exception e) {
            errorCount.incrementAndGet();
            throw new BusinessException(ResultCode.STATE_ERROR, "写入 " + key + " 失败: " + e.getMessage());
        }
    }
}
