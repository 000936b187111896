package com.wangbin.hvac.api.controller;

import com.wangbin.hvac.common.exception.BusinessException;
import com.wangbin.hvac.common.web.result.ApiResult;
import com.wangbin.hvac.common.web.result.ResultCode;
import com.wangbin.hvac.core.config.HvacProperties;
import com.wangbin.hvac.core.config.LocationProfile;
import com.wangbin.hvac.core.staging.RuntimeBalance;
import com.wangbin.hvac.core.staging.StagingState;
import com.wangbin.hvac.core.state.ControllerStateStore;
import com.wangbin.hvac.monitor.alert.AlertManager;
import com.wangbin.hvac.monitor.alert.AlertNotification;
import com.wangbin.hvac.monitor.factory.DataFactoryService;
import com.wangbin.hvac.monitor.factory.PerformanceSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 性能指标、告警与分级状态查询接口
 */
@RestController
@RequiredArgsConstructor
public class PerformanceController {

    private final DataFactoryService dataFactoryService;
    private final AlertManager alertManager;
    private final ControllerStateStore stateStore;
    private final HvacProperties properties;

    @GetMapping("/api/performance/{locationId}")
    public ApiResult<List<PerformanceSnapshot>> performance(@PathVariable String locationId) {
        return ApiResult.success(dataFactoryService.getPerformance(locationId));
    }

    @GetMapping("/api/performance/{locationId}/{equipmentId}")
    public ApiResult<PerformanceSnapshot> equipmentPerformance(@PathVariable String locationId,
                                                               @PathVariable String equipmentId) {
        return dataFactoryService.getPerformance(locationId, equipmentId)
                .map(ApiResult::success)
                .orElseThrow(() -> new BusinessException(ResultCode.DATA_NOT_FOUND,
                        "暂无设备性能数据: " + equipmentId));
    }

    @GetMapping("/api/alerts")
    public ApiResult<List<AlertNotification>> alerts(@RequestParam(required = false) String locationId,
                                                     @RequestParam(defaultValue = "50") int limit) {
        return ApiResult.success(alertManager.recent(locationId, Math.max(1, limit)));
    }

    @GetMapping("/api/staging/{groupId}")
    public ApiResult<Map<String, Object>> staging(@PathVariable String groupId,
                                                  @RequestParam(required = false) String locationId) {
        for (LocationProfile location : properties.getLocations()) {
            if (locationId != null && !location.getId().equalsIgnoreCase(locationId)) {
                continue;
            }
            StagingState state = stateStore.loadStagingState(location.getId(), groupId);
            if (state != null) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("locationId", location.getId());
                data.put("state", state);
                data.put("runtimeBalance", RuntimeBalance.of(state));
                return ApiResult.success(data);
            }
        }
        throw new BusinessException(ResultCode.DATA_NOT_FOUND, "分级组不存在: " + groupId);
    }
}
