package com.wangbin.hvac.api.controller;

import com.wangbin.hvac.common.web.result.ApiResult;
import com.wangbin.hvac.core.processor.LocationProcessorManager;
import com.wangbin.hvac.core.processor.ProcessorStatus;
import com.wangbin.hvac.core.processor.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 位置处理器控制器
 * 提供处理器的启动、停止、手动触发与状态查询接口
 */
@Slf4j
@RestController
@RequestMapping("/api/processors")
@RequiredArgsConstructor
public class ProcessorController {

    private final LocationProcessorManager processorManager;

    @GetMapping
    public ApiResult<List<ProcessorStatus>> list() {
        return ApiResult.success(processorManager.getStatus());
    }

    @GetMapping("/{locationId}")
    public ApiResult<ProcessorStatus> status(@PathVariable String locationId) {
        return ApiResult.success(processorManager.getStatus(locationId));
    }

    @PostMapping("/{locationId}/start")
    public ApiResult<ProcessorStatus> start(@PathVariable String locationId) {
        log.info("请求启动位置处理器: {}", locationId);
        return ApiResult.success("位置处理器已启动", processorManager.start(locationId));
    }

    @PostMapping("/{locationId}/stop")
    public ApiResult<ProcessorStatus> stop(@PathVariable String locationId) {
        log.info("请求停止位置处理器: {}", locationId);
        return ApiResult.success("位置处理器已停止", processorManager.stop(locationId));
    }

    @DeleteMapping("/{locationId}/equipment/{equipmentId}/state")
    public ApiResult<Void> resetState(@PathVariable String locationId, @PathVariable String equipmentId) {
        log.info("请求清除设备控制器状态: {}/{}", locationId, equipmentId);
        processorManager.resetState(locationId, equipmentId);
        return ApiResult.success();
    }

    @PostMapping("/{locationId}/{equipmentType}/run")
    public ApiResult<TaskStatus> run(@PathVariable String locationId, @PathVariable String equipmentType) {
        return ApiResult.success("控制周期已触发", processorManager.trigger(locationId, equipmentType));
    }
}
