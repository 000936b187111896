package com.wangbin.hvac.api.controller;

import com.wangbin.hvac.api.dto.CommandRequest;
import com.wangbin.hvac.common.exception.BusinessException;
import com.wangbin.hvac.common.web.result.ApiResult;
import com.wangbin.hvac.common.web.result.ResultCode;
import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.TelemetrySnapshot;
import com.wangbin.hvac.core.model.UserCommand;
import com.wangbin.hvac.core.source.InMemoryCommandSource;
import com.wangbin.hvac.core.source.InMemoryTelemetrySource;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 内存数据源的遥测与命令写入接口，仅 hvac.source.mode=memory 时可用
 */
@Slf4j
@RestController
public class TelemetryController {

    private final ObjectProvider<InMemoryTelemetrySource> telemetrySource;
    private final ObjectProvider<InMemoryCommandSource> commandSource;

    public TelemetryController(ObjectProvider<InMemoryTelemetrySource> telemetrySource,
                               ObjectProvider<InMemoryCommandSource> commandSource) {
        this.telemetrySource = telemetrySource;
        this.commandSource = commandSource;
    }

    @PostMapping("/api/telemetry/{locationId}/{equipmentId}")
    public ApiResult<TelemetrySnapshot> ingest(@PathVariable String locationId, @PathVariable String equipmentId,
                                               @RequestBody Map<String, Object> metrics) {
        InMemoryTelemetrySource source = telemetrySource.getIfAvailable();
        if (source == null) {
            throw new BusinessException(ResultCode.OPERATION_FAILED, "当前遥测源不支持写入");
        }
        return ApiResult.success(source.update(locationId, equipmentId, metrics));
    }

    @PostMapping("/api/commands/{locationId}")
    public ApiResult<UserCommand> submit(@PathVariable String locationId,
                                         @Valid @RequestBody CommandRequest request) {
        InMemoryCommandSource source = commandSource.getIfAvailable();
        if (source == null) {
            throw new BusinessException(ResultCode.OPERATION_FAILED, "当前命令源不支持写入");
        }
        EquipmentType type;
        try {
            type = EquipmentType.fromCode(request.getEquipmentType());
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ResultCode.PARAM_ERROR, e.getMessage());
        }
        UserCommand command = UserCommand.builder()
                .locationId(locationId)
                .equipmentId(request.getEquipmentId())
                .equipmentType(type.getCode())
                .commandType(request.getCommandType())
                .value(request.getValue())
                .modifiedBy(request.getModifiedBy() != null ? request.getModifiedBy() : "api")
                .modifiedAt(System.currentTimeMillis())
                .build();
        source.submit(command);
        log.info("收到用户命令：{}/{} {}={}", locationId, command.getEquipmentId(), command.getCommandType(),
                command.getValue());
        return ApiResult.success(command);
    }
}
