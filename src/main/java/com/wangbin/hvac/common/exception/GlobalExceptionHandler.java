package com.wangbin.hvac.common.exception;

import com.wangbin.hvac.common.web.result.ApiResult;
import com.wangbin.hvac.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理控制引擎异常
     */
    @ExceptionHandler(EngineException.class)
    public ApiResult<?> handleEngineException(EngineException e, HttpServletRequest request) {
        log.error("控制引擎异常 - Location: {}, Equipment: {}, Type: {}",
                e.getLocationId(), e.getEquipmentId(), e.getEquipmentType(), e);

        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.setData(e.getData());
        result.addExtra("locationId", e.getLocationId());
        result.addExtra("equipmentId", e.getEquipmentId());
        result.addExtra("equipmentType", e.getEquipmentType());
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数校验异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ApiResult<?> handleValidationException(MethodArgumentNotValidException e, HttpServletRequest request) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        String message = fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        log.error("参数校验异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理约束违反异常
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ApiResult<?> handleConstraintViolationException(ConstraintViolationException e,
                                                           HttpServletRequest request) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));

        log.error("约束违反异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), "系统内部错误，请联系管理员");
    }
}
