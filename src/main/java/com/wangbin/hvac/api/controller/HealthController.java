package com.wangbin.hvac.api.controller;

import com.wangbin.hvac.monitor.health.HealthStatus;
import com.wangbin.hvac.monitor.health.SystemHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 引擎健康检查接口，DOWN 时返回 503。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SystemHealthService systemHealthService;

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = systemHealthService.getSystemHealth();
        HttpStatus status = health.getStatus() == HealthStatus.Status.DOWN
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(health);
    }
}
