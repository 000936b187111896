package com.wangbin.hvac.common.config;

import com.wangbin.hvac.core.staging.LeadLagManager;
import com.wangbin.hvac.core.staging.StagingCoordinator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 控制引擎基础组件
 */
@Configuration
public class EngineConfig {

    @Bean
    public StagingCoordinator stagingCoordinator() {
        return new StagingCoordinator();
    }

    @Bean
    public LeadLagManager leadLagManager() {
        return new LeadLagManager();
    }
}
