package com.wangbin.hvac.core.staging;

import com.wangbin.hvac.core.config.LocationProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 分级控制参数
 */
@Value
@Builder
public class StagingConfig {

    int totalStages;

    @Builder.Default
    Duration stageUpDelay = Duration.ofMinutes(3);

    @Builder.Default
    Duration stageDownDelay = Duration.ofMinutes(3);

    @Builder.Default
    Duration minimumRuntime = Duration.ofMinutes(3);

    @Builder.Default
    RotationPolicy rotation = RotationPolicy.ROUND_ROBIN;

    public static StagingConfig from(LocationProfile.GeoTuning tuning) {
        return StagingConfig.builder()
                .totalStages(tuning.getStageCount())
                .stageUpDelay(tuning.getStageUpDelay())
                .stageDownDelay(tuning.getStageDownDelay())
                .minimumRuntime(tuning.getMinimumRuntime())
                .rotation(tuning.getRotation())
                .build();
    }

    public static StagingConfig from(LocationProfile.ChillerTuning tuning) {
        return StagingConfig.builder()
                .totalStages(tuning.getMaxStages())
                .stageUpDelay(tuning.getStageUpDelay())
                .stageDownDelay(tuning.getStageDownDelay())
                .minimumRuntime(tuning.getMinimumRuntime())
                .rotation(tuning.getRotation())
                .build();
    }
}
