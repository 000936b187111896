package com.wangbin.hvac.core.pid;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PID参数
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PidParams {

    @Builder.Default
    private double kp = 0.5;

    @Builder.Default
    private double ki = 0.03;

    @Builder.Default
    private double kd = 0.05;

    @Builder.Default
    private double outputMin = 0;

    @Builder.Default
    private double outputMax = 100;

    /** 反作用：输出 = outputMax - 原始输出 */
    @Builder.Default
    private boolean reverseActing = false;

    /** 积分限幅（抗饱和） */
    @Builder.Default
    private double maxIntegral = 10;

    /** 关闭时调用方退化为简单比例控制 */
    @Builder.Default
    private boolean enabled = true;

    public static PidParams defaults() {
        return PidParams.builder().build();
    }
}
