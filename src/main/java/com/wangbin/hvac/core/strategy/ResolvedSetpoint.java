package com.wangbin.hvac.core.strategy;

import com.wangbin.hvac.core.model.SetpointSource;
import lombok.Value;

@Value
public class ResolvedSetpoint {
    double value;
    SetpointSource source;
}
