package com.edge.match.core.dedup;

import lombok.Data;

@Data
public class BallMatchConfig {
    // 允许的最大时间差（秒）
    private double maxTimeDiff = 0.5;
    private boolean enableInterpolation = true;
    private double minConfidence = 0.3;
}
