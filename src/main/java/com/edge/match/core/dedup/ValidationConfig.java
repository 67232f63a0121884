package com.edge.match.core.dedup;

import lombok.Data;

@Data
public class ValidationConfig {
    // 同队事件最小间隔（秒）
    private double minEventInterval = 0.5;
    // 最大冲刺速度（m/s）
    private double maxMovementSpeed = 12;
    private boolean enableWarnings = true;
}
