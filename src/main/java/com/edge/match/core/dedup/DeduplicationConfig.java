package com.edge.match.core.dedup;

import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * 去重参数
 */
@Data
public class DeduplicationConfig {
    // 未配置类型阈值时使用的时间半径（秒）
    private double timeThreshold = 2.0;
    private Map<EventType, Double> timeThresholdByType = defaultThresholds();
    // 每多一个独立窗口的置信度增益
    private double confidenceBoostPerDetection = 0.1;
    // 窗口重叠区内事件的置信度系数
    private double windowEdgePenalty = 0.9;

    public double thresholdFor(EventType type) {
        Double value = timeThresholdByType != null ? timeThresholdByType.get(type) : null;
        return value != null ? value : timeThreshold;
    }

    private static Map<EventType, Double> defaultThresholds() {
        Map<EventType, Double> thresholds = new EnumMap<>(EventType.class);
        thresholds.put(EventType.SHOT, 1.0);
        thresholds.put(EventType.PASS, 2.0);
        thresholds.put(EventType.CARRY, 3.0);
        thresholds.put(EventType.TURNOVER, 2.0);
        thresholds.put(EventType.SET_PIECE, 2.5);
        return thresholds;
    }
}
