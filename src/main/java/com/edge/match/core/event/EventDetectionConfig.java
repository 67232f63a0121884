package com.edge.match.core.event;

import lombok.Data;

/**
 * 事件推断配置
 */
@Data
public class EventDetectionConfig {
    // 控球判定距离（归一化坐标）
    private double possessionDistanceThreshold = 0.05;
    // 控球段最少帧数
    private int minPossessionFrames = 3;
    // 最小带球距离
    private double minCarryDistance = 0.02;
    // 低于该置信度需人工复核
    private double reviewThreshold = 0.6;
    private double fps = 30;
}
