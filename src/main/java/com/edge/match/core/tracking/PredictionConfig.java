package com.edge.match.core.tracking;

import lombok.Data;

/**
 * 轨迹预测（卡尔曼滤波）参数
 */
@Data
public class PredictionConfig {
    // 过程噪声标准差
    private double processNoise = 0.1;
    // 观测噪声标准差
    private double measurementNoise = 0.5;
    // 置信度衰减速率（每秒）
    private double confidenceDecayRate = 0.2;
    // 预测最长有效时间（秒）
    private double maxPredictionTime = 5.0;
    // 轨迹重关联的最大距离（归一化坐标）
    private double reassociationDistance = 0.1;
}
