package com.edge.match.core.team;

import lombok.Data;

/**
 * K-means 颜色聚类参数
 */
@Data
public class KMeansConfig {
    private int k = 2;
    private int maxIterations = 100;
    // 质心移动阈值，按 255 缩放后与 RGB 距离比较
    private double convergenceThreshold = 0.001;
    private ColorSpace colorSpace = ColorSpace.HSV;
    // 每队至少 3 名球员
    private int minSamples = 6;
}
