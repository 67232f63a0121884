package com.edge.match.core.transform;

import com.edge.match.model.HomographyKeypoint;

import java.util.List;

/**
 * 单应性估计策略
 */
public interface HomographyEstimator {
    /**
     * 由关键点对应关系估计屏幕 -> 场地矩阵
     *
     * @param keypoints 至少 4 个对应点
     * @return 3x3 矩阵，解不唯一时返回 null
     * @throws IllegalArgumentException 对应点少于 4 个
     */
    double[][] estimate(List<HomographyKeypoint> keypoints);
}
