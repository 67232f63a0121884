package com.edge.match.model;

import java.util.List;

/**
 * 单应性数据
 * <p>
 * matrix 为屏幕 -> 场地的 3x3 投影矩阵
 */
public class HomographyData {
    private final int frameNumber;
    private final double[][] matrix;
    private final List<HomographyKeypoint> keypoints;
    private final double confidence;
    private final FieldSize fieldSize;
    private final boolean cameraMoving;

    public HomographyData(int frameNumber, double[][] matrix, List<HomographyKeypoint> keypoints,
                          double confidence, FieldSize fieldSize, boolean cameraMoving) {
        this.frameNumber = frameNumber;
        this.matrix = matrix;
        this.keypoints = keypoints;
        this.confidence = confidence;
        this.fieldSize = fieldSize;
        this.cameraMoving = cameraMoving;
    }

    public int getFrameNumber() { return frameNumber; }
    public double[][] getMatrix() { return matrix; }
    public List<HomographyKeypoint> getKeypoints() { return keypoints; }
    public double getConfidence() { return confidence; }
    public FieldSize getFieldSize() { return fieldSize; }
    public boolean isCameraMoving() { return cameraMoving; }
}
