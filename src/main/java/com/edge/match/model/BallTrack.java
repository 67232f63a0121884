package com.edge.match.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 整场比赛的足球轨迹
 */
public class BallTrack {
    private final List<BallDetection> detections;
    private final String modelId;
    private final double avgConfidence;
    private final double visibilityRate;
    private final Map<Integer, BallDetection> byFrame = new LinkedHashMap<>();

    public BallTrack(List<BallDetection> detections, String modelId) {
        this.detections = detections;
        this.modelId = modelId;

        int visibleCount = 0;
        double confidenceSum = 0;
        for (BallDetection d : detections) {
            byFrame.put(d.getFrameNumber(), d);
            if (d.isVisible()) {
                visibleCount++;
                confidenceSum += d.getConfidence();
            }
        }
        this.avgConfidence = visibleCount > 0 ? confidenceSum / visibleCount : 0;
        this.visibilityRate = detections.isEmpty() ? 0 : (double) visibleCount / detections.size();
    }

    public BallDetection getFrame(int frameNumber) {
        return byFrame.get(frameNumber);
    }

    public Map<Integer, BallDetection> asFrameMap() {
        return Collections.unmodifiableMap(byFrame);
    }

    public List<BallDetection> getDetections() { return detections; }
    public String getModelId() { return modelId; }
    public double getAvgConfidence() { return avgConfidence; }
    public double getVisibilityRate() { return visibilityRate; }
}
