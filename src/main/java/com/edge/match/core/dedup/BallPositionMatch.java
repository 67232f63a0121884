package com.edge.match.core.dedup;

import com.edge.match.model.Point;

public class BallPositionMatch {
    private final Point position;
    private final double confidence;
    // 插值结果没有对应帧
    private final Integer frameNumber;
    private final double timeDiff;
    private final boolean interpolated;

    public BallPositionMatch(Point position, double confidence, Integer frameNumber,
                             double timeDiff, boolean interpolated) {
        this.position = position;
        this.confidence = confidence;
        this.frameNumber = frameNumber;
        this.timeDiff = timeDiff;
        this.interpolated = interpolated;
    }

    public PositionEstimate toEstimate() {
        return new PositionEstimate(position, PositionSource.BALL_DETECTION, confidence);
    }

    public Point getPosition() { return position; }
    public double getConfidence() { return confidence; }
    public Integer getFrameNumber() { return frameNumber; }
    public double getTimeDiff() { return timeDiff; }
    public boolean isInterpolated() { return interpolated; }
}
