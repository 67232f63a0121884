package com.edge.match.model;

/**
 * 单帧足球检测
 * <p>
 * interpolated 为 true 表示该位置来自预测而非观测
 */
public class BallDetection {
    private final int frameNumber;
    private final double timestamp;
    private final Point position;
    private final double confidence;
    private final boolean visible;
    private final boolean interpolated;

    public BallDetection(int frameNumber, double timestamp, Point position, double confidence, boolean visible) {
        this(frameNumber, timestamp, position, confidence, visible, false);
    }

    public BallDetection(int frameNumber, double timestamp, Point position, double confidence,
                         boolean visible, boolean interpolated) {
        this.frameNumber = frameNumber;
        this.timestamp = timestamp;
        this.position = position;
        this.confidence = confidence;
        this.visible = visible;
        this.interpolated = interpolated;
    }

    public int getFrameNumber() { return frameNumber; }
    public double getTimestamp() { return timestamp; }
    public Point getPosition() { return position; }
    public double getConfidence() { return confidence; }
    public boolean isVisible() { return visible; }
    public boolean isInterpolated() { return interpolated; }

    @Override
    public String toString() {
        return String.format("Ball[f=%d %s conf=%.2f%s%s]", frameNumber, position, confidence,
                visible ? "" : " hidden", interpolated ? " interp" : "");
    }
}
