package com.edge.match.core.tracking;

import com.edge.match.model.Point;

/**
 * 某轨迹在某帧的估计位置
 */
public class PredictedPosition {
    private final String trackId;
    private final int frameNumber;
    private final Point position;
    private final Point velocity;
    private final boolean predicted;
    private final double confidence;
    private final int lastObservedFrame;
    private final double timeSinceObservation;

    public PredictedPosition(String trackId, int frameNumber, Point position, Point velocity,
                             boolean predicted, double confidence, int lastObservedFrame,
                             double timeSinceObservation) {
        this.trackId = trackId;
        this.frameNumber = frameNumber;
        this.position = position;
        this.velocity = velocity;
        this.predicted = predicted;
        this.confidence = confidence;
        this.lastObservedFrame = lastObservedFrame;
        this.timeSinceObservation = timeSinceObservation;
    }

    public String getTrackId() { return trackId; }
    public int getFrameNumber() { return frameNumber; }
    public Point getPosition() { return position; }
    public Point getVelocity() { return velocity; }
    public boolean isPredicted() { return predicted; }
    public double getConfidence() { return confidence; }
    public int getLastObservedFrame() { return lastObservedFrame; }
    public double getTimeSinceObservation() { return timeSinceObservation; }
}
