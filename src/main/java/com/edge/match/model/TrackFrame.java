package com.edge.match.model;

public class TrackFrame {
    private final int frameNumber;
    private final double timestamp;
    private final BoundingBox bbox;
    private final Point center;
    private final double confidence;

    public TrackFrame(int frameNumber, double timestamp, BoundingBox bbox, Point center, double confidence) {
        this.frameNumber = frameNumber;
        this.timestamp = timestamp;
        this.bbox = bbox;
        this.center = center != null ? center : bbox.getCenter();
        this.confidence = confidence;
    }

    public int getFrameNumber() { return frameNumber; }
    public double getTimestamp() { return timestamp; }
    public BoundingBox getBbox() { return bbox; }
    public Point getCenter() { return center; }
    public double getConfidence() { return confidence; }
}
