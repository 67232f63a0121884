package com.edge.match.core.dedup;

import com.edge.match.model.Point;

public class PositionEstimate {
    private final Point position;
    private final PositionSource source;
    private final double confidence;

    public PositionEstimate(Point position, PositionSource source, double confidence) {
        this.position = position;
        this.source = source;
        this.confidence = confidence;
    }

    public Point getPosition() { return position; }
    public PositionSource getSource() { return source; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return String.format("PositionEstimate{%s, source=%s, conf=%.2f}", position, source, confidence);
    }
}
