package com.edge.match.dto;

import com.edge.match.model.BallDetection;
import com.edge.match.model.Point;
import lombok.Data;

@Data
public class BallDetectionDto {
    private int frameNumber;
    private Double timestamp;
    private Point position;
    private double confidence;
    private boolean visible = true;

    public BallDetection toBallDetection(double fps) {
        double t = timestamp != null ? timestamp : frameNumber / fps;
        Point p = position != null ? position : new Point(0.5, 0.5);
        return new BallDetection(frameNumber, t, p, confidence, visible && position != null);
    }
}
