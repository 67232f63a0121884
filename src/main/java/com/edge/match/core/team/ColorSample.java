package com.edge.match.core.team;

import com.edge.match.model.Point;

/**
 * 球衣颜色采样
 */
public class ColorSample {
    private final String trackId;
    private final RgbColor color;
    private final Point position;

    public ColorSample(String trackId, RgbColor color, Point position) {
        this.trackId = trackId;
        this.color = color;
        this.position = position;
    }

    public String getTrackId() { return trackId; }
    public RgbColor getColor() { return color; }
    public Point getPosition() { return position; }
}
