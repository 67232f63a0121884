package com.edge.match.model;

/**
 * 单个单应性对应点：屏幕归一化坐标与场地坐标（米）
 */
public class HomographyKeypoint {
    private final Point screen;
    private final Point field;
    private final String label;
    private final double confidence;

    public HomographyKeypoint(Point screen, Point field, String label, double confidence) {
        this.screen = screen;
        this.field = field;
        this.label = label;
        this.confidence = confidence;
    }

    public Point getScreen() { return screen; }
    public Point getField() { return field; }
    public String getLabel() { return label; }
    public double getConfidence() { return confidence; }
}
