package com.edge.match.model;

/**
 * 球场尺寸（米）
 */
public class FieldSize {
    private double length;
    private double width;

    public FieldSize() {
    }

    public FieldSize(double length, double width) {
        this.length = length;
        this.width = width;
    }

    public double getLength() { return length; }
    public void setLength(double length) { this.length = length; }

    public double getWidth() { return width; }
    public void setWidth(double width) { this.width = width; }

    @Override
    public String toString() {
        return String.format("%.1fx%.1fm", length, width);
    }
}
