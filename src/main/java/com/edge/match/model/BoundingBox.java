package com.edge.match.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 归一化边界框
 * <p>
 * x, y 为左上角，w, h 为宽高，均在 [0,1] 范围内
 */
public class BoundingBox {
    private double x;
    private double y;
    private double w;
    private double h;

    public BoundingBox() {
    }

    public BoundingBox(double x, double y, double w, double h) {
        this.x = x;
        this.y = y;
        this.w = w;
        this.h = h;
    }

    @JsonIgnore
    public Point getCenter() {
        return new Point(x + w / 2.0, y + h / 2.0);
    }

    @JsonIgnore
    public double getArea() {
        return Math.max(0, w) * Math.max(0, h);
    }

    /**
     * 交并比
     */
    public double iou(BoundingBox other) {
        double x1 = Math.max(x, other.x);
        double y1 = Math.max(y, other.y);
        double x2 = Math.min(x + w, other.x + other.w);
        double y2 = Math.min(y + h, other.y + other.h);

        double intersection = Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
        double union = getArea() + other.getArea() - intersection;
        return union > 0 ? intersection / union : 0;
    }

    /**
     * 按相对比例截取子区域，例如球衣区域
     */
    public BoundingBox subRegion(double top, double bottom, double left, double right) {
        return new BoundingBox(x + w * left, y + h * top, w * (right - left), h * (bottom - top));
    }

    public double getX() { return x; }
    public void setX(double x) { this.x = x; }

    public double getY() { return y; }
    public void setY(double y) { this.y = y; }

    public double getW() { return w; }
    public void setW(double w) { this.w = w; }

    public double getH() { return h; }
    public void setH(double h) { this.h = h; }

    @Override
    public String toString() {
        return String.format("BoundingBox[%.3f,%.3f %.3fx%.3f]", x, y, w, h);
    }
}
