package com.edge.match.model;

/**
 * 二维点
 * <p>
 * 既用于归一化屏幕坐标 [0,1]，也用于以球场中心为原点的场地坐标（米）
 */
public class Point {
    /**
     * 退化变换的哨兵值，调用方应视为"无法映射"
     */
    public static final Point ORIGIN = new Point(0, 0);

    public double x;
    public double y;

    public Point() {
    }

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * 计算到另一个点的欧几里得距离
     */
    public double distanceTo(Point other) {
        double dx = this.x - other.x;
        double dy = this.y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * 线性插值，t=0 返回本点，t=1 返回 other
     */
    public Point lerp(Point other, double t) {
        return new Point(x + (other.x - x) * t, y + (other.y - y) * t);
    }

    public boolean isOrigin() {
        return x == 0 && y == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point p = (Point) o;
        return Double.compare(p.x, x) == 0 && Double.compare(p.y, y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%.3f, %.3f)", x, y);
    }
}
