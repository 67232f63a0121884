package com.edge.match.core.team;

/**
 * HSV 颜色：h 为角度 [0,360)，s 和 v 为 [0,1]
 */
public class HsvColor {
    private final double h;
    private final double s;
    private final double v;

    public HsvColor(double h, double s, double v) {
        this.h = h;
        this.s = s;
        this.v = v;
    }

    public double getH() { return h; }
    public double getS() { return s; }
    public double getV() { return v; }

    @Override
    public String toString() {
        return String.format("HSV(%.1f, %.2f, %.2f)", h, s, v);
    }
}
