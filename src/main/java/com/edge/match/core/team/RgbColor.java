package com.edge.match.core.team;

/**
 * RGB 颜色，分量 0-255
 */
public class RgbColor {
    public static final RgbColor NEUTRAL_GRAY = new RgbColor(128, 128, 128);

    private final int r;
    private final int g;
    private final int b;

    public RgbColor(int r, int g, int b) {
        this.r = r;
        this.g = g;
        this.b = b;
    }

    public int getR() { return r; }
    public int getG() { return g; }
    public int getB() { return b; }

    public String toHex() {
        return ColorUtils.rgbToHex(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbColor)) return false;
        RgbColor c = (RgbColor) o;
        return r == c.r && g == c.g && b == c.b;
    }

    @Override
    public int hashCode() {
        return (r << 16) | (g << 8) | b;
    }

    @Override
    public String toString() {
        return toHex();
    }
}
