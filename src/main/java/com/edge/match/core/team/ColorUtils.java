package com.edge.match.core.team;

/**
 * 颜色工具
 * <p>
 * 提供十六进制 / RGB / HSV 互转以及几种颜色距离
 */
public final class ColorUtils {

    private ColorUtils() {
    }

    /**
     * 解析 #RRGGBB（# 可省略），格式不合法时返回中性灰
     */
    public static RgbColor hexToRgb(String hex) {
        if (hex == null) {
            return RgbColor.NEUTRAL_GRAY;
        }
        String value = hex.startsWith("#") ? hex.substring(1) : hex;
        if (!value.matches("[0-9a-fA-F]{6}")) {
            return RgbColor.NEUTRAL_GRAY;
        }
        int rgb = Integer.parseInt(value, 16);
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public static String rgbToHex(RgbColor color) {
        return String.format("#%02x%02x%02x", clamp(color.getR()), clamp(color.getG()), clamp(color.getB()));
    }

    public static HsvColor rgbToHsv(RgbColor color) {
        double r = color.getR() / 255.0;
        double g = color.getG() / 255.0;
        double b = color.getB() / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;

        double h = 0;
        if (delta != 0) {
            if (max == r) {
                h = 60 * (((g - b) / delta) % 6);
            } else if (max == g) {
                h = 60 * ((b - r) / delta + 2);
            } else {
                h = 60 * ((r - g) / delta + 4);
            }
        }
        if (h < 0) {
            h += 360;
        }

        double s = max == 0 ? 0 : delta / max;
        return new HsvColor(h, s, max);
    }

    /**
     * RGB 空间欧几里得距离
     */
    public static double rgbDistance(RgbColor c1, RgbColor c2) {
        double dr = c1.getR() - c2.getR();
        double dg = c1.getG() - c2.getG();
        double db = c1.getB() - c2.getB();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /**
     * HSV 空间加权距离，用于聚类
     * <p>
     * sqrt(4·hue² + 2·sat² + val²)，hue 为环形差值除以 180
     */
    public static double hsvDistance(RgbColor c1, RgbColor c2) {
        HsvColor hsv1 = rgbToHsv(c1);
        HsvColor hsv2 = rgbToHsv(c2);

        double hue = hueDifference(hsv1, hsv2) / 180.0;
        double sat = Math.abs(hsv1.getS() - hsv2.getS());
        double val = Math.abs(hsv1.getV() - hsv2.getV());
        return Math.sqrt(hue * hue * 4 + sat * sat * 2 + val * val);
    }

    /**
     * 归一化颜色差异 [0,1]，用于队色匹配
     * <p>
     * 0.5·hue + 0.3·sat + 0.2·val，hue 为环形差值除以 180
     */
    public static double colorDistance(RgbColor c1, RgbColor c2) {
        HsvColor hsv1 = rgbToHsv(c1);
        HsvColor hsv2 = rgbToHsv(c2);

        double hue = hueDifference(hsv1, hsv2) / 180.0;
        double sat = Math.abs(hsv1.getS() - hsv2.getS());
        double val = Math.abs(hsv1.getV() - hsv2.getV());
        return hue * 0.5 + sat * 0.3 + val * 0.2;
    }

    /**
     * 颜色是否与队色足够接近
     */
    public static boolean matchesTeamColor(RgbColor color, String teamHex, double threshold) {
        return colorDistance(color, hexToRgb(teamHex)) < threshold;
    }

    public static RgbColor average(Iterable<RgbColor> colors) {
        long r = 0, g = 0, b = 0;
        int count = 0;
        for (RgbColor c : colors) {
            r += c.getR();
            g += c.getG();
            b += c.getB();
            count++;
        }
        if (count == 0) {
            return RgbColor.NEUTRAL_GRAY;
        }
        return new RgbColor(Math.round((float) r / count), Math.round((float) g / count), Math.round((float) b / count));
    }

    private static double hueDifference(HsvColor a, HsvColor b) {
        double diff = Math.abs(a.getH() - b.getH());
        return Math.min(diff, 360 - diff);
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }
}
