package com.edge.match.core.event;

/**
 * 进攻方向（屏幕 x 轴）
 */
public enum AttackDirection {
    LEFT_TO_RIGHT,
    RIGHT_TO_LEFT,
    NONE;

    /**
     * 接受 "LTR" / "RTL" 缩写或枚举名，无法识别时为 NONE
     */
    public static AttackDirection parse(String value) {
        if (value == null) {
            return NONE;
        }
        switch (value.trim().toUpperCase()) {
            case "LTR":
            case "LEFT_TO_RIGHT":
                return LEFT_TO_RIGHT;
            case "RTL":
            case "RIGHT_TO_LEFT":
                return RIGHT_TO_LEFT;
            default:
                return NONE;
        }
    }

    /**
     * 沿进攻方向的位移，正值为向前
     */
    public double progress(double startX, double endX) {
        double dx = endX - startX;
        if (this == LEFT_TO_RIGHT) {
            return dx;
        }
        if (this == RIGHT_TO_LEFT) {
            return -dx;
        }
        return 0;
    }
}
