package com.edge.match.model;

/**
 * 比赛赛制
 */
public enum GameFormat {
    /** 11 人制，105 x 68 米 */
    ELEVEN(105, 68),
    /** 8 人制，68 x 50 米 */
    EIGHT(68, 50),
    /** 5 人制，40 x 20 米 */
    FIVE(40, 20);

    private final double length;
    private final double width;

    GameFormat(double length, double width) {
        this.length = length;
        this.width = width;
    }

    public FieldSize fieldSize() {
        return new FieldSize(length, width);
    }
}
