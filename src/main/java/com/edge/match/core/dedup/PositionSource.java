package com.edge.match.core.dedup;

/**
 * 事件位置来源，按优先级从高到低：
 * BALL_DETECTION > MERGED / MODEL_OUTPUT > ZONE_CONVERSION > UNKNOWN
 */
public enum PositionSource {
    BALL_DETECTION,
    MERGED,
    MODEL_OUTPUT,
    ZONE_CONVERSION,
    UNKNOWN
}
