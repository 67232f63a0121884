package com.edge.match.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * 队伍标识（三态）
 * <p>
 * UNKNOWN 会主动抑制传球结果、抢断和逻辑校验中的推断，不能当作任意一方
 */
public enum TeamId {
    HOME,
    AWAY,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public TeamId opponent() {
        switch (this) {
            case HOME:
                return AWAY;
            case AWAY:
                return HOME;
            default:
                return UNKNOWN;
        }
    }

    /**
     * 宽松解析，null 或无法识别的值都视为 UNKNOWN
     */
    @JsonCreator
    public static TeamId parse(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return TeamId.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
