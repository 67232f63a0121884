package com.edge.match.core.dedup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 场地三区（相对于进攻队伍）
 */
public enum EventZone {
    DEFENSIVE_THIRD,
    MIDDLE_THIRD,
    ATTACKING_THIRD;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EventZone fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return EventZone.valueOf(value.trim().toUpperCase());
    }
}
