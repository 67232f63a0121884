package com.edge.match.core.dedup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 窗口分析产出的事件类型
 */
public enum EventType {
    PASS("pass"),
    CARRY("carry"),
    TURNOVER("turnover"),
    SHOT("shot"),
    SET_PIECE("setPiece");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 按编码或枚举名解析
     *
     * @throws IllegalArgumentException 无法识别的类型
     */
    @JsonCreator
    public static EventType fromCode(String value) {
        if (value == null) {
            return null;
        }
        for (EventType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
