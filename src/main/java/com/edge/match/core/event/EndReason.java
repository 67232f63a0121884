package com.edge.match.core.event;

public enum EndReason {
    PASS,
    LOST,
    UNKNOWN
}
