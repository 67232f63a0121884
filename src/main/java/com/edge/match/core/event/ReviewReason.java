package com.edge.match.core.event;

public enum ReviewReason {
    LOW_KICKER_CONFIDENCE,
    LOW_RECEIVER_CONFIDENCE,
    LOW_CONFIDENCE,
    AMBIGUOUS_PLAYER
}
