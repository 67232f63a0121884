package com.edge.match.core.event;

public enum PassOutcome {
    COMPLETE,
    INCOMPLETE,
    INTERCEPTED
}
