package com.edge.match.core.event;

import java.util.Collections;
import java.util.List;

/**
 * 待人工复核的事件
 */
public class PendingReview {
    private final String eventId;
    private final String eventType;
    private final ReviewReason reason;
    private final List<ReviewCandidate> candidates;
    private final boolean resolved;

    public PendingReview(String eventId, String eventType, ReviewReason reason, List<ReviewCandidate> candidates) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.reason = reason;
        this.candidates = candidates != null ? candidates : Collections.emptyList();
        this.resolved = false;
    }

    public String getEventId() { return eventId; }
    public String getEventType() { return eventType; }
    public ReviewReason getReason() { return reason; }
    public List<ReviewCandidate> getCandidates() { return candidates; }
    public boolean isResolved() { return resolved; }
}
