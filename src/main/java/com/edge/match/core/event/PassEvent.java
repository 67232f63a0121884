package com.edge.match.core.event;

/**
 * 传球事件
 * <p>
 * 未完成传球（INCOMPLETE）没有接球人
 */
public class PassEvent {
    private final String eventId;
    private final String matchId;
    private final int frameNumber;
    private final double timestamp;
    private final EventParticipant kicker;
    private final EventParticipant receiver;
    private final PassOutcome outcome;
    private final double outcomeConfidence;
    private final double confidence;
    private final boolean needsReview;
    private final ReviewReason reviewReason;

    public PassEvent(String eventId, String matchId, int frameNumber, double timestamp,
                     EventParticipant kicker, EventParticipant receiver, PassOutcome outcome,
                     double outcomeConfidence, double confidence, boolean needsReview, ReviewReason reviewReason) {
        this.eventId = eventId;
        this.matchId = matchId;
        this.frameNumber = frameNumber;
        this.timestamp = timestamp;
        this.kicker = kicker;
        this.receiver = receiver;
        this.outcome = outcome;
        this.outcomeConfidence = outcomeConfidence;
        this.confidence = confidence;
        this.needsReview = needsReview;
        this.reviewReason = reviewReason;
    }

    public String getEventId() { return eventId; }
    public String getMatchId() { return matchId; }
    public int getFrameNumber() { return frameNumber; }
    public double getTimestamp() { return timestamp; }
    public EventParticipant getKicker() { return kicker; }
    public EventParticipant getReceiver() { return receiver; }
    public PassOutcome getOutcome() { return outcome; }
    public double getOutcomeConfidence() { return outcomeConfidence; }
    public double getConfidence() { return confidence; }
    public boolean isNeedsReview() { return needsReview; }
    public ReviewReason getReviewReason() { return reviewReason; }

    @Override
    public String toString() {
        return String.format("PassEvent{%s, frame=%d, %s -> %s, outcome=%s, conf=%.3f}",
                eventId, frameNumber, kicker.getTrackId(),
                receiver != null ? receiver.getTrackId() : "-", outcome, confidence);
    }
}
