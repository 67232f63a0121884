package com.edge.match.core.event;

/**
 * 球权转换事件
 * <p>
 * 一次转换总是成对出现：失球方 LOST 与得球方 WON，置信度相同
 */
public class TurnoverEvent {

    public enum TurnoverType {
        LOST,
        WON
    }

    private final String eventId;
    private final String matchId;
    private final TurnoverType turnoverType;
    private final int frameNumber;
    private final double timestamp;
    private final EventParticipant player;
    private final EventParticipant otherPlayer;
    private final double confidence;
    private final boolean needsReview;

    public TurnoverEvent(String eventId, String matchId, TurnoverType turnoverType, int frameNumber, double timestamp,
                         EventParticipant player, EventParticipant otherPlayer,
                         double confidence, boolean needsReview) {
        this.eventId = eventId;
        this.matchId = matchId;
        this.turnoverType = turnoverType;
        this.frameNumber = frameNumber;
        this.timestamp = timestamp;
        this.player = player;
        this.otherPlayer = otherPlayer;
        this.confidence = confidence;
        this.needsReview = needsReview;
    }

    public String getEventId() { return eventId; }
    public String getMatchId() { return matchId; }
    public TurnoverType getTurnoverType() { return turnoverType; }
    public int getFrameNumber() { return frameNumber; }
    public double getTimestamp() { return timestamp; }
    public EventParticipant getPlayer() { return player; }
    public EventParticipant getOtherPlayer() { return otherPlayer; }
    public double getConfidence() { return confidence; }
    public boolean isNeedsReview() { return needsReview; }
}
