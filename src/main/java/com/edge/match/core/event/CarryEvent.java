package com.edge.match.core.event;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;

/**
 * 带球事件
 * <p>
 * carryIndex 为持球期间累计移动距离，progressIndex 为沿进攻方向的净位移
 */
public class CarryEvent {
    private final String eventId;
    private final String matchId;
    private final String trackId;
    private final String playerId;
    private final TeamId teamId;
    private final int startFrame;
    private final int endFrame;
    private final double startTime;
    private final double endTime;
    private final Point startPosition;
    private final Point endPosition;
    private final double carryIndex;
    private final double progressIndex;
    private final double confidence;

    public CarryEvent(String eventId, String matchId, PossessionSegment segment,
                      Point startPosition, Point endPosition, double carryIndex, double progressIndex) {
        this.eventId = eventId;
        this.matchId = matchId;
        this.trackId = segment.getTrackId();
        this.playerId = segment.getPlayerId();
        this.teamId = segment.getTeamId();
        this.startFrame = segment.getStartFrame();
        this.endFrame = segment.getEndFrame();
        this.startTime = segment.getStartTime();
        this.endTime = segment.getEndTime();
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.carryIndex = carryIndex;
        this.progressIndex = progressIndex;
        this.confidence = segment.getConfidence();
    }

    public String getEventId() { return eventId; }
    public String getMatchId() { return matchId; }
    public String getTrackId() { return trackId; }
    public String getPlayerId() { return playerId; }
    public TeamId getTeamId() { return teamId; }
    public int getStartFrame() { return startFrame; }
    public int getEndFrame() { return endFrame; }
    public double getStartTime() { return startTime; }
    public double getEndTime() { return endTime; }
    public Point getStartPosition() { return startPosition; }
    public Point getEndPosition() { return endPosition; }
    public double getCarryIndex() { return carryIndex; }
    public double getProgressIndex() { return progressIndex; }
    public double getConfidence() { return confidence; }
}
