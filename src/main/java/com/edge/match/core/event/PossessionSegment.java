package com.edge.match.core.event;

import com.edge.match.model.TeamId;

/**
 * 同一轨迹连续持球的区间
 */
public class PossessionSegment {
    private final String trackId;
    private final String playerId;
    private final TeamId teamId;
    private final int startFrame;
    private final int endFrame;
    private final double startTime;
    private final double endTime;
    private final int frameCount;
    private final double confidence;
    private final EndReason endReason;

    public PossessionSegment(String trackId, String playerId, TeamId teamId,
                             int startFrame, int endFrame, double startTime, double endTime,
                             int frameCount, double confidence, EndReason endReason) {
        this.trackId = trackId;
        this.playerId = playerId;
        this.teamId = teamId != null ? teamId : TeamId.UNKNOWN;
        this.startFrame = startFrame;
        this.endFrame = endFrame;
        this.startTime = startTime;
        this.endTime = endTime;
        this.frameCount = frameCount;
        this.confidence = confidence;
        this.endReason = endReason;
    }

    public String getTrackId() { return trackId; }
    public String getPlayerId() { return playerId; }
    public TeamId getTeamId() { return teamId; }
    public int getStartFrame() { return startFrame; }
    public int getEndFrame() { return endFrame; }
    public double getStartTime() { return startTime; }
    public double getEndTime() { return endTime; }
    public int getFrameCount() { return frameCount; }
    public double getConfidence() { return confidence; }
    public EndReason getEndReason() { return endReason; }

    @Override
    public String toString() {
        return String.format("PossessionSegment{track=%s, team=%s, frames=%d-%d, conf=%.3f, end=%s}",
                trackId, teamId, startFrame, endFrame, confidence, endReason);
    }
}
