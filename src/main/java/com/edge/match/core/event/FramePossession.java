package com.edge.match.core.event;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;

/**
 * 单帧控球判定结果
 * <p>
 * 球不可见时 possessorTrackId 为 null、confidence 为 0；
 * 球可见但最近球员超出阈值时 possessorTrackId 为 null，distance 仍为实测值
 */
public class FramePossession {
    private final int frameNumber;
    private final double timestamp;
    private final Point ballPosition;
    private final boolean ballVisible;
    private final String possessorTrackId;
    private final Point possessorPosition;
    private final TeamId possessorTeamId;
    private final Double distance;
    private final double confidence;

    public FramePossession(int frameNumber, double timestamp, Point ballPosition, boolean ballVisible,
                           String possessorTrackId, Point possessorPosition, TeamId possessorTeamId,
                           Double distance, double confidence) {
        this.frameNumber = frameNumber;
        this.timestamp = timestamp;
        this.ballPosition = ballPosition;
        this.ballVisible = ballVisible;
        this.possessorTrackId = possessorTrackId;
        this.possessorPosition = possessorPosition;
        this.possessorTeamId = possessorTeamId;
        this.distance = distance;
        this.confidence = confidence;
    }

    public boolean hasPossessor() {
        return possessorTrackId != null && possessorPosition != null;
    }

    public int getFrameNumber() { return frameNumber; }
    public double getTimestamp() { return timestamp; }
    public Point getBallPosition() { return ballPosition; }
    public boolean isBallVisible() { return ballVisible; }
    public String getPossessorTrackId() { return possessorTrackId; }
    public Point getPossessorPosition() { return possessorPosition; }
    public TeamId getPossessorTeamId() { return possessorTeamId; }
    public Double getDistance() { return distance; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return String.format("FramePossession{frame=%d, possessor=%s, distance=%s, conf=%.3f}",
                frameNumber, possessorTrackId, distance, confidence);
    }
}
