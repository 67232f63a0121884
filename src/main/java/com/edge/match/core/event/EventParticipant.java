package com.edge.match.core.event;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;

/**
 * 事件中的一名参与球员
 */
public class EventParticipant {
    private final String trackId;
    private final String playerId;
    private final TeamId teamId;
    private final Point position;
    private final double confidence;

    public EventParticipant(String trackId, String playerId, TeamId teamId, Point position, double confidence) {
        this.trackId = trackId;
        this.playerId = playerId;
        this.teamId = teamId;
        this.position = position;
        this.confidence = confidence;
    }

    static EventParticipant of(PossessionSegment segment, Point position) {
        return new EventParticipant(segment.getTrackId(), segment.getPlayerId(), segment.getTeamId(),
                position, segment.getConfidence());
    }

    public String getTrackId() { return trackId; }
    public String getPlayerId() { return playerId; }
    public TeamId getTeamId() { return teamId; }
    public Point getPosition() { return position; }
    public double getConfidence() { return confidence; }
}
