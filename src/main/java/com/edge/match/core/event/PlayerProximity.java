package com.edge.match.core.event;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;

/**
 * 离球最近的球员
 */
public class PlayerProximity {
    private final String trackId;
    private final Point position;
    private final double distance;
    private final TeamId teamId;

    public PlayerProximity(String trackId, Point position, double distance, TeamId teamId) {
        this.trackId = trackId;
        this.position = position;
        this.distance = distance;
        this.teamId = teamId;
    }

    public String getTrackId() { return trackId; }
    public Point getPosition() { return position; }
    public double getDistance() { return distance; }
    public TeamId getTeamId() { return teamId; }
}
