package com.edge.match.core.team;

import com.edge.match.model.TeamId;

/**
 * 单条轨迹的队伍归属
 */
public class TrackTeamMeta {
    private final String trackId;
    private final TeamId teamId;
    private final TeamLabel label;
    private final double teamConfidence;
    private final String dominantColor;
    private final ClassificationMethod classificationMethod;

    public TrackTeamMeta(String trackId, TeamLabel label, double teamConfidence, String dominantColor,
                         ClassificationMethod classificationMethod) {
        this.trackId = trackId;
        this.label = label;
        this.teamId = label.toTeamId();
        this.teamConfidence = teamConfidence;
        this.dominantColor = dominantColor;
        this.classificationMethod = classificationMethod;
    }

    public String getTrackId() { return trackId; }
    public TeamId getTeamId() { return teamId; }
    public TeamLabel getLabel() { return label; }
    public double getTeamConfidence() { return teamConfidence; }
    public String getDominantColor() { return dominantColor; }
    public ClassificationMethod getClassificationMethod() { return classificationMethod; }
}
