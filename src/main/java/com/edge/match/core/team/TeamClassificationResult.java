package com.edge.match.core.team;

import java.util.List;
import java.util.Map;

public class TeamClassificationResult {
    private final Map<String, TeamLabel> assignments;
    private final List<ClusterResult> clusters;
    private final double confidence;
    private final String homeColor;
    private final String awayColor;
    private final String refereeColor;

    public TeamClassificationResult(Map<String, TeamLabel> assignments, List<ClusterResult> clusters,
                                    double confidence, String homeColor, String awayColor, String refereeColor) {
        this.assignments = assignments;
        this.clusters = clusters;
        this.confidence = confidence;
        this.homeColor = homeColor;
        this.awayColor = awayColor;
        this.refereeColor = refereeColor;
    }

    public TeamLabel labelOf(String trackId) {
        return assignments.getOrDefault(trackId, TeamLabel.UNKNOWN);
    }

    public Map<String, TeamLabel> getAssignments() { return assignments; }
    public List<ClusterResult> getClusters() { return clusters; }
    public double getConfidence() { return confidence; }
    public String getHomeColor() { return homeColor; }
    public String getAwayColor() { return awayColor; }
    public String getRefereeColor() { return refereeColor; }
}
