package com.edge.match.core.team;

import java.util.List;

public class ClusterResult {
    private int clusterId;
    private final RgbColor centroid;
    private final List<ColorSample> members;
    // 成员到质心的平均距离
    private final double avgDistance;

    public ClusterResult(int clusterId, RgbColor centroid, List<ColorSample> members, double avgDistance) {
        this.clusterId = clusterId;
        this.centroid = centroid;
        this.members = members;
        this.avgDistance = avgDistance;
    }

    public boolean contains(String trackId) {
        return members.stream().anyMatch(m -> m.getTrackId().equals(trackId));
    }

    public int size() {
        return members.size();
    }

    public int getClusterId() { return clusterId; }
    void setClusterId(int clusterId) { this.clusterId = clusterId; }
    public RgbColor getCentroid() { return centroid; }
    public List<ColorSample> getMembers() { return members; }
    public double getAvgDistance() { return avgDistance; }
}
