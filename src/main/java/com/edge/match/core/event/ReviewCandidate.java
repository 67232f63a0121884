package com.edge.match.core.event;

public class ReviewCandidate {
    private final String trackId;
    private final String playerId;
    private final double confidence;

    public ReviewCandidate(String trackId, String playerId, double confidence) {
        this.trackId = trackId;
        this.playerId = playerId;
        this.confidence = confidence;
    }

    public String getTrackId() { return trackId; }
    public String getPlayerId() { return playerId; }
    public double getConfidence() { return confidence; }
}
