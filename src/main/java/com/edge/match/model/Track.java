package com.edge.match.model;

import java.util.Collection;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 轨迹
 * <p>
 * 帧号到 TrackFrame 的有序映射，在一次比赛分析中持续累积
 */
public class Track {
    private final String trackId;
    private final NavigableMap<Integer, TrackFrame> frames = new TreeMap<>();
    private TeamId teamId = TeamId.UNKNOWN;
    private String playerId;

    public Track(String trackId) {
        this.trackId = trackId;
    }

    public void addFrame(TrackFrame frame) {
        frames.put(frame.getFrameNumber(), frame);
    }

    /**
     * @return 指定帧的数据，该帧不存在时返回 null
     */
    public TrackFrame getFrame(int frameNumber) {
        return frames.get(frameNumber);
    }

    public Collection<TrackFrame> getFrames() {
        return frames.values();
    }

    public int getFirstFrame() {
        return frames.isEmpty() ? -1 : frames.firstKey();
    }

    public int getLastFrame() {
        return frames.isEmpty() ? -1 : frames.lastKey();
    }

    public int size() {
        return frames.size();
    }

    public String getTrackId() { return trackId; }

    public TeamId getTeamId() { return teamId; }
    public void setTeamId(TeamId teamId) { this.teamId = teamId != null ? teamId : TeamId.UNKNOWN; }

    public String getPlayerId() { return playerId; }
    public void setPlayerId(String playerId) { this.playerId = playerId; }

    @Override
    public String toString() {
        return "Track{" + trackId + ", team=" + teamId + ", frames=" + frames.size() + "}";
    }
}
