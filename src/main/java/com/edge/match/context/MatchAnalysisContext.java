package com.edge.match.context;

import com.edge.match.core.filter.FilterStats;
import com.edge.match.core.filter.MotionHistory;
import com.edge.match.core.team.ColorSample;
import com.edge.match.core.tracking.IouTracker;
import com.edge.match.core.tracking.PredictionConfig;
import com.edge.match.core.tracking.TrackPredictor;
import com.edge.match.core.tracking.Tracker;
import com.edge.match.model.Detection;
import com.edge.match.model.Track;
import com.edge.match.model.TrackFrame;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单场比赛分析的可变状态
 * <p>
 * 每次分析创建一个实例，分析结束后丢弃；只由分析线程写入，不跨比赛共享
 */
public class MatchAnalysisContext {
    private final String matchId;
    private final MotionHistory motionHistory = new MotionHistory();
    private final TrackPredictor predictor;
    private final Tracker tracker;
    private final Map<String, Track> tracks = new LinkedHashMap<>();
    private final List<ColorSample> colorSamples = new ArrayList<>();
    private final FilterStats filterStats = new FilterStats();
    private int framesProcessed;

    public MatchAnalysisContext(String matchId, PredictionConfig predictionConfig, double iouThreshold, int maxAge) {
        this.matchId = matchId;
        this.predictor = new TrackPredictor(predictionConfig);
        this.tracker = new IouTracker(predictor, iouThreshold, maxAge);
    }

    /**
     * 将通过过滤的检测追加到对应轨迹
     */
    public void appendToTracks(int frameNumber, double timestamp, List<Detection> detections) {
        for (Detection det : detections) {
            if (det.getTrackId() == null) {
                continue;
            }
            Track track = tracks.computeIfAbsent(det.getTrackId(), Track::new);
            track.addFrame(new TrackFrame(frameNumber, timestamp, det.getBbox(), det.getCenter(), det.getConfidence()));
        }
    }

    public void addColorSample(ColorSample sample) {
        colorSamples.add(sample);
    }

    public void recordFrame(FilterStats stats) {
        filterStats.add(stats);
        framesProcessed++;
    }

    public String getMatchId() { return matchId; }
    public MotionHistory getMotionHistory() { return motionHistory; }
    public TrackPredictor getPredictor() { return predictor; }
    public Tracker getTracker() { return tracker; }
    public Collection<Track> getTracks() { return tracks.values(); }
    public Track getTrack(String trackId) { return tracks.get(trackId); }
    public List<ColorSample> getColorSamples() { return colorSamples; }
    public FilterStats getFilterStats() { return filterStats; }
    public int getFramesProcessed() { return framesProcessed; }
}
