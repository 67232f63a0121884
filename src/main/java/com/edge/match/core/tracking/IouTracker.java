package com.edge.match.core.tracking;

import com.edge.match.model.BoundingBox;
import com.edge.match.model.Detection;
import com.edge.match.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 基于 IoU 的多目标跟踪器
 * <p>
 * 处理流程：
 * 1. 清除超过 maxAge 帧未更新的轨迹
 * 2. 以 1 - IoU 为代价，用匈牙利算法做全局一一分配（同类别且 IoU 达到阈值才有效）
 * 3. 未分配的检测尝试通过卡尔曼预测重关联到刚丢失的同类别轨迹
 * 4. 仍未分配的检测创建新轨迹
 */
public class IouTracker implements Tracker {
    private static final Logger logger = LoggerFactory.getLogger(IouTracker.class);

    public static final double DEFAULT_IOU_THRESHOLD = 0.3;
    public static final int DEFAULT_MAX_AGE = 30;

    private final Map<String, TrackState> tracks = new LinkedHashMap<>();
    // 轨迹类别，轨迹过期后仍保留，用于重关联
    private final Map<String, String> trackLabels = new HashMap<>();
    private final TrackPredictor predictor;
    private final double iouThreshold;
    private final int maxAge;
    private int nextTrackId = 0;

    public IouTracker(TrackPredictor predictor, double iouThreshold, int maxAge) {
        this.predictor = predictor;
        this.iouThreshold = iouThreshold;
        this.maxAge = maxAge;
    }

    public IouTracker(TrackPredictor predictor) {
        this(predictor, DEFAULT_IOU_THRESHOLD, DEFAULT_MAX_AGE);
    }

    @Override
    public Map<Integer, String> update(int frameNumber, double timestamp, List<Detection> detections) {
        Map<Integer, String> assignments = new HashMap<>();

        // 1. 清除过期轨迹
        tracks.entrySet().removeIf(e -> frameNumber - e.getValue().lastFrame > maxAge);

        List<String> trackIds = new ArrayList<>(tracks.keySet());
        Set<String> usedTracks = new HashSet<>();

        // 2. 匈牙利全局分配
        if (!trackIds.isEmpty() && !detections.isEmpty()) {
            double[][] cost = new double[detections.size()][trackIds.size()];
            for (int i = 0; i < detections.size(); i++) {
                Detection det = detections.get(i);
                for (int j = 0; j < trackIds.size(); j++) {
                    TrackState track = tracks.get(trackIds.get(j));
                    double iou = Objects.equals(track.label, det.getLabel()) ? det.getBbox().iou(track.lastBbox) : 0;
                    cost[i][j] = iou >= iouThreshold ? 1.0 - iou : HungarianAlgorithm.PADDING_COST;
                }
            }

            int[] result = HungarianAlgorithm.solve(cost);
            for (int i = 0; i < result.length; i++) {
                int j = result[i];
                if (j >= 0 && cost[i][j] < HungarianAlgorithm.PADDING_COST) {
                    String trackId = trackIds.get(j);
                    assignments.put(i, trackId);
                    usedTracks.add(trackId);
                }
            }
        }

        // 3. 未分配的检测尝试重关联
        List<PredictedPosition> lostPredictions = new ArrayList<>();
        for (PredictedPosition prediction : predictor.getAllPredictions(frameNumber, timestamp)) {
            if (!usedTracks.contains(prediction.getTrackId()) && prediction.getLastObservedFrame() < frameNumber) {
                lostPredictions.add(prediction);
            }
        }

        for (int i = 0; i < detections.size(); i++) {
            if (assignments.containsKey(i)) {
                continue;
            }
            Detection det = detections.get(i);
            List<PredictedPosition> candidates = new ArrayList<>();
            for (PredictedPosition prediction : lostPredictions) {
                if (Objects.equals(trackLabels.get(prediction.getTrackId()), det.getLabel())) {
                    candidates.add(prediction);
                }
            }
            PredictedPosition match = TrackPredictor.findBestMatch(candidates, det.getCenter(),
                    predictor.getConfig().getReassociationDistance());
            String trackId;
            if (match != null) {
                trackId = match.getTrackId();
                lostPredictions.remove(match);
                logger.debug("Re-associated detection {} at frame {} to track {}", i, frameNumber, trackId);
            } else {
                trackId = "track_" + nextTrackId++;
            }
            assignments.put(i, trackId);
            usedTracks.add(trackId);
        }

        // 4. 写回轨迹状态与滤波器
        for (Map.Entry<Integer, String> entry : assignments.entrySet()) {
            Detection det = detections.get(entry.getKey());
            String trackId = entry.getValue();
            tracks.put(trackId, new TrackState(det.getBbox(), frameNumber, det.getLabel()));
            trackLabels.put(trackId, det.getLabel());
            Point center = det.getCenter();
            predictor.updateTrack(trackId, center, frameNumber, timestamp);
            det.setTrackId(trackId);
        }

        return assignments;
    }

    @Override
    public List<String> getActiveTrackIds() {
        return new ArrayList<>(tracks.keySet());
    }

    @Override
    public void reset() {
        tracks.clear();
        trackLabels.clear();
        predictor.clear();
        nextTrackId = 0;
    }

    @Override
    public String getTrackerId() {
        return "iou-tracker-v1";
    }

    private static class TrackState {
        final BoundingBox lastBbox;
        final int lastFrame;
        final String label;

        TrackState(BoundingBox lastBbox, int lastFrame, String label) {
            this.lastBbox = lastBbox;
            this.lastFrame = lastFrame;
            this.label = label;
        }
    }
}
