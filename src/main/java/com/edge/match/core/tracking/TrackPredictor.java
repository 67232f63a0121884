package com.edge.match.core.tracking;

import com.edge.match.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批量滤波器管理器
 * <p>
 * 按轨迹 ID 管理卡尔曼滤波器，支持短暂离开画面后的轨迹重关联。
 * 每次比赛分析独占一个实例
 */
public class TrackPredictor {
    private static final Logger logger = LoggerFactory.getLogger(TrackPredictor.class);

    public static final double DEFAULT_MATCH_DISTANCE = 0.1;

    private final Map<String, KalmanFilter> filters = new LinkedHashMap<>();
    private final PredictionConfig config;

    public TrackPredictor(PredictionConfig config) {
        this.config = config;
    }

    public TrackPredictor() {
        this(new PredictionConfig());
    }

    /**
     * 以首次观测创建（或重建）轨迹滤波器
     */
    public void initTrack(String trackId, Point position, int frameNumber, double timestamp) {
        KalmanFilter filter = new KalmanFilter(config);
        filter.init(position, frameNumber, timestamp);
        filters.put(trackId, filter);
    }

    /**
     * 用新观测更新轨迹，轨迹不存在时自动创建
     */
    public void updateTrack(String trackId, Point position, int frameNumber, double timestamp) {
        KalmanFilter filter = filters.get(trackId);
        if (filter == null) {
            initTrack(trackId, position, frameNumber, timestamp);
            return;
        }
        filter.update(position, frameNumber, timestamp);
    }

    /**
     * 所有轨迹向前预测 dt 秒
     */
    public void predictAll(double dt) {
        for (KalmanFilter filter : filters.values()) {
            filter.predict(dt);
        }
    }

    /**
     * 位置按速度外推到 currentTime
     *
     * @return 预测已失效或轨迹不存在时返回 null
     */
    public PredictedPosition getPrediction(String trackId, int frameNumber, double currentTime) {
        KalmanFilter filter = filters.get(trackId);
        if (filter == null || !filter.isPredictionValid(currentTime)) {
            return null;
        }
        return filter.toPredictedPosition(trackId, frameNumber, currentTime);
    }

    public List<PredictedPosition> getAllPredictions(int frameNumber, double currentTime) {
        List<PredictedPosition> predictions = new ArrayList<>();
        for (Map.Entry<String, KalmanFilter> entry : filters.entrySet()) {
            if (entry.getValue().isPredictionValid(currentTime)) {
                predictions.add(entry.getValue().toPredictedPosition(entry.getKey(), frameNumber, currentTime));
            }
        }
        return predictions;
    }

    /**
     * 删除预测已失效的轨迹
     *
     * @return 被删除的轨迹 ID
     */
    public List<String> pruneStale(double currentTime) {
        List<String> removed = new ArrayList<>();
        Iterator<Map.Entry<String, KalmanFilter>> it = filters.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, KalmanFilter> entry = it.next();
            if (!entry.getValue().isPredictionValid(currentTime)) {
                it.remove();
                removed.add(entry.getKey());
            }
        }
        if (!removed.isEmpty()) {
            logger.debug("Pruned {} stale track filters at t={}", removed.size(), currentTime);
        }
        return removed;
    }

    public boolean hasTrack(String trackId) {
        return filters.containsKey(trackId);
    }

    public int trackCount() {
        return filters.size();
    }

    public void clear() {
        filters.clear();
    }

    public PredictionConfig getConfig() {
        return config;
    }

    /**
     * 最近邻重关联：在距离严格小于 maxDistance 的预测中取最近的一个
     *
     * @return 没有满足条件的预测时返回 null
     */
    public static PredictedPosition findBestMatch(List<PredictedPosition> predictions, Point observation,
                                                  double maxDistance) {
        PredictedPosition best = null;
        double bestDistance = maxDistance;
        for (PredictedPosition prediction : predictions) {
            double distance = prediction.getPosition().distanceTo(observation);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = prediction;
            }
        }
        return best;
    }

    public static PredictedPosition findBestMatch(List<PredictedPosition> predictions, Point observation) {
        return findBestMatch(predictions, observation, DEFAULT_MATCH_DISTANCE);
    }
}
