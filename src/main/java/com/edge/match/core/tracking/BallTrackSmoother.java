package com.edge.match.core.tracking;

import com.edge.match.model.BallDetection;
import com.edge.match.model.BallTrack;
import com.edge.match.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 足球轨迹平滑
 * <p>
 * - 可见帧：卡尔曼滤波平滑位置
 * - 短暂丢失（距上次可见小于 maxGapSeconds）：用预测位置补帧，interpolated=true，
 *   置信度 max(0.1, 0.9 - 丢失秒数)
 * - 长时间丢失：不可见，位置为画面中心，置信度 0
 */
public class BallTrackSmoother {
    private static final Logger logger = LoggerFactory.getLogger(BallTrackSmoother.class);

    private static final Point FRAME_CENTER = new Point(0.5, 0.5);

    private final PredictionConfig config;
    private final double maxGapSeconds;

    public BallTrackSmoother(PredictionConfig config, double maxGapSeconds) {
        this.config = config;
        this.maxGapSeconds = maxGapSeconds;
    }

    public BallTrackSmoother(PredictionConfig config) {
        this(config, 1.0);
    }

    /**
     * @param raw     原始检测（每帧一条，不可见帧 visible=false）
     * @param modelId 产生检测的模型
     */
    public BallTrack smooth(List<BallDetection> raw, String modelId) {
        List<BallDetection> sorted = new ArrayList<>(raw);
        sorted.sort(Comparator.comparingInt(BallDetection::getFrameNumber));

        KalmanFilter filter = new KalmanFilter(config);
        List<BallDetection> result = new ArrayList<>(sorted.size());
        Double lastVisibleTime = null;
        int predictedCount = 0;

        for (BallDetection d : sorted) {
            if (d.isVisible() && d.getPosition() != null) {
                filter.update(d.getPosition(), d.getFrameNumber(), d.getTimestamp());
                result.add(new BallDetection(d.getFrameNumber(), d.getTimestamp(), filter.getEstimatedPosition(),
                        d.getConfidence(), true, false));
                lastVisibleTime = d.getTimestamp();
                continue;
            }

            double gap = lastVisibleTime == null ? Double.POSITIVE_INFINITY : d.getTimestamp() - lastVisibleTime;
            if (gap < maxGapSeconds && filter.isInitialized()) {
                filter.predictTo(d.getTimestamp());
                double confidence = Math.max(0.1, 0.9 - gap);
                result.add(new BallDetection(d.getFrameNumber(), d.getTimestamp(), filter.getEstimatedPosition(),
                        confidence, false, true));
                predictedCount++;
                continue;
            }
            result.add(new BallDetection(d.getFrameNumber(), d.getTimestamp(), FRAME_CENTER, 0, false, false));
        }

        BallTrack track = new BallTrack(result, modelId);
        logger.info("Ball track smoothed: frames={}, predicted={}, visibilityRate={}, avgConfidence={}",
                result.size(), predictedCount,
                String.format("%.2f", track.getVisibilityRate()),
                String.format("%.2f", track.getAvgConfidence()));
        return track;
    }
}
