package com.edge.match.core.dedup;

import com.edge.match.model.BallDetection;
import com.edge.match.model.Point;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 按时间戳在足球轨迹中查找事件发生时的球位置
 * <p>
 * 50ms 内视为精确匹配；前后两帧都在 maxTimeDiff 内时线性插值；
 * 只有一侧可用时取最近帧并降低置信度
 */
public class BallPositionMatcher {

    static final double EXACT_MATCH_WINDOW = 0.05;

    private final BallMatchConfig config;

    public BallPositionMatcher(BallMatchConfig config) {
        this.config = config != null ? config : new BallMatchConfig();
    }

    /**
     * @return 没有满足条件的检测时返回 null
     */
    public BallPositionMatch match(List<BallDetection> detections, double timestamp) {
        if (detections == null || detections.isEmpty()) {
            return null;
        }
        List<BallDetection> valid = detections.stream()
                .filter(d -> d.isVisible() && d.getConfidence() >= config.getMinConfidence())
                .sorted(Comparator.comparingDouble(BallDetection::getTimestamp))
                .collect(Collectors.toList());
        if (valid.isEmpty()) {
            return null;
        }

        for (BallDetection d : valid) {
            double diff = Math.abs(d.getTimestamp() - timestamp);
            if (diff < EXACT_MATCH_WINDOW) {
                return new BallPositionMatch(d.getPosition(), d.getConfidence(), d.getFrameNumber(), diff, false);
            }
        }

        if (!config.isEnableInterpolation()) {
            BallDetection nearest = nearest(valid, timestamp);
            if (nearest == null) {
                return null;
            }
            return new BallPositionMatch(nearest.getPosition(), nearest.getConfidence() * 0.9,
                    nearest.getFrameNumber(), Math.abs(nearest.getTimestamp() - timestamp), false);
        }

        BallDetection before = null;
        BallDetection after = null;
        for (BallDetection d : valid) {
            if (d.getTimestamp() <= timestamp) {
                before = d;
            }
            if (d.getTimestamp() >= timestamp) {
                after = d;
                break;
            }
        }

        if (before == null || after == null) {
            BallDetection single = before != null ? before : after;
            double timeDiff = Math.abs(single.getTimestamp() - timestamp);
            if (timeDiff > config.getMaxTimeDiff()) {
                return null;
            }
            double confidence = single.getConfidence() * Math.max(0.5, 1 - timeDiff / config.getMaxTimeDiff());
            return new BallPositionMatch(single.getPosition(), confidence, single.getFrameNumber(), timeDiff, false);
        }

        double beforeDiff = timestamp - before.getTimestamp();
        double afterDiff = after.getTimestamp() - timestamp;
        if (beforeDiff > config.getMaxTimeDiff() || afterDiff > config.getMaxTimeDiff()) {
            BallDetection nearest = beforeDiff < afterDiff ? before : after;
            double timeDiff = Math.min(beforeDiff, afterDiff);
            if (timeDiff > config.getMaxTimeDiff()) {
                return null;
            }
            return new BallPositionMatch(nearest.getPosition(), nearest.getConfidence() * 0.8,
                    nearest.getFrameNumber(), timeDiff, false);
        }

        Point position = interpolate(before, after, timestamp);
        double avgConfidence = (before.getConfidence() + after.getConfidence()) / 2;
        double span = after.getTimestamp() - before.getTimestamp();
        double penalty = Math.max(0.7, 1 - span / 2);
        return new BallPositionMatch(position, avgConfidence * penalty, null,
                Math.min(beforeDiff, afterDiff), true);
    }

    static Point interpolate(BallDetection before, BallDetection after, double timestamp) {
        double span = after.getTimestamp() - before.getTimestamp();
        if (span == 0) {
            return before.getPosition();
        }
        double ratio = (timestamp - before.getTimestamp()) / span;
        return before.getPosition().lerp(after.getPosition(), ratio);
    }

    private BallDetection nearest(List<BallDetection> sorted, double timestamp) {
        BallDetection nearest = null;
        double minDiff = Double.POSITIVE_INFINITY;
        for (BallDetection d : sorted) {
            double diff = Math.abs(d.getTimestamp() - timestamp);
            if (diff < minDiff && diff <= config.getMaxTimeDiff()) {
                minDiff = diff;
                nearest = d;
            }
        }
        return nearest;
    }
}
