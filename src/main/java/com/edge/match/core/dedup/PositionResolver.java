package com.edge.match.core.dedup;

import com.edge.match.model.BallDetection;

import java.util.List;

/**
 * 为去重后的事件确定唯一位置
 * <p>
 * 按来源优先级取第一个可用的位置，不同来源之间不做平均
 */
public class PositionResolver {
    private final BallPositionMatcher ballMatcher;

    public PositionResolver(BallPositionMatcher ballMatcher) {
        this.ballMatcher = ballMatcher;
    }

    public PositionEstimate resolve(DeduplicatedEvent event, List<BallDetection> ballDetections) {
        BallPositionMatch ball = ballMatcher.match(ballDetections, event.getAbsoluteTimestamp());
        if (ball != null) {
            return ball.toEstimate();
        }
        if (event.getMergedPosition() != null) {
            double confidence = event.getMergedPositionConfidence() != null ? event.getMergedPositionConfidence() : 0.5;
            PositionSource source = event.getPositionSource() != null ? event.getPositionSource() : PositionSource.MODEL_OUTPUT;
            return new PositionEstimate(event.getMergedPosition(), source, confidence);
        }
        return ZoneMapper.positionFromZone(event.getZone(), event.getTeam());
    }

    /**
     * 解析位置并写回事件
     *
     * @return 是否由足球检测确定
     */
    public boolean apply(DeduplicatedEvent event, List<BallDetection> ballDetections) {
        PositionEstimate estimate = resolve(event, ballDetections);
        event.setMergedPosition(estimate.getPosition());
        event.setPositionSource(estimate.getSource());
        event.setMergedPositionConfidence(estimate.getConfidence());
        return estimate.getSource() == PositionSource.BALL_DETECTION;
    }
}
