package com.edge.match.core.dedup;

import com.edge.match.model.BallDetection;
import com.edge.match.model.Point;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BallPositionMatcherTest {

    private final BallPositionMatcher matcher = new BallPositionMatcher(new BallMatchConfig());

    private static BallDetection ball(int frame, double timestamp, double x, double confidence) {
        return new BallDetection(frame, timestamp, new Point(x, 0.5), confidence, true);
    }

    @Test
    void detection_within_fifty_millis_is_exact() {
        BallPositionMatch match = matcher.match(Arrays.asList(
                ball(30, 1.02, 0.4, 0.9), ball(42, 1.4, 0.6, 0.9)), 1.0);

        assertThat(match.isInterpolated()).isFalse();
        assertThat(match.getFrameNumber()).isEqualTo(30);
        assertThat(match.getConfidence()).isEqualTo(0.9);
        assertThat(match.getTimeDiff()).isCloseTo(0.02, within(1e-9));
    }

    @Test
    void bracketing_detections_are_interpolated() {
        BallPositionMatch match = matcher.match(Arrays.asList(
                ball(42, 1.4, 0.6, 0.8), ball(30, 1.0, 0.4, 0.8)), 1.2);

        assertThat(match.isInterpolated()).isTrue();
        assertThat(match.getFrameNumber()).isNull();
        assertThat(match.getPosition().x).isCloseTo(0.5, within(1e-9));
        // 跨度 0.4 秒，惩罚系数 0.8
        assertThat(match.getConfidence()).isCloseTo(0.64, within(1e-9));
    }

    @Test
    void single_side_match_decays_with_distance() {
        BallPositionMatch match = matcher.match(Collections.singletonList(ball(30, 1.0, 0.4, 0.8)), 1.25);

        assertThat(match.isInterpolated()).isFalse();
        assertThat(match.getConfidence()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void nothing_within_max_time_diff_returns_null() {
        assertThat(matcher.match(Collections.singletonList(ball(30, 1.0, 0.4, 0.8)), 2.0)).isNull();
        assertThat(matcher.match(Collections.emptyList(), 1.0)).isNull();
        assertThat(matcher.match(null, 1.0)).isNull();
    }

    @Test
    void invisible_and_low_confidence_detections_are_ignored() {
        List<BallDetection> detections = Arrays.asList(
                new BallDetection(30, 1.0, new Point(0.4, 0.5), 0.9, false),
                ball(31, 1.0, 0.4, 0.2));

        assertThat(matcher.match(detections, 1.0)).isNull();
    }

    @Test
    void nearest_detection_is_used_when_interpolation_disabled() {
        BallMatchConfig config = new BallMatchConfig();
        config.setEnableInterpolation(false);
        BallPositionMatcher nearestOnly = new BallPositionMatcher(config);

        BallPositionMatch match = nearestOnly.match(Arrays.asList(
                ball(30, 1.0, 0.4, 0.8), ball(42, 1.4, 0.6, 0.8)), 1.3);

        assertThat(match.getFrameNumber()).isEqualTo(42);
        assertThat(match.getConfidence()).isCloseTo(0.72, within(1e-9));
    }
}
