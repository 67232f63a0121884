package com.edge.match.core.tracking;

import com.edge.match.model.BallDetection;
import com.edge.match.model.BallTrack;
import com.edge.match.model.Point;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BallTrackSmootherTest {

    private final BallTrackSmoother smoother = new BallTrackSmoother(new PredictionConfig(), 1.0);

    private static BallDetection visible(int frame, double x) {
        return new BallDetection(frame, frame / 30.0, new Point(x, 0.5), 0.8, true);
    }

    private static BallDetection missing(int frame) {
        return new BallDetection(frame, frame / 30.0, new Point(0.5, 0.5), 0, false);
    }

    @Test
    void short_gap_is_filled_by_prediction() {
        List<BallDetection> raw = new ArrayList<>();
        raw.add(visible(0, 0.30));
        raw.add(visible(1, 0.31));
        raw.add(missing(2));
        raw.add(visible(3, 0.33));

        BallTrack track = smoother.smooth(raw, "yolo-ball-v1");

        BallDetection gap = track.getFrame(2);
        assertThat(gap.isVisible()).isFalse();
        assertThat(gap.isInterpolated()).isTrue();
        assertThat(gap.getConfidence()).isCloseTo(0.9 - 1 / 30.0, within(1e-9));
        assertThat(track.getModelId()).isEqualTo("yolo-ball-v1");
        assertThat(track.getVisibilityRate()).isEqualTo(0.75);
    }

    @Test
    void long_gap_falls_back_to_frame_center_with_zero_confidence() {
        List<BallDetection> raw = new ArrayList<>();
        raw.add(visible(0, 0.2));
        for (int f = 1; f <= 40; f++) {
            raw.add(missing(f));
        }

        BallTrack track = smoother.smooth(raw, "input");

        BallDetection late = track.getFrame(40);
        assertThat(late.isInterpolated()).isFalse();
        assertThat(late.getConfidence()).isZero();
        assertThat(late.getPosition()).isEqualTo(new Point(0.5, 0.5));
        assertThat(track.getFrame(10).isInterpolated()).isTrue();
    }

    @Test
    void leading_invisible_frames_have_nothing_to_predict_from() {
        List<BallDetection> raw = List.of(missing(0), visible(1, 0.4));

        BallTrack track = smoother.smooth(raw, "input");

        assertThat(track.getFrame(0).isInterpolated()).isFalse();
        assertThat(track.getFrame(0).getConfidence()).isZero();
        assertThat(track.getAvgConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void output_is_ordered_by_frame() {
        List<BallDetection> raw = List.of(visible(2, 0.5), visible(0, 0.4), visible(1, 0.45));

        BallTrack track = smoother.smooth(raw, "input");

        assertThat(track.getDetections()).extracting(BallDetection::getFrameNumber).containsExactly(0, 1, 2);
    }

    @Test
    void empty_input_gives_empty_track() {
        BallTrack track = smoother.smooth(List.of(), "input");
        assertThat(track.getDetections()).isEmpty();
        assertThat(track.getVisibilityRate()).isZero();
    }
}
