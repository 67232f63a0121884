package com.edge.match.core.transform;

import com.edge.match.model.FieldSize;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import com.edge.match.model.HomographyKeypoint;
import com.edge.match.model.Point;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DltHomographyEstimatorTest {

    private final DltHomographyEstimator estimator = new DltHomographyEstimator();
    private final FieldSize pitch = GameFormat.ELEVEN.fieldSize();

    private HomographyKeypoint keypoint(double sx, double sy, String label) {
        return new HomographyKeypoint(new Point(sx, sy), PitchKeypoints.lookup(label, pitch), label, 0.9);
    }

    @Test
    void recovers_full_pitch_mapping_from_corners() {
        List<HomographyKeypoint> keypoints = List.of(
                keypoint(0, 0, "corner_tl"),
                keypoint(1, 0, "corner_tr"),
                keypoint(0, 1, "corner_bl"),
                keypoint(1, 1, "corner_br"),
                keypoint(0.5, 0.5, "center"));

        double[][] h = estimator.estimate(keypoints);

        assertThat(h).isNotNull();
        Point p = CoordinateTransform.transformPoint(h, new Point(0.25, 0.75));
        assertThat(p.x).isCloseTo(-26.25, within(1e-6));
        assertThat(p.y).isCloseTo(-17, within(1e-6));
        assertThat(CoordinateTransform.computeReprojectionError(h, keypoints)).isLessThan(1e-6);
    }

    @Test
    void recovers_perspective_mapping() {
        double[][] truth = {
                {80, 10, -40},
                {5, -50, 25},
                {0.2, 0.1, 1}
        };
        String[] labels = {"corner_tl", "corner_tr", "corner_bl", "corner_br", "center", "penalty_front_tl"};
        Point[] screens = {new Point(0.1, 0.2), new Point(0.9, 0.15), new Point(0.05, 0.9),
                new Point(0.95, 0.85), new Point(0.5, 0.5), new Point(0.3, 0.4)};
        List<HomographyKeypoint> keypoints = new ArrayList<>();
        for (int i = 0; i < screens.length; i++) {
            keypoints.add(new HomographyKeypoint(screens[i], CoordinateTransform.transformPoint(truth, screens[i]),
                    labels[i], 1.0));
        }

        double[][] h = estimator.estimate(keypoints);

        Point expected = CoordinateTransform.transformPoint(truth, new Point(0.6, 0.3));
        Point actual = CoordinateTransform.transformPoint(h, new Point(0.6, 0.3));
        assertThat(actual.x).isCloseTo(expected.x, within(1e-6));
        assertThat(actual.y).isCloseTo(expected.y, within(1e-6));
    }

    @Test
    void fewer_than_four_keypoints_is_rejected() {
        List<HomographyKeypoint> keypoints = List.of(
                keypoint(0, 0, "corner_tl"),
                keypoint(1, 0, "corner_tr"),
                keypoint(0.5, 0.5, "center"));
        assertThatThrownBy(() -> estimator.estimate(keypoints))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 4");
    }

    @Test
    void collinear_keypoints_are_degenerate() {
        List<HomographyKeypoint> keypoints = List.of(
                new HomographyKeypoint(new Point(0.1, 0.1), new Point(-40, 0), "a", 1.0),
                new HomographyKeypoint(new Point(0.2, 0.2), new Point(-20, 0), "b", 1.0),
                new HomographyKeypoint(new Point(0.3, 0.3), new Point(0, 0), "c", 1.0),
                new HomographyKeypoint(new Point(0.4, 0.4), new Point(20, 0), "d", 1.0));
        assertThat(estimator.estimate(keypoints)).isNull();
    }

    @Test
    void homography_data_carries_average_keypoint_confidence() {
        List<HomographyKeypoint> keypoints = List.of(
                keypoint(0, 0, "corner_tl"),
                keypoint(1, 0, "corner_tr"),
                keypoint(0, 1, "corner_bl"),
                new HomographyKeypoint(new Point(1, 1), PitchKeypoints.lookup("corner_br", pitch), "corner_br", 0.5));

        HomographyData data = estimator.createHomographyData(42, keypoints, pitch);

        assertThat(data.getFrameNumber()).isEqualTo(42);
        assertThat(data.getConfidence()).isCloseTo((0.9 * 3 + 0.5) / 4, within(1e-9));
        assertThat(data.isCameraMoving()).isFalse();
    }

    @Test
    void unknown_keypoint_label_has_no_field_position() {
        assertThat(PitchKeypoints.lookup("corner_tl", GameFormat.FIVE.fieldSize())).isEqualTo(new Point(-20, 10));
        assertThat(PitchKeypoints.lookup("somewhere", pitch)).isNull();
    }
}
