package com.edge.match.core.tracking;

import com.edge.match.model.BoundingBox;
import com.edge.match.model.Detection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IouTrackerTest {

    private static Detection person(double x, double y) {
        return new Detection("person", new BoundingBox(x, y, 0.05, 0.15), 0.9);
    }

    private static List<Detection> frame(Detection... detections) {
        return new ArrayList<>(List.of(detections));
    }

    @Test
    void overlapping_boxes_keep_their_track_id() {
        IouTracker tracker = new IouTracker(new TrackPredictor());

        Detection a0 = person(0.10, 0.40);
        Detection b0 = person(0.60, 0.40);
        tracker.update(0, 0.0, frame(a0, b0));

        Detection b1 = person(0.605, 0.40);
        Detection a1 = person(0.102, 0.40);
        Map<Integer, String> assignments = tracker.update(1, 1 / 30.0, frame(b1, a1));

        assertThat(a1.getTrackId()).isEqualTo(a0.getTrackId());
        assertThat(b1.getTrackId()).isEqualTo(b0.getTrackId());
        assertThat(assignments).containsEntry(0, b0.getTrackId());
        assertThat(tracker.getActiveTrackIds()).hasSize(2);
    }

    @Test
    void different_labels_never_share_a_track() {
        IouTracker tracker = new IouTracker(new TrackPredictor(), 0.3, 30);
        Detection player = person(0.3, 0.3);
        tracker.update(0, 0, frame(player));

        Detection referee = new Detection("referee", new BoundingBox(0.3, 0.3, 0.05, 0.15), 0.9);
        tracker.update(1, 1 / 30.0, frame(referee));

        assertThat(referee.getTrackId()).isNotEqualTo(player.getTrackId());
    }

    @Test
    void tracks_older_than_max_age_are_dropped() {
        IouTracker tracker = new IouTracker(new TrackPredictor(), 0.3, 5);
        tracker.update(0, 0, frame(person(0.1, 0.1)));
        tracker.update(6, 0.2, frame());

        assertThat(tracker.getActiveTrackIds()).isEmpty();
    }

    @Test
    void detection_reappearing_near_prediction_is_reassociated() {
        IouTracker tracker = new IouTracker(new TrackPredictor(), 0.3, 30);
        Detection first = person(0.40, 0.40);
        tracker.update(0, 0.0, frame(first));

        // 两帧遮挡后出现在附近，但 IoU 不足
        Detection reappeared = person(0.43, 0.40);
        tracker.update(3, 0.1, frame(reappeared));

        assertThat(first.getBbox().iou(reappeared.getBbox())).isLessThan(0.3);
        assertThat(reappeared.getTrackId()).isEqualTo(first.getTrackId());
    }

    @Test
    void moving_player_relinks_at_extrapolated_position_after_occlusion() {
        PredictionConfig config = new PredictionConfig();
        config.setMeasurementNoise(0.01);
        IouTracker tracker = new IouTracker(new TrackPredictor(config), 0.3, 30);

        Detection last = null;
        for (int f = 0; f <= 30; f++) {
            last = person(0.10 + 0.01 * f, 0.40);
            tracker.update(f, f / 30.0, frame(last));
        }
        for (int f = 31; f < 45; f++) {
            tracker.update(f, f / 30.0, frame());
        }

        // 离最后观测位置 0.15，超出重关联距离，但接近外推位置
        Detection reappeared = person(0.55, 0.40);
        tracker.update(45, 1.5, frame(reappeared));

        assertThat(reappeared.getTrackId()).isEqualTo(last.getTrackId());
    }

    @Test
    void far_away_detection_starts_new_track() {
        IouTracker tracker = new IouTracker(new TrackPredictor());
        Detection first = person(0.10, 0.10);
        tracker.update(0, 0, frame(first));

        Detection other = person(0.80, 0.80);
        tracker.update(1, 1 / 30.0, frame(other));

        assertThat(other.getTrackId()).isNotEqualTo(first.getTrackId());
    }

    @Test
    void reset_restarts_numbering() {
        IouTracker tracker = new IouTracker(new TrackPredictor());
        Detection first = person(0.1, 0.1);
        tracker.update(0, 0, frame(first));
        tracker.reset();

        Detection again = person(0.7, 0.7);
        tracker.update(0, 0, frame(again));

        assertThat(again.getTrackId()).isEqualTo(first.getTrackId());
        assertThat(tracker.getTrackerId()).isEqualTo("iou-tracker-v1");
    }
}
