package com.edge.match.core.tracking;

import com.edge.match.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrackPredictorTest {

    @Test
    void update_creates_missing_track() {
        TrackPredictor predictor = new TrackPredictor();
        predictor.updateTrack("t1", new Point(0.2, 0.2), 0, 0);

        assertThat(predictor.hasTrack("t1")).isTrue();
        PredictedPosition p = predictor.getPrediction("t1", 0, 0);
        assertThat(p.getPosition()).isEqualTo(new Point(0.2, 0.2));
        assertThat(p.isPredicted()).isFalse();
    }

    @Test
    void prediction_for_later_frame_is_flagged_as_predicted() {
        TrackPredictor predictor = new TrackPredictor();
        predictor.updateTrack("t1", new Point(0.2, 0.2), 10, 1.0);

        PredictedPosition p = predictor.getPrediction("t1", 12, 1.5);
        assertThat(p.isPredicted()).isTrue();
        assertThat(p.getLastObservedFrame()).isEqualTo(10);
        assertThat(p.getTimeSinceObservation()).isEqualTo(0.5);
        assertThat(p.getConfidence()).isLessThan(1.0);
    }

    @Test
    void prediction_advances_with_time_without_changing_filter() {
        PredictionConfig config = new PredictionConfig();
        config.setMeasurementNoise(0.01);
        TrackPredictor predictor = new TrackPredictor(config);
        for (int frame = 0; frame <= 30; frame++) {
            predictor.updateTrack("t1", new Point(0.1 + 0.01 * frame, 0.5), frame, frame / 30.0);
        }

        PredictedPosition atOne = predictor.getPrediction("t1", 60, 2.0);
        PredictedPosition atTwo = predictor.getPrediction("t1", 90, 3.0);
        PredictedPosition again = predictor.getPrediction("t1", 60, 2.0);

        assertThat(atOne.getPosition().x).isCloseTo(0.7, within(0.08));
        assertThat(atTwo.getPosition().x).isGreaterThan(atOne.getPosition().x);
        assertThat(again.getPosition()).isEqualTo(atOne.getPosition());
    }

    @Test
    void expired_tracks_are_hidden_then_pruned() {
        TrackPredictor predictor = new TrackPredictor();
        predictor.updateTrack("old", new Point(0.1, 0.1), 0, 0.0);
        predictor.updateTrack("fresh", new Point(0.9, 0.9), 150, 5.0);

        assertThat(predictor.getPrediction("old", 200, 6.0)).isNull();
        assertThat(predictor.getAllPredictions(200, 6.0))
                .extracting(PredictedPosition::getTrackId)
                .containsExactly("fresh");

        assertThat(predictor.pruneStale(6.0)).containsExactly("old");
        assertThat(predictor.trackCount()).isEqualTo(1);
    }

    @Test
    void best_match_requires_strictly_closer_than_limit() {
        PredictedPosition near = new PredictedPosition("near", 5, new Point(0.50, 0.50), new Point(0, 0),
                true, 0.9, 4, 0.03);
        PredictedPosition far = new PredictedPosition("far", 5, new Point(0.55, 0.50), new Point(0, 0),
                true, 0.9, 4, 0.03);
        List<PredictedPosition> predictions = List.of(far, near);

        assertThat(TrackPredictor.findBestMatch(predictions, new Point(0.51, 0.50)).getTrackId()).isEqualTo("near");
        assertThat(TrackPredictor.findBestMatch(predictions, new Point(0.50, 0.70), 0.1)).isNull();
        assertThat(TrackPredictor.findBestMatch(List.of(), new Point(0.5, 0.5))).isNull();
    }
}
