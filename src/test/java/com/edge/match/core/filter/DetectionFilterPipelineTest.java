package com.edge.match.core.filter;

import com.edge.match.model.BoundingBox;
import com.edge.match.model.Detection;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionFilterPipelineTest {

    private final FilterConfig config = new FilterConfig();
    private final DetectionFilterPipeline pipeline = new DetectionFilterPipeline(config);

    private static Detection detection(double cx, double cy, double confidence) {
        return new Detection("person", new BoundingBox(cx - 0.02, cy - 0.05, 0.04, 0.1), confidence);
    }

    private static Detection tracked(String trackId, double cx, double cy) {
        Detection d = detection(cx, cy, 0.9);
        d.setTrackId(trackId);
        return d;
    }

    @Test
    void confidence_threshold_is_inclusive() {
        List<Detection> input = List.of(detection(0.5, 0.5, 0.3), detection(0.5, 0.5, 0.29));
        assertThat(DetectionFilterPipeline.filterByConfidence(input, 0.3)).containsExactly(input.get(0));
    }

    @Test
    void top_n_keeps_highest_confidence() {
        List<Detection> input = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            input.add(detection(0.5, 0.5, 0.5 + i * 0.02));
        }

        FilterInput filterInput = new FilterInput(input, 0);
        filterInput.setGameFormat(GameFormat.FIVE);
        FilterResult result = pipeline.run(filterInput);

        assertThat(result.getPassed()).hasSize(15);
        assertThat(result.getPassed()).allMatch(d -> d.getConfidence() >= 0.5 + 5 * 0.02 - 1e-9);
        assertThat(result.getStats().getFilteredByTopN()).isEqualTo(5);
        assertThat(result.getFiltered()).hasSize(5);
    }

    @Test
    void detections_outside_pitch_are_removed() {
        // 屏幕 x 在 [0.1, 0.9] 内映射到球场，两侧为场外
        double[][] matrix = {
                {105 / 0.8, 0, -52.5 - 105 / 0.8 * 0.1},
                {0, -68, 34},
                {0, 0, 1}
        };
        HomographyData homography = new HomographyData(0, matrix, new ArrayList<>(), 1.0,
                GameFormat.ELEVEN.fieldSize(), false);
        Detection inside = detection(0.5, 0.5, 0.9);
        Detection outside = detection(0.05, 0.5, 0.9);

        FilterInput input = new FilterInput(List.of(inside, outside), 0);
        input.setHomography(homography);
        FilterResult result = pipeline.run(input);

        assertThat(result.getPassed()).containsExactly(inside);
        assertThat(result.getStats().getFilteredByPitch()).isEqualTo(1);
    }

    @Test
    void pitch_filter_can_be_disabled() {
        config.setFilterOutsidePitch(false);
        // 所有点都映射到场外
        double[][] offPitch = {
                {1, 0, 100},
                {0, 1, 0},
                {0, 0, 1}
        };
        FilterInput input = new FilterInput(List.of(detection(0.5, 0.5, 0.9)), 0);
        input.setHomography(new HomographyData(0, offPitch, new ArrayList<>(), 1, GameFormat.FIVE.fieldSize(), false));
        input.setGameFormat(GameFormat.FIVE);

        assertThat(pipeline.run(input).getPassed()).hasSize(1);
    }

    @Test
    void stationary_track_is_removed_once_history_exists() {
        MotionHistory history = new MotionHistory();

        // 首帧没有历史，放行
        List<Detection> first = pipeline.filterByMotion(List.of(tracked("static", 0.5, 0.5), tracked("runner", 0.2, 0.2)),
                history, 0);
        assertThat(first).hasSize(2);

        List<Detection> second = pipeline.filterByMotion(List.of(tracked("static", 0.5, 0.5), tracked("runner", 0.25, 0.2)),
                history, 1);
        assertThat(second).extracting(Detection::getTrackId).containsExactly("runner");
    }

    @Test
    void untracked_detections_skip_motion_filter() {
        MotionHistory history = new MotionHistory();
        Detection untracked = detection(0.5, 0.5, 0.9);
        assertThat(pipeline.filterByMotion(List.of(untracked), history, 0)).containsExactly(untracked);
        assertThat(history.size()).isZero();
    }

    @Test
    void roster_filter_removes_unknown_numbers_only() {
        Detection listed = detection(0.5, 0.5, 0.9);
        listed.setJerseyNumber(10);
        Detection unlisted = detection(0.5, 0.5, 0.9);
        unlisted.setJerseyNumber(99);
        Detection unnumbered = detection(0.5, 0.5, 0.9);

        FilterInput input = new FilterInput(List.of(listed, unlisted, unnumbered), 0);
        input.setRoster(List.of(new RosterEntry(10, TeamId.HOME), new RosterEntry(7, TeamId.AWAY)));
        FilterResult result = pipeline.run(input);

        assertThat(result.getPassed()).containsExactly(listed, unnumbered);
        assertThat(result.getStats().getFilteredByRoster()).isEqualTo(1);
    }

    @Test
    void color_stage_runs_only_with_both_team_colors() {
        DetectionFilterPipeline rejectAll = new DetectionFilterPipeline(config, (dets, home, away) -> new ArrayList<>());
        FilterInput input = new FilterInput(List.of(detection(0.5, 0.5, 0.9)), 0);
        input.setHomeColor("#ff0000");

        assertThat(rejectAll.run(input).getPassed()).hasSize(1);

        input.setAwayColor("#0000ff");
        FilterResult result = rejectAll.run(input);
        assertThat(result.getPassed()).isEmpty();
        assertThat(result.getStats().getFilteredByColor()).isEqualTo(1);
    }

    @Test
    void team_color_stage_drops_third_colors_and_keeps_unknown() {
        Detection red = detection(0.2, 0.5, 0.9);
        Detection blue = detection(0.4, 0.5, 0.9);
        Detection referee = detection(0.6, 0.5, 0.9);
        Detection unsampled = detection(0.8, 0.5, 0.9);
        Map<Detection, String> colors = new IdentityHashMap<>();
        colors.put(red, "#e01010");
        colors.put(blue, "#1010e0");
        colors.put(referee, "#101010");

        DetectionFilterPipeline byColor = new DetectionFilterPipeline(config,
                ColorFilterStage.teamColorMatch(colors::get, config.getColorSimilarityThreshold()));
        FilterInput input = new FilterInput(List.of(red, blue, referee, unsampled), 0);
        input.setHomeColor("#ff0000");
        input.setAwayColor("#0000ff");
        FilterResult result = byColor.run(input);

        assertThat(result.getPassed()).containsExactlyInAnyOrder(red, blue, unsampled);
        assertThat(result.getStats().getFilteredByColor()).isEqualTo(1);
    }

    @Test
    void stats_accumulate_across_frames() {
        FilterStats total = new FilterStats();
        FilterResult a = pipeline.run(new FilterInput(List.of(detection(0.5, 0.5, 0.1)), 0));
        FilterResult b = pipeline.run(new FilterInput(List.of(detection(0.5, 0.5, 0.9)), 1));
        total.add(a.getStats());
        total.add(b.getStats());

        assertThat(total.getTotalInput()).isEqualTo(2);
        assertThat(total.getPassedCount()).isEqualTo(1);
        assertThat(total.getFilteredByConfidence()).isEqualTo(1);
    }

    @Test
    void center_point_defaults_to_bbox_center() {
        Detection d = new Detection("person", new BoundingBox(0.1, 0.2, 0.2, 0.4), 0.8);
        assertThat(d.getCenter()).isEqualTo(new Point(0.2, 0.4));
    }
}
