package com.edge.match.core.filter;

import com.edge.match.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MotionHistoryTest {

    @Test
    void movement_is_sum_of_consecutive_distances() {
        List<Point> path = List.of(new Point(0, 0), new Point(3, 4), new Point(3, 4), new Point(6, 8));
        assertThat(MotionHistory.calculateMovement(path)).isCloseTo(10, within(1e-9));
    }

    @Test
    void empty_and_single_point_paths_do_not_move() {
        assertThat(MotionHistory.calculateMovement(List.of())).isZero();
        assertThat(MotionHistory.calculateMovement(List.of(new Point(5, 5)))).isZero();
    }

    @Test
    void entries_outside_window_are_trimmed() {
        MotionHistory history = new MotionHistory();
        history.record("t1", new Point(0, 0), 1, 30);
        history.record("t1", new Point(10, 0), 10, 30);
        assertThat(history.frameNumbers("t1")).containsExactly(1, 10);

        history.record("t1", new Point(20, 0), 50, 30);

        assertThat(history.frameNumbers("t1")).containsExactly(50);
        assertThat(history.movement("t1")).isZero();
    }

    @Test
    void stale_tracks_are_pruned() {
        MotionHistory history = new MotionHistory();
        history.record("old", new Point(0, 0), 0, 30);
        history.record("recent", new Point(0, 0), 80, 30);

        assertThat(history.pruneStale(100, 90)).isEqualTo(1);
        assertThat(history.hasHistory("old")).isFalse();
        assertThat(history.hasHistory("recent")).isTrue();
        assertThat(history.size()).isEqualTo(1);
    }
}
