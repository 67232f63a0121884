package com.edge.match.core.dedup;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EventDeduplicatorTest {

    private final EventDeduplicator deduplicator = new EventDeduplicator(new DeduplicationConfig());

    private static RawEvent event(String window, double timestamp, EventType type, TeamId team, double confidence) {
        RawEvent event = new RawEvent();
        event.setMatchId("m1");
        event.setWindowId(window);
        event.setAbsoluteTimestamp(timestamp);
        event.setType(type);
        event.setTeam(team);
        event.setConfidence(confidence);
        return event;
    }

    @Test
    void overlapping_detections_merge_into_one_event() {
        List<RawEvent> raw = Arrays.asList(
                event("w1", 10.0, EventType.PASS, TeamId.HOME, 0.8),
                event("w2", 10.5, EventType.PASS, TeamId.HOME, 0.7));

        List<DeduplicatedEvent> result = deduplicator.deduplicate(raw);

        assertThat(result).hasSize(1);
        DeduplicatedEvent merged = result.get(0);
        assertThat(merged.getClusterSize()).isEqualTo(2);
        assertThat(merged.isMerged()).isTrue();
        assertThat(merged.getMergedFromWindows()).containsExactly("w1", "w2");
        assertThat(merged.getConfidence()).isEqualTo(0.8);
        assertThat(merged.getAdjustedConfidence()).isCloseTo(0.82, within(1e-9));
        assertThat(merged.getAbsoluteTimestamp()).isCloseTo((10.0 * 0.8 + 10.5 * 0.7) / 1.5, within(1e-9));
    }

    @Test
    void same_window_repeats_do_not_boost_confidence() {
        List<RawEvent> raw = Arrays.asList(
                event("w1", 10.0, EventType.PASS, TeamId.HOME, 0.6),
                event("w1", 10.2, EventType.PASS, TeamId.HOME, 0.5));

        DeduplicatedEvent merged = deduplicator.deduplicate(raw).get(0);

        assertThat(merged.getMergedFromWindows()).containsExactly("w1");
        assertThat(merged.getAdjustedConfidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void different_team_or_type_stays_separate() {
        List<RawEvent> raw = Arrays.asList(
                event("w1", 10.0, EventType.PASS, TeamId.HOME, 0.8),
                event("w2", 10.1, EventType.PASS, TeamId.AWAY, 0.8),
                event("w2", 10.2, EventType.SHOT, TeamId.AWAY, 0.8));

        assertThat(deduplicator.deduplicate(raw)).hasSize(3);
    }

    @Test
    void events_beyond_type_radius_stay_separate() {
        // SHOT 半径 1 秒
        List<RawEvent> raw = Arrays.asList(
                event("w1", 10.0, EventType.SHOT, TeamId.HOME, 0.8),
                event("w2", 11.5, EventType.SHOT, TeamId.HOME, 0.8));

        assertThat(deduplicator.deduplicate(raw)).hasSize(2);
    }

    @Test
    void clustering_chains_against_last_member() {
        List<RawEvent> raw = Arrays.asList(
                event("w3", 3.6, EventType.PASS, TeamId.HOME, 0.7),
                event("w1", 0.0, EventType.PASS, TeamId.HOME, 0.7),
                event("w2", 1.8, EventType.PASS, TeamId.HOME, 0.7));

        List<List<RawEvent>> clusters = deduplicator.cluster(raw);

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0)).extracting(RawEvent::getWindowId).containsExactly("w1", "w2", "w3");
    }

    @Test
    void output_never_exceeds_input() {
        List<RawEvent> raw = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            EventType type = EventType.values()[i % EventType.values().length];
            TeamId team = i % 2 == 0 ? TeamId.HOME : TeamId.AWAY;
            raw.add(event("w" + (i % 3), i * 0.7, type, team, 0.5 + (i % 5) * 0.1));
        }

        List<DeduplicatedEvent> result = deduplicator.deduplicate(raw);

        assertThat(result.size()).isLessThanOrEqualTo(raw.size());
        assertThat(result.stream().mapToInt(DeduplicatedEvent::getClusterSize).sum()).isEqualTo(raw.size());
        assertThat(result).allSatisfy(e -> assertThat(e.getAdjustedConfidence()).isBetween(0.0, 1.0));
    }

    @Test
    void details_take_majority_and_keep_goal() {
        RawEvent a = event("w1", 5.0, EventType.SHOT, TeamId.HOME, 0.9);
        a.getDetails().put("shotResult", "saved");
        a.getDetails().put("bodyPart", "left_foot");
        RawEvent b = event("w2", 5.2, EventType.SHOT, TeamId.HOME, 0.6);
        b.getDetails().put("shotResult", "saved");
        b.getDetails().put("bodyPart", "right_foot");
        RawEvent c = event("w3", 5.4, EventType.SHOT, TeamId.HOME, 0.5);
        c.getDetails().put("shotResult", "goal");
        c.getDetails().put("bodyPart", "right_foot");

        DeduplicatedEvent merged = deduplicator.deduplicate(Arrays.asList(a, b, c)).get(0);

        assertThat(merged.detail("bodyPart")).isEqualTo("right_foot");
        assertThat(merged.detail("shotResult")).isEqualTo("goal");
    }

    @Test
    void merged_position_is_confidence_weighted() {
        RawEvent a = event("w1", 20.0, EventType.CARRY, TeamId.AWAY, 0.8);
        a.setPosition(new Point(0.4, 0.5));
        a.setPositionConfidence(0.6);
        RawEvent b = event("w2", 20.5, EventType.CARRY, TeamId.AWAY, 0.7);
        b.setPosition(new Point(0.6, 0.5));
        b.setPositionConfidence(0.2);

        DeduplicatedEvent merged = deduplicator.deduplicate(Arrays.asList(a, b)).get(0);

        assertThat(merged.getMergedPosition().x).isCloseTo(0.45, within(1e-9));
        assertThat(merged.getPositionSource()).isEqualTo(PositionSource.MERGED);
        assertThat(merged.getMergedPositionConfidence()).isCloseTo(0.45, within(1e-9));
    }

    @Test
    void empty_input_gives_empty_output() {
        assertThat(deduplicator.deduplicate(Collections.emptyList())).isEmpty();
    }

    @Test
    void malformed_input_is_rejected() {
        assertThatThrownBy(() -> deduplicator.deduplicate(null))
                .isInstanceOf(IllegalArgumentException.class);

        RawEvent missingType = event("w1", 1.0, null, TeamId.HOME, 0.5);
        assertThatThrownBy(() -> deduplicator.deduplicate(Arrays.asList(
                event("w1", 0.5, EventType.PASS, TeamId.HOME, 0.5), missingType)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1");

        assertThatThrownBy(() -> deduplicator.deduplicate(Collections.singletonList(
                event("w1", 1.0, EventType.PASS, TeamId.HOME, 1.5))))
                .hasMessageContaining("confidence");

        assertThatThrownBy(() -> deduplicator.deduplicate(Collections.singletonList(
                event("w1", -1.0, EventType.PASS, TeamId.HOME, 0.5))))
                .hasMessageContaining("timestamp");
    }

    @Test
    void stats_count_merged_and_unique() {
        List<RawEvent> raw = Arrays.asList(
                event("w1", 10.0, EventType.PASS, TeamId.HOME, 0.8),
                event("w2", 10.5, EventType.PASS, TeamId.HOME, 0.7),
                event("w2", 30.0, EventType.TURNOVER, TeamId.AWAY, 0.6));

        List<DeduplicatedEvent> result = deduplicator.deduplicate(raw);
        DeduplicationStats stats = EventDeduplicator.stats(raw, result);

        assertThat(stats.getTotalRawEvents()).isEqualTo(3);
        assertThat(stats.getTotalDeduplicatedEvents()).isEqualTo(2);
        assertThat(stats.getMergedCount()).isEqualTo(1);
        assertThat(stats.getUniqueCount()).isEqualTo(1);
        assertThat(stats.getAverageClusterSize()).isEqualTo(2.0);
        assertThat(stats.getByType().get(EventType.PASS).getRaw()).isEqualTo(2);
        assertThat(stats.getByType().get(EventType.PASS).getMergedCount()).isEqualTo(1);
    }

    @Test
    void boosted_confidence_is_capped() {
        assertThat(EventDeduplicator.boostedConfidence(0.95, 20, 0.1)).isEqualTo(1.0);
        assertThat(EventDeduplicator.boostedConfidence(0.5, 3, 0.1)).isCloseTo(0.6, within(1e-9));
    }
}
