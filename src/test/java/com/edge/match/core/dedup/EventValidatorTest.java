package com.edge.match.core.dedup;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventValidatorTest {

    private final EventValidator validator = new EventValidator(new ValidationConfig());

    private static DeduplicatedEvent event(double timestamp, EventType type, TeamId team) {
        DeduplicatedEvent event = new DeduplicatedEvent();
        event.setAbsoluteTimestamp(timestamp);
        event.setType(type);
        event.setTeam(team);
        event.setAdjustedConfidence(0.8);
        return event;
    }

    private static DeduplicatedEvent at(DeduplicatedEvent event, double x, double y) {
        event.setMergedPosition(new Point(x, y));
        return event;
    }

    @Test
    void duplicate_timestamp_is_an_error() {
        List<DeduplicatedEvent> events = Arrays.asList(
                event(12.0, EventType.PASS, TeamId.HOME),
                event(12.0, EventType.PASS, TeamId.HOME));

        ValidationResult result = validator.validate(events);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(1);
        ValidationIssue error = result.getErrors().get(0);
        assertThat(error.getCategory()).isEqualTo(ValidationIssue.Category.TEMPORAL);
        assertThat(error.getEventIndex()).isEqualTo(1);
        assertThat(error.getRelatedEventIndex()).isEqualTo(0);
        assertThat(error.getSeverity()).isNull();
    }

    @Test
    void short_interval_by_same_team_warns_unless_sequence_is_valid() {
        ValidationResult warned = validator.validateTemporal(Arrays.asList(
                event(5.0, EventType.PASS, TeamId.HOME),
                event(5.2, EventType.PASS, TeamId.HOME)));
        ValidationResult allowed = validator.validateTemporal(Arrays.asList(
                event(5.0, EventType.PASS, TeamId.HOME),
                event(5.2, EventType.SHOT, TeamId.HOME)));

        assertThat(warned.getWarnings()).hasSize(1);
        assertThat(warned.getWarnings().get(0).getSeverity()).isEqualTo(ValidationIssue.Severity.LOW);
        assertThat(allowed.getWarnings()).isEmpty();
    }

    @Test
    void completed_pass_followed_by_opponent_action_warns() {
        DeduplicatedEvent pass = event(10.0, EventType.PASS, TeamId.HOME);
        pass.getDetails().put("outcome", "complete");

        ValidationResult result = validator.validateLogical(Arrays.asList(
                pass, event(12.0, EventType.SHOT, TeamId.AWAY)));

        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0).getCategory()).isEqualTo(ValidationIssue.Category.LOGICAL);
        assertThat(result.getWarnings().get(0).getSeverity()).isEqualTo(ValidationIssue.Severity.MEDIUM);
    }

    @Test
    void unknown_team_never_triggers_possession_checks() {
        DeduplicatedEvent pass = event(10.0, EventType.PASS, TeamId.HOME);
        pass.getDetails().put("outcome", "complete");

        ValidationResult result = validator.validateLogical(Arrays.asList(
                pass, event(12.0, EventType.SHOT, TeamId.UNKNOWN)));

        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void intercepted_pass_followed_by_same_team_warns() {
        DeduplicatedEvent pass = event(10.0, EventType.PASS, TeamId.AWAY);
        pass.getDetails().put("outcome", "intercepted");

        ValidationResult result = validator.validateLogical(Arrays.asList(
                pass, event(11.0, EventType.CARRY, TeamId.AWAY)));

        assertThat(result.getWarnings()).hasSize(1);
    }

    @Test
    void goal_without_kickoff_warns() {
        DeduplicatedEvent goal = event(60.0, EventType.SHOT, TeamId.HOME);
        goal.getDetails().put("shotResult", "goal");

        ValidationResult missing = validator.validateLogical(Arrays.asList(
                goal, event(70.0, EventType.PASS, TeamId.AWAY)));
        ValidationResult kickoff = validator.validateLogical(Arrays.asList(
                goal, event(70.0, EventType.SET_PIECE, TeamId.AWAY)));

        assertThat(missing.getWarnings()).extracting(ValidationIssue::getMessage)
                .containsExactly("Goal scored but no kickoff detected within 30 seconds");
        assertThat(kickoff.getWarnings()).isEmpty();
    }

    @Test
    void impossible_movement_warns_with_severity() {
        // 半场长度 52.5 米
        ValidationResult medium = validator.validatePositional(Arrays.asList(
                at(event(0.0, EventType.CARRY, TeamId.HOME), 0.0, 0.5),
                at(event(3.0, EventType.CARRY, TeamId.HOME), 0.5, 0.5)));
        ValidationResult high = validator.validatePositional(Arrays.asList(
                at(event(0.0, EventType.CARRY, TeamId.HOME), 0.0, 0.5),
                at(event(1.0, EventType.CARRY, TeamId.HOME), 0.5, 0.5)));

        assertThat(medium.getWarnings()).hasSize(1);
        assertThat(medium.getWarnings().get(0).getSeverity()).isEqualTo(ValidationIssue.Severity.MEDIUM);
        assertThat(high.getWarnings().get(0).getSeverity()).isEqualTo(ValidationIssue.Severity.HIGH);
    }

    @Test
    void zone_and_default_positions_are_not_speed_checked() {
        DeduplicatedEvent zone = at(event(0.0, EventType.CARRY, TeamId.HOME), 0.0, 0.5);
        zone.setPositionSource(PositionSource.ZONE_CONVERSION);
        DeduplicatedEvent centre = at(event(1.0, EventType.CARRY, TeamId.HOME), 0.5, 0.5);
        centre.setPositionSource(PositionSource.UNKNOWN);
        DeduplicatedEvent observed = at(event(2.0, EventType.CARRY, TeamId.HOME), 1.0, 0.5);
        observed.setPositionSource(PositionSource.MODEL_OUTPUT);

        ValidationResult result = validator.validatePositional(Arrays.asList(zone, centre, observed));

        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void fast_movement_after_same_team_pass_is_allowed() {
        ValidationResult result = validator.validatePositional(Arrays.asList(
                at(event(0.0, EventType.PASS, TeamId.HOME), 0.0, 0.5),
                at(event(1.0, EventType.CARRY, TeamId.HOME), 0.5, 0.5)));

        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void disabled_warnings_keep_errors() {
        ValidationConfig config = new ValidationConfig();
        config.setEnableWarnings(false);
        EventValidator quiet = new EventValidator(config);

        ValidationResult result = quiet.validate(Arrays.asList(
                at(event(0.0, EventType.PASS, TeamId.HOME), 0.0, 0.5),
                at(event(0.0, EventType.PASS, TeamId.HOME), 0.0, 0.5),
                at(event(0.2, EventType.CARRY, TeamId.AWAY), 0.9, 0.5)));

        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getErrors()).hasSize(1);
    }

    @Test
    void validation_sorts_by_timestamp_first() {
        ValidationResult result = validator.validate(Arrays.asList(
                event(20.0, EventType.CARRY, TeamId.HOME),
                event(5.0, EventType.PASS, TeamId.AWAY)));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
        assertThat(validator.validate(Collections.emptyList()).summary()).startsWith("Validation PASSED");
    }
}
