package com.edge.match.core.dedup;

import com.edge.match.model.TeamId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 去重后事件的一致性校验
 * <p>
 * 三项独立检查，结果取并集：
 * - 时间：重复事件（错误）、同队事件间隔过短（警告）
 * - 逻辑：传球结果与后续控球队伍不一致、进球后缺少开球
 * - 位置：相邻事件位移所需速度超过冲刺速度
 * <p>
 * 事件下标指按时间排序后的位置
 */
public class EventValidator {

    static final double KICKOFF_WINDOW_SECONDS = 30.0;

    private static final List<EventType[]> VALID_SHORT_SEQUENCES = Arrays.asList(
            new EventType[]{EventType.PASS, EventType.SHOT},
            new EventType[]{EventType.CARRY, EventType.PASS},
            new EventType[]{EventType.CARRY, EventType.SHOT},
            new EventType[]{EventType.SET_PIECE, EventType.PASS},
            new EventType[]{EventType.SET_PIECE, EventType.SHOT}
    );

    private final ValidationConfig config;

    public EventValidator(ValidationConfig config) {
        this.config = config != null ? config : new ValidationConfig();
    }

    public ValidationResult validate(List<DeduplicatedEvent> events) {
        return ValidationResult.union(
                validateTemporal(events),
                validateLogical(events),
                validatePositional(events));
    }

    // ==================== 时间 ====================

    public ValidationResult validateTemporal(List<DeduplicatedEvent> events) {
        List<ValidationIssue> warnings = new ArrayList<>();
        List<ValidationIssue> errors = new ArrayList<>();
        List<DeduplicatedEvent> sorted = sorted(events);

        for (int i = 1; i < sorted.size(); i++) {
            DeduplicatedEvent prev = sorted.get(i - 1);
            DeduplicatedEvent curr = sorted.get(i);
            double timeDiff = curr.getAbsoluteTimestamp() - prev.getAbsoluteTimestamp();

            if (timeDiff == 0 && prev.getType() == curr.getType() && prev.getTeam() == curr.getTeam()) {
                errors.add(new ValidationIssue(ValidationIssue.Category.TEMPORAL,
                        String.format("Duplicate event at timestamp %.2f: same type (%s) and team (%s)",
                                curr.getAbsoluteTimestamp(), curr.getType().getCode(), curr.getTeam()),
                        i, i - 1, null));
                continue;
            }

            if (timeDiff > 0 && timeDiff < config.getMinEventInterval()
                    && prev.getTeam() == curr.getTeam()
                    && !isValidShortSequence(prev.getType(), curr.getType())
                    && config.isEnableWarnings()) {
                warnings.add(new ValidationIssue(ValidationIssue.Category.TEMPORAL,
                        String.format("Short interval (%.2fs) between %s and %s by same team",
                                timeDiff, prev.getType().getCode(), curr.getType().getCode()),
                        i, i - 1, ValidationIssue.Severity.LOW));
            }
        }
        return new ValidationResult(warnings, errors);
    }

    /**
     * 只有观测得到的位置参与速度检查，区域中心和默认中心点不算
     */
    static boolean hasFieldPosition(DeduplicatedEvent event) {
        return event.getMergedPosition() != null
                && event.getPositionSource() != PositionSource.UNKNOWN
                && event.getPositionSource() != PositionSource.ZONE_CONVERSION;
    }

    static boolean isValidShortSequence(EventType prev, EventType curr) {
        for (EventType[] sequence : VALID_SHORT_SEQUENCES) {
            if (sequence[0] == prev && sequence[1] == curr) {
                return true;
            }
        }
        return false;
    }

    // ==================== 逻辑 ====================

    public ValidationResult validateLogical(List<DeduplicatedEvent> events) {
        List<ValidationIssue> warnings = new ArrayList<>();
        if (!config.isEnableWarnings()) {
            return new ValidationResult(warnings, new ArrayList<>());
        }
        List<DeduplicatedEvent> sorted = sorted(events);

        for (int i = 1; i < sorted.size(); i++) {
            DeduplicatedEvent prev = sorted.get(i - 1);
            DeduplicatedEvent event = sorted.get(i);

            if (prev.getType() == EventType.PASS && "complete".equals(prev.detail("outcome"))
                    && event.getType() != EventType.TURNOVER
                    && isOpponent(prev.getTeam(), event.getTeam())) {
                warnings.add(new ValidationIssue(ValidationIssue.Category.LOGICAL,
                        String.format("Completed pass by %s followed by %s by %s without turnover",
                                prev.getTeam(), event.getType().getCode(), event.getTeam()),
                        i, i - 1, ValidationIssue.Severity.MEDIUM));
            }

            if (prev.getType() == EventType.PASS && "intercepted".equals(prev.detail("outcome"))
                    && event.getType() != EventType.TURNOVER
                    && event.getTeam() == prev.getTeam()) {
                warnings.add(new ValidationIssue(ValidationIssue.Category.LOGICAL,
                        String.format("Intercepted pass followed by same team (%s) action without possession change",
                                event.getTeam()),
                        i, i - 1, ValidationIssue.Severity.MEDIUM));
            }

            if (prev.getType() == EventType.SHOT && "goal".equals(prev.detail("shotResult"))) {
                double sinceGoal = event.getAbsoluteTimestamp() - prev.getAbsoluteTimestamp();
                if (sinceGoal < KICKOFF_WINDOW_SECONDS && event.getType() != EventType.SET_PIECE) {
                    warnings.add(new ValidationIssue(ValidationIssue.Category.LOGICAL,
                            "Goal scored but no kickoff detected within 30 seconds",
                            i, i - 1, ValidationIssue.Severity.LOW));
                }
            }
        }
        return new ValidationResult(warnings, new ArrayList<>());
    }

    private static boolean isOpponent(TeamId a, TeamId b) {
        return a != null && a.isKnown() && b != null && b.isKnown() && a != b;
    }

    // ==================== 位置 ====================

    public ValidationResult validatePositional(List<DeduplicatedEvent> events) {
        List<ValidationIssue> warnings = new ArrayList<>();
        List<DeduplicatedEvent> sorted = sorted(events);

        for (int i = 1; i < sorted.size(); i++) {
            DeduplicatedEvent prev = sorted.get(i - 1);
            DeduplicatedEvent curr = sorted.get(i);
            if (!hasFieldPosition(prev) || !hasFieldPosition(curr)) {
                continue;
            }
            double timeDiff = curr.getAbsoluteTimestamp() - prev.getAbsoluteTimestamp();
            if (timeDiff <= 0) {
                continue;
            }

            double distance = ZoneMapper.distanceMeters(prev.getMergedPosition(), curr.getMergedPosition());
            double speed = distance / timeDiff;
            if (speed <= config.getMaxMovementSpeed()) {
                continue;
            }
            // 传球后球的移动速度可以超过球员
            if (prev.getType() == EventType.PASS && prev.getTeam() == curr.getTeam()) {
                continue;
            }
            if (config.isEnableWarnings()) {
                ValidationIssue.Severity severity = speed > config.getMaxMovementSpeed() * 2
                        ? ValidationIssue.Severity.HIGH
                        : ValidationIssue.Severity.MEDIUM;
                warnings.add(new ValidationIssue(ValidationIssue.Category.POSITIONAL,
                        String.format("Impossible movement: %.1fm in %.2fs (%.1f m/s required)",
                                distance, timeDiff, speed),
                        i, i - 1, severity));
            }
        }
        return new ValidationResult(warnings, new ArrayList<>());
    }

    private static List<DeduplicatedEvent> sorted(List<DeduplicatedEvent> events) {
        List<DeduplicatedEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingDouble(DeduplicatedEvent::getAbsoluteTimestamp));
        return sorted;
    }
}
