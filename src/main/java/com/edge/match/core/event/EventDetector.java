package com.edge.match.core.event;

import com.edge.match.model.BallDetection;
import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import com.edge.match.model.Track;
import com.edge.match.model.TrackFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 事件推断引擎
 * <p>
 * 流程：
 * 1. 逐帧判定控球球员
 * 2. 合并为控球段
 * 3. 由相邻控球段推断传球、球权转换
 * 4. 由单个控球段推断带球
 * 5. 提取需人工复核的事件
 * <p>
 * 所有坐标为归一化屏幕坐标，无内部状态，可重复调用
 */
public class EventDetector {
    private static final Logger logger = LoggerFactory.getLogger(EventDetector.class);

    private final EventDetectionConfig config;

    public EventDetector(EventDetectionConfig config) {
        this.config = config != null ? config : new EventDetectionConfig();
    }

    public EventDetectionConfig getConfig() {
        return config;
    }

    // ==================== 控球判定 ====================

    /**
     * 在指定帧查找离球最近的球员
     *
     * @return 该帧没有任何轨迹数据时返回 null
     */
    public static PlayerProximity findClosestPlayer(Point ball, Collection<Track> tracks, int frameNumber) {
        if (ball == null || tracks == null) {
            return null;
        }
        PlayerProximity closest = null;
        for (Track track : tracks) {
            TrackFrame frame = track.getFrame(frameNumber);
            if (frame == null || frame.getCenter() == null) {
                continue;
            }
            double distance = ball.distanceTo(frame.getCenter());
            if (closest == null || distance < closest.getDistance()) {
                closest = new PlayerProximity(track.getTrackId(), frame.getCenter(), distance, track.getTeamId());
            }
        }
        return closest;
    }

    /**
     * 逐帧判定控球
     *
     * @param ballFrames   帧号 → 足球检测
     * @param frameNumbers 需判定的帧号（升序）
     */
    public List<FramePossession> detectFramePossessions(Collection<Track> tracks,
                                                        Map<Integer, BallDetection> ballFrames,
                                                        List<Integer> frameNumbers) {
        List<FramePossession> possessions = new ArrayList<>(frameNumbers.size());
        double threshold = config.getPossessionDistanceThreshold();

        for (int frameNumber : frameNumbers) {
            BallDetection ball = ballFrames.get(frameNumber);
            double timestamp = frameNumber / config.getFps();

            if (ball == null || !ball.isVisible()) {
                possessions.add(new FramePossession(frameNumber, timestamp,
                        ball != null ? ball.getPosition() : null, false,
                        null, null, null, null, 0.0));
                continue;
            }

            PlayerProximity closest = findClosestPlayer(ball.getPosition(), tracks, frameNumber);
            if (closest == null || closest.getDistance() > threshold) {
                // 球可见但无人足够近
                possessions.add(new FramePossession(frameNumber, timestamp, ball.getPosition(), true,
                        null, null, null, closest != null ? closest.getDistance() : null,
                        ball.getConfidence()));
                continue;
            }

            double proximity;
            if (threshold > 0) {
                proximity = Math.max(0, 1 - closest.getDistance() / threshold);
            } else {
                proximity = closest.getDistance() == 0 ? 1 : 0;
            }

            possessions.add(new FramePossession(frameNumber, timestamp, ball.getPosition(), true,
                    closest.getTrackId(), closest.getPosition(), closest.getTeamId(),
                    closest.getDistance(), ball.getConfidence() * proximity));
        }
        return possessions;
    }

    // ==================== 控球段 ====================

    /**
     * 单次前向扫描构建控球段
     * <p>
     * 控球球员变化或控球为空时结束当前段；段的结束帧为最后一个实际持球帧，
     * 持球帧数不足 minPossessionFrames 的段被丢弃
     *
     * @param trackPlayerMap trackId → playerId，可为空
     */
    public List<PossessionSegment> buildPossessionSegments(List<FramePossession> framePossessions,
                                                           Map<String, String> trackPlayerMap) {
        List<PossessionSegment> segments = new ArrayList<>();
        Map<String, String> players = trackPlayerMap != null ? trackPlayerMap : new HashMap<>();
        OpenSegment current = null;

        for (FramePossession fp : framePossessions) {
            if (fp.hasPossessor()) {
                if (current == null) {
                    current = new OpenSegment(fp);
                } else if (current.trackId.equals(fp.getPossessorTrackId())) {
                    current.extend(fp);
                } else {
                    emit(segments, current, players, endReasonFor(current.teamId, fp.getPossessorTeamId()));
                    current = new OpenSegment(fp);
                }
            } else if (current != null) {
                emit(segments, current, players, EndReason.LOST);
                current = null;
            }
        }

        if (current != null) {
            emit(segments, current, players, EndReason.UNKNOWN);
        }

        logger.debug("Built {} possession segments from {} frames", segments.size(), framePossessions.size());
        return segments;
    }

    private void emit(List<PossessionSegment> segments, OpenSegment open,
                      Map<String, String> players, EndReason reason) {
        if (open.frameCount < config.getMinPossessionFrames()) {
            return;
        }
        segments.add(new PossessionSegment(open.trackId, players.get(open.trackId), open.teamId,
                open.startFrame, open.endFrame, open.startTime, open.endTime,
                open.frameCount, open.confidenceSum / open.frameCount, reason));
    }

    static EndReason endReasonFor(TeamId previous, TeamId next) {
        if (previous != null && previous.isKnown() && previous == next) {
            return EndReason.PASS;
        }
        return EndReason.LOST;
    }

    private static class OpenSegment {
        final String trackId;
        final TeamId teamId;
        final int startFrame;
        final double startTime;
        int endFrame;
        double endTime;
        double confidenceSum;
        int frameCount;

        OpenSegment(FramePossession fp) {
            this.trackId = fp.getPossessorTrackId();
            this.teamId = fp.getPossessorTeamId() != null ? fp.getPossessorTeamId() : TeamId.UNKNOWN;
            this.startFrame = fp.getFrameNumber();
            this.startTime = fp.getTimestamp();
            this.endFrame = fp.getFrameNumber();
            this.endTime = fp.getTimestamp();
            this.confidenceSum = fp.getConfidence();
            this.frameCount = 1;
        }

        void extend(FramePossession fp) {
            endFrame = fp.getFrameNumber();
            endTime = fp.getTimestamp();
            confidenceSum += fp.getConfidence();
            frameCount++;
        }
    }

    // ==================== 传球 ====================

    public List<PassEvent> detectPasses(List<PossessionSegment> segments, String matchId,
                                        Map<Integer, FramePossession> possessionsByFrame) {
        List<PassEvent> passes = new ArrayList<>();

        for (int i = 0; i < segments.size() - 1; i++) {
            PossessionSegment current = segments.get(i);
            PossessionSegment next = segments.get(i + 1);
            if (current.getTrackId().equals(next.getTrackId())) {
                continue;
            }

            Point kickerPos = possessorPositionAt(possessionsByFrame, current.getEndFrame());
            Point receiverPos = possessorPositionAt(possessionsByFrame, next.getStartFrame());
            if (kickerPos == null) {
                logger.debug("Skipping pass at frame {}: kicker position unavailable", current.getEndFrame());
                continue;
            }

            PassOutcome outcome = passOutcome(current.getTeamId(), next.getTeamId());
            double outcomeConfidence = outcomeConfidence(current, next);
            double confidence = (current.getConfidence() + next.getConfidence()) / 2 * outcomeConfidence;
            boolean needsReview = confidence < config.getReviewThreshold();
            ReviewReason reviewReason = null;
            if (needsReview) {
                reviewReason = current.getConfidence() < config.getReviewThreshold()
                        ? ReviewReason.LOW_KICKER_CONFIDENCE
                        : ReviewReason.LOW_RECEIVER_CONFIDENCE;
            }

            EventParticipant receiver = outcome == PassOutcome.INCOMPLETE || receiverPos == null
                    ? null
                    : EventParticipant.of(next, receiverPos);

            passes.add(new PassEvent(eventId(matchId, "pass", current.getEndFrame()), matchId,
                    current.getEndFrame(), current.getEndTime(),
                    EventParticipant.of(current, kickerPos), receiver, outcome,
                    outcomeConfidence, confidence, needsReview, reviewReason));
        }
        return passes;
    }

    static PassOutcome passOutcome(TeamId kickerTeam, TeamId receiverTeam) {
        if (kickerTeam == receiverTeam && kickerTeam.isKnown()) {
            return PassOutcome.COMPLETE;
        }
        if (!receiverTeam.isKnown()) {
            return PassOutcome.INCOMPLETE;
        }
        return PassOutcome.INTERCEPTED;
    }

    static double outcomeConfidence(PossessionSegment current, PossessionSegment next) {
        double min = Math.min(current.getConfidence(), next.getConfidence());
        if (!current.getTeamId().isKnown() || !next.getTeamId().isKnown()) {
            return min * 0.5;
        }
        return min;
    }

    // ==================== 带球 ====================

    public List<CarryEvent> detectCarries(List<PossessionSegment> segments, String matchId,
                                          Map<Integer, FramePossession> possessionsByFrame,
                                          AttackDirection attackDirection) {
        List<CarryEvent> carries = new ArrayList<>();
        AttackDirection direction = attackDirection != null ? attackDirection : AttackDirection.NONE;

        for (PossessionSegment segment : segments) {
            List<Point> path = new ArrayList<>();
            for (int frame = segment.getStartFrame(); frame <= segment.getEndFrame(); frame++) {
                FramePossession fp = possessionsByFrame.get(frame);
                if (fp != null && segment.getTrackId().equals(fp.getPossessorTrackId())
                        && fp.getPossessorPosition() != null) {
                    path.add(fp.getPossessorPosition());
                }
            }
            if (path.size() < 2) {
                continue;
            }

            double carryIndex = 0;
            for (int i = 1; i < path.size(); i++) {
                carryIndex += path.get(i - 1).distanceTo(path.get(i));
            }
            if (carryIndex < config.getMinCarryDistance()) {
                continue;
            }

            Point start = path.get(0);
            Point end = path.get(path.size() - 1);
            double progressIndex = direction.progress(start.x, end.x);

            carries.add(new CarryEvent(eventId(matchId, "carry", segment.getStartFrame()), matchId, segment,
                    start, end, carryIndex, progressIndex));
        }
        return carries;
    }

    // ==================== 球权转换 ====================

    public List<TurnoverEvent> detectTurnovers(List<PossessionSegment> segments, String matchId,
                                               Map<Integer, FramePossession> possessionsByFrame) {
        List<TurnoverEvent> turnovers = new ArrayList<>();

        for (int i = 0; i < segments.size() - 1; i++) {
            PossessionSegment current = segments.get(i);
            PossessionSegment next = segments.get(i + 1);
            if (current.getTeamId() == next.getTeamId()
                    || !current.getTeamId().isKnown()
                    || !next.getTeamId().isKnown()) {
                continue;
            }

            Point loserPos = possessorPositionAt(possessionsByFrame, current.getEndFrame());
            Point winnerPos = possessorPositionAt(possessionsByFrame, next.getStartFrame());
            if (loserPos == null || winnerPos == null) {
                continue;
            }

            double confidence = Math.min(current.getConfidence(), next.getConfidence());
            boolean needsReview = confidence < config.getReviewThreshold();
            EventParticipant loser = EventParticipant.of(current, loserPos);
            EventParticipant winner = EventParticipant.of(next, winnerPos);

            turnovers.add(new TurnoverEvent(eventId(matchId, "turnover_lost", current.getEndFrame()), matchId,
                    TurnoverEvent.TurnoverType.LOST, current.getEndFrame(), current.getEndTime(),
                    loser, winner, confidence, needsReview));
            turnovers.add(new TurnoverEvent(eventId(matchId, "turnover_won", next.getStartFrame()), matchId,
                    TurnoverEvent.TurnoverType.WON, next.getStartFrame(), next.getStartTime(),
                    winner, loser, confidence, needsReview));
        }
        return turnovers;
    }

    // ==================== 完整流程 ====================

    /**
     * 完整的事件推断流程，帧号取自足球检测
     */
    public DetectedEvents detectAllEvents(Collection<Track> tracks, List<BallDetection> ballDetections,
                                          String matchId, AttackDirection attackDirection) {
        Map<Integer, BallDetection> ballFrames = new TreeMap<>();
        for (BallDetection ball : ballDetections) {
            ballFrames.put(ball.getFrameNumber(), ball);
        }
        if (ballFrames.isEmpty()) {
            logger.info("No ball frames for match {}, skipping event detection", matchId);
            return DetectedEvents.empty();
        }

        List<Integer> frameNumbers = new ArrayList<>(ballFrames.keySet());
        List<FramePossession> framePossessions = detectFramePossessions(tracks, ballFrames, frameNumbers);

        Map<Integer, FramePossession> possessionsByFrame = new HashMap<>();
        for (FramePossession fp : framePossessions) {
            possessionsByFrame.put(fp.getFrameNumber(), fp);
        }

        Map<String, String> trackPlayerMap = new HashMap<>();
        for (Track track : tracks) {
            trackPlayerMap.put(track.getTrackId(), track.getPlayerId());
        }

        List<PossessionSegment> segments = buildPossessionSegments(framePossessions, trackPlayerMap);
        List<PassEvent> passes = detectPasses(segments, matchId, possessionsByFrame);
        List<CarryEvent> carries = detectCarries(segments, matchId, possessionsByFrame, attackDirection);
        List<TurnoverEvent> turnovers = detectTurnovers(segments, matchId, possessionsByFrame);

        logger.info("Match {}: {} segments, {} passes, {} carries, {} turnovers",
                matchId, segments.size(), passes.size(), carries.size(), turnovers.size());
        return new DetectedEvents(segments, passes, carries, turnovers);
    }

    // ==================== 人工复核 ====================

    /**
     * 提取需复核事件，每个物理事件只产生一条记录（球权转换只保留 LOST 一侧）
     */
    public List<PendingReview> extractPendingReviews(DetectedEvents events) {
        double threshold = config.getReviewThreshold();
        List<PendingReview> reviews = new ArrayList<>();

        for (PassEvent pass : events.getPassEvents()) {
            if (!pass.isNeedsReview()) {
                continue;
            }
            List<ReviewCandidate> candidates = new ArrayList<>();
            candidates.add(candidateOf(pass.getKicker()));
            if (pass.getReceiver() != null) {
                candidates.add(candidateOf(pass.getReceiver()));
            }
            reviews.add(new PendingReview(pass.getEventId(), "pass", passReviewReason(pass, threshold), candidates));
        }

        for (CarryEvent carry : events.getCarryEvents()) {
            if (carry.getConfidence() >= threshold) {
                continue;
            }
            reviews.add(new PendingReview(carry.getEventId(), "carry", ReviewReason.LOW_CONFIDENCE, null));
        }

        for (TurnoverEvent turnover : events.getTurnoverEvents()) {
            if (!turnover.isNeedsReview() || turnover.getTurnoverType() == TurnoverEvent.TurnoverType.WON) {
                continue;
            }
            reviews.add(new PendingReview(turnover.getEventId(), "turnover", ReviewReason.LOW_CONFIDENCE, null));
        }
        return reviews;
    }

    static ReviewReason passReviewReason(PassEvent pass, double threshold) {
        if (pass.getKicker().getConfidence() < threshold) {
            return ReviewReason.LOW_CONFIDENCE;
        }
        if (pass.getReceiver() != null && pass.getReceiver().getConfidence() < threshold) {
            return ReviewReason.LOW_CONFIDENCE;
        }
        if (pass.getOutcomeConfidence() < threshold) {
            return ReviewReason.AMBIGUOUS_PLAYER;
        }
        return ReviewReason.LOW_CONFIDENCE;
    }

    private static ReviewCandidate candidateOf(EventParticipant participant) {
        return new ReviewCandidate(participant.getTrackId(), participant.getPlayerId(), participant.getConfidence());
    }

    // ==================== 工具 ====================

    private static Point possessorPositionAt(Map<Integer, FramePossession> possessionsByFrame, int frame) {
        FramePossession fp = possessionsByFrame.get(frame);
        return fp != null ? fp.getPossessorPosition() : null;
    }

    /**
     * 事件 ID：matchId_type_frame，同一输入总是得到相同的 ID
     */
    static String eventId(String matchId, String type, int frameNumber) {
        return matchId + "_" + type + "_" + frameNumber;
    }
}
