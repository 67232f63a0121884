package com.edge.match.service;

import com.edge.match.config.YamlConfig;
import com.edge.match.context.MatchAnalysisContext;
import com.edge.match.core.event.AttackDirection;
import com.edge.match.core.event.DetectedEvents;
import com.edge.match.core.event.EventDetector;
import com.edge.match.core.filter.DetectionFilterPipeline;
import com.edge.match.core.filter.FilterInput;
import com.edge.match.core.filter.FilterResult;
import com.edge.match.core.filter.RosterEntry;
import com.edge.match.core.team.ColorSample;
import com.edge.match.core.team.ColorUtils;
import com.edge.match.core.team.TeamClassificationResult;
import com.edge.match.core.team.TeamClassifier;
import com.edge.match.core.team.TrackTeamMeta;
import com.edge.match.core.tracking.BallTrackSmoother;
import com.edge.match.core.transform.HomographyEstimator;
import com.edge.match.dto.AnalysisRequest;
import com.edge.match.dto.BallDetectionDto;
import com.edge.match.dto.DetectionDto;
import com.edge.match.dto.FrameDto;
import com.edge.match.dto.HomographyDto;
import com.edge.match.dto.KeypointDto;
import com.edge.match.dto.MatchAnalysisResult;
import com.edge.match.dto.RosterEntryDto;
import com.edge.match.exception.DetectionException;
import com.edge.match.model.BallDetection;
import com.edge.match.model.BallTrack;
import com.edge.match.model.Detection;
import com.edge.match.model.FieldSize;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import com.edge.match.model.HomographyKeypoint;
import com.edge.match.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 比赛分析服务
 * <p>
 * 每次调用创建独立的 MatchAnalysisContext：
 * 1. 逐帧跟踪并过滤检测，累积轨迹与球衣颜色采样
 * 2. 平滑足球轨迹
 * 3. 队伍分类并写回轨迹
 * 4. 事件推断与复核提取
 */
@Service
public class MatchAnalysisService {
    private static final Logger logger = LoggerFactory.getLogger(MatchAnalysisService.class);

    static final String INPUT_BALL_MODEL = "input";

    @Autowired
    private YamlConfig config;

    @Autowired
    private DetectionFilterPipeline filterPipeline;

    @Autowired
    private TeamClassifier teamClassifier;

    @Autowired
    private BallTrackSmoother ballTrackSmoother;

    @Autowired
    private EventDetector eventDetector;

    @Autowired
    private HomographyEstimator homographyEstimator;

    /**
     * @throws IllegalArgumentException 请求结构不合法
     * @throws DetectionException       跟踪或分类阶段失败
     */
    public MatchAnalysisResult analyze(AnalysisRequest request) {
        if (request == null || request.getMatchId() == null || request.getMatchId().isBlank()) {
            throw new IllegalArgumentException("matchId is required");
        }
        if (request.getGameFormat() == null) {
            request.setGameFormat(GameFormat.ELEVEN);
        }
        long startTime = System.currentTimeMillis();
        double fps = config.getEvents().getFps();
        YamlConfig.TrackingConfig tracking = config.getTracking();

        MatchAnalysisContext context = new MatchAnalysisContext(request.getMatchId(),
                config.getPrediction(), tracking.getIouThreshold(), tracking.getMaxAge());
        HomographyData homography = toHomography(request.getHomography(), request.getGameFormat().fieldSize());
        List<RosterEntry> roster = new ArrayList<>();
        for (RosterEntryDto entry : request.getRoster()) {
            roster.add(entry.toEntry());
        }

        // 1. 跟踪与过滤
        List<FrameDto> frames = new ArrayList<>(request.getFrames());
        frames.sort(Comparator.comparingInt(FrameDto::getFrameNumber));
        try {
            for (FrameDto frame : frames) {
                processFrame(context, frame, fps, homography, roster, request);
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DetectionException(DetectionException.Stage.TRACKING,
                    "Tracking failed for match " + request.getMatchId() + ": " + e.getMessage(), false, e);
        }

        // 2. 足球轨迹
        List<BallDetection> rawBall = new ArrayList<>();
        for (BallDetectionDto dto : request.getBallDetections()) {
            rawBall.add(dto.toBallDetection(fps));
        }
        BallTrack ballTrack = ballTrackSmoother.smooth(rawBall, INPUT_BALL_MODEL);

        // 3. 队伍分类
        boolean userHint = request.getHomeColor() != null && request.getAwayColor() != null;
        TeamClassificationResult teams;
        List<TrackTeamMeta> metas;
        try {
            teams = teamClassifier.classify(context.getColorSamples(), request.getHomeColor(), request.getAwayColor());
            metas = teamClassifier.toTrackMetas(context.getColorSamples(), teams, userHint);
        } catch (RuntimeException e) {
            throw new DetectionException(DetectionException.Stage.CLASSIFICATION,
                    "Team classification failed for match " + request.getMatchId() + ": " + e.getMessage(), false, e);
        }
        for (TrackTeamMeta meta : metas) {
            Track track = context.getTrack(meta.getTrackId());
            if (track != null) {
                track.setTeamId(meta.getTeamId());
            }
        }

        // 4. 事件推断
        AttackDirection direction = AttackDirection.parse(request.getAttackDirection());
        DetectedEvents events = eventDetector.detectAllEvents(context.getTracks(), ballTrack.getDetections(),
                request.getMatchId(), direction);

        MatchAnalysisResult result = new MatchAnalysisResult();
        result.setMatchId(request.getMatchId());
        result.setTrackerId(context.getTracker().getTrackerId());
        result.setFramesProcessed(context.getFramesProcessed());
        result.setTrackCount(context.getTracks().size());
        result.setPossessionSegments(events.getPossessionSegments());
        result.setPassEvents(events.getPassEvents());
        result.setCarryEvents(events.getCarryEvents());
        result.setTurnoverEvents(events.getTurnoverEvents());
        result.setPendingReviews(eventDetector.extractPendingReviews(events));
        result.setTeamMetas(metas);
        result.setTeamConfidence(teams.getConfidence());
        result.setHomeColor(teams.getHomeColor());
        result.setAwayColor(teams.getAwayColor());
        result.setRefereeColor(teams.getRefereeColor());
        result.getBall().setModelId(ballTrack.getModelId());
        result.getBall().setAvgConfidence(ballTrack.getAvgConfidence());
        result.getBall().setVisibilityRate(ballTrack.getVisibilityRate());
        result.getBall().setDetections(ballTrack.getDetections());
        result.setFilterStats(context.getFilterStats());

        logger.info("Match {} analyzed in {} ms: frames={}, tracks={}, events={}, reviews={}",
                request.getMatchId(), System.currentTimeMillis() - startTime, context.getFramesProcessed(),
                context.getTracks().size(), events.totalEvents(), result.getPendingReviews().size());
        return result;
    }

    private void processFrame(MatchAnalysisContext context, FrameDto frame, double fps,
                              HomographyData homography, List<RosterEntry> roster, AnalysisRequest request) {
        double timestamp = frame.getTimestamp() != null ? frame.getTimestamp() : frame.getFrameNumber() / fps;

        List<Detection> detections = new ArrayList<>();
        Map<Detection, String> jerseyColors = new IdentityHashMap<>();
        for (DetectionDto dto : frame.getDetections()) {
            Detection detection = dto.toDetection();
            detections.add(detection);
            if (dto.getJerseyColor() != null) {
                jerseyColors.put(detection, dto.getJerseyColor());
            }
        }

        context.getTracker().update(frame.getFrameNumber(), timestamp, detections);

        FilterInput input = new FilterInput(detections, frame.getFrameNumber());
        input.setGameFormat(request.getGameFormat());
        input.setHomography(homography);
        input.setMotionHistory(context.getMotionHistory());
        input.setRoster(roster);
        input.setHomeColor(request.getHomeColor());
        input.setAwayColor(request.getAwayColor());
        FilterResult filtered = filterPipeline.run(input);

        context.appendToTracks(frame.getFrameNumber(), timestamp, filtered.getPassed());
        for (Detection detection : filtered.getPassed()) {
            String color = jerseyColors.get(detection);
            if (color != null) {
                context.addColorSample(new ColorSample(detection.getTrackId(), ColorUtils.hexToRgb(color),
                        detection.getCenter()));
            }
        }
        context.recordFrame(filtered.getStats());

        context.getMotionHistory().pruneStale(frame.getFrameNumber(), config.getFilter().getStaleTrackFrames());
        context.getPredictor().pruneStale(timestamp);
    }

    /**
     * 请求中的单应性：优先使用矩阵，否则由关键点估计
     */
    HomographyData toHomography(HomographyDto dto, FieldSize fieldSize) {
        if (dto == null) {
            return null;
        }
        List<HomographyKeypoint> keypoints = new ArrayList<>();
        for (KeypointDto keypoint : dto.getKeypoints()) {
            keypoints.add(keypoint.toKeypoint(fieldSize));
        }
        if (dto.getMatrix() != null) {
            return new HomographyData(dto.getFrameNumber(), dto.getMatrix(), keypoints, dto.getConfidence(),
                    fieldSize, false);
        }
        double[][] matrix = homographyEstimator.estimate(keypoints);
        if (matrix == null) {
            logger.warn("Homography keypoints are degenerate, pitch filter disabled");
            return null;
        }
        return new HomographyData(dto.getFrameNumber(), matrix, keypoints, dto.getConfidence(), fieldSize, false);
    }
}
