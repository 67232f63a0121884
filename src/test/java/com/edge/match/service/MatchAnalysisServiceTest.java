package com.edge.match.service;

import com.edge.match.config.YamlConfig;
import com.edge.match.core.event.EventDetector;
import com.edge.match.core.event.PassEvent;
import com.edge.match.core.event.PassOutcome;
import com.edge.match.core.filter.DetectionFilterPipeline;
import com.edge.match.core.team.TeamClassifier;
import com.edge.match.core.team.TeamLabel;
import com.edge.match.core.team.TrackTeamMeta;
import com.edge.match.core.tracking.BallTrackSmoother;
import com.edge.match.core.transform.DltHomographyEstimator;
import com.edge.match.dto.AnalysisRequest;
import com.edge.match.dto.BallDetectionDto;
import com.edge.match.dto.DetectionDto;
import com.edge.match.dto.FrameDto;
import com.edge.match.dto.HomographyDto;
import com.edge.match.dto.KeypointDto;
import com.edge.match.dto.MatchAnalysisResult;
import com.edge.match.model.BoundingBox;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchAnalysisServiceTest {

    private static final String RED = "#dd1419";
    private static final String BLUE = "#1f3fbf";
    private static final double[] RED_ROWS = {0.15, 0.30, 0.45};
    private static final double[] BLUE_ROWS = {0.60, 0.75, 0.90};

    private MatchAnalysisService service;

    @BeforeEach
    void setUp() {
        YamlConfig config = new YamlConfig();
        // 高过程噪声、低观测噪声，平滑后的球位置贴近观测
        config.getPrediction().setProcessNoise(100);
        config.getPrediction().setMeasurementNoise(0.01);
        service = new MatchAnalysisService();
        ReflectionTestUtils.setField(service, "config", config);
        ReflectionTestUtils.setField(service, "filterPipeline", new DetectionFilterPipeline(config.getFilter()));
        ReflectionTestUtils.setField(service, "teamClassifier", new TeamClassifier(config.getKmeans()));
        ReflectionTestUtils.setField(service, "ballTrackSmoother", new BallTrackSmoother(config.getPrediction(),
                config.getTracking().getBallMaxGapSeconds()));
        ReflectionTestUtils.setField(service, "eventDetector", new EventDetector(config.getEvents()));
        ReflectionTestUtils.setField(service, "homographyEstimator", new DltHomographyEstimator());
    }

    private static DetectionDto player(double cx, double cy, String color) {
        DetectionDto dto = new DetectionDto();
        dto.setBbox(new BoundingBox(cx - 0.02, cy - 0.05, 0.04, 0.1));
        dto.setCenter(new Point(cx, cy));
        dto.setConfidence(0.9);
        dto.setJerseyColor(color);
        return dto;
    }

    private static BallDetectionDto ball(int frame, double x, double y) {
        BallDetectionDto dto = new BallDetectionDto();
        dto.setFrameNumber(frame);
        dto.setPosition(new Point(x, y));
        dto.setConfidence(0.9);
        return dto;
    }

    /**
     * 三名红衣与三名蓝衣球员向右跑动，前 5 帧球在红衣 1 号脚下，之后传给红衣 2 号
     */
    private static AnalysisRequest passBetweenTeammates() {
        AnalysisRequest request = new AnalysisRequest();
        request.setMatchId("match-7");
        request.setGameFormat(GameFormat.ELEVEN);
        request.setHomeColor(RED);
        request.setAwayColor(BLUE);

        List<FrameDto> frames = new ArrayList<>();
        List<BallDetectionDto> balls = new ArrayList<>();
        for (int f = 0; f < 10; f++) {
            FrameDto frame = new FrameDto();
            frame.setFrameNumber(f);
            double redX = 0.2 + 0.01 * f;
            double blueX = 0.6 + 0.01 * f;
            for (double y : RED_ROWS) {
                frame.getDetections().add(player(redX, y, RED));
            }
            for (double y : BLUE_ROWS) {
                frame.getDetections().add(player(blueX, y, BLUE));
            }
            // 乱序输入，服务内按帧号排序
            frames.add(0, frame);
            balls.add(ball(f, redX, f < 5 ? RED_ROWS[0] : RED_ROWS[1]));
        }
        request.setFrames(frames);
        request.setBallDetections(balls);
        return request;
    }

    @Test
    void analyze_runs_full_pipeline() {
        MatchAnalysisResult result = service.analyze(passBetweenTeammates());

        assertThat(result.getMatchId()).isEqualTo("match-7");
        assertThat(result.getFramesProcessed()).isEqualTo(10);
        assertThat(result.getTrackCount()).isEqualTo(6);
        assertThat(result.getFilterStats()).isNotNull();

        assertThat(result.getTeamMetas()).hasSize(6);
        assertThat(result.getTeamMetas()).extracting(TrackTeamMeta::getLabel)
                .containsOnly(TeamLabel.HOME, TeamLabel.AWAY);
        assertThat(result.getHomeColor()).isNotEqualTo(result.getAwayColor());

        assertThat(result.getBall().getModelId()).isEqualTo(MatchAnalysisService.INPUT_BALL_MODEL);
        assertThat(result.getBall().getVisibilityRate()).isEqualTo(1.0);
        assertThat(result.getBall().getDetections()).hasSize(10);

        assertThat(result.getPossessionSegments()).hasSize(2);
        assertThat(result.getPassEvents()).hasSize(1);
        PassEvent pass = result.getPassEvents().get(0);
        assertThat(pass.getOutcome()).isEqualTo(PassOutcome.COMPLETE);
        assertThat(pass.getFrameNumber()).isEqualTo(4);
        assertThat(pass.getKicker().getTeamId()).isEqualTo(TeamId.HOME);
        assertThat(pass.getReceiver().getTeamId()).isEqualTo(TeamId.HOME);
        assertThat(pass.getKicker().getTrackId()).isNotEqualTo(pass.getReceiver().getTrackId());
        assertThat(result.getTurnoverEvents()).isEmpty();
    }

    @Test
    void missing_match_id_is_rejected() {
        AnalysisRequest request = passBetweenTeammates();
        request.setMatchId(" ");

        assertThatThrownBy(() -> service.analyze(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("matchId");
    }

    @Test
    void detection_without_bbox_is_a_bad_request() {
        AnalysisRequest request = passBetweenTeammates();
        request.getFrames().get(0).getDetections().add(new DetectionDto());

        assertThatThrownBy(() -> service.analyze(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bbox");
    }

    @Test
    void empty_match_yields_no_events() {
        AnalysisRequest request = new AnalysisRequest();
        request.setMatchId("empty");
        request.setGameFormat(null);

        MatchAnalysisResult result = service.analyze(request);

        assertThat(result.getFramesProcessed()).isZero();
        assertThat(result.getPossessionSegments()).isEmpty();
        assertThat(result.getPendingReviews()).isEmpty();
        assertThat(result.getTeamConfidence()).isZero();
    }

    // ==================== 单应性 ====================

    private static KeypointDto keypoint(double sx, double sy, String label) {
        KeypointDto dto = new KeypointDto();
        dto.setScreen(new Point(sx, sy));
        dto.setLabel(label);
        return dto;
    }

    @Test
    void homography_is_estimated_from_labelled_keypoints() {
        HomographyDto dto = new HomographyDto();
        dto.setFrameNumber(3);
        dto.getKeypoints().add(keypoint(0, 0, "corner_tl"));
        dto.getKeypoints().add(keypoint(1, 0, "corner_tr"));
        dto.getKeypoints().add(keypoint(0, 1, "corner_bl"));
        dto.getKeypoints().add(keypoint(1, 1, "corner_br"));

        HomographyData homography = service.toHomography(dto, GameFormat.ELEVEN.fieldSize());

        assertThat(homography).isNotNull();
        assertThat(homography.getFrameNumber()).isEqualTo(3);
        assertThat(homography.getMatrix()).hasDimensions(3, 3);
    }

    @Test
    void degenerate_keypoints_disable_homography() {
        HomographyDto dto = new HomographyDto();
        for (int i = 1; i <= 4; i++) {
            KeypointDto kp = keypoint(0.1 * i, 0.1 * i, "p" + i);
            kp.setField(new Point(-60 + 20 * i, 0));
            dto.getKeypoints().add(kp);
        }

        assertThat(service.toHomography(dto, GameFormat.ELEVEN.fieldSize())).isNull();
        assertThat(service.toHomography(null, GameFormat.ELEVEN.fieldSize())).isNull();
    }

    @Test
    void supplied_matrix_is_used_as_is() {
        HomographyDto dto = new HomographyDto();
        double[][] matrix = {{105, 0, -52.5}, {0, -68, 34}, {0, 0, 1}};
        dto.setMatrix(matrix);

        HomographyData homography = service.toHomography(dto, GameFormat.ELEVEN.fieldSize());

        assertThat(homography.getMatrix()).isSameAs(matrix);
    }
}
