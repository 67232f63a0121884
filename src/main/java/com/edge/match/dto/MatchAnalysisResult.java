package com.edge.match.dto;

import com.edge.match.core.event.CarryEvent;
import com.edge.match.core.event.PassEvent;
import com.edge.match.core.event.PendingReview;
import com.edge.match.core.event.PossessionSegment;
import com.edge.match.core.event.TurnoverEvent;
import com.edge.match.core.filter.FilterStats;
import com.edge.match.core.team.TrackTeamMeta;
import com.edge.match.model.BallDetection;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单场比赛分析结果
 */
@Data
public class MatchAnalysisResult {
    private String matchId;
    private String trackerId;
    private int framesProcessed;
    private int trackCount;

    private List<PossessionSegment> possessionSegments = new ArrayList<>();
    private List<PassEvent> passEvents = new ArrayList<>();
    private List<CarryEvent> carryEvents = new ArrayList<>();
    private List<TurnoverEvent> turnoverEvents = new ArrayList<>();
    private List<PendingReview> pendingReviews = new ArrayList<>();

    private List<TrackTeamMeta> teamMetas = new ArrayList<>();
    private double teamConfidence;
    private String homeColor;
    private String awayColor;
    private String refereeColor;

    private BallSummary ball = new BallSummary();
    private FilterStats filterStats;

    @Data
    public static class BallSummary {
        private String modelId;
        private double avgConfidence;
        private double visibilityRate;
        private List<BallDetection> detections = new ArrayList<>();
    }
}
