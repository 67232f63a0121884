package com.edge.match.dto;

import com.edge.match.model.GameFormat;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 比赛分析请求
 */
@Data
public class AnalysisRequest {
    private String matchId;
    private GameFormat gameFormat = GameFormat.ELEVEN;
    // LTR / RTL，为空时不计算推进
    private String attackDirection;
    // 主客队参考色 #RRGGBB
    private String homeColor;
    private String awayColor;
    private List<RosterEntryDto> roster = new ArrayList<>();
    private HomographyDto homography;
    private List<FrameDto> frames = new ArrayList<>();
    private List<BallDetectionDto> ballDetections = new ArrayList<>();
}
