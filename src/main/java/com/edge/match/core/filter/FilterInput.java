package com.edge.match.core.filter;

import com.edge.match.model.Detection;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import lombok.Data;

import java.util.List;

/**
 * 单帧过滤输入，可选项为 null 时对应阶段跳过
 */
@Data
public class FilterInput {
    private List<Detection> detections;
    private int frameNumber;
    private GameFormat gameFormat = GameFormat.ELEVEN;
    private HomographyData homography;
    private MotionHistory motionHistory;
    private List<RosterEntry> roster;
    private String homeColor;
    private String awayColor;

    public FilterInput(List<Detection> detections, int frameNumber) {
        this.detections = detections;
        this.frameNumber = frameNumber;
    }
}
