package com.edge.match.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class FrameDetectionResult {
    private int frameNumber;
    private int width;
    private int height;
    private List<DetectionDto> players = new ArrayList<>();
    private DetectionDto ball;
    private String playerModelId;
    private String ballModelId;
}
