package com.edge.match.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一帧的球员检测
 */
@Data
public class FrameDto {
    private int frameNumber;
    // 为空时按 frameNumber / fps 计算
    private Double timestamp;
    private List<DetectionDto> detections = new ArrayList<>();
}
