package com.edge.match.dto;

import com.edge.match.model.BoundingBox;
import com.edge.match.model.Detection;
import com.edge.match.model.Point;
import lombok.Data;

/**
 * 单个检测（归一化坐标）
 */
@Data
public class DetectionDto {
    private String label = "person";
    private BoundingBox bbox;
    // 为空时取边界框中心
    private Point center;
    private double confidence;
    private Double classConfidence;
    private Integer jerseyNumber;
    // 球衣颜色 #RRGGBB，由帧检测接口采样得到
    private String jerseyColor;

    public Detection toDetection() {
        if (bbox == null) {
            throw new IllegalArgumentException("Detection bbox is required");
        }
        Detection detection = new Detection(label, bbox, center, confidence, classConfidence);
        detection.setJerseyNumber(jerseyNumber);
        return detection;
    }

    public static DetectionDto from(Detection detection, String jerseyColor) {
        DetectionDto dto = new DetectionDto();
        dto.setLabel(detection.getLabel());
        dto.setBbox(detection.getBbox());
        dto.setCenter(detection.getCenter());
        dto.setConfidence(detection.getConfidence());
        dto.setClassConfidence(detection.getClassConfidence());
        dto.setJerseyNumber(detection.getJerseyNumber());
        dto.setJerseyColor(jerseyColor);
        return dto;
    }
}
