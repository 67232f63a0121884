package com.edge.match.dto;

import com.edge.match.model.FieldSize;
import com.edge.match.model.HomographyKeypoint;
import com.edge.match.model.Point;
import com.edge.match.core.transform.PitchKeypoints;
import lombok.Data;

/**
 * 屏幕点与场地点的对应关系
 * <p>
 * field 为空时按 label 查找标准场地关键点
 */
@Data
public class KeypointDto {
    private Point screen;
    private Point field;
    private String label;
    private double confidence = 1.0;

    public HomographyKeypoint toKeypoint(FieldSize fieldSize) {
        Point fieldPoint = field != null ? field : PitchKeypoints.lookup(label, fieldSize);
        if (screen == null || fieldPoint == null) {
            throw new IllegalArgumentException("Keypoint " + label + " needs a screen point and a field point or known label");
        }
        return new HomographyKeypoint(screen, fieldPoint, label, confidence);
    }
}
