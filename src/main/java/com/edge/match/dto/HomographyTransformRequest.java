package com.edge.match.dto;

import com.edge.match.model.GameFormat;
import com.edge.match.model.Point;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 坐标转换请求，direction 为 SCREEN_TO_FIELD 或 FIELD_TO_SCREEN
 */
@Data
public class HomographyTransformRequest {
    private double[][] matrix;
    private GameFormat gameFormat = GameFormat.ELEVEN;
    private String direction = "SCREEN_TO_FIELD";
    private List<Point> points = new ArrayList<>();
}
