package com.edge.match.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单应性输入：直接给出矩阵，或给出关键点由服务端估计
 */
@Data
public class HomographyDto {
    private int frameNumber;
    private double[][] matrix;
    private List<KeypointDto> keypoints = new ArrayList<>();
    private double confidence = 1.0;
}
