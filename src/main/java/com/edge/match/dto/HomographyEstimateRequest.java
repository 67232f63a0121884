package com.edge.match.dto;

import com.edge.match.model.GameFormat;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class HomographyEstimateRequest {
    private int frameNumber;
    private GameFormat gameFormat = GameFormat.ELEVEN;
    private List<KeypointDto> keypoints = new ArrayList<>();
}
