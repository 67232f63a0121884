package com.edge.match.core.detect;

import com.edge.match.model.Detection;

public class PlaceholderBallDetector implements BallDetector {

    @Override
    public Detection detectBall(EncodedFrame frame) {
        return null;
    }

    @Override
    public String getModelId() {
        return "placeholder-ball-v1";
    }
}
