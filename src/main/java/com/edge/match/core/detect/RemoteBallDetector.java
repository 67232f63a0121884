package com.edge.match.core.detect;

import com.edge.match.model.Detection;

public class RemoteBallDetector implements BallDetector {
    private final InferenceServiceClient client;

    public RemoteBallDetector(InferenceServiceClient client) {
        this.client = client;
    }

    @Override
    public Detection detectBall(EncodedFrame frame) {
        return client.detectBall(frame);
    }

    @Override
    public String getModelId() {
        return "yolo-ball-v1";
    }
}
