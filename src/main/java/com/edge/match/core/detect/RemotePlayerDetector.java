package com.edge.match.core.detect;

import com.edge.match.model.Detection;

import java.util.List;

/**
 * 调用外部推理服务的球员检测
 */
public class RemotePlayerDetector implements PlayerDetector {
    private final InferenceServiceClient client;

    public RemotePlayerDetector(InferenceServiceClient client) {
        this.client = client;
    }

    @Override
    public List<Detection> detectPlayers(EncodedFrame frame) {
        return client.detectPlayers(frame);
    }

    @Override
    public String getModelId() {
        return "yolo-player-v1";
    }
}
