package com.edge.match.core.detect;

import com.edge.match.model.Detection;

import java.util.Collections;
import java.util.List;

/**
 * 无模型时使用，始终返回空结果
 */
public class PlaceholderPlayerDetector implements PlayerDetector {

    @Override
    public List<Detection> detectPlayers(EncodedFrame frame) {
        return Collections.emptyList();
    }

    @Override
    public String getModelId() {
        return "placeholder-player-v1";
    }
}
