package com.edge.match.core.detect;

import com.edge.match.model.Detection;

import java.util.List;

public interface PlayerDetector {
    /**
     * @return 归一化坐标的球员检测，没有检测到时返回空列表
     */
    List<Detection> detectPlayers(EncodedFrame frame);

    String getModelId();
}
