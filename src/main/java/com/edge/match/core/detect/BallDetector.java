package com.edge.match.core.detect;

import com.edge.match.model.Detection;

public interface BallDetector {
    /**
     * @return 足球检测，未检测到时返回 null
     */
    Detection detectBall(EncodedFrame frame);

    String getModelId();
}
