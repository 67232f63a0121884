package com.edge.match.core.tracking;

import com.edge.match.model.Detection;

import java.util.List;
import java.util.Map;

/**
 * 多目标跟踪器
 */
public interface Tracker {
    /**
     * 处理一帧检测结果
     *
     * @return 检测下标 -> 轨迹 ID
     */
    Map<Integer, String> update(int frameNumber, double timestamp, List<Detection> detections);

    List<String> getActiveTrackIds();

    void reset();

    String getTrackerId();
}
