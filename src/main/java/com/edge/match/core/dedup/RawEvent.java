package com.edge.match.core.dedup;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * 单个分析窗口产出的原始事件
 */
@Data
public class RawEvent {
    private String matchId;
    private String videoId;
    // 来源窗口
    private String windowId;
    // 相对窗口起点的时间（秒）
    private double relativeTimestamp;
    // 相对视频起点的时间（秒）
    private double absoluteTimestamp;
    private EventType type;
    private TeamId team;
    private String player;
    private EventZone zone;
    // 模型给出的归一化位置
    private Point position;
    private Double positionConfidence;
    private Map<String, Object> details = new HashMap<>();
    private double confidence;
    // 窗口边缘惩罚后的置信度，为空时取 confidence
    private Double adjustedConfidence;
    private String visualEvidence;

    @JsonIgnore
    public double getEffectiveConfidence() {
        return adjustedConfidence != null ? adjustedConfidence : confidence;
    }
}
