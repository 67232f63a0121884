package com.edge.match.core.dedup;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个或多个原始事件合并后的规范事件
 */
@Data
public class DeduplicatedEvent {
    private String matchId;
    private String videoId;
    private double absoluteTimestamp;
    private EventType type;
    private TeamId team;
    private String player;
    private EventZone zone;
    private Map<String, Object> details = new HashMap<>();
    // 代表事件的原始置信度
    private double confidence;
    // 合并后置信度
    private double adjustedConfidence;
    // 计入多来源佐证后的置信度
    private double ensembleConfidence;
    private String visualEvidence;
    private List<String> mergedFromWindows = new ArrayList<>();
    private int clusterSize;
    private Point mergedPosition;
    private PositionSource positionSource;
    private Double mergedPositionConfidence;

    public boolean isMerged() {
        return clusterSize > 1;
    }

    public Object detail(String key) {
        return details != null ? details.get(key) : null;
    }
}
