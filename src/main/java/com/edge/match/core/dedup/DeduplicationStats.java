package com.edge.match.core.dedup;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class DeduplicationStats {
    private int totalRawEvents;
    private int totalDeduplicatedEvents;
    // 由多个原始事件合并而来的数量
    private int mergedCount;
    private int uniqueCount;
    private double averageClusterSize;
    private Map<EventType, TypeStats> byType = new LinkedHashMap<>();

    @Data
    public static class TypeStats {
        private int raw;
        private int deduplicated;
        private int mergedCount;
    }
}
