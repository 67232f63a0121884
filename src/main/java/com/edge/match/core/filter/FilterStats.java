package com.edge.match.core.filter;

import lombok.Data;

/**
 * 各过滤阶段的统计
 */
@Data
public class FilterStats {
    private int totalInput;
    private int passedCount;
    private int filteredByConfidence;
    private int filteredByPitch;
    private int filteredByColor;
    private int filteredByMotion;
    private int filteredByRoster;
    private int filteredByTopN;

    /**
     * 累加另一帧的统计
     */
    public void add(FilterStats other) {
        totalInput += other.totalInput;
        passedCount += other.passedCount;
        filteredByConfidence += other.filteredByConfidence;
        filteredByPitch += other.filteredByPitch;
        filteredByColor += other.filteredByColor;
        filteredByMotion += other.filteredByMotion;
        filteredByRoster += other.filteredByRoster;
        filteredByTopN += other.filteredByTopN;
    }
}
