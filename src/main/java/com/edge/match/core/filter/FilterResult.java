package com.edge.match.core.filter;

import com.edge.match.model.Detection;

import java.util.List;

public class FilterResult {
    private final List<Detection> passed;
    private final List<Detection> filtered;
    private final FilterStats stats;

    public FilterResult(List<Detection> passed, List<Detection> filtered, FilterStats stats) {
        this.passed = passed;
        this.filtered = filtered;
        this.stats = stats;
    }

    public List<Detection> getPassed() { return passed; }
    public List<Detection> getFiltered() { return filtered; }
    public FilterStats getStats() { return stats; }
}
