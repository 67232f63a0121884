package com.edge.match.dto;

import com.edge.match.core.dedup.DeduplicatedEvent;
import com.edge.match.core.dedup.DeduplicationStats;
import com.edge.match.core.dedup.ValidationIssue;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DeduplicationResult {
    private List<DeduplicatedEvent> events = new ArrayList<>();
    private DeduplicationStats stats;
    private boolean valid;
    private List<ValidationIssue> errors = new ArrayList<>();
    private List<ValidationIssue> warnings = new ArrayList<>();
    private String validationSummary;
    // 由足球检测确定位置的事件数
    private int ballPositionMatches;
}
