package com.edge.match.core.dedup;

/**
 * 校验发现的问题，错误没有严重级别
 */
public class ValidationIssue {

    public enum Category {
        TEMPORAL,
        LOGICAL,
        POSITIONAL
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH
    }

    private final Category category;
    private final String message;
    private final int eventIndex;
    private final Integer relatedEventIndex;
    private final Severity severity;

    public ValidationIssue(Category category, String message, int eventIndex,
                           Integer relatedEventIndex, Severity severity) {
        this.category = category;
        this.message = message;
        this.eventIndex = eventIndex;
        this.relatedEventIndex = relatedEventIndex;
        this.severity = severity;
    }

    public Category getCategory() { return category; }
    public String getMessage() { return message; }
    public int getEventIndex() { return eventIndex; }
    public Integer getRelatedEventIndex() { return relatedEventIndex; }
    public Severity getSeverity() { return severity; }

    @Override
    public String toString() {
        return "[" + category + "] Event " + eventIndex + ": " + message;
    }
}
