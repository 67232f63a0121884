package com.edge.match.core.dedup;

/**
 * 分析窗口
 * <p>
 * [absoluteStart, absoluteEnd) 包含前后重叠区，去掉重叠区后为核心区
 */
public class AnalysisWindow {
    private final String windowId;
    private final double absoluteStart;
    private final double absoluteEnd;
    private final double overlapBefore;
    private final double overlapAfter;

    public AnalysisWindow(String windowId, double absoluteStart, double absoluteEnd,
                          double overlapBefore, double overlapAfter) {
        if (absoluteEnd < absoluteStart) {
            throw new IllegalArgumentException("Window " + windowId + " ends before it starts");
        }
        this.windowId = windowId;
        this.absoluteStart = absoluteStart;
        this.absoluteEnd = absoluteEnd;
        this.overlapBefore = Math.max(0, overlapBefore);
        this.overlapAfter = Math.max(0, overlapAfter);
    }

    public boolean contains(double timestamp) {
        return timestamp >= absoluteStart && timestamp < absoluteEnd;
    }

    public boolean isInCoreWindow(double timestamp) {
        double coreStart = absoluteStart + overlapBefore;
        double coreEnd = absoluteEnd - overlapAfter;
        return timestamp >= coreStart && timestamp < coreEnd;
    }

    public double toAbsolute(double relativeTime) {
        return relativeTime + absoluteStart;
    }

    public double toRelative(double absoluteTime) {
        return Math.max(0, absoluteTime - absoluteStart);
    }

    /**
     * 将窗口内的原始事件转换为绝对时间，并对重叠区事件施加边缘惩罚
     */
    public void adjust(RawEvent event, double edgePenalty) {
        event.setWindowId(windowId);
        event.setAbsoluteTimestamp(toAbsolute(event.getRelativeTimestamp()));
        double factor = isInCoreWindow(event.getAbsoluteTimestamp()) ? 1.0 : edgePenalty;
        event.setAdjustedConfidence(event.getConfidence() * factor);
    }

    public String getWindowId() { return windowId; }
    public double getAbsoluteStart() { return absoluteStart; }
    public double getAbsoluteEnd() { return absoluteEnd; }
    public double getOverlapBefore() { return overlapBefore; }
    public double getOverlapAfter() { return overlapAfter; }
}
