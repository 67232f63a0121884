package com.edge.match.core.dedup;

/**
 * 多来源佐证的置信度提升
 */
public final class EnsembleConfidence {

    public static final double BOOST_PER_SOURCE = 0.05;

    private EnsembleConfidence() {
    }

    /**
     * min(1, base + 0.05·m·(1 − base))，m 为佐证来源数
     */
    public static double boost(double base, int corroboratingSources) {
        double boost = BOOST_PER_SOURCE * Math.max(0, corroboratingSources);
        return Math.min(1.0, base + boost * (1 - base));
    }

    public static double calculate(DeduplicatedEvent event, boolean sceneMatch, boolean clipMatch,
                                   boolean ballPositionMatch) {
        int sources = 0;
        if (sceneMatch) {
            sources++;
        }
        if (clipMatch) {
            sources++;
        }
        if (ballPositionMatch) {
            sources++;
        }
        return boost(event.getAdjustedConfidence(), sources);
    }
}
