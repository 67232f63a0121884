package com.edge.match.core.dedup;

import com.edge.match.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 重叠窗口事件去重
 * <p>
 * 按时间排序后，同类型、同队且与簇内最后一个事件间隔不超过类型半径的事件归为一簇，
 * 每簇合并为一个规范事件，输出数量不会超过输入数量
 */
public class EventDeduplicator {
    private static final Logger logger = LoggerFactory.getLogger(EventDeduplicator.class);

    static final String SHOT_RESULT = "shotResult";
    static final String GOAL = "goal";

    private final DeduplicationConfig config;

    public EventDeduplicator(DeduplicationConfig config) {
        this.config = config != null ? config : new DeduplicationConfig();
    }

    public List<DeduplicatedEvent> deduplicate(Collection<RawEvent> events) {
        validateInput(events);
        if (events.isEmpty()) {
            return new ArrayList<>();
        }
        List<DeduplicatedEvent> result = cluster(events).stream()
                .map(this::merge)
                .collect(Collectors.toList());
        logger.info("Deduplicated {} raw events into {} events", events.size(), result.size());
        return result;
    }

    // ==================== 输入校验 ====================

    /**
     * @throws IllegalArgumentException 集合或元素结构不合法
     */
    public static void validateInput(Collection<RawEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("Raw event collection must not be null");
        }
        int index = 0;
        for (RawEvent event : events) {
            if (event == null) {
                throw new IllegalArgumentException("Raw event at index " + index + " is null");
            }
            if (event.getType() == null) {
                throw new IllegalArgumentException("Raw event at index " + index + " has no type");
            }
            if (event.getTeam() == null) {
                throw new IllegalArgumentException("Raw event at index " + index + " has no team");
            }
            if (event.getWindowId() == null || event.getWindowId().isBlank()) {
                throw new IllegalArgumentException("Raw event at index " + index + " has no windowId");
            }
            if (event.getAbsoluteTimestamp() < 0 || Double.isNaN(event.getAbsoluteTimestamp())) {
                throw new IllegalArgumentException("Raw event at index " + index
                        + " has invalid timestamp: " + event.getAbsoluteTimestamp());
            }
            if (!inUnitRange(event.getConfidence())
                    || (event.getAdjustedConfidence() != null && !inUnitRange(event.getAdjustedConfidence()))) {
                throw new IllegalArgumentException("Raw event at index " + index
                        + " has confidence outside [0, 1]");
            }
            index++;
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0 && value <= 1;
    }

    // ==================== 聚类 ====================

    public List<List<RawEvent>> cluster(Collection<RawEvent> events) {
        List<RawEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingDouble(RawEvent::getAbsoluteTimestamp));

        List<List<RawEvent>> clusters = new ArrayList<>();
        List<RawEvent> current = null;

        for (RawEvent event : sorted) {
            if (current != null) {
                RawEvent last = current.get(current.size() - 1);
                double timeDiff = Math.abs(event.getAbsoluteTimestamp() - last.getAbsoluteTimestamp());
                if (event.getType() == last.getType()
                        && event.getTeam() == last.getTeam()
                        && timeDiff <= config.thresholdFor(event.getType())) {
                    current.add(event);
                    continue;
                }
                clusters.add(current);
            }
            current = new ArrayList<>();
            current.add(event);
        }
        if (current != null) {
            clusters.add(current);
        }
        return clusters;
    }

    // ==================== 合并 ====================

    public DeduplicatedEvent merge(List<RawEvent> cluster) {
        if (cluster == null || cluster.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge empty cluster");
        }

        RawEvent base = cluster.get(0);
        for (RawEvent event : cluster) {
            if (event.getEffectiveConfidence() > base.getEffectiveConfidence()) {
                base = event;
            }
        }

        DeduplicatedEvent merged = new DeduplicatedEvent();
        merged.setMatchId(base.getMatchId());
        merged.setVideoId(base.getVideoId());
        merged.setType(base.getType());
        merged.setTeam(base.getTeam());
        merged.setConfidence(base.getConfidence());
        merged.setClusterSize(cluster.size());
        merged.setAbsoluteTimestamp(weightedTimestamp(cluster));
        merged.setPlayer(firstNonNull(base.getPlayer(), cluster, RawEvent::getPlayer));
        merged.setZone(firstNonNull(base.getZone(), cluster, RawEvent::getZone));
        merged.setDetails(mergeDetails(cluster));

        Set<String> windows = new LinkedHashSet<>();
        for (RawEvent event : cluster) {
            windows.add(event.getWindowId());
        }
        merged.setMergedFromWindows(new ArrayList<>(windows));
        merged.setAdjustedConfidence(boostedConfidence(base.getEffectiveConfidence(), windows.size(),
                config.getConfidenceBoostPerDetection()));

        String evidence = cluster.stream()
                .map(RawEvent::getVisualEvidence)
                .filter(v -> v != null && !v.isBlank())
                .collect(Collectors.joining("; "));
        merged.setVisualEvidence(evidence.isEmpty() ? null : evidence);

        mergePosition(cluster, merged);
        return merged;
    }

    /**
     * base + boost·(n−1)·(1 − base)，上限 1
     */
    public static double boostedConfidence(double base, int distinctWindows, double boostPerDetection) {
        double bonus = boostPerDetection * Math.max(0, distinctWindows - 1);
        return Math.min(1.0, base + bonus * (1 - base));
    }

    private static double weightedTimestamp(List<RawEvent> cluster) {
        double totalWeight = 0;
        double weighted = 0;
        double plain = 0;
        for (RawEvent event : cluster) {
            totalWeight += event.getEffectiveConfidence();
            weighted += event.getAbsoluteTimestamp() * event.getEffectiveConfidence();
            plain += event.getAbsoluteTimestamp();
        }
        return totalWeight > 0 ? weighted / totalWeight : plain / cluster.size();
    }

    private static <T> T firstNonNull(T preferred, List<RawEvent> cluster,
                                      Function<RawEvent, T> getter) {
        if (preferred != null) {
            return preferred;
        }
        for (RawEvent event : cluster) {
            T value = getter.apply(event);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * 每个字段取被最多事件支持的值，票数相同时取置信度更高的来源；
     * 任一事件给出 shotResult=goal 时保留进球
     */
    static Map<String, Object> mergeDetails(List<RawEvent> cluster) {
        Map<String, Map<Object, Vote>> votes = new LinkedHashMap<>();
        for (RawEvent event : cluster) {
            if (event.getDetails() == null) {
                continue;
            }
            for (Map.Entry<String, Object> entry : event.getDetails().entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                Vote vote = votes.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(entry.getValue(), v -> new Vote());
                vote.count++;
                vote.bestConfidence = Math.max(vote.bestConfidence, event.getEffectiveConfidence());
            }
        }

        Map<String, Object> merged = new HashMap<>();
        for (Map.Entry<String, Map<Object, Vote>> field : votes.entrySet()) {
            Object winner = null;
            Vote winnerVote = null;
            for (Map.Entry<Object, Vote> candidate : field.getValue().entrySet()) {
                Vote vote = candidate.getValue();
                if (winnerVote == null
                        || vote.count > winnerVote.count
                        || (vote.count == winnerVote.count && vote.bestConfidence > winnerVote.bestConfidence)) {
                    winner = candidate.getKey();
                    winnerVote = vote;
                }
            }
            merged.put(field.getKey(), winner);
        }

        if (field(votes, SHOT_RESULT).containsKey(GOAL)) {
            merged.put(SHOT_RESULT, GOAL);
        }
        return merged;
    }

    private static Map<Object, Vote> field(Map<String, Map<Object, Vote>> votes, String key) {
        Map<Object, Vote> values = votes.get(key);
        return values != null ? values : new HashMap<>();
    }

    private static class Vote {
        int count;
        double bestConfidence;
    }

    /**
     * 按位置置信度加权平均簇内模型位置
     */
    private static void mergePosition(List<RawEvent> cluster, DeduplicatedEvent merged) {
        List<RawEvent> withPosition = cluster.stream()
                .filter(e -> e.getPosition() != null && e.getPositionConfidence() != null && e.getPositionConfidence() > 0)
                .collect(Collectors.toList());
        if (withPosition.isEmpty()) {
            return;
        }

        double total = 0;
        double x = 0;
        double y = 0;
        for (RawEvent event : withPosition) {
            double w = event.getPositionConfidence();
            total += w;
            x += event.getPosition().x * w;
            y += event.getPosition().y * w;
        }

        merged.setMergedPosition(new Point(x / total, y / total));
        double avg = total / withPosition.size();
        merged.setMergedPositionConfidence(Math.min(1.0, avg + 0.05 * (withPosition.size() - 1)));
        merged.setPositionSource(withPosition.size() > 1 ? PositionSource.MERGED : PositionSource.MODEL_OUTPUT);
    }

    // ==================== 统计 ====================

    public static DeduplicationStats stats(Collection<RawEvent> rawEvents, List<DeduplicatedEvent> deduplicated) {
        DeduplicationStats stats = new DeduplicationStats();
        stats.setTotalRawEvents(rawEvents.size());
        stats.setTotalDeduplicatedEvents(deduplicated.size());

        int merged = 0;
        int totalClusterSize = 0;
        for (DeduplicatedEvent event : deduplicated) {
            if (event.isMerged()) {
                merged++;
                totalClusterSize += event.getClusterSize();
            }
        }
        stats.setMergedCount(merged);
        stats.setUniqueCount(deduplicated.size() - merged);
        stats.setAverageClusterSize(merged > 0 ? (double) totalClusterSize / merged : 0);

        for (RawEvent event : rawEvents) {
            DeduplicationStats.TypeStats typeStats =
                    stats.getByType().computeIfAbsent(event.getType(), t -> new DeduplicationStats.TypeStats());
            typeStats.setRaw(typeStats.getRaw() + 1);
        }
        for (DeduplicatedEvent event : deduplicated) {
            DeduplicationStats.TypeStats typeStats =
                    stats.getByType().computeIfAbsent(event.getType(), t -> new DeduplicationStats.TypeStats());
            typeStats.setDeduplicated(typeStats.getDeduplicated() + 1);
            if (event.isMerged()) {
                typeStats.setMergedCount(typeStats.getMergedCount() + 1);
            }
        }
        return stats;
    }
}
