package com.edge.match.core.filter;

import com.edge.match.core.transform.CoordinateTransform;
import com.edge.match.model.Detection;
import com.edge.match.model.FieldSize;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import com.edge.match.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 非球员检测过滤流水线
 * <p>
 * 顺序执行：
 * 1. 置信度（>= 阈值保留）
 * 2. 球场边界（无单应性或关闭时跳过）
 * 3. 队服颜色（可插拔，默认直通）
 * 4. 运动历史（累计位移不足的静止目标被移除，无历史的轨迹放行）
 * 5. 名单号码（无号码放行，有名单时才执行）
 * 6. 按置信度取前 N（始终执行）
 */
public class DetectionFilterPipeline {
    private static final Logger logger = LoggerFactory.getLogger(DetectionFilterPipeline.class);

    private final FilterConfig config;
    private final ColorFilterStage colorStage;

    public DetectionFilterPipeline(FilterConfig config, ColorFilterStage colorStage) {
        this.config = config;
        this.colorStage = colorStage != null ? colorStage : ColorFilterStage.passThrough();
    }

    public DetectionFilterPipeline(FilterConfig config) {
        this(config, ColorFilterStage.passThrough());
    }

    public FilterResult run(FilterInput input) {
        List<Detection> detections = input.getDetections() != null ? input.getDetections() : Collections.emptyList();
        FilterStats stats = new FilterStats();
        stats.setTotalInput(detections.size());

        List<Detection> current = filterByConfidence(detections, config.getMinConfidence());
        stats.setFilteredByConfidence(detections.size() - current.size());

        if (config.isFilterOutsidePitch() && input.getHomography() != null) {
            int before = current.size();
            current = filterByPitchBoundary(current, input.getHomography(), input.getGameFormat());
            stats.setFilteredByPitch(before - current.size());
        }

        if (input.getHomeColor() != null && input.getAwayColor() != null) {
            int before = current.size();
            current = colorStage.filter(current, input.getHomeColor(), input.getAwayColor());
            stats.setFilteredByColor(before - current.size());
        }

        if (input.getMotionHistory() != null) {
            int before = current.size();
            current = filterByMotion(current, input.getMotionHistory(), input.getFrameNumber());
            stats.setFilteredByMotion(before - current.size());
        }

        if (input.getRoster() != null && !input.getRoster().isEmpty()) {
            int before = current.size();
            current = filterByRoster(current, input.getRoster());
            stats.setFilteredByRoster(before - current.size());
        }

        int before = current.size();
        current = filterTopN(current, config.maxPlayersFor(input.getGameFormat()));
        stats.setFilteredByTopN(before - current.size());
        stats.setPassedCount(current.size());

        Set<Detection> passedSet = Collections.newSetFromMap(new IdentityHashMap<>());
        passedSet.addAll(current);
        List<Detection> filtered = new ArrayList<>();
        for (Detection d : detections) {
            if (!passedSet.contains(d)) {
                filtered.add(d);
            }
        }

        logger.debug("Frame {} filtered: {}", input.getFrameNumber(), stats);
        return new FilterResult(current, filtered, stats);
    }

    // ==================== 各过滤阶段 ====================

    public static List<Detection> filterByConfidence(List<Detection> detections, double minConfidence) {
        List<Detection> passed = new ArrayList<>();
        for (Detection d : detections) {
            if (d.getConfidence() >= minConfidence) {
                passed.add(d);
            }
        }
        return passed;
    }

    /**
     * 中心点映射到场地坐标后不在球场内的检测被移除；无法映射的点保留
     */
    public static List<Detection> filterByPitchBoundary(List<Detection> detections, HomographyData homography,
                                                        GameFormat format) {
        FieldSize fieldSize = homography.getFieldSize() != null ? homography.getFieldSize() : format.fieldSize();
        List<Detection> passed = new ArrayList<>();
        for (Detection d : detections) {
            if (CoordinateTransform.isDegenerate(homography.getMatrix(), d.getCenter())) {
                passed.add(d);
                continue;
            }
            Point field = CoordinateTransform.screenToField(homography, d.getCenter());
            if (CoordinateTransform.isOnPitch(field, fieldSize)) {
                passed.add(d);
            }
        }
        return passed;
    }

    /**
     * 先写入当前帧位置，再按窗口内累计位移判断；此前没有历史的轨迹直接放行
     */
    public List<Detection> filterByMotion(List<Detection> detections, MotionHistory history, int frameNumber) {
        List<Detection> passed = new ArrayList<>();
        for (Detection d : detections) {
            String trackId = d.getTrackId();
            if (trackId == null) {
                passed.add(d);
                continue;
            }

            boolean hadHistory = history.hasHistory(trackId);
            history.record(trackId, toPixels(d.getCenter()), frameNumber, config.getMotionWindowFrames());

            if (!hadHistory || history.movement(trackId) >= config.getMinMovement()) {
                passed.add(d);
            }
        }
        return passed;
    }

    public static List<Detection> filterByRoster(List<Detection> detections, List<RosterEntry> roster) {
        Set<Integer> validNumbers = new HashSet<>();
        roster.forEach(r -> validNumbers.add(r.getJerseyNumber()));

        List<Detection> passed = new ArrayList<>();
        for (Detection d : detections) {
            Integer number = d.getJerseyNumber();
            if (number == null || validNumbers.contains(number)) {
                passed.add(d);
            }
        }
        return passed;
    }

    public static List<Detection> filterTopN(List<Detection> detections, int maxCount) {
        if (detections.size() <= maxCount) {
            return new ArrayList<>(detections);
        }
        List<Detection> sorted = new ArrayList<>(detections);
        sorted.sort(Comparator.comparingDouble(Detection::getConfidence).reversed());
        return new ArrayList<>(sorted.subList(0, Math.max(0, maxCount)));
    }

    private Point toPixels(Point normalized) {
        return new Point(normalized.x * config.getFrameWidth(), normalized.y * config.getFrameHeight());
    }

    public FilterConfig getConfig() {
        return config;
    }
}
