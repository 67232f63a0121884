package com.edge.match.core.transform;

import com.edge.match.model.FieldSize;
import com.edge.match.model.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 标准球场关键点（场地坐标，米，以中心为原点）
 * <p>
 * 禁区和球门尺寸按国际标准固定，边角和中线随球场尺寸缩放
 */
public final class PitchKeypoints {

    private static final double PENALTY_AREA_DEPTH = 16.5;
    private static final double PENALTY_AREA_HALF_WIDTH = 20.15;
    private static final double GOAL_HALF_WIDTH = 3.66;
    private static final double CENTER_CIRCLE_RADIUS = 9.15;

    private PitchKeypoints() {
    }

    public static Map<String, Point> forField(FieldSize fieldSize) {
        double hl = fieldSize.getLength() / 2;
        double hw = fieldSize.getWidth() / 2;
        double penaltyFront = hl - PENALTY_AREA_DEPTH;
        double penaltyHalfWidth = Math.min(PENALTY_AREA_HALF_WIDTH, hw);

        Map<String, Point> points = new LinkedHashMap<>();
        points.put("corner_tl", new Point(-hl, hw));
        points.put("corner_tr", new Point(hl, hw));
        points.put("corner_bl", new Point(-hl, -hw));
        points.put("corner_br", new Point(hl, -hw));

        points.put("center", new Point(0, 0));
        points.put("center_top", new Point(0, hw));
        points.put("center_bottom", new Point(0, -hw));

        points.put("penalty_tl", new Point(-hl, penaltyHalfWidth));
        points.put("penalty_bl", new Point(-hl, -penaltyHalfWidth));
        points.put("penalty_front_tl", new Point(-penaltyFront, penaltyHalfWidth));
        points.put("penalty_front_bl", new Point(-penaltyFront, -penaltyHalfWidth));
        points.put("penalty_tr", new Point(hl, penaltyHalfWidth));
        points.put("penalty_br", new Point(hl, -penaltyHalfWidth));
        points.put("penalty_front_tr", new Point(penaltyFront, penaltyHalfWidth));
        points.put("penalty_front_br", new Point(penaltyFront, -penaltyHalfWidth));

        points.put("goal_l_top", new Point(-hl, GOAL_HALF_WIDTH));
        points.put("goal_l_bottom", new Point(-hl, -GOAL_HALF_WIDTH));
        points.put("goal_r_top", new Point(hl, GOAL_HALF_WIDTH));
        points.put("goal_r_bottom", new Point(hl, -GOAL_HALF_WIDTH));

        points.put("center_circle_top", new Point(0, CENTER_CIRCLE_RADIUS));
        points.put("center_circle_bottom", new Point(0, -CENTER_CIRCLE_RADIUS));
        points.put("center_circle_left", new Point(-CENTER_CIRCLE_RADIUS, 0));
        points.put("center_circle_right", new Point(CENTER_CIRCLE_RADIUS, 0));
        return Collections.unmodifiableMap(points);
    }

    /**
     * 按标签查找关键点
     *
     * @return 未知标签返回 null
     */
    public static Point lookup(String label, FieldSize fieldSize) {
        return forField(fieldSize).get(label);
    }
}
