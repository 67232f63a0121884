package com.edge.match.core.dedup;

import com.edge.match.model.Point;
import com.edge.match.model.TeamId;

/**
 * 场地三区与坐标换算
 * <p>
 * 主队从左向右进攻，客队区间镜像；归一化坐标按 105 x 68 米换算
 */
public final class ZoneMapper {

    public static final double FIELD_LENGTH = 105.0;
    public static final double FIELD_WIDTH = 68.0;

    private static final double FIRST_THIRD = 0.333;
    private static final double SECOND_THIRD = 0.667;

    private ZoneMapper() {
    }

    /**
     * @return [xMin, xMax]
     */
    static double[] bounds(EventZone zone, TeamId team) {
        boolean away = team == TeamId.AWAY;
        switch (zone) {
            case DEFENSIVE_THIRD:
                return away ? new double[]{SECOND_THIRD, 1.0} : new double[]{0.0, FIRST_THIRD};
            case ATTACKING_THIRD:
                return away ? new double[]{0.0, FIRST_THIRD} : new double[]{SECOND_THIRD, 1.0};
            default:
                return new double[]{FIRST_THIRD, SECOND_THIRD};
        }
    }

    public static Point zoneCenter(EventZone zone, TeamId team) {
        double[] b = bounds(zone, team);
        return new Point((b[0] + b[1]) / 2, 0.5);
    }

    /**
     * 不在任何区间时返回中场
     */
    public static EventZone zoneOf(Point position, TeamId team) {
        for (EventZone zone : EventZone.values()) {
            double[] b = bounds(zone, team);
            if (position.x >= b[0] && position.x <= b[1] && position.y >= 0 && position.y <= 1) {
                return zone;
            }
        }
        return EventZone.MIDDLE_THIRD;
    }

    /**
     * 区域中心作为位置估计，没有区域时返回场地中心
     */
    public static PositionEstimate positionFromZone(EventZone zone, TeamId team) {
        if (zone == null) {
            return new PositionEstimate(new Point(0.5, 0.5), PositionSource.UNKNOWN, 0.1);
        }
        return new PositionEstimate(zoneCenter(zone, team), PositionSource.ZONE_CONVERSION, 0.5);
    }

    public static Point normalizedToMeters(Point p) {
        return new Point(p.x * FIELD_LENGTH, p.y * FIELD_WIDTH);
    }

    public static Point metersToNormalized(Point p) {
        return new Point(p.x / FIELD_LENGTH, p.y / FIELD_WIDTH);
    }

    public static double distanceMeters(Point a, Point b) {
        return normalizedToMeters(a).distanceTo(normalizedToMeters(b));
    }
}
