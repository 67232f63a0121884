package com.edge.match.core.team;

import com.edge.match.model.TeamId;

/**
 * 颜色聚类给出的轨迹标签
 */
public enum TeamLabel {
    HOME,
    AWAY,
    REFEREE,
    UNKNOWN;

    /**
     * 裁判不属于任一队，映射为 UNKNOWN
     */
    public TeamId toTeamId() {
        switch (this) {
            case HOME:
                return TeamId.HOME;
            case AWAY:
                return TeamId.AWAY;
            default:
                return TeamId.UNKNOWN;
        }
    }
}
