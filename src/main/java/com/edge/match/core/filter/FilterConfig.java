package com.edge.match.core.filter;

import com.edge.match.model.GameFormat;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * 检测过滤参数
 */
@Data
public class FilterConfig {
    // 各赛制最多保留的检测数（含裁判）
    private Map<GameFormat, Integer> maxPlayers = defaultMaxPlayers();
    private double minConfidence = 0.3;
    // 运动窗口内最小累计位移（像素）
    private double minMovement = 10;
    private int motionWindowFrames = 30;
    // 队色匹配阈值，由 ColorFilterStage.teamColorMatch 使用；默认的直通阶段不读取
    private double colorSimilarityThreshold = 0.4;
    private boolean filterOutsidePitch = true;
    // 超过该帧数未出现的轨迹从运动历史中移除
    private int staleTrackFrames = 90;
    // 归一化坐标换算为像素时使用的画面尺寸
    private int frameWidth = 1920;
    private int frameHeight = 1080;

    public int maxPlayersFor(GameFormat format) {
        Integer value = maxPlayers.get(format);
        return value != null ? value : defaultMaxPlayers().get(format);
    }

    private static Map<GameFormat, Integer> defaultMaxPlayers() {
        Map<GameFormat, Integer> defaults = new EnumMap<>(GameFormat.class);
        defaults.put(GameFormat.ELEVEN, 25);
        defaults.put(GameFormat.EIGHT, 20);
        defaults.put(GameFormat.FIVE, 15);
        return defaults;
    }
}
