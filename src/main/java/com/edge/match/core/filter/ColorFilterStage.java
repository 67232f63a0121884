package com.edge.match.core.filter;

import com.edge.match.core.team.ColorUtils;
import com.edge.match.model.Detection;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 队服颜色过滤阶段
 */
@FunctionalInterface
public interface ColorFilterStage {

    /**
     * @return 通过过滤的检测
     */
    List<Detection> filter(List<Detection> detections, String homeColor, String awayColor);

    /**
     * 直通实现，在具备可靠的颜色提取之前使用
     */
    static ColorFilterStage passThrough() {
        return (detections, homeColor, awayColor) -> detections;
    }

    /**
     * 按队色过滤：颜色与任一队色的差异小于阈值才保留，取不到颜色的检测放行
     *
     * @param jerseyColorOf 检测对应的队服颜色（hex），未知时返回 null
     * @param threshold     见 {@link FilterConfig#getColorSimilarityThreshold()}
     */
    static ColorFilterStage teamColorMatch(Function<Detection, String> jerseyColorOf, double threshold) {
        return (detections, homeColor, awayColor) -> detections.stream()
                .filter(d -> {
                    String hex = jerseyColorOf.apply(d);
                    if (hex == null) {
                        return true;
                    }
                    return ColorUtils.matchesTeamColor(ColorUtils.hexToRgb(hex), homeColor, threshold)
                            || ColorUtils.matchesTeamColor(ColorUtils.hexToRgb(hex), awayColor, threshold);
                })
                .collect(Collectors.toList());
    }
}
