package com.edge.match.dto;

import com.edge.match.core.dedup.RawEvent;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 事件去重请求
 * <p>
 * windows 不为空时，事件按 windowId 对应窗口换算绝对时间并施加边缘惩罚
 */
@Data
public class DeduplicationRequest {
    private List<RawEvent> events = new ArrayList<>();
    private List<WindowDto> windows = new ArrayList<>();
    // 用于确定事件位置的足球检测，可为空
    private List<BallDetectionDto> ballDetections = new ArrayList<>();
    private double fps = 30;

    @Data
    public static class WindowDto {
        private String windowId;
        private double absoluteStart;
        private double absoluteEnd;
        private double overlapBefore;
        private double overlapAfter;
    }
}
