package com.edge.match.core.detect;

import lombok.Data;

/**
 * 检测器配置
 */
@Data
public class DetectorConfig {
    // placeholder 或 remote
    private String strategy = "placeholder";
    // 推理服务地址
    private String baseUrl = "http://localhost:8080";
    private int timeoutSeconds = 30;
    private double confidenceThreshold = 0.5;
    private double nmsThreshold = 0.45;
}
