package com.edge.match.dto;

import lombok.Data;

/**
 * 单帧检测请求，图像为 Base64 编码的 JPEG/PNG
 */
@Data
public class FrameDetectionRequest {
    private int frameNumber;
    private String imageBase64;
}
