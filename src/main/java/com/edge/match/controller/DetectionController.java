package com.edge.match.controller;

import com.edge.match.config.YamlConfig;
import com.edge.match.core.detect.InferenceServiceClient;
import com.edge.match.dto.FrameDetectionRequest;
import com.edge.match.dto.FrameDetectionResult;
import com.edge.match.exception.DetectionException;
import com.edge.match.service.FrameDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 单帧检测控制器
 */
@RestController
@RequestMapping("/api/detection")
@Tag(name = "单帧检测", description = "球员/足球检测与球衣颜色采样")
public class DetectionController {
    private static final Logger logger = LoggerFactory.getLogger(DetectionController.class);

    @Autowired
    private FrameDetectionService frameDetectionService;

    @Autowired
    private YamlConfig yamlConfig;

    @Operation(
            summary = "检测单帧",
            description = """
                    图像为 Base64 编码的 JPEG/PNG。检测器由 match-engine.detector.strategy 决定：
                    placeholder 返回空结果，remote 调用外部推理服务。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "检测完成"),
            @ApiResponse(responseCode = "400", description = "图像缺失或无法解码"),
            @ApiResponse(responseCode = "502", description = "推理服务调用失败"),
            @ApiResponse(responseCode = "503", description = "OpenCV 不可用")
    })
    @PostMapping("/frame")
    public ResponseEntity<Map<String, Object>> detectFrame(@RequestBody FrameDetectionRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            FrameDetectionResult result = frameDetectionService.detect(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);

        } catch (IllegalStateException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(503).body(response);

        } catch (DetectionException e) {
            logger.error("Frame detection failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            response.put("retryable", e.isRetryable());
            return ResponseEntity.status(502).body(response);

        } catch (Exception e) {
            logger.error("Frame detection failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * 推理服务健康检查，仅 remote 策略有效
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        String strategy = yamlConfig.getDetector().getStrategy();
        if (!"remote".equalsIgnoreCase(strategy)) {
            Map<String, Object> data = new HashMap<>();
            data.put("strategy", strategy);
            data.put("remote", false);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        }
        try {
            Map<String, Object> data = new HashMap<>(new InferenceServiceClient(yamlConfig.getDetector()).health());
            data.put("strategy", strategy);
            data.put("remote", true);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (DetectionException e) {
            logger.warn("Inference service health check failed: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            response.put("retryable", e.isRetryable());
            return ResponseEntity.status(502).body(response);
        }
    }
}
