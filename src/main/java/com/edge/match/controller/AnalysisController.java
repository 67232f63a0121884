package com.edge.match.controller;

import com.edge.match.dto.AnalysisRequest;
import com.edge.match.dto.MatchAnalysisResult;
import com.edge.match.exception.DetectionException;
import com.edge.match.service.MatchAnalysisService;
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
 * 比赛分析控制器
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "比赛分析", description = "跟踪、过滤、队伍分类与事件推断")
public class AnalysisController {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    @Autowired
    private MatchAnalysisService analysisService;

    @Operation(
            summary = "分析一场比赛",
            description = """
                    输入逐帧检测结果和足球检测，依次执行：
                    1. IoU 跟踪与检测过滤
                    2. 足球轨迹平滑
                    3. 球衣颜色聚类区分主客队
                    4. 控球片段、传球、带球、丢失/夺回球权推断

                    低置信度事件会出现在 pendingReviews 中等待人工复核。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "分析完成"),
            @ApiResponse(responseCode = "400", description = "请求参数错误"),
            @ApiResponse(responseCode = "502", description = "跟踪或分类阶段失败"),
            @ApiResponse(responseCode = "500", description = "服务器内部错误")
    })
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestBody AnalysisRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            MatchAnalysisResult result = analysisService.analyze(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);

        } catch (DetectionException e) {
            logger.error("Match analysis failed at stage {}", e.getStage(), e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            response.put("stage", e.getStage().name());
            response.put("retryable", e.isRetryable());
            return ResponseEntity.status(502).body(response);

        } catch (Exception e) {
            logger.error("Match analysis failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }
}
