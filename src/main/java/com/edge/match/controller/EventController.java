package com.edge.match.controller;

import com.edge.match.dto.DeduplicationRequest;
import com.edge.match.dto.DeduplicationResult;
import com.edge.match.service.EventConsolidationService;
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
 * 多窗口事件去重控制器
 */
@RestController
@RequestMapping("/api/events")
@Tag(name = "事件去重", description = "重叠分析窗口的事件合并、位置确定与一致性校验")
public class EventController {
    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    @Autowired
    private EventConsolidationService consolidationService;

    @Operation(
            summary = "去重并校验事件",
            description = """
                    同类型、同队伍且时间差在阈值内的事件合并为一个，
                    多窗口检出的事件置信度提升。合并后按足球检测 > 模型坐标 > 区域中心确定位置，
                    并做时间、逻辑、位置三类一致性校验。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "处理完成，校验错误在 data.errors 中"),
            @ApiResponse(responseCode = "400", description = "事件结构不合法"),
            @ApiResponse(responseCode = "500", description = "服务器内部错误")
    })
    @PostMapping("/deduplicate")
    public ResponseEntity<Map<String, Object>> deduplicate(@RequestBody DeduplicationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            DeduplicationResult result = consolidationService.consolidate(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);

        } catch (Exception e) {
            logger.error("Event deduplication failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }
}
