package com.edge.match.controller;

import com.edge.match.config.YamlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 配置查看控制器
 */
@RestController
@RequestMapping("/api/config")
public class ConfigController {

    private static final Logger logger = LoggerFactory.getLogger(ConfigController.class);

    @Autowired
    private YamlConfig yamlConfig;

    /**
     * 当前生效的引擎参数
     */
    @GetMapping("/engine")
    public ResponseEntity<Map<String, Object>> getEngineConfig() {
        Map<String, Object> response = new HashMap<>();
        try {
            Map<String, Object> data = new HashMap<>();
            data.put("events", yamlConfig.getEvents());
            data.put("filter", yamlConfig.getFilter());
            data.put("kmeans", yamlConfig.getKmeans());
            data.put("prediction", yamlConfig.getPrediction());
            data.put("tracking", yamlConfig.getTracking());
            data.put("deduplication", yamlConfig.getDeduplication());
            data.put("validation", yamlConfig.getValidation());
            data.put("ballMatch", yamlConfig.getBallMatch());
            data.put("detector", yamlConfig.getDetector());

            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Failed to get engine config", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }
}
