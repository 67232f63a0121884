package com.edge.match.config;

import com.edge.match.core.dedup.BallMatchConfig;
import com.edge.match.core.dedup.DeduplicationConfig;
import com.edge.match.core.dedup.ValidationConfig;
import com.edge.match.core.detect.DetectorConfig;
import com.edge.match.core.event.EventDetectionConfig;
import com.edge.match.core.filter.FilterConfig;
import com.edge.match.core.team.KMeansConfig;
import com.edge.match.core.tracking.PredictionConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "match-engine")
public class YamlConfig {
    private EventDetectionConfig events = new EventDetectionConfig();
    private FilterConfig filter = new FilterConfig();
    private KMeansConfig kmeans = new KMeansConfig();
    private PredictionConfig prediction = new PredictionConfig();
    private TrackingConfig tracking = new TrackingConfig();
    private DeduplicationConfig deduplication = new DeduplicationConfig();
    private ValidationConfig validation = new ValidationConfig();
    private BallMatchConfig ballMatch = new BallMatchConfig();
    private DetectorConfig detector = new DetectorConfig();

    @Data
    public static class TrackingConfig {
        // 同标签检测与轨迹匹配的最小 IoU
        private double iouThreshold = 0.3;
        // 超过该帧数未匹配的轨迹被移除
        private int maxAge = 30;
        // 足球轨迹允许预测填补的最大空缺（秒）
        private double ballMaxGapSeconds = 1.0;
    }
}
