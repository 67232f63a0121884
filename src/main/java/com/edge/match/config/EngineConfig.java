package com.edge.match.config;

import com.edge.match.core.dedup.BallPositionMatcher;
import com.edge.match.core.dedup.EventDeduplicator;
import com.edge.match.core.dedup.EventValidator;
import com.edge.match.core.dedup.PositionResolver;
import com.edge.match.core.detect.BallDetector;
import com.edge.match.core.detect.DetectorFactory;
import com.edge.match.core.detect.PlayerDetector;
import com.edge.match.core.event.EventDetector;
import com.edge.match.core.filter.DetectionFilterPipeline;
import com.edge.match.core.team.JerseyColorSampler;
import com.edge.match.core.team.TeamClassifier;
import com.edge.match.core.tracking.BallTrackSmoother;
import com.edge.match.core.transform.DltHomographyEstimator;
import com.edge.match.core.transform.HomographyEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 引擎组件配置
 * <p>
 * 从 application.yml 读取参数，创建无状态的算法组件；
 * 单场比赛的可变状态在 MatchAnalysisContext 中，不在这里创建
 */
@Configuration
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public EventDetector eventDetector() {
        logger.info("EventDetector config: {}", yamlConfig.getEvents());
        return new EventDetector(yamlConfig.getEvents());
    }

    @Bean
    public DetectionFilterPipeline detectionFilterPipeline() {
        logger.info("Detection filter config: {}", yamlConfig.getFilter());
        return new DetectionFilterPipeline(yamlConfig.getFilter());
    }

    @Bean
    public TeamClassifier teamClassifier() {
        logger.info("K-means config: {}", yamlConfig.getKmeans());
        return new TeamClassifier(yamlConfig.getKmeans());
    }

    @Bean
    public BallTrackSmoother ballTrackSmoother() {
        return new BallTrackSmoother(yamlConfig.getPrediction(), yamlConfig.getTracking().getBallMaxGapSeconds());
    }

    @Bean
    public HomographyEstimator homographyEstimator() {
        return new DltHomographyEstimator();
    }

    @Bean
    public JerseyColorSampler jerseyColorSampler() {
        return new JerseyColorSampler();
    }

    @Bean
    public EventDeduplicator eventDeduplicator() {
        logger.info("Deduplication config: {}", yamlConfig.getDeduplication());
        return new EventDeduplicator(yamlConfig.getDeduplication());
    }

    @Bean
    public EventValidator eventValidator() {
        return new EventValidator(yamlConfig.getValidation());
    }

    @Bean
    public PositionResolver positionResolver() {
        return new PositionResolver(new BallPositionMatcher(yamlConfig.getBallMatch()));
    }

    @Bean
    public PlayerDetector playerDetector() {
        PlayerDetector detector = DetectorFactory.createPlayerDetector(yamlConfig.getDetector());
        logger.info("Player detector: strategy={}, model={}", yamlConfig.getDetector().getStrategy(), detector.getModelId());
        return detector;
    }

    @Bean
    public BallDetector ballDetector() {
        BallDetector detector = DetectorFactory.createBallDetector(yamlConfig.getDetector());
        logger.info("Ball detector: strategy={}, model={}", yamlConfig.getDetector().getStrategy(), detector.getModelId());
        return detector;
    }
}
