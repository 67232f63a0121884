package com.edge.match.core.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 按配置创建检测器
 * <p>
 * strategy:
 * - "placeholder": 不依赖模型，返回空结果
 * - "remote": 调用外部推理服务
 */
public class DetectorFactory {
    private static final Logger logger = LoggerFactory.getLogger(DetectorFactory.class);

    public static final String PLACEHOLDER = "placeholder";
    public static final String REMOTE = "remote";

    /**
     * @throws IllegalArgumentException 未知策略
     */
    public static PlayerDetector createPlayerDetector(DetectorConfig config) {
        String strategy = normalize(config);
        switch (strategy) {
            case PLACEHOLDER:
                return new PlaceholderPlayerDetector();
            case REMOTE:
                logger.info("Using remote player detector at {}", config.getBaseUrl());
                return new RemotePlayerDetector(new InferenceServiceClient(config));
            default:
                throw new IllegalArgumentException("Unsupported detector strategy: " + config.getStrategy());
        }
    }

    public static BallDetector createBallDetector(DetectorConfig config) {
        String strategy = normalize(config);
        switch (strategy) {
            case PLACEHOLDER:
                return new PlaceholderBallDetector();
            case REMOTE:
                logger.info("Using remote ball detector at {}", config.getBaseUrl());
                return new RemoteBallDetector(new InferenceServiceClient(config));
            default:
                throw new IllegalArgumentException("Unsupported detector strategy: " + config.getStrategy());
        }
    }

    private static String normalize(DetectorConfig config) {
        if (config == null || config.getStrategy() == null) {
            return PLACEHOLDER;
        }
        return config.getStrategy().trim().toLowerCase();
    }
}
