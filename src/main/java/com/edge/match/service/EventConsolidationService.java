package com.edge.match.service;

import com.edge.match.config.YamlConfig;
import com.edge.match.core.dedup.AnalysisWindow;
import com.edge.match.core.dedup.DeduplicatedEvent;
import com.edge.match.core.dedup.EnsembleConfidence;
import com.edge.match.core.dedup.EventDeduplicator;
import com.edge.match.core.dedup.EventValidator;
import com.edge.match.core.dedup.PositionResolver;
import com.edge.match.core.dedup.RawEvent;
import com.edge.match.core.dedup.ValidationResult;
import com.edge.match.dto.BallDetectionDto;
import com.edge.match.dto.DeduplicationRequest;
import com.edge.match.dto.DeduplicationResult;
import com.edge.match.model.BallDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 多窗口事件合并服务：窗口换算 -> 去重 -> 一致性校验 -> 位置确定
 */
@Service
public class EventConsolidationService {
    private static final Logger logger = LoggerFactory.getLogger(EventConsolidationService.class);

    @Autowired
    private EventDeduplicator deduplicator;

    @Autowired
    private EventValidator validator;

    @Autowired
    private PositionResolver positionResolver;

    @Autowired
    private YamlConfig config;

    public DeduplicationResult consolidate(DeduplicationRequest request) {
        if (request == null || request.getEvents() == null) {
            throw new IllegalArgumentException("events are required");
        }
        List<RawEvent> events = request.getEvents();
        applyWindows(events, request.getWindows());

        List<DeduplicatedEvent> deduplicated = deduplicator.deduplicate(events);
        // 校验在位置解析之前，只使用事件自带的位置
        ValidationResult validation = validator.validate(deduplicated);

        List<BallDetection> balls = new ArrayList<>();
        for (BallDetectionDto dto : request.getBallDetections()) {
            balls.add(dto.toBallDetection(request.getFps()));
        }
        int ballMatches = 0;
        for (DeduplicatedEvent event : deduplicated) {
            boolean ballMatched = positionResolver.apply(event, balls);
            if (ballMatched) {
                ballMatches++;
            }
            event.setEnsembleConfidence(EnsembleConfidence.calculate(event, false, false, ballMatched));
        }

        DeduplicationResult result = new DeduplicationResult();
        result.setEvents(deduplicated);
        result.setStats(EventDeduplicator.stats(events, deduplicated));
        result.setValid(validation.isValid());
        result.setErrors(validation.getErrors());
        result.setWarnings(validation.getWarnings());
        result.setValidationSummary(validation.summary());
        result.setBallPositionMatches(ballMatches);

        logger.info("Consolidated {} raw events into {} ({} ball-positioned), {}",
                events.size(), deduplicated.size(), ballMatches, validation.summary());
        return result;
    }

    /**
     * 对声明了窗口的事件换算绝对时间；未声明窗口的事件保持原样
     */
    void applyWindows(List<RawEvent> events, List<DeduplicationRequest.WindowDto> windows) {
        if (windows == null || windows.isEmpty()) {
            return;
        }
        Map<String, AnalysisWindow> byId = new HashMap<>();
        for (DeduplicationRequest.WindowDto dto : windows) {
            byId.put(dto.getWindowId(), new AnalysisWindow(dto.getWindowId(), dto.getAbsoluteStart(),
                    dto.getAbsoluteEnd(), dto.getOverlapBefore(), dto.getOverlapAfter()));
        }
        for (RawEvent event : events) {
            if (event == null) {
                continue;
            }
            AnalysisWindow window = byId.get(event.getWindowId());
            if (window != null) {
                window.adjust(event, config.getDeduplication().getWindowEdgePenalty());
            }
        }
    }
}
