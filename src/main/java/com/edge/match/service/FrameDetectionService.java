package com.edge.match.service;

import com.edge.match.config.NativeLibraryLoader;
import com.edge.match.core.detect.BallDetector;
import com.edge.match.core.detect.EncodedFrame;
import com.edge.match.core.detect.PlayerDetector;
import com.edge.match.core.team.JerseyColorSampler;
import com.edge.match.dto.DetectionDto;
import com.edge.match.dto.FrameDetectionRequest;
import com.edge.match.dto.FrameDetectionResult;
import com.edge.match.model.Detection;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.List;

/**
 * 单帧检测服务
 * <p>
 * 解码图像后调用球员/足球检测器，并为每名球员采样球衣颜色，
 * 结果可直接作为比赛分析请求中的一帧
 */
@Service
public class FrameDetectionService {
    private static final Logger logger = LoggerFactory.getLogger(FrameDetectionService.class);

    @Autowired
    private PlayerDetector playerDetector;

    @Autowired
    private BallDetector ballDetector;

    @Autowired
    private JerseyColorSampler jerseyColorSampler;

    public FrameDetectionResult detect(FrameDetectionRequest request) {
        if (request == null || request.getImageBase64() == null || request.getImageBase64().isBlank()) {
            throw new IllegalArgumentException("imageBase64 is required");
        }
        if (!NativeLibraryLoader.loadNativeLibraries()) {
            throw new IllegalStateException("OpenCV is not available, frame detection disabled");
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(stripDataUri(request.getImageBase64()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("imageBase64 is not valid Base64", e);
        }

        Mat frame = decode(bytes);
        try {
            long startTime = System.currentTimeMillis();
            EncodedFrame encoded = EncodedFrame.fromMat(frame);

            List<Detection> players = playerDetector.detectPlayers(encoded);
            Detection ball = ballDetector.detectBall(encoded);

            FrameDetectionResult result = new FrameDetectionResult();
            result.setFrameNumber(request.getFrameNumber());
            result.setWidth(frame.cols());
            result.setHeight(frame.rows());
            for (Detection player : players) {
                String color = jerseyColorSampler.sample(frame, player.getBbox()).toHex();
                result.getPlayers().add(DetectionDto.from(player, color));
            }
            if (ball != null) {
                result.setBall(DetectionDto.from(ball, null));
            }
            result.setPlayerModelId(playerDetector.getModelId());
            result.setBallModelId(ballDetector.getModelId());

            logger.info("Frame {} detected in {} ms: players={}, ball={}", request.getFrameNumber(),
                    System.currentTimeMillis() - startTime, players.size(), ball != null);
            return result;
        } finally {
            frame.release();
        }
    }

    private static Mat decode(byte[] bytes) {
        MatOfByte buffer = new MatOfByte(bytes);
        try {
            Mat frame = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
            if (frame == null || frame.empty()) {
                throw new IllegalArgumentException("imageBase64 is not a decodable image");
            }
            return frame;
        } finally {
            buffer.release();
        }
    }

    // data:image/jpeg;base64,xxxx
    static String stripDataUri(String value) {
        int comma = value.indexOf(',');
        return value.startsWith("data:") && comma > 0 ? value.substring(comma + 1) : value.trim();
    }
}
