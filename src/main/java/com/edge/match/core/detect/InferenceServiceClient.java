package com.edge.match.core.detect;

import com.edge.match.exception.DetectionException;
import com.edge.match.model.BoundingBox;
import com.edge.match.model.Detection;
import com.edge.match.model.Point;
import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 推理服务 HTTP 客户端
 * <p>
 * 接口：
 * - POST /detect/players
 * - POST /detect/ball
 * - GET  /health
 * <p>
 * 传输失败和 5xx 标记为可重试，4xx 和响应格式错误不可重试
 */
public class InferenceServiceClient {
    private static final Logger logger = LoggerFactory.getLogger(InferenceServiceClient.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final Gson gson = new Gson();
    private final OkHttpClient httpClient;
    private final DetectorConfig config;
    private final String baseUrl;

    public InferenceServiceClient(DetectorConfig config) {
        this.config = config;
        this.baseUrl = config.getBaseUrl().endsWith("/")
                ? config.getBaseUrl().substring(0, config.getBaseUrl().length() - 1)
                : config.getBaseUrl();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    public List<Detection> detectPlayers(EncodedFrame frame) {
        DetectRequest request = newRequest(frame);
        request.nmsThreshold = config.getNmsThreshold();

        PlayersResponse response = post("/detect/players", request, PlayersResponse.class);
        List<Detection> detections = new ArrayList<>();
        if (response.detections != null) {
            for (WireDetection wire : response.detections) {
                detections.add(wire.toDetection());
            }
        }
        logger.debug("Player detection returned {} detections in {} ms (model={})",
                detections.size(), response.inferenceTimeMs, response.modelId);
        return detections;
    }

    public Detection detectBall(EncodedFrame frame) {
        BallResponse response = post("/detect/ball", newRequest(frame), BallResponse.class);
        return response.detection != null ? response.detection.toDetection() : null;
    }

    /**
     * @return 服务返回的状态字段
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> health() {
        Request request = new Request.Builder().url(baseUrl + "/health").get().build();
        return execute(request, Map.class);
    }

    private DetectRequest newRequest(EncodedFrame frame) {
        DetectRequest request = new DetectRequest();
        request.frameData = Base64.getEncoder().encodeToString(frame.getData());
        request.width = frame.getWidth();
        request.height = frame.getHeight();
        request.confidenceThreshold = config.getConfidenceThreshold();
        return request;
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(gson.toJson(body), JSON))
                .build();
        return execute(request, responseType);
    }

    private <T> T execute(Request request, Class<T> responseType) {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                boolean retryable = response.code() >= 500;
                throw new DetectionException(DetectionException.Stage.DETECTION,
                        "Inference service " + request.url().encodedPath() + " failed with code: " + response.code(),
                        retryable);
            }
            ResponseBody body = response.body();
            T parsed = body != null ? gson.fromJson(body.string(), responseType) : null;
            if (parsed == null) {
                throw new DetectionException(DetectionException.Stage.DETECTION,
                        "Inference service returned an empty body for " + request.url().encodedPath(), false);
            }
            return parsed;
        } catch (IOException e) {
            logger.warn("Inference service call {} failed: {}", request.url(), e.getMessage());
            throw new DetectionException(DetectionException.Stage.DETECTION,
                    "Inference service unreachable: " + e.getMessage(), true, e);
        } catch (JsonSyntaxException e) {
            throw new DetectionException(DetectionException.Stage.DETECTION,
                    "Malformed inference response: " + e.getMessage(), false, e);
        }
    }

    // ==================== 传输对象 ====================

    static class DetectRequest {
        String frameData;
        int width;
        int height;
        Double confidenceThreshold;
        Double nmsThreshold;
    }

    static class PlayersResponse {
        List<WireDetection> detections;
        double inferenceTimeMs;
        String modelId;
    }

    static class BallResponse {
        WireDetection detection;
        double inferenceTimeMs;
        String modelId;
    }

    static class WireDetection {
        WireBox bbox;
        WirePoint center;
        double confidence;
        String label;
        Double classConfidence;

        Detection toDetection() {
            BoundingBox box = bbox != null ? new BoundingBox(bbox.x, bbox.y, bbox.w, bbox.h) : new BoundingBox();
            Point c = center != null ? new Point(center.x, center.y) : null;
            return new Detection(label, box, c, confidence, classConfidence);
        }
    }

    static class WireBox {
        double x;
        double y;
        double w;
        double h;
    }

    static class WirePoint {
        double x;
        double y;
    }
}
