package com.edge.match.controller;

import com.edge.match.core.transform.CoordinateTransform;
import com.edge.match.core.transform.HomographyEstimator;
import com.edge.match.dto.HomographyEstimateRequest;
import com.edge.match.dto.HomographyTransformRequest;
import com.edge.match.dto.KeypointDto;
import com.edge.match.model.FieldSize;
import com.edge.match.model.GameFormat;
import com.edge.match.model.HomographyData;
import com.edge.match.model.HomographyKeypoint;
import com.edge.match.model.Point;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 屏幕/场地坐标转换控制器
 */
@RestController
@RequestMapping("/api/homography")
@Tag(name = "坐标转换", description = "单应性矩阵估计与屏幕/场地坐标互转")
public class HomographyController {
    private static final Logger logger = LoggerFactory.getLogger(HomographyController.class);

    @Autowired
    private HomographyEstimator homographyEstimator;

    @Operation(
            summary = "由关键点估计单应性矩阵",
            description = """
                    至少 4 个屏幕点与场地点的对应关系。关键点未给出场地坐标时，
                    按 label 查找标准球场关键点（如 center、corner_tl）。
                    返回矩阵及重投影误差（米）。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "估计成功"),
            @ApiResponse(responseCode = "400", description = "关键点不足或退化"),
            @ApiResponse(responseCode = "500", description = "服务器内部错误")
    })
    @PostMapping("/estimate")
    public ResponseEntity<Map<String, Object>> estimate(@RequestBody HomographyEstimateRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            FieldSize fieldSize = fieldSizeOf(request.getGameFormat());
            List<HomographyKeypoint> keypoints = new ArrayList<>();
            for (KeypointDto dto : request.getKeypoints()) {
                keypoints.add(dto.toKeypoint(fieldSize));
            }

            double[][] matrix = homographyEstimator.estimate(keypoints);
            if (matrix == null) {
                response.put("status", "error");
                response.put("message", "Keypoints are degenerate, homography cannot be determined");
                return ResponseEntity.badRequest().body(response);
            }

            double reprojectionError = CoordinateTransform.computeReprojectionError(matrix, keypoints);
            logger.info("Homography estimated for frame {} from {} keypoints, reprojection error {} m",
                    request.getFrameNumber(), keypoints.size(), String.format("%.3f", reprojectionError));

            Map<String, Object> data = new HashMap<>();
            data.put("frameNumber", request.getFrameNumber());
            data.put("matrix", matrix);
            data.put("reprojectionError", reprojectionError);
            data.put("fieldSize", fieldSize);

            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);

        } catch (Exception e) {
            logger.error("Failed to estimate homography", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    @Operation(summary = "坐标转换", description = "direction 为 SCREEN_TO_FIELD 或 FIELD_TO_SCREEN")
    @PostMapping("/transform")
    public ResponseEntity<Map<String, Object>> transform(@RequestBody HomographyTransformRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            if (request.getMatrix() == null || request.getMatrix().length != 3) {
                response.put("status", "error");
                response.put("message", "matrix must be 3x3");
                return ResponseEntity.badRequest().body(response);
            }
            for (double[] row : request.getMatrix()) {
                if (row == null || row.length != 3) {
                    response.put("status", "error");
                    response.put("message", "matrix must be 3x3");
                    return ResponseEntity.badRequest().body(response);
                }
            }

            FieldSize fieldSize = fieldSizeOf(request.getGameFormat());
            HomographyData homography = new HomographyData(0, request.getMatrix(), new ArrayList<>(), 1.0,
                    fieldSize, false);
            String direction = request.getDirection() == null ? "SCREEN_TO_FIELD" : request.getDirection().toUpperCase();

            List<Point> points = new ArrayList<>();
            List<Boolean> onPitch = new ArrayList<>();
            switch (direction) {
                case "SCREEN_TO_FIELD":
                    for (Point p : request.getPoints()) {
                        Point field = CoordinateTransform.screenToField(homography, p);
                        points.add(field);
                        onPitch.add(CoordinateTransform.isOnPitch(field, fieldSize));
                    }
                    break;
                case "FIELD_TO_SCREEN":
                    for (Point p : request.getPoints()) {
                        Point screen = CoordinateTransform.fieldToScreen(homography, p);
                        if (screen == null) {
                            response.put("status", "error");
                            response.put("message", "matrix is not invertible");
                            return ResponseEntity.badRequest().body(response);
                        }
                        points.add(screen);
                        onPitch.add(CoordinateTransform.isOnPitch(p, fieldSize));
                    }
                    break;
                default:
                    response.put("status", "error");
                    response.put("message", "Unknown direction: " + request.getDirection());
                    return ResponseEntity.badRequest().body(response);
            }

            Map<String, Object> data = new HashMap<>();
            data.put("direction", direction);
            data.put("points", points);
            data.put("onPitch", onPitch);

            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Failed to transform points", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    private static FieldSize fieldSizeOf(GameFormat format) {
        return (format != null ? format : GameFormat.ELEVEN).fieldSize();
    }
}
