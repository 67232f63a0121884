package com.edge.match.core.transform;

import com.edge.match.model.FieldSize;
import com.edge.match.model.HomographyData;
import com.edge.match.model.HomographyKeypoint;
import com.edge.match.model.Point;

import java.util.List;

/**
 * 屏幕坐标与场地坐标之间的投影变换
 * <p>
 * 屏幕坐标为归一化 [0,1]，场地坐标以球场中心为原点，单位为米。
 * 变换公式：(x', y') = (H · [x, y, 1]) / w
 * <p>
 * 约定：
 * - |w| < EPSILON 时变换退化，返回 {@link Point#ORIGIN} 作为哨兵
 * - 矩阵不可逆（|det| < EPSILON）时求逆返回 null
 */
public final class CoordinateTransform {

    public static final double EPSILON = 1e-10;

    private CoordinateTransform() {
    }

    /**
     * 对单点应用 3x3 投影矩阵
     */
    public static Point transformPoint(double[][] h, Point p) {
        double x = h[0][0] * p.x + h[0][1] * p.y + h[0][2];
        double y = h[1][0] * p.x + h[1][1] * p.y + h[1][2];
        double w = h[2][0] * p.x + h[2][1] * p.y + h[2][2];

        if (Math.abs(w) < EPSILON) {
            return Point.ORIGIN;
        }
        return new Point(x / w, y / w);
    }

    /**
     * 投影后 w 分量接近 0，说明该点无法映射
     */
    public static boolean isDegenerate(double[][] h, Point p) {
        double w = h[2][0] * p.x + h[2][1] * p.y + h[2][2];
        return Math.abs(w) < EPSILON;
    }

    /**
     * 屏幕 -> 场地
     */
    public static Point screenToField(HomographyData homography, Point screenPoint) {
        return transformPoint(homography.getMatrix(), screenPoint);
    }

    /**
     * 场地 -> 屏幕
     *
     * @return 屏幕坐标，矩阵不可逆时返回 null
     */
    public static Point fieldToScreen(HomographyData homography, Point fieldPoint) {
        double[][] inverse = invert(homography.getMatrix());
        if (inverse == null) {
            return null;
        }
        return transformPoint(inverse, fieldPoint);
    }

    /**
     * 场地坐标下两点距离（米）
     */
    public static double fieldDistance(Point p1, Point p2) {
        return p1.distanceTo(p2);
    }

    /**
     * 判断场地坐标是否在球场范围内（边线上算在场内）
     */
    public static boolean isOnPitch(Point fieldPoint, FieldSize fieldSize) {
        double halfLength = fieldSize.getLength() / 2;
        double halfWidth = fieldSize.getWidth() / 2;
        return Math.abs(fieldPoint.x) <= halfLength && Math.abs(fieldPoint.y) <= halfWidth;
    }

    /**
     * 平均重投影误差（米）：关键点屏幕坐标经 H 投影后与其场地坐标的距离均值
     *
     * @return 无关键点时返回正无穷
     */
    public static double computeReprojectionError(double[][] h, List<HomographyKeypoint> keypoints) {
        if (keypoints == null || keypoints.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        double total = 0;
        for (HomographyKeypoint kp : keypoints) {
            Point projected = transformPoint(h, kp.getScreen());
            total += projected.distanceTo(kp.getField());
        }
        return total / keypoints.size();
    }

    /**
     * 在两个关键帧单应性之间按帧号线性插值
     * <p>
     * t = (frame - f1) / (f2 - f1)，截断到 [0,1]；两帧相同时直接返回 h1。
     * 插值结果标记为摄像机移动中
     */
    public static HomographyData interpolateHomography(HomographyData h1, HomographyData h2, int targetFrame) {
        if (h1.getFrameNumber() == h2.getFrameNumber()) {
            return h1;
        }

        double t = (double) (targetFrame - h1.getFrameNumber()) / (h2.getFrameNumber() - h1.getFrameNumber());
        double clampedT = Math.max(0, Math.min(1, t));

        double[][] m1 = h1.getMatrix();
        double[][] m2 = h2.getMatrix();
        double[][] matrix = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                matrix[i][j] = m1[i][j] + clampedT * (m2[i][j] - m1[i][j]);
            }
        }

        double confidence = h1.getConfidence() + clampedT * (h2.getConfidence() - h1.getConfidence());
        return new HomographyData(targetFrame, matrix, h1.getKeypoints(), confidence, h1.getFieldSize(), true);
    }

    // ==================== 矩阵运算工具方法 ====================

    /**
     * 3x3 矩阵求逆（余子式 / 行列式）
     *
     * @return 逆矩阵，|det| < EPSILON 时返回 null
     */
    public static double[][] invert(double[][] m) {
        double det = determinant(m);
        if (Math.abs(det) < EPSILON) {
            return null;
        }

        double invDet = 1.0 / det;
        return new double[][]{
                {
                        (m[1][1] * m[2][2] - m[1][2] * m[2][1]) * invDet,
                        (m[0][2] * m[2][1] - m[0][1] * m[2][2]) * invDet,
                        (m[0][1] * m[1][2] - m[0][2] * m[1][1]) * invDet
                },
                {
                        (m[1][2] * m[2][0] - m[1][0] * m[2][2]) * invDet,
                        (m[0][0] * m[2][2] - m[0][2] * m[2][0]) * invDet,
                        (m[0][2] * m[1][0] - m[0][0] * m[1][2]) * invDet
                },
                {
                        (m[1][0] * m[2][1] - m[1][1] * m[2][0]) * invDet,
                        (m[0][1] * m[2][0] - m[0][0] * m[2][1]) * invDet,
                        (m[0][0] * m[1][1] - m[0][1] * m[1][0]) * invDet
                }
        };
    }

    public static double determinant(double[][] m) {
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    public static double[][] multiply(double[][] a, double[][] b) {
        double[][] result = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                for (int k = 0; k < 3; k++) {
                    result[i][j] += a[i][k] * b[k][j];
                }
            }
        }
        return result;
    }
}
