package com.edge.match.core.transform;

import com.edge.match.model.FieldSize;
import com.edge.match.model.HomographyData;
import com.edge.match.model.HomographyKeypoint;
import com.edge.match.model.Point;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 直接线性变换（DLT）单应性估计
 * <p>
 * 每个对应点 (x,y) -> (x',y') 贡献两行：
 * <pre>
 * [-x, -y, -1,  0,  0,  0, x*x', y*x', x']
 * [ 0,  0,  0, -x, -y, -1, x*y', y*y', y']
 * </pre>
 * A·h = 0 的最小二乘解为 A 最小奇异值对应的右奇异向量。
 * 求解前对两组点做 Hartley 归一化（质心移到原点，平均距离 sqrt(2)）
 */
public class DltHomographyEstimator implements HomographyEstimator {
    private static final Logger logger = LoggerFactory.getLogger(DltHomographyEstimator.class);

    private static final int MIN_CORRESPONDENCES = 4;
    // 次小奇异值与最大奇异值之比低于此值认为解不唯一（如点共线）
    private static final double RANK_TOLERANCE = 1e-9;

    @Override
    public double[][] estimate(List<HomographyKeypoint> keypoints) {
        if (keypoints == null || keypoints.size() < MIN_CORRESPONDENCES) {
            throw new IllegalArgumentException("Homography estimation requires at least "
                    + MIN_CORRESPONDENCES + " correspondences, got "
                    + (keypoints == null ? 0 : keypoints.size()));
        }

        int n = keypoints.size();
        Point[] src = new Point[n];
        Point[] dst = new Point[n];
        for (int i = 0; i < n; i++) {
            HomographyKeypoint kp = keypoints.get(i);
            if (kp.getScreen() == null || kp.getField() == null) {
                throw new IllegalArgumentException("Keypoint " + i + " is missing screen or field coordinates");
            }
            src[i] = kp.getScreen();
            dst[i] = kp.getField();
        }

        double[][] srcNorm = normalizationMatrix(src);
        double[][] dstNorm = normalizationMatrix(dst);

        // 行数不足 9 时补零行，保证 SVD 给出完整的 9x9 右奇异矩阵
        int rows = Math.max(2 * n, 9);
        double[][] a = new double[rows][9];
        for (int i = 0; i < n; i++) {
            Point s = CoordinateTransform.transformPoint(srcNorm, src[i]);
            Point d = CoordinateTransform.transformPoint(dstNorm, dst[i]);
            double x = s.x, y = s.y, xp = d.x, yp = d.y;

            a[2 * i] = new double[]{-x, -y, -1, 0, 0, 0, x * xp, y * xp, xp};
            a[2 * i + 1] = new double[]{0, 0, 0, -x, -y, -1, x * yp, y * yp, yp};
        }

        RealMatrix matrixA = new Array2DRowRealMatrix(a, false);
        SingularValueDecomposition svd = new SingularValueDecomposition(matrixA);
        double[] singularValues = svd.getSingularValues();

        double largest = singularValues[0];
        double secondSmallest = singularValues[singularValues.length - 2];
        if (largest <= 0 || secondSmallest / largest < RANK_TOLERANCE) {
            logger.warn("Homography is not uniquely determined by {} correspondences (degenerate layout)", n);
            return null;
        }

        double[] h = svd.getV().getColumn(8);
        double[][] normalized = {
                {h[0], h[1], h[2]},
                {h[3], h[4], h[5]},
                {h[6], h[7], h[8]}
        };

        // 反归一化：H = T_dst^-1 · H_n · T_src
        double[][] dstInverse = CoordinateTransform.invert(dstNorm);
        if (dstInverse == null) {
            return null;
        }
        double[][] result = CoordinateTransform.multiply(CoordinateTransform.multiply(dstInverse, normalized), srcNorm);

        double scale = result[2][2];
        if (Math.abs(scale) > CoordinateTransform.EPSILON) {
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) {
                    result[i][j] /= scale;
                }
            }
        }

        logger.debug("Estimated homography from {} correspondences, reprojection error={}",
                n, CoordinateTransform.computeReprojectionError(result, keypoints));
        return result;
    }

    /**
     * 估计矩阵并打包为 HomographyData，置信度取关键点置信度均值
     *
     * @return 估计失败时返回 null
     */
    public HomographyData createHomographyData(int frameNumber, List<HomographyKeypoint> keypoints, FieldSize fieldSize) {
        double[][] matrix = estimate(keypoints);
        if (matrix == null) {
            return null;
        }
        double avgConfidence = keypoints.stream()
                .mapToDouble(HomographyKeypoint::getConfidence)
                .average()
                .orElse(0);
        return new HomographyData(frameNumber, matrix, keypoints, avgConfidence, fieldSize, false);
    }

    /**
     * Hartley 归一化矩阵
     */
    private double[][] normalizationMatrix(Point[] points) {
        double cx = 0, cy = 0;
        for (Point p : points) {
            cx += p.x;
            cy += p.y;
        }
        cx /= points.length;
        cy /= points.length;

        double meanDist = 0;
        for (Point p : points) {
            meanDist += Math.hypot(p.x - cx, p.y - cy);
        }
        meanDist /= points.length;

        double s = meanDist > CoordinateTransform.EPSILON ? Math.sqrt(2) / meanDist : 1.0;
        return new double[][]{
                {s, 0, -s * cx},
                {0, s, -s * cy},
                {0, 0, 1}
        };
    }
}
