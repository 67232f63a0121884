package com.edge.match.core.tracking;

import com.edge.match.model.Point;

/**
 * 卡尔曼滤波器
 * <p>
 * 用于平滑轨迹中心点，并在遮挡期间预测位置
 * <p>
 * 状态向量: x = [px, py, vx, vy]^T，匀速运动模型
 * <p>
 * 矩阵定义:
 * F = [1, 0, dt,  0]    H = [1, 0, 0, 0]
 *     [0, 1,  0, dt]        [0, 1, 0, 0]
 *     [0, 0,  1,  0]
 *     [0, 0,  0,  1]
 * <p>
 * Q 为连续白噪声加速度模型，按 dt^4/4, dt^3/2, dt^2 缩放，乘以 processNoise^2；
 * R = measurementNoise^2 · I2
 */
public class KalmanFilter {
    // 状态向量 [px, py, vx, vy]
    private double[] x;

    // 状态协方差矩阵 P (4x4)
    private double[][] P;

    // 观测矩阵 H (2x4)
    private static final double[][] H = {
            {1, 0, 0, 0},
            {0, 1, 0, 0}
    };

    // 观测噪声协方差 R (2x2)
    private final double[][] R;

    private final PredictionConfig config;

    // 状态所对应的时间（秒）
    private double stateTime;

    // 最近一次真实观测
    private double lastUpdateTime;
    private int lastObservationFrame;

    private boolean initialized;

    public KalmanFilter(PredictionConfig config) {
        this.config = config;
        double r = config.getMeasurementNoise() * config.getMeasurementNoise();
        this.R = new double[][]{
                {r, 0},
                {0, r}
        };
        this.initialized = false;
    }

    public KalmanFilter() {
        this(new PredictionConfig());
    }

    /**
     * 以首次观测初始化，速度为 0，协方差为单位阵
     */
    public void init(Point initialPoint, int frameNumber, double timestamp) {
        this.x = new double[]{initialPoint.x, initialPoint.y, 0, 0};
        this.P = identity4x4();
        this.stateTime = timestamp;
        this.lastUpdateTime = timestamp;
        this.lastObservationFrame = frameNumber;
        this.initialized = true;
    }

    /**
     * 预测步骤（时间更新）
     * <p>
     * x_pred = F * x
     * P_pred = F * P * F^T + Q
     * <p>
     * dt <= 0 时不做任何事
     */
    public void predict(double dt) {
        checkInitialized();
        if (dt <= 0) {
            return;
        }

        double[][] F = transitionMatrix(dt);
        this.x = matrixVectorMultiply(F, x);
        this.P = matrixAdd(matrixMultiply(matrixMultiply(F, P), matrixTranspose(F)), processNoise(dt));
        this.stateTime += dt;
    }

    /**
     * 预测到指定时刻，早于当前状态时间时不做任何事
     */
    public void predictTo(double timestamp) {
        predict(timestamp - stateTime);
    }

    /**
     * 更新步骤（观测更新）
     * <p>
     * 观测时间晚于当前状态时间时先预测到观测时刻。
     * y = z - H * x, S = H * P * H^T + R, K = P * H^T * S^-1。
     * S 奇异时保持先验估计不变
     *
     * @param measurement 观测位置
     * @param frameNumber 观测帧号
     * @param timestamp   观测时间（秒）
     */
    public void update(Point measurement, int frameNumber, double timestamp) {
        if (!initialized) {
            init(measurement, frameNumber, timestamp);
            return;
        }

        if (timestamp > stateTime) {
            predict(timestamp - stateTime);
        }

        double[] z = new double[]{measurement.x, measurement.y};
        double[] y = vectorSubtract(z, matrixVectorMultiply(H, x));

        double[][] HT = matrixTranspose(H);
        double[][] PHT = matrixMultiply(P, HT);               // 4x2
        double[][] S = matrixAdd(matrixMultiply(H, PHT), R);  // 2x2

        double[][] SInv = matrixInverse2x2(S);
        if (SInv == null) {
            return;
        }

        double[][] K = matrixMultiply(PHT, SInv);             // 4x2
        this.x = vectorAdd(x, matrixVectorMultiply(K, y));
        this.P = matrixMultiply(matrixSubtract(identity4x4(), matrixMultiply(K, H)), P);

        this.lastUpdateTime = timestamp;
        this.lastObservationFrame = frameNumber;
    }

    /**
     * 置信度随距上次观测的时间指数衰减：exp(-decayRate * Δt)
     */
    public double getConfidence(double currentTime) {
        double elapsed = Math.max(0, currentTime - lastUpdateTime);
        return Math.max(0, Math.exp(-config.getConfidenceDecayRate() * elapsed));
    }

    /**
     * 距上次观测不超过 maxPredictionTime 时预测可用
     */
    public boolean isPredictionValid(double currentTime) {
        return currentTime - lastUpdateTime <= config.getMaxPredictionTime();
    }

    /**
     * 按当前速度外推到指定时刻，不修改滤波器状态；早于状态时间时返回当前估计
     */
    public Point extrapolateTo(double timestamp) {
        checkInitialized();
        double dt = Math.max(0, timestamp - stateTime);
        return new Point(x[0] + x[2] * dt, x[1] + x[3] * dt);
    }

    public PredictedPosition toPredictedPosition(String trackId, int frameNumber, double currentTime) {
        double sinceObservation = Math.max(0, currentTime - lastUpdateTime);
        return new PredictedPosition(trackId, frameNumber, extrapolateTo(currentTime), getEstimatedVelocity(),
                frameNumber != lastObservationFrame, getConfidence(currentTime),
                lastObservationFrame, sinceObservation);
    }

    public Point getEstimatedPosition() {
        checkInitialized();
        return new Point(x[0], x[1]);
    }

    public Point getEstimatedVelocity() {
        checkInitialized();
        return new Point(x[2], x[3]);
    }

    /**
     * 位置不确定性 = sqrt(P[0][0] + P[1][1])
     */
    public double getPositionUncertainty() {
        checkInitialized();
        return Math.sqrt(P[0][0] + P[1][1]);
    }

    public double getStateTime() {
        return stateTime;
    }

    public double getLastUpdateTime() {
        return lastUpdateTime;
    }

    public int getLastObservationFrame() {
        return lastObservationFrame;
    }

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("KalmanFilter not initialized. Call init() first.");
        }
    }

    // ==================== 矩阵运算工具方法 ====================

    private static double[][] transitionMatrix(double dt) {
        return new double[][]{
                {1, 0, dt, 0},
                {0, 1, 0, dt},
                {0, 0, 1, 0},
                {0, 0, 0, 1}
        };
    }

    private double[][] processNoise(double dt) {
        double q = config.getProcessNoise() * config.getProcessNoise();
        double dt2 = dt * dt;
        double dt3 = dt2 * dt;
        double dt4 = dt3 * dt;
        return new double[][]{
                {q * dt4 / 4, 0, q * dt3 / 2, 0},
                {0, q * dt4 / 4, 0, q * dt3 / 2},
                {q * dt3 / 2, 0, q * dt2, 0},
                {0, q * dt3 / 2, 0, q * dt2}
        };
    }

    private static double[][] identity4x4() {
        return new double[][]{
                {1, 0, 0, 0},
                {0, 1, 0, 0},
                {0, 0, 1, 0},
                {0, 0, 0, 1}
        };
    }

    private static double[] matrixVectorMultiply(double[][] matrix, double[] vector) {
        double[] result = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[0].length; j++) {
                result[i] += matrix[i][j] * vector[j];
            }
        }
        return result;
    }

    private static double[][] matrixMultiply(double[][] A, double[][] B) {
        int rowsA = A.length;
        int colsA = A[0].length;
        int colsB = B[0].length;
        double[][] result = new double[rowsA][colsB];
        for (int i = 0; i < rowsA; i++) {
            for (int j = 0; j < colsB; j++) {
                for (int k = 0; k < colsA; k++) {
                    result[i][j] += A[i][k] * B[k][j];
                }
            }
        }
        return result;
    }

    private static double[][] matrixTranspose(double[][] matrix) {
        double[][] result = new double[matrix[0].length][matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[0].length; j++) {
                result[j][i] = matrix[i][j];
            }
        }
        return result;
    }

    private static double[] vectorAdd(double[] a, double[] b) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] + b[i];
        }
        return result;
    }

    private static double[] vectorSubtract(double[] a, double[] b) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] - b[i];
        }
        return result;
    }

    private static double[][] matrixAdd(double[][] A, double[][] B) {
        double[][] result = new double[A.length][A[0].length];
        for (int i = 0; i < A.length; i++) {
            for (int j = 0; j < A[0].length; j++) {
                result[i][j] = A[i][j] + B[i][j];
            }
        }
        return result;
    }

    private static double[][] matrixSubtract(double[][] A, double[][] B) {
        double[][] result = new double[A.length][A[0].length];
        for (int i = 0; i < A.length; i++) {
            for (int j = 0; j < A[0].length; j++) {
                result[i][j] = A[i][j] - B[i][j];
            }
        }
        return result;
    }

    /**
     * 2x2矩阵求逆
     * <p>
     * A^-1 = (1/det(A)) * [d -b; -c a]
     *
     * @return 逆矩阵，|det| < 1e-10 时返回 null
     */
    static double[][] matrixInverse2x2(double[][] matrix) {
        double a = matrix[0][0];
        double b = matrix[0][1];
        double c = matrix[1][0];
        double d = matrix[1][1];

        double det = a * d - b * c;
        if (Math.abs(det) < 1e-10) {
            return null;
        }

        double invDet = 1.0 / det;
        return new double[][]{
                {d * invDet, -b * invDet},
                {-c * invDet, a * invDet}
        };
    }
}
