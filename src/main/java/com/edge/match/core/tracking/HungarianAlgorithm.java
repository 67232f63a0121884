package com.edge.match.core.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 匈牙利算法实现
 * <p>
 * 用于求解分配问题的最优解
 * 在本项目中用于将当前帧检测框一一分配到已有轨迹
 * <p>
 * 基于行列势（potentials）的 Kuhn-Munkres 实现，时间复杂度 O(n^3)
 */
public class HungarianAlgorithm {
    private static final Logger logger = LoggerFactory.getLogger(HungarianAlgorithm.class);

    // 虚拟行/列的代价
    public static final double PADDING_COST = 1e6;

    /**
     * 求解最小权重匹配
     *
     * @param costMatrix 代价矩阵，costMatrix[i][j] 表示将行 i 分配到列 j 的代价
     *                   行列数不等时自动补虚拟行/列
     * @return 匹配结果，result[i] = j 表示行 i 分配到列 j，-1 表示未匹配
     */
    public static int[] solve(double[][] costMatrix) {
        if (costMatrix == null || costMatrix.length == 0) {
            return new int[0];
        }

        int rows = costMatrix.length;
        int cols = costMatrix[0].length;
        if (cols == 0) {
            int[] none = new int[rows];
            Arrays.fill(none, -1);
            return none;
        }

        int n = Math.max(rows, cols);
        double[][] a = makeSquareMatrix(costMatrix, n);

        // 1-based 下标，第 0 行/列为哨兵
        double[] u = new double[n + 1];
        double[] v = new double[n + 1];
        int[] p = new int[n + 1];   // p[j] = 分配到列 j 的行
        int[] way = new int[n + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            double[] minv = new double[n + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[n + 1];

            do {
                used[j0] = true;
                int i0 = p[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= n; j++) {
                    if (!used[j]) {
                        double cur = a[i0 - 1][j - 1] - u[i0] - v[j];
                        if (cur < minv[j]) {
                            minv[j] = cur;
                            way[j] = j0;
                        }
                        if (minv[j] < delta) {
                            delta = minv[j];
                            j1 = j;
                        }
                    }
                }
                for (int j = 0; j <= n; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);

            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] result = new int[rows];
        Arrays.fill(result, -1);
        for (int j = 1; j <= n; j++) {
            int row = p[j] - 1;
            int col = j - 1;
            if (row >= 0 && row < rows && col < cols) {
                result[row] = col;
            }
        }

        logger.debug("Hungarian assignment solved for {}x{} matrix, total cost={}",
                rows, cols, calculateTotalCost(costMatrix, result));
        return result;
    }

    /**
     * 将矩阵转换为方阵，虚拟元素的代价设为 PADDING_COST
     */
    private static double[][] makeSquareMatrix(double[][] matrix, int size) {
        double[][] result = new double[size][size];
        for (double[] row : result) {
            Arrays.fill(row, PADDING_COST);
        }
        for (int i = 0; i < matrix.length; i++) {
            System.arraycopy(matrix[i], 0, result[i], 0, matrix[i].length);
        }
        return result;
    }

    /**
     * 计算匹配的总代价
     */
    public static double calculateTotalCost(double[][] costMatrix, int[] assignment) {
        double total = 0.0;
        for (int i = 0; i < assignment.length; i++) {
            int j = assignment[i];
            if (j >= 0 && j < costMatrix[i].length) {
                total += costMatrix[i][j];
            }
        }
        return total;
    }
}
