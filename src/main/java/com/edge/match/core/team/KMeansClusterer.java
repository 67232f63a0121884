package com.edge.match.core.team;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleBiFunction;
import java.util.stream.Collectors;

/**
 * K-means 颜色聚类
 * <p>
 * - k-means++ 初始化：第一个质心均匀随机，之后按到已有质心最短距离的平方加权抽样
 * - 迭代 分配 -> 更新，直到所有质心移动都不超过阈值或达到最大迭代次数
 * - 空簇质心重置为中性灰
 * - 结果按簇大小降序排列并重新编号
 */
public class KMeansClusterer {
    private static final Logger logger = LoggerFactory.getLogger(KMeansClusterer.class);

    private final KMeansConfig config;
    private final Random random;

    public KMeansClusterer(KMeansConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    public KMeansClusterer(KMeansConfig config) {
        this(config, new Random());
    }

    /**
     * @return 簇列表，样本数少于 minSamples 时返回空列表
     */
    public List<ClusterResult> cluster(List<ColorSample> samples) {
        if (samples.size() < config.getMinSamples() || samples.isEmpty()) {
            logger.debug("Skip clustering: {} samples < minSamples {}", samples.size(), config.getMinSamples());
            return new ArrayList<>();
        }

        ToDoubleBiFunction<RgbColor, RgbColor> distance = distanceFunction();
        int k = Math.max(1, config.getK());

        List<RgbColor> centroids = initializeCentroids(samples, k, distance);
        int[] assignments = assign(samples, centroids, distance);

        int iterations = 0;
        for (; iterations < config.getMaxIterations(); iterations++) {
            List<RgbColor> updated = updateCentroids(samples, assignments, centroids.size());
            if (hasConverged(centroids, updated)) {
                break;
            }
            centroids = updated;
            assignments = assign(samples, centroids, distance);
        }

        List<ClusterResult> clusters = new ArrayList<>();
        for (int i = 0; i < centroids.size(); i++) {
            List<ColorSample> members = new ArrayList<>();
            double total = 0;
            for (int j = 0; j < samples.size(); j++) {
                if (assignments[j] == i) {
                    members.add(samples.get(j));
                    total += distance.applyAsDouble(samples.get(j).getColor(), centroids.get(i));
                }
            }
            clusters.add(new ClusterResult(i, centroids.get(i), members,
                    members.isEmpty() ? 0 : total / members.size()));
        }

        clusters.sort(Comparator.comparingInt(ClusterResult::size).reversed());
        for (int i = 0; i < clusters.size(); i++) {
            clusters.get(i).setClusterId(i);
        }

        logger.debug("K-means finished after {} iterations, cluster sizes={}", iterations,
                clusters.stream().map(ClusterResult::size).collect(Collectors.toList()));
        return clusters;
    }

    public ToDoubleBiFunction<RgbColor, RgbColor> distanceFunction() {
        return config.getColorSpace() == ColorSpace.HSV ? ColorUtils::hsvDistance : ColorUtils::rgbDistance;
    }

    private List<RgbColor> initializeCentroids(List<ColorSample> samples, int k,
                                               ToDoubleBiFunction<RgbColor, RgbColor> distance) {
        List<RgbColor> centroids = new ArrayList<>();
        if (samples.size() < k) {
            samples.forEach(s -> centroids.add(s.getColor()));
            return centroids;
        }

        centroids.add(samples.get(random.nextInt(samples.size())).getColor());

        for (int i = 1; i < k; i++) {
            double[] weights = new double[samples.size()];
            double total = 0;
            for (int j = 0; j < samples.size(); j++) {
                double min = Double.POSITIVE_INFINITY;
                for (RgbColor c : centroids) {
                    min = Math.min(min, distance.applyAsDouble(samples.get(j).getColor(), c));
                }
                weights[j] = min * min;
                total += weights[j];
            }

            double target = random.nextDouble() * total;
            RgbColor chosen = null;
            for (int j = 0; j < samples.size(); j++) {
                target -= weights[j];
                if (target <= 0 && weights[j] > 0) {
                    chosen = samples.get(j).getColor();
                    break;
                }
            }
            // 浮点误差或所有样本已与质心重合
            if (chosen == null) {
                chosen = samples.get(samples.size() - 1).getColor();
            }
            centroids.add(chosen);
        }
        return centroids;
    }

    private int[] assign(List<ColorSample> samples, List<RgbColor> centroids,
                         ToDoubleBiFunction<RgbColor, RgbColor> distance) {
        int[] result = new int[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            double min = Double.POSITIVE_INFINITY;
            for (int c = 0; c < centroids.size(); c++) {
                double d = distance.applyAsDouble(samples.get(i).getColor(), centroids.get(c));
                if (d < min) {
                    min = d;
                    result[i] = c;
                }
            }
        }
        return result;
    }

    private List<RgbColor> updateCentroids(List<ColorSample> samples, int[] assignments, int k) {
        long[][] sums = new long[k][4];
        for (int i = 0; i < samples.size(); i++) {
            RgbColor c = samples.get(i).getColor();
            long[] sum = sums[assignments[i]];
            sum[0] += c.getR();
            sum[1] += c.getG();
            sum[2] += c.getB();
            sum[3]++;
        }

        List<RgbColor> centroids = new ArrayList<>(k);
        for (long[] sum : sums) {
            if (sum[3] == 0) {
                centroids.add(RgbColor.NEUTRAL_GRAY);
            } else {
                centroids.add(new RgbColor(
                        (int) Math.round((double) sum[0] / sum[3]),
                        (int) Math.round((double) sum[1] / sum[3]),
                        (int) Math.round((double) sum[2] / sum[3])));
            }
        }
        return centroids;
    }

    private boolean hasConverged(List<RgbColor> previous, List<RgbColor> current) {
        double limit = config.getConvergenceThreshold() * 255;
        for (int i = 0; i < previous.size(); i++) {
            if (ColorUtils.rgbDistance(previous.get(i), current.get(i)) > limit) {
                return false;
            }
        }
        return true;
    }
}
