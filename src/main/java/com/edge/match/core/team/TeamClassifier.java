package com.edge.match.core.team;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleBiFunction;

/**
 * 基于球衣颜色的队伍分类
 * <p>
 * 功能特性：
 * 1. 同一轨迹的多个采样先取平均
 * 2. K-means 聚类，最大的两个簇为两队，第三个簇视为裁判
 * 3. 提供参考队色时比较两种簇 -> 队伍分配，取总颜色距离较小者
 * 4. 置信度为两主簇的分离度 / 内聚度比值，截断到 [0,1]
 * <p>
 * 样本不足时不聚类，全部返回 UNKNOWN、置信度 0
 */
public class TeamClassifier {
    private static final Logger logger = LoggerFactory.getLogger(TeamClassifier.class);

    private static final String GRAY_HEX = RgbColor.NEUTRAL_GRAY.toHex();

    private final KMeansConfig config;
    private final KMeansClusterer clusterer;

    public TeamClassifier(KMeansConfig config, KMeansClusterer clusterer) {
        this.config = config;
        this.clusterer = clusterer;
    }

    public TeamClassifier(KMeansConfig config) {
        this(config, new KMeansClusterer(config));
    }

    /**
     * @param samples   颜色采样，可包含同一轨迹的多次采样
     * @param homeColor 主队参考色（#RRGGBB），可为 null
     * @param awayColor 客队参考色，可为 null
     */
    public TeamClassificationResult classify(List<ColorSample> samples, String homeColor, String awayColor) {
        List<ColorSample> perTrack = averageByTrack(samples);
        Map<String, TeamLabel> assignments = new LinkedHashMap<>();

        if (perTrack.size() < config.getMinSamples()) {
            logger.info("Team classification skipped: {} tracks sampled, {} required",
                    perTrack.size(), config.getMinSamples());
            return unknownForAll(perTrack, new ArrayList<>());
        }

        List<ClusterResult> clusters = clusterer.cluster(perTrack);
        if (clusters.size() < 2) {
            logger.warn("Team classification produced {} clusters, expected at least 2", clusters.size());
            return unknownForAll(perTrack, clusters);
        }

        ToDoubleBiFunction<RgbColor, RgbColor> distance = clusterer.distanceFunction();
        int homeCluster = 0;
        int awayCluster = 1;

        if (homeColor != null && awayColor != null) {
            RgbColor homeRgb = ColorUtils.hexToRgb(homeColor);
            RgbColor awayRgb = ColorUtils.hexToRgb(awayColor);
            RgbColor c0 = clusters.get(0).getCentroid();
            RgbColor c1 = clusters.get(1).getCentroid();

            double direct = distance.applyAsDouble(c0, homeRgb) + distance.applyAsDouble(c1, awayRgb);
            double swapped = distance.applyAsDouble(c0, awayRgb) + distance.applyAsDouble(c1, homeRgb);
            if (swapped < direct) {
                homeCluster = 1;
                awayCluster = 0;
            }
        }

        for (ColorSample sample : perTrack) {
            TeamLabel label = TeamLabel.UNKNOWN;
            for (ClusterResult cluster : clusters) {
                if (cluster.contains(sample.getTrackId())) {
                    if (cluster.getClusterId() == homeCluster) {
                        label = TeamLabel.HOME;
                    } else if (cluster.getClusterId() == awayCluster) {
                        label = TeamLabel.AWAY;
                    } else if (cluster.getClusterId() == 2) {
                        label = TeamLabel.REFEREE;
                    }
                    break;
                }
            }
            assignments.put(sample.getTrackId(), label);
        }

        double separation = distance.applyAsDouble(clusters.get(0).getCentroid(), clusters.get(1).getCentroid());
        double avgIntra = (clusters.get(0).getAvgDistance() + clusters.get(1).getAvgDistance()) / 2;
        double confidence = Math.min(1, Math.max(0, separation / (avgIntra + 0.001) - 1) / 2);

        String refereeColor = clusters.size() > 2 ? clusters.get(2).getCentroid().toHex() : null;
        TeamClassificationResult result = new TeamClassificationResult(assignments, clusters, confidence,
                clusters.get(homeCluster).getCentroid().toHex(),
                clusters.get(awayCluster).getCentroid().toHex(),
                refereeColor);

        logger.info("Teams classified: tracks={}, home={}, away={}, referee={}, confidence={}",
                perTrack.size(), result.getHomeColor(), result.getAwayColor(), refereeColor,
                String.format("%.3f", confidence));
        return result;
    }

    /**
     * 将分类结果转换为每条轨迹的队伍元数据
     */
    public List<TrackTeamMeta> toTrackMetas(List<ColorSample> samples, TeamClassificationResult result,
                                            boolean userHint) {
        ClassificationMethod method = userHint ? ClassificationMethod.USER_HINT : ClassificationMethod.COLOR_CLUSTERING;
        List<TrackTeamMeta> metas = new ArrayList<>();
        for (ColorSample sample : averageByTrack(samples)) {
            TeamLabel label = result.labelOf(sample.getTrackId());
            double confidence = label == TeamLabel.UNKNOWN ? 0 : result.getConfidence();
            metas.add(new TrackTeamMeta(sample.getTrackId(), label, confidence, sample.getColor().toHex(), method));
        }
        return metas;
    }

    /**
     * 同一轨迹的采样颜色取均值，位置取首个采样
     */
    static List<ColorSample> averageByTrack(List<ColorSample> samples) {
        Map<String, List<ColorSample>> byTrack = new LinkedHashMap<>();
        for (ColorSample sample : samples) {
            byTrack.computeIfAbsent(sample.getTrackId(), id -> new ArrayList<>()).add(sample);
        }

        List<ColorSample> averaged = new ArrayList<>(byTrack.size());
        for (Map.Entry<String, List<ColorSample>> entry : byTrack.entrySet()) {
            List<RgbColor> colors = new ArrayList<>();
            entry.getValue().forEach(s -> colors.add(s.getColor()));
            averaged.add(new ColorSample(entry.getKey(), ColorUtils.average(colors),
                    entry.getValue().get(0).getPosition()));
        }
        return averaged;
    }

    private TeamClassificationResult unknownForAll(List<ColorSample> perTrack, List<ClusterResult> clusters) {
        Map<String, TeamLabel> assignments = new LinkedHashMap<>();
        for (ColorSample sample : perTrack) {
            assignments.put(sample.getTrackId(), TeamLabel.UNKNOWN);
        }
        return new TeamClassificationResult(assignments, clusters, 0, GRAY_HEX, GRAY_HEX, null);
    }
}
