package com.edge.match.model;

/**
 * 单帧检测结果
 * <p>
 * 由外部检测器产生，坐标全部归一化。trackId 和 jerseyNumber 由跟踪器或外部识别写入
 */
public class Detection {
    private final String label;        // 类别名称 player / ball / referee
    private final BoundingBox bbox;
    private final Point center;
    private final double confidence;
    private final Double classConfidence;
    private String trackId;
    private Integer jerseyNumber;

    public Detection(String label, BoundingBox bbox, double confidence) {
        this(label, bbox, bbox.getCenter(), confidence, null);
    }

    public Detection(String label, BoundingBox bbox, Point center, double confidence, Double classConfidence) {
        this.label = label;
        this.bbox = bbox;
        this.center = center != null ? center : bbox.getCenter();
        this.confidence = confidence;
        this.classConfidence = classConfidence;
    }

    public String getLabel() { return label; }
    public BoundingBox getBbox() { return bbox; }
    public Point getCenter() { return center; }
    public double getConfidence() { return confidence; }
    public Double getClassConfidence() { return classConfidence; }

    public String getTrackId() { return trackId; }
    public void setTrackId(String trackId) { this.trackId = trackId; }

    public Integer getJerseyNumber() { return jerseyNumber; }
    public void setJerseyNumber(Integer jerseyNumber) { this.jerseyNumber = jerseyNumber; }

    @Override
    public String toString() {
        return "Detection{" +
                "label='" + label + '\'' +
                ", track=" + trackId +
                ", conf=" + confidence +
                ", bbox=" + bbox +
                ", center=" + center +
                '}';
    }
}
