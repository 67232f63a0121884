package com.edge.match.core.team;

import com.edge.match.model.BoundingBox;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

/**
 * 从原始帧中提取球衣区域的平均颜色
 * <p>
 * 球衣区域：边界框高度的 15%-55%，宽度的 25%-75%，避开头部、腿部和手臂
 */
public class JerseyColorSampler {

    public static final double REGION_TOP = 0.15;
    public static final double REGION_BOTTOM = 0.55;
    public static final double REGION_LEFT = 0.25;
    public static final double REGION_RIGHT = 0.75;

    /**
     * 归一化边界框对应的球衣子区域
     */
    public static BoundingBox jerseyRegion(BoundingBox bbox) {
        return bbox.subRegion(REGION_TOP, REGION_BOTTOM, REGION_LEFT, REGION_RIGHT);
    }

    /**
     * @param frame BGR 图像
     * @param bbox  归一化边界框
     * @return 区域平均 RGB 颜色，区域为空时返回中性灰
     */
    public RgbColor sample(Mat frame, BoundingBox bbox) {
        if (frame == null || frame.empty()) {
            return RgbColor.NEUTRAL_GRAY;
        }

        BoundingBox region = jerseyRegion(bbox);
        int width = frame.cols();
        int height = frame.rows();

        int x1 = Math.max(0, (int) Math.floor(region.getX() * width));
        int y1 = Math.max(0, (int) Math.floor(region.getY() * height));
        int x2 = Math.min(width, (int) Math.floor((region.getX() + region.getW()) * width));
        int y2 = Math.min(height, (int) Math.floor((region.getY() + region.getH()) * height));

        if (x2 <= x1 || y2 <= y1) {
            return RgbColor.NEUTRAL_GRAY;
        }

        Mat roi = new Mat(frame, new Rect(x1, y1, x2 - x1, y2 - y1));
        try {
            Scalar mean = Core.mean(roi);
            return new RgbColor(
                    (int) Math.round(mean.val[2]),
                    (int) Math.round(mean.val[1]),
                    (int) Math.round(mean.val[0]));
        } finally {
            roi.release();
        }
    }
}
