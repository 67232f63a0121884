package com.edge.match.core.detect;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * 编码后的单帧图像（JPEG）
 */
public class EncodedFrame {
    private final byte[] data;
    private final int width;
    private final int height;

    public EncodedFrame(byte[] data, int width, int height) {
        this.data = data;
        this.width = width;
        this.height = height;
    }

    /**
     * 将 OpenCV 图像编码为 JPEG
     */
    public static EncodedFrame fromMat(Mat frame) {
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".jpg", frame, buffer)) {
                throw new IllegalArgumentException("Failed to encode frame as JPEG");
            }
            return new EncodedFrame(buffer.toArray(), frame.cols(), frame.rows());
        } finally {
            buffer.release();
        }
    }

    public byte[] getData() { return data; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
}
