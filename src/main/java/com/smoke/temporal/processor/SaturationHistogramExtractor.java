package com.smoke.temporal.processor;

import com.smoke.temporal.model.Region;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * 区域饱和度直方图提取
 * 饱和度 s 按 s/255 落入 [0,1] 上 numBins 个等宽分箱，s=255 归入最后一个分箱
 * 直方图按 (总数 + 1e-6) 归一化：非空区域和约为1，零像素区域返回全零向量
 */
public class SaturationHistogramExtractor {

    static final double EPSILON = 1e-6;

    private static final int LEVELS = 256;

    private final int numBins;

    /**
     * 饱和度值 -> 分箱序号
     */
    private final int[] binOf = new int[LEVELS];

    public SaturationHistogramExtractor(int numBins) {
        this.numBins = numBins;
        for (int s = 0; s < LEVELS; s++) {
            binOf[s] = Math.min(s * numBins / 255, numBins - 1);
        }
    }

    public double[] compute(Mat frame, Region region) {
        double[] histogram = new double[numBins];

        // 裁剪到帧内
        int x0 = clamp(region.getX0(), frame.cols());
        int y0 = clamp(region.getY0(), frame.rows());
        int x1 = clamp(region.getX1(), frame.cols());
        int y1 = clamp(region.getY1(), frame.rows());
        if (x1 <= x0 || y1 <= y0) {
            return histogram;
        }

        Mat regionFrame = frame.submat(y0, y1, x0, x1);
        Mat hsv = new Mat();
        Mat saturation = new Mat();

        try {
            Imgproc.cvtColor(regionFrame, hsv, Imgproc.COLOR_BGR2HSV);
            Core.extractChannel(hsv, saturation, 1);

            byte[] values = new byte[(int) saturation.total()];
            saturation.get(0, 0, values);

            long[] counts = new long[numBins];
            for (byte value : values) {
                counts[binOf[value & 0xFF]]++;
            }

            double denominator = values.length + EPSILON;
            for (int i = 0; i < numBins; i++) {
                histogram[i] = counts[i] / denominator;
            }
            return histogram;
        } finally {
            regionFrame.release();
            hsv.release();
            saturation.release();
        }
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    public int getNumBins() {
        return numBins;
    }
}
