package com.smoke.temporal;

import com.smoke.temporal.util.ImageUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用合成帧
 */
public final class TestFrames {

    static {
        ImageUtils.loadOpenCV();
    }

    private TestFrames() {
    }

    public static void init() {
        // 触发静态初始化
    }

    public static Mat solid(int width, int height, int blue, int green, int red) {
        return new Mat(height, width, CvType.CV_8UC3, new Scalar(blue, green, red));
    }

    /**
     * 饱和度恰好为 saturation 的纯色帧：B=255, G=R=255-saturation
     */
    public static Mat withSaturation(int width, int height, int saturation) {
        return solid(width, height, 255, 255 - saturation, 255 - saturation);
    }

    public static Mat black(int width, int height) {
        return solid(width, height, 0, 0, 0);
    }

    /**
     * 饱和度从0线性增加到255的帧序列
     */
    public static List<Mat> saturationRamp(int width, int height, int count) {
        List<Mat> frames = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int saturation = count > 1 ? Math.round(i * 255f / (count - 1)) : 0;
            frames.add(withSaturation(width, height, saturation));
        }
        return frames;
    }

    public static List<Mat> repeat(Mat frame, int count) {
        List<Mat> frames = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            frames.add(frame);
        }
        return frames;
    }

    public static void releaseAll(List<Mat> frames) {
        for (Mat frame : frames) {
            frame.release();
        }
    }

    /**
     * 读取单通道图像中的一个区域块（行优先）
     */
    public static int[] block(Mat gray, int regionIndex, int blockRows, int blockCols) {
        byte[] data = ImageUtils.toByteArray(gray);
        int yStart = (regionIndex / 3) * blockRows;
        int xStart = (regionIndex % 3) * blockCols;
        int[] block = new int[blockRows * blockCols];
        for (int r = 0; r < blockRows; r++) {
            for (int c = 0; c < blockCols; c++) {
                block[r * blockCols + c] = data[(yStart + r) * gray.cols() + xStart + c] & 0xFF;
            }
        }
        return block;
    }
}
