package com.smoke.temporal.util;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 图像处理工具类
 */
public class ImageUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ImageUtils.class);

    private static volatile boolean loaded = false;

    static {
        loadOpenCV();
    }

    private ImageUtils() {
    }

    /**
     * 加载OpenCV本地库（可重复调用）
     */
    public static synchronized void loadOpenCV() {
        if (loaded) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            LOG.info("OpenCV loaded successfully");
        } catch (Throwable e) {
            LOG.error("Failed to load OpenCV", e);
            throw new IllegalStateException("Failed to load OpenCV native library", e);
        }
    }

    /**
     * 是否为3通道8位图像（BGR）
     */
    public static boolean isBgrFrame(Mat mat) {
        return mat != null && !mat.empty() && mat.type() == CvType.CV_8UC3;
    }

    /**
     * 读取Mat的全部像素（行优先）
     */
    public static byte[] toByteArray(Mat mat) {
        Mat source = mat.isContinuous() ? mat : mat.clone();
        byte[] data = new byte[(int) (source.total() * source.channels())];
        source.get(0, 0, data);
        if (source != mat) {
            source.release();
        }
        return data;
    }

    /**
     * 由行优先像素数据创建单通道8位图像
     */
    public static Mat toGrayMat(byte[] data, int rows, int cols) {
        Mat mat = new Mat(rows, cols, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * 安全释放Mat
     */
    public static void safeRelease(Mat mat) {
        if (mat != null) {
            try {
                mat.release();
            } catch (Exception e) {
                LOG.error("Error releasing Mat", e);
            }
        }
    }
}
