package com.smoke.temporal.processor;

import com.smoke.temporal.exception.InvalidInputException;
import com.smoke.temporal.util.ImageUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 帧尺寸标准化
 * 已是标准尺寸的帧原样返回；否则返回新的缩放后Mat，由调用方释放
 */
public class FrameStandardizer {

    private final int frameWidth;
    private final int frameHeight;

    public FrameStandardizer(int frameWidth, int frameHeight) {
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
    }

    public Mat standardize(Mat frame) {
        validate(frame);

        if (frame.cols() == frameWidth && frame.rows() == frameHeight) {
            return frame;
        }

        Mat resized = new Mat();
        Imgproc.resize(frame, resized, new Size(frameWidth, frameHeight), 0, 0, Imgproc.INTER_LINEAR);
        return resized;
    }

    private void validate(Mat frame) {
        if (frame == null) {
            throw new InvalidInputException("Frame is null");
        }
        if (frame.empty()) {
            throw new InvalidInputException("Frame is empty");
        }
        if (!ImageUtils.isBgrFrame(frame)) {
            throw new InvalidInputException("Expected 3-channel 8-bit frame, got type "
                    + CvType.typeToString(frame.type()));
        }
    }

    public int getFrameWidth() {
        return frameWidth;
    }

    public int getFrameHeight() {
        return frameHeight;
    }
}
