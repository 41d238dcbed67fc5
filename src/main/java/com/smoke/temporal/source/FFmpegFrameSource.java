package com.smoke.temporal.source;

import com.smoke.temporal.util.ImageUtils;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.nio.ByteBuffer;

/**
 * 基于 JavaCV FFmpegFrameGrabber 的视频帧来源
 * 解码为 BGR24 后拷贝到 OpenCV Mat
 */
@Slf4j
public class FFmpegFrameSource implements FrameSource {

    static {
        ImageUtils.loadOpenCV();
    }

    private final String videoPath;
    private final FFmpegFrameGrabber grabber;
    private final int totalFrames;

    // 下一次顺序读取的帧号，相同时跳过seek
    private int nextFrameIndex = 0;

    public FFmpegFrameSource(String videoPath) {
        this.videoPath = videoPath;
        this.grabber = new FFmpegFrameGrabber(videoPath);
        grabber.setPixelFormat(avutil.AV_PIX_FMT_BGR24);
        try {
            grabber.start();
        } catch (FrameGrabber.Exception e) {
            log.error("Error opening video: {}", videoPath, e);
            closeQuietly();
            throw new RuntimeException("Failed to open video: " + videoPath, e);
        }
        this.totalFrames = grabber.getLengthInFrames();

        log.info("Video opened: {}, frames: {}, fps: {}, resolution: {}x{}",
                videoPath, totalFrames, grabber.getFrameRate(),
                grabber.getImageWidth(), grabber.getImageHeight());
    }

    @Override
    public int getTotalFrames() {
        return totalFrames;
    }

    @Override
    public Mat readFrame(int index) {
        if (index < 0 || index >= totalFrames) {
            return null;
        }
        try {
            if (index != nextFrameIndex) {
                grabber.setVideoFrameNumber(index);
            }
            Frame frame = grabber.grabImage();
            nextFrameIndex = index + 1;
            if (frame == null || frame.image == null) {
                return null;
            }
            return toMat(frame);
        } catch (FrameGrabber.Exception e) {
            log.warn("Error decoding frame {} of {}: {}", index, videoPath, e.getMessage());
            // 解码器状态未知，下次强制seek
            nextFrameIndex = -1;
            return null;
        }
    }

    /**
     * 按行拷贝（考虑 stride）到 CV_8UC3 Mat
     */
    private Mat toMat(Frame frame) {
        int width = frame.imageWidth;
        int height = frame.imageHeight;
        int channels = frame.imageChannels;
        if (channels != 3 || frame.imageDepth != Frame.DEPTH_UBYTE) {
            log.warn("Unexpected frame format: channels={}, depth={}", channels, frame.imageDepth);
            return null;
        }

        ByteBuffer buffer = ((ByteBuffer) frame.image[0]).duplicate();
        int rowBytes = width * channels;
        byte[] data = new byte[rowBytes * height];
        for (int y = 0; y < height; y++) {
            buffer.position(y * frame.imageStride);
            buffer.get(data, y * rowBytes, rowBytes);
        }

        Mat mat = new Mat(height, width, CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    @Override
    public void close() {
        closeQuietly();
        log.info("Video closed: {}", videoPath);
    }

    private void closeQuietly() {
        try {
            grabber.stop();
            grabber.release();
        } catch (Exception e) {
            log.error("Error stopping/releasing grabber", e);
        }
    }
}
