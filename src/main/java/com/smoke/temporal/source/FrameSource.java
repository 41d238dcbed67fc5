package com.smoke.temporal.source;

import com.smoke.temporal.exception.InvalidInputException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 视频帧来源
 */
public interface FrameSource extends AutoCloseable {

    Logger LOG = LoggerFactory.getLogger(FrameSource.class);

    /**
     * 视频总帧数
     */
    int getTotalFrames();

    /**
     * 读取指定帧（BGR, CV_8UC3），解码失败返回 null
     */
    Mat readFrame(int index);

    /**
     * 读取 [start, end] 区间的帧
     * 某帧读取失败时复用上一帧的副本；第一帧就失败则无法生成片段
     */
    default List<Mat> readSegment(int start, int end) {
        List<Mat> frames = new ArrayList<>(Math.max(0, end - start + 1));
        for (int index = start; index <= end; index++) {
            Mat frame = readFrame(index);
            if (frame == null || frame.empty()) {
                if (frames.isEmpty()) {
                    throw new InvalidInputException("No frames available for segment "
                            + start + "-" + end + " (failed at frame " + index + ")");
                }
                LOG.warn("Could not read frame {}, using previous frame", index);
                frame = frames.get(frames.size() - 1).clone();
            }
            frames.add(frame);
        }
        return frames;
    }

    @Override
    void close();
}
