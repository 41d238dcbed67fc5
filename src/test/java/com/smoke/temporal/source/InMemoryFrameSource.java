package com.smoke.temporal.source;

import org.opencv.core.Mat;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 内存帧来源，可指定读取失败的帧号
 */
public class InMemoryFrameSource implements FrameSource {

    private final List<Mat> frames;
    private final Set<Integer> failing = new HashSet<>();
    private boolean closed;

    public InMemoryFrameSource(List<Mat> frames) {
        this.frames = frames;
    }

    public InMemoryFrameSource failAt(int... indices) {
        for (int index : indices) {
            failing.add(index);
        }
        return this;
    }

    @Override
    public int getTotalFrames() {
        return frames.size();
    }

    @Override
    public Mat readFrame(int index) {
        if (index < 0 || index >= frames.size() || failing.contains(index)) {
            return null;
        }
        return frames.get(index).clone();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
