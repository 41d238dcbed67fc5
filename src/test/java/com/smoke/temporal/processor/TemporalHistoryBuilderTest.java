package com.smoke.temporal.processor;

import com.smoke.temporal.TestFrames;
import com.smoke.temporal.exception.InvalidInputException;
import com.smoke.temporal.model.Region;
import com.smoke.temporal.model.RegionHistory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemporalHistoryBuilderTest {

    private static final int WIDTH = 100;
    private static final int HEIGHT = 50;

    private final List<Region> regions = RegionLayout.defineRegions(WIDTH, HEIGHT);
    private final TemporalHistoryBuilder builder = new TemporalHistoryBuilder(
            new FrameStandardizer(WIDTH, HEIGHT), new SaturationHistogramExtractor(64), 64);

    @BeforeAll
    static void loadOpenCV() {
        TestFrames.init();
    }

    @Test
    void testOneEntryPerFramePerRegion() {
        List<Mat> frames = TestFrames.saturationRamp(WIDTH, HEIGHT, 5);
        List<RegionHistory> histories = builder.build(frames, regions);

        assertEquals(9, histories.size());
        for (int i = 0; i < histories.size(); i++) {
            RegionHistory history = histories.get(i);
            assertEquals(i, history.getRegionIndex());
            assertEquals(5, history.size());
            for (double[] entry : history.getEntries()) {
                assertEquals(64, entry.length);
                assertEquals(1.0, Arrays.stream(entry).sum(), 1e-6);
            }
        }
        TestFrames.releaseAll(frames);
    }

    @Test
    void testEntriesFollowFrameOrder() {
        List<Mat> frames = new ArrayList<>();
        frames.add(TestFrames.black(WIDTH, HEIGHT));
        frames.add(TestFrames.withSaturation(WIDTH, HEIGHT, 128));
        frames.add(TestFrames.withSaturation(WIDTH, HEIGHT, 255));

        List<double[]> entries = builder.build(frames, regions).get(4).getEntries();

        assertEquals(1.0, entries.get(0)[0], 1e-6);
        assertEquals(1.0, entries.get(1)[32], 1e-6);
        assertEquals(1.0, entries.get(2)[63], 1e-6);
        TestFrames.releaseAll(frames);
    }

    @Test
    void testFramesOfOtherSizesAreStandardized() {
        List<Mat> frames = new ArrayList<>();
        frames.add(TestFrames.withSaturation(37, 21, 128));
        frames.add(TestFrames.withSaturation(400, 200, 128));

        List<RegionHistory> histories = builder.build(frames, regions);

        for (RegionHistory history : histories) {
            assertEquals(1.0, history.getEntries().get(0)[32], 1e-6);
            assertEquals(1.0, history.getEntries().get(1)[32], 1e-6);
        }
        // 调用方的帧保持原样
        assertEquals(37, frames.get(0).cols());
        assertFalse(frames.get(0).empty());
        TestFrames.releaseAll(frames);
    }

    @Test
    void testFrameCountMismatchIsAccepted() {
        List<Mat> frames = TestFrames.saturationRamp(WIDTH, HEIGHT, 3);
        List<RegionHistory> histories = builder.build(frames, regions);
        assertEquals(3, histories.get(0).size());
        TestFrames.releaseAll(frames);
    }

    @Test
    void testNoFramesGiveEmptyHistories() {
        List<RegionHistory> histories = builder.build(new ArrayList<>(), regions);
        assertEquals(9, histories.size());
        histories.forEach(history -> assertEquals(0, history.size()));
    }

    @Test
    void testInvalidFrameRejected() {
        List<Mat> frames = new ArrayList<>();
        frames.add(TestFrames.black(WIDTH, HEIGHT));
        frames.add(new Mat(HEIGHT, WIDTH, CvType.CV_8UC1, new Scalar(0)));

        assertThrows(InvalidInputException.class, () -> builder.build(frames, regions));
        TestFrames.releaseAll(frames);
    }
}
