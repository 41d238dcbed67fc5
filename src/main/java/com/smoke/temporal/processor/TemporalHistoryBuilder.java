package com.smoke.temporal.processor;

import com.smoke.temporal.model.Region;
import com.smoke.temporal.model.RegionHistory;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 构建各区域的直方图时间序列
 * 帧数与时序长度不一致时只记录警告，由网格渲染阶段补齐或截断
 */
public class TemporalHistoryBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalHistoryBuilder.class);

    private final FrameStandardizer standardizer;
    private final SaturationHistogramExtractor extractor;
    private final int temporalLength;

    public TemporalHistoryBuilder(FrameStandardizer standardizer,
                                  SaturationHistogramExtractor extractor,
                                  int temporalLength) {
        this.standardizer = standardizer;
        this.extractor = extractor;
        this.temporalLength = temporalLength;
    }

    public List<RegionHistory> build(List<Mat> frames, List<Region> regions) {
        if (frames.size() != temporalLength) {
            LOG.warn("Expected {} frames, got {}", temporalLength, frames.size());
        }

        List<RegionHistory> histories = new ArrayList<>(regions.size());
        for (Region region : regions) {
            histories.add(new RegionHistory(region.getIndex()));
        }

        for (Mat frame : frames) {
            Mat standardized = standardizer.standardize(frame);
            try {
                for (int i = 0; i < regions.size(); i++) {
                    histories.get(i).append(extractor.compute(standardized, regions.get(i)));
                }
            } finally {
                // 只释放缩放产生的临时帧，调用方的帧不动
                if (standardized != frame) {
                    standardized.release();
                }
            }
        }

        return histories;
    }
}
