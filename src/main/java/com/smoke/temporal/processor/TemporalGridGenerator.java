package com.smoke.temporal.processor;

import com.smoke.temporal.config.TemporalGridConfig;
import com.smoke.temporal.exception.InvalidConfigurationException;
import com.smoke.temporal.exception.InvalidInputException;
import com.smoke.temporal.model.Region;
import com.smoke.temporal.model.RegionHistory;
import com.smoke.temporal.model.TemporalGrid;
import com.smoke.temporal.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 时序饱和度直方图网格生成器
 * 功能：
 * 1. 将每帧划分为3x3重叠区域
 * 2. 计算每个区域逐帧的饱和度直方图
 * 3. 每个区域独立归一化后拼成一张单通道网格图（默认192x192）
 * 除不可变配置外不保存任何状态，每次调用互相独立
 */
public class TemporalGridGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalGridGenerator.class);

    private static final int RECOMMENDED_TEMPORAL_LENGTH = 64;

    static {
        ImageUtils.loadOpenCV();
    }

    private final TemporalGridConfig config;
    private final List<Region> regions;
    private final TemporalHistoryBuilder historyBuilder;
    private final RegionGridRenderer renderer;

    public TemporalGridGenerator() {
        this(TemporalGridConfig.defaults());
    }

    public TemporalGridGenerator(TemporalGridConfig config) {
        validate(config);
        this.config = config;
        this.regions = RegionLayout.defineRegions(config.getFrameWidth(), config.getFrameHeight());
        this.historyBuilder = new TemporalHistoryBuilder(
                new FrameStandardizer(config.getFrameWidth(), config.getFrameHeight()),
                new SaturationHistogramExtractor(config.getNumBins()),
                config.getTemporalLength()
        );
        this.renderer = new RegionGridRenderer(
                config.getNumRegions(), config.getNumBins(), config.getTemporalLength());

        LOG.debug("Temporal grid generator initialized: frame {}x{}, bins: {}, temporal length: {}",
                config.getFrameWidth(), config.getFrameHeight(), config.getNumBins(), config.getTemporalLength());
    }

    private static void validate(TemporalGridConfig config) {
        if (config == null) {
            throw new InvalidConfigurationException("Configuration cannot be null");
        }
        if (config.getNumRegions() != RegionLayout.REGION_COUNT) {
            throw new InvalidConfigurationException("num_regions must be 9 for 3x3 grid, got "
                    + config.getNumRegions());
        }
        if (config.getFrameWidth() <= 0 || config.getFrameHeight() <= 0) {
            throw new InvalidConfigurationException("Frame size must be positive, got "
                    + config.getFrameWidth() + "x" + config.getFrameHeight());
        }
        if (config.getNumBins() <= 0) {
            throw new InvalidConfigurationException("num_bins must be positive, got " + config.getNumBins());
        }
        if (config.getTemporalLength() <= 0) {
            throw new InvalidConfigurationException("temporal_length must be positive, got "
                    + config.getTemporalLength());
        }
        if (config.getTemporalLength() != RECOMMENDED_TEMPORAL_LENGTH) {
            LOG.warn("Recommended temporal_length is {}, got {}",
                    RECOMMENDED_TEMPORAL_LENGTH, config.getTemporalLength());
        }
    }

    /**
     * 由帧序列生成网格图像（CV_8UC1），调用方负责释放
     */
    public Mat generateFromFrames(List<Mat> frames) {
        return generate(frames).getImage();
    }

    /**
     * 由帧序列生成网格，附带各区域的渲染结果
     */
    public TemporalGrid generate(List<Mat> frames) {
        if (frames == null) {
            throw new InvalidInputException("Frame sequence cannot be null");
        }

        try {
            List<RegionHistory> histories = historyBuilder.build(frames, regions);
            TemporalGrid grid = renderer.render(histories);

            if (grid.failedRegionCount() > 0) {
                LOG.warn("Temporal grid generated with {} failed region(s)", grid.failedRegionCount());
            }
            return grid;

        } catch (RuntimeException e) {
            LOG.error("Error generating temporal analysis: {}", e.getMessage());
            throw e;
        }
    }

    public List<Region> getRegions() {
        return regions;
    }

    public TemporalGridConfig getConfig() {
        return config;
    }
}
