package com.smoke.temporal.config;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.Properties;

/**
 * 时序网格生成器配置（构造后不可变）
 */
@Value
@Builder
public class TemporalGridConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_FRAME_WIDTH = 1920;
    public static final int DEFAULT_FRAME_HEIGHT = 1080;
    public static final int DEFAULT_NUM_REGIONS = 9;
    public static final int DEFAULT_NUM_BINS = 64;
    public static final int DEFAULT_TEMPORAL_LENGTH = 64;

    /**
     * 标准化帧宽度
     */
    @Builder.Default
    int frameWidth = DEFAULT_FRAME_WIDTH;

    /**
     * 标准化帧高度
     */
    @Builder.Default
    int frameHeight = DEFAULT_FRAME_HEIGHT;

    /**
     * 区域数量（3x3布局，必须为9）
     */
    @Builder.Default
    int numRegions = DEFAULT_NUM_REGIONS;

    /**
     * 饱和度直方图分箱数
     */
    @Builder.Default
    int numBins = DEFAULT_NUM_BINS;

    /**
     * 时序长度（帧数）
     */
    @Builder.Default
    int temporalLength = DEFAULT_TEMPORAL_LENGTH;

    public static TemporalGridConfig defaults() {
        return TemporalGridConfig.builder().build();
    }

    /**
     * 从属性中读取网格参数，缺省项使用默认值
     */
    public static TemporalGridConfig fromProperties(Properties props) {
        return TemporalGridConfig.builder()
                .frameWidth(Integer.parseInt(props.getProperty("grid.frame.width",
                        String.valueOf(DEFAULT_FRAME_WIDTH)).trim()))
                .frameHeight(Integer.parseInt(props.getProperty("grid.frame.height",
                        String.valueOf(DEFAULT_FRAME_HEIGHT)).trim()))
                .numRegions(Integer.parseInt(props.getProperty("grid.num.regions",
                        String.valueOf(DEFAULT_NUM_REGIONS)).trim()))
                .numBins(Integer.parseInt(props.getProperty("grid.num.bins",
                        String.valueOf(DEFAULT_NUM_BINS)).trim()))
                .temporalLength(Integer.parseInt(props.getProperty("grid.temporal.length",
                        String.valueOf(DEFAULT_TEMPORAL_LENGTH)).trim()))
                .build();
    }

    /**
     * 输出图像高度：3行区域，每行 temporalLength 像素
     */
    public int getGridHeight() {
        return 3 * temporalLength;
    }

    /**
     * 输出图像宽度：3列区域，每列 numBins 像素
     */
    public int getGridWidth() {
        return 3 * numBins;
    }
}
