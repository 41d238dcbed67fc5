package com.smoke.temporal.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.opencv.core.Mat;

import java.util.List;

/**
 * 时序网格：9个独立归一化的区域块组成的单通道8位图像
 */
@Getter
@AllArgsConstructor
public class TemporalGrid {

    /**
     * CV_8UC1 图像，默认 192x192
     */
    private final Mat image;

    /**
     * 按区域序号排列的渲染结果
     */
    private final List<RegionRenderResult> regionResults;

    public long failedRegionCount() {
        return regionResults.stream().filter(RegionRenderResult::isFailed).count();
    }

    public void release() {
        if (image != null) {
            image.release();
        }
    }
}
