package com.smoke.temporal.processor;

import com.smoke.temporal.model.Region;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 3x3 重叠区域布局
 * 每个区域覆盖帧宽高的40%，起点位于0%、30%、60%，相邻区域重叠20%
 */
public class RegionLayout implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int GRID_SIZE = 3;
    public static final int REGION_COUNT = GRID_SIZE * GRID_SIZE;

    private static final double REGION_COVERAGE = 0.4;
    private static final double[] ORIGINS = {0.0, 0.3, 0.6};

    private RegionLayout() {
    }

    /**
     * 根据帧尺寸计算9个区域，边界裁剪到帧内
     */
    public static List<Region> defineRegions(int frameWidth, int frameHeight) {
        int width = Math.max(0, frameWidth);
        int height = Math.max(0, frameHeight);

        int regionWidth = (int) (width * REGION_COVERAGE);
        int regionHeight = (int) (height * REGION_COVERAGE);

        List<Region> regions = new ArrayList<>(REGION_COUNT);
        for (int row = 0; row < GRID_SIZE; row++) {
            for (int col = 0; col < GRID_SIZE; col++) {
                int xStart = (int) (width * ORIGINS[col]);
                int yStart = (int) (height * ORIGINS[row]);

                regions.add(Region.builder()
                        .name("R" + (row * GRID_SIZE + col + 1))
                        .row(row)
                        .col(col)
                        .x0(xStart)
                        .y0(yStart)
                        .x1(Math.min(xStart + regionWidth, width))
                        .y1(Math.min(yStart + regionHeight, height))
                        .build());
            }
        }
        return Collections.unmodifiableList(regions);
    }
}
