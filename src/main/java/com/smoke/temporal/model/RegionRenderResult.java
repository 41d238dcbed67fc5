package com.smoke.temporal.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单个区域的渲染结果
 * OK：数据完整；REPAIRED：经过修复（补零、截断等）；FAILED：处理失败，区域填零
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RegionRenderResult {

    public enum Status {
        OK,
        REPAIRED,
        FAILED
    }

    private final int regionIndex;
    private final Status status;

    /**
     * 行优先的区域像素（temporalLength x numBins），FAILED 时为 null
     */
    private final byte[] block;

    private final String reason;

    public static RegionRenderResult ok(int regionIndex, byte[] block) {
        return new RegionRenderResult(regionIndex, Status.OK, block, null);
    }

    public static RegionRenderResult repaired(int regionIndex, byte[] block, String reason) {
        return new RegionRenderResult(regionIndex, Status.REPAIRED, block, reason);
    }

    public static RegionRenderResult failed(int regionIndex, String reason) {
        return new RegionRenderResult(regionIndex, Status.FAILED, null, reason);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
