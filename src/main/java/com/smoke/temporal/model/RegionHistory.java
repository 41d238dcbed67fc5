package com.smoke.temporal.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个区域在帧序列上的直方图时间序列
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegionHistory implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 区域序号 (0-8)
     */
    private int regionIndex;

    /**
     * 按帧顺序排列的直方图
     */
    private List<double[]> entries = new ArrayList<>();

    public RegionHistory(int regionIndex) {
        this.regionIndex = regionIndex;
    }

    public void append(double[] histogram) {
        entries.add(histogram);
    }

    public int size() {
        return entries == null ? 0 : entries.size();
    }
}
