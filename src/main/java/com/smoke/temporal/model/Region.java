package com.smoke.temporal.model;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * 帧内的矩形区域（3x3重叠布局中的一格），构造后不可变
 */
@Value
@Builder
public class Region implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 区域名称（R1..R9）
     */
    String name;

    /**
     * 网格行号 (0-2)
     */
    int row;

    /**
     * 网格列号 (0-2)
     */
    int col;

    int x0;  // 左上角x
    int y0;  // 左上角y
    int x1;  // 右下角x（不含）
    int y1;  // 右下角y（不含）

    public int getIndex() {
        return row * 3 + col;
    }
}
