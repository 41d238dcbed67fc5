package com.smoke.temporal.model;

import java.util.Locale;

/**
 * 二分类标签，类别序号即 YOLO 标签中的 class id
 */
public enum SmokeLabel {

    SMOKE(0, "smoke"),
    NO_SMOKE(1, "no_smoke");

    private final int classId;
    private final String className;

    SmokeLabel(int classId, String className) {
        this.classId = classId;
        this.className = className;
    }

    public int getClassId() {
        return classId;
    }

    public String getClassName() {
        return className;
    }

    /**
     * 整图边界框的 YOLO 标签行
     */
    public String toYoloLine() {
        return classId + " 0.5 0.5 1.0 1.0";
    }

    public static SmokeLabel of(boolean hasSmoke) {
        return hasSmoke ? SMOKE : NO_SMOKE;
    }

    public static SmokeLabel parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SmokeLabel label : values()) {
            if (label.className.equals(normalized) || String.valueOf(label.classId).equals(normalized)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown label: " + value);
    }
}
