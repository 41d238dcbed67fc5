package com.smoke.temporal.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 视频片段标注（写入汇总JSON）
 */
@Data
@Builder
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@AllArgsConstructor
public class SegmentAnnotation implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 片段起始帧（含）
     */
    @JsonProperty("start_frame")
    private int startFrame;

    /**
     * 片段结束帧（含）
     */
    @JsonProperty("end_frame")
    private int endFrame;

    /**
     * 是否有烟雾
     */
    @JsonProperty("has_smoke")
    private boolean hasSmoke;

    @JsonIgnore
    public String getSegmentKey() {
        return String.format("frames_%06d_%06d", startFrame, endFrame);
    }

    @JsonIgnore
    public SmokeLabel getLabel() {
        return SmokeLabel.of(hasSmoke);
    }

    @JsonIgnore
    public int getFrameCount() {
        return endFrame - startFrame + 1;
    }
}
