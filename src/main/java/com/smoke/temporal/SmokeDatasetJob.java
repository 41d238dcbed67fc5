package com.smoke.temporal;

import com.smoke.temporal.config.DatasetConfig;
import com.smoke.temporal.exception.InvalidInputException;
import com.smoke.temporal.model.SegmentAnnotation;
import com.smoke.temporal.model.SmokeLabel;
import com.smoke.temporal.processor.TemporalGridGenerator;
import com.smoke.temporal.sink.DatasetWriter;
import com.smoke.temporal.source.FFmpegFrameSource;
import com.smoke.temporal.source.FrameSource;
import com.smoke.temporal.util.ImageUtils;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 烟雾数据集生成任务
 * 功能：
 * 1. 打开视频文件
 * 2. 按 "起始帧:标签" 读取64帧片段
 * 3. 生成时序网格图并写入数据集（图像、YOLO标签、汇总JSON）
 */
public class SmokeDatasetJob {

    private static final Logger LOG = LoggerFactory.getLogger(SmokeDatasetJob.class);

    private final DatasetConfig config;
    private final DatasetWriter writer;

    public SmokeDatasetJob(DatasetConfig config) {
        this(config, new DatasetWriter(config, new TemporalGridGenerator(config.getGridConfig())));
    }

    SmokeDatasetJob(DatasetConfig config, DatasetWriter writer) {
        this.config = config;
        this.writer = writer;
    }

    /**
     * 处理一个视频的所有片段标注
     *
     * @return 成功写入的片段数
     */
    public int run(String videoPath, FrameSource source, List<SegmentSpec> segments) throws Exception {
        int saved = 0;
        for (SegmentSpec spec : segments) {
            int start = spec.getStartFrame();
            int end = Math.min(start + config.getSegmentLength() - 1, source.getTotalFrames() - 1);
            if (start < 0 || end < start) {
                LOG.warn("Segment start {} outside video ({} frames), skipping", start, source.getTotalFrames());
                continue;
            }

            SegmentAnnotation annotation = SegmentAnnotation.builder()
                    .startFrame(start)
                    .endFrame(end)
                    .hasSmoke(spec.getLabel() == SmokeLabel.SMOKE)
                    .build();

            List<Mat> frames;
            try {
                frames = source.readSegment(start, end);
            } catch (InvalidInputException e) {
                LOG.warn("Segment {}-{} skipped: {}", start, end, e.getMessage());
                continue;
            }
            try {
                writer.saveSegment(videoPath, annotation, frames);
                saved++;
            } finally {
                frames.forEach(ImageUtils::safeRelease);
            }
        }

        writer.writeDatasetInfo();
        LOG.info("Video {}: {} of {} segment(s) saved", videoPath, saved, segments.size());
        return saved;
    }

    /**
     * 解析 "起始帧:标签" 参数，例如 "128:smoke"、"640:no_smoke"
     */
    static List<SegmentSpec> parseSegments(String[] args, int offset) {
        List<SegmentSpec> specs = new ArrayList<>();
        for (int i = offset; i < args.length; i++) {
            String[] parts = args[i].split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected <start>:<label>, got " + args[i]);
            }
            specs.add(new SegmentSpec(Integer.parseInt(parts[0].trim()), SmokeLabel.parse(parts[1])));
        }
        return specs;
    }

    /**
     * 片段参数
     */
    static class SegmentSpec {
        private final int startFrame;
        private final SmokeLabel label;

        SegmentSpec(int startFrame, SmokeLabel label) {
            this.startFrame = startFrame;
            this.label = label;
        }

        int getStartFrame() {
            return startFrame;
        }

        SmokeLabel getLabel() {
            return label;
        }
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: SmokeDatasetJob <video-path> <start>:<smoke|no_smoke> [<start>:<label> ...]");
            System.exit(1);
        }

        try {
            // 1. 加载配置
            DatasetConfig config = DatasetConfig.loadConfig();

            // 2. 解析片段参数
            List<SegmentSpec> segments = parseSegments(args, 1);

            // 3. 打开视频并生成数据集
            SmokeDatasetJob job = new SmokeDatasetJob(config);
            try (FrameSource source = new FFmpegFrameSource(args[0])) {
                job.run(args[0], source, segments);
            }

            LOG.info("Dataset written to {}", config.getRootDir());
        } catch (Exception e) {
            LOG.error("Error running smoke dataset job", e);
            System.exit(1);
        }
    }
}
