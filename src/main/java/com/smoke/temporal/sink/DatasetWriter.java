package com.smoke.temporal.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smoke.temporal.config.DatasetConfig;
import com.smoke.temporal.model.SegmentAnnotation;
import com.smoke.temporal.model.SmokeLabel;
import com.smoke.temporal.processor.TemporalGridGenerator;
import com.smoke.temporal.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.List;

/**
 * 训练数据集写入器
 * 目录结构：
 * - images/：每个64帧片段的192x192时序网格图（PNG）
 * - labels/：YOLO格式标签（整图边界框）
 * - classes.txt：类别名称
 * - all_annotations_summary.json：按视频路径和片段键汇总的标注
 * - dataset_info.txt：数据集说明和统计
 */
public class DatasetWriter {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final DatasetConfig config;
    private final TemporalGridGenerator generator;
    private final Path rootDir;
    private final Path imagesDir;
    private final Path labelsDir;

    public DatasetWriter(DatasetConfig config, TemporalGridGenerator generator) {
        this.config = config;
        this.generator = generator;
        this.rootDir = Paths.get(config.getRootDir());
        this.imagesDir = rootDir.resolve(config.getImagesSubdir());
        this.labelsDir = rootDir.resolve(config.getLabelsSubdir());
    }

    /**
     * 保存一个标注片段：网格图 + 标签 + 汇总
     *
     * @return 片段的唯一键（视频名_片段键）
     */
    public String saveSegment(String videoPath, SegmentAnnotation annotation, List<Mat> frames) throws IOException {
        // 汇总无法解析时在写入任何文件之前失败
        ObjectNode summary = loadSummary();
        createDirectories();

        String uniqueKey = uniqueSegmentKey(videoPath, annotation);

        saveTemporalImage(uniqueKey, annotation, frames);
        writeLabel(uniqueKey, annotation.getLabel());
        updateSummary(summary, videoPath, annotation);

        Path classesFile = rootDir.resolve(config.getClassesFile());
        if (!Files.exists(classesFile)) {
            writeClasses(classesFile);
        }

        LOG.info("Segment saved: key={}, label={}", uniqueKey, annotation.getLabel().getClassName());
        return uniqueKey;
    }

    /**
     * 生成网格图；生成失败时改存片段最后一帧作为备用图
     */
    private void saveTemporalImage(String uniqueKey, SegmentAnnotation annotation, List<Mat> frames) {
        Mat temporalImage = null;
        try {
            temporalImage = generator.generateFromFrames(frames);
            Path imagePath = imagesDir.resolve(uniqueKey + ".png");
            if (Imgcodecs.imwrite(imagePath.toString(), temporalImage)) {
                LOG.info("Saved temporal analysis image: {}", imagePath);
            } else {
                LOG.error("Failed to save temporal analysis image to {}", imagePath);
            }
        } catch (RuntimeException e) {
            LOG.error("Error generating temporal analysis for segment {}-{}: {}",
                    annotation.getStartFrame(), annotation.getEndFrame(), e.getMessage());
            saveFallbackFrame(uniqueKey, frames);
        } finally {
            ImageUtils.safeRelease(temporalImage);
        }
    }

    private void saveFallbackFrame(String uniqueKey, List<Mat> frames) {
        if (frames == null || frames.isEmpty()) {
            LOG.warn("No frame available for fallback image: {}", uniqueKey);
            return;
        }
        Mat lastFrame = frames.get(frames.size() - 1);
        if (lastFrame == null || lastFrame.empty()) {
            LOG.warn("Last frame unusable for fallback image: {}", uniqueKey);
            return;
        }
        Path imagePath = imagesDir.resolve(uniqueKey + "_fallback.png");
        if (Imgcodecs.imwrite(imagePath.toString(), lastFrame)) {
            LOG.info("Saved fallback frame: {}", imagePath);
        } else {
            LOG.error("Failed to save fallback frame to {}", imagePath);
        }
    }

    private void writeLabel(String uniqueKey, SmokeLabel label) throws IOException {
        Path labelFile = labelsDir.resolve(uniqueKey + ".txt");
        Files.write(labelFile, (label.toYoloLine() + "\n").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 更新汇总，只写入当前片段，其他视频、片段和未知字段原样保留
     */
    private void updateSummary(ObjectNode summary, String videoPath, SegmentAnnotation annotation)
            throws IOException {
        String videoKey = videoPath != null ? videoPath : "";
        JsonNode videoNode = summary.get(videoKey);
        ObjectNode videoAnnotations = videoNode instanceof ObjectNode
                ? (ObjectNode) videoNode
                : summary.putObject(videoKey);
        videoAnnotations.set(annotation.getSegmentKey(), objectMapper.valueToTree(annotation));
        objectMapper.writeValue(rootDir.resolve(config.getSummaryFile()).toFile(), summary);
    }

    /**
     * 以JSON树读取汇总文件；不存在时返回空对象
     *
     * @throws IOException 文件无法解析或根节点不是对象，此时文件不会被改写
     */
    public ObjectNode loadSummary() throws IOException {
        Path summaryFile = rootDir.resolve(config.getSummaryFile());
        if (!Files.exists(summaryFile)) {
            return objectMapper.createObjectNode();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(summaryFile.toFile());
        } catch (IOException e) {
            LOG.error("Unreadable summary file {}, leaving it untouched", summaryFile);
            throw new IOException("Unreadable summary file: " + summaryFile, e);
        }
        if (root == null || root.isMissingNode()) {
            return objectMapper.createObjectNode();
        }
        if (!root.isObject()) {
            throw new IOException("Summary file " + summaryFile + " is not a JSON object");
        }
        return (ObjectNode) root;
    }

    /**
     * 重写 classes.txt 和 dataset_info.txt
     */
    public void writeDatasetInfo() throws IOException {
        createDirectories();
        writeClasses(rootDir.resolve(config.getClassesFile()));

        ObjectNode summary = loadSummary();
        int videos = 0;
        int totalSegments = 0;
        int smokeSegments = 0;
        for (Iterator<JsonNode> it = summary.elements(); it.hasNext(); ) {
            JsonNode videoAnnotations = it.next();
            int segments = 0;
            for (JsonNode segment : videoAnnotations) {
                // 只统计片段标注，合并工具产生的包装节点等跳过
                if (!segment.has("start_frame")) {
                    continue;
                }
                SegmentAnnotation annotation = objectMapper.treeToValue(segment, SegmentAnnotation.class);
                segments++;
                if (annotation.isHasSmoke()) {
                    smokeSegments++;
                }
            }
            if (segments > 0) {
                videos++;
                totalSegments += segments;
            }
        }

        int temporalLength = generator.getConfig().getTemporalLength();
        int gridWidth = generator.getConfig().getGridWidth();
        int gridHeight = generator.getConfig().getGridHeight();

        StringBuilder info = new StringBuilder();
        info.append("Smoke Detection YOLO Dataset - Temporal Analysis\n");
        info.append("==================================================\n\n");
        info.append("Directory Structure:\n");
        info.append("- ").append(config.getImagesSubdir()).append("/: Contains ")
                .append(gridWidth).append('x').append(gridHeight)
                .append(" temporal analysis images from ").append(temporalLength).append("-frame segments\n");
        info.append("- ").append(config.getLabelsSubdir()).append("/: Contains YOLO format annotation files\n");
        info.append("- ").append(config.getClassesFile()).append(": Class names (smoke, no_smoke)\n\n");
        info.append("Image Format:\n");
        info.append("- Size: ").append(gridWidth).append('x').append(gridHeight).append(" pixels\n");
        info.append("- Type: Temporal saturation analysis (grayscale)\n");
        info.append("- Source: ").append(temporalLength).append(" consecutive video frames per image\n");
        info.append("- Grid: 3x3 regions with 40% coverage and 20% overlap\n");
        info.append("- Each cell: ").append(generator.getConfig().getNumBins()).append('x').append(temporalLength)
                .append(" pixels representing temporal saturation histogram\n\n");
        info.append("YOLO Format:\n");
        for (SmokeLabel label : SmokeLabel.values()) {
            info.append("- Class ").append(label.getClassId()).append(": ").append(label.getClassName()).append('\n');
        }
        info.append("Dataset Statistics:\n");
        info.append("- Videos processed: ").append(videos).append('\n');
        info.append("- Total segments: ").append(totalSegments).append('\n');
        info.append("- Smoke segments: ").append(smokeSegments).append('\n');
        info.append("- No smoke segments: ").append(totalSegments - smokeSegments).append('\n');

        Files.write(rootDir.resolve(config.getInfoFile()), info.toString().getBytes(StandardCharsets.UTF_8));
        LOG.info("Dataset info written: {} video(s), {} segment(s)", videos, totalSegments);
    }

    private void writeClasses(Path classesFile) throws IOException {
        StringBuilder classes = new StringBuilder();
        for (SmokeLabel label : SmokeLabel.values()) {
            classes.append(label.getClassName()).append('\n');
        }
        Files.write(classesFile, classes.toString().getBytes(StandardCharsets.UTF_8));
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(imagesDir);
        Files.createDirectories(labelsDir);
    }

    /**
     * 视频文件名（去扩展名）+ 片段键
     */
    public static String uniqueSegmentKey(String videoPath, SegmentAnnotation annotation) {
        String videoName = "annotations";
        if (videoPath != null && !videoPath.isEmpty()) {
            String fileName = Paths.get(videoPath).getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            videoName = dot > 0 ? fileName.substring(0, dot) : fileName;
        }
        return videoName + "_" + annotation.getSegmentKey();
    }

    public Path getRootDir() {
        return rootDir;
    }
}
