package com.smoke.temporal.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 数据集合并工具
 * 将源数据集目录复制到目标目录：
 * 1. 同名JSON文件按内容合并（对象合并键，数组去重合并）
 * 2. 同名文本文件按行去重追加
 * 3. 其他文件（图片、标签）直接覆盖
 */
public class DatasetMerger {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetMerger.class);

    private static final Set<String> TEXT_EXTENSIONS = new LinkedHashSet<>(
            Arrays.asList(".txt", ".py", ".xml", ".csv", ".log"));

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Data
    @AllArgsConstructor
    public static class MergeReport {
        private int totalFiles;
        private int mergedFiles;
    }

    /**
     * 合并源目录到目标目录
     */
    public MergeReport merge(Path sourceDir, Path destinationDir) throws IOException {
        Files.createDirectories(destinationDir);

        LOG.info("Merging dataset: {} -> {}", sourceDir, destinationDir);

        int totalFiles = 0;
        int mergedFiles = 0;

        if (!Files.isDirectory(sourceDir)) {
            LOG.warn("Source folder does not exist: {}", sourceDir);
            return new MergeReport(0, 0);
        }

        for (Path relative : listFiles(sourceDir)) {
            Path sourceFile = sourceDir.resolve(relative);
            Path destFile = destinationDir.resolve(relative);
            if (destFile.getParent() != null) {
                Files.createDirectories(destFile.getParent());
            }

            if (Files.exists(destFile)) {
                String extension = extensionOf(relative);
                if (".json".equals(extension)) {
                    if (mergeJson(destFile, sourceFile)) {
                        LOG.info("Merged JSON: {}", relative);
                        mergedFiles++;
                    } else {
                        LOG.info("Overwriting: {}", relative);
                        Files.copy(sourceFile, destFile, StandardCopyOption.REPLACE_EXISTING);
                    }
                } else if (TEXT_EXTENSIONS.contains(extension)) {
                    try {
                        mergeText(destFile, sourceFile);
                        LOG.info("Merged: {}", relative);
                        mergedFiles++;
                    } catch (IOException e) {
                        LOG.warn("Error merging {}, overwriting: {}", relative, e.getMessage());
                        Files.copy(sourceFile, destFile, StandardCopyOption.REPLACE_EXISTING);
                    }
                } else {
                    LOG.debug("Overwriting: {}", relative);
                    Files.copy(sourceFile, destFile, StandardCopyOption.REPLACE_EXISTING);
                }
            } else {
                LOG.debug("Copied: {}", relative);
                Files.copy(sourceFile, destFile);
            }
            totalFiles++;
        }

        LOG.info("Merge complete: {} file(s) processed, {} merged", totalFiles, mergedFiles);
        return new MergeReport(totalFiles, mergedFiles);
    }

    /**
     * 合并JSON：对象合并键（新值覆盖），数组追加不重复元素，类型不一致时同时保留
     *
     * @return 解析失败返回 false，由调用方覆盖
     */
    boolean mergeJson(Path existingFile, Path newFile) {
        try {
            JsonNode existing = objectMapper.readTree(existingFile.toFile());
            JsonNode incoming = objectMapper.readTree(newFile.toFile());

            JsonNode merged;
            if (existing.isObject() && incoming.isObject()) {
                ObjectNode object = ((ObjectNode) existing).deepCopy();
                object.setAll((ObjectNode) incoming);
                merged = object;
            } else if (existing.isArray() && incoming.isArray()) {
                ArrayNode array = ((ArrayNode) existing).deepCopy();
                for (JsonNode item : incoming) {
                    if (!containsNode(existing, item)) {
                        array.add(item);
                    }
                }
                merged = array;
            } else {
                ObjectNode wrapper = objectMapper.createObjectNode();
                wrapper.set("existing", existing);
                wrapper.set("new", incoming);
                merged = wrapper;
            }

            objectMapper.writeValue(existingFile.toFile(), merged);
            return true;
        } catch (IOException e) {
            LOG.warn("Error merging JSON {}: {}", existingFile, e.getMessage());
            return false;
        }
    }

    private static boolean containsNode(JsonNode array, JsonNode item) {
        for (JsonNode element : array) {
            if (element.equals(item)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 文本文件按行去重追加，保留原有内容
     */
    void mergeText(Path existingFile, Path newFile) throws IOException {
        String existingContent = new String(Files.readAllBytes(existingFile), StandardCharsets.UTF_8);
        String newContent = new String(Files.readAllBytes(newFile), StandardCharsets.UTF_8);

        Set<String> existingLines = existingContent.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toSet());

        List<String> uniqueNewLines = new ArrayList<>();
        for (String line : newContent.lines().map(String::trim).collect(Collectors.toList())) {
            if (!line.isEmpty() && !existingLines.contains(line)) {
                uniqueNewLines.add(line);
            }
        }

        StringBuilder result = new StringBuilder(existingContent);
        if (!uniqueNewLines.isEmpty()) {
            if (!existingContent.isEmpty() && !existingContent.endsWith("\n")) {
                result.append('\n');
            }
            result.append(String.join("\n", uniqueNewLines)).append('\n');
        }
        Files.write(existingFile, result.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 目录下所有文件的相对路径（排序后）
     */
    public List<Path> listFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return new ArrayList<>();
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(directory::relativize)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static String extensionOf(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot) : "";
    }

    /**
     * 主函数
     * 用法：DatasetMerger &lt;源目录&gt; &lt;目标目录&gt; [--dry-run]
     */
    public static void main(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: DatasetMerger <source-folder> <destination-folder> [--dry-run]");
            System.out.println("Example: DatasetMerger dataset1/smoke_detection_annotations "
                    + "dataset2/smoke_detection_annotations");
            return;
        }

        Path source = Paths.get(args[0]);
        Path destination = Paths.get(args[1]);
        boolean dryRun = Arrays.asList(args).contains("--dry-run");
        DatasetMerger merger = new DatasetMerger();

        try {
            if (dryRun) {
                LOG.info("DRY RUN - no files will be copied");
                for (Path file : merger.listFiles(source)) {
                    LOG.info("Source: {}", file);
                }
                for (Path file : merger.listFiles(destination)) {
                    LOG.info("Destination: {}", file);
                }
                return;
            }

            MergeReport report = merger.merge(source, destination);
            LOG.info("Total files processed: {}, files merged: {}",
                    report.getTotalFiles(), report.getMergedFiles());
        } catch (Exception e) {
            LOG.error("Error merging datasets", e);
            System.exit(1);
        }
    }
}
