package com.smoke.temporal.config;

import com.smoke.temporal.exception.InvalidConfigurationException;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Serializable;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 数据集生成配置类
 */
@Data
public class DatasetConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DatasetConfig.class);

    public static final String DEFAULT_RESOURCE = "application.properties";

    // 网格生成配置
    private TemporalGridConfig gridConfig = TemporalGridConfig.defaults();

    // 视频切片配置
    private int segmentLength = 64;

    // 数据集目录配置
    private String rootDir = Paths.get(System.getProperty("user.home"), "smoke_detection_annotations").toString();
    private String imagesSubdir = "images";
    private String labelsSubdir = "labels";
    private String classesFile = "classes.txt";
    private String summaryFile = "all_annotations_summary.json";
    private String infoFile = "dataset_info.txt";

    /**
     * 从配置文件加载配置
     */
    public static DatasetConfig loadConfig() {
        return loadConfig(DEFAULT_RESOURCE);
    }

    /**
     * 从指定的classpath资源加载配置
     */
    public static DatasetConfig loadConfig(String resource) {
        DatasetConfig config = new DatasetConfig();
        Properties props = new Properties();

        try (InputStream input = DatasetConfig.class.getClassLoader()
                .getResourceAsStream(resource)) {
            if (input == null) {
                LOG.warn("Configuration file '{}' not found in classpath", resource);
                return config;
            }

            props.load(input);

            // 加载网格配置
            config.setGridConfig(TemporalGridConfig.fromProperties(props));

            // 加载切片配置
            config.setSegmentLength(Integer.parseInt(
                    props.getProperty("segment.length", "64").trim()));

            // 加载数据集目录配置
            String rootDir = props.getProperty("dataset.root.dir", "").trim();
            if (!rootDir.isEmpty()) {
                config.setRootDir(rootDir.replace("${user.home}", System.getProperty("user.home")));
            }
            config.setImagesSubdir(props.getProperty("dataset.images.subdir", "images").trim());
            config.setLabelsSubdir(props.getProperty("dataset.labels.subdir", "labels").trim());
            config.setClassesFile(props.getProperty("dataset.classes.file", "classes.txt").trim());
            config.setSummaryFile(props.getProperty("dataset.summary.file",
                    "all_annotations_summary.json").trim());
            config.setInfoFile(props.getProperty("dataset.info.file", "dataset_info.txt").trim());

            LOG.info("Configuration loaded successfully");
            LOG.info("Grid: frame {}x{}, regions: {}, bins: {}, temporal length: {}",
                    config.getGridConfig().getFrameWidth(), config.getGridConfig().getFrameHeight(),
                    config.getGridConfig().getNumRegions(), config.getGridConfig().getNumBins(),
                    config.getGridConfig().getTemporalLength());
            LOG.info("Dataset root: {}, segment length: {}", config.getRootDir(), config.getSegmentLength());

        } catch (NumberFormatException e) {
            LOG.error("Invalid numeric value in configuration '{}'", resource, e);
            throw new InvalidConfigurationException("Invalid numeric value in " + resource, e);
        } catch (Exception e) {
            LOG.error("Error loading configuration", e);
            throw new RuntimeException("Failed to load configuration", e);
        }

        return config;
    }
}
