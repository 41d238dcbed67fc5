package com.smoke.temporal.processor;

import com.smoke.temporal.exception.InvalidInputException;
import com.smoke.temporal.model.RegionHistory;
import com.smoke.temporal.model.RegionRenderResult;
import com.smoke.temporal.model.TemporalGrid;
import com.smoke.temporal.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 3x3 时序网格渲染器
 * 处理流程（每个区域独立）：
 * 1. 校验并修复直方图条目
 * 2. 堆叠为 (帧数 x 分箱数) 矩阵，负值裁剪为0
 * 3. 行补零/截断到 temporalLength，列补零/截断到 numBins
 * 4. 整个矩阵做 min-max 归一化到 [0,255]（区域之间互不影响）
 * 5. 写入网格中对应的位置
 * 单个区域出错时该区域填零，其他区域正常输出
 */
public class RegionGridRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(RegionGridRenderer.class);

    static final int MID_GRAY = 128;
    static final int WHITE = 255;

    private final int numRegions;
    private final int numBins;
    private final int temporalLength;

    public RegionGridRenderer(int numRegions, int numBins, int temporalLength) {
        this.numRegions = numRegions;
        this.numBins = numBins;
        this.temporalLength = temporalLength;
    }

    /**
     * 渲染完整网格
     */
    public TemporalGrid render(List<RegionHistory> histories) {
        if (histories == null || histories.isEmpty()) {
            throw new InvalidInputException("Region histories cannot be empty");
        }
        if (histories.size() != numRegions) {
            throw new InvalidInputException(
                    "Expected " + numRegions + " regions, got " + histories.size());
        }

        int gridWidth = RegionLayout.GRID_SIZE * numBins;
        int gridHeight = RegionLayout.GRID_SIZE * temporalLength;
        byte[] gridData = new byte[gridWidth * gridHeight];

        List<RegionRenderResult> results = new ArrayList<>(numRegions);
        for (int i = 0; i < histories.size(); i++) {
            RegionRenderResult result = renderRegion(i, histories.get(i));
            results.add(result);

            // 失败区域保持全零
            if (!result.isFailed()) {
                place(gridData, gridWidth, i, result.getBlock());
            }
        }

        return new TemporalGrid(ImageUtils.toGrayMat(gridData, gridHeight, gridWidth), results);
    }

    /**
     * 渲染单个区域，任何运行时异常都被隔离在本区域内
     */
    public RegionRenderResult renderRegion(int regionIndex, RegionHistory history) {
        String regionName = "Region " + (regionIndex + 1);
        List<String> repairs = new ArrayList<>();

        try {
            List<double[]> entries = repairEntries(regionName, history, repairs);
            double[][] raw = stack(entries);
            double[][] fixed = fixDimensions(regionName, raw, repairs);
            byte[] block = normalize(regionName, fixed);

            if (repairs.isEmpty()) {
                return RegionRenderResult.ok(regionIndex, block);
            }
            return RegionRenderResult.repaired(regionIndex, block, String.join("; ", repairs));

        } catch (RuntimeException e) {
            LOG.error("{}: Error during processing - {}", regionName, e.getMessage(), e);
            return RegionRenderResult.failed(regionIndex, e.getMessage());
        }
    }

    /**
     * 空历史替换为 temporalLength 个零向量；空条目替换为零向量
     */
    private List<double[]> repairEntries(String regionName, RegionHistory history, List<String> repairs) {
        List<double[]> entries = history == null ? null : history.getEntries();

        if (entries == null || entries.isEmpty()) {
            LOG.warn("{}: Empty history, using zero array", regionName);
            repairs.add("empty history");
            List<double[]> zeros = new ArrayList<>(temporalLength);
            for (int j = 0; j < temporalLength; j++) {
                zeros.add(new double[numBins]);
            }
            return zeros;
        }

        List<double[]> validated = new ArrayList<>(entries.size());
        for (int j = 0; j < entries.size(); j++) {
            double[] hist = entries.get(j);
            if (hist == null || hist.length == 0) {
                LOG.warn("{}, frame {}: Empty histogram, using zeros", regionName, j);
                repairs.add("frame " + j + " empty histogram");
                hist = new double[numBins];
            }
            validated.add(hist);
        }
        return validated;
    }

    /**
     * 堆叠为矩阵并裁剪负值，所有行长度必须一致
     */
    private double[][] stack(List<double[]> entries) {
        int cols = entries.get(0).length;
        double[][] matrix = new double[entries.size()][];

        for (int j = 0; j < entries.size(); j++) {
            double[] hist = entries.get(j);
            if (hist.length != cols) {
                throw new IllegalArgumentException("Inconsistent histogram length at frame " + j
                        + ": expected " + cols + ", got " + hist.length);
            }
            double[] row = new double[cols];
            for (int k = 0; k < cols; k++) {
                // NaN 保留，交给归一化阶段处理
                row[k] = hist[k] < 0.0 ? 0.0 : hist[k];
            }
            matrix[j] = row;
        }
        return matrix;
    }

    /**
     * 行列补零或截断到 (temporalLength, numBins)
     */
    private double[][] fixDimensions(String regionName, double[][] raw, List<String> repairs) {
        int rows = raw.length;
        int cols = raw[0].length;

        if (rows < temporalLength) {
            LOG.warn("{}: Padded {} temporal frames (had {}, expected {})",
                    regionName, temporalLength - rows, rows, temporalLength);
            repairs.add("padded " + (temporalLength - rows) + " temporal frames");
        } else if (rows > temporalLength) {
            LOG.warn("{}: Clamped temporal frames (had {}, expected {})", regionName, rows, temporalLength);
            repairs.add("clamped " + (rows - temporalLength) + " temporal frames");
        }

        if (cols < numBins) {
            LOG.warn("{}: Padded {} histogram bins (had {}, expected {})",
                    regionName, numBins - cols, cols, numBins);
            repairs.add("padded " + (numBins - cols) + " histogram bins");
        } else if (cols > numBins) {
            LOG.warn("{}: Clamped histogram bins (had {}, expected {})", regionName, cols, numBins);
            repairs.add("clamped " + (cols - numBins) + " histogram bins");
        }

        double[][] fixed = new double[temporalLength][numBins];
        int keptRows = Math.min(rows, temporalLength);
        int keptCols = Math.min(cols, numBins);
        for (int r = 0; r < keptRows; r++) {
            System.arraycopy(raw[r], 0, fixed[r], 0, keptCols);
        }

        if (fixed.length != temporalLength || fixed[0].length != numBins) {
            throw new IllegalStateException(regionName + ": Shape mismatch after padding/clamping. Got ("
                    + fixed.length + ", " + fixed[0].length + "), expected ("
                    + temporalLength + ", " + numBins + ")");
        }
        return fixed;
    }

    /**
     * 整个矩阵 min-max 归一化到 [0,255]，截断取整，输出行优先的区域块
     */
    private byte[] normalize(String regionName, double[][] matrix) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        boolean hasNaN = false;
        for (double[] row : matrix) {
            for (double value : row) {
                if (Double.isNaN(value)) {
                    hasNaN = true;
                } else {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
            }
        }

        byte[] block = new byte[temporalLength * numBins];

        if (hasNaN || !Double.isFinite(min) || !Double.isFinite(max)) {
            LOG.warn("{}: Invalid range min={}, max={}, using fallback", regionName,
                    hasNaN ? Double.NaN : min, hasNaN ? Double.NaN : max);
            Arrays.fill(block, (byte) MID_GRAY);
        } else if (max == min) {
            if (max > 0) {
                LOG.debug("{}: Uniform region (all values = {}), setting to 255", regionName, max);
                Arrays.fill(block, (byte) WHITE);
            } else {
                LOG.debug("{}: Empty region (all zeros), keeping as 0", regionName);
            }
        } else {
            double range = max - min;
            for (int r = 0; r < temporalLength; r++) {
                for (int c = 0; c < numBins; c++) {
                    block[r * numBins + c] = (byte) (int) ((matrix[r][c] - min) / range * 255);
                }
            }
        }
        return block;
    }

    /**
     * 将区域块写入网格：row = i/3, col = i%3
     */
    private void place(byte[] gridData, int gridWidth, int regionIndex, byte[] block) {
        int yStart = (regionIndex / RegionLayout.GRID_SIZE) * temporalLength;
        int xStart = (regionIndex % RegionLayout.GRID_SIZE) * numBins;
        for (int r = 0; r < temporalLength; r++) {
            System.arraycopy(block, r * numBins, gridData, (yStart + r) * gridWidth + xStart, numBins);
        }
    }
}
