package com.pipeline.amts.operators;

import com.pipeline.amts.model.DataPoint;
import com.pipeline.amts.model.FlaggedPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 稳健离群检测算子。
 * 以中位数为中心、中位数绝对偏差（MAD）为离散度估计，
 * 将 |x - median| > k × 1.4826 × MAD 的数据点标记为离群。
 *
 * 只标记不删除，由调用方决定如何处理被标记的点。
 * 无内部状态，可在多个切片间并发调用。
 *
 * 参数：
 * - threshold: 离群倍数 k（默认3.5）
 * - window: 滑动窗口大小（0 表示整个序列）
 */
public final class RobustFilter {

    /** 正态分布下 MAD 到标准差的换算系数 */
    public static final double MAD_SCALE = 1.4826;

    public static final double DEFAULT_THRESHOLD = 3.5;

    /** 窗口内少于该点数时不做检测 */
    public static final int MIN_POINTS = 3;

    private final double threshold;

    public RobustFilter(double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("MAD threshold must be a positive number, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public RobustFilter() {
        this(DEFAULT_THRESHOLD);
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * 对整个序列做一次检测。
     * MAD 为 0（所有值相同）时不标记任何点。
     */
    public List<FlaggedPoint> filter(List<? extends DataPoint> series) {
        List<FlaggedPoint> result = new ArrayList<>(series.size());
        if (series.isEmpty()) {
            return result;
        }
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        boolean[] flags = flagWhole(values);
        for (int i = 0; i < values.length; i++) {
            DataPoint dp = series.get(i);
            result.add(new FlaggedPoint(dp.getTimestamp(), dp.getValue(), flags[i]));
        }
        return result;
    }

    /**
     * 滑动窗口检测。
     * 前 window 个点一起与开头窗口 [0, min(n, window)) 比较，之后每个点与以它结尾的最近 window 个点比较。
     * 序列长度达到 window 后，已有点的结果不再随后续数据变化。
     *
     * @param window 窗口大小；小于等于0时退化为整序列检测
     */
    public List<FlaggedPoint> filterTrailing(List<? extends DataPoint> series, int window) {
        if (window <= 0) {
            return filter(series);
        }
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        boolean[] flags = flagTrailing(values, window);
        List<FlaggedPoint> result = new ArrayList<>(series.size());
        for (int i = 0; i < values.length; i++) {
            DataPoint dp = series.get(i);
            result.add(new FlaggedPoint(dp.getTimestamp(), dp.getValue(), flags[i]));
        }
        return result;
    }

    /**
     * 多列检测：任一列被标记则整行标记。
     *
     * @param columns 每个元素是一列，各列长度相同
     * @param window  窗口大小；小于等于0时按整序列检测
     * @return 每行是否离群
     */
    public boolean[] flagRows(List<double[]> columns, int window) {
        if (columns.isEmpty()) {
            return new boolean[0];
        }
        int rows = columns.get(0).length;
        boolean[] mask = new boolean[rows];
        for (double[] column : columns) {
            if (column.length != rows) {
                throw new IllegalArgumentException("All columns must have the same length");
            }
            boolean[] flags = window > 0 ? flagTrailing(column, window) : flagWhole(column);
            for (int i = 0; i < rows; i++) {
                mask[i] |= flags[i];
            }
        }
        return mask;
    }

    private boolean[] flagWhole(double[] values) {
        boolean[] flags = new boolean[values.length];
        if (values.length < MIN_POINTS) {
            return flags;
        }
        double median = median(values.clone());
        double scaledMad = MAD_SCALE * mad(values, median);
        if (scaledMad == 0.0 || Double.isNaN(scaledMad)) {
            return flags;
        }
        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs(values[i] - median) > threshold * scaledMad;
        }
        return flags;
    }

    private boolean[] flagTrailing(double[] values, int window) {
        boolean[] flags = new boolean[values.length];
        // 前 window 个点共用开头窗口 [0, min(n, window))
        int leading = Math.min(values.length, window);
        boolean[] head = flagWhole(Arrays.copyOf(values, leading));
        System.arraycopy(head, 0, flags, 0, leading);

        for (int i = window; i < values.length; i++) {
            double[] slice = Arrays.copyOfRange(values, i - window + 1, i + 1);
            flags[i] = isOutlier(values[i], slice);
        }
        return flags;
    }

    private boolean isOutlier(double value, double[] window) {
        if (window.length < MIN_POINTS) {
            return false;
        }
        double median = median(window.clone());
        double scaledMad = MAD_SCALE * mad(window, median);
        if (scaledMad == 0.0 || Double.isNaN(scaledMad)) {
            return false;
        }
        return Math.abs(value - median) > threshold * scaledMad;
    }

    /** 中位数；会对传入数组排序 */
    static double median(double[] values) {
        Arrays.sort(values);
        int n = values.length;
        if (n % 2 == 1) {
            return values[n / 2];
        }
        return (values[n / 2 - 1] + values[n / 2]) / 2.0;
    }

    static double mad(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }
}
