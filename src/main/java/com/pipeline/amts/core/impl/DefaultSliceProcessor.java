package com.pipeline.amts.core.impl;

import com.pipeline.amts.core.HistoryStore;
import com.pipeline.amts.core.OutputSink;
import com.pipeline.amts.core.SliceProcessor;
import com.pipeline.amts.exception.SliceProcessingException;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.ProcessResult;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.RawBatch;
import com.pipeline.amts.model.RawRow;
import com.pipeline.amts.model.SliceDefinition;
import com.pipeline.amts.model.SliceType;
import com.pipeline.amts.operators.RobustFilter;
import com.pipeline.amts.storage.RawCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 切片处理器默认实现。
 *
 * 离群检测总是在切片的完整有效序列（StartUTC 之后的全部原始行）上进行，
 * 使用滑动窗口（见 RobustFilter#filterTrailing），然后再截取本次需要写入的部分。
 * 历史不足一个窗口时按全量处理，这样增量多次处理与一次全量重建得到的结果完全一致。
 */
public class DefaultSliceProcessor implements SliceProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultSliceProcessor.class);

    private final RawInputLocator locator;
    private final RawCsvReader reader;
    private final HistoryStore historyStore;
    private final List<OutputSink> sinks;

    /** 离群检测滑动窗口大小，0 表示整个序列 */
    private final int windowSize;

    public DefaultSliceProcessor(RawInputLocator locator, RawCsvReader reader, HistoryStore historyStore,
                                 List<OutputSink> sinks, int windowSize) {
        this.locator = locator;
        this.reader = reader;
        this.historyStore = historyStore;
        this.sinks = List.copyOf(sinks);
        this.windowSize = windowSize;
        log.info("SliceProcessor initialized. Sinks: {}, FilterWindow: {}", this.sinks.size(), windowSize);
    }

    @Override
    public ProcessResult process(SliceDefinition definition, CacheEntry entry, ProcessingMode mode) {
        String sliceId = definition.getSliceId();
        ProcessingMode effective = mode;
        if (mode == ProcessingMode.INCREMENTAL && (entry == null || entry.getLastProcessedEpoch() == null)) {
            // 没有处理记录时无法知道历史里已有什么，按全量重建处理
            log.info("Slice '{}' has no cached epoch, promoting to full rebuild.", sliceId);
            effective = ProcessingMode.FULL;
        }

        try {
            return doProcess(definition, entry, effective);
        } catch (SliceProcessingException e) {
            log.error("Slice '{}' failed: {}", sliceId, e.getMessage(), e);
            return ProcessResult.error(sliceId, effective, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Slice '{}' failed unexpectedly: {}", sliceId, e.getMessage(), e);
            return ProcessResult.error(sliceId, effective, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ProcessResult doProcess(SliceDefinition definition, CacheEntry entry, ProcessingMode requested) {
        String sliceId = definition.getSliceId();
        ProcessingMode mode = requested;

        // 1. 定位原始文件
        List<Path> files;
        try {
            files = locator.locate(definition);
        } catch (UncheckedIOException e) {
            throw new SliceProcessingException(sliceId, e.getMessage(), e);
        }
        if (files.isEmpty()) {
            log.info("Slice '{}': no raw files match '{}' under {}.",
                    sliceId, definition.getMatchPattern(), definition.getImportFolder());
            return ProcessResult.noInput(sliceId, mode);
        }

        // 2. 解析
        RawBatch batch;
        try {
            batch = reader.read(definition, files);
        } catch (IOException e) {
            throw new SliceProcessingException(sliceId, "Cannot read raw input: " + e.getMessage(), e);
        }

        // 3. 有效序列：StartUTC 之后，按时间排序，同一时间戳保留最先读到的行
        List<RawRow> series = effectiveSeries(definition, batch.getRows());

        // 4. 增量截止点；已写入部分的离群结果还可能变化时改为全量
        Instant cutoff = null;
        if (mode == ProcessingMode.INCREMENTAL) {
            cutoff = incrementalCutoff(definition, entry);
            if (!flagsSettled(series, cutoff)) {
                log.info("Slice '{}': outlier flags before {} are not final yet (window {}), rebuilding in full.",
                        sliceId, cutoff, windowSize);
                mode = ProcessingMode.FULL;
                cutoff = null;
            }
        }

        // 5. 离群检测，截取本次需要写入的部分
        boolean[] outliers = new RobustFilter(definition.getOutlierThreshold())
                .flagRows(columnsOf(definition.getType(), series), windowSize);
        List<DeltaRecord> accepted = new ArrayList<>();
        List<DeltaRecord> rejected = new ArrayList<>();
        Instant maxTimestamp = null;
        for (int i = 0; i < series.size(); i++) {
            RawRow row = series.get(i);
            if (cutoff != null && !row.getTimestamp().isAfter(cutoff)) {
                continue;
            }
            DeltaRecord record = toDelta(definition, row, outliers[i]);
            if (outliers[i]) {
                rejected.add(record);
            } else {
                accepted.add(record);
            }
            maxTimestamp = row.getTimestamp();
        }

        // 6. 写入历史
        if (mode == ProcessingMode.FULL) {
            historyStore.replace(definition, accepted, rejected);
        } else if (!accepted.isEmpty() || !rejected.isEmpty()) {
            historyStore.append(definition, accepted, rejected);
        }

        Instant newEpoch;
        if (maxTimestamp != null) {
            newEpoch = maxTimestamp;
        } else {
            newEpoch = cutoff;
        }

        // 7. 通知下游
        if (mode == ProcessingMode.FULL || !accepted.isEmpty()) {
            notifySinks(definition, accepted, mode);
        }

        log.info("Slice '{}' processed ({}): {} appended, {} rejected, {} parse warning(s), epoch {}.",
                sliceId, mode, accepted.size(), rejected.size(), batch.getParseWarnings(), newEpoch);
        return ProcessResult.ok(sliceId, mode, accepted.size(), rejected.size(),
                batch.getParseWarnings(), newEpoch, batch.getMaxModifiedMillis());
    }

    /**
     * 增量截止点：缓存中的数据时间点与历史最后一条记录两者较晚者。
     * 历史写入后、缓存提交前进程退出时，靠历史本身避免重复写入。
     */
    private Instant incrementalCutoff(SliceDefinition definition, CacheEntry entry) {
        Instant epoch = entry.getLastProcessedEpoch();
        Instant last = historyStore.lastTimestamp(definition).orElse(null);
        if (last != null && last.isAfter(epoch)) {
            log.warn("Slice '{}': history ends at {} beyond cached epoch {}, resuming from history.",
                    definition.getSliceId(), last, epoch);
            return last;
        }
        return epoch;
    }

    /**
     * 截止点之前至少有 window 行时，这些行的离群结果不再随新数据变化，可以只追加。
     * window 为 0（整序列检测）时任何新数据都可能改变已有结果。
     */
    boolean flagsSettled(List<RawRow> series, Instant cutoff) {
        if (windowSize <= 0) {
            return false;
        }
        int written = 0;
        for (RawRow row : series) {
            if (!row.getTimestamp().isAfter(cutoff)) {
                written++;
            }
        }
        return written >= windowSize;
    }

    static List<RawRow> effectiveSeries(SliceDefinition definition, List<RawRow> rows) {
        Instant start = definition.getStartTimestamp();
        List<RawRow> sorted = new ArrayList<>();
        for (RawRow row : rows) {
            if (!row.getTimestamp().isBefore(start)) {
                sorted.add(row);
            }
        }
        // 稳定排序，保证同一时间戳时先读到的行在前
        sorted.sort(Comparator.comparing(RawRow::getTimestamp));

        List<RawRow> unique = new ArrayList<>(sorted.size());
        Set<Instant> seen = new HashSet<>();
        for (RawRow row : sorted) {
            if (seen.add(row.getTimestamp())) {
                unique.add(row);
            }
        }
        return unique;
    }

    private static List<double[]> columnsOf(SliceType type, List<RawRow> series) {
        List<double[]> columns = new ArrayList<>();
        for (SliceType.Measurement m : type.getMeasurements()) {
            double[] column = new double[series.size()];
            for (int i = 0; i < column.length; i++) {
                column[i] = series.get(i).reading(m);
            }
            columns.add(column);
        }
        return columns;
    }

    static DeltaRecord toDelta(SliceDefinition definition, RawRow row, boolean outlier) {
        SliceType type = definition.getType();
        Double north = type.measures(SliceType.Measurement.NORTHING)
                ? toMillimetres(row.getNorthing(), definition.getBaselineNorth()) : null;
        Double east = type.measures(SliceType.Measurement.EASTING)
                ? toMillimetres(row.getEasting(), definition.getBaselineEast()) : null;
        double height = toMillimetres(row.getElevation(), definition.getBaselineHeight());
        return new DeltaRecord(row.getTimestamp(), definition.getSensorId(), row.getPointName(),
                north, east, height, outlier);
    }

    /** 读数与基准值之差，米转毫米 */
    private static double toMillimetres(double reading, double baseline) {
        return (reading - baseline) * 1000.0;
    }

    private void notifySinks(SliceDefinition definition, List<DeltaRecord> records, ProcessingMode mode) {
        for (OutputSink sink : sinks) {
            try {
                sink.accept(definition, records, mode);
            } catch (Exception e) {
                log.warn("Output sink '{}' failed for slice '{}': {}",
                        sink.name(), definition.getSliceId(), e.getMessage(), e);
            }
        }
    }
}
