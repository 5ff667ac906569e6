package com.pipeline.amts.sinks;

import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import com.pipeline.amts.core.OutputSink;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.SliceDefinition;
import com.pipeline.amts.model.SliceType;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * 批次统计报表。
 * 每次写入后在 reports 目录生成 {sliceId}_{yyyy-MM-dd}_summary.csv，
 * 每个位移分量一行：样本数、均值、标准差、最小值、中位数、最大值。
 * 同一天多次处理时覆盖当天的报表。
 */
public class SummaryReportSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(SummaryReportSink.class);

    static final String[] HEADER = {"COLUMN", "COUNT", "MEAN", "STD", "MIN", "MEDIAN", "MAX"};

    private final Path reportsRoot;
    private final Clock clock;

    public SummaryReportSink(Path reportsRoot) {
        this(reportsRoot, Clock.systemUTC());
    }

    public SummaryReportSink(Path reportsRoot, Clock clock) {
        this.reportsRoot = reportsRoot;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "summary-report";
    }

    @Override
    public void accept(SliceDefinition definition, List<DeltaRecord> records, ProcessingMode mode) throws IOException {
        if (records.isEmpty()) {
            return;
        }
        Path file = reportFile(definition);
        Files.createDirectories(file.getParent());

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                     .setHeader(HEADER)
                     .setRecordSeparator('\n')
                     .build())) {
            SliceType type = definition.getType();
            if (type.measures(SliceType.Measurement.NORTHING)) {
                printColumn(printer, "DELTA_N_MM", records, DeltaRecord::getDeltaNorthMm);
            }
            if (type.measures(SliceType.Measurement.EASTING)) {
                printColumn(printer, "DELTA_E_MM", records, DeltaRecord::getDeltaEastMm);
            }
            printColumn(printer, "DELTA_H_MM", records, DeltaRecord::getDeltaHeightMm);
        }
        log.debug("Summary report written: {}", file);
    }

    public Path reportFile(SliceDefinition definition) {
        return reportsRoot.resolve(definition.getStorageName() + "_" + LocalDate.now(clock) + "_summary.csv");
    }

    private static void printColumn(CSVPrinter printer, String column, List<DeltaRecord> records,
                                    Function<DeltaRecord, Double> getter) throws IOException {
        double[] values = records.stream()
                .map(getter)
                .filter(v -> v != null)
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (values.length == 0) {
            printer.printRecord(column, 0, "", "", "", "", "");
            return;
        }
        Stats stats = Stats.of(values);
        printer.printRecord(
                column,
                stats.count(),
                stats.mean(),
                stats.count() > 1 ? Double.toString(stats.sampleStandardDeviation()) : "",
                stats.min(),
                Quantiles.median().compute(values),
                stats.max());
    }
}
