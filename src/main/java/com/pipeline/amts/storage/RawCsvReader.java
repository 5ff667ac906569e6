package com.pipeline.amts.storage;

import com.pipeline.amts.model.FileProfile;
import com.pipeline.amts.model.RawBatch;
import com.pipeline.amts.model.RawRow;
import com.pipeline.amts.model.SliceDefinition;
import com.pipeline.amts.model.SliceType;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按文件画像读取原始导出文件。
 *
 * 只保留测点名以切片 PointName 开头（不区分大小写）的行；
 * 时间戳或读数无法解析的行计入解析警告并跳过。
 * 缺少必需列的文件整体跳过。
 */
public class RawCsvReader {

    private static final Logger log = LoggerFactory.getLogger(RawCsvReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .build();

    /**
     * 读取一组文件中属于该切片的行。
     *
     * @param definition 切片定义
     * @param files      已定位的原始文件，按路径升序
     * @return 本次读取结果，行按文件顺序排列（未排序、未去重）
     * @throws IOException 文件不可读
     */
    public RawBatch read(SliceDefinition definition, List<Path> files) throws IOException {
        FileProfile profile = definition.getProfile();
        ZoneId zone = definition.effectiveZone();
        DateTimeFormatter format = profile.getTimeFormat() == null
                ? null : DateTimeFormatter.ofPattern(profile.getTimeFormat(), Locale.ROOT);
        String prefix = definition.getPointName().toLowerCase(Locale.ROOT);

        List<RawRow> rows = new ArrayList<>();
        int warnings = 0;
        long maxModified = 0L;

        for (Path file : files) {
            maxModified = Math.max(maxModified, Files.getLastModifiedTime(file).toMillis());

            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                skipBom(reader);
                try (CSVParser parser = FORMAT.parse(reader)) {
                    Map<String, String> columns = resolveColumns(parser, definition);
                    if (columns == null) {
                        continue;
                    }

                    String fileName = file.getFileName().toString();
                    for (CSVRecord record : parser) {
                        String point = field(record, columns.get(profile.getPointColumn()));
                        if (point == null || !point.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                            continue;
                        }
                        RawRow row = toRow(record, columns, definition, zone, format, point, fileName);
                        if (row == null) {
                            warnings++;
                        } else {
                            rows.add(row);
                        }
                    }
                }
            } catch (IllegalStateException | IllegalArgumentException | java.io.UncheckedIOException e) {
                throw new IOException("Malformed CSV in " + file + ": " + e.getMessage(), e);
            }
        }

        if (warnings > 0) {
            log.warn("Slice '{}': {} raw row(s) could not be parsed and were skipped.",
                    definition.getSliceId(), warnings);
        }
        return new RawBatch(rows, files.size(), warnings, maxModified);
    }

    private RawRow toRow(CSVRecord record, Map<String, String> columns, SliceDefinition definition,
                         ZoneId zone, DateTimeFormatter format, String point, String fileName) {
        FileProfile profile = definition.getProfile();
        SliceType type = definition.getType();
        try {
            Instant ts = TimestampParser.toInstant(
                    field(record, columns.get(profile.getTimeColumn())), zone, format);

            Double northing = null;
            Double easting = null;
            if (type.measures(SliceType.Measurement.NORTHING)) {
                northing = number(field(record, columns.get(profile.getNorthingColumn())));
            }
            if (type.measures(SliceType.Measurement.EASTING)) {
                easting = number(field(record, columns.get(profile.getEastingColumn())));
            }
            double elevation = number(field(record, columns.get(profile.getElevationColumn())));
            return new RawRow(ts, point, northing, easting, elevation, fileName);
        } catch (DateTimeException | IllegalArgumentException e) {
            log.debug("Skipping row {} of {}: {}", record.getRecordNumber(), fileName, e.getMessage());
            return null;
        }
    }

    /**
     * 将画像中的列名映射到文件实际表头（不区分大小写）。
     * 缺少必需列时返回null。
     */
    private Map<String, String> resolveColumns(CSVParser parser, SliceDefinition definition) {
        Map<String, String> actual = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String header : parser.getHeaderNames()) {
            actual.put(header, header);
        }

        FileProfile profile = definition.getProfile();
        List<String> required = new ArrayList<>();
        required.add(profile.getTimeColumn());
        required.add(profile.getPointColumn());
        for (SliceType.Measurement m : definition.getType().getMeasurements()) {
            required.add(profile.columnFor(m));
        }

        Map<String, String> resolved = new TreeMap<>();
        for (String column : required) {
            String header = actual.get(column);
            if (header == null) {
                log.warn("Raw file skipped for slice '{}': missing column '{}'.",
                        definition.getSliceId(), column);
                return null;
            }
            resolved.put(column, header);
        }
        return resolved;
    }

    private static String field(CSVRecord record, String header) {
        if (!record.isSet(header)) {
            return null;
        }
        String v = record.get(header);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static double number(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("empty reading");
        }
        double d = Double.parseDouble(raw);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("non-finite reading '" + raw + "'");
        }
        return d;
    }

    private static void skipBom(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
    }
}
