package com.pipeline.amts.core.impl;

import com.pipeline.amts.core.ConfigStore;
import com.pipeline.amts.exception.ConfigSourceException;
import com.pipeline.amts.model.ConfigLoadResult;
import com.pipeline.amts.model.FileProfile;
import com.pipeline.amts.model.RowError;
import com.pipeline.amts.model.SliceDefinition;
import com.pipeline.amts.model.SliceType;
import com.pipeline.amts.storage.TimestampParser;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 基于两张CSV表的配置存储实现。
 *
 * - Settings.csv：每行一个测点切片
 * - FileProfiles.csv：原始文件画像，按 Profile 列被测点表引用
 *
 * 列名不区分大小写。
 */
public class CsvConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(CsvConfigStore.class);

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "y");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private final Path settingsFile;
    private final Path profilesFile;
    private final double defaultThreshold;

    public CsvConfigStore(Path settingsFile, Path profilesFile, double defaultThreshold) {
        this.settingsFile = settingsFile;
        this.profilesFile = profilesFile;
        this.defaultThreshold = defaultThreshold;
    }

    @Override
    public List<Path> sourceFiles() {
        return List.of(settingsFile, profilesFile);
    }

    @Override
    public ConfigLoadResult load() {
        Map<String, FileProfile> profiles = loadProfiles();

        List<SliceDefinition> definitions = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        // 存储名（忽略大小写）→ 占用它的 sliceId
        Map<String, String> storageNames = new HashMap<>();
        int inactive = 0;
        int dataRows = 0;

        try (Reader reader = Files.newBufferedReader(settingsFile, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            requireColumns(parser, "Active|CSVImport", "SensorID|SQLSensorID", "Site", "PointName");

            for (CSVRecord record : parser) {
                long rowId = record.getRecordNumber();
                if (isBlankRecord(record)) {
                    continue;
                }
                dataRows++;
                if (!parseBool(value(record, "Active", "CSVImport"))) {
                    inactive++;
                    continue;
                }

                String sliceId = null;
                try {
                    sliceId = sliceIdOf(record);
                    if (seen.contains(sliceId)) {
                        errors.add(new RowError(rowId, sliceId, "Duplicate sliceId '" + sliceId + "'"));
                        continue;
                    }
                    String storageKey = SliceDefinition.storageName(sliceId).toLowerCase(Locale.ROOT);
                    String owner = storageNames.get(storageKey);
                    if (owner != null) {
                        errors.add(new RowError(rowId, sliceId, "sliceId '" + sliceId
                                + "' maps to the same output names as '" + owner + "'"));
                        continue;
                    }
                    // 校验通过后才占用 sliceId，无效行不挡住后面的同名有效行
                    definitions.add(toDefinition(record, sliceId, profiles));
                    seen.add(sliceId);
                    storageNames.put(storageKey, sliceId);
                } catch (IllegalArgumentException | DateTimeException e) {
                    errors.add(new RowError(rowId, sliceId, e.getMessage()));
                }
            }
        } catch (IOException | IllegalStateException | java.io.UncheckedIOException e) {
            throw new ConfigSourceException("Cannot read settings table " + settingsFile + ": " + e.getMessage(), e);
        }
        if (dataRows == 0) {
            throw new ConfigSourceException("Settings table " + settingsFile + " has no data rows");
        }

        for (RowError error : errors) {
            log.warn("Settings {} rejected: {}", settingsFile.getFileName(), error);
        }
        log.info("Loaded {} active slice(s) from {} ({} inactive, {} rejected).",
                definitions.size(), settingsFile, inactive, errors.size());
        return new ConfigLoadResult(definitions, errors);
    }

    // ==================== 测点表 ====================

    private SliceDefinition toDefinition(CSVRecord record, String sliceId, Map<String, FileProfile> profiles) {
        SliceType type = SliceType.parse(value(record, "Type"));

        String profileName = require(record, "FileProfile");
        FileProfile profile = profiles.get(profileName);
        if (profile == null) {
            throw new IllegalArgumentException("FileProfile '" + profileName + "' not found");
        }

        String exportFolder = value(record, "ExportFolder");
        String threshold = value(record, "OutlierMAD");
        String zone = value(record, "TimeZone");

        return SliceDefinition.builder()
                .sliceId(sliceId)
                .sensorId(normalizeId(require(record, "SensorID", "SQLSensorID")))
                .site(require(record, "Site"))
                .pointName(require(record, "PointName"))
                .type(type)
                .importFolder(Paths.get(require(record, "ImportFolder")))
                .exportFolder(exportFolder == null ? null : Paths.get(exportFolder))
                .baselineNorth(optionalDouble(record, "BaselineN"))
                .baselineEast(optionalDouble(record, "BaselineE"))
                .baselineHeight(parseDouble("BaselineH", require(record, "BaselineH")))
                .outlierThreshold(threshold == null ? defaultThreshold : parseDouble("OutlierMAD", threshold))
                .startTimestamp(TimestampParser.parseUtc(require(record, "StartUTC")))
                .timeZone(zone == null ? null : ZoneId.of(zone))
                .profile(profile)
                .active(true)
                .sqlExport(parseBool(value(record, "SQLImport")))
                .build();
    }

    private String sliceIdOf(CSVRecord record) {
        String explicit = value(record, "SliceId");
        if (explicit != null) {
            return explicit;
        }
        return require(record, "Site") + ":" + require(record, "PointName");
    }

    /** 表格软件常把整数ID存成 "101.0" */
    private static String normalizeId(String raw) {
        return raw.endsWith(".0") ? raw.substring(0, raw.length() - 2) : raw;
    }

    // ==================== 文件画像表 ====================

    /**
     * 读取文件画像表，按 Profile 名索引。表不存在或不可读时返回空表。
     */
    public Map<String, FileProfile> loadProfiles() {
        Map<String, FileProfile> profiles = new LinkedHashMap<>();
        if (!Files.isRegularFile(profilesFile)) {
            log.error("FileProfiles table {} not found, no profiles available.", profilesFile);
            return profiles;
        }

        try (Reader reader = Files.newBufferedReader(profilesFile, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                String name = value(record, "Profile");
                String match = value(record, "Match");
                if (name == null || match == null) {
                    continue;
                }
                if (profiles.containsKey(name)) {
                    log.warn("Duplicate FileProfile '{}' at row {}, keeping first occurrence.",
                            name, record.getRecordNumber());
                    continue;
                }
                profiles.put(name, new FileProfile(
                        name,
                        match,
                        validateZone(value(record, "TimeZone")),
                        value(record, "TimeFormat"),
                        value(record, "ColumnTime"),
                        value(record, "ColumnPoint"),
                        value(record, "ColumnNorthing"),
                        value(record, "ColumnEasting"),
                        value(record, "ColumnElevation")));
            }
        } catch (IOException | IllegalStateException | java.io.UncheckedIOException e) {
            log.error("Could not read FileProfiles table {}: {}", profilesFile, e.getMessage(), e);
            profiles.clear();
        }
        return profiles;
    }

    /** 非法时区名记录警告并按UTC处理 */
    private static ZoneId validateZone(String zone) {
        if (zone == null) {
            return null;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Invalid TimeZone '{}' in FileProfiles, defaulting to UTC.", zone);
            return null;
        }
    }

    // ==================== 工具方法 ====================

    private static void requireColumns(CSVParser parser, String... alternatives) {
        Set<String> headers = new HashSet<>();
        for (String h : parser.getHeaderNames()) {
            headers.add(h.toLowerCase(Locale.ROOT));
        }
        for (String alternative : alternatives) {
            boolean present = false;
            for (String name : alternative.split("\\|")) {
                present |= headers.contains(name.toLowerCase(Locale.ROOT));
            }
            if (!present) {
                throw new IllegalStateException("missing required column '" + alternative + "'");
            }
        }
    }

    private static boolean isBlankRecord(CSVRecord record) {
        for (String v : record) {
            if (v != null && !v.isBlank()) return false;
        }
        return true;
    }

    /** 取第一个存在且非空的列值 */
    private static String value(CSVRecord record, String... names) {
        for (String name : names) {
            if (record.isMapped(name) && record.isSet(name)) {
                String v = record.get(name);
                if (v != null && !v.isBlank()) {
                    return v.trim();
                }
            }
        }
        return null;
    }

    private static String require(CSVRecord record, String... names) {
        String v = value(record, names);
        if (v == null) {
            throw new IllegalArgumentException("Missing required field '" + names[0] + "'");
        }
        return v;
    }

    private static Double optionalDouble(CSVRecord record, String name) {
        String v = value(record, name);
        return v == null ? null : parseDouble(name, v);
    }

    private static double parseDouble(String name, String raw) {
        try {
            double d = Double.parseDouble(raw);
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new NumberFormatException(raw);
            }
            return d;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + name + "' is not numeric: '" + raw + "'");
        }
    }

    static boolean parseBool(String raw) {
        return raw != null && TRUE_VALUES.contains(raw.trim().toLowerCase(Locale.ROOT));
    }
}
