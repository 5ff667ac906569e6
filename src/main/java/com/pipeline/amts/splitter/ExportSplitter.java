package com.pipeline.amts.splitter;

import com.pipeline.amts.model.FileProfile;
import com.pipeline.amts.storage.TimestampParser;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 导出文件拆分。
 *
 * 把监测软件导出的合并CSV按测点拆成单独的文件：
 * - 按文件画像的 Match 规则在导出目录中查找文件，archive 中已有同名文件的跳过
 * - 按画像的测点列分组，每组写到 {拆分目录}/{stem}_{point}/{stem}_{point}_{iso}.csv
 * - 追加一列 UTC 时间 TIMESTAMP
 * - 拆分成功后原文件移入 {导出目录}/archive/
 */
public class ExportSplitter implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExportSplitter.class);

    public static final String ARCHIVE_DIR = "archive";

    /** 文件名末尾的 _yyyyMMdd_HHmmss 部分 */
    private static final Pattern NAME_STAMP = Pattern.compile("^(.*)_(\\d{8})_(\\d{6})(?:_.*)?$");
    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter ISO_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HHmmss'Z'");
    private static final DateTimeFormatter OUTPUT_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private final Collection<FileProfile> profiles;
    private final Path exportRoot;
    private final Path separatedRoot;
    private final long sleepMillis;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ExportSplitter(Collection<FileProfile> profiles, Path exportRoot, Path separatedRoot, long sleepMillis) {
        this.profiles = List.copyOf(profiles);
        this.exportRoot = exportRoot;
        this.separatedRoot = separatedRoot;
        this.sleepMillis = sleepMillis;
    }

    /**
     * 循环拆分，直到 stop 被调用或线程被中断。
     */
    @Override
    public void run() {
        running.set(true);
        log.info("Export splitter watching {}, writing {}, archive {}",
                exportRoot, separatedRoot, exportRoot.resolve(ARCHIVE_DIR));
        while (running.get()) {
            try {
                runOnce();
            } catch (RuntimeException e) {
                log.error("Split cycle failed", e);
            }
            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Export splitter stopped.");
    }

    public void stop() {
        running.set(false);
    }

    /**
     * 执行一轮拆分。
     *
     * @return 成功拆分并归档的文件数
     */
    public int runOnce() {
        int split = 0;
        for (FileProfile profile : profiles) {
            for (Path file : matching(profile)) {
                if (Files.exists(exportRoot.resolve(ARCHIVE_DIR).resolve(file.getFileName()))) {
                    continue;
                }
                if (splitOne(file, profile)) {
                    archive(file);
                    split++;
                }
            }
        }
        return split;
    }

    private List<Path> matching(FileProfile profile) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(exportRoot)) {
            log.warn("Export root {} does not exist.", exportRoot);
            return files;
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + profile.getMatchPattern());
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(exportRoot)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p) && matcher.matches(p.getFileName())) {
                    files.add(p);
                }
            }
        } catch (IOException e) {
            log.error("Cannot list export root {}: {}", exportRoot, e.getMessage(), e);
        }
        files.sort(null);
        return files;
    }

    /**
     * 拆分单个文件。
     *
     * @return 是否全部写出成功
     */
    boolean splitOne(Path file, FileProfile profile) {
        String fileName = file.getFileName().toString();
        String base = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        String stem = stemOf(base);
        String iso = isoFromName(base);
        ZoneId zone = profile.getTimeZone() != null ? profile.getTimeZone() : ZoneOffset.UTC;
        DateTimeFormatter format = profile.getTimeFormat() == null
                ? null : DateTimeFormatter.ofPattern(profile.getTimeFormat(), Locale.ROOT);

        List<String> header;
        Map<String, List<List<String>>> groups = new LinkedHashMap<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            header = new ArrayList<>(parser.getHeaderNames());
            for (String column : List.of(profile.getPointColumn(), profile.getTimeColumn(),
                    profile.getElevationColumn())) {
                if (!header.contains(column)) {
                    log.error("{} missing mandatory column '{}'", fileName, column);
                    return false;
                }
            }

            for (CSVRecord record : parser) {
                String point = record.isSet(profile.getPointColumn()) ? record.get(profile.getPointColumn()) : "";
                if (point.isEmpty()) {
                    continue;
                }
                List<String> values = new ArrayList<>(header.size() + 1);
                for (String column : header) {
                    values.add(record.isSet(column) ? record.get(column) : "");
                }
                values.add(utcTime(record.get(profile.getTimeColumn()), zone, format));
                groups.computeIfAbsent(point, k -> new ArrayList<>()).add(values);
            }
        } catch (IOException | IllegalStateException | IllegalArgumentException | java.io.UncheckedIOException e) {
            log.error("Cannot read {}: {}", fileName, e.getMessage());
            return false;
        }

        header.add("TIMESTAMP");
        for (Map.Entry<String, List<List<String>>> group : groups.entrySet()) {
            String point = group.getKey().replaceAll("[\\\\/:*?\"<>|]", "_");
            Path folder = separatedRoot.resolve(stem + "_" + point);
            Path out = folder.resolve(stem + "_" + point + "_" + iso + ".csv");
            try {
                Files.createDirectories(folder);
                try (BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
                     CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                             .setHeader(header.toArray(new String[0]))
                             .setRecordSeparator('\n')
                             .build())) {
                    printer.printRecords(group.getValue());
                }
                log.info("{} -> {} ({} rows)", fileName, out.getFileName(), group.getValue().size());
            } catch (IOException e) {
                log.error("{} cannot write {}: {}", fileName, out.getFileName(), e.getMessage());
                return false;
            }
        }
        return true;
    }

    private void archive(Path file) {
        Path target = exportRoot.resolve(ARCHIVE_DIR).resolve(file.getFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Could not move {} to archive: {}", file.getFileName(), e.getMessage());
        }
    }

    private static String utcTime(String raw, ZoneId zone, DateTimeFormatter format) {
        try {
            return OUTPUT_TIME_FORMAT.format(
                    TimestampParser.toInstant(raw, zone, format).atOffset(ZoneOffset.UTC));
        } catch (DateTimeException e) {
            return "";
        }
    }

    /** 去掉文件名末尾的 _日期_时间 部分 */
    static String stemOf(String baseName) {
        Matcher m = NAME_STAMP.matcher(baseName);
        return m.matches() ? m.group(1) : baseName;
    }

    /** 从文件名中的 _yyyyMMdd_HHmmss 得到 yyyy-MM-dd'T'HHmmss'Z'，无法识别时为 unknown */
    static String isoFromName(String baseName) {
        Matcher m = NAME_STAMP.matcher(baseName);
        if (!m.matches()) {
            return "unknown";
        }
        try {
            return LocalDateTime.parse(m.group(2) + "_" + m.group(3), NAME_FORMAT).format(ISO_NAME_FORMAT);
        } catch (DateTimeParseException e) {
            return "unknown";
        }
    }
}
