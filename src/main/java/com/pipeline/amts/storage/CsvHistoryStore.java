package com.pipeline.amts.storage;

import com.pipeline.amts.core.HistoryStore;
import com.pipeline.amts.exception.HistoryWriteException;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.SliceDefinition;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 基于CSV文件的切片历史存储。
 *
 * 核心设计：
 * - 一个切片一个目录：{导出根目录}/{site}/{切片存储名}/deltas.csv（见 SliceDefinition#storageName），剔除记录在同目录 rejected.csv
 * - 追加写入，失败时截断回写入前的长度
 * - 全量重建先写临时文件，再原子替换
 * - 进程内按文件加读写锁，读取方总是看到完整的行
 */
public class CsvHistoryStore implements HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(CsvHistoryStore.class);

    public static final String DELTAS_FILE = "deltas.csv";
    public static final String REJECTED_FILE = "rejected.csv";

    static final String[] HEADER = {
            "TIMESTAMP", "SENSOR_ID", "POINT_NAME", "DELTA_N_MM", "DELTA_E_MM", "DELTA_H_MM", "OUTLIER"
    };

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    /** 未配置 ExportFolder 的切片使用的根目录 */
    private final Path outputRoot;

    private final ConcurrentHashMap<Path, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public CsvHistoryStore(Path outputRoot) {
        this.outputRoot = outputRoot;
        log.info("CsvHistoryStore initialized. Default root: {}", outputRoot);
    }

    /** 切片历史所在目录 */
    public Path sliceDirectory(SliceDefinition definition) {
        Path root = definition.getExportFolder() != null ? definition.getExportFolder() : outputRoot;
        return root.resolve(SliceDefinition.storageName(definition.getSite())).resolve(definition.getStorageName());
    }

    public Path deltasFile(SliceDefinition definition) {
        return sliceDirectory(definition).resolve(DELTAS_FILE);
    }

    public Path rejectedFile(SliceDefinition definition) {
        return sliceDirectory(definition).resolve(REJECTED_FILE);
    }

    // ==================== 写入 ====================

    @Override
    public void append(SliceDefinition definition, List<DeltaRecord> accepted, List<DeltaRecord> rejected) {
        String sliceId = definition.getSliceId();
        Path deltas = deltasFile(definition);
        Path rejects = rejectedFile(definition);

        ReadWriteLock lock = lockFor(deltas);
        lock.writeLock().lock();
        try {
            checkMonotonic(sliceId, lastTimestampOf(deltas), accepted);
            checkMonotonic(sliceId, lastTimestampOf(rejects), rejected);

            Files.createDirectories(deltas.getParent());
            long deltasSize = sizeOf(deltas);
            long rejectsSize = sizeOf(rejects);
            try {
                appendRecords(deltas, accepted);
                appendRecords(rejects, rejected);
            } catch (IOException e) {
                rollback(deltas, deltasSize);
                rollback(rejects, rejectsSize);
                throw new HistoryWriteException(sliceId, "Append to history failed: " + e.getMessage(), e);
            }
            log.debug("Slice '{}': appended {} record(s), {} rejected.", sliceId, accepted.size(), rejected.size());
        } catch (IOException e) {
            throw new HistoryWriteException(sliceId, "Cannot prepare history directory: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void replace(SliceDefinition definition, List<DeltaRecord> accepted, List<DeltaRecord> rejected) {
        String sliceId = definition.getSliceId();
        Path deltas = deltasFile(definition);
        Path rejects = rejectedFile(definition);

        checkMonotonic(sliceId, null, accepted);
        checkMonotonic(sliceId, null, rejected);

        ReadWriteLock lock = lockFor(deltas);
        lock.writeLock().lock();
        Path deltasTmp = null;
        Path rejectsTmp = null;
        try {
            Files.createDirectories(deltas.getParent());
            deltasTmp = writeTemp(deltas, accepted);
            rejectsTmp = writeTemp(rejects, rejected);
            Files.move(deltasTmp, deltas, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            Files.move(rejectsTmp, rejects, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.info("Slice '{}': history rebuilt with {} record(s), {} rejected.",
                    sliceId, accepted.size(), rejected.size());
        } catch (IOException e) {
            deleteQuietly(deltasTmp);
            deleteQuietly(rejectsTmp);
            throw new HistoryWriteException(sliceId, "History rebuild failed: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== 读取 ====================

    @Override
    public Optional<Instant> lastTimestamp(SliceDefinition definition) {
        Path deltas = deltasFile(definition);
        ReadWriteLock lock = lockFor(deltas);
        lock.readLock().lock();
        try {
            Instant accepted = lastTimestampOf(deltas);
            Instant rejected = lastTimestampOf(rejectedFile(definition));
            if (accepted == null || (rejected != null && rejected.isAfter(accepted))) {
                return Optional.ofNullable(rejected);
            }
            return Optional.of(accepted);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DeltaRecord> read(SliceDefinition definition, Instant from, Instant to) {
        return readWindow(definition, deltasFile(definition), from, to);
    }

    @Override
    public List<DeltaRecord> readRejected(SliceDefinition definition, Instant from, Instant to) {
        return readWindow(definition, rejectedFile(definition), from, to);
    }

    private List<DeltaRecord> readWindow(SliceDefinition definition, Path file, Instant from, Instant to) {
        ReadWriteLock lock = lockFor(deltasFile(definition));
        lock.readLock().lock();
        try {
            List<DeltaRecord> result = new ArrayList<>();
            for (DeltaRecord r : readAll(file)) {
                Instant ts = r.getTimestamp();
                if ((from == null || !ts.isBefore(from)) && (to == null || !ts.isAfter(to))) {
                    result.add(r);
                }
            }
            return result;
        } catch (IOException e) {
            throw new HistoryWriteException(definition.getSliceId(),
                    "Cannot read history " + file + ": " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== 内部工具方法 ====================

    private void checkMonotonic(String sliceId, Instant last, List<DeltaRecord> records) {
        Instant previous = last;
        for (DeltaRecord r : records) {
            if (previous != null && !r.getTimestamp().isAfter(previous)) {
                throw new HistoryWriteException(sliceId, "Timestamp " + r.getTimestamp()
                        + " is not after " + previous + ", history must be strictly increasing");
            }
            previous = r.getTimestamp();
        }
    }

    private void appendRecords(Path file, List<DeltaRecord> records) throws IOException {
        boolean newFile = sizeOf(file) == 0L;
        if (records.isEmpty() && !newFile) {
            return;
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
            if (newFile) {
                printer.printRecord((Object[]) HEADER);
            }
            for (DeltaRecord r : records) {
                printRecord(printer, r);
            }
        }
    }

    private Path writeTemp(Path target, List<DeltaRecord> records) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
            printer.printRecord((Object[]) HEADER);
            for (DeltaRecord r : records) {
                printRecord(printer, r);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw e;
        }
        return tmp;
    }

    private static void printRecord(CSVPrinter printer, DeltaRecord r) throws IOException {
        printer.printRecord(
                r.getTimestamp().toString(),
                r.getSensorId(),
                r.getPointName(),
                format(r.getDeltaNorthMm()),
                format(r.getDeltaEastMm()),
                format(r.getDeltaHeightMm()),
                r.isOutlier());
    }

    private static String format(Double value) {
        return value == null ? "" : Double.toString(value);
    }

    private List<DeltaRecord> readAll(Path file) throws IOException {
        List<DeltaRecord> records = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return records;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            for (CSVRecord row : parser) {
                DeltaRecord r = toRecord(row);
                if (r != null) {
                    records.add(r);
                } else {
                    log.warn("Skipping malformed history line {} in {}", row.getRecordNumber(), file);
                }
            }
        } catch (IllegalStateException | java.io.UncheckedIOException e) {
            throw new IOException("Malformed history file " + file + ": " + e.getMessage(), e);
        }
        return records;
    }

    private static DeltaRecord toRecord(CSVRecord row) {
        if (row.size() < HEADER.length) {
            return null;
        }
        try {
            return new DeltaRecord(
                    Instant.parse(row.get(0)),
                    row.get(1),
                    row.get(2),
                    parseNullable(row.get(3)),
                    parseNullable(row.get(4)),
                    Double.parseDouble(row.get(5)),
                    Boolean.parseBoolean(row.get(6)));
        } catch (DateTimeParseException | NumberFormatException e) {
            return null;
        }
    }

    private static Double parseNullable(String raw) {
        return (raw == null || raw.isEmpty()) ? null : Double.valueOf(raw);
    }

    private Instant lastTimestampOf(Path file) {
        try {
            List<DeltaRecord> all = readAll(file);
            return all.isEmpty() ? null : all.get(all.size() - 1).getTimestamp();
        } catch (IOException e) {
            throw new HistoryWriteException(null, "Cannot read history " + file + ": " + e.getMessage(), e);
        }
    }

    private static long sizeOf(Path file) throws IOException {
        return Files.exists(file) ? Files.size(file) : 0L;
    }

    private static void rollback(Path file, long size) {
        try {
            if (size == 0L) {
                Files.deleteIfExists(file);
                return;
            }
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
                channel.truncate(size);
            }
        } catch (IOException e) {
            log.error("Failed to roll back {} to {} bytes: {}", file, size, e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }

    private ReadWriteLock lockFor(Path deltas) {
        return locks.computeIfAbsent(deltas.toAbsolutePath().normalize(), k -> new ReentrantReadWriteLock());
    }
}
