package com.pipeline.amts.core.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipeline.amts.core.InputTracker;
import com.pipeline.amts.core.SliceCache;
import com.pipeline.amts.model.CacheDiff;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.Fingerprint;
import com.pipeline.amts.model.RunStatus;
import com.pipeline.amts.model.SliceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于JSON文件的切片缓存。
 *
 * 核心设计：
 * - 整个缓存是一份JSON文档，与配置表放在同一目录
 * - 每次提交都完整重写：先写临时文件，再原子替换原文件
 * - commit / clear 串行执行（单写者）；读取走内存副本
 * - 文件缺失或损坏时按空缓存处理，所有切片都会被判定为变化
 */
public class JsonSliceCache implements SliceCache {

    private static final Logger log = LoggerFactory.getLogger(JsonSliceCache.class);

    public static final String DEFAULT_FILE_NAME = ".amts_cache.json";

    private static final TypeReference<TreeMap<String, CacheEntry>> CACHE_TYPE = new TypeReference<>() {};

    private final Path cacheFile;
    private final ObjectMapper mapper;

    /** 原始文件修改时间探针；为null时只按定义摘要判断 */
    private final InputTracker inputTracker;
    private final boolean watchRawInputs;

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public JsonSliceCache(Path cacheFile) {
        this(cacheFile, null, false);
    }

    public JsonSliceCache(Path cacheFile, InputTracker inputTracker, boolean watchRawInputs) {
        this.cacheFile = cacheFile;
        this.inputTracker = inputTracker;
        this.watchRawInputs = watchRawInputs && inputTracker != null;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);

        load();
        log.info("SliceCache initialized. File: {}, Entries: {}, WatchRawInputs: {}",
                cacheFile, entries.size(), this.watchRawInputs);
    }

    @Override
    public Fingerprint fingerprintOf(SliceDefinition definition) {
        return Fingerprint.compute(definition);
    }

    @Override
    public Optional<CacheEntry> get(String sliceId) {
        CacheEntry entry = entries.get(sliceId);
        return entry == null ? Optional.empty() : Optional.of(entry.copy());
    }

    @Override
    public CacheDiff diff(Collection<SliceDefinition> definitions) {
        Set<String> changed = new LinkedHashSet<>();
        Set<String> unchanged = new LinkedHashSet<>();
        Set<String> current = new HashSet<>();

        for (SliceDefinition definition : definitions) {
            String sliceId = definition.getSliceId();
            current.add(sliceId);
            if (isChanged(definition, entries.get(sliceId))) {
                changed.add(sliceId);
            } else {
                unchanged.add(sliceId);
            }
        }

        Set<String> removed = new LinkedHashSet<>(new TreeMap<>(entries).keySet());
        removed.removeAll(current);

        CacheDiff diff = new CacheDiff(changed, unchanged, removed);
        if (!removed.isEmpty()) {
            log.info("Orphaned cache entries (no longer configured): {}", removed);
        }
        log.debug("Cache diff: {}", diff);
        return diff;
    }

    private boolean isChanged(SliceDefinition definition, CacheEntry entry) {
        if (entry == null || entry.getFingerprint() == null) {
            return true;
        }
        if (!entry.getFingerprint().equals(fingerprintOf(definition))) {
            return true;
        }
        // 上次失败的切片在下一轮检测时重试
        if (entry.getLastRunStatus() == RunStatus.ERROR) {
            return true;
        }
        if (watchRawInputs) {
            try {
                return inputTracker.latestModified(definition) > entry.getInputModifiedMillis();
            } catch (UncheckedIOException e) {
                log.warn("Cannot check raw inputs for slice '{}': {}", definition.getSliceId(), e.getMessage());
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized void commit(String sliceId, Fingerprint fingerprint, Instant epoch,
                                    long inputModifiedMillis, RunStatus status, String error) {
        CacheEntry entry = new CacheEntry(fingerprint, epoch, inputModifiedMillis, status, error, Instant.now());

        Map<String, CacheEntry> next = new TreeMap<>(entries);
        next.put(sliceId, entry);
        persist(next);
        entries.put(sliceId, entry);

        log.debug("Committed cache entry for slice '{}': {}", sliceId, entry);
    }

    @Override
    public synchronized void clear() {
        persist(new TreeMap<>());
        entries.clear();
        log.info("Slice cache cleared.");
    }

    @Override
    public Map<String, CacheEntry> snapshot() {
        Map<String, CacheEntry> copy = new TreeMap<>();
        entries.forEach((k, v) -> copy.put(k, v.copy()));
        return copy;
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    // ==================== 持久化 ====================

    private void load() {
        if (!Files.isRegularFile(cacheFile)) {
            log.info("No cache file at {}, starting with an empty cache.", cacheFile);
            return;
        }
        try {
            Map<String, CacheEntry> loaded = mapper.readValue(cacheFile.toFile(), CACHE_TYPE);
            if (loaded != null) {
                loaded.forEach((k, v) -> {
                    if (k != null && v != null) entries.put(k, v);
                });
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Cache file {} is unreadable ({}), starting with an empty cache.", cacheFile, e.getMessage());
            entries.clear();
        }
    }

    private void persist(Map<String, CacheEntry> content) {
        Path tmp = null;
        try {
            Path dir = cacheFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, cacheFile.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), content);
            Files.move(tmp, cacheFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new UncheckedIOException("Cannot write cache file " + cacheFile, e);
        }
    }
}
