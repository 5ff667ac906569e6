package com.pipeline.amts.core.impl;

import com.google.common.collect.EvictingQueue;
import com.pipeline.amts.core.HistoryStore;
import com.pipeline.amts.core.PipelineQueries;
import com.pipeline.amts.core.Scheduler;
import com.pipeline.amts.core.SliceCache;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.RowError;
import com.pipeline.amts.model.SliceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 只读查询默认实现。所有结果都是快照，读取不会触发任何处理。
 */
public class DefaultPipelineQueries implements PipelineQueries {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineQueries.class);

    private final Scheduler scheduler;
    private final SliceCache sliceCache;
    private final HistoryStore historyStore;
    private final Path logFile;

    public DefaultPipelineQueries(Scheduler scheduler, SliceCache sliceCache,
                                  HistoryStore historyStore, Path logFile) {
        this.scheduler = scheduler;
        this.sliceCache = sliceCache;
        this.historyStore = historyStore;
        this.logFile = logFile;
    }

    @Override
    public List<SliceDefinition> activeDefinitions() {
        return scheduler.lastLoad().getDefinitions();
    }

    @Override
    public List<RowError> rowErrors() {
        return scheduler.lastLoad().getRowErrors();
    }

    @Override
    public List<DeltaRecord> readDeltas(String sliceId, Instant from, Instant to) {
        return historyStore.read(require(sliceId), from, to);
    }

    @Override
    public List<DeltaRecord> readRejected(String sliceId, Instant from, Instant to) {
        return historyStore.readRejected(require(sliceId), from, to);
    }

    @Override
    public Map<String, CacheEntry> cacheEntries() {
        return sliceCache.snapshot();
    }

    @Override
    public Set<String> orphanedSlices() {
        Set<String> orphans = new TreeSet<>(sliceCache.snapshot().keySet());
        for (SliceDefinition definition : activeDefinitions()) {
            orphans.remove(definition.getSliceId());
        }
        return orphans;
    }

    @Override
    public List<String> tailLog(int lines) {
        if (lines <= 0 || logFile == null || !Files.isRegularFile(logFile)) {
            return new ArrayList<>();
        }
        EvictingQueue<String> tail = EvictingQueue.create(lines);
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                tail.add(line);
            }
        } catch (IOException e) {
            log.warn("Cannot read log file {}: {}", logFile, e.getMessage());
            throw new UncheckedIOException("Cannot read log file " + logFile, e);
        }
        return new ArrayList<>(tail);
    }

    private SliceDefinition require(String sliceId) {
        return scheduler.lastLoad().find(sliceId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown or inactive slice '" + sliceId + "'"));
    }
}
