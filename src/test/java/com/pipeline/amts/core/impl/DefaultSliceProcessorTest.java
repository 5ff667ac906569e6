package com.pipeline.amts.core.impl;

import com.pipeline.amts.SliceFixtures;
import com.pipeline.amts.core.HistoryStore;
import com.pipeline.amts.core.OutputSink;
import com.pipeline.amts.exception.HistoryWriteException;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.Fingerprint;
import com.pipeline.amts.model.ProcessResult;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.RawRow;
import com.pipeline.amts.model.RunStatus;
import com.pipeline.amts.model.SliceDefinition;
import com.pipeline.amts.storage.CsvHistoryStore;
import com.pipeline.amts.storage.RawCsvReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSliceProcessorTest {

    private static final double TOLERANCE = 1e-6;

    @TempDir
    Path dir;

    private Path rawDir;
    private SliceDefinition definition;
    private CsvHistoryStore history;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        rawDir = dir.resolve("raw");
        definition = SliceFixtures.reflective(rawDir).build();
        history = new CsvHistoryStore(dir.resolve("out"));
        sink = new RecordingSink();
    }

    private DefaultSliceProcessor processor(HistoryStore store, OutputSink... sinks) {
        return processor(50, store, sinks);
    }

    private DefaultSliceProcessor processor(int window, HistoryStore store, OutputSink... sinks) {
        return new DefaultSliceProcessor(new RawInputLocator(), new RawCsvReader(), store, List.of(sinks), window);
    }

    /** 第 i 小时的一行：读数在基准值附近小幅波动，spike 为 true 时高程跳变 0.5m */
    private static String row(int i, boolean spike) {
        double n = 1000.0 + 0.001 * (i % 3);
        double e = 2000.0 + 0.001 * (i % 2);
        double h = spike ? 100.5 : 100.0 + 0.001 * (i % 3);
        return SliceFixtures.hour(i) + ",P01," + n + "," + e + "," + h;
    }

    private void writeRows(String file, int from, int to, int spikeAt) throws IOException {
        List<String> rows = new ArrayList<>();
        for (int i = from; i < to; i++) {
            rows.add(row(i, i == spikeAt));
        }
        SliceFixtures.writeRaw(rawDir, file, rows.toArray(new String[0]));
    }

    private static CacheEntry entryFrom(ProcessResult result) {
        return new CacheEntry(Fingerprint.of("abc"), result.getNewEpoch(), result.getInputModifiedMillis(),
                RunStatus.OK, null, Instant.now());
    }

    private static List<String> render(List<DeltaRecord> records) {
        return records.stream().map(DeltaRecord::toString).collect(Collectors.toList());
    }

    @Test
    void shouldPromoteToFullWithoutCachedEpochAndRejectSpike() throws IOException {
        writeRows("a.csv", 0, 10, 7);

        ProcessResult result = processor(history, sink).process(definition, null, ProcessingMode.INCREMENTAL);

        assertEquals(RunStatus.OK, result.getStatus());
        assertEquals(ProcessingMode.FULL, result.getMode());
        assertEquals(9, result.getRecordsAppended());
        assertEquals(1, result.getRejectedCount());
        assertEquals(SliceFixtures.hourInstant(9), result.getNewEpoch());

        List<DeltaRecord> rejected = history.readRejected(definition, null, null);
        assertEquals(1, rejected.size());
        assertEquals(SliceFixtures.hourInstant(7), rejected.get(0).getTimestamp());
        assertEquals(500.0, rejected.get(0).getDeltaHeightMm(), TOLERANCE);

        assertEquals(List.of(9), sink.sizes);
        assertEquals(List.of(ProcessingMode.FULL), sink.modes);
    }

    @Test
    void shouldBeIdempotentWithoutNewInput() throws IOException {
        writeRows("a.csv", 0, 10, 7);
        DefaultSliceProcessor processor = processor(4, history, sink);
        ProcessResult first = processor.process(definition, null, ProcessingMode.FULL);

        ProcessResult second = processor.process(definition, entryFrom(first), ProcessingMode.INCREMENTAL);

        assertEquals(RunStatus.OK, second.getStatus());
        assertEquals(0, second.getRecordsAppended());
        assertEquals(0, second.getRejectedCount());
        assertEquals(first.getNewEpoch(), second.getNewEpoch());
        assertEquals(9, history.read(definition, null, null).size());
        assertEquals(1, sink.sizes.size());
    }

    @Test
    void shouldAppendOnlyNewRowsIncrementally() throws IOException {
        writeRows("a.csv", 0, 5, -1);
        DefaultSliceProcessor processor = processor(4, history, sink);
        ProcessResult first = processor.process(definition, null, ProcessingMode.INCREMENTAL);
        writeRows("b.csv", 5, 10, 7);

        ProcessResult second = processor.process(definition, entryFrom(first), ProcessingMode.INCREMENTAL);

        assertEquals(ProcessingMode.INCREMENTAL, second.getMode());
        assertEquals(4, second.getRecordsAppended());
        assertEquals(1, second.getRejectedCount());
        assertEquals(SliceFixtures.hourInstant(9), second.getNewEpoch());

        List<DeltaRecord> all = history.read(definition, null, null);
        assertEquals(9, all.size());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i).getTimestamp().isAfter(all.get(i - 1).getTimestamp()));
        }
        assertEquals(List.of(5, 4), sink.sizes);
    }

    @Test
    void incrementalHistoryShouldMatchFullRebuild() throws IOException {
        writeRows("a.csv", 0, 4, -1);
        DefaultSliceProcessor incremental = processor(6, history);
        ProcessResult r1 = incremental.process(definition, null, ProcessingMode.INCREMENTAL);
        writeRows("b.csv", 4, 8, 6);
        ProcessResult r2 = incremental.process(definition, entryFrom(r1), ProcessingMode.INCREMENTAL);
        writeRows("c.csv", 8, 12, 11);
        incremental.process(definition, entryFrom(r2), ProcessingMode.INCREMENTAL);

        CsvHistoryStore rebuilt = new CsvHistoryStore(dir.resolve("rebuilt"));
        processor(6, rebuilt).process(definition, null, ProcessingMode.FULL);

        assertEquals(render(rebuilt.read(definition, null, null)), render(history.read(definition, null, null)));
        assertEquals(render(rebuilt.readRejected(definition, null, null)),
                render(history.readRejected(definition, null, null)));
    }

    @Test
    void shouldRejectSpikeInFirstRow() throws IOException {
        writeRows("a.csv", 0, 10, 0);

        ProcessResult result = processor(history, sink).process(definition, null, ProcessingMode.FULL);

        assertEquals(9, result.getRecordsAppended());
        assertEquals(1, result.getRejectedCount());
        List<DeltaRecord> rejected = history.readRejected(definition, null, null);
        assertEquals(1, rejected.size());
        assertEquals(SliceFixtures.hourInstant(0), rejected.get(0).getTimestamp());
    }

    @Test
    void shouldRebuildWhileHistoryIsShorterThanWindow() throws IOException {
        // 两行不足以判断离群，第 0 行先被接受
        writeRows("a.csv", 0, 2, 0);
        DefaultSliceProcessor processor = processor(6, history, sink);
        ProcessResult first = processor.process(definition, null, ProcessingMode.INCREMENTAL);
        assertEquals(0, first.getRejectedCount());
        writeRows("b.csv", 2, 7, -1);

        ProcessResult second = processor.process(definition, entryFrom(first), ProcessingMode.INCREMENTAL);

        assertEquals(ProcessingMode.FULL, second.getMode());
        assertEquals(6, second.getRecordsAppended());
        assertEquals(1, second.getRejectedCount());
        List<DeltaRecord> rejected = history.readRejected(definition, null, null);
        assertEquals(1, rejected.size());
        assertEquals(SliceFixtures.hourInstant(0), rejected.get(0).getTimestamp());
        assertEquals(List.of(2, 6), sink.sizes);
        assertEquals(List.of(ProcessingMode.FULL, ProcessingMode.FULL), sink.modes);

        CsvHistoryStore rebuilt = new CsvHistoryStore(dir.resolve("rebuilt"));
        processor(6, rebuilt).process(definition, null, ProcessingMode.FULL);
        assertEquals(render(rebuilt.read(definition, null, null)), render(history.read(definition, null, null)));
    }

    @Test
    void shouldAdvanceEpochWhenAllNewRowsAreRejected() throws IOException {
        writeRows("a.csv", 0, 7, -1);
        DefaultSliceProcessor processor = processor(4, history, sink);
        ProcessResult first = processor.process(definition, null, ProcessingMode.INCREMENTAL);
        writeRows("b.csv", 7, 8, 7);

        ProcessResult second = processor.process(definition, entryFrom(first), ProcessingMode.INCREMENTAL);

        assertEquals(0, second.getRecordsAppended());
        assertEquals(1, second.getRejectedCount());
        assertEquals(SliceFixtures.hourInstant(7), second.getNewEpoch());
        assertEquals(1, sink.sizes.size());
    }

    @Test
    void shouldKeepHistoryWhenSinkFails() throws Exception {
        writeRows("a.csv", 0, 5, -1);
        OutputSink failing = Mockito.mock(OutputSink.class);
        Mockito.doThrow(new IllegalStateException("downstream offline"))
                .when(failing).accept(Mockito.any(), Mockito.any(), Mockito.any());
        Mockito.when(failing.name()).thenReturn("failing");

        ProcessResult result = processor(history, failing, sink).process(definition, null, ProcessingMode.FULL);

        assertEquals(RunStatus.OK, result.getStatus());
        assertEquals(5, history.read(definition, null, null).size());
        assertEquals(List.of(5), sink.sizes);
    }

    @Test
    void shouldResumeFromHistoryWhenCachedEpochIsBehind() throws IOException {
        writeRows("a.csv", 0, 10, -1);
        DefaultSliceProcessor processor = processor(4, history);
        processor.process(definition, null, ProcessingMode.FULL);

        CacheEntry stale = new CacheEntry(Fingerprint.of("abc"), SliceFixtures.hourInstant(4), 0L,
                RunStatus.OK, null, Instant.now());
        ProcessResult result = processor.process(definition, stale, ProcessingMode.INCREMENTAL);

        assertEquals(RunStatus.OK, result.getStatus());
        assertEquals(0, result.getRecordsAppended());
        assertEquals(SliceFixtures.hourInstant(9), result.getNewEpoch());
        assertEquals(10, history.read(definition, null, null).size());
    }

    @Test
    void shouldRebuildCleanlyAfterCacheLoss() throws IOException {
        writeRows("a.csv", 0, 10, 7);
        DefaultSliceProcessor processor = processor(history);
        processor.process(definition, null, ProcessingMode.FULL);
        List<String> before = render(history.read(definition, null, null));

        ProcessResult result = processor.process(definition, null, ProcessingMode.INCREMENTAL);

        assertEquals(ProcessingMode.FULL, result.getMode());
        assertEquals(before, render(history.read(definition, null, null)));
    }

    @Test
    void shouldReportNoInputWhenNothingMatches() {
        ProcessResult result = processor(history, sink).process(definition, null, ProcessingMode.FULL);

        assertEquals(RunStatus.NO_INPUT, result.getStatus());
        assertTrue(sink.sizes.isEmpty());
    }

    @Test
    void shouldReportErrorWhenHistoryWriteFails() throws IOException {
        writeRows("a.csv", 0, 5, -1);
        HistoryStore broken = Mockito.mock(HistoryStore.class);
        Mockito.doThrow(new HistoryWriteException("S1:P01", "disk full"))
                .when(broken).replace(Mockito.any(), Mockito.anyList(), Mockito.anyList());

        ProcessResult result = processor(broken, sink).process(definition, null, ProcessingMode.FULL);

        assertEquals(RunStatus.ERROR, result.getStatus());
        assertEquals("disk full", result.getError());
        assertNull(result.getNewEpoch());
        assertTrue(sink.sizes.isEmpty());
    }

    @Test
    void shouldDropRowsBeforeStartAndDuplicateTimestamps() {
        Instant start = SliceFixtures.START;
        SliceDefinition late = SliceFixtures.reflective(rawDir).startTimestamp(start.plusSeconds(3600)).build();
        List<RawRow> rows = List.of(
                new RawRow(start.plusSeconds(7200), "P01", 1000.0, 2000.0, 100.0, "b.csv"),
                new RawRow(start, "P01", 1000.0, 2000.0, 100.0, "a.csv"),
                new RawRow(start.plusSeconds(3600), "P01", 1000.0, 2000.0, 100.1, "a.csv"),
                new RawRow(start.plusSeconds(3600), "P01", 1000.0, 2000.0, 100.2, "b.csv"));

        List<RawRow> series = DefaultSliceProcessor.effectiveSeries(late, rows);

        assertEquals(2, series.size());
        assertEquals(start.plusSeconds(3600), series.get(0).getTimestamp());
        assertEquals("a.csv", series.get(0).getSourceFile());
        assertEquals(start.plusSeconds(7200), series.get(1).getTimestamp());
    }

    @Test
    void shouldComputeMillimetreDeltas() {
        RawRow row = new RawRow(SliceFixtures.START, "P01", 1000.002, 1999.999, 100.0105, "a.csv");

        DeltaRecord reflective = DefaultSliceProcessor.toDelta(definition, row, false);
        assertEquals(2.0, reflective.getDeltaNorthMm(), TOLERANCE);
        assertEquals(-1.0, reflective.getDeltaEastMm(), TOLERANCE);
        assertEquals(10.5, reflective.getDeltaHeightMm(), TOLERANCE);
        assertEquals("101", reflective.getSensorId());

        SliceDefinition prismless = SliceFixtures.reflectless(rawDir).build();
        RawRow q = new RawRow(SliceFixtures.START, "Q01", null, null, 49.99, "a.csv");
        DeltaRecord reflectless = DefaultSliceProcessor.toDelta(prismless, q, true);
        assertNull(reflectless.getDeltaNorthMm());
        assertNull(reflectless.getDeltaEastMm());
        assertEquals(-10.0, reflectless.getDeltaHeightMm(), TOLERANCE);
        assertTrue(reflectless.isOutlier());
    }

    @Test
    void historyStoreShouldBeConsultedForIncrementalCutoff() throws IOException {
        writeRows("a.csv", 0, 3, -1);
        HistoryStore store = Mockito.mock(HistoryStore.class);
        Mockito.when(store.lastTimestamp(definition)).thenReturn(Optional.of(SliceFixtures.hourInstant(1)));
        CacheEntry entry = new CacheEntry(Fingerprint.of("abc"), SliceFixtures.hourInstant(0), 0L,
                RunStatus.OK, null, Instant.now());

        ProcessResult result = processor(2, store).process(definition, entry, ProcessingMode.INCREMENTAL);

        assertEquals(1, result.getRecordsAppended());
        Mockito.verify(store).append(Mockito.eq(definition),
                Mockito.argThat(list -> list.size() == 1
                        && list.get(0).getTimestamp().equals(SliceFixtures.hourInstant(2))),
                Mockito.eq(List.of()));
    }

    /** 记录每次调用的记录数与模式 */
    private static final class RecordingSink implements OutputSink {
        final List<Integer> sizes = new ArrayList<>();
        final List<ProcessingMode> modes = new ArrayList<>();

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void accept(SliceDefinition definition, List<DeltaRecord> records, ProcessingMode mode) {
            sizes.add(records.size());
            modes.add(mode);
        }
    }
}
