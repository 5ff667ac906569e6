package com.pipeline.amts.core.impl;

import com.pipeline.amts.SliceFixtures;
import com.pipeline.amts.core.ConfigStore;
import com.pipeline.amts.core.SliceCache;
import com.pipeline.amts.core.SliceProcessor;
import com.pipeline.amts.exception.ConfigSourceException;
import com.pipeline.amts.model.CacheDiff;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.Command;
import com.pipeline.amts.model.ConfigLoadResult;
import com.pipeline.amts.model.Fingerprint;
import com.pipeline.amts.model.ProcessResult;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.RowError;
import com.pipeline.amts.model.RunStatus;
import com.pipeline.amts.model.SchedulerState;
import com.pipeline.amts.model.SliceDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;

class DefaultSchedulerTest {

    private static final Fingerprint FP = Fingerprint.of("f00d");
    private static final Instant EPOCH = Instant.parse("2024-03-01T00:00:00Z");

    private final SliceDefinition sliceA = SliceFixtures.reflective(Path.of("raw")).build();
    private final SliceDefinition sliceB = SliceFixtures.reflectless(Path.of("raw")).build();

    private ConfigStore configStore;
    private SliceCache cache;
    private SliceProcessor processor;
    private DefaultScheduler scheduler;

    @BeforeEach
    void setUp() {
        configStore = Mockito.mock(ConfigStore.class);
        cache = Mockito.mock(SliceCache.class);
        processor = Mockito.mock(SliceProcessor.class);

        Mockito.when(configStore.load()).thenReturn(new ConfigLoadResult(List.of(sliceA, sliceB), List.of()));
        Mockito.when(cache.get(any())).thenReturn(Optional.empty());
        Mockito.when(cache.fingerprintOf(any())).thenReturn(FP);
        Mockito.when(cache.diff(anyList())).thenReturn(new CacheDiff(Set.of(), Set.of("S1:P01", "S1:Q01"), Set.of()));
        Mockito.when(processor.process(any(), any(), any())).thenAnswer(inv -> {
            SliceDefinition d = inv.getArgument(0);
            ProcessingMode mode = inv.getArgument(2);
            return ProcessResult.ok(d.getSliceId(), mode, 1, 0, 0, EPOCH, 42L);
        });

        scheduler = new DefaultScheduler(configStore, cache, processor, 2, 60_000L);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private void awaitTerminated() throws InterruptedException {
        assertTrue(scheduler.awaitTermination(Duration.ofSeconds(10)), "scheduler did not terminate");
        assertEquals(SchedulerState.TERMINATED, scheduler.getState());
    }

    @Test
    void runOnceShouldProcessAllSlicesIncrementallyAndTerminate() throws InterruptedException {
        scheduler.submit(Command.RUN_ONCE);
        scheduler.start();

        awaitTerminated();
        Mockito.verify(processor).process(eq(sliceA), isNull(), eq(ProcessingMode.INCREMENTAL));
        Mockito.verify(processor).process(eq(sliceB), isNull(), eq(ProcessingMode.INCREMENTAL));
        Mockito.verify(cache).commit("S1:P01", FP, EPOCH, 42L, RunStatus.OK, null);
        Mockito.verify(cache).commit("S1:Q01", FP, EPOCH, 42L, RunStatus.OK, null);
        assertEquals(2, scheduler.getTotalProcessed());
    }

    @Test
    void fullBuildShouldClearCacheBeforeProcessing() throws InterruptedException {
        scheduler.submit(Command.FULL_BUILD);
        scheduler.submit(Command.RUN_ONCE);
        scheduler.start();

        awaitTerminated();
        InOrder order = Mockito.inOrder(cache, processor);
        order.verify(cache).clear();
        order.verify(processor).process(eq(sliceA), any(), eq(ProcessingMode.FULL));
        Mockito.verify(processor).process(eq(sliceB), any(), eq(ProcessingMode.FULL));
    }

    @Test
    void shouldDispatchOnlyChangedSlices() {
        Mockito.when(cache.diff(anyList())).thenReturn(
                new CacheDiff(Set.of("S1:P01"), Set.of("S1:Q01"), Set.of()));

        scheduler.start();

        Mockito.verify(cache, Mockito.timeout(5_000)).commit(eq("S1:P01"), eq(FP), eq(EPOCH), eq(42L),
                eq(RunStatus.OK), isNull());
        scheduler.shutdown();
        Mockito.verify(processor, Mockito.never()).process(eq(sliceB), any(), any());
    }

    @Test
    void errorShouldKeepPreviousFingerprintAndEpoch() throws InterruptedException {
        Fingerprint previous = Fingerprint.of("0ld");
        CacheEntry entry = new CacheEntry(previous, EPOCH, 7L, RunStatus.OK, null, Instant.now());
        Mockito.when(cache.get("S1:P01")).thenReturn(Optional.of(entry));
        Mockito.doReturn(ProcessResult.error("S1:P01", ProcessingMode.INCREMENTAL, "boom"))
                .when(processor).process(eq(sliceA), any(), any());

        scheduler.submit(Command.RUN_ONCE);
        scheduler.start();

        awaitTerminated();
        Mockito.verify(cache).commit("S1:P01", previous, EPOCH, 7L, RunStatus.ERROR, "boom");
        assertEquals(1, scheduler.getTotalFailed());
    }

    @Test
    void noInputShouldLeaveCacheUntouched() throws InterruptedException {
        Mockito.doReturn(ProcessResult.noInput("S1:P01", ProcessingMode.INCREMENTAL))
                .when(processor).process(eq(sliceA), any(), any());

        scheduler.submit(Command.RUN_ONCE);
        scheduler.start();

        awaitTerminated();
        Mockito.verify(cache, Mockito.never()).commit(eq("S1:P01"), any(), any(), anyLong(), any(), any());
    }

    @Test
    void shouldRejectCommandsAfterStop() throws InterruptedException {
        scheduler.start();
        assertTrue(scheduler.submit(Command.STOP));

        awaitTerminated();
        assertFalse(scheduler.submit(Command.RELOAD_SETTINGS));
    }

    @Test
    void stopShouldFinishRunningSliceAndDiscardQueuedOnes() throws InterruptedException {
        SliceDefinition sliceC = SliceFixtures.reflective(Path.of("raw")).sliceId("S1:P02").pointName("P02").build();
        Mockito.when(configStore.load()).thenReturn(new ConfigLoadResult(List.of(sliceA, sliceB, sliceC), List.of()));
        Mockito.when(cache.diff(anyList())).thenReturn(
                new CacheDiff(Set.of("S1:P01", "S1:Q01", "S1:P02"), Set.of(), Set.of()));
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Mockito.doAnswer(inv -> {
            SliceDefinition d = inv.getArgument(0);
            running.countDown();
            release.await(10, TimeUnit.SECONDS);
            return ProcessResult.ok(d.getSliceId(), ProcessingMode.INCREMENTAL, 1, 0, 0, EPOCH, 42L);
        }).when(processor).process(any(), any(), any());
        scheduler = new DefaultScheduler(configStore, cache, processor, 1, 60_000L);

        scheduler.start();
        assertTrue(running.await(10, TimeUnit.SECONDS), "first slice never started");
        assertTrue(scheduler.submit(Command.STOP));
        release.countDown();

        awaitTerminated();
        Mockito.verify(processor, Mockito.times(1)).process(any(), any(), any());
        Mockito.verify(cache, Mockito.times(1)).commit(any(), any(), any(), anyLong(), any(), any());
        assertEquals(1, scheduler.getTotalProcessed());
        assertEquals(2, scheduler.getTotalSkipped());
    }

    @Test
    void shouldNeverRunSameSliceConcurrently() {
        Mockito.when(cache.diff(anyList())).thenReturn(
                new CacheDiff(Set.of("S1:P01", "S1:Q01"), Set.of(), Set.of()));
        ConcurrentHashMap<String, AtomicInteger> running = new ConcurrentHashMap<>();
        AtomicInteger maxConcurrent = new AtomicInteger();
        Mockito.doAnswer(inv -> {
            SliceDefinition d = inv.getArgument(0);
            AtomicInteger counter = running.computeIfAbsent(d.getSliceId(), k -> new AtomicInteger());
            maxConcurrent.accumulateAndGet(counter.incrementAndGet(), Math::max);
            Thread.sleep(20);
            counter.decrementAndGet();
            return ProcessResult.ok(d.getSliceId(), ProcessingMode.INCREMENTAL, 0, 0, 0, EPOCH, 0L);
        }).when(processor).process(any(), any(), any());

        scheduler.start();
        for (int i = 0; i < 5; i++) {
            scheduler.submit(Command.RELOAD_SETTINGS);
        }

        Mockito.verify(processor, Mockito.timeout(10_000).atLeast(12)).process(any(), any(), any());
        scheduler.shutdown();
        assertEquals(1, maxConcurrent.get());
        assertEquals(0, scheduler.getActiveSliceCount());
    }

    @Test
    void startShouldFailWhenConfigSourceUnreadable() {
        Mockito.when(configStore.load()).thenThrow(new ConfigSourceException("Settings.csv missing"));

        assertThrows(ConfigSourceException.class, scheduler::start);
        assertEquals(SchedulerState.TERMINATED, scheduler.getState());
        assertFalse(scheduler.submit(Command.RUN_ONCE));
    }

    @Test
    void startShouldFailWhenEveryRowIsRejected() {
        Mockito.when(configStore.load()).thenReturn(
                new ConfigLoadResult(List.of(), List.of(new RowError(1, null, "Missing required field 'Site'"))));

        assertThrows(ConfigSourceException.class, scheduler::start);
    }

    @Test
    void shouldStayAliveWhenConfigBreaksAtRuntime() {
        scheduler.start();
        Mockito.verify(cache, Mockito.timeout(5_000)).diff(anyList());
        Mockito.when(configStore.load()).thenThrow(new ConfigSourceException("locked by editor"));

        assertTrue(scheduler.submit(Command.RELOAD_SETTINGS));

        Mockito.verify(configStore, Mockito.timeout(5_000).times(3)).load();
        assertEquals(List.of(sliceA, sliceB), scheduler.lastLoad().getDefinitions());
        assertTrue(scheduler.submit(Command.RELOAD_SETTINGS));
    }

    @Test
    void shouldValidateConstructorArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultScheduler(configStore, cache, processor, 0, 1_000L));
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultScheduler(configStore, cache, processor, 1, 0L));
    }
}
