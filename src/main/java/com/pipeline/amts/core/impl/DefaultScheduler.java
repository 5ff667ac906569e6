package com.pipeline.amts.core.impl;

import com.pipeline.amts.core.ConfigStore;
import com.pipeline.amts.core.Scheduler;
import com.pipeline.amts.core.SliceCache;
import com.pipeline.amts.core.SliceProcessor;
import com.pipeline.amts.exception.ConfigSourceException;
import com.pipeline.amts.model.CacheDiff;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.Command;
import com.pipeline.amts.model.ConfigLoadResult;
import com.pipeline.amts.model.ProcessResult;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.RowError;
import com.pipeline.amts.model.RunStatus;
import com.pipeline.amts.model.SchedulerState;
import com.pipeline.amts.model.SliceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 调度器默认实现。
 *
 * 一个调度线程独占命令队列：空闲时在队列上等待，超时即视为一次轮询。
 * 每轮评估加载配置、与缓存比对，把需要处理的切片分发到固定大小的工作线程池，
 * 等全部工作项完成后回到空闲。同一切片同一时刻最多一个工作项在执行。
 *
 * 缓存提交规则：
 * - OK：写入新的定义摘要和数据时间点
 * - NO_INPUT：不修改缓存
 * - ERROR：保留之前的摘要和时间点，只记录失败状态，下一轮重试
 */
public class DefaultScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private final ConfigStore configStore;
    private final SliceCache sliceCache;
    private final SliceProcessor sliceProcessor;

    private final int parallelism;

    /** 轮询间隔（毫秒） */
    private final long pollIntervalMs;

    private final LinkedBlockingQueue<Command> commands = new LinkedBlockingQueue<>();

    /** 正在执行的切片，用于重复执行检测 */
    private final ConcurrentHashMap<String, ProcessingMode> inFlight = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile boolean stopRequested = false;
    private volatile ConfigLoadResult lastLoad = ConfigLoadResult.empty();

    private ExecutorService workerPool;
    private Thread schedulerThread;

    /** 执行统计 */
    private final AtomicInteger totalProcessed = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);
    private final AtomicInteger totalSkipped = new AtomicInteger(0);

    public DefaultScheduler(ConfigStore configStore, SliceCache sliceCache, SliceProcessor sliceProcessor,
                            int parallelism, long pollIntervalMs) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Worker parallelism must be at least 1, got: " + parallelism);
        }
        if (pollIntervalMs < 1) {
            throw new IllegalArgumentException("Poll interval must be positive, got: " + pollIntervalMs);
        }
        this.configStore = configStore;
        this.sliceCache = sliceCache;
        this.sliceProcessor = sliceProcessor;
        this.parallelism = parallelism;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * 启动前先加载一次配置：配置源不可读，或所有行都被拒绝时抛出异常，调度器直接进入终止状态。
     *
     * @throws ConfigSourceException 配置源整体不可用
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Scheduler is already running, ignoring duplicate start.");
            return;
        }

        ConfigLoadResult initial;
        try {
            initial = configStore.load();
            if (initial.getDefinitions().isEmpty() && !initial.getRowErrors().isEmpty()) {
                throw new ConfigSourceException("Configuration source has no valid rows ("
                        + initial.getRowErrors().size() + " rejected)");
            }
        } catch (ConfigSourceException e) {
            log.error("Scheduler not started: {}", e.getMessage());
            terminate();
            throw e;
        }
        lastLoad = initial;

        AtomicInteger threadIndex = new AtomicInteger(0);
        workerPool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "slice-worker-" + threadIndex.incrementAndGet());
            t.setUncaughtExceptionHandler((th, e) ->
                    log.error("Uncaught exception in worker thread {}: {}", th.getName(), e.getMessage(), e));
            return t;
        });

        schedulerThread = new Thread(this::schedulerLoop, "slice-scheduler");
        schedulerThread.setDaemon(false);
        schedulerThread.start();

        log.info("Scheduler started. Slices: {}, Parallelism: {}, Poll interval: {}ms",
                initial.getDefinitions().size(), parallelism, pollIntervalMs);
    }

    @Override
    public boolean submit(Command command) {
        if (state == SchedulerState.TERMINATED || terminated.getCount() == 0) {
            log.warn("Scheduler is terminated, command {} rejected.", command);
            return false;
        }
        if (command == Command.STOP) {
            // 立即生效：尚未开始的工作项在执行前检查此标记
            stopRequested = true;
        }
        commands.offer(command);
        log.info("Command {} accepted.", command);
        return true;
    }

    @Override
    public SchedulerState getState() {
        return state;
    }

    @Override
    public ConfigLoadResult lastLoad() {
        return lastLoad;
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void shutdown() {
        if (!started.get()) {
            terminate();
            return;
        }
        submit(Command.STOP);
        try {
            if (!awaitTermination(Duration.ofMillis(pollIntervalMs).plusSeconds(30))) {
                log.warn("Scheduler did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for scheduler thread to finish.");
        }
    }

    // ==================== 调度主循环 ====================

    private void schedulerLoop() {
        log.info("Slice scheduler loop started.");
        boolean first = true;
        try {
            while (!stopRequested) {
                Command command;
                try {
                    // 启动后若没有待处理命令，立即评估一次
                    command = first ? commands.poll() : commands.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                first = false;

                if (command == null) {
                    runCycle(CycleKind.CHANGED_ONLY);
                    continue;
                }

                switch (command) {
                    case STOP:
                        stopRequested = true;
                        break;
                    case RELOAD_SETTINGS:
                        runCycle(CycleKind.CHANGED_ONLY);
                        break;
                    case FULL_BUILD:
                        runCycle(CycleKind.FULL_BUILD);
                        break;
                    case RUN_ONCE:
                        runCycle(CycleKind.ALL_INCREMENTAL);
                        stopRequested = true;
                        break;
                    default:
                        log.warn("Unknown command {}", command);
                }
            }
        } catch (RuntimeException e) {
            log.error("Slice scheduler loop failed", e);
        } finally {
            terminate();
        }
    }

    private enum CycleKind {
        /** 只处理定义或输入发生变化的切片 */
        CHANGED_ONLY,
        /** 全部活跃切片增量处理 */
        ALL_INCREMENTAL,
        /** 清空缓存后全部活跃切片全量重算 */
        FULL_BUILD
    }

    /**
     * 单轮评估：加载配置 → 比对缓存 → 分发 → 等待完成
     */
    private void runCycle(CycleKind kind) {
        state = SchedulerState.EVALUATING;
        try {
            ConfigLoadResult load;
            try {
                load = configStore.load();
            } catch (ConfigSourceException e) {
                log.error("Configuration source unreadable, staying idle: {}", e.getMessage(), e);
                return;
            }
            for (RowError error : load.getRowErrors()) {
                log.warn("Configuration row excluded: {}", error);
            }
            if (load.getDefinitions().isEmpty() && !load.getRowErrors().isEmpty()) {
                log.error("Configuration source has no valid rows ({} rejected), nothing to process.",
                        load.getRowErrors().size());
            }
            lastLoad = load;

            List<SliceDefinition> targets = new ArrayList<>();
            ProcessingMode mode = ProcessingMode.INCREMENTAL;
            switch (kind) {
                case FULL_BUILD:
                    sliceCache.clear();
                    targets.addAll(load.getDefinitions());
                    mode = ProcessingMode.FULL;
                    break;
                case ALL_INCREMENTAL:
                    targets.addAll(load.getDefinitions());
                    break;
                default:
                    CacheDiff diff = sliceCache.diff(load.getDefinitions());
                    for (SliceDefinition definition : load.getDefinitions()) {
                        if (diff.getChanged().contains(definition.getSliceId())) {
                            targets.add(definition);
                        }
                    }
            }

            if (targets.isEmpty()) {
                log.debug("No slices need processing.");
                return;
            }

            state = SchedulerState.DISPATCHING;
            log.info("Dispatching {} slice(s) in {} mode.", targets.size(), mode);
            List<Future<?>> futures = new ArrayList<>();
            for (SliceDefinition definition : targets) {
                Future<?> future = dispatch(definition, mode);
                if (future != null) {
                    futures.add(future);
                }
            }

            state = SchedulerState.DRAINING;
            drain(futures);
        } catch (RuntimeException e) {
            log.error("Evaluation cycle failed: {}", e.getMessage(), e);
        } finally {
            if (state != SchedulerState.TERMINATED) {
                state = SchedulerState.IDLE;
            }
        }
    }

    /**
     * 提交一个工作项。同一切片已有工作项在执行时跳过。
     *
     * @return 工作项句柄；被跳过时为null
     */
    private Future<?> dispatch(SliceDefinition definition, ProcessingMode mode) {
        String sliceId = definition.getSliceId();

        // 重复执行检测
        if (inFlight.putIfAbsent(sliceId, mode) != null) {
            log.warn("Slice '{}' is already being processed, skipping.", sliceId);
            totalSkipped.incrementAndGet();
            return null;
        }

        try {
            return workerPool.submit(() -> {
                try {
                    if (stopRequested) {
                        log.info("Stop requested, discarding queued slice '{}'.", sliceId);
                        totalSkipped.incrementAndGet();
                        return;
                    }
                    runWorkItem(definition, mode);
                } catch (Exception e) {
                    totalFailed.incrementAndGet();
                    log.error("Work item for slice '{}' failed: {}", sliceId, e.getMessage(), e);
                } finally {
                    inFlight.remove(sliceId);
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(sliceId);
            throw e;
        }
    }

    private void runWorkItem(SliceDefinition definition, ProcessingMode mode) {
        String sliceId = definition.getSliceId();
        long startTime = System.currentTimeMillis();

        CacheEntry entry = sliceCache.get(sliceId).orElse(null);
        ProcessResult result = sliceProcessor.process(definition, entry, mode);

        switch (result.getStatus()) {
            case OK:
                sliceCache.commit(sliceId, sliceCache.fingerprintOf(definition), result.getNewEpoch(),
                        result.getInputModifiedMillis(), RunStatus.OK, null);
                totalProcessed.incrementAndGet();
                break;
            case NO_INPUT:
                log.debug("Slice '{}' has no input, cache left untouched.", sliceId);
                break;
            case ERROR:
            default:
                sliceCache.commit(sliceId,
                        entry != null ? entry.getFingerprint() : null,
                        entry != null ? entry.getLastProcessedEpoch() : null,
                        entry != null ? entry.getInputModifiedMillis() : 0L,
                        RunStatus.ERROR, result.getError());
                totalFailed.incrementAndGet();
                log.warn("Slice '{}' left stale after error: {}", sliceId, result.getError());
        }

        log.debug("Slice '{}' finished in {}ms: {}", sliceId, System.currentTimeMillis() - startTime, result);
    }

    /**
     * 等待本轮全部工作项结束。STOP 不中断正在执行的切片。
     */
    private void drain(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining work items.");
                return;
            } catch (ExecutionException e) {
                log.error("Work item terminated abnormally: {}", e.getCause().getMessage(), e.getCause());
            }
        }
    }

    private void terminate() {
        state = SchedulerState.DRAINING;
        int discarded = commands.size();
        commands.clear();
        if (discarded > 0) {
            log.info("Discarded {} pending command(s).", discarded);
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(60, TimeUnit.SECONDS)) {
                    log.warn("Worker pool did not finish within 60s, forcing shutdown.");
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            }
        }

        state = SchedulerState.TERMINATED;
        terminated.countDown();
        log.info("Scheduler terminated. Processed: {}, Failed: {}, Skipped: {}",
                totalProcessed.get(), totalFailed.get(), totalSkipped.get());
    }

    /** 获取执行统计 */
    public int getTotalProcessed() { return totalProcessed.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
    public int getTotalSkipped() { return totalSkipped.get(); }
    public int getActiveSliceCount() { return inFlight.size(); }
}
