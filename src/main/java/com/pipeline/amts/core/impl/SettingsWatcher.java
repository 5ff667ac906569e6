package com.pipeline.amts.core.impl;

import com.pipeline.amts.core.Scheduler;
import com.pipeline.amts.model.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 配置文件监听。
 * 监听配置表所在目录，配置表被创建、修改或删除时向调度器投递 RELOAD_SETTINGS。
 * 表格软件保存一次文件常触发多个事件，最后一个事件之后静默 debounce 毫秒才投递。
 */
public class SettingsWatcher implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SettingsWatcher.class);

    private final Scheduler scheduler;
    private final long debounceMs;

    /** 目录 -> 该目录下需要关注的文件名 */
    private final Map<Path, Set<String>> watched = new HashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private WatchService watchService;
    private Thread watcherThread;

    public SettingsWatcher(List<Path> sourceFiles, Scheduler scheduler, long debounceMs) {
        this.scheduler = scheduler;
        this.debounceMs = Math.max(0L, debounceMs);
        for (Path file : sourceFiles) {
            Path abs = file.toAbsolutePath().normalize();
            watched.computeIfAbsent(abs.getParent(), k -> new HashSet<>()).add(abs.getFileName().toString());
        }
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            log.warn("SettingsWatcher is already running.");
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        for (Path dir : watched.keySet()) {
            dir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        }

        watcherThread = new Thread(this, "settings-watcher");
        watcherThread.setDaemon(true);
        watcherThread.start();

        log.info("SettingsWatcher started. Watching: {}", watched);
    }

    @Override
    public void run() {
        long lastEventAt = 0L;
        boolean pending = false;
        try {
            while (running.get()) {
                long wait = pending ? Math.max(1L, debounceMs - (System.currentTimeMillis() - lastEventAt)) : 500L;
                WatchKey key = watchService.poll(wait, TimeUnit.MILLISECONDS);

                if (key != null) {
                    Path dir = (Path) key.watchable();
                    for (WatchEvent<?> event : key.pollEvents()) {
                        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                            pending = true;
                            lastEventAt = System.currentTimeMillis();
                            continue;
                        }
                        Path name = (Path) event.context();
                        if (isWatched(dir, name)) {
                            log.debug("Settings change detected: {} {}", event.kind().name(), dir.resolve(name));
                            pending = true;
                            lastEventAt = System.currentTimeMillis();
                        }
                    }
                    if (!key.reset()) {
                        log.warn("Settings directory {} is no longer accessible.", dir);
                    }
                }

                if (pending && System.currentTimeMillis() - lastEventAt >= debounceMs) {
                    pending = false;
                    log.info("Settings changed, requesting reload.");
                    if (!scheduler.submit(Command.RELOAD_SETTINGS)) {
                        running.set(false);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed.");
        } finally {
            log.info("SettingsWatcher stopped.");
        }
    }

    private boolean isWatched(Path dir, Path name) {
        Set<String> names = watched.get(dir.toAbsolutePath().normalize());
        return names != null && name != null && names.contains(name.toString());
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service: {}", e.getMessage());
        }
        if (watcherThread != null) {
            watcherThread.interrupt();
        }
    }
}
