package com.pipeline.amts;

import com.pipeline.amts.core.OutputSink;
import com.pipeline.amts.core.PipelineQueries;
import com.pipeline.amts.core.Scheduler;
import com.pipeline.amts.core.impl.CsvConfigStore;
import com.pipeline.amts.core.impl.DefaultPipelineQueries;
import com.pipeline.amts.core.impl.DefaultScheduler;
import com.pipeline.amts.core.impl.DefaultSliceProcessor;
import com.pipeline.amts.core.impl.JsonSliceCache;
import com.pipeline.amts.core.impl.RawInputLocator;
import com.pipeline.amts.core.impl.SettingsWatcher;
import com.pipeline.amts.exception.ConfigSourceException;
import com.pipeline.amts.model.Command;
import com.pipeline.amts.model.FileProfile;
import com.pipeline.amts.sinks.KafkaDeltaPublisher;
import com.pipeline.amts.sinks.SqliteDataloggerSink;
import com.pipeline.amts.sinks.SummaryReportSink;
import com.pipeline.amts.splitter.ExportSplitter;
import com.pipeline.amts.storage.CsvHistoryStore;
import com.pipeline.amts.storage.RawCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：加载配置、打开缓存、组装处理器与下游、启动调度和文件监听。
 *
 * 用法：
 *   java -jar amts-pipeline.jar [配置文件路径] [--full] [--run-once] [--settings 目录]
 *   java -jar amts-pipeline.jar [配置文件路径] --split 导出目录 拆分目录 [--split-once] [--sleep 秒]
 *
 * 退出码：0 正常结束；1 启动时配置源不可读；2 参数错误
 */
public class AmtsApplication {

    private static final Logger log = LoggerFactory.getLogger(AmtsApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_UNREADABLE = 1;
    static final int EXIT_BAD_ARGUMENTS = 2;

    private final List<OutputSink> sinks = new ArrayList<>();
    private Scheduler scheduler;
    private SettingsWatcher settingsWatcher;
    private PipelineQueries queries;

    /**
     * 组装并启动。
     *
     * @throws ConfigSourceException 配置源不可读
     */
    public void start(AppConfig config, CommandLine cli) {
        log.info("=== AMTS Incremental Slice Pipeline ===");
        log.info("Starting with config: {}", config);

        // 1. 配置源
        CsvConfigStore configStore = new CsvConfigStore(
                config.getPointsPath(), config.getProfilesPath(), config.getFilterDefaultThreshold());

        // 2. 缓存（原始文件修改时间作为独立的变更触发源）
        RawInputLocator locator = new RawInputLocator();
        JsonSliceCache cache = new JsonSliceCache(config.getCachePath(), locator, config.isWatchRawInputs());

        // 3. 历史存储与下游
        CsvHistoryStore historyStore = new CsvHistoryStore(Paths.get(config.getOutputRoot()));
        sinks.add(new SummaryReportSink(config.getReportsRoot()));
        if (!config.getSqlitePath().isEmpty()) {
            sinks.add(new SqliteDataloggerSink(config.getSqlitePath()));
        }
        if (!config.getKafkaBootstrapServers().isEmpty()) {
            sinks.add(KafkaDeltaPublisher.create(config.getKafkaBootstrapServers(), config.getKafkaTopic()));
        }

        // 4. 处理器与调度器
        DefaultSliceProcessor processor = new DefaultSliceProcessor(
                locator, new RawCsvReader(), historyStore, sinks, config.getFilterWindowSize());
        scheduler = new DefaultScheduler(
                configStore, cache, processor, config.getWorkerParallelism(), config.getPollIntervalMs());
        queries = new DefaultPipelineQueries(scheduler, cache, historyStore, Paths.get(config.getLogFile()));

        // 启动前投递的命令先于首轮轮询执行；STOP 投递即生效，不能跟在 FULL_BUILD 后面
        if (cli.full) {
            scheduler.submit(Command.FULL_BUILD);
        }
        if (cli.runOnce) {
            scheduler.submit(Command.RUN_ONCE);
        }

        scheduler.start();

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        // 5. 配置文件监听（单次运行模式不需要）
        if (config.isWatchEnabled() && !cli.runOnce) {
            settingsWatcher = new SettingsWatcher(configStore.sourceFiles(), scheduler, config.getWatchDebounceMs());
            try {
                settingsWatcher.start();
            } catch (IOException e) {
                log.warn("Settings watcher unavailable, relying on polling: {}", e.getMessage());
                settingsWatcher = null;
            }
        }

        log.info("=== Pipeline started successfully ===");
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return scheduler == null || scheduler.awaitTermination(timeout);
    }

    public synchronized void shutdown() {
        if (settingsWatcher != null) {
            settingsWatcher.close();
            settingsWatcher = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        for (OutputSink sink : sinks) {
            try {
                sink.close();
            } catch (Exception e) {
                log.warn("Failed to close sink '{}': {}", sink.name(), e.getMessage());
            }
        }
        sinks.clear();
        log.info("=== Pipeline shut down ===");
    }

    public PipelineQueries getQueries() {
        return queries;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    // ==================== 拆分模式 ====================

    static int runSplitter(AppConfig config, CommandLine cli) {
        Map<String, FileProfile> profiles = new CsvConfigStore(
                config.getPointsPath(), config.getProfilesPath(), config.getFilterDefaultThreshold()).loadProfiles();
        if (profiles.isEmpty()) {
            log.error("No file profiles available in {}, nothing to split.", config.getProfilesPath());
            return EXIT_CONFIG_UNREADABLE;
        }

        ExportSplitter splitter = new ExportSplitter(profiles.values(),
                Paths.get(cli.exportRoot), Paths.get(cli.separatedRoot), cli.sleepSeconds * 1000L);
        if (cli.splitOnce) {
            int count = splitter.runOnce();
            log.info("Split {} file(s).", count);
        } else {
            splitter.run();
        }
        return EXIT_OK;
    }

    // ==================== 命令行 ====================

    /**
     * 命令行参数
     */
    static final class CommandLine {
        String configPath = "config/application.properties";
        String settingsDir;
        boolean full;
        boolean runOnce;
        boolean split;
        boolean splitOnce;
        String exportRoot;
        String separatedRoot;
        long sleepSeconds = 60;

        static CommandLine parse(String[] args) {
            CommandLine cli = new CommandLine();
            boolean configSeen = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--full":
                        cli.full = true;
                        break;
                    case "--run-once":
                        cli.runOnce = true;
                        break;
                    case "--settings":
                        cli.settingsDir = value(args, ++i, arg);
                        break;
                    case "--split":
                        cli.split = true;
                        cli.exportRoot = value(args, ++i, arg);
                        cli.separatedRoot = value(args, ++i, arg);
                        break;
                    case "--split-once":
                        cli.splitOnce = true;
                        break;
                    case "--sleep":
                        String raw = value(args, ++i, arg);
                        try {
                            cli.sleepSeconds = Long.parseLong(raw);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--sleep expects seconds, got '" + raw + "'");
                        }
                        if (cli.sleepSeconds < 1) {
                            throw new IllegalArgumentException("--sleep must be at least 1 second");
                        }
                        break;
                    default:
                        if (arg.startsWith("--") || configSeen) {
                            throw new IllegalArgumentException("Unexpected argument '" + arg + "'");
                        }
                        cli.configPath = arg;
                        configSeen = true;
                }
            }
            if ((cli.splitOnce || cli.sleepSeconds != 60) && !cli.split) {
                throw new IllegalArgumentException("--split-once and --sleep require --split");
            }
            if (cli.split && (cli.full || cli.runOnce)) {
                throw new IllegalArgumentException("--split cannot be combined with --full or --run-once");
            }
            return cli;
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException(flag + " requires a value");
            }
            return args[index];
        }
    }

    private static void printUsage() {
        System.err.println("Usage: amts-pipeline [config.properties] [--full] [--run-once] [--settings <dir>]");
        System.err.println("       amts-pipeline [config.properties] --split <exportRoot> <separatedRoot>"
                + " [--split-once] [--sleep <seconds>]");
    }

    static int run(String[] args) {
        CommandLine cli;
        try {
            cli = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            printUsage();
            return EXIT_BAD_ARGUMENTS;
        }

        AppConfig config = AppConfig.load(cli.configPath);
        if (cli.settingsDir != null) {
            config.withSettingsDir(cli.settingsDir);
        }

        if (cli.split) {
            return runSplitter(config, cli);
        }

        AmtsApplication app = new AmtsApplication();
        try {
            app.start(config, cli);
        } catch (ConfigSourceException e) {
            log.error("Configuration source unreadable, aborting: {}", e.getMessage());
            app.shutdown();
            return EXIT_CONFIG_UNREADABLE;
        }

        try {
            while (!app.awaitTermination(Duration.ofMinutes(1))) {
                log.debug("Pipeline still running.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        app.shutdown();
        return EXIT_OK;
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }
}
