package com.pipeline.amts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // ---- 配置源 ----
    private String settingsDir = "settings";
    private String pointsFile = "Settings.csv";
    private String profilesFile = "FileProfiles.csv";
    /** 为空时放在配置目录下的 .amts_cache.json */
    private String cacheFile = "";

    // ---- 输出 ----
    private String outputRoot = "data/output";

    // ---- 调度 ----
    private long pollIntervalMs = 60_000L;
    private int workerParallelism = Runtime.getRuntime().availableProcessors();
    private boolean watchEnabled = true;
    private boolean watchRawInputs = true;
    private long watchDebounceMs = 2_000L;

    // ---- 离群检测 ----
    private double filterDefaultThreshold = 3.5;
    private int filterWindowSize = 50;

    // ---- 下游 ----
    private String sqlitePath = "data/datalogger.db";
    /** 为空时不启用Kafka推送 */
    private String kafkaBootstrapServers = "";
    private String kafkaTopic = "amts-deltas";

    // ---- 日志 ----
    private String logFile = "logs/amts.log";

    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        Path path = Paths.get(configPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Config file {} not found, using defaults.", configPath);
            return new AppConfig();
        }
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
            return fromProperties(props);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return new AppConfig();
        }
    }

    static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.settingsDir = props.getProperty("settings.dir", config.settingsDir);
        config.pointsFile = props.getProperty("settings.points.file", config.pointsFile);
        config.profilesFile = props.getProperty("settings.profiles.file", config.profilesFile);
        config.cacheFile = props.getProperty("cache.file", config.cacheFile).trim();
        config.outputRoot = props.getProperty("output.root", config.outputRoot);
        config.pollIntervalMs = Long.parseLong(
                props.getProperty("scheduler.poll.interval.ms", String.valueOf(config.pollIntervalMs)).trim());
        config.workerParallelism = Integer.parseInt(
                props.getProperty("worker.parallelism", String.valueOf(config.workerParallelism)).trim());
        config.watchEnabled = Boolean.parseBoolean(
                props.getProperty("watch.enabled", String.valueOf(config.watchEnabled)).trim());
        config.watchRawInputs = Boolean.parseBoolean(
                props.getProperty("watch.raw.inputs", String.valueOf(config.watchRawInputs)).trim());
        config.watchDebounceMs = Long.parseLong(
                props.getProperty("watch.debounce.ms", String.valueOf(config.watchDebounceMs)).trim());
        config.filterDefaultThreshold = Double.parseDouble(
                props.getProperty("filter.default.threshold", String.valueOf(config.filterDefaultThreshold)).trim());
        config.filterWindowSize = Integer.parseInt(
                props.getProperty("filter.window.size", String.valueOf(config.filterWindowSize)).trim());
        config.sqlitePath = props.getProperty("sqlite.path", config.sqlitePath).trim();
        config.kafkaBootstrapServers = props.getProperty("kafka.bootstrap.servers", config.kafkaBootstrapServers).trim();
        config.kafkaTopic = props.getProperty("kafka.topic", config.kafkaTopic).trim();
        config.logFile = props.getProperty("log.file", config.logFile);
        return config;
    }

    /** 命令行 --settings 覆盖配置目录 */
    public AppConfig withSettingsDir(String dir) {
        this.settingsDir = dir;
        return this;
    }

    public Path getPointsPath() {
        return Paths.get(settingsDir, pointsFile);
    }

    public Path getProfilesPath() {
        return Paths.get(settingsDir, profilesFile);
    }

    /** 缓存文件默认与配置表放在一起 */
    public Path getCachePath() {
        return cacheFile.isEmpty() ? Paths.get(settingsDir, ".amts_cache.json") : Paths.get(cacheFile);
    }

    public Path getReportsRoot() {
        return Paths.get(outputRoot, "reports");
    }

    // ---- Getters ----
    public String getSettingsDir() { return settingsDir; }
    public String getOutputRoot() { return outputRoot; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public int getWorkerParallelism() { return workerParallelism; }
    public boolean isWatchEnabled() { return watchEnabled; }
    public boolean isWatchRawInputs() { return watchRawInputs; }
    public long getWatchDebounceMs() { return watchDebounceMs; }
    public double getFilterDefaultThreshold() { return filterDefaultThreshold; }
    public int getFilterWindowSize() { return filterWindowSize; }
    public String getSqlitePath() { return sqlitePath; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaTopic() { return kafkaTopic; }
    public String getLogFile() { return logFile; }

    @Override
    public String toString() {
        return "AppConfig{settings='" + settingsDir + "'"
                + ", output='" + outputRoot + "'"
                + ", poll=" + pollIntervalMs + "ms"
                + ", parallelism=" + workerParallelism
                + ", watch=" + watchEnabled + "/" + watchRawInputs
                + ", filter=" + filterDefaultThreshold + "@" + filterWindowSize
                + ", kafka='" + kafkaBootstrapServers + "'}";
    }
}
