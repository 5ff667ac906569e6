package com.pipeline.amts.model;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * 切片定义：一个监测点的完整处理配置。
 * 每次重新加载配置源时整体重建，加载后不再修改。
 */
public final class SliceDefinition implements Serializable {

    private final String sliceId;
    private final String sensorId;
    private final String site;
    private final String pointName;
    private final SliceType type;
    private final Path importFolder;
    private final Path exportFolder;
    private final Double baselineNorth;
    private final Double baselineEast;
    private final double baselineHeight;
    private final double outlierThreshold;
    private final Instant startTimestamp;
    private final ZoneId timeZone;
    private final FileProfile profile;
    private final boolean active;
    private final boolean sqlExport;

    private SliceDefinition(Builder b) {
        this.sliceId = Objects.requireNonNull(b.sliceId, "sliceId");
        this.sensorId = Objects.requireNonNull(b.sensorId, "sensorId");
        this.site = Objects.requireNonNull(b.site, "site");
        this.pointName = Objects.requireNonNull(b.pointName, "pointName");
        this.type = Objects.requireNonNull(b.type, "type");
        this.importFolder = Objects.requireNonNull(b.importFolder, "importFolder");
        this.exportFolder = b.exportFolder;
        this.baselineNorth = b.baselineNorth;
        this.baselineEast = b.baselineEast;
        this.baselineHeight = b.baselineHeight;
        this.outlierThreshold = b.outlierThreshold;
        this.startTimestamp = Objects.requireNonNull(b.startTimestamp, "startTimestamp");
        this.timeZone = b.timeZone;
        this.profile = Objects.requireNonNull(b.profile, "profile");
        this.active = b.active;
        this.sqlExport = b.sqlExport;

        if (type == SliceType.REFLECTIVE && (baselineNorth == null || baselineEast == null)) {
            throw new IllegalArgumentException("Reflective slice '" + sliceId
                    + "' requires BaselineN and BaselineE");
        }
        if (!(outlierThreshold > 0)) {
            throw new IllegalArgumentException("OutlierMAD must be positive for slice '" + sliceId + "'");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .sliceId(sliceId).sensorId(sensorId).site(site).pointName(pointName)
                .type(type).importFolder(importFolder).exportFolder(exportFolder)
                .baselineNorth(baselineNorth).baselineEast(baselineEast)
                .baselineHeight(baselineHeight).outlierThreshold(outlierThreshold)
                .startTimestamp(startTimestamp).timeZone(timeZone).profile(profile)
                .active(active).sqlExport(sqlExport);
    }

    public String getSliceId() { return sliceId; }
    public String getSensorId() { return sensorId; }
    public String getSite() { return site; }
    public String getPointName() { return pointName; }
    public SliceType getType() { return type; }
    public Path getImportFolder() { return importFolder; }
    public Path getExportFolder() { return exportFolder; }
    public Double getBaselineNorth() { return baselineNorth; }
    public Double getBaselineEast() { return baselineEast; }
    public double getBaselineHeight() { return baselineHeight; }
    public double getOutlierThreshold() { return outlierThreshold; }
    public Instant getStartTimestamp() { return startTimestamp; }
    public ZoneId getTimeZone() { return timeZone; }
    public FileProfile getProfile() { return profile; }
    public boolean isActive() { return active; }
    public boolean isSqlExport() { return sqlExport; }

    public String getMatchPattern() {
        return profile.getMatchPattern();
    }

    /** 原始时间戳所在时区：切片配置优先，其次文件画像，最后UTC */
    public ZoneId effectiveZone() {
        if (timeZone != null) return timeZone;
        if (profile.getTimeZone() != null) return profile.getTimeZone();
        return ZoneOffset.UTC;
    }

    /** 切片在目录名、表名、报表文件名中使用的名称 */
    public String getStorageName() {
        return storageName(sliceId);
    }

    /**
     * 把任意标识编码为只含字母、数字和下划线的名称，不同标识得到不同名称。
     * 字母和数字原样保留，下划线写成两个下划线，其余字符写成下划线加4位十六进制码，
     * 例如 "S1:P01" 得到 "S1_003AP01"，"S1_P01" 得到 "S1__P01"。
     */
    public static String storageName(String id) {
        StringBuilder sb = new StringBuilder(id.length() + 8);
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            } else if (c == '_') {
                sb.append("__");
            } else {
                sb.append('_').append(String.format("%04X", (int) c));
            }
        }
        return sb.toString();
    }

    public Double baselineFor(SliceType.Measurement measurement) {
        switch (measurement) {
            case NORTHING:
                return baselineNorth;
            case EASTING:
                return baselineEast;
            default:
                return baselineHeight;
        }
    }

    @Override
    public String toString() {
        return "SliceDefinition{" + sliceId + ", sensor=" + sensorId + ", type=" + type
                + ", start=" + startTimestamp + ", profile=" + profile.getName() + "}";
    }

    public static final class Builder {
        private String sliceId;
        private String sensorId;
        private String site;
        private String pointName;
        private SliceType type;
        private Path importFolder;
        private Path exportFolder;
        private Double baselineNorth;
        private Double baselineEast;
        private double baselineHeight;
        private double outlierThreshold = 3.5;
        private Instant startTimestamp;
        private ZoneId timeZone;
        private FileProfile profile;
        private boolean active = true;
        private boolean sqlExport;

        private Builder() {}

        public Builder sliceId(String sliceId) { this.sliceId = sliceId; return this; }
        public Builder sensorId(String sensorId) { this.sensorId = sensorId; return this; }
        public Builder site(String site) { this.site = site; return this; }
        public Builder pointName(String pointName) { this.pointName = pointName; return this; }
        public Builder type(SliceType type) { this.type = type; return this; }
        public Builder importFolder(Path importFolder) { this.importFolder = importFolder; return this; }
        public Builder exportFolder(Path exportFolder) { this.exportFolder = exportFolder; return this; }
        public Builder baselineNorth(Double baselineNorth) { this.baselineNorth = baselineNorth; return this; }
        public Builder baselineEast(Double baselineEast) { this.baselineEast = baselineEast; return this; }
        public Builder baselineHeight(double baselineHeight) { this.baselineHeight = baselineHeight; return this; }
        public Builder outlierThreshold(double outlierThreshold) { this.outlierThreshold = outlierThreshold; return this; }
        public Builder startTimestamp(Instant startTimestamp) { this.startTimestamp = startTimestamp; return this; }
        public Builder timeZone(ZoneId timeZone) { this.timeZone = timeZone; return this; }
        public Builder profile(FileProfile profile) { this.profile = profile; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder sqlExport(boolean sqlExport) { this.sqlExport = sqlExport; return this; }

        public SliceDefinition build() {
            return new SliceDefinition(this);
        }
    }
}
