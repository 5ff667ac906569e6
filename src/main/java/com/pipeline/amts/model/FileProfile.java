package com.pipeline.amts.model;

import java.io.Serializable;
import java.time.ZoneId;
import java.util.Objects;

/**
 * 原始文件画像：文件匹配规则、时区以及列名映射。
 * 对应配置源中的 FileProfiles 表，一行一个画像。
 */
public final class FileProfile implements Serializable {

    public static final String DEFAULT_TIME_COLUMN = "Event Time (UTC)";
    public static final String DEFAULT_POINT_COLUMN = "Point Name";
    public static final String DEFAULT_NORTHING_COLUMN = "Northing";
    public static final String DEFAULT_EASTING_COLUMN = "Easting";
    public static final String DEFAULT_ELEVATION_COLUMN = "Elevation";

    private final String name;
    private final String matchPattern;
    /** 为null时表示未配置（按UTC处理） */
    private final ZoneId timeZone;
    /** 为null时使用内置的几种常见格式 */
    private final String timeFormat;
    private final String timeColumn;
    private final String pointColumn;
    private final String northingColumn;
    private final String eastingColumn;
    private final String elevationColumn;

    public FileProfile(String name, String matchPattern, ZoneId timeZone, String timeFormat,
                       String timeColumn, String pointColumn,
                       String northingColumn, String eastingColumn, String elevationColumn) {
        this.name = Objects.requireNonNull(name, "name");
        this.matchPattern = Objects.requireNonNull(matchPattern, "matchPattern");
        this.timeZone = timeZone;
        this.timeFormat = timeFormat;
        this.timeColumn = orDefault(timeColumn, DEFAULT_TIME_COLUMN);
        this.pointColumn = orDefault(pointColumn, DEFAULT_POINT_COLUMN);
        this.northingColumn = orDefault(northingColumn, DEFAULT_NORTHING_COLUMN);
        this.eastingColumn = orDefault(eastingColumn, DEFAULT_EASTING_COLUMN);
        this.elevationColumn = orDefault(elevationColumn, DEFAULT_ELEVATION_COLUMN);
    }

    /** 仅指定匹配规则、其余取默认值的画像 */
    public static FileProfile withDefaults(String name, String matchPattern) {
        return new FileProfile(name, matchPattern, null, null, null, null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value.trim();
    }

    public String getName() { return name; }
    public String getMatchPattern() { return matchPattern; }
    public ZoneId getTimeZone() { return timeZone; }
    public String getTimeFormat() { return timeFormat; }
    public String getTimeColumn() { return timeColumn; }
    public String getPointColumn() { return pointColumn; }
    public String getNorthingColumn() { return northingColumn; }
    public String getEastingColumn() { return eastingColumn; }
    public String getElevationColumn() { return elevationColumn; }

    public String columnFor(SliceType.Measurement measurement) {
        switch (measurement) {
            case NORTHING:
                return northingColumn;
            case EASTING:
                return eastingColumn;
            default:
                return elevationColumn;
        }
    }

    @Override
    public String toString() {
        return "FileProfile{" + name + ", match='" + matchPattern + "', tz=" + timeZone + "}";
    }
}
