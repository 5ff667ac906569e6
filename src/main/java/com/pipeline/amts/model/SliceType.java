package com.pipeline.amts.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 测点类型。决定原始文件中必须存在的测量列以及输出哪些位移量。
 */
public enum SliceType {
    /** 有棱镜测点：北、东、高三个分量 */
    REFLECTIVE(EnumSet.of(Measurement.NORTHING, Measurement.EASTING, Measurement.ELEVATION)),
    /** 免棱镜测点：仅高程 */
    REFLECTLESS(EnumSet.of(Measurement.ELEVATION));

    private final Set<Measurement> measurements;

    SliceType(Set<Measurement> measurements) {
        this.measurements = measurements;
    }

    public Set<Measurement> getMeasurements() {
        return EnumSet.copyOf(measurements);
    }

    public boolean measures(Measurement measurement) {
        return measurements.contains(measurement);
    }

    /**
     * 解析配置表中的类型字符串（忽略大小写和首尾空白）
     *
     * @throws IllegalArgumentException 未知类型
     */
    public static SliceType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Type is required");
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "reflective":
                return REFLECTIVE;
            case "reflectless":
                return REFLECTLESS;
            default:
                throw new IllegalArgumentException("Unknown Type '" + raw.trim()
                        + "', expected reflective or reflectless");
        }
    }

    /** 测量分量 */
    public enum Measurement {
        NORTHING,
        EASTING,
        ELEVATION
    }
}
