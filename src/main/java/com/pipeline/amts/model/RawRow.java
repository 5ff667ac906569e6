package com.pipeline.amts.model;

import java.time.Instant;

/**
 * 从原始文件读出的一行测量数据。仅在单次处理内存在，不落盘。
 */
public class RawRow {
    private final Instant timestamp;
    private final String pointName;
    private final Double northing;
    private final Double easting;
    private final double elevation;
    private final String sourceFile;

    public RawRow(Instant timestamp, String pointName, Double northing, Double easting,
                  double elevation, String sourceFile) {
        this.timestamp = timestamp;
        this.pointName = pointName;
        this.northing = northing;
        this.easting = easting;
        this.elevation = elevation;
        this.sourceFile = sourceFile;
    }

    public Instant getTimestamp() { return timestamp; }
    public String getPointName() { return pointName; }
    public Double getNorthing() { return northing; }
    public Double getEasting() { return easting; }
    public double getElevation() { return elevation; }
    public String getSourceFile() { return sourceFile; }

    public Double reading(SliceType.Measurement measurement) {
        switch (measurement) {
            case NORTHING:
                return northing;
            case EASTING:
                return easting;
            default:
                return elevation;
        }
    }
}
