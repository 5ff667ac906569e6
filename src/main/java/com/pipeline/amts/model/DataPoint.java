package com.pipeline.amts.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 单个时序数据点：时间戳 + 数值
 */
public class DataPoint implements Serializable {
    private final Instant timestamp;
    private final double value;

    public DataPoint(Instant timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public Instant getTimestamp() { return timestamp; }
    public double getValue() { return value; }

    @Override
    public String toString() {
        return timestamp + "=" + value;
    }
}
