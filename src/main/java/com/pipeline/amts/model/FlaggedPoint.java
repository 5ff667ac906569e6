package com.pipeline.amts.model;

import java.time.Instant;

/**
 * 经过离群检测的数据点
 */
public class FlaggedPoint extends DataPoint {
    private final boolean outlier;

    public FlaggedPoint(Instant timestamp, double value, boolean outlier) {
        super(timestamp, value);
        this.outlier = outlier;
    }

    public boolean isOutlier() { return outlier; }

    @Override
    public String toString() {
        return super.toString() + (outlier ? "(outlier)" : "");
    }
}
