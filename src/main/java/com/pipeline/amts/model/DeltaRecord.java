package com.pipeline.amts.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;

/**
 * 位移输出记录，单位毫米。免棱镜测点的北、东分量为null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeltaRecord implements Serializable {
    private Instant timestamp;
    private String sensorId;
    private String pointName;
    private Double deltaNorthMm;
    private Double deltaEastMm;
    private double deltaHeightMm;
    /** true 表示被离群检测剔除，只出现在 rejected 记录中 */
    private boolean outlier;

    public DeltaRecord() {}

    public DeltaRecord(Instant timestamp, String sensorId, String pointName,
                       Double deltaNorthMm, Double deltaEastMm, double deltaHeightMm, boolean outlier) {
        this.timestamp = timestamp;
        this.sensorId = sensorId;
        this.pointName = pointName;
        this.deltaNorthMm = deltaNorthMm;
        this.deltaEastMm = deltaEastMm;
        this.deltaHeightMm = deltaHeightMm;
        this.outlier = outlier;
    }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public String getSensorId() { return sensorId; }
    public void setSensorId(String sensorId) { this.sensorId = sensorId; }
    public String getPointName() { return pointName; }
    public void setPointName(String pointName) { this.pointName = pointName; }
    public Double getDeltaNorthMm() { return deltaNorthMm; }
    public void setDeltaNorthMm(Double deltaNorthMm) { this.deltaNorthMm = deltaNorthMm; }
    public Double getDeltaEastMm() { return deltaEastMm; }
    public void setDeltaEastMm(Double deltaEastMm) { this.deltaEastMm = deltaEastMm; }
    public double getDeltaHeightMm() { return deltaHeightMm; }
    public void setDeltaHeightMm(double deltaHeightMm) { this.deltaHeightMm = deltaHeightMm; }
    public boolean isOutlier() { return outlier; }
    public void setOutlier(boolean outlier) { this.outlier = outlier; }

    @Override
    public String toString() {
        return "DeltaRecord{" + timestamp + ", dN=" + deltaNorthMm + ", dE=" + deltaEastMm
                + ", dH=" + deltaHeightMm + (outlier ? ", outlier" : "") + "}";
    }
}
