package com.pipeline.amts.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;

/**
 * 切片缓存条目：记录上次处理的定义摘要和数据时间点
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheEntry implements Serializable {
    /** 最近一次成功处理时的定义摘要；从未成功时为null */
    private Fingerprint fingerprint;
    /** 已写入历史的最大原始数据时间戳 */
    private Instant lastProcessedEpoch;
    /** 最近一次成功处理时匹配文件的最大修改时间（毫秒） */
    private long inputModifiedMillis;
    private RunStatus lastRunStatus;
    private String lastError;
    private Instant updatedAt;

    public CacheEntry() {}

    public CacheEntry(Fingerprint fingerprint, Instant lastProcessedEpoch, long inputModifiedMillis,
                      RunStatus lastRunStatus, String lastError, Instant updatedAt) {
        this.fingerprint = fingerprint;
        this.lastProcessedEpoch = lastProcessedEpoch;
        this.inputModifiedMillis = inputModifiedMillis;
        this.lastRunStatus = lastRunStatus;
        this.lastError = lastError;
        this.updatedAt = updatedAt;
    }

    public CacheEntry copy() {
        return new CacheEntry(fingerprint, lastProcessedEpoch, inputModifiedMillis,
                lastRunStatus, lastError, updatedAt);
    }

    public Fingerprint getFingerprint() { return fingerprint; }
    public void setFingerprint(Fingerprint fingerprint) { this.fingerprint = fingerprint; }
    public Instant getLastProcessedEpoch() { return lastProcessedEpoch; }
    public void setLastProcessedEpoch(Instant lastProcessedEpoch) { this.lastProcessedEpoch = lastProcessedEpoch; }
    public long getInputModifiedMillis() { return inputModifiedMillis; }
    public void setInputModifiedMillis(long inputModifiedMillis) { this.inputModifiedMillis = inputModifiedMillis; }
    public RunStatus getLastRunStatus() { return lastRunStatus; }
    public void setLastRunStatus(RunStatus lastRunStatus) { this.lastRunStatus = lastRunStatus; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "CacheEntry{fp=" + fingerprint + ", epoch=" + lastProcessedEpoch
                + ", status=" + lastRunStatus + "}";
    }
}
