package com.pipeline.amts.model;

import java.time.Instant;

/**
 * 单个切片一次处理的结果
 */
public final class ProcessResult {
    private final String sliceId;
    private final RunStatus status;
    private final int recordsAppended;
    private final int rejectedCount;
    private final int parseWarnings;
    /** 处理后的数据时间点；没有推进时等于处理前的值 */
    private final Instant newEpoch;
    private final long inputModifiedMillis;
    private final ProcessingMode mode;
    private final String error;

    private ProcessResult(String sliceId, RunStatus status, int recordsAppended, int rejectedCount,
                          int parseWarnings, Instant newEpoch, long inputModifiedMillis,
                          ProcessingMode mode, String error) {
        this.sliceId = sliceId;
        this.status = status;
        this.recordsAppended = recordsAppended;
        this.rejectedCount = rejectedCount;
        this.parseWarnings = parseWarnings;
        this.newEpoch = newEpoch;
        this.inputModifiedMillis = inputModifiedMillis;
        this.mode = mode;
        this.error = error;
    }

    public static ProcessResult ok(String sliceId, ProcessingMode mode, int recordsAppended, int rejectedCount,
                                   int parseWarnings, Instant newEpoch, long inputModifiedMillis) {
        return new ProcessResult(sliceId, RunStatus.OK, recordsAppended, rejectedCount,
                parseWarnings, newEpoch, inputModifiedMillis, mode, null);
    }

    public static ProcessResult noInput(String sliceId, ProcessingMode mode) {
        return new ProcessResult(sliceId, RunStatus.NO_INPUT, 0, 0, 0, null, 0L, mode, null);
    }

    public static ProcessResult error(String sliceId, ProcessingMode mode, String error) {
        return new ProcessResult(sliceId, RunStatus.ERROR, 0, 0, 0, null, 0L, mode, error);
    }

    public String getSliceId() { return sliceId; }
    public RunStatus getStatus() { return status; }
    public int getRecordsAppended() { return recordsAppended; }
    public int getRejectedCount() { return rejectedCount; }
    public int getParseWarnings() { return parseWarnings; }
    public Instant getNewEpoch() { return newEpoch; }
    public long getInputModifiedMillis() { return inputModifiedMillis; }
    public ProcessingMode getMode() { return mode; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return "ProcessResult{" + sliceId + ", " + status + ", mode=" + mode
                + ", appended=" + recordsAppended + ", rejected=" + rejectedCount
                + ", parseWarnings=" + parseWarnings + ", epoch=" + newEpoch
                + (error != null ? ", error='" + error + "'" : "") + "}";
    }
}
