package com.pipeline.amts.model;

import java.io.Serializable;

/**
 * 配置行校验失败记录。该行被排除，其它行照常处理。
 */
public final class RowError implements Serializable {
    /** 配置表中的行号（表头之后从1开始） */
    private final long rowId;
    /** 能识别时给出切片标识，否则为null */
    private final String sliceId;
    private final String reason;

    public RowError(long rowId, String sliceId, String reason) {
        this.rowId = rowId;
        this.sliceId = sliceId;
        this.reason = reason;
    }

    public long getRowId() { return rowId; }
    public String getSliceId() { return sliceId; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return "row " + rowId + (sliceId != null ? " (" + sliceId + ")" : "") + ": " + reason;
    }
}
