package com.pipeline.amts.model;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * 一个切片本次读取到的原始数据
 */
public final class RawBatch {
    private final List<RawRow> rows;
    /** 匹配到的文件数 */
    private final int filesMatched;
    /** 无法解析的行数（时间戳或数值非法） */
    private final int parseWarnings;
    /** 匹配文件的最大修改时间（毫秒） */
    private final long maxModifiedMillis;

    public RawBatch(List<RawRow> rows, int filesMatched, int parseWarnings, long maxModifiedMillis) {
        this.rows = ImmutableList.copyOf(rows);
        this.filesMatched = filesMatched;
        this.parseWarnings = parseWarnings;
        this.maxModifiedMillis = maxModifiedMillis;
    }

    public List<RawRow> getRows() { return rows; }
    public int getFilesMatched() { return filesMatched; }
    public int getParseWarnings() { return parseWarnings; }
    public long getMaxModifiedMillis() { return maxModifiedMillis; }
}
