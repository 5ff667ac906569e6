package com.pipeline.amts.exception;

/**
 * 单个切片处理失败（读取、检测、计算或写入）。
 * 只影响当前切片，缓存摘要不推进，下个检测周期重试。
 */
public class SliceProcessingException extends RuntimeException {

    private final String sliceId;

    public SliceProcessingException(String sliceId, String message) {
        super(message);
        this.sliceId = sliceId;
    }

    public SliceProcessingException(String sliceId, String message, Throwable cause) {
        super(message, cause);
        this.sliceId = sliceId;
    }

    public String getSliceId() {
        return sliceId;
    }
}
