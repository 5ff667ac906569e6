package com.pipeline.amts.exception;

import java.io.IOException;

/**
 * 历史文件写入失败。已提交的历史保持不变。
 */
public class HistoryWriteException extends SliceProcessingException {

    public HistoryWriteException(String sliceId, String message, IOException cause) {
        super(sliceId, message, cause);
    }

    public HistoryWriteException(String sliceId, String message) {
        super(sliceId, message);
    }
}
