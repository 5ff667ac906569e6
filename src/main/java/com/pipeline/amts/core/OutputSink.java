package com.pipeline.amts.core;

import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.SliceDefinition;

import java.util.List;

/**
 * 输出下游接口（报表、数据记录库、消息推送等）。
 *
 * 在历史成功写入之后调用。下游失败只记录日志，
 * 不回滚已提交的历史。
 */
public interface OutputSink extends AutoCloseable {

    /**
     * @return 下游名称，用于日志
     */
    String name();

    /**
     * 接收本次新写入历史的记录。
     *
     * @param definition 切片定义
     * @param records    本次写入的记录，按时间升序；全量模式下为完整历史
     * @param mode       处理模式
     * @throws Exception 任何失败均由调用方记录
     */
    void accept(SliceDefinition definition, List<DeltaRecord> records, ProcessingMode mode) throws Exception;

    @Override
    default void close() {}
}
