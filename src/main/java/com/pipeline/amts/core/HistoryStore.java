package com.pipeline.amts.core;

import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.SliceDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 切片历史存储接口：位移记录的最终依据。
 *
 * 每个切片一份只追加的历史，时间戳严格递增。
 * 被离群检测剔除的记录另存一份 rejected 记录，便于核查。
 * 除全量重建外不重写已有历史；写入失败时已提交的内容保持不变。
 */
public interface HistoryStore {

    /**
     * 追加一批记录。
     *
     * @param definition 切片定义
     * @param accepted   通过检测的记录，按时间升序
     * @param rejected   被剔除的记录，按时间升序
     * @throws com.pipeline.amts.exception.HistoryWriteException 写入失败或时间戳不递增
     */
    void append(SliceDefinition definition, List<DeltaRecord> accepted, List<DeltaRecord> rejected);

    /**
     * 以新内容整体替换切片历史（全量重建）。替换是原子的。
     *
     * @param definition 切片定义
     * @param accepted   通过检测的记录
     * @param rejected   被剔除的记录
     * @throws com.pipeline.amts.exception.HistoryWriteException 写入失败
     */
    void replace(SliceDefinition definition, List<DeltaRecord> accepted, List<DeltaRecord> rejected);

    /**
     * 最后写入的记录时间戳，包括被剔除的记录。
     *
     * @param definition 切片定义
     * @return 最后时间戳；历史为空时为空
     */
    Optional<Instant> lastTimestamp(SliceDefinition definition);

    /**
     * 读取时间窗口内的历史记录（闭区间，null表示不限）。
     */
    List<DeltaRecord> read(SliceDefinition definition, Instant from, Instant to);

    /**
     * 读取时间窗口内被剔除的记录（闭区间，null表示不限）。
     */
    List<DeltaRecord> readRejected(SliceDefinition definition, Instant from, Instant to);
}
