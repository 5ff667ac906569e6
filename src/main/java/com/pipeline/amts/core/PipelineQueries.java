package com.pipeline.amts.core;

import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.RowError;
import com.pipeline.amts.model.SliceDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 只读查询接口，供外部请求层使用。
 * 返回的都是快照，读取永远不会触发处理。
 */
public interface PipelineQueries {

    /** 当前活跃的切片定义 */
    List<SliceDefinition> activeDefinitions();

    /** 最近一次加载时被拒绝的配置行 */
    List<RowError> rowErrors();

    /**
     * 切片在时间窗口内的位移历史（闭区间，null表示不限）。
     *
     * @throws IllegalArgumentException 切片不存在或未激活
     */
    List<DeltaRecord> readDeltas(String sliceId, Instant from, Instant to);

    /**
     * 切片在时间窗口内被剔除的记录。
     *
     * @throws IllegalArgumentException 切片不存在或未激活
     */
    List<DeltaRecord> readRejected(String sliceId, Instant from, Instant to);

    /** 缓存条目快照（含孤立条目） */
    Map<String, CacheEntry> cacheEntries();

    /** 缓存中存在但配置中已没有的切片 */
    Set<String> orphanedSlices();

    /**
     * 日志文件最后若干行。
     *
     * @param lines 行数
     * @return 日志行；日志文件不存在时为空列表
     */
    List<String> tailLog(int lines);
}
