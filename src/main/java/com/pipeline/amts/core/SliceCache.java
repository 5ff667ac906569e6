package com.pipeline.amts.core;

import com.pipeline.amts.model.CacheDiff;
import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.Fingerprint;
import com.pipeline.amts.model.RunStatus;
import com.pipeline.amts.model.SliceDefinition;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 切片缓存接口："切片定义或输入是否在上次处理后发生变化" 的判断依据。
 *
 * 持久化 sliceId → CacheEntry 映射。实现约定：
 * - 持久化文件缺失或损坏时按空缓存处理，所有切片都视为变化，绝不因此跳过切片
 * - commit 必须整体重写或原子替换持久化文件，进程中断不得损坏其它条目
 * - commit 与 clear 串行执行（单写者）
 * - 配置中已消失的切片条目保留为孤立条目，只有 clear 才会删除
 */
public interface SliceCache {

    /**
     * 计算切片定义摘要。纯函数，相同字段值必然得到相同摘要。
     *
     * @param definition 切片定义
     * @return 定义摘要
     */
    Fingerprint fingerprintOf(SliceDefinition definition);

    /**
     * 获取切片的缓存条目。
     *
     * @param sliceId 切片标识
     * @return 缓存条目副本；不存在时为空
     */
    Optional<CacheEntry> get(String sliceId);

    /**
     * 将当前配置与缓存比对。
     * 缓存中不存在、摘要不同（或开启原始输入检测时输入文件更新）的切片记为changed。
     *
     * @param definitions 当前活跃切片定义
     * @return 比对结果
     */
    CacheDiff diff(Collection<SliceDefinition> definitions);

    /**
     * 原子更新一个切片的缓存条目并持久化。
     *
     * @param sliceId             切片标识
     * @param fingerprint         需要记录的定义摘要（失败时传入原有摘要）
     * @param epoch               已处理到的数据时间点
     * @param inputModifiedMillis 输入文件最大修改时间
     * @param status              处理状态
     * @param error               错误信息，可为null
     */
    void commit(String sliceId, Fingerprint fingerprint, Instant epoch, long inputModifiedMillis,
                RunStatus status, String error);

    /**
     * 清空全部条目（仅用于全量重建）。
     */
    void clear();

    /**
     * 当前全部条目的只读快照（含孤立条目）。
     *
     * @return sliceId → 缓存条目副本
     */
    Map<String, CacheEntry> snapshot();
}
