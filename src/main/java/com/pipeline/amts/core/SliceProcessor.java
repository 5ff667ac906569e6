package com.pipeline.amts.core;

import com.pipeline.amts.model.CacheEntry;
import com.pipeline.amts.model.ProcessResult;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.SliceDefinition;

/**
 * 切片处理器接口：单个切片的端到端执行：
 *   定位原始文件 → 解析 → 截取新数据 → 离群检测 → 计算位移 → 写入历史 → 通知下游
 *
 * 实现约定：
 * - 不抛出异常，所有失败都体现在返回结果中
 * - 不修改缓存，缓存提交由调度器根据结果完成
 * - 不同切片之间没有共享的可变状态，可以并发调用
 */
public interface SliceProcessor {

    /**
     * 处理一个切片。
     *
     * @param definition 切片定义
     * @param entry      上次处理的缓存条目，不存在时为null
     * @param mode       处理模式
     * @return 处理结果
     */
    ProcessResult process(SliceDefinition definition, CacheEntry entry, ProcessingMode mode);
}
