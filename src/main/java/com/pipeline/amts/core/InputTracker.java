package com.pipeline.amts.core;

import com.pipeline.amts.model.SliceDefinition;

/**
 * 原始输入跟踪：返回切片匹配文件的最大修改时间，作为独立于配置摘要的变化信号。
 */
@FunctionalInterface
public interface InputTracker {

    /**
     * @param definition 切片定义
     * @return 匹配文件的最大修改时间（毫秒）；没有匹配文件时返回0
     */
    long latestModified(SliceDefinition definition);
}
