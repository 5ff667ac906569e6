package com.pipeline.amts.model;

/**
 * 切片最近一次处理的结果状态
 */
public enum RunStatus {
    /** 处理成功（包括没有新数据的情况） */
    OK,
    /** 没有匹配到原始文件，属于正常的静默切片 */
    NO_INPUT,
    /** 处理失败，下个检测周期重试 */
    ERROR
}
