package com.pipeline.amts.model;

/**
 * 切片处理模式
 */
public enum ProcessingMode {
    /** 仅追加上次处理时间点之后的新数据 */
    INCREMENTAL,
    /** 丢弃已有输出，从起始时间重算全部历史 */
    FULL
}
