package com.pipeline.amts.model;

/**
 * 外部控制命令。进入调度器的命令队列后异步执行。
 */
public enum Command {
    /** 对全部活跃切片做一次增量处理后退出 */
    RUN_ONCE,
    /** 清空缓存，全部活跃切片按全量模式重算 */
    FULL_BUILD,
    /** 立即重新加载配置并评估差异 */
    RELOAD_SETTINGS,
    /** 完成正在处理的切片后退出，丢弃尚未开始的工作项 */
    STOP
}
